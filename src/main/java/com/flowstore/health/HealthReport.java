package com.flowstore.health;

import java.util.List;

/**
 * Outcome of one health check.
 */
public final class HealthReport {

    private final boolean healthy;
    private final boolean testPassed;
    private final List<String> issues;
    private final long timestamp;

    public HealthReport(boolean healthy, boolean testPassed, List<String> issues, long timestamp) {
        this.healthy = healthy;
        this.testPassed = testPassed;
        this.issues = List.copyOf(issues);
        this.timestamp = timestamp;
    }

    public boolean isHealthy() {
        return healthy;
    }

    /**
     * True when the write/read/delete round trip succeeded.
     */
    public boolean isTestPassed() {
        return testPassed;
    }

    public List<String> getIssues() {
        return issues;
    }

    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "HealthReport{" +
               "healthy=" + healthy +
               ", testPassed=" + testPassed +
               ", issues=" + issues +
               ", timestamp=" + timestamp +
               '}';
    }
}
