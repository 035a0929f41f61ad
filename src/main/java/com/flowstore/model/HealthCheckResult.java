package com.flowstore.model;

import java.util.List;

/**
 * Result of an on-demand health check, including a stats snapshot.
 */
public final class HealthCheckResult {

    private final boolean healthy;
    private final long timestamp;
    private final boolean testPassed;
    private final List<String> issues;
    private final EngineStats stats;

    public HealthCheckResult(boolean healthy, long timestamp, boolean testPassed, List<String> issues,
                             EngineStats stats) {
        this.healthy = healthy;
        this.timestamp = timestamp;
        this.testPassed = testPassed;
        this.issues = List.copyOf(issues);
        this.stats = stats;
    }

    public boolean isHealthy() {
        return healthy;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public boolean isTestPassed() {
        return testPassed;
    }

    public List<String> getIssues() {
        return issues;
    }

    public EngineStats getStats() {
        return stats;
    }
}
