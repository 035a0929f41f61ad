package com.flowstore.health;

import com.flowstore.resource.ResourceGovernor;
import com.flowstore.util.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Checks that the engine can still store data and that its metrics are within
 * bounds. A failing check is reported, never thrown.
 */
public class HealthMonitor {

    private static final Logger logger = LoggerFactory.getLogger(HealthMonitor.class);

    public static final double MAX_ERROR_RATE = 0.1;
    public static final double MIN_HIT_RATE = 0.3;
    public static final long MIN_LOOKUPS_FOR_HIT_RATE = 100;
    public static final double MAX_MEMORY_USAGE = 0.9;

    /**
     * Write, read back and delete a probe value.
     */
    @FunctionalInterface
    public interface SelfTest {

        /**
         * @return true if the value read back equals the value written
         */
        boolean run() throws Exception;
    }

    private final MetricsCollector metrics;
    private final ResourceGovernor governor;
    private final LongSupplier memoryUsage;
    private final long memoryBudget;
    private final SelfTest selfTest;
    private final Clock clock;
    private volatile HealthReport lastReport;

    public HealthMonitor(MetricsCollector metrics, ResourceGovernor governor, LongSupplier memoryUsage,
                         long memoryBudget, SelfTest selfTest, Clock clock) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.governor = Objects.requireNonNull(governor, "governor");
        this.memoryUsage = Objects.requireNonNull(memoryUsage, "memoryUsage");
        this.memoryBudget = memoryBudget;
        this.selfTest = Objects.requireNonNull(selfTest, "selfTest");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Run the self-test and threshold checks.
     *
     * @return the report, also retained as {@link #getLastReport()}
     */
    public HealthReport runSelfTest() {
        List<String> issues = new ArrayList<>();

        boolean testPassed;
        try {
            testPassed = selfTest.run();
            if (!testPassed) {
                issues.add("Storage self-test returned mismatched data");
            }
        } catch (Exception e) {
            testPassed = false;
            issues.add("Storage self-test failed: " + e.getMessage());
            logger.warn("Health self-test failed", e);
        }

        double errorRate = metrics.getErrorRate();
        if (errorRate > MAX_ERROR_RATE) {
            issues.add(String.format("High error rate: %.1f%%", errorRate * 100));
        }

        if (metrics.getCacheLookups() > MIN_LOOKUPS_FOR_HIT_RATE && metrics.getHitRate() < MIN_HIT_RATE) {
            issues.add(String.format("Low cache hit rate: %.1f%%", metrics.getHitRate() * 100));
        }

        double memoryRatio = (double) memoryUsage.getAsLong() / memoryBudget;
        if (memoryRatio > MAX_MEMORY_USAGE) {
            issues.add(String.format("High memory usage: %.1f%%", memoryRatio * 100));
            governor.enterLowMemoryMode();
        }

        HealthReport report = new HealthReport(issues.isEmpty(), testPassed, issues, clock.millis());
        if (report.isHealthy()) {
            logger.debug("Health check passed");
        } else {
            logger.warn("Health check found issues: {}", issues);
        }
        lastReport = report;
        return report;
    }

    /**
     * @return the most recent report, or null if no check has run yet
     */
    public HealthReport getLastReport() {
        return lastReport;
    }
}
