package com.flowstore.resource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Turns environment samples into tuning policy for the cache and codec.
 *
 * Low-memory mode uses hysteresis: it is entered above {@link #LOW_MEMORY_ENTER}
 * pressure and left only once pressure drops below {@link #LOW_MEMORY_EXIT}.
 * The governor is advisory; nothing ever waits on it.
 */
public class ResourceGovernor {

    private static final Logger logger = LoggerFactory.getLogger(ResourceGovernor.class);

    public static final double LOW_MEMORY_ENTER = 0.8;
    public static final double LOW_MEMORY_EXIT = 0.6;

    private final EnvironmentProbe probe;
    private final LongSupplier memoryUsage;
    private final long memoryBudget;
    private volatile ResourceState state;
    private volatile ResourcePolicy policy;
    private boolean lowMemoryMode;

    /**
     * @param probe        external telemetry source
     * @param memoryUsage  supplier of the engine's own memory usage in bytes
     * @param memoryBudget the configured maximum memory size in bytes
     */
    public ResourceGovernor(EnvironmentProbe probe, LongSupplier memoryUsage, long memoryBudget) {
        if (memoryBudget <= 0) {
            throw new IllegalArgumentException("memoryBudget must be positive, got: " + memoryBudget);
        }
        this.probe = Objects.requireNonNull(probe, "probe");
        this.memoryUsage = Objects.requireNonNull(memoryUsage, "memoryUsage");
        this.memoryBudget = memoryBudget;
        this.state = ResourceState.healthy();
        this.policy = ResourcePolicy.standard();
    }

    /**
     * Sample the environment. Memory pressure is the higher of what the probe
     * reports and the engine's own usage against its budget.
     *
     * @return the sampled state
     */
    public ResourceState sampleEnvironment() {
        ResourceState sampled;
        try {
            sampled = probe.sample();
        } catch (RuntimeException e) {
            logger.warn("Environment probe failed, assuming healthy environment: {}", e.getMessage());
            sampled = ResourceState.healthy();
        }
        if (sampled == null) {
            sampled = ResourceState.healthy();
        }
        double ownPressure = (double) memoryUsage.getAsLong() / memoryBudget;
        if (ownPressure > sampled.getMemoryPressure()) {
            sampled = sampled.withMemoryPressure(ownPressure);
        }
        return sampled;
    }

    /**
     * Derive and publish a policy for the given state.
     *
     * @param newState the environment state
     * @return the published policy
     */
    public synchronized ResourcePolicy applyPolicy(ResourceState newState) {
        Objects.requireNonNull(newState, "newState");
        double pressure = newState.getMemoryPressure();
        if (!lowMemoryMode && pressure > LOW_MEMORY_ENTER) {
            lowMemoryMode = true;
            logger.info("Low memory mode enabled (pressure={})", String.format("%.2f", pressure));
        } else if (lowMemoryMode && pressure < LOW_MEMORY_EXIT) {
            lowMemoryMode = false;
            logger.info("Low memory mode disabled (pressure={})", String.format("%.2f", pressure));
        }

        boolean battery = newState.isBatteryConstrained();
        NetworkQuality network = newState.getNetworkQuality();
        CompressionMode mode;
        switch (network) {
            case CONSTRAINED:
                mode = CompressionMode.MAXIMUM;
                break;
            case SLOW:
                mode = CompressionMode.AGGRESSIVE;
                break;
            default:
                mode = CompressionMode.ADAPTIVE;
        }

        ResourcePolicy next = new ResourcePolicy(
            lowMemoryMode ? ResourcePolicy.LOW_MEMORY_CACHE_FRACTION : ResourcePolicy.DEFAULT_CACHE_FRACTION,
            mode,
            lowMemoryMode || battery,
            battery ? ResourcePolicy.BATTERY_BATCH_SIZE : ResourcePolicy.DEFAULT_BATCH_SIZE,
            lowMemoryMode,
            battery,
            network);

        if (battery && !policy.isBatteryOptimized()) {
            logger.info("Battery optimization enabled");
        }
        if (mode != policy.getCompressionMode()) {
            logger.debug("Compression mode {} -> {} (network={})", policy.getCompressionMode(), mode, network);
        }
        this.state = newState;
        this.policy = next;
        return next;
    }

    /**
     * Sample the environment and apply the resulting policy.
     *
     * @return the published policy
     */
    public ResourcePolicy refresh() {
        return applyPolicy(sampleEnvironment());
    }

    /**
     * Force low-memory mode on until pressure falls below the exit threshold.
     * Used by the health monitor when it observes high usage between samples.
     */
    public void enterLowMemoryMode() {
        ResourceState current = state;
        applyPolicy(current.withMemoryPressure(Math.max(current.getMemoryPressure(), LOW_MEMORY_ENTER + 0.01)));
    }

    public ResourcePolicy currentPolicy() {
        return policy;
    }

    public ResourceState currentState() {
        return state;
    }
}
