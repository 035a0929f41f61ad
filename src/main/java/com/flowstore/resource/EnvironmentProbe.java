package com.flowstore.resource;

/**
 * Source of platform telemetry. The embedding application samples whatever it
 * can observe (heap usage, connection type, battery) and hands it to the engine
 * through this interface.
 */
@FunctionalInterface
public interface EnvironmentProbe {

    ResourceState sample();

    /**
     * A probe that always reports a healthy environment.
     */
    static EnvironmentProbe healthy() {
        return ResourceState::healthy;
    }

    /**
     * A probe that always reports the given state.
     */
    static EnvironmentProbe fixed(ResourceState state) {
        return () -> state;
    }
}
