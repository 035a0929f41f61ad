package com.flowstore.resource;

import java.util.Objects;

/**
 * Snapshot of the environment the engine is running in.
 */
public final class ResourceState {

    private static final ResourceState HEALTHY = new ResourceState(0.0, NetworkQuality.GOOD, false);

    private final double memoryPressure;
    private final NetworkQuality networkQuality;
    private final boolean batteryConstrained;

    /**
     * @param memoryPressure     fraction of the memory budget in use, 0.0 to 1.0
     * @param networkQuality     current link quality
     * @param batteryConstrained true when running on low or discharging battery
     */
    public ResourceState(double memoryPressure, NetworkQuality networkQuality, boolean batteryConstrained) {
        if (Double.isNaN(memoryPressure) || memoryPressure < 0) {
            throw new IllegalArgumentException("memoryPressure must be non-negative, got: " + memoryPressure);
        }
        this.memoryPressure = memoryPressure;
        this.networkQuality = Objects.requireNonNull(networkQuality, "networkQuality");
        this.batteryConstrained = batteryConstrained;
    }

    public static ResourceState healthy() {
        return HEALTHY;
    }

    public double getMemoryPressure() {
        return memoryPressure;
    }

    public NetworkQuality getNetworkQuality() {
        return networkQuality;
    }

    public boolean isBatteryConstrained() {
        return batteryConstrained;
    }

    public ResourceState withMemoryPressure(double pressure) {
        return new ResourceState(pressure, networkQuality, batteryConstrained);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResourceState that = (ResourceState) o;
        return Double.compare(that.memoryPressure, memoryPressure) == 0 &&
               batteryConstrained == that.batteryConstrained &&
               networkQuality == that.networkQuality;
    }

    @Override
    public int hashCode() {
        return Objects.hash(memoryPressure, networkQuality, batteryConstrained);
    }

    @Override
    public String toString() {
        return String.format("ResourceState{memoryPressure=%.2f, network=%s, batteryConstrained=%s}",
            memoryPressure, networkQuality, batteryConstrained);
    }
}
