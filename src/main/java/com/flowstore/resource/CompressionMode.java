package com.flowstore.resource;

/**
 * How hard the codec should work to shrink payloads.
 */
public enum CompressionMode {

    /** Pick the algorithm from payload size alone. */
    ADAPTIVE,

    /** Use at least run-length encoding, even for small payloads. */
    AGGRESSIVE,

    /** Always use LZ77. */
    MAXIMUM
}
