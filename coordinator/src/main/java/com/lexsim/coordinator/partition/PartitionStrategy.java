package com.lexsim.coordinator.partition;

/**
 * How entity IDs are spread over node-indexed partitions.
 */
public enum PartitionStrategy {
    /**
     * Entity at input index {@code i} goes to partition {@code i mod N}.
     */
    ROUND_ROBIN,

    /**
     * Partition is {@code polynomial31(entityId) mod N}; stable across manager instances.
     */
    HASH,

    /**
     * Contiguous blocks of {@code ceil(total / N)}; the last partition absorbs the remainder.
     */
    RANGE,

    /**
     * Placeholder for load-aware placement. Currently behaves as {@link #ROUND_ROBIN}.
     */
    LOAD_BALANCED,

    /**
     * Placeholder for location-aware placement. Currently behaves as {@link #ROUND_ROBIN}.
     */
    GEOGRAPHIC
}
