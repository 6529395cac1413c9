package com.lexsim.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    /**
     * Tag key for payload type.
     */
    public static final String TYPE = "type";

    /**
     * Tag key for the result of a rebalance check (planned/balanced).
     */
    public static final String OUTCOME = "outcome";
}
