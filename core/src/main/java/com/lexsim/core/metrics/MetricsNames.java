package com.lexsim.core.metrics;

/**
 * Micrometer metric names used by the coordinator.
 * <p>
 * <b>Naming convention:</b> {@code lexsim.cluster.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Counter: Messages enqueued on the channel.
     * <p>
     * Tags: type (payload type)
     * </p>
     */
    public static final String MESSAGES_SENT_TOTAL = "lexsim.cluster.messages.sent.total";

    /**
     * Counter: Messages received by the coordinator node.
     */
    public static final String MESSAGES_RECEIVED_TOTAL = "lexsim.cluster.messages.received.total";

    /**
     * Counter: Rebalance checks.
     * <p>
     * Tags: outcome (planned/balanced)
     * </p>
     */
    public static final String REBALANCE_CHECKS_TOTAL = "lexsim.cluster.rebalance.checks.total";

    /**
     * Counter: Moves emitted across all rebalance plans.
     */
    public static final String REBALANCE_MOVES_TOTAL = "lexsim.cluster.rebalance.moves.total";

    /**
     * Counter: Entities handed to the partition manager.
     */
    public static final String ENTITIES_DISTRIBUTED_TOTAL = "lexsim.cluster.entities.distributed.total";

    /**
     * Gauge: Number of nodes in the cluster.
     */
    public static final String NODES = "lexsim.cluster.nodes";

    /**
     * Gauge: Messages currently waiting on the channel.
     */
    public static final String CHANNEL_DEPTH = "lexsim.cluster.channel.depth";
}
