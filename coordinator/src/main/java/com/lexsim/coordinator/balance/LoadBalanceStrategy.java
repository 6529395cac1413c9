package com.lexsim.coordinator.balance;

/**
 * When the load balancer considers the cluster imbalanced.
 */
public enum LoadBalanceStrategy {
    /**
     * Never rebalance.
     */
    NONE,

    /**
     * Always rebalance; the caller decides when to ask.
     */
    PERIODIC,

    /**
     * Rebalance when the busiest node is above the load threshold.
     */
    DYNAMIC,

    /**
     * Rebalance when the spread between busiest and idlest node exceeds the minimum imbalance.
     */
    WORK_STEALING
}
