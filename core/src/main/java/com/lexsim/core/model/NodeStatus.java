package com.lexsim.core.model;

/**
 * Lifecycle status of a worker node.
 * <p>
 * A {@link #FAILED} node is marked, never removed, so historical partition
 * ownership stays traceable.
 * </p>
 */
public enum NodeStatus {
    /**
     * Node is idle and ready for work.
     */
    IDLE,

    /**
     * Node is currently processing entities.
     */
    ACTIVE,

    /**
     * Node is waiting for data or a barrier.
     */
    WAITING,

    /**
     * Node has failed.
     */
    FAILED,

    /**
     * Node is recovering from a failure.
     */
    RECOVERING
}
