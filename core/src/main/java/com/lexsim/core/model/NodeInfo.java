package com.lexsim.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable snapshot of a worker node tracked by the coordinator.
 * <p>
 * Contains identity, rank, and the dynamic fields (load, entity count, status).
 * The registry replaces snapshots instead of mutating them, so a snapshot handed
 * to a caller never changes underneath it.
 * </p>
 * <p>
 * <b>Invariant:</b> {@code load} is only ever derived from {@code entityCount} through
 * {@link #withRecomputedLoad(int)}.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class NodeInfo {
    /**
     * Small integer identity, stable for the lifetime of the coordinator.
     */
    int id;

    /**
     * Opaque address (e.g., {@code node-3}).
     */
    String address;

    /**
     * Rank in the cluster. Rank 0 is the designated coordinator node.
     */
    int rank;

    /**
     * Cluster size at creation time.
     */
    int totalNodes;

    /**
     * Current load, 0.0 (idle) to 1.0 (fully loaded).
     */
    double load;

    /**
     * Number of entities assigned to this node.
     */
    int entityCount;

    NodeStatus status;

    /**
     * Creates a fresh idle node with zero load and no entities.
     */
    public static NodeInfo create(int id, String address, int rank, int totalNodes) {
        return NodeInfo.builder()
            .id(id)
            .address(address)
            .rank(rank)
            .totalNodes(totalNodes)
            .load(0.0)
            .entityCount(0)
            .status(NodeStatus.IDLE)
            .build();
    }

    /**
     * Whether this node holds the coordinator rank. A naming convenience; there is
     * exactly one coordinator by construction and it is never elected.
     */
    public boolean isCoordinator() {
        return rank == 0;
    }

    /**
     * Returns a snapshot whose load is {@code min(1.0, entityCount / maxEntitiesPerNode)}.
     * Leaves the load unchanged when {@code maxEntitiesPerNode <= 0}.
     *
     * @param maxEntitiesPerNode Capacity that corresponds to a load of 1.0
     * @return Recomputed snapshot (may be {@code this})
     */
    public NodeInfo withRecomputedLoad(int maxEntitiesPerNode) {
        if (maxEntitiesPerNode <= 0) {
            return this;
        }
        double recomputed = Math.min(1.0, (double) entityCount / (double) maxEntitiesPerNode);
        return toBuilder().load(recomputed).build();
    }

    public NodeInfo withEntityCount(int entityCount) {
        return toBuilder().entityCount(entityCount).build();
    }

    public NodeInfo withStatus(NodeStatus status) {
        return toBuilder().status(status).build();
    }
}
