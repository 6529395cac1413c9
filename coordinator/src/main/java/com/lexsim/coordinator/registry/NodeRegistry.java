package com.lexsim.coordinator.registry;

import com.lexsim.core.error.NodeNotFoundException;
import com.lexsim.core.model.EntityPartition;
import com.lexsim.core.model.NodeInfo;
import com.lexsim.core.model.NodeStatus;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.IntFunction;

/**
 * Static and dynamic state of every node in the cluster.
 * <p>
 * Node IDs are the indices {@code 0..size-1} and rank equals ID, so rank 0 is the
 * coordinator node. Nodes are never removed; a failed node is only marked.
 * </p>
 * <p>
 * <b>Thread-safety:</b> all mutations are serialized on this instance. Readers get
 * immutable {@link NodeInfo} snapshots, never live references.
 * </p>
 */
public class NodeRegistry {
    private final List<NodeInfo> nodes;

    // Last positive capacity; reused when a caller reports new counts
    private int maxEntitiesPerNode;

    public NodeRegistry(int numNodes, IntFunction<String> addressFor) {
        List<NodeInfo> created = new ArrayList<>(numNodes);
        for (int i = 0; i < numNodes; i++) {
            created.add(NodeInfo.create(i, addressFor.apply(i), i, numNodes));
        }
        this.nodes = created;
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Adds each partition's size to its owner's entity count, then recomputes every node's load.
     *
     * @param partitions         Freshly created partitions
     * @param maxEntitiesPerNode Capacity that maps to load 1.0 (no load change when 0, and the
     *                           previously stored capacity is kept)
     */
    public synchronized void recordDistribution(Collection<EntityPartition> partitions, int maxEntitiesPerNode) {
        for (EntityPartition partition : partitions) {
            int owner = partition.getNodeId();
            if (owner >= 0 && owner < nodes.size()) {
                NodeInfo node = nodes.get(owner);
                nodes.set(owner, node.withEntityCount(node.getEntityCount() + partition.size()));
            }
        }
        if (maxEntitiesPerNode > 0) {
            this.maxEntitiesPerNode = maxEntitiesPerNode;
        }
        nodes.replaceAll(node -> node.withRecomputedLoad(maxEntitiesPerNode));
    }

    /**
     * Records a caller-reported entity count and recomputes that node's load.
     *
     * @throws NodeNotFoundException if the node does not exist
     */
    public synchronized NodeInfo updateEntityCount(int nodeId, int entityCount) {
        NodeInfo updated = require(nodeId).withEntityCount(entityCount).withRecomputedLoad(maxEntitiesPerNode);
        nodes.set(nodeId, updated);
        return updated;
    }

    /**
     * @throws NodeNotFoundException if the node does not exist
     */
    public synchronized NodeInfo updateStatus(int nodeId, NodeStatus status) {
        NodeInfo updated = require(nodeId).withStatus(status);
        nodes.set(nodeId, updated);
        return updated;
    }

    public synchronized Optional<NodeInfo> get(int nodeId) {
        if (nodeId < 0 || nodeId >= nodes.size()) {
            return Optional.empty();
        }
        return Optional.of(nodes.get(nodeId));
    }

    public synchronized List<NodeInfo> snapshot() {
        return List.copyOf(nodes);
    }

    public synchronized int getMaxEntitiesPerNode() {
        return maxEntitiesPerNode;
    }

    private NodeInfo require(int nodeId) {
        return get(nodeId).orElseThrow(() -> new NodeNotFoundException(nodeId));
    }
}
