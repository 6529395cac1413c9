package com.lexsim.coordinator.cluster;

import com.lexsim.core.model.NodeInfo;
import com.lexsim.core.model.NodeStatus;
import com.lexsim.core.model.RebalanceMove;
import com.lexsim.core.msg.Message;
import com.lexsim.core.msg.Payload;

import java.util.List;
import java.util.Optional;

/**
 * Operations exposed to simulation and verification drivers.
 */
public interface IClusterCoordinator {

    /**
     * Partitions the entities over all nodes and updates node counts and loads.
     */
    void distributeEntities(List<String> entityIds);

    /**
     * Sends from the coordinator node.
     *
     * @param destination Target node, or {@code null} to broadcast
     * @return The message ID
     */
    long sendMessage(Integer destination, Payload payload);

    /**
     * Receives on behalf of the coordinator node. Never blocks.
     */
    Optional<Message> receiveMessage();

    /**
     * Broadcasts a barrier signal. Does not wait for acknowledgements.
     *
     * @return The message ID
     */
    long barrier();

    /**
     * Returns the advisory move plan, empty when the cluster is balanced.
     */
    List<RebalanceMove> rebalanceIfNeeded();

    void updateNodeStatus(int nodeId, NodeStatus status);

    Optional<NodeInfo> getNode(int nodeId);

    List<NodeInfo> nodes();

    int numNodes();
}
