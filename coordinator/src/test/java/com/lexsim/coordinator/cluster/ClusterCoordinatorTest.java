package com.lexsim.coordinator.cluster;

import com.lexsim.coordinator.balance.LoadBalanceStrategy;
import com.lexsim.coordinator.config.CoordinatorConfig;
import com.lexsim.coordinator.partition.PartitionStrategy;
import com.lexsim.core.error.InvalidParameterException;
import com.lexsim.core.error.NodeNotFoundException;
import com.lexsim.core.metrics.MetricsNames;
import com.lexsim.core.metrics.MetricsTags;
import com.lexsim.core.model.AssignmentVersion;
import com.lexsim.core.model.NodeInfo;
import com.lexsim.core.model.NodeStatus;
import com.lexsim.core.model.RebalanceMove;
import com.lexsim.core.msg.Message;
import com.lexsim.core.msg.Payload;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end scenarios against a single in-process coordinator.
 */
class ClusterCoordinatorTest {

    @Test
    void testCreate_NodesStartIdle() {
        ClusterCoordinator coordinator = new ClusterCoordinator(4, PartitionStrategy.ROUND_ROBIN, LoadBalanceStrategy.NONE);

        assertEquals(4, coordinator.numNodes());
        assertEquals(0, coordinator.coordinatorNode().getId());
        assertTrue(coordinator.coordinatorNode().isCoordinator());
        for (NodeInfo node : coordinator.nodes()) {
            assertEquals(NodeStatus.IDLE, node.getStatus());
            assertEquals(0.0, node.getLoad());
            assertEquals("node-" + node.getId(), node.getAddress());
        }
        assertTrue(coordinator.assignmentVersion().isEmpty());
    }

    @Test
    void testCreate_ZeroNodesRejected() {
        assertThrows(InvalidParameterException.class,
            () -> new ClusterCoordinator(0, PartitionStrategy.ROUND_ROBIN, LoadBalanceStrategy.NONE));
    }

    @Test
    void testDistribute_RoundRobinFillsEveryNode() {
        ClusterCoordinator coordinator = new ClusterCoordinator(3, PartitionStrategy.ROUND_ROBIN, LoadBalanceStrategy.NONE);

        coordinator.distributeEntities(entities(12));

        for (NodeInfo node : coordinator.nodes()) {
            assertEquals(4, node.getEntityCount());
            assertEquals(1.0, node.getLoad());
        }
        assertEquals(3, coordinator.partitions().size());
        assertTrue(coordinator.rebalanceIfNeeded().isEmpty());
    }

    @Test
    void testDistribute_FewerEntitiesThanNodesKeepsLoadsAtZero() {
        ClusterCoordinator coordinator = new ClusterCoordinator(4, PartitionStrategy.ROUND_ROBIN, LoadBalanceStrategy.NONE);

        coordinator.distributeEntities(entities(2));

        int total = 0;
        for (NodeInfo node : coordinator.nodes()) {
            assertEquals(0.0, node.getLoad());
            total += node.getEntityCount();
        }
        assertEquals(2, total);
    }

    @Test
    void testDistribute_HashKeepsLoadsInRange() {
        ClusterCoordinator coordinator = new ClusterCoordinator(3, PartitionStrategy.HASH, LoadBalanceStrategy.NONE);

        coordinator.distributeEntities(entities(10));

        int total = 0;
        for (NodeInfo node : coordinator.nodes()) {
            assertTrue(node.getLoad() >= 0.0 && node.getLoad() <= 1.0, "load " + node.getLoad());
            total += node.getEntityCount();
        }
        assertEquals(10, total);
    }

    @Test
    void testDynamic_EquallySaturatedNodesProduceNoPlan() {
        ClusterCoordinator coordinator = new ClusterCoordinator(3, PartitionStrategy.ROUND_ROBIN, LoadBalanceStrategy.DYNAMIC);
        coordinator.distributeEntities(entities(12));

        assertTrue(coordinator.rebalanceIfNeeded().isEmpty());
        assertEquals(0, coordinator.pendingMessages());
    }

    @Test
    void testDynamic_BelowThresholdProducesNoPlan() {
        ClusterCoordinator coordinator = new ClusterCoordinator(3, PartitionStrategy.ROUND_ROBIN, LoadBalanceStrategy.DYNAMIC);
        coordinator.distributeEntities(entities(12));
        coordinator.updateNodeEntityCount(0, 3);
        coordinator.updateNodeEntityCount(1, 2);
        coordinator.updateNodeEntityCount(2, 1);

        assertEquals(0.75, coordinator.getNode(0).orElseThrow().getLoad());
        assertTrue(coordinator.rebalanceIfNeeded().isEmpty());
    }

    @Test
    void testWorkStealing_CallerExecutesPlan() {
        SimpleMeterRegistry meters = new SimpleMeterRegistry();
        ClusterCoordinator coordinator = new ClusterCoordinator(
            CoordinatorConfig.builder()
                .numNodes(3)
                .loadBalanceStrategy(LoadBalanceStrategy.WORK_STEALING)
                .build(),
            meters);
        coordinator.distributeEntities(entities(6));
        coordinator.updateNodeEntityCount(2, 0);

        List<RebalanceMove> moves = coordinator.rebalanceIfNeeded();

        assertEquals(List.of(new RebalanceMove(0, 0, 2), new RebalanceMove(1, 1, 2)), moves);
        // Plans are advisory: ownership is unchanged until the caller acts
        assertEquals(0, coordinator.partitions().get(0).getNodeId());

        for (RebalanceMove move : moves) {
            coordinator.reassignPartition(move.partitionId(), move.toNode());
        }
        coordinator.updateNodeEntityCount(0, 0);
        coordinator.updateNodeEntityCount(1, 0);
        coordinator.updateNodeEntityCount(2, 4);

        assertEquals(2, coordinator.partitionManager().getNodePartitions(2).size());
        assertEquals(1.0, coordinator.getNode(2).orElseThrow().getLoad());

        Message announcement = coordinator.receiveMessage().orElseThrow();
        assertEquals(Payload.Type.LOAD_BALANCE, announcement.getPayload().type());
        assertTrue(announcement.isBroadcast());

        assertEquals(1.0, meters.get(MetricsNames.REBALANCE_CHECKS_TOTAL)
            .tag(MetricsTags.OUTCOME, "planned").counter().count());
        assertEquals(2.0, meters.get(MetricsNames.REBALANCE_MOVES_TOTAL).counter().count());
        assertEquals(1.0, meters.get(MetricsNames.MESSAGES_RECEIVED_TOTAL).counter().count());
    }

    @Test
    void testMessaging_BarrierAndDirectSends() {
        SimpleMeterRegistry meters = new SimpleMeterRegistry();
        ClusterCoordinator coordinator = new ClusterCoordinator(CoordinatorConfig.builder().numNodes(3).build(), meters);

        assertEquals(0L, coordinator.barrier());
        assertEquals(1, coordinator.pendingMessages());
        assertEquals(1L, coordinator.sendMessage(2, Payload.custom("hello")));
        assertEquals(2, coordinator.pendingMessages());

        // Node 0 sees the broadcast but not the message addressed to node 2
        Message barrier = coordinator.receiveMessage().orElseThrow();
        assertEquals(Payload.Type.BARRIER, barrier.getPayload().type());
        assertEquals(0, barrier.getSource());
        assertEquals(Optional.empty(), coordinator.receiveMessage());
        assertEquals(1, coordinator.pendingMessages());

        assertEquals(1.0, meters.get(MetricsNames.MESSAGES_SENT_TOTAL)
            .tag(MetricsTags.TYPE, "barrier").counter().count());
        assertEquals(1.0, meters.get(MetricsNames.MESSAGES_SENT_TOTAL)
            .tag(MetricsTags.TYPE, "custom").counter().count());
        assertEquals(1.0, meters.get(MetricsNames.CHANNEL_DEPTH).gauge().value());
        assertEquals(3.0, meters.get(MetricsNames.NODES).gauge().value());
    }

    @Test
    void testUpdateNodeStatus() {
        ClusterCoordinator coordinator = new ClusterCoordinator(3, PartitionStrategy.ROUND_ROBIN, LoadBalanceStrategy.NONE);

        coordinator.updateNodeStatus(1, NodeStatus.FAILED);

        assertEquals(NodeStatus.FAILED, coordinator.getNode(1).orElseThrow().getStatus());
        assertThrows(NodeNotFoundException.class, () -> coordinator.updateNodeStatus(99, NodeStatus.ACTIVE));
        assertTrue(coordinator.getNode(99).isEmpty());
    }

    @Test
    void testUpdateNodeEntityCount_RejectsNegative() {
        ClusterCoordinator coordinator = new ClusterCoordinator(2, PartitionStrategy.ROUND_ROBIN, LoadBalanceStrategy.NONE);

        assertThrows(InvalidParameterException.class, () -> coordinator.updateNodeEntityCount(0, -1));
        assertThrows(NodeNotFoundException.class, () -> coordinator.updateNodeEntityCount(2, 1));
    }

    @Test
    void testAssignmentVersion_IncrementsAndHashesLayout() {
        ClusterCoordinator first = new ClusterCoordinator(3, PartitionStrategy.ROUND_ROBIN, LoadBalanceStrategy.NONE);
        ClusterCoordinator second = new ClusterCoordinator(3, PartitionStrategy.ROUND_ROBIN, LoadBalanceStrategy.NONE);

        first.distributeEntities(entities(6));
        second.distributeEntities(entities(6));
        AssignmentVersion v1 = first.assignmentVersion().orElseThrow();

        assertEquals(1L, v1.getVersion());
        assertTrue(v1.sameLayoutAs(second.assignmentVersion().orElseThrow()));
        assertEquals(16, v1.getVersionHash().length());

        first.distributeEntities(List.of("late-0"));
        AssignmentVersion v2 = first.assignmentVersion().orElseThrow();

        assertEquals(2L, v2.getVersion());
        assertFalse(v2.sameLayoutAs(v1));
    }

    @Test
    void testReassignPartition_RejectsUnknownTargetNode() {
        ClusterCoordinator coordinator = new ClusterCoordinator(3, PartitionStrategy.ROUND_ROBIN, LoadBalanceStrategy.NONE);
        coordinator.distributeEntities(entities(6));

        NodeNotFoundException error = assertThrows(NodeNotFoundException.class,
            () -> coordinator.reassignPartition(0, 3));
        assertEquals(3, error.getNodeId());
        assertThrows(NodeNotFoundException.class, () -> coordinator.reassignPartition(0, -1));
        assertEquals(0, coordinator.partitions().get(0).getNodeId());

        assertEquals(2, coordinator.reassignPartition(0, 2).orElseThrow().getNodeId());
        assertTrue(coordinator.reassignPartition(99, 1).isEmpty());
    }

    @Test
    void testClock_StampsMessagesAndVersions() {
        Instant now = Instant.parse("2024-05-01T10:15:30Z");
        ClusterCoordinator coordinator = new ClusterCoordinator(
            CoordinatorConfig.builder().numNodes(2).build(),
            new SimpleMeterRegistry(),
            Clock.fixed(now, ZoneOffset.UTC));

        coordinator.distributeEntities(entities(4));
        coordinator.barrier();

        assertEquals(now, coordinator.assignmentVersion().orElseThrow().getIssuedAt());
        assertEquals(now.getEpochSecond(), coordinator.receiveMessage().orElseThrow().getTimestamp());
    }

    @Test
    void testWorkStealing_NanMinImbalanceRejected() {
        CoordinatorConfig config = CoordinatorConfig.builder()
            .numNodes(3)
            .loadBalanceStrategy(LoadBalanceStrategy.WORK_STEALING)
            .minImbalance(Double.NaN)
            .build();

        assertThrows(InvalidParameterException.class, () -> new ClusterCoordinator(config));
    }

    @Test
    void testUpdateNodeEntityCount_AfterSparseDistributionKeepsCapacity() {
        ClusterCoordinator coordinator = new ClusterCoordinator(3, PartitionStrategy.ROUND_ROBIN, LoadBalanceStrategy.NONE);
        coordinator.distributeEntities(entities(6));
        coordinator.distributeEntities(entities(1));

        NodeInfo updated = coordinator.updateNodeEntityCount(1, 1);

        assertEquals(0.5, updated.getLoad());
    }

    private static List<String> entities(int count) {
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            ids.add("entity-" + i);
        }
        return ids;
    }
}
