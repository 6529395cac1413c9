package com.lexsim.coordinator.cluster;

import com.lexsim.coordinator.balance.LoadBalanceStrategy;
import com.lexsim.coordinator.balance.LoadBalancer;
import com.lexsim.coordinator.channel.IMessageChannel;
import com.lexsim.coordinator.channel.InMemoryMessageChannel;
import com.lexsim.coordinator.config.CoordinatorConfig;
import com.lexsim.coordinator.partition.PartitionManager;
import com.lexsim.coordinator.partition.PartitionStrategy;
import com.lexsim.coordinator.registry.NodeRegistry;
import com.lexsim.core.error.InvalidParameterException;
import com.lexsim.core.error.NodeNotFoundException;
import com.lexsim.core.hash.Hashers;
import com.lexsim.core.metrics.MetricsNames;
import com.lexsim.core.metrics.MetricsTags;
import com.lexsim.core.model.AssignmentVersion;
import com.lexsim.core.model.EntityPartition;
import com.lexsim.core.model.NodeInfo;
import com.lexsim.core.model.NodeStatus;
import com.lexsim.core.model.RebalanceMove;
import com.lexsim.core.msg.Message;
import com.lexsim.core.msg.Payload;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Orchestration facade over the node registry, partition manager, message channel
 * and load balancer.
 * <p>
 * <b>Lifecycle:</b> initialized, then distributing, then any number of steady/rebalancing
 * rounds driven by the caller. There is no terminal state.
 * </p>
 * <p>
 * <b>Moves are never executed here.</b> {@link #rebalanceIfNeeded()} reports what should
 * move; the caller moves entities (see {@link #reassignPartition(int, int)}) and
 * reports the new counts via {@link #updateNodeEntityCount(int, int)}.
 * </p>
 * <p>
 * <b>Thread-safety:</b> registry-mutating operations are serialized on this instance;
 * the channel has its own lock. Node snapshots returned to callers are immutable.
 * Each instance owns its collaborators exclusively; nothing is static.
 * </p>
 */
public class ClusterCoordinator implements IClusterCoordinator {
    private static final Logger log = LoggerFactory.getLogger(ClusterCoordinator.class);

    private final CoordinatorConfig config;
    private final NodeRegistry registry;
    private final PartitionManager partitionManager;
    private final IMessageChannel channel;
    private final LoadBalancer loadBalancer;
    private final int coordinatorNodeId;
    private final Clock clock;

    private final AtomicLong versionCounter = new AtomicLong(0);
    private volatile AssignmentVersion currentVersion;

    private final Map<Payload.Type, Counter> messagesSent = new EnumMap<>(Payload.Type.class);
    private final Counter messagesReceived;
    private final Counter rebalancePlanned;
    private final Counter rebalanceBalanced;
    private final Counter rebalanceMoves;
    private final Counter entitiesDistributed;

    public ClusterCoordinator(int numNodes,
                              PartitionStrategy partitionStrategy,
                              LoadBalanceStrategy loadBalanceStrategy) {
        this(CoordinatorConfig.builder()
            .numNodes(numNodes)
            .partitionStrategy(partitionStrategy)
            .loadBalanceStrategy(loadBalanceStrategy)
            .build());
    }

    public ClusterCoordinator(CoordinatorConfig config) {
        this(config, new SimpleMeterRegistry());
    }

    public ClusterCoordinator(CoordinatorConfig config, MeterRegistry meterRegistry) {
        this(config, meterRegistry, Clock.systemUTC());
    }

    /**
     * Uses {@code clock} both for message timestamps and for assignment version timestamps.
     */
    public ClusterCoordinator(CoordinatorConfig config, MeterRegistry meterRegistry, Clock clock) {
        this(config, new InMemoryMessageChannel(clock), meterRegistry, clock);
    }

    public ClusterCoordinator(CoordinatorConfig config,
                              IMessageChannel channel,
                              MeterRegistry meterRegistry,
                              Clock clock) {
        this.config = config.validate();
        this.clock = clock;
        this.registry = new NodeRegistry(config.getNumNodes(), config::addressFor);
        this.partitionManager = new PartitionManager(config.getPartitionStrategy());
        this.channel = channel;
        this.loadBalancer = new LoadBalancer(
            config.getLoadBalanceStrategy(), config.getLoadThreshold(), config.getMinImbalance());
        this.coordinatorNodeId = 0;

        // Metrics
        for (Payload.Type type : Payload.Type.values()) {
            messagesSent.put(type, Counter.builder(MetricsNames.MESSAGES_SENT_TOTAL)
                .tag(MetricsTags.TYPE, type.name().toLowerCase(Locale.ROOT))
                .register(meterRegistry));
        }
        messagesReceived = Counter.builder(MetricsNames.MESSAGES_RECEIVED_TOTAL).register(meterRegistry);
        rebalancePlanned = Counter.builder(MetricsNames.REBALANCE_CHECKS_TOTAL)
            .tag(MetricsTags.OUTCOME, "planned")
            .register(meterRegistry);
        rebalanceBalanced = Counter.builder(MetricsNames.REBALANCE_CHECKS_TOTAL)
            .tag(MetricsTags.OUTCOME, "balanced")
            .register(meterRegistry);
        rebalanceMoves = Counter.builder(MetricsNames.REBALANCE_MOVES_TOTAL).register(meterRegistry);
        entitiesDistributed = Counter.builder(MetricsNames.ENTITIES_DISTRIBUTED_TOTAL).register(meterRegistry);
        Gauge.builder(MetricsNames.NODES, registry, NodeRegistry::size).register(meterRegistry);
        Gauge.builder(MetricsNames.CHANNEL_DEPTH, channel, IMessageChannel::size).register(meterRegistry);

        log.info("Cluster coordinator created: nodes={}, partitionStrategy={}, loadBalanceStrategy={}",
            config.getNumNodes(), config.getPartitionStrategy(), config.getLoadBalanceStrategy());
    }

    /**
     * {@inheritDoc}
     * <p>
     * Load capacity is {@code entityIds.size() / numNodes} (integer division). With fewer
     * entities than nodes that is 0 and every load stays where it was.
     * </p>
     *
     * @throws InvalidParameterException if partitioning rejects the input
     */
    @Override
    public synchronized void distributeEntities(List<String> entityIds) {
        int numNodes = registry.size();
        List<EntityPartition> created = partitionManager.createPartitions(entityIds, numNodes);

        int maxEntitiesPerNode = entityIds.size() / numNodes;
        registry.recordDistribution(created, maxEntitiesPerNode);
        entitiesDistributed.increment(entityIds.size());

        currentVersion = issueVersion();
        log.info("Distributed {} entities over {} nodes (maxPerNode={}, version={})",
            entityIds.size(), numNodes, maxEntitiesPerNode, currentVersion.getVersion());
    }

    @Override
    public long sendMessage(Integer destination, Payload payload) {
        long id = channel.send(coordinatorNodeId, destination, payload);
        messagesSent.get(payload.type()).increment();
        return id;
    }

    @Override
    public Optional<Message> receiveMessage() {
        Optional<Message> message = channel.receive(coordinatorNodeId);
        message.ifPresent(m -> messagesReceived.increment());
        return message;
    }

    @Override
    public long barrier() {
        return sendMessage(null, Payload.barrier());
    }

    /**
     * {@inheritDoc}
     * <p>
     * A non-empty plan is also announced with a broadcast {@code LoadBalance} message.
     * Partitions are never touched.
     * </p>
     */
    @Override
    public synchronized List<RebalanceMove> rebalanceIfNeeded() {
        List<NodeInfo> nodes = registry.snapshot();
        if (!loadBalancer.needsRebalancing(nodes)) {
            rebalanceBalanced.increment();
            return List.of();
        }

        List<RebalanceMove> moves = loadBalancer.calculateRebalance(nodes, partitionManager.partitions());
        if (moves.isEmpty()) {
            rebalanceBalanced.increment();
            return List.of();
        }

        rebalancePlanned.increment();
        rebalanceMoves.increment(moves.size());
        sendMessage(null, Payload.loadBalance());
        log.info("Rebalance planned: {} moves ({})", moves.size(), loadBalancer.getStrategy());
        return List.copyOf(moves);
    }

    /**
     * @throws NodeNotFoundException if {@code nodeId} is out of range
     */
    @Override
    public synchronized void updateNodeStatus(int nodeId, NodeStatus status) {
        registry.updateStatus(nodeId, status);
        log.info("Node {} status -> {}", nodeId, status);
    }

    /**
     * Records the entity count a caller observed after executing moves, and recomputes
     * that node's load against the capacity of the last distribution.
     *
     * @throws NodeNotFoundException if {@code nodeId} is out of range
     * @throws InvalidParameterException if {@code entityCount} is negative
     */
    public synchronized NodeInfo updateNodeEntityCount(int nodeId, int entityCount) {
        if (entityCount < 0) {
            throw new InvalidParameterException("Entity count must not be negative, got " + entityCount);
        }
        return registry.updateEntityCount(nodeId, entityCount);
    }

    /**
     * Moves a partition to another node on behalf of a caller executing a rebalance move.
     * Entity counts are not touched; report them via {@link #updateNodeEntityCount(int, int)}.
     *
     * @return the updated partition copy, or empty if no partition has that ID
     * @throws NodeNotFoundException if {@code toNode} is out of range
     */
    public synchronized Optional<EntityPartition> reassignPartition(int partitionId, int toNode) {
        if (registry.get(toNode).isEmpty()) {
            throw new NodeNotFoundException(toNode);
        }
        return partitionManager.reassign(partitionId, toNode);
    }

    @Override
    public Optional<NodeInfo> getNode(int nodeId) {
        return registry.get(nodeId);
    }

    @Override
    public List<NodeInfo> nodes() {
        return registry.snapshot();
    }

    @Override
    public int numNodes() {
        return registry.size();
    }

    public NodeInfo coordinatorNode() {
        return registry.get(coordinatorNodeId).orElseThrow();
    }

    public PartitionManager partitionManager() {
        return partitionManager;
    }

    public List<EntityPartition> partitions() {
        return partitionManager.partitions();
    }

    public LoadBalancer loadBalancer() {
        return loadBalancer;
    }

    public int pendingMessages() {
        return channel.size();
    }

    public CoordinatorConfig config() {
        return config;
    }

    /**
     * Version of the latest distribution, empty before the first one.
     */
    public Optional<AssignmentVersion> assignmentVersion() {
        return Optional.ofNullable(currentVersion);
    }

    private AssignmentVersion issueVersion() {
        StringBuilder layout = new StringBuilder();
        for (EntityPartition partition : partitionManager.partitions()) {
            layout.append(partition.getId()).append(':').append(partition.getNodeId()).append('=');
            layout.append(String.join(",", partition.getEntityIds())).append(';');
        }
        return AssignmentVersion.builder()
            .version(versionCounter.incrementAndGet())
            .issuedAt(clock.instant())
            .versionHash(Hashers.toHex(Hashers.murmur3Hash(layout.toString())))
            .build();
    }
}
