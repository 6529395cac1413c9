package com.lexsim.coordinator.partition;

import com.lexsim.core.error.InvalidParameterException;
import com.lexsim.core.hash.Hashers;
import com.lexsim.core.model.EntityPartition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Splits entity IDs into one partition per node using a fixed {@link PartitionStrategy}.
 * <p>
 * <b>Guarantees for {@code createPartitions(E, N)}:</b>
 * <ul>
 *   <li>Exactly {@code N} partitions are returned, one per node index {@code 0..N-1}, even if empty.</li>
 *   <li>Every input entity lands in exactly one of them.</li>
 *   <li>Partition IDs come from a counter that is never reset, so IDs never collide across calls.</li>
 * </ul>
 * </p>
 * <p>
 * Partitions from every call are retained for lookups. Callers only receive copies.
 * </p>
 */
public class PartitionManager {
    private static final Logger log = LoggerFactory.getLogger(PartitionManager.class);

    private final PartitionStrategy strategy;
    private final AtomicInteger nextPartitionId = new AtomicInteger(0);
    private final List<EntityPartition> partitions = new ArrayList<>();

    public PartitionManager(PartitionStrategy strategy) {
        this.strategy = strategy;
    }

    public PartitionStrategy getStrategy() {
        return strategy;
    }

    /**
     * Creates {@code numNodes} partitions and fills them with {@code entityIds}.
     *
     * @param entityIds Entity IDs in input order (may be empty)
     * @param numNodes  Number of target nodes
     * @return Copies of the new partitions, indexed by owning node
     * @throws InvalidParameterException if {@code numNodes <= 0} or an entity ID is null
     */
    public synchronized List<EntityPartition> createPartitions(List<String> entityIds, int numNodes) {
        if (numNodes <= 0) {
            throw new InvalidParameterException("Number of nodes must be greater than 0");
        }
        if (entityIds.contains(null)) {
            throw new InvalidParameterException("Entity IDs must not be null");
        }

        List<EntityPartition> created = new ArrayList<>(numNodes);
        for (int nodeId = 0; nodeId < numNodes; nodeId++) {
            created.add(new EntityPartition(nextPartitionId.getAndIncrement(), nodeId));
        }

        int total = entityIds.size();
        int chunkSize = (total + numNodes - 1) / numNodes;
        for (int i = 0; i < total; i++) {
            String entityId = entityIds.get(i);
            created.get(partitionIndex(entityId, i, chunkSize, numNodes)).addEntity(entityId);
        }

        partitions.addAll(created);

        log.info("Partitioned {} entities into {} partitions (strategy={}, ids {}..{})",
            total, numNodes, strategy, created.get(0).getId(), created.get(numNodes - 1).getId());

        return created.stream().map(EntityPartition::copy).collect(Collectors.toList());
    }

    private int partitionIndex(String entityId, int inputIndex, int chunkSize, int numNodes) {
        switch (strategy) {
            case HASH:
                return Hashers.bucket(Hashers.polynomial31(entityId), numNodes);
            case RANGE:
                return Math.min(inputIndex / chunkSize, numNodes - 1);
            case ROUND_ROBIN:
            case LOAD_BALANCED:
            case GEOGRAPHIC:
            default:
                // Load- and location-aware placement fall back to round-robin
                return inputIndex % numNodes;
        }
    }

    /**
     * Finds the first partition (in creation order) that holds {@code entityId}.
     *
     * @return the partition copy, or empty if the entity is unassigned
     */
    public synchronized Optional<EntityPartition> getPartition(String entityId) {
        return partitions.stream()
            .filter(p -> p.contains(entityId))
            .findFirst()
            .map(EntityPartition::copy);
    }

    /**
     * All partitions currently owned by {@code nodeId}, in creation order.
     */
    public synchronized List<EntityPartition> getNodePartitions(int nodeId) {
        return partitions.stream()
            .filter(p -> p.getNodeId() == nodeId)
            .map(EntityPartition::copy)
            .collect(Collectors.toList());
    }

    public synchronized int partitionCount() {
        return partitions.size();
    }

    /**
     * Snapshot of every partition, in creation order.
     */
    public synchronized List<EntityPartition> partitions() {
        return partitions.stream().map(EntityPartition::copy).collect(Collectors.toList());
    }

    /**
     * Transfers ownership of a partition. Called by whoever executes a rebalance move;
     * the entities travel with the partition, so no entity ends up in two partitions.
     * The manager does not know the cluster size, so {@code toNode} is not range-checked here.
     *
     * @return the updated partition copy, or empty if no partition has that ID
     */
    public synchronized Optional<EntityPartition> reassign(int partitionId, int toNode) {
        for (EntityPartition partition : partitions) {
            if (partition.getId() == partitionId) {
                int from = partition.getNodeId();
                partition.assignTo(toNode);
                log.info("Partition {} ({} entities) reassigned {} -> {}", partitionId, partition.size(), from, toNode);
                return Optional.of(partition.copy());
            }
        }
        return Optional.empty();
    }
}
