package com.lexsim.coordinator.balance;

import com.lexsim.core.error.InvalidParameterException;
import com.lexsim.core.model.EntityPartition;
import com.lexsim.core.model.NodeInfo;
import com.lexsim.core.model.RebalanceMove;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Decides whether the cluster needs rebalancing and which partitions should move.
 * <p>
 * Pure: holds only its configuration and never mutates the nodes or partitions it is given.
 * Executing a plan is the caller's job.
 * </p>
 * <p>
 * <b>Plan heuristic (one greedy pass):</b>
 * <pre>
 *   avg         = mean(load)
 *   overloaded  = load &gt; avg, busiest first
 *   underloaded = load &lt; avg, idlest first
 *   for each overloaded node, for each partition it owns:
 *     if node.load - underloaded[0].load &gt; minImbalance: move partition to underloaded[0]
 *       and drop underloaded[0] unless it is the last candidate
 * </pre>
 * Loads are not recomputed during the pass, so the plan is not guaranteed optimal.
 * </p>
 */
public class LoadBalancer {
    private static final Logger log = LoggerFactory.getLogger(LoadBalancer.class);

    public static final double DEFAULT_LOAD_THRESHOLD = 0.8;
    public static final double DEFAULT_MIN_IMBALANCE = 0.2;

    private final LoadBalanceStrategy strategy;
    private final double loadThreshold;
    private volatile double minImbalance;

    public LoadBalancer(LoadBalanceStrategy strategy, double loadThreshold) {
        this(strategy, loadThreshold, DEFAULT_MIN_IMBALANCE);
    }

    public LoadBalancer(LoadBalanceStrategy strategy, double loadThreshold, double minImbalance) {
        this.strategy = strategy;
        this.loadThreshold = clamp(loadThreshold);
        this.minImbalance = clamp(minImbalance);
    }

    /**
     * Checks whether the current loads warrant a rebalance under the configured strategy.
     *
     * @param nodes Node snapshots
     * @return false for an empty cluster, otherwise the strategy's verdict
     */
    public boolean needsRebalancing(List<NodeInfo> nodes) {
        if (nodes.isEmpty()) {
            return false;
        }

        double maxLoad = nodes.stream().mapToDouble(NodeInfo::getLoad).max().orElse(0.0);
        double minLoad = nodes.stream().mapToDouble(NodeInfo::getLoad).min().orElse(0.0);

        switch (strategy) {
            case PERIODIC:
                return true;
            case DYNAMIC:
                return maxLoad > loadThreshold;
            case WORK_STEALING:
                return maxLoad - minLoad > minImbalance;
            case NONE:
            default:
                return false;
        }
    }

    /**
     * Computes an advisory move plan.
     *
     * @param nodes      Node snapshots
     * @param partitions Partitions in creation order
     * @return Moves, empty when there are fewer than two nodes or no partitions
     */
    public List<RebalanceMove> calculateRebalance(List<NodeInfo> nodes, List<EntityPartition> partitions) {
        List<RebalanceMove> moves = new ArrayList<>();
        if (nodes.size() < 2 || partitions.isEmpty()) {
            return moves;
        }

        double avgLoad = nodes.stream().mapToDouble(NodeInfo::getLoad).average().orElse(0.0);

        List<NodeInfo> overloaded = nodes.stream()
            .filter(n -> n.getLoad() > avgLoad)
            .sorted(Comparator.comparingDouble(NodeInfo::getLoad).reversed())
            .collect(Collectors.toList());

        List<NodeInfo> underloaded = nodes.stream()
            .filter(n -> n.getLoad() < avgLoad)
            .sorted(Comparator.comparingDouble(NodeInfo::getLoad))
            .collect(Collectors.toCollection(ArrayList::new));

        for (NodeInfo source : overloaded) {
            for (EntityPartition partition : partitions) {
                if (partition.getNodeId() != source.getId() || underloaded.isEmpty()) {
                    continue;
                }
                NodeInfo target = underloaded.get(0);
                if (source.getLoad() - target.getLoad() > minImbalance) {
                    moves.add(new RebalanceMove(partition.getId(), source.getId(), target.getId()));
                    // The last candidate keeps absorbing moves
                    if (underloaded.size() > 1) {
                        underloaded.remove(0);
                    }
                }
            }
        }

        log.debug("Rebalance plan: avgLoad={}, overloaded={}, moves={}",
            String.format("%.3f", avgLoad), overloaded.size(), moves.size());
        return moves;
    }

    /**
     * Sets the minimum imbalance, clamped to [0,1].
     *
     * @throws InvalidParameterException if {@code threshold} is NaN
     */
    public void setImbalanceThreshold(double threshold) {
        this.minImbalance = clamp(threshold);
    }

    public LoadBalanceStrategy getStrategy() {
        return strategy;
    }

    public double getLoadThreshold() {
        return loadThreshold;
    }

    public double getMinImbalance() {
        return minImbalance;
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            throw new InvalidParameterException("Threshold must be a number, got NaN");
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
