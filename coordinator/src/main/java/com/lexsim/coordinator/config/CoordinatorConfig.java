package com.lexsim.coordinator.config;

import com.lexsim.coordinator.balance.LoadBalanceStrategy;
import com.lexsim.coordinator.partition.PartitionStrategy;
import com.lexsim.core.error.InvalidParameterException;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Locale;

/**
 * Configuration for a cluster coordinator, built in code or loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class CoordinatorConfig {

    int numNodes;

    @Builder.Default
    PartitionStrategy partitionStrategy = PartitionStrategy.ROUND_ROBIN;

    @Builder.Default
    LoadBalanceStrategy loadBalanceStrategy = LoadBalanceStrategy.NONE;

    // Dynamic strategy trigger, clamped to [0,1] by the balancer
    @Builder.Default
    double loadThreshold = 0.8;

    // WorkStealing trigger and per-move gap, clamped to [0,1] by the balancer
    @Builder.Default
    double minImbalance = 0.2;

    // Tick of the periodic rebalance driver
    @Builder.Default
    Duration rebalanceInterval = Duration.ofSeconds(30);

    // String.format template applied to the node id
    @Builder.Default
    String nodeAddressTemplate = "node-%d";

    public static CoordinatorConfig fromEnv() {
        return CoordinatorConfig.builder()
            .numNodes(Integer.parseInt(getEnv("CLUSTER_NODES", "4")))
            .partitionStrategy(PartitionStrategy.valueOf(normalize(getEnv("PARTITION_STRATEGY", "round_robin"))))
            .loadBalanceStrategy(LoadBalanceStrategy.valueOf(normalize(getEnv("LOAD_BALANCE_STRATEGY", "none"))))
            .loadThreshold(Double.parseDouble(getEnv("LOAD_THRESHOLD", "0.8")))
            .minImbalance(Double.parseDouble(getEnv("MIN_IMBALANCE", "0.2")))
            .rebalanceInterval(Duration.ofSeconds(Integer.parseInt(getEnv("REBALANCE_INTERVAL_SEC", "30"))))
            .nodeAddressTemplate(getEnv("NODE_ADDRESS_TEMPLATE", "node-%d"))
            .build();
    }

    /**
     * Rejects values no coordinator can be built from.
     *
     * @return this config, for chaining
     * @throws InvalidParameterException if the node count is not positive, a threshold is not a
     *                                   number in [0,1], or a required field is missing
     */
    public CoordinatorConfig validate() {
        if (numNodes <= 0) {
            throw new InvalidParameterException("Number of nodes must be greater than 0, got " + numNodes);
        }
        if (partitionStrategy == null || loadBalanceStrategy == null) {
            throw new InvalidParameterException("Partition and load-balance strategies are required");
        }
        requireUnitRange("loadThreshold", loadThreshold);
        requireUnitRange("minImbalance", minImbalance);
        if (rebalanceInterval == null || rebalanceInterval.isNegative() || rebalanceInterval.isZero()) {
            throw new InvalidParameterException("Rebalance interval must be positive");
        }
        if (nodeAddressTemplate == null) {
            throw new InvalidParameterException("Node address template is required");
        }
        return this;
    }

    private static void requireUnitRange(String name, double value) {
        // NaN fails both comparisons, so it is rejected here too
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new InvalidParameterException(name + " must be within [0,1], got " + value);
        }
    }

    public String addressFor(int nodeId) {
        return String.format(nodeAddressTemplate, nodeId);
    }

    private static String normalize(String value) {
        return value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
