package com.lexsim.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome counters a node reports back after running its entities.
 * <p>
 * Carried by {@link Payload.Results}. The coordinator never interprets the
 * counters; it only ships and merges them.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class RunMetrics {
    /**
     * Total rule applications evaluated.
     */
    @JsonProperty("totalApplications")
    long totalApplications;

    /**
     * Applications with a deterministic outcome.
     */
    @JsonProperty("deterministicCount")
    long deterministicCount;

    /**
     * Applications that required discretion.
     */
    @JsonProperty("discretionCount")
    long discretionCount;

    /**
     * Applications that were void.
     */
    @JsonProperty("voidCount")
    long voidCount;

    @JsonCreator
    public RunMetrics(
        @JsonProperty("totalApplications") long totalApplications,
        @JsonProperty("deterministicCount") long deterministicCount,
        @JsonProperty("discretionCount") long discretionCount,
        @JsonProperty("voidCount") long voidCount
    ) {
        this.totalApplications = totalApplications;
        this.deterministicCount = deterministicCount;
        this.discretionCount = discretionCount;
        this.voidCount = voidCount;
    }

    public static RunMetrics empty() {
        return new RunMetrics(0, 0, 0, 0);
    }

    /**
     * Share of deterministic outcomes, 0.0 when nothing was applied.
     */
    public double deterministicRatio() {
        if (totalApplications == 0) {
            return 0.0;
        }
        return (double) deterministicCount / (double) totalApplications;
    }

    /**
     * Field-wise sum of two reports.
     */
    public RunMetrics merge(RunMetrics other) {
        return new RunMetrics(
            totalApplications + other.totalApplications,
            deterministicCount + other.deterministicCount,
            discretionCount + other.discretionCount,
            voidCount + other.voidCount
        );
    }
}
