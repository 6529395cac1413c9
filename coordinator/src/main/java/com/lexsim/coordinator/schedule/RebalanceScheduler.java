package com.lexsim.coordinator.schedule;

import com.lexsim.coordinator.cluster.ClusterCoordinator;
import com.lexsim.coordinator.cluster.IClusterCoordinator;
import com.lexsim.core.model.RebalanceMove;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.List;

/**
 * Periodically asks the coordinator for a rebalance plan.
 * <p>
 * Supplies the timing that the periodic strategy leaves to the caller. The returned
 * {@link Flux} is cold: nothing runs until the caller subscribes, and disposing the
 * subscription stops the checks. Plans are only emitted, never executed.
 * </p>
 */
public class RebalanceScheduler {
    private static final Logger log = LoggerFactory.getLogger(RebalanceScheduler.class);

    private final IClusterCoordinator coordinator;
    private final Duration interval;

    public RebalanceScheduler(IClusterCoordinator coordinator, Duration interval) {
        this.coordinator = coordinator;
        this.interval = interval;
    }

    /**
     * Scheduler ticking at the coordinator's configured rebalance interval.
     */
    public static RebalanceScheduler forCoordinator(ClusterCoordinator coordinator) {
        return new RebalanceScheduler(coordinator, coordinator.config().getRebalanceInterval());
    }

    public Duration getInterval() {
        return interval;
    }

    /**
     * Starts periodic rebalance checks.
     *
     * @return Flux of non-empty move plans
     */
    public Flux<List<RebalanceMove>> start() {
        return Flux.interval(interval)
            .doOnSubscribe(s -> log.info("Starting periodic rebalance checks every {}", interval))
            .map(tick -> coordinator.rebalanceIfNeeded())
            .filter(moves -> !moves.isEmpty())
            .doOnNext(moves -> log.info("Periodic check produced {} moves", moves.size()))
            .onErrorContinue((err, tick) -> log.warn("Rebalance check failed, continuing", err));
    }
}
