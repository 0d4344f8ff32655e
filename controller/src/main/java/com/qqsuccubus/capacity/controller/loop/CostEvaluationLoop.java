package com.qqsuccubus.capacity.controller.loop;

import com.qqsuccubus.capacity.controller.cost.CostGovernor;
import com.qqsuccubus.capacity.controller.cost.IBudgetStateStore;
import com.qqsuccubus.capacity.controller.cost.RightsizingAdvisor;
import com.qqsuccubus.capacity.controller.registry.TargetRegistry;
import com.qqsuccubus.capacity.core.model.BudgetState;
import com.qqsuccubus.capacity.core.model.RightsizingRecommendation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

/**
 * Drives the budget evaluation and the periodic rightsizing report. The only writer of the budget state.
 * <p>
 * The state is saved after every evaluation. On taking over leadership the saved state is restored
 * before the first evaluation, so a billing outage at failover keeps the previous leader's tier.
 */
public class CostEvaluationLoop {
    private static final Logger log = LoggerFactory.getLogger(CostEvaluationLoop.class);

    private final Duration evaluationInterval;
    private final Duration rightsizingInterval;
    private final TargetRegistry registry;
    private final CostGovernor governor;
    private final IBudgetStateStore stateStore;
    private final Duration storeTimeout;
    private final RightsizingAdvisor advisor;
    private final BooleanSupplier leader;
    private final Clock clock;

    private final Disposable.Composite tickers = Disposables.composite();
    private final AtomicBoolean leading = new AtomicBoolean(false);

    public CostEvaluationLoop(
        Duration evaluationInterval,
        Duration rightsizingInterval,
        TargetRegistry registry,
        CostGovernor governor,
        IBudgetStateStore stateStore,
        Duration storeTimeout,
        RightsizingAdvisor advisor,
        BooleanSupplier leader,
        Clock clock
    ) {
        this.evaluationInterval = evaluationInterval;
        this.rightsizingInterval = rightsizingInterval;
        this.registry = registry;
        this.governor = governor;
        this.stateStore = stateStore;
        this.storeTimeout = storeTimeout;
        this.advisor = advisor;
        this.leader = leader;
        this.clock = clock;
    }

    public void start() {
        log.info("Starting cost loop: evaluation every {}, rightsizing every {}", evaluationInterval, rightsizingInterval);
        tickers.add(Flux.interval(Duration.ZERO, evaluationInterval)
            .onBackpressureDrop()
            .flatMap(tick -> evaluate(clock.instant()), 1)
            .subscribe());
        tickers.add(Flux.interval(rightsizingInterval)
            .onBackpressureDrop()
            .flatMap(tick -> rightsize(clock.instant()), 1)
            .subscribe());
    }

    public void stop() {
        tickers.dispose();
        log.info("Cost loop stopped");
    }

    public Mono<BudgetState> evaluate(Instant now) {
        if (!leader.getAsBoolean()) {
            if (leading.compareAndSet(true, false)) {
                log.info("Leadership lost, budget evaluation paused");
            }
            return Mono.empty();
        }
        Mono<Void> takeover = leading.get() ? Mono.empty() : restore();
        return takeover
            .then(Mono.defer(() -> governor.evaluate(registry.all(), now)))
            .flatMap(this::persist)
            .doOnNext(state -> log.debug("Budget {}: rate {}/h, spend {}", state.getTier(),
                state.getHourlyRate(), state.getSpendToDate()))
            .onErrorResume(err -> {
                log.error("Cost evaluation failed", err);
                return Mono.empty();
            });
    }

    /**
     * Loads the last saved state into the governor. A failed load is retried on the next tick,
     * the evaluation still runs on the state held locally.
     */
    private Mono<Void> restore() {
        return stateStore.load()
            .timeout(storeTimeout)
            .doOnNext(governor::restore)
            .doOnSuccess(ignored -> {
                leading.set(true);
                log.info("Leadership acquired, budget tier {}", governor.currentState().getTier());
            })
            .onErrorResume(err -> {
                log.warn("Cannot load saved budget state, retrying next evaluation: {}", err.getMessage());
                return Mono.empty();
            })
            .then();
    }

    private Mono<BudgetState> persist(BudgetState state) {
        return stateStore.save(state)
            .timeout(storeTimeout)
            .onErrorResume(err -> {
                log.warn("Cannot save budget state: {}", err.getMessage());
                return Mono.empty();
            })
            .thenReturn(state);
    }

    public Mono<List<RightsizingRecommendation>> rightsize(Instant now) {
        if (!leader.getAsBoolean()) {
            return Mono.empty();
        }
        return advisor.report(registry.all(), now)
            .onErrorResume(err -> {
                log.error("Rightsizing report failed", err);
                return Mono.empty();
            });
    }
}
