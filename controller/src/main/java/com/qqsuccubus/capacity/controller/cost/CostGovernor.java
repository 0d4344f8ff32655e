package com.qqsuccubus.capacity.controller.cost;

import com.qqsuccubus.capacity.controller.config.ControllerConfig;
import com.qqsuccubus.capacity.controller.kafka.ControlEvents;
import com.qqsuccubus.capacity.controller.kafka.IControlPublisher;
import com.qqsuccubus.capacity.core.error.BudgetDataUnavailableException;
import com.qqsuccubus.capacity.core.metrics.MetricsNames;
import com.qqsuccubus.capacity.core.metrics.MetricsTags;
import com.qqsuccubus.capacity.core.model.BudgetPolicy;
import com.qqsuccubus.capacity.core.model.BudgetState;
import com.qqsuccubus.capacity.core.model.BudgetTier;
import com.qqsuccubus.capacity.core.model.Decision;
import com.qqsuccubus.capacity.core.model.DecisionTier;
import com.qqsuccubus.capacity.core.model.ScalingProposal;
import com.qqsuccubus.capacity.core.model.SpendHorizon;
import com.qqsuccubus.capacity.core.model.Target;
import com.qqsuccubus.capacity.core.msg.AlertType;
import com.qqsuccubus.capacity.core.msg.ControlMessages;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Tracks spend against budget and has the last word on every decision.
 * <p>
 * Tiers:
 * <ul>
 *   <li>EMERGENCY: spend or projected end-of-period spend reaches the budget of any horizon</li>
 *   <li>WARNING: spend reaches {@code warningRatio * budget} of any horizon</li>
 *   <li>NORMAL: otherwise</li>
 * </ul>
 * Escalation is immediate. A raised tier only falls back to NORMAL, after
 * {@code ceil(deEscalationWindow / costInterval)} consecutive evaluations below the warning threshold of every
 * horizon; a WARNING-level evaluation holds the tier and restarts the count. Without billing data the governor
 * fails closed: it can still escalate on its own estimate but never de-escalates.
 * </p>
 */
public class CostGovernor {
    private static final Logger log = LoggerFactory.getLogger(CostGovernor.class);

    public static final String EMERGENCY_RATIONALE = "cost-override: emergency tier";

    private final ControllerConfig config;
    private final BudgetPolicy policy;
    private final ICostDataSource costDataSource;
    private final IControlPublisher publisher;
    private final MeterRegistry meterRegistry;
    private final SpendEstimator estimator = new SpendEstimator();

    private final AtomicReference<BudgetState> state;

    public CostGovernor(
        ControllerConfig config,
        BudgetPolicy policy,
        ICostDataSource costDataSource,
        IControlPublisher publisher,
        MeterRegistry meterRegistry,
        Instant startedAt
    ) {
        this.config = config;
        this.policy = policy;
        this.costDataSource = costDataSource;
        this.publisher = publisher;
        this.meterRegistry = meterRegistry;
        this.state = new AtomicReference<>(BudgetState.initial(startedAt));

        Gauge.builder(MetricsNames.GOVERNOR_BUDGET_TIER, state, s -> s.get().getTier().ordinal())
            .register(meterRegistry);
        Gauge.builder(MetricsNames.GOVERNOR_HOURLY_RATE, state, s -> s.get().getHourlyRate())
            .register(meterRegistry);
    }

    public BudgetState currentState() {
        return state.get();
    }

    public BudgetPolicy getPolicy() {
        return policy;
    }

    /**
     * Number of consecutive below-warning evaluations required before a raised tier drops to NORMAL.
     */
    public int deEscalationEvaluations() {
        long windowMs = policy.getDeEscalationWindow().toMillis();
        long intervalMs = Math.max(1, config.getCostEvaluationInterval().toMillis());
        return (int) Math.max(1, (windowMs + intervalMs - 1) / intervalMs);
    }

    /**
     * Adopts a state saved by an earlier leader when it is more severe than the one held here.
     * Never lowers the held tier.
     */
    public BudgetState restore(BudgetState saved) {
        BudgetState held = state.get();
        if (!saved.getTier().isWorseThan(held.getTier())) {
            return held;
        }
        BudgetState restored = saved.withDataAvailable(held.isDataAvailable());
        state.set(restored);
        log.info("Restored budget tier {} (since {})", restored.getTier(), restored.getTierSince());
        return restored;
    }

    /**
     * One cost-evaluation cycle: refreshes spend figures and moves the budget tier.
     */
    public Mono<BudgetState> evaluate(Collection<Target> targets, Instant now) {
        double rate = targets.stream().mapToDouble(Target::hourlyCost).sum();
        Map<SpendHorizon, Double> estimated = estimator.accrue(rate, now);
        BudgetState previous = state.get();

        return billedSpend(now)
            .map(billed -> next(previous, rate, estimated, billed, true, now))
            .onErrorResume(err -> {
                log.warn("Billing data unavailable, holding tier {}: {}", previous.getTier(), err.getMessage());
                return Mono.just(next(previous, rate, estimated, Map.of(), false, now));
            })
            .flatMap(next -> {
                state.set(next);
                return announce(previous, next, now).thenReturn(next);
            });
    }

    /**
     * Shapes an arbitrated proposal into the final decision for the active tier.
     */
    public Decision govern(Target target, ScalingProposal proposal, BudgetState budget, Instant now) {
        int current = target.getCurrentCapacity();
        Decision.DecisionBuilder decision = Decision.builder()
            .targetId(target.getId())
            .previousCapacity(current)
            .issuedAt(now);

        if (budget.getTier() == BudgetTier.EMERGENCY && !target.isCritical()) {
            int floor = target.getEmergencyFloor() != null ? target.getEmergencyFloor() : policy.getEmergencyFloor();
            Target capped = target.withBounds(
                Math.min(target.getMinCapacity(), floor),
                Math.min(target.getMaxCapacity(), floor));
            int capacity = capped.clamp(proposal.getCapacity());
            String rationale;
            if (capacity < proposal.getCapacity()) {
                rationale = EMERGENCY_RATIONALE;
                log.warn("{} for {}: proposal {} capped to floor {} ({})", EMERGENCY_RATIONALE,
                    target.getId(), proposal.getCapacity(), capacity, proposal.getRationale());
                ControlEvents.fire(publisher, ControlEvents.alert(
                    AlertType.COST_OVERRIDE,
                    ControlMessages.Severity.CRITICAL,
                    target.getId(),
                    String.format("Emergency budget tier: capacity capped at %d (proposed %d)", capacity, proposal.getCapacity()),
                    Map.of("proposed", proposal.getCapacity(), "capped", capacity, "floor", floor,
                        "proposalRationale", String.valueOf(proposal.getRationale())),
                    now)).subscribe();
            } else {
                rationale = proposal.getRationale() + "; within emergency floor " + floor;
            }
            return count(decision.capacity(capacity).tier(DecisionTier.EMERGENCY).rationale(rationale).build());
        }

        if (budget.getTier() == BudgetTier.WARNING
            && policy.isFreezeScaleUpInWarning()
            && !target.isCritical()
            && proposal.getCapacity() > current) {
            log.info("Scale-up of {} to {} held at {} by warning budget tier", target.getId(), proposal.getCapacity(), current);
            return count(decision
                .capacity(target.clamp(current))
                .tier(DecisionTier.COST_CAPPED)
                .rationale(String.format("cost-capped: scale-up to %d frozen in warning tier", proposal.getCapacity()))
                .build());
        }

        return count(decision
            .capacity(target.clamp(proposal.getCapacity()))
            .tier(DecisionTier.NORMAL)
            .rationale(proposal.getRationale())
            .build());
    }

    BudgetState next(
        BudgetState previous,
        double rate,
        Map<SpendHorizon, Double> estimated,
        Map<SpendHorizon, Double> billed,
        boolean dataAvailable,
        Instant now
    ) {
        Map<SpendHorizon, Double> spend = new EnumMap<>(SpendHorizon.class);
        Map<SpendHorizon, Double> projected = new EnumMap<>(SpendHorizon.class);
        for (SpendHorizon horizon : SpendHorizon.values()) {
            double toDate = Math.max(estimated.getOrDefault(horizon, 0.0), billed.getOrDefault(horizon, 0.0));
            spend.put(horizon, toDate);
            projected.put(horizon, toDate + rate * horizon.hoursRemaining(now));
        }

        BudgetTier observed = observe(spend, projected);
        BudgetTier tier = previous.getTier();
        Instant since = previous.getTierSince();
        int calm = previous.getConsecutiveBelowTier();

        if (observed.isWorseThan(tier)) {
            tier = observed;
            since = now;
            calm = 0;
        } else if (tier != BudgetTier.NORMAL && observed == BudgetTier.NORMAL && dataAvailable) {
            calm++;
            if (calm >= deEscalationEvaluations()) {
                tier = BudgetTier.NORMAL;
                since = now;
                calm = 0;
            }
        } else {
            // at or above the warning threshold, or no billing data: the calm streak starts over
            calm = 0;
        }

        return BudgetState.builder()
            .spendToDate(spend)
            .projectedSpend(projected)
            .hourlyRate(rate)
            .tier(tier)
            .tierSince(since)
            .consecutiveBelowTier(calm)
            .dataAvailable(dataAvailable)
            .evaluatedAt(now)
            .build();
    }

    private BudgetTier observe(Map<SpendHorizon, Double> spend, Map<SpendHorizon, Double> projected) {
        BudgetTier observed = BudgetTier.NORMAL;
        for (Map.Entry<SpendHorizon, Double> budget : policy.getBudgets().entrySet()) {
            SpendHorizon horizon = budget.getKey();
            double toDate = spend.get(horizon);
            if (toDate >= budget.getValue() || projected.get(horizon) >= budget.getValue()) {
                return BudgetTier.EMERGENCY;
            }
            if (toDate >= policy.warningThreshold(horizon)) {
                observed = BudgetTier.WARNING;
            }
        }
        return observed;
    }

    private Mono<Map<SpendHorizon, Double>> billedSpend(Instant now) {
        if (policy.getBudgets().isEmpty()) {
            return Mono.just(Map.of());
        }
        Duration timeout = config.getCostDataTimeout();
        return Flux.fromIterable(policy.getBudgets().keySet())
            .flatMap(horizon -> costDataSource.spendBetween(horizon.periodStart(now), now)
                .timeout(timeout)
                .switchIfEmpty(Mono.error(() -> new BudgetDataUnavailableException("No billed spend for " + horizon)))
                .map(value -> Map.entry(horizon, value)))
            .collectMap(Map.Entry::getKey, Map.Entry::getValue);
    }

    private Mono<Void> announce(BudgetState previous, BudgetState next, Instant now) {
        Mono<Void> alerts = Mono.empty();

        if (next.getTier() != previous.getTier()) {
            boolean escalation = next.getTier().isWorseThan(previous.getTier());
            log.info("Budget tier {} -> {} (rate {}/h, spend {})", previous.getTier(), next.getTier(),
                String.format(Locale.ROOT, "%.2f", next.getHourlyRate()), next.getSpendToDate());
            alerts = alerts.then(ControlEvents.fire(publisher, ControlEvents.alert(
                AlertType.TIER_TRANSITION,
                escalation && next.getTier() == BudgetTier.EMERGENCY
                    ? ControlMessages.Severity.CRITICAL
                    : escalation ? ControlMessages.Severity.WARNING : ControlMessages.Severity.INFO,
                null,
                String.format("Budget tier %s -> %s", previous.getTier(), next.getTier()),
                spendDetails(next),
                now)));
        }

        if (!next.isDataAvailable() && previous.isDataAvailable()) {
            alerts = alerts.then(ControlEvents.fire(publisher, ControlEvents.alert(
                AlertType.BUDGET_DATA_UNAVAILABLE,
                ControlMessages.Severity.WARNING,
                null,
                String.format("Billing data unavailable; holding budget tier %s", next.getTier()),
                spendDetails(next),
                now)));
        } else if (next.isDataAvailable() && !previous.isDataAvailable()) {
            log.info("Billing data available again");
        }

        return alerts;
    }

    private static Map<String, Object> spendDetails(BudgetState state) {
        Map<String, Object> details = new HashMap<>();
        details.put("tier", state.getTier().name());
        details.put("hourlyRate", state.getHourlyRate());
        state.getSpendToDate().forEach((h, v) -> details.put("spend." + h.name().toLowerCase(Locale.ROOT), v));
        state.getProjectedSpend().forEach((h, v) -> details.put("projected." + h.name().toLowerCase(Locale.ROOT), v));
        return details;
    }

    private Decision count(Decision decision) {
        meterRegistry.counter(MetricsNames.GOVERNOR_DECISIONS_TOTAL,
            MetricsTags.TIER, decision.getTier().name().toLowerCase(Locale.ROOT)).increment();
        return decision;
    }
}
