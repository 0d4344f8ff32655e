package com.qqsuccubus.capacity.controller.loop;

import com.qqsuccubus.capacity.controller.arbiter.DecisionArbiter;
import com.qqsuccubus.capacity.controller.cost.CostGovernor;
import com.qqsuccubus.capacity.controller.executor.ActionExecutor;
import com.qqsuccubus.capacity.controller.forecast.PredictiveForecaster;
import com.qqsuccubus.capacity.controller.metrics.MetricsAggregator;
import com.qqsuccubus.capacity.controller.metrics.SignalBundle;
import com.qqsuccubus.capacity.controller.reactive.ReactivePolicyEvaluator;
import com.qqsuccubus.capacity.core.model.BudgetState;
import com.qqsuccubus.capacity.core.model.Decision;
import com.qqsuccubus.capacity.core.model.DecisionLogEntry;
import com.qqsuccubus.capacity.core.model.MetricSample;
import com.qqsuccubus.capacity.core.model.ScalingProposal;
import com.qqsuccubus.capacity.core.model.Target;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One pass of the decision pipeline for a set of targets:
 * <pre>
 *   collect -> evaluate / forecast -> arbitrate -> govern -> apply
 * </pre>
 * The decide step runs on a single thread against one budget snapshot; only the apply step fans out.
 */
public class ScalingCycle {
    private static final Logger log = LoggerFactory.getLogger(ScalingCycle.class);

    private final MetricsAggregator aggregator;
    private final ReactivePolicyEvaluator evaluator;
    private final PredictiveForecaster forecaster;
    private final DecisionArbiter arbiter;
    private final CostGovernor governor;
    private final ActionExecutor executor;

    public ScalingCycle(
        MetricsAggregator aggregator,
        ReactivePolicyEvaluator evaluator,
        PredictiveForecaster forecaster,
        DecisionArbiter arbiter,
        CostGovernor governor,
        ActionExecutor executor
    ) {
        this.aggregator = aggregator;
        this.evaluator = evaluator;
        this.forecaster = forecaster;
        this.arbiter = arbiter;
        this.governor = governor;
        this.executor = executor;
    }

    /**
     * Collects signals and decides every target. Applies nothing.
     */
    public Mono<CyclePlan> decide(List<Target> targets, Instant now) {
        return aggregator.collect(targets, now)
            .map(bundles -> plan(targets, bundles, now));
    }

    /**
     * Applies the decisions in parallel across targets and stores the demand feedback.
     */
    public Mono<List<DecisionLogEntry>> execute(CyclePlan plan) {
        Mono<Void> history = Flux.fromIterable(plan.getDemand())
            .flatMap(forecaster::recordDemand)
            .then();

        return Flux.fromIterable(plan.getDecisions())
            .flatMap(executor::apply)
            .collectList()
            .flatMap(entries -> history.thenReturn(entries));
    }

    CyclePlan plan(List<Target> targets, Map<String, SignalBundle> bundles, Instant now) {
        BudgetState budget = governor.currentState();
        List<Decision> decisions = new ArrayList<>(targets.size());
        List<MetricSample> demand = new ArrayList<>();

        for (Target target : targets) {
            SignalBundle bundle = bundles.get(target.getId());

            ScalingProposal reactive = null;
            if (bundle != null && !bundle.isExcluded()) {
                reactive = evaluator.evaluate(target, bundle.getSamples(), now);
            }
            List<MetricSample> demandHistory = bundle != null
                ? bundle.samplesOf(MetricSample.DEMAND_SIGNAL)
                : List.of();
            ScalingProposal predictive = forecaster.forecast(target, demandHistory, now);

            ScalingProposal proposal = arbiter.arbitrate(target, reactive, predictive);
            Decision decision = governor.govern(target, proposal, budget, now);
            decisions.add(decision);

            if (reactive != null) {
                demand.add(aggregator.recordFeedback(target, reactive.getDemand(), now));
            }
            log.debug("Decision for {}: {} -> {} [{}] {}", target.getId(), decision.getPreviousCapacity(),
                decision.getCapacity(), decision.getTier(), decision.getRationale());
        }
        return new CyclePlan(decisions, demand);
    }
}
