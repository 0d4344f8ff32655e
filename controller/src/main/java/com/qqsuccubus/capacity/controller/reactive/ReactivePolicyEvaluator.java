package com.qqsuccubus.capacity.controller.reactive;

import com.google.common.math.Quantiles;
import com.google.common.math.Stats;
import com.qqsuccubus.capacity.core.metrics.MetricsNames;
import com.qqsuccubus.capacity.core.metrics.MetricsTags;
import com.qqsuccubus.capacity.core.model.MetricSample;
import com.qqsuccubus.capacity.core.model.ProposalOrigin;
import com.qqsuccubus.capacity.core.model.ScalingBehavior;
import com.qqsuccubus.capacity.core.model.ScalingProposal;
import com.qqsuccubus.capacity.core.model.SignalKind;
import com.qqsuccubus.capacity.core.model.SignalPolicy;
import com.qqsuccubus.capacity.core.model.Target;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;
import java.util.StringJoiner;

/**
 * Threshold-based capacity proposal per target (HPA-style).
 * <p>
 * Formula per signal:
 * <pre>
 *   observed = P95 (latency) or average (others) of fresh samples in the signal window
 *   raw      = ceil(max(current, 1) * observed / target)
 *   desired  = max(raw over all signals)
 * </pre>
 * The desired capacity then passes the stabilization windows and the per-cycle step limits.
 * </p>
 */
public class ReactivePolicyEvaluator {
    private static final Logger log = LoggerFactory.getLogger(ReactivePolicyEvaluator.class);

    private final StabilizationTracker tracker;
    private final MeterRegistry meterRegistry;

    public ReactivePolicyEvaluator(MeterRegistry meterRegistry) {
        this(new StabilizationTracker(), meterRegistry);
    }

    public ReactivePolicyEvaluator(StabilizationTracker tracker, MeterRegistry meterRegistry) {
        this.tracker = tracker;
        this.meterRegistry = meterRegistry;
    }

    /**
     * @param samples buffered samples of the target, any signal and freshness
     * @return the proposal, or {@code null} when every signal is stale (no opinion this cycle)
     */
    public ScalingProposal evaluate(Target target, List<MetricSample> samples, Instant now) {
        int current = target.getCurrentCapacity();
        int base = Math.max(current, 1);

        int fresh = 0;
        int observedSignals = 0;
        int rawDesired = 0;
        double demand = 0.0;
        StringJoiner detail = new StringJoiner(", ");

        for (SignalPolicy signal : target.getSignals()) {
            List<Double> windowValues = freshValuesInWindow(samples, signal, now);
            double observed;
            if (!windowValues.isEmpty()) {
                observed = aggregate(windowValues, signal.effectiveAggregation());
                fresh++;
            } else {
                MetricSample fallback = latestOf(samples, signal.getName());
                if (fallback == null) {
                    continue;
                }
                // last-known-good, low confidence
                observed = fallback.getValue();
            }
            observedSignals++;

            double signalDemand = signal.getTargetValue() > 0
                ? base * observed / signal.getTargetValue()
                : current;
            int signalDesired = (int) Math.ceil(signalDemand);
            detail.add(String.format(Locale.ROOT, "%s=%.3f/%.3f->%d",
                signal.getName(), observed, signal.getTargetValue(), signalDesired));

            if (signalDesired > rawDesired) {
                rawDesired = signalDesired;
            }
            demand = Math.max(demand, signalDemand);
        }

        if (fresh == 0) {
            log.debug("Reactive evaluator abstains for {}: no fresh signal", target.getId());
            count("abstain");
            return null;
        }

        ScalingBehavior behavior = target.getBehavior();
        tracker.record(target.getId(), now, rawDesired, behavior.longestWindow());

        int desired = current;
        String outcome;
        if (rawDesired > current) {
            OptionalInt level = tracker.upLevel(target.getId(), now, behavior.getScaleUpStabilization());
            if (level.isPresent() && level.getAsInt() > current) {
                int step = StepLimits.maxScaleUp(current, behavior);
                desired = Math.min(level.getAsInt(), current + step);
                outcome = desired < level.getAsInt()
                    ? String.format("scale-up to %d (step-limited from %d)", desired, level.getAsInt())
                    : String.format("scale-up to %d", desired);
            } else {
                outcome = "scale-up pending stabilization";
            }
        } else if (rawDesired < current) {
            OptionalInt level = tracker.downLevel(target.getId(), now, behavior.getScaleDownStabilization());
            if (level.isPresent() && level.getAsInt() < current) {
                int step = StepLimits.maxScaleDown(current, behavior);
                desired = Math.max(level.getAsInt(), current - step);
                outcome = desired > level.getAsInt()
                    ? String.format("scale-down to %d (step-limited from %d)", desired, level.getAsInt())
                    : String.format("scale-down to %d", desired);
            } else {
                outcome = "scale-down pending stabilization";
            }
        } else {
            outcome = "at target";
        }

        double confidence = (double) fresh / target.getSignals().size();
        String rationale = String.format(Locale.ROOT, "reactive: %s [%s; fresh %d/%d]",
            outcome, detail, fresh, observedSignals);

        ScalingProposal proposal = ScalingProposal.builder()
            .targetId(target.getId())
            .capacity(desired)
            .origin(ProposalOrigin.REACTIVE)
            .rationale(rationale)
            .confidence(confidence)
            .demand(demand)
            .build();

        count(proposal.directionFrom(current).name().toLowerCase(Locale.ROOT));
        log.debug("Reactive proposal for {}: {} -> {} ({})", target.getId(), current, desired, rationale);
        return proposal;
    }

    private static List<Double> freshValuesInWindow(List<MetricSample> samples, SignalPolicy signal, Instant now) {
        Instant from = now.minus(signal.effectiveWindow());
        List<Double> values = new ArrayList<>();
        for (MetricSample sample : samples) {
            if (sample.isFresh()
                && sample.getSignal().equals(signal.getName())
                && !sample.getTimestamp().isBefore(from)
                && !sample.getTimestamp().isAfter(now)) {
                values.add(sample.getValue());
            }
        }
        return values;
    }

    private static MetricSample latestOf(List<MetricSample> samples, String signal) {
        return samples.stream()
            .filter(s -> s.getSignal().equals(signal))
            .max(Comparator.comparing(MetricSample::getTimestamp))
            .orElse(null);
    }

    static double aggregate(List<Double> values, SignalKind.Aggregation aggregation) {
        if (aggregation == SignalKind.Aggregation.P95) {
            return Quantiles.percentiles().index(95).compute(values);
        }
        return Stats.meanOf(values);
    }

    private void count(String direction) {
        meterRegistry.counter(MetricsNames.REACTIVE_EVALUATIONS_TOTAL, MetricsTags.DIRECTION, direction).increment();
    }
}
