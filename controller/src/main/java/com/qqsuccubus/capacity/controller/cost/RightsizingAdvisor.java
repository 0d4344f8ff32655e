package com.qqsuccubus.capacity.controller.cost;

import com.google.common.math.Stats;
import com.qqsuccubus.capacity.controller.kafka.ControlEvents;
import com.qqsuccubus.capacity.controller.kafka.IControlPublisher;
import com.qqsuccubus.capacity.controller.metrics.MetricsAggregator;
import com.qqsuccubus.capacity.core.model.MetricSample;
import com.qqsuccubus.capacity.core.model.RecommendationType;
import com.qqsuccubus.capacity.core.model.RightsizingRecommendation;
import com.qqsuccubus.capacity.core.model.Target;
import com.qqsuccubus.capacity.core.msg.AlertType;
import com.qqsuccubus.capacity.core.msg.ControlMessages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Periodic rightsizing report from average CPU and memory utilization.
 * <p>
 * Thresholds (percent of allocation):
 * <ul>
 *   <li>DOWNSIZE: cpu &lt; 20 and memory &lt; 30, saves 30%</li>
 *   <li>UPSIZE: cpu &gt; 80 or memory &gt; 85</li>
 *   <li>OPTIMIZE: cpu &lt; 40 and memory &lt; 50, saves 15%</li>
 * </ul>
 * Targets without both a cpu and a memory signal are skipped.
 * </p>
 */
public class RightsizingAdvisor {
    private static final Logger log = LoggerFactory.getLogger(RightsizingAdvisor.class);

    static final String CPU_SIGNAL = "cpu";
    static final List<String> MEMORY_SIGNALS = List.of("memory", "mem");
    static final double HOURS_PER_MONTH = 24 * 30;
    static final int REPORT_SIZE = 10;

    private final MetricsAggregator aggregator;
    private final IControlPublisher publisher;

    private final AtomicReference<List<RightsizingRecommendation>> latest = new AtomicReference<>(List.of());

    public RightsizingAdvisor(MetricsAggregator aggregator, IControlPublisher publisher) {
        this.aggregator = aggregator;
        this.publisher = publisher;
    }

    /**
     * Builds the report, keeps it for {@link #latest()} and publishes it as a {@code RIGHTSIZING_REPORT} alert.
     */
    public Mono<List<RightsizingRecommendation>> report(Collection<Target> targets, Instant now) {
        List<RightsizingRecommendation> recommendations = recommend(targets);
        latest.set(recommendations);

        if (recommendations.isEmpty()) {
            log.info("Rightsizing report: no recommendations for {} targets", targets.size());
            return Mono.just(recommendations);
        }

        double savings = recommendations.stream().mapToDouble(RightsizingRecommendation::getPotentialMonthlySavings).sum();
        log.info("Rightsizing report: {} recommendations, potential savings {}/month",
            recommendations.size(), Math.round(savings * 100) / 100.0);

        return ControlEvents.fire(publisher, ControlEvents.alert(
                AlertType.RIGHTSIZING_REPORT,
                ControlMessages.Severity.INFO,
                null,
                String.format("%d rightsizing recommendations", recommendations.size()),
                Map.of("recommendations", recommendations, "potentialMonthlySavings", savings),
                now))
            .thenReturn(recommendations);
    }

    public List<RightsizingRecommendation> latest() {
        return latest.get();
    }

    List<RightsizingRecommendation> recommend(Collection<Target> targets) {
        List<RightsizingRecommendation> all = new ArrayList<>();
        for (Target target : targets) {
            analyze(target).ifPresent(all::add);
        }
        return all.stream()
            .sorted(Comparator.comparingDouble(RightsizingRecommendation::getPotentialMonthlySavings).reversed())
            .limit(REPORT_SIZE)
            .collect(Collectors.toList());
    }

    Optional<RightsizingRecommendation> analyze(Target target) {
        OptionalDouble cpu = averagePercent(target.getId(), List.of(CPU_SIGNAL));
        OptionalDouble memory = averagePercent(target.getId(), MEMORY_SIGNALS);
        if (cpu.isEmpty() || memory.isEmpty()) {
            return Optional.empty();
        }

        double cpuPct = cpu.getAsDouble();
        double memPct = memory.getAsDouble();
        double monthlyCost = target.getCurrentCapacity() * target.getUnitCostPerHour() * HOURS_PER_MONTH;

        RecommendationType type;
        String action;
        double savings;
        if (cpuPct < 20 && memPct < 30) {
            type = RecommendationType.DOWNSIZE;
            action = "Consider reducing CPU/memory allocation";
            savings = monthlyCost * 0.30;
        } else if (cpuPct > 80 || memPct > 85) {
            type = RecommendationType.UPSIZE;
            action = "Consider increasing CPU/memory allocation";
            savings = 0;
        } else if (cpuPct < 40 && memPct < 50) {
            type = RecommendationType.OPTIMIZE;
            action = "Consider slight resource reduction";
            savings = monthlyCost * 0.15;
        } else {
            return Optional.empty();
        }

        return Optional.of(RightsizingRecommendation.builder()
            .targetId(target.getId())
            .cpuUtilization(cpuPct)
            .memoryUtilization(memPct)
            .type(type)
            .action(action)
            .monthlyCost(monthlyCost)
            .potentialMonthlySavings(savings)
            .build());
    }

    // Signals carry fractions in [0, 1]
    private OptionalDouble averagePercent(String targetId, List<String> signalNames) {
        for (String signal : signalNames) {
            List<MetricSample> samples = aggregator.freshSamples(targetId, signal);
            if (!samples.isEmpty()) {
                return OptionalDouble.of(Stats.meanOf(samples.stream().mapToDouble(MetricSample::getValue).toArray()) * 100);
            }
        }
        return OptionalDouble.empty();
    }
}
