package com.qqsuccubus.capacity.controller.cost;

import com.qqsuccubus.capacity.controller.config.ControllerConfig;
import com.qqsuccubus.capacity.controller.metrics.MetricsAggregator;
import com.qqsuccubus.capacity.controller.support.RecordingPublisher;
import com.qqsuccubus.capacity.controller.support.StubMetricsSource;
import com.qqsuccubus.capacity.controller.support.Targets;
import com.qqsuccubus.capacity.core.model.RecommendationType;
import com.qqsuccubus.capacity.core.model.RightsizingRecommendation;
import com.qqsuccubus.capacity.core.model.Target;
import com.qqsuccubus.capacity.core.msg.AlertType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RightsizingAdvisorTest {

    private static final Instant T0 = Instant.parse("2026-03-10T10:00:00Z");

    private StubMetricsSource source;
    private RecordingPublisher publisher;
    private MetricsAggregator aggregator;
    private RightsizingAdvisor advisor;

    @BeforeEach
    void setUp() {
        source = new StubMetricsSource();
        publisher = new RecordingPublisher();
        aggregator = new MetricsAggregator(ControllerConfig.defaults(), source, publisher, new SimpleMeterRegistry());
        advisor = new RightsizingAdvisor(aggregator, publisher);
    }

    @Test
    void testReport_ClassifiesAndSortsBySavings() {
        List<Target> targets = List.of(
            observed("hot", 0.9, 0.5),
            observed("idle", 0.1, 0.2),
            observed("balanced", 0.6, 0.6),
            observed("mid", 0.3, 0.4));
        aggregator.collect(targets, T0).block();

        List<RightsizingRecommendation> report = advisor.report(targets, T0).block();

        assertEquals(3, report.size());
        assertEquals("idle", report.get(0).getTargetId());
        assertEquals(RecommendationType.DOWNSIZE, report.get(0).getType());
        // 2 units * 0.5/h * 720h = 720/month, 30% of it
        assertEquals(720.0, report.get(0).getMonthlyCost(), 1e-9);
        assertEquals(216.0, report.get(0).getPotentialMonthlySavings(), 1e-9);

        assertEquals("mid", report.get(1).getTargetId());
        assertEquals(RecommendationType.OPTIMIZE, report.get(1).getType());
        assertEquals(108.0, report.get(1).getPotentialMonthlySavings(), 1e-9);

        assertEquals("hot", report.get(2).getTargetId());
        assertEquals(RecommendationType.UPSIZE, report.get(2).getType());
        assertEquals(0.0, report.get(2).getPotentialMonthlySavings());

        assertEquals(report, advisor.latest());
        assertEquals(1, publisher.alertsOf(AlertType.RIGHTSIZING_REPORT).size());
    }

    @Test
    void testTargetWithoutMemorySignal_Skipped() {
        Target cpuOnly = Targets.svcA().id("cpu-only").build();
        source.set("cpu-only", "cpu", 0.05);
        aggregator.collect(List.of(cpuOnly), T0).block();

        assertTrue(advisor.report(List.of(cpuOnly), T0).block().isEmpty());
        assertTrue(publisher.alertsOf(AlertType.RIGHTSIZING_REPORT).isEmpty());
    }

    @Test
    void testNoSamples_NoRecommendation() {
        assertTrue(advisor.analyze(Targets.svcA().signal(Targets.memory(0.5)).build()).isEmpty());
    }

    private Target observed(String id, double cpu, double memory) {
        source.set(id, "cpu", cpu).set(id, "memory", memory);
        return Targets.svcA().id(id).signal(Targets.memory(0.5)).build();
    }
}
