package com.qqsuccubus.capacity.controller.reactive;

import com.qqsuccubus.capacity.controller.support.Targets;
import com.qqsuccubus.capacity.core.metrics.MetricsNames;
import com.qqsuccubus.capacity.core.metrics.MetricsTags;
import com.qqsuccubus.capacity.core.model.MetricSample;
import com.qqsuccubus.capacity.core.model.ProposalOrigin;
import com.qqsuccubus.capacity.core.model.SampleFreshness;
import com.qqsuccubus.capacity.core.model.ScalingProposal;
import com.qqsuccubus.capacity.core.model.SignalKind;
import com.qqsuccubus.capacity.core.model.SignalPolicy;
import com.qqsuccubus.capacity.core.model.Target;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReactivePolicyEvaluatorTest {

    private static final Instant T0 = Instant.parse("2026-03-10T10:00:00Z");

    private SimpleMeterRegistry meterRegistry;
    private ReactivePolicyEvaluator evaluator;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        evaluator = new ReactivePolicyEvaluator(meterRegistry);
    }

    @Test
    void testSustainedHighCpu_ScalesUpAfterStabilizationWithStepLimit() {
        Target target = Targets.svcA().build();
        List<MetricSample> samples = new ArrayList<>();

        // 95% cpu every 15s for 90s against a 30% target: raw demand ceil(2 * 0.95 / 0.3) = 7
        for (int sec = 0; sec <= 45; sec += 15) {
            Instant now = T0.plusSeconds(sec);
            samples.add(sample("svc-A", "cpu", 0.95, now));
            ScalingProposal proposal = evaluator.evaluate(target, samples, now);
            assertNotNull(proposal);
            assertEquals(2, proposal.getCapacity(), "held while the 60s window is not covered at t=" + sec);
            assertTrue(proposal.getRationale().contains("pending stabilization"));
        }

        for (int sec = 60; sec <= 90; sec += 30) {
            Instant now = T0.plusSeconds(sec);
            samples.add(sample("svc-A", "cpu", 0.95, now));
            ScalingProposal proposal = evaluator.evaluate(target, samples, now);
            assertNotNull(proposal);
            assertEquals(4, proposal.getCapacity(), "step limit of 2 from current 2 at t=" + sec);
            assertEquals(ProposalOrigin.REACTIVE, proposal.getOrigin());
            assertEquals(1.0, proposal.getConfidence(), 1e-9);
            assertEquals(2 * 0.95 / 0.3, proposal.getDemand(), 1e-9);
            assertTrue(proposal.getRationale().startsWith("reactive: scale-up to 4 (step-limited from 7)"),
                proposal.getRationale());
        }
    }

    @Test
    void testFlappingSignal_NeverScales() {
        Target target = Targets.svcA().currentCapacity(4).build();

        // Alternates between raw 8 and raw 1 every cycle for ten minutes
        for (int sec = 0; sec <= 600; sec += 15) {
            Instant now = T0.plusSeconds(sec);
            double cpu = (sec / 15) % 2 == 0 ? 0.6 : 0.05;
            ScalingProposal proposal = evaluator.evaluate(target, List.of(sample("svc-A", "cpu", cpu, now)), now);
            assertNotNull(proposal);
            assertEquals(4, proposal.getCapacity(), "flapping must not move capacity at t=" + sec);
        }
    }

    @Test
    void testSustainedLowCpu_ScalesDownAfterFiveMinutesByPercentStep() {
        Target target = Targets.svcA().currentCapacity(4).build();

        for (int sec = 0; sec < 300; sec += 15) {
            Instant now = T0.plusSeconds(sec);
            ScalingProposal proposal = evaluator.evaluate(target, List.of(sample("svc-A", "cpu", 0.05, now)), now);
            assertEquals(4, proposal.getCapacity(), "held inside the scale-down window at t=" + sec);
        }

        Instant now = T0.plusSeconds(300);
        ScalingProposal proposal = evaluator.evaluate(target, List.of(sample("svc-A", "cpu", 0.05, now)), now);
        // raw 1, step max(1, floor(4 * 50%)) = 2
        assertEquals(2, proposal.getCapacity());
    }

    @Test
    void testAllSignalsStale_Abstains() {
        Target target = Targets.svcA().build();
        MetricSample stale = sample("svc-A", "cpu", 0.95, T0).asStale(T0.plusSeconds(15));

        assertNull(evaluator.evaluate(target, List.of(stale), T0.plusSeconds(15)));
        assertNull(evaluator.evaluate(target, List.of(), T0.plusSeconds(15)));
        assertEquals(2.0, meterRegistry.counter(MetricsNames.REACTIVE_EVALUATIONS_TOTAL, MetricsTags.DIRECTION, "abstain").count());
    }

    @Test
    void testOneStaleSignal_UsesLastKnownGoodWithLowerConfidence() {
        Target target = Targets.svcA().signal(Targets.memory(0.5)).build();
        Instant now = T0.plusSeconds(15);
        List<MetricSample> samples = List.of(
            sample("svc-A", "cpu", 0.3, now),
            MetricSample.builder().targetId("svc-A").signal("memory").value(1.5).timestamp(now)
                .freshness(SampleFreshness.STALE).build());

        ScalingProposal proposal = evaluator.evaluate(target, samples, now);

        assertNotNull(proposal);
        assertEquals(0.5, proposal.getConfidence(), 1e-9);
        // memory last-known-good dominates: 2 * 1.5 / 0.5 = 6
        assertEquals(6.0, proposal.getDemand(), 1e-9);
    }

    @Test
    void testLatencySignal_UsesP95() {
        SignalPolicy latency = SignalPolicy.builder()
            .name("p95_latency")
            .kind(SignalKind.LATENCY)
            .targetValue(0.2)
            .window(Duration.ofSeconds(60))
            .build();
        Target target = Targets.svcA().clearSignals().signal(latency).build();

        List<MetricSample> samples = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            samples.add(sample("svc-A", "p95_latency", i == 19 ? 1.0 : 0.1, T0.plusSeconds(i)));
        }
        ScalingProposal proposal = evaluator.evaluate(target, samples, T0.plusSeconds(20));

        assertNotNull(proposal);
        assertTrue(proposal.getDemand() > 2 * 0.1 / 0.2, "p95 must reflect the slow tail");
    }

    @Test
    void testAggregate_AverageAndP95() {
        List<Double> values = List.of(1.0, 2.0, 3.0, 4.0, 100.0);
        assertEquals(22.0, ReactivePolicyEvaluator.aggregate(values, SignalKind.Aggregation.AVERAGE), 1e-9);
        assertTrue(ReactivePolicyEvaluator.aggregate(values, SignalKind.Aggregation.P95) > 4.0);
    }

    private static MetricSample sample(String targetId, String signal, double value, Instant at) {
        return MetricSample.builder().targetId(targetId).signal(signal).value(value).timestamp(at).build();
    }
}
