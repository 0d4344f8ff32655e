package com.qqsuccubus.capacity.controller.cost;

import com.qqsuccubus.capacity.controller.config.ControllerConfig;
import com.qqsuccubus.capacity.controller.support.RecordingPublisher;
import com.qqsuccubus.capacity.controller.support.StubCostDataSource;
import com.qqsuccubus.capacity.controller.support.Targets;
import com.qqsuccubus.capacity.core.metrics.MetricsNames;
import com.qqsuccubus.capacity.core.model.BudgetPolicy;
import com.qqsuccubus.capacity.core.model.BudgetState;
import com.qqsuccubus.capacity.core.model.BudgetTier;
import com.qqsuccubus.capacity.core.model.Decision;
import com.qqsuccubus.capacity.core.model.DecisionTier;
import com.qqsuccubus.capacity.core.model.ProposalOrigin;
import com.qqsuccubus.capacity.core.model.ScalingProposal;
import com.qqsuccubus.capacity.core.model.SpendHorizon;
import com.qqsuccubus.capacity.core.model.Target;
import com.qqsuccubus.capacity.core.msg.AlertType;
import com.qqsuccubus.capacity.core.msg.ControlMessages;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CostGovernorTest {

    private static final Instant T0 = Instant.parse("2026-03-10T10:00:00Z");

    private StubCostDataSource costData;
    private RecordingPublisher publisher;
    private SimpleMeterRegistry meterRegistry;
    private CostGovernor governor;

    // Free targets keep the projected spend equal to the billed spend
    private final List<Target> freeTargets = List.of(Targets.svcA().unitCostPerHour(0.0).build());

    @BeforeEach
    void setUp() {
        costData = new StubCostDataSource();
        publisher = new RecordingPublisher();
        meterRegistry = new SimpleMeterRegistry();
        governor = governor(BudgetPolicy.builder()
            .budget(SpendHorizon.DAY, 100.0)
            .deEscalationWindow(Duration.ofMinutes(5))
            .build());
    }

    @Test
    void testDeEscalationEvaluations_RoundedUp() {
        assertEquals(5, governor.deEscalationEvaluations());
        assertEquals(1, governor(BudgetPolicy.builder().deEscalationWindow(Duration.ZERO).build())
            .deEscalationEvaluations());
        assertEquals(3, governor(BudgetPolicy.builder().deEscalationWindow(Duration.ofSeconds(150)).build())
            .deEscalationEvaluations());
    }

    @Test
    void testOverspend_EscalatesImmediately() {
        costData.spend = 150.0;

        BudgetState state = governor.evaluate(freeTargets, T0).block();

        assertEquals(BudgetTier.EMERGENCY, state.getTier());
        assertEquals(150.0, state.getSpendToDate().get(SpendHorizon.DAY), 1e-9);
        List<ControlMessages.Alert> transitions = publisher.alertsOf(AlertType.TIER_TRANSITION);
        assertEquals(1, transitions.size());
        assertEquals(ControlMessages.Severity.CRITICAL, transitions.get(0).getSeverity());
        assertEquals(2.0, meterRegistry.get(MetricsNames.GOVERNOR_BUDGET_TIER).gauge().value());
    }

    @Test
    void testWarningThreshold_EscalatesToWarning() {
        costData.spend = 85.0;

        assertEquals(BudgetTier.WARNING, governor.evaluate(freeTargets, T0).block().getTier());
        assertEquals(ControlMessages.Severity.WARNING,
            publisher.alertsOf(AlertType.TIER_TRANSITION).get(0).getSeverity());
    }

    @Test
    void testDeEscalation_NeedsFullWindowOfCalmEvaluations() {
        costData.spend = 150.0;
        governor.evaluate(freeTargets, T0).block();

        costData.spend = 10.0;
        for (int i = 1; i <= 4; i++) {
            BudgetState state = governor.evaluate(freeTargets, T0.plus(Duration.ofMinutes(i))).block();
            assertEquals(BudgetTier.EMERGENCY, state.getTier(), "still emergency after " + i + " calm evaluations");
            assertEquals(i, state.getConsecutiveBelowTier());
        }

        BudgetState state = governor.evaluate(freeTargets, T0.plus(Duration.ofMinutes(5))).block();
        assertEquals(BudgetTier.NORMAL, state.getTier());
        assertEquals(T0.plus(Duration.ofMinutes(5)), state.getTierSince());
        assertEquals(0, state.getConsecutiveBelowTier());

        List<ControlMessages.Alert> transitions = publisher.alertsOf(AlertType.TIER_TRANSITION);
        assertEquals(2, transitions.size());
        assertEquals(ControlMessages.Severity.INFO, transitions.get(1).getSeverity());
    }

    @Test
    void testWarningLevelSpend_NeverLowersEmergency() {
        costData.spend = 150.0;
        governor.evaluate(freeTargets, T0).block();

        // 90 is below the budget but above the warning threshold of 80
        costData.spend = 90.0;
        for (int i = 1; i <= 10; i++) {
            BudgetState state = governor.evaluate(freeTargets, T0.plus(Duration.ofMinutes(i))).block();
            assertEquals(BudgetTier.EMERGENCY, state.getTier(), "warning-level spend at evaluation " + i);
            assertEquals(0, state.getConsecutiveBelowTier());
        }
        assertEquals(1, publisher.alertsOf(AlertType.TIER_TRANSITION).size());
    }

    @Test
    void testWarningLevelSpend_RestartsCalmCount() {
        costData.spend = 150.0;
        governor.evaluate(freeTargets, T0).block();
        int minute = 0;

        costData.spend = 90.0;
        for (int i = 0; i < 4; i++) {
            governor.evaluate(freeTargets, T0.plus(Duration.ofMinutes(++minute))).block();
        }
        // one calm evaluation after a warning-level stretch does not end the emergency
        costData.spend = 10.0;
        BudgetState afterOneCalm = governor.evaluate(freeTargets, T0.plus(Duration.ofMinutes(++minute))).block();
        assertEquals(BudgetTier.EMERGENCY, afterOneCalm.getTier());
        assertEquals(1, afterOneCalm.getConsecutiveBelowTier());

        for (int i = 0; i < 3; i++) {
            governor.evaluate(freeTargets, T0.plus(Duration.ofMinutes(++minute))).block();
        }
        costData.spend = 90.0;
        BudgetState interrupted = governor.evaluate(freeTargets, T0.plus(Duration.ofMinutes(++minute))).block();
        assertEquals(BudgetTier.EMERGENCY, interrupted.getTier());
        assertEquals(0, interrupted.getConsecutiveBelowTier());

        costData.spend = 10.0;
        for (int i = 1; i <= 4; i++) {
            assertEquals(BudgetTier.EMERGENCY,
                governor.evaluate(freeTargets, T0.plus(Duration.ofMinutes(++minute))).block().getTier());
        }
        BudgetState recovered = governor.evaluate(freeTargets, T0.plus(Duration.ofMinutes(++minute))).block();
        assertEquals(BudgetTier.NORMAL, recovered.getTier());
    }

    @Test
    void testWarningTier_DropsToNormalOnlyAfterFullCalmWindow() {
        costData.spend = 85.0;
        governor.evaluate(freeTargets, T0).block();

        costData.spend = 10.0;
        for (int i = 1; i <= 4; i++) {
            assertEquals(BudgetTier.WARNING,
                governor.evaluate(freeTargets, T0.plus(Duration.ofMinutes(i))).block().getTier());
        }
        assertEquals(BudgetTier.NORMAL,
            governor.evaluate(freeTargets, T0.plus(Duration.ofMinutes(5))).block().getTier());
    }

    @Test
    void testRelapseDuringCalm_ResetsCounter() {
        costData.spend = 150.0;
        governor.evaluate(freeTargets, T0).block();

        costData.spend = 10.0;
        governor.evaluate(freeTargets, T0.plus(Duration.ofMinutes(1))).block();
        governor.evaluate(freeTargets, T0.plus(Duration.ofMinutes(2))).block();
        costData.spend = 150.0;
        BudgetState relapsed = governor.evaluate(freeTargets, T0.plus(Duration.ofMinutes(3))).block();

        assertEquals(BudgetTier.EMERGENCY, relapsed.getTier());
        assertEquals(0, relapsed.getConsecutiveBelowTier());
    }

    @Test
    void testRestore_AdoptsMoreSevereSavedTier() {
        Instant since = T0.minus(Duration.ofMinutes(20));
        BudgetState saved = BudgetState.initial(since).withTier(BudgetTier.EMERGENCY).withConsecutiveBelowTier(2);

        BudgetState restored = governor.restore(saved);

        assertEquals(BudgetTier.EMERGENCY, restored.getTier());
        assertEquals(since, governor.currentState().getTierSince());
        assertEquals(2, governor.currentState().getConsecutiveBelowTier());

        // the calm streak carries over: three more calm evaluations finish the window
        costData.spend = 10.0;
        for (int i = 1; i <= 2; i++) {
            governor.evaluate(freeTargets, T0.plus(Duration.ofMinutes(i))).block();
        }
        assertEquals(BudgetTier.EMERGENCY, governor.currentState().getTier());
        assertEquals(BudgetTier.NORMAL, governor.evaluate(freeTargets, T0.plus(Duration.ofMinutes(3))).block().getTier());
    }

    @Test
    void testRestore_NeverLowersHeldTier() {
        costData.spend = 150.0;
        governor.evaluate(freeTargets, T0).block();

        BudgetState kept = governor.restore(BudgetState.initial(T0.minus(Duration.ofHours(1)))
            .withTier(BudgetTier.WARNING));

        assertEquals(BudgetTier.EMERGENCY, kept.getTier());
        assertEquals(T0, governor.currentState().getTierSince());
    }

    @Test
    void testBillingUnavailable_HoldsTierAlertsOnceAndResetsCalm() {
        costData.spend = 150.0;
        governor.evaluate(freeTargets, T0).block();
        costData.spend = 10.0;
        for (int i = 1; i <= 3; i++) {
            governor.evaluate(freeTargets, T0.plus(Duration.ofMinutes(i))).block();
        }

        costData.unavailable = true;
        for (int i = 4; i <= 10; i++) {
            BudgetState state = governor.evaluate(freeTargets, T0.plus(Duration.ofMinutes(i))).block();
            assertEquals(BudgetTier.EMERGENCY, state.getTier());
            assertFalse(state.isDataAvailable());
            assertEquals(0, state.getConsecutiveBelowTier());
        }
        assertEquals(1, publisher.alertsOf(AlertType.BUDGET_DATA_UNAVAILABLE).size());

        // the calm count starts over once billing is back
        costData.unavailable = false;
        for (int i = 11; i <= 14; i++) {
            assertEquals(BudgetTier.EMERGENCY,
                governor.evaluate(freeTargets, T0.plus(Duration.ofMinutes(i))).block().getTier());
        }
        assertEquals(BudgetTier.NORMAL,
            governor.evaluate(freeTargets, T0.plus(Duration.ofMinutes(15))).block().getTier());
    }

    @Test
    void testBillingUnavailable_StillEscalatesOnEstimate() {
        governor = governor(BudgetPolicy.builder().budget(SpendHorizon.HOUR, 50.0).build());
        costData.unavailable = true;
        // 10 units at 10/h: 100/h projected over the full hour against a budget of 50
        Target expensive = Targets.svcA().currentCapacity(10).unitCostPerHour(10.0).build();

        BudgetState state = governor.evaluate(List.of(expensive), T0).block();

        assertEquals(BudgetTier.EMERGENCY, state.getTier());
        assertEquals(100.0, state.getHourlyRate(), 1e-9);
        assertEquals(100.0, state.getProjectedSpend().get(SpendHorizon.HOUR), 1e-9);
        assertFalse(state.isDataAvailable());
    }

    @Test
    void testEmergencyTier_CapsNonCriticalAtFloorWithOverrideAlert() {
        Target target = Targets.svcA().build();
        BudgetState emergency = BudgetState.initial(T0).withTier(BudgetTier.EMERGENCY);

        Decision decision = governor.govern(target, proposal(4), emergency, T0);

        assertEquals(1, decision.getCapacity());
        assertEquals(2, decision.getPreviousCapacity());
        assertEquals(DecisionTier.EMERGENCY, decision.getTier());
        assertEquals(CostGovernor.EMERGENCY_RATIONALE, decision.getRationale());
        assertEquals(1, publisher.alertsOf(AlertType.COST_OVERRIDE).size());
        assertEquals(ControlMessages.Severity.CRITICAL, publisher.alertsOf(AlertType.COST_OVERRIDE).get(0).getSeverity());
    }

    @Test
    void testEmergencyTier_ProposalUnderFloorKeepsRationale() {
        Target target = Targets.svcA().emergencyFloor(3).build();
        BudgetState emergency = BudgetState.initial(T0).withTier(BudgetTier.EMERGENCY);

        Decision decision = governor.govern(target, proposal(2), emergency, T0);

        assertEquals(2, decision.getCapacity());
        assertEquals(DecisionTier.EMERGENCY, decision.getTier());
        assertTrue(decision.getRationale().endsWith("within emergency floor 3"));
        assertTrue(publisher.alertsOf(AlertType.COST_OVERRIDE).isEmpty());
    }

    @Test
    void testEmergencyTier_CriticalTargetUntouched() {
        Target critical = Targets.svcA().critical(true).build();
        BudgetState emergency = BudgetState.initial(T0).withTier(BudgetTier.EMERGENCY);

        Decision decision = governor.govern(critical, proposal(8), emergency, T0);

        assertEquals(8, decision.getCapacity());
        assertEquals(DecisionTier.NORMAL, decision.getTier());
    }

    @Test
    void testEmergencyTier_NeverAboveFloorForRandomTargets() {
        Random random = new Random(7);
        BudgetState emergency = BudgetState.initial(T0).withTier(BudgetTier.EMERGENCY);
        for (int i = 0; i < 500; i++) {
            int min = random.nextInt(6);
            int max = min + random.nextInt(30);
            Integer floor = random.nextBoolean() ? null : random.nextInt(5);
            Target target = Targets.svcA()
                .minCapacity(min)
                .maxCapacity(max)
                .currentCapacity(min + random.nextInt(max - min + 1))
                .emergencyFloor(floor)
                .build();
            int effectiveFloor = floor != null ? floor : 1;

            Decision decision = governor.govern(target, proposal(random.nextInt(60)), emergency, T0);

            assertTrue(decision.getCapacity() <= effectiveFloor,
                String.format("capacity %d above floor %d", decision.getCapacity(), effectiveFloor));
            assertTrue(decision.getCapacity() >= Math.min(min, effectiveFloor));
        }
    }

    @Test
    void testWarningTier_FreezesScaleUpWhenConfigured() {
        governor = governor(BudgetPolicy.builder().budget(SpendHorizon.DAY, 100.0).freezeScaleUpInWarning(true).build());
        Target target = Targets.svcA().build();
        BudgetState warning = BudgetState.initial(T0).withTier(BudgetTier.WARNING);

        Decision up = governor.govern(target, proposal(4), warning, T0);
        assertEquals(2, up.getCapacity());
        assertEquals(DecisionTier.COST_CAPPED, up.getTier());

        Decision down = governor.govern(target, proposal(1), warning, T0);
        assertEquals(1, down.getCapacity());
        assertEquals(DecisionTier.NORMAL, down.getTier());
    }

    @Test
    void testNormalTier_PassesProposalThrough() {
        Decision decision = governor.govern(Targets.svcA().build(), proposal(4), BudgetState.initial(T0), T0);

        assertEquals(4, decision.getCapacity());
        assertEquals(DecisionTier.NORMAL, decision.getTier());
        assertEquals("reactive: scale-up to 4", decision.getRationale());
        assertEquals(T0, decision.getIssuedAt());
    }

    private CostGovernor governor(BudgetPolicy policy) {
        return new CostGovernor(ControllerConfig.defaults(), policy, costData, publisher, meterRegistry, T0);
    }

    private static ScalingProposal proposal(int capacity) {
        return ScalingProposal.builder()
            .targetId("svc-A")
            .capacity(capacity)
            .origin(ProposalOrigin.REACTIVE)
            .rationale("reactive: scale-up to " + capacity)
            .confidence(1.0)
            .demand(capacity)
            .build();
    }
}
