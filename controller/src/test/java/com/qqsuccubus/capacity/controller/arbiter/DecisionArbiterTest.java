package com.qqsuccubus.capacity.controller.arbiter;

import com.qqsuccubus.capacity.controller.support.Targets;
import com.qqsuccubus.capacity.core.model.ProposalOrigin;
import com.qqsuccubus.capacity.core.model.ScalingProposal;
import com.qqsuccubus.capacity.core.model.Target;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DecisionArbiterTest {

    private final DecisionArbiter arbiter = new DecisionArbiter(0.95);

    // svc-A runs 2 replicas within [1, 10]
    private final Target target = Targets.svcA().build();

    @Test
    void testNoOpinions_HoldsCurrent() {
        ScalingProposal result = arbiter.arbitrate(target, null, null);

        assertEquals(2, result.getCapacity());
        assertEquals(ProposalOrigin.HOLD, result.getOrigin());
    }

    @Test
    void testSingleOpinion_Used() {
        ScalingProposal reactive = proposal(ProposalOrigin.REACTIVE, 4, 1.0);
        ScalingProposal predictive = proposal(ProposalOrigin.PREDICTIVE, 6, 0.85);

        assertSame(reactive, arbiter.arbitrate(target, reactive, null));
        assertSame(predictive, arbiter.arbitrate(target, null, predictive));
    }

    @Test
    void testBothUp_LargerWins() {
        ScalingProposal result = arbiter.arbitrate(target,
            proposal(ProposalOrigin.REACTIVE, 4, 1.0),
            proposal(ProposalOrigin.PREDICTIVE, 6, 0.85));

        assertEquals(6, result.getCapacity());
        assertEquals(ProposalOrigin.PREDICTIVE, result.getOrigin());
        assertTrue(result.getRationale().contains("both scale up"));
    }

    @Test
    void testBothDown_GentlerShrinkWins() {
        Target running8 = Targets.svcA().currentCapacity(8).build();

        ScalingProposal result = arbiter.arbitrate(running8,
            proposal(ProposalOrigin.REACTIVE, 4, 1.0),
            proposal(ProposalOrigin.PREDICTIVE, 6, 0.9));

        assertEquals(6, result.getCapacity());
        assertTrue(result.getRationale().contains("gentler shrink"));
    }

    @Test
    void testDisagreement_ReactiveUnlessPredictiveVeryConfident() {
        ScalingProposal up = proposal(ProposalOrigin.REACTIVE, 4, 1.0);
        ScalingProposal down = proposal(ProposalOrigin.PREDICTIVE, 1, 0.9);

        ScalingProposal reactiveWins = arbiter.arbitrate(target, up, down);
        assertEquals(4, reactiveWins.getCapacity());
        assertEquals(ProposalOrigin.REACTIVE, reactiveWins.getOrigin());

        ScalingProposal predictiveWins = arbiter.arbitrate(target, up, down.withConfidence(0.95));
        assertEquals(1, predictiveWins.getCapacity());
        assertTrue(predictiveWins.getRationale().contains("overrides reactive 4"));
    }

    @Test
    void testHoldVersusScale_TreatedAsDisagreement() {
        ScalingProposal hold = proposal(ProposalOrigin.REACTIVE, 2, 1.0);

        assertEquals(2, arbiter.arbitrate(target, hold, proposal(ProposalOrigin.PREDICTIVE, 5, 0.9)).getCapacity());
        assertEquals(5, arbiter.arbitrate(target, hold, proposal(ProposalOrigin.PREDICTIVE, 5, 0.97)).getCapacity());
    }

    @Test
    void testResult_ClampedToBounds() {
        ScalingProposal result = arbiter.arbitrate(target, proposal(ProposalOrigin.REACTIVE, 25, 1.0), null);

        assertEquals(10, result.getCapacity());
        assertTrue(result.getRationale().endsWith("clamped to [1, 10]"));
    }

    @Test
    void testRandomProposals_AlwaysWithinBounds() {
        Random random = new Random(42);
        for (int i = 0; i < 1_000; i++) {
            int min = random.nextInt(5);
            int max = min + random.nextInt(20);
            Target t = Targets.svcA().minCapacity(min).maxCapacity(max)
                .currentCapacity(min + random.nextInt(max - min + 1)).build();
            ScalingProposal reactive = random.nextBoolean()
                ? proposal(ProposalOrigin.REACTIVE, random.nextInt(50), 1.0) : null;
            ScalingProposal predictive = random.nextBoolean()
                ? proposal(ProposalOrigin.PREDICTIVE, random.nextInt(50), random.nextDouble()) : null;

            int capacity = arbiter.arbitrate(t, reactive, predictive).getCapacity();

            assertTrue(capacity >= min && capacity <= max,
                String.format("capacity %d outside [%d, %d]", capacity, min, max));
        }
    }

    private static ScalingProposal proposal(ProposalOrigin origin, int capacity, double confidence) {
        return ScalingProposal.builder()
            .targetId("svc-A")
            .capacity(capacity)
            .origin(origin)
            .rationale(origin.name().toLowerCase())
            .confidence(confidence)
            .demand(capacity)
            .build();
    }
}
