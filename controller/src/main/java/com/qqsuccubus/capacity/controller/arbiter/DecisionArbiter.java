package com.qqsuccubus.capacity.controller.arbiter;

import com.qqsuccubus.capacity.core.model.ScalingProposal;
import com.qqsuccubus.capacity.core.model.ScalingProposal.Direction;
import com.qqsuccubus.capacity.core.model.Target;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Merges the reactive and predictive proposals of a target into one.
 * <p>
 * Rules, in order:
 * <ol>
 *   <li>neither proposal: hold current capacity</li>
 *   <li>one proposal: use it</li>
 *   <li>both scale up: the larger</li>
 *   <li>both scale down: the larger resulting capacity (gentler shrink)</li>
 *   <li>otherwise reactive, unless predictive confidence reaches the override threshold</li>
 * </ol>
 * The result is clamped to the target's bounds.
 * </p>
 */
public class DecisionArbiter {
    private static final Logger log = LoggerFactory.getLogger(DecisionArbiter.class);

    private final double overrideThreshold;

    public DecisionArbiter(double overrideThreshold) {
        this.overrideThreshold = overrideThreshold;
    }

    public ScalingProposal arbitrate(Target target, ScalingProposal reactive, ScalingProposal predictive) {
        ScalingProposal chosen = choose(target, reactive, predictive);
        int clamped = target.clamp(chosen.getCapacity());
        if (clamped == chosen.getCapacity()) {
            return chosen;
        }
        log.debug("Proposal for {} clamped from {} to {}", target.getId(), chosen.getCapacity(), clamped);
        return chosen.toBuilder()
            .capacity(clamped)
            .rationale(String.format(Locale.ROOT, "%s; clamped to [%d, %d]",
                chosen.getRationale(), target.getMinCapacity(), target.getMaxCapacity()))
            .build();
    }

    private ScalingProposal choose(Target target, ScalingProposal reactive, ScalingProposal predictive) {
        if (reactive == null && predictive == null) {
            return ScalingProposal.hold(target, "hold: no reactive or predictive opinion");
        }
        if (predictive == null) {
            return reactive;
        }
        if (reactive == null) {
            return predictive;
        }

        int current = target.getCurrentCapacity();
        Direction reactiveDir = reactive.directionFrom(current);
        Direction predictiveDir = predictive.directionFrom(current);

        if (reactiveDir == predictiveDir && reactiveDir != Direction.HOLD) {
            ScalingProposal larger = reactive.getCapacity() >= predictive.getCapacity() ? reactive : predictive;
            return annotate(larger, reactiveDir == Direction.UP
                ? "both scale up, larger wins"
                : "both scale down, gentler shrink wins");
        }
        if (reactiveDir == Direction.HOLD && predictiveDir == Direction.HOLD) {
            return reactive;
        }

        if (predictive.getConfidence() >= overrideThreshold) {
            return annotate(predictive, String.format(Locale.ROOT,
                "disagreement, predictive confidence %.2f overrides reactive %d",
                predictive.getConfidence(), reactive.getCapacity()));
        }
        return annotate(reactive, String.format(Locale.ROOT,
            "disagreement, reactive preferred over predictive %d (confidence %.2f)",
            predictive.getCapacity(), predictive.getConfidence()));
    }

    private static ScalingProposal annotate(ScalingProposal proposal, String note) {
        return proposal.withRationale(proposal.getRationale() + "; arbiter: " + note);
    }
}
