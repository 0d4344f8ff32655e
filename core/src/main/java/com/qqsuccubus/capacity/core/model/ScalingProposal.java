package com.qqsuccubus.capacity.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Capacity proposed for a target in one cycle. Created each cycle and discarded after the decision.
 */
@Value
@Builder(toBuilder = true)
@With
public class ScalingProposal {
    String targetId;

    int capacity;

    ProposalOrigin origin;

    String rationale;

    /**
     * Self-assessed reliability in [0, 1].
     */
    double confidence;

    /**
     * Unconstrained demand in capacity units, before stabilization and step limits.
     */
    double demand;

    public Direction directionFrom(int currentCapacity) {
        if (capacity > currentCapacity) {
            return Direction.UP;
        }
        if (capacity < currentCapacity) {
            return Direction.DOWN;
        }
        return Direction.HOLD;
    }

    public static ScalingProposal hold(Target target, String rationale) {
        return ScalingProposal.builder()
            .targetId(target.getId())
            .capacity(target.getCurrentCapacity())
            .origin(ProposalOrigin.HOLD)
            .rationale(rationale)
            .confidence(1.0)
            .demand(target.getCurrentCapacity())
            .build();
    }

    public enum Direction {
        UP,
        DOWN,
        HOLD
    }
}
