package com.qqsuccubus.capacity.controller.reactive;

import com.qqsuccubus.capacity.core.model.ScalingBehavior;

/**
 * Per-cycle change limits.
 * <p>
 * Growth takes whichever of the percent and pod policies allows the larger step. Shrinking follows the
 * percent policy alone, with a minimum step of one unit so a target can always reach its floor.
 * </p>
 */
public final class StepLimits {
    private StepLimits() {
    }

    public static int maxScaleUp(int current, ScalingBehavior behavior) {
        int byPercent = (int) Math.ceil(current * behavior.getScaleUpPercent() / 100.0);
        return Math.max(1, Math.max(byPercent, behavior.getScaleUpPods()));
    }

    public static int maxScaleDown(int current, ScalingBehavior behavior) {
        int byPercent = (int) Math.floor(current * behavior.getScaleDownPercent() / 100.0);
        return Math.max(1, byPercent);
    }
}
