package com.qqsuccubus.capacity.core.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.Map;

/**
 * Static budget configuration consumed by the cost governor.
 */
@Value
@Builder(toBuilder = true)
public class BudgetPolicy {
    /**
     * Budget per horizon. Horizons without an entry are not governed.
     */
    @Singular
    Map<SpendHorizon, Double> budgets;

    /**
     * Fraction of budget at which the warning tier starts.
     */
    @Builder.Default
    double warningRatio = 0.8;

    /**
     * Capacity non-critical targets are forced down to in the emergency tier.
     */
    @Builder.Default
    int emergencyFloor = 1;

    /**
     * Spend must stay below the warning threshold this long before the tier drops back to normal.
     */
    @Builder.Default
    Duration deEscalationWindow = Duration.ofMinutes(15);

    /**
     * Hold non-critical scale-ups at current capacity while in the warning tier.
     */
    boolean freezeScaleUpInWarning;

    public double warningThreshold(SpendHorizon horizon) {
        return budgets.getOrDefault(horizon, Double.POSITIVE_INFINITY) * warningRatio;
    }
}
