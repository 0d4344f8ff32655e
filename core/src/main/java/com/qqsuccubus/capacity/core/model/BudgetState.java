package com.qqsuccubus.capacity.core.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * Snapshot of spend against budget. Replaced as a whole on every cost evaluation and persisted so the
 * next leader starts from the same tier.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@With
public class BudgetState {
    /**
     * Spend so far in the current period of each horizon.
     */
    @Singular("spend")
    Map<SpendHorizon, Double> spendToDate;

    /**
     * Spend expected by the end of the current period at the current hourly rate.
     */
    @Singular("projected")
    Map<SpendHorizon, Double> projectedSpend;

    /**
     * Estimated spend rate of all registered targets, per hour.
     */
    double hourlyRate;

    BudgetTier tier;

    Instant tierSince;

    /**
     * Consecutive evaluations below the warning threshold while {@link #tier} is raised. Drives de-escalation.
     */
    int consecutiveBelowTier;

    /**
     * False when the billing source could not be read during the last evaluation.
     */
    @Builder.Default
    boolean dataAvailable = true;

    Instant evaluatedAt;

    public static BudgetState initial(Instant now) {
        return BudgetState.builder()
            .tier(BudgetTier.NORMAL)
            .tierSince(now)
            .evaluatedAt(now)
            .build();
    }
}
