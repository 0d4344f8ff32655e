package com.qqsuccubus.capacity.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;

/**
 * Final capacity for a target, as issued by the cost governor to the action executor.
 */
@Value
@Builder(toBuilder = true)
@With
public class Decision {
    String targetId;

    int capacity;

    /**
     * Capacity the target was running at when the decision was issued.
     */
    int previousCapacity;

    DecisionTier tier;

    String rationale;

    Instant issuedAt;

    public boolean isEmergency() {
        return tier == DecisionTier.EMERGENCY;
    }
}
