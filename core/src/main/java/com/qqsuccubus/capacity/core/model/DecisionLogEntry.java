package com.qqsuccubus.capacity.core.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Append-only record of what happened to a decision.
 */
@Value
@Builder
public class DecisionLogEntry {
    Decision decision;

    DecisionStatus status;

    /**
     * Rationale of the decision plus the outcome detail (failure cause, cooldown remaining).
     */
    String rationale;

    int attempts;

    Instant recordedAt;

    public String getTargetId() {
        return decision.getTargetId();
    }
}
