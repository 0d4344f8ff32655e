package com.qqsuccubus.capacity.core.model;

public enum DecisionStatus {
    APPLIED,

    /**
     * Same capacity as last applied; recorded but not sent to the orchestrator.
     */
    NO_OP,

    /**
     * Dropped because the target is still cooling down from its previous change.
     */
    SUPPRESSED_COOLDOWN,

    /**
     * The orchestrator rejected the change on every attempt.
     */
    FAILED
}
