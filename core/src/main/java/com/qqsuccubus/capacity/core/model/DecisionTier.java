package com.qqsuccubus.capacity.core.model;

/**
 * How the cost governor shaped a decision.
 */
public enum DecisionTier {
    /**
     * Passed through unchanged.
     */
    NORMAL,

    /**
     * Growth held back by a warning-tier budget cap.
     */
    COST_CAPPED,

    /**
     * Forced under the emergency floor. Preempts the target's cooldown.
     */
    EMERGENCY
}
