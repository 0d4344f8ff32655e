package com.qqsuccubus.capacity.core.msg;

import com.qqsuccubus.capacity.core.model.DecisionStatus;
import com.qqsuccubus.capacity.core.model.DecisionTier;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.Map;

/**
 * Control messages published by the controller.
 * <p>
 * These flow over Kafka control topics as JSON and feed alerting and audit consumers.
 * </p>
 */
public final class ControlMessages {
    private ControlMessages() {
    }

    /**
     * Fire-and-forget notification for tier transitions, overrides, failures and reports.
     */
    @Value
    @Builder(toBuilder = true)
    @With
    public static class Alert {
        AlertType type;

        Severity severity;

        /**
         * Target the alert is about, {@code null} for controller-wide alerts.
         */
        String targetId;

        String message;

        /**
         * Free-form structured details (spend figures, recommendation lists).
         */
        Map<String, Object> details;

        /**
         * Timestamp when this alert was raised (epoch millis).
         */
        long ts;
    }

    /**
     * Audit record of one decision log entry.
     */
    @Value
    @Builder(toBuilder = true)
    public static class DecisionEvent {
        String targetId;

        int previousCapacity;

        int capacity;

        DecisionTier tier;

        DecisionStatus status;

        String rationale;

        int attempts;

        long issuedAtMs;

        long recordedAtMs;
    }

    public enum Severity {
        INFO,
        WARNING,
        CRITICAL
    }
}
