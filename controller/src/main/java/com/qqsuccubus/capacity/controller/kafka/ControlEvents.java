package com.qqsuccubus.capacity.controller.kafka;

import com.qqsuccubus.capacity.core.model.DecisionLogEntry;
import com.qqsuccubus.capacity.core.msg.AlertType;
import com.qqsuccubus.capacity.core.msg.ControlMessages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Map;

/**
 * Builders for control messages, and delivery that never fails the calling pipeline.
 */
public final class ControlEvents {
    private static final Logger log = LoggerFactory.getLogger(ControlEvents.class);

    private ControlEvents() {
    }

    public static ControlMessages.Alert alert(
        AlertType type,
        ControlMessages.Severity severity,
        String targetId,
        String message,
        Map<String, Object> details,
        Instant at
    ) {
        return ControlMessages.Alert.builder()
            .type(type)
            .severity(severity)
            .targetId(targetId)
            .message(message)
            .details(details != null ? details : Map.of())
            .ts(at.toEpochMilli())
            .build();
    }

    public static ControlMessages.DecisionEvent decisionEvent(DecisionLogEntry entry) {
        return ControlMessages.DecisionEvent.builder()
            .targetId(entry.getTargetId())
            .previousCapacity(entry.getDecision().getPreviousCapacity())
            .capacity(entry.getDecision().getCapacity())
            .tier(entry.getDecision().getTier())
            .status(entry.getStatus())
            .rationale(entry.getRationale())
            .attempts(entry.getAttempts())
            .issuedAtMs(entry.getDecision().getIssuedAt().toEpochMilli())
            .recordedAtMs(entry.getRecordedAt().toEpochMilli())
            .build();
    }

    /**
     * Publishes an alert; a delivery failure is logged and does not propagate.
     */
    public static Mono<Void> fire(IControlPublisher publisher, ControlMessages.Alert alert) {
        return publisher.publishAlert(alert)
            .onErrorResume(err -> {
                log.warn("Alert {} for {} not delivered: {}", alert.getType(), alert.getTargetId(), err.getMessage());
                return Mono.empty();
            });
    }

    public static Mono<Void> audit(IControlPublisher publisher, DecisionLogEntry entry) {
        return publisher.publishDecision(decisionEvent(entry))
            .onErrorResume(err -> {
                log.warn("Decision event for {} not delivered: {}", entry.getTargetId(), err.getMessage());
                return Mono.empty();
            });
    }
}
