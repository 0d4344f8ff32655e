package com.qqsuccubus.capacity.controller.kafka;

import com.qqsuccubus.capacity.core.msg.ControlMessages;
import reactor.core.publisher.Mono;

/**
 * Outbound channel for alerts and decision audit events (Dependency Inversion Principle).
 */
public interface IControlPublisher {
    Mono<Void> publishAlert(ControlMessages.Alert alert);
    Mono<Void> publishDecision(ControlMessages.DecisionEvent event);
    void close();
}
