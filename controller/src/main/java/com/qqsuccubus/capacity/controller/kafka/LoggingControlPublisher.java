package com.qqsuccubus.capacity.controller.kafka;

import com.qqsuccubus.capacity.core.msg.ControlMessages;
import com.qqsuccubus.capacity.core.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Used when no Kafka bootstrap is configured: alerts and decision events only go to the log.
 */
public class LoggingControlPublisher implements IControlPublisher {
    private static final Logger log = LoggerFactory.getLogger(LoggingControlPublisher.class);

    @Override
    public Mono<Void> publishAlert(ControlMessages.Alert alert) {
        return Mono.fromRunnable(() -> {
            switch (alert.getSeverity()) {
                case CRITICAL:
                    log.error("ALERT {}", JsonUtils.writeValueAsString(alert));
                    break;
                case WARNING:
                    log.warn("ALERT {}", JsonUtils.writeValueAsString(alert));
                    break;
                default:
                    log.info("ALERT {}", JsonUtils.writeValueAsString(alert));
            }
        });
    }

    @Override
    public Mono<Void> publishDecision(ControlMessages.DecisionEvent event) {
        return Mono.fromRunnable(() -> log.info("DECISION {}", JsonUtils.writeValueAsString(event)));
    }

    @Override
    public void close() {
        log.debug("Logging control publisher closed");
    }
}
