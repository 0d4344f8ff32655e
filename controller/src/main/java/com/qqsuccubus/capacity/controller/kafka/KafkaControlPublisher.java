package com.qqsuccubus.capacity.controller.kafka;

import com.qqsuccubus.capacity.controller.config.ControllerConfig;
import com.qqsuccubus.capacity.core.msg.ControlMessages;
import com.qqsuccubus.capacity.core.msg.Topics;
import com.qqsuccubus.capacity.core.util.JsonUtils;
import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.errors.TopicExistsException;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.kafka.sender.KafkaSender;
import reactor.kafka.sender.SenderOptions;
import reactor.kafka.sender.SenderRecord;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Publishes alerts and decision events as JSON to the control topics.
 */
public class KafkaControlPublisher implements IControlPublisher {
    private static final Logger log = LoggerFactory.getLogger(KafkaControlPublisher.class);

    private final KafkaSender<String, String> sender;
    private final AdminClient adminClient;

    public KafkaControlPublisher(ControllerConfig config) {
        Map<String, Object> producerProps = new HashMap<>();
        producerProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
        producerProps.put(ProducerConfig.CLIENT_ID_CONFIG, config.getNodeId());
        producerProps.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.ACKS_CONFIG, "all");
        producerProps.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, "true");

        this.sender = KafkaSender.create(SenderOptions.create(producerProps));

        Map<String, Object> adminProps = new HashMap<>();
        adminProps.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
        this.adminClient = AdminClient.create(adminProps);

        createTopicIfNotExists(Topics.CONTROL_ALERTS, 1, (short) 1)
            .then(createTopicIfNotExists(Topics.CONTROL_DECISIONS, 4, (short) 1))
            .subscribe(
                v -> { },
                err -> log.error("Control topic setup failed; publishing will retry on first send", err)
            );
        log.info("Kafka control publisher initialized: {}", config.getKafkaBootstrap());
    }

    @Override
    public Mono<Void> publishAlert(ControlMessages.Alert alert) {
        ProducerRecord<String, String> record = new ProducerRecord<>(
            Topics.CONTROL_ALERTS,
            alert.getTargetId(),
            JsonUtils.writeValueAsString(alert)
        );

        return send(record)
            .doOnSuccess(v -> log.debug("Published alert: type={}, target={}", alert.getType(), alert.getTargetId()))
            .doOnError(err -> log.error("Failed to publish alert {}", alert.getType(), err));
    }

    @Override
    public Mono<Void> publishDecision(ControlMessages.DecisionEvent event) {
        // keyed by target so a target's history stays ordered within one partition
        ProducerRecord<String, String> record = new ProducerRecord<>(
            Topics.CONTROL_DECISIONS,
            event.getTargetId(),
            JsonUtils.writeValueAsString(event)
        );

        return send(record)
            .doOnError(err -> log.error("Failed to publish decision event for {}", event.getTargetId(), err));
    }

    private Mono<Void> send(ProducerRecord<String, String> record) {
        return sender.send(Mono.just(SenderRecord.create(record, null)))
            .next()
            .then();
    }

    private Mono<Void> createTopicIfNotExists(String topicName, int partitions, short replicationFactor) {
        return Mono.fromFuture(() -> adminClient.listTopics().names().toCompletionStage().toCompletableFuture())
            .flatMap(names -> {
                if (names.contains(topicName)) {
                    return Mono.empty();
                }

                return Mono.fromFuture(() -> {
                    log.info("Creating Kafka topic: {} (partitions={}, replication={})",
                        topicName, partitions, replicationFactor);

                    return adminClient.createTopics(Collections.singleton(new NewTopic(topicName, partitions, replicationFactor)))
                        .all()
                        .toCompletionStage()
                        .toCompletableFuture();
                });
            })
            .onErrorResume(error -> {
                if (error.getCause() instanceof TopicExistsException) {
                    log.info("Kafka topic already exists: {}", topicName);
                    return Mono.empty();
                }
                return Mono.error(error);
            })
            .then();
    }

    @Override
    public void close() {
        sender.close();
        adminClient.close();
        log.info("Kafka control publisher closed");
    }
}
