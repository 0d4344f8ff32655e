package com.qqsuccubus.capacity.controller.redis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.qqsuccubus.capacity.controller.cost.IBudgetStateStore;
import com.qqsuccubus.capacity.core.model.BudgetState;
import com.qqsuccubus.capacity.core.redis.Keys;
import com.qqsuccubus.capacity.core.util.JsonUtils;
import io.lettuce.core.RedisClient;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Budget state as one JSON string under {@link Keys#budgetState()}.
 */
public class RedisBudgetStateStore implements IBudgetStateStore {
    private static final Logger log = LoggerFactory.getLogger(RedisBudgetStateStore.class);

    private final RedisClient client;
    private final StatefulRedisConnection<String, String> connection;
    private final RedisReactiveCommands<String, String> commands;

    public RedisBudgetStateStore(String redisUrl) {
        this.client = RedisClient.create(redisUrl);
        this.connection = client.connect();
        this.commands = connection.reactive();
        log.info("Budget state stored in Redis: {}", redisUrl);
    }

    @Override
    public Mono<BudgetState> load() {
        return commands.get(Keys.budgetState())
            .flatMap(RedisBudgetStateStore::decode);
    }

    @Override
    public Mono<Void> save(BudgetState state) {
        return Mono.fromCallable(() -> JsonUtils.writeValueAsString(state))
            .flatMap(json -> commands.set(Keys.budgetState(), json))
            .then();
    }

    @Override
    public void close() {
        connection.close();
        client.shutdown();
    }

    /**
     * An unreadable value counts as nothing saved; the next evaluation overwrites it.
     */
    static Mono<BudgetState> decode(String json) {
        try {
            return Mono.just(JsonUtils.mapper().readValue(json, BudgetState.class));
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable budget state under {}: {}", Keys.budgetState(), e.getOriginalMessage());
            return Mono.empty();
        }
    }
}
