package com.qqsuccubus.capacity.controller.redis;

import com.qqsuccubus.capacity.controller.forecast.IForecastHistoryStore;
import com.qqsuccubus.capacity.core.model.MetricSample;
import com.qqsuccubus.capacity.core.redis.Keys;
import io.lettuce.core.Range;
import io.lettuce.core.RedisClient;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;

/**
 * Forecast history in Redis sorted sets, one per target and signal (see {@link Keys#history}).
 * <p>
 * Each append trims the set to the retention window, so the set never outgrows one training window.
 * </p>
 */
public class RedisForecastHistoryStore implements IForecastHistoryStore {
    private static final Logger log = LoggerFactory.getLogger(RedisForecastHistoryStore.class);

    private final RedisClient client;
    private final StatefulRedisConnection<String, String> connection;
    private final RedisReactiveCommands<String, String> commands;
    private final Duration retention;

    public RedisForecastHistoryStore(String redisUrl, Duration retention) {
        this.client = RedisClient.create(redisUrl);
        this.connection = client.connect();
        this.commands = connection.reactive();
        this.retention = retention;
        log.info("Connected to Redis: {}", redisUrl);
    }

    @Override
    public Mono<Void> append(MetricSample sample) {
        String key = Keys.history(sample.getTargetId(), sample.getSignal());
        long ts = sample.getTimestamp().toEpochMilli();
        long cutoff = sample.getTimestamp().minus(retention).toEpochMilli();

        return commands.zadd(key, (double) ts, member(ts, sample.getValue()))
            .then(commands.zremrangebyscore(key, Range.from(Range.Boundary.unbounded(), Range.Boundary.excluding(cutoff))))
            .then();
    }

    @Override
    public Flux<MetricSample> range(String targetId, String signal, Instant from, Instant to) {
        return commands.zrangebyscore(Keys.history(targetId, signal), Range.create(from.toEpochMilli(), to.toEpochMilli()))
            .concatMap(member -> parse(targetId, signal, member));
    }

    @Override
    public void close() {
        connection.close();
        client.shutdown();
        log.info("Redis connection closed");
    }

    static String member(long epochMillis, double value) {
        return epochMillis + ":" + value;
    }

    static Mono<MetricSample> parse(String targetId, String signal, String member) {
        int sep = member.indexOf(':');
        if (sep <= 0) {
            log.warn("Skipping malformed history member {} for {}/{}", member, targetId, signal);
            return Mono.empty();
        }
        try {
            return Mono.just(MetricSample.builder()
                .targetId(targetId)
                .signal(signal)
                .timestamp(Instant.ofEpochMilli(Long.parseLong(member.substring(0, sep))))
                .value(Double.parseDouble(member.substring(sep + 1)))
                .build());
        } catch (NumberFormatException e) {
            log.warn("Skipping malformed history member {} for {}/{}", member, targetId, signal);
            return Mono.empty();
        }
    }
}
