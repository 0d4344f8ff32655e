package com.qqsuccubus.capacity.controller.forecast;

import com.qqsuccubus.capacity.core.model.MetricSample;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Process-local history, used when no Redis URL is configured. Lost on restart, so the forecaster
 * needs a full training window of uptime before it can propose anything.
 */
public class InMemoryForecastHistoryStore implements IForecastHistoryStore {

    private final Duration retention;
    private final Map<String, NavigableMap<Instant, MetricSample>> series = new ConcurrentHashMap<>();

    public InMemoryForecastHistoryStore(Duration retention) {
        this.retention = retention;
    }

    @Override
    public Mono<Void> append(MetricSample sample) {
        return Mono.fromRunnable(() -> {
            NavigableMap<Instant, MetricSample> points = series.computeIfAbsent(
                key(sample.getTargetId(), sample.getSignal()), k -> new ConcurrentSkipListMap<>());
            points.put(sample.getTimestamp(), sample);
            points.headMap(sample.getTimestamp().minus(retention), false).clear();
        });
    }

    @Override
    public Flux<MetricSample> range(String targetId, String signal, Instant from, Instant to) {
        return Flux.defer(() -> {
            NavigableMap<Instant, MetricSample> points = series.get(key(targetId, signal));
            if (points == null) {
                return Flux.empty();
            }
            return Flux.fromIterable(List.copyOf(points.subMap(from, true, to, true).values()));
        });
    }

    @Override
    public void close() {
        series.clear();
    }

    private static String key(String targetId, String signal) {
        return targetId + ":" + signal;
    }
}
