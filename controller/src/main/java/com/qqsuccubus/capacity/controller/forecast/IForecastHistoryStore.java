package com.qqsuccubus.capacity.controller.forecast;

import com.qqsuccubus.capacity.core.model.MetricSample;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Append-only historical series per target and signal, queryable by time range.
 */
public interface IForecastHistoryStore {
    Mono<Void> append(MetricSample sample);

    /**
     * Samples with {@code from <= timestamp <= to}, oldest first.
     */
    Flux<MetricSample> range(String targetId, String signal, Instant from, Instant to);

    void close();
}
