package com.qqsuccubus.capacity.controller.metrics;

import com.qqsuccubus.capacity.core.model.SignalPolicy;
import com.qqsuccubus.capacity.core.model.Target;
import reactor.core.publisher.Mono;

/**
 * Pull API for the current value of one signal of one target.
 * <p>
 * An error or an empty result both mean "no reading this cycle"; the aggregator then falls back to the
 * last-known-good sample.
 * </p>
 */
public interface IMetricsSource {
    Mono<Double> fetch(Target target, SignalPolicy signal);
}
