package com.qqsuccubus.capacity.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Duration;

/**
 * Per-target scaling rule for one signal.
 * <p>
 * The reactive evaluator aggregates the signal over {@link #window} and derives
 * {@code ceil(current * observed / targetValue)} replicas from it.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
public class SignalPolicy {
    public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(60);

    /**
     * Signal name, unique per target (e.g. "cpu", "memory", "queue_depth", "p95_latency").
     */
    String name;

    SignalKind kind;

    /**
     * Desired value of the aggregated signal per replica (e.g. 0.6 for 60% CPU).
     */
    double targetValue;

    /**
     * Aggregation override. {@code null} means the kind's default.
     */
    SignalKind.Aggregation aggregation;

    /**
     * Aggregation window. {@code null} means {@link #DEFAULT_WINDOW}.
     */
    Duration window;

    /**
     * Metrics backend query. {@code {target}} is replaced with the target id.
     */
    String query;

    public SignalKind.Aggregation effectiveAggregation() {
        return aggregation != null ? aggregation : kind.getDefaultAggregation();
    }

    public Duration effectiveWindow() {
        return window != null ? window : DEFAULT_WINDOW;
    }
}
