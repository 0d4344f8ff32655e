package com.qqsuccubus.capacity.core.model;

/**
 * Category of a scaling signal. Decides the default windowed aggregation.
 */
public enum SignalKind {
    UTILIZATION(Aggregation.AVERAGE),
    LATENCY(Aggregation.P95),
    QUEUE_DEPTH(Aggregation.AVERAGE),
    CUSTOM(Aggregation.AVERAGE);

    private final Aggregation defaultAggregation;

    SignalKind(Aggregation defaultAggregation) {
        this.defaultAggregation = defaultAggregation;
    }

    public Aggregation getDefaultAggregation() {
        return defaultAggregation;
    }

    /**
     * Windowed aggregation applied to a signal before comparing it to its target.
     */
    public enum Aggregation {
        AVERAGE,
        P95
    }
}
