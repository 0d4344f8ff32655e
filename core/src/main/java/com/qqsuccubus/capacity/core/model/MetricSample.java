package com.qqsuccubus.capacity.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;

/**
 * One reading of one signal for one target. Immutable once recorded.
 */
@Value
@Builder(toBuilder = true)
@With
public class MetricSample {
    /**
     * Signal name of the demand feedback series recorded by the decision pipeline.
     */
    public static final String DEMAND_SIGNAL = "demand";

    String targetId;

    String signal;

    double value;

    Instant timestamp;

    @Builder.Default
    SampleFreshness freshness = SampleFreshness.FRESH;

    public boolean isFresh() {
        return freshness == SampleFreshness.FRESH;
    }

    public MetricSample asStale(Instant at) {
        return toBuilder().timestamp(at).freshness(SampleFreshness.STALE).build();
    }
}
