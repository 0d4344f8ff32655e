package com.qqsuccubus.capacity.controller.metrics;

import com.qqsuccubus.capacity.core.model.MetricSample;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * What the aggregator knows about one target after a collection cycle.
 */
@Value
@Builder
public class SignalBundle {
    String targetId;

    /**
     * This cycle's reading per signal. Stale entries carry the last-known-good value; signals that never
     * produced a reading are absent.
     */
    @Singular("latest")
    Map<String, MetricSample> latestBySignal;

    /**
     * Buffered history of all signals, including this cycle's samples.
     */
    @Singular
    List<MetricSample> samples;

    /**
     * Consecutive cycles without any fresh sample.
     */
    int staleCycles;

    /**
     * Set when {@link #staleCycles} exceeded the staleness limit; the reactive evaluator must skip the
     * target this cycle.
     */
    boolean excluded;

    public long freshCount() {
        return latestBySignal.values().stream().filter(MetricSample::isFresh).count();
    }

    public List<MetricSample> samplesOf(String signal) {
        return samples.stream()
            .filter(s -> s.getSignal().equals(signal))
            .collect(Collectors.toList());
    }
}
