package com.qqsuccubus.capacity.controller.metrics;

import com.google.common.collect.EvictingQueue;
import com.qqsuccubus.capacity.core.model.MetricSample;
import com.qqsuccubus.capacity.core.model.SignalPolicy;
import com.qqsuccubus.capacity.core.model.Target;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded per-signal sample history of one target.
 * <p>
 * Each signal keeps at most {@link #getCapacity()} samples; the oldest is evicted on overflow.
 * </p>
 */
public class SampleRingBuffer {
    private final int capacity;
    private final Map<String, EvictingQueue<MetricSample>> bySignal = new HashMap<>();

    public SampleRingBuffer(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Samples needed to cover the longest stabilization or aggregation window of the target, and at
     * least {@code minWindow}, at the given polling interval.
     */
    public static int capacityFor(Target target, Duration pollInterval, Duration minWindow) {
        Duration longest = target.getBehavior().longestWindow();
        for (SignalPolicy signal : target.getSignals()) {
            if (signal.effectiveWindow().compareTo(longest) > 0) {
                longest = signal.effectiveWindow();
            }
        }
        if (minWindow.compareTo(longest) > 0) {
            longest = minWindow;
        }
        long pollMs = Math.max(1, pollInterval.toMillis());
        return (int) ((longest.toMillis() + pollMs - 1) / pollMs) + 1;
    }

    public int getCapacity() {
        return capacity;
    }

    public synchronized void append(MetricSample sample) {
        bySignal.computeIfAbsent(sample.getSignal(), s -> EvictingQueue.create(capacity)).add(sample);
    }

    /**
     * Most recent fresh sample of a signal, if any is still buffered.
     */
    public synchronized Optional<MetricSample> lastKnownGood(String signal) {
        EvictingQueue<MetricSample> queue = bySignal.get(signal);
        if (queue == null) {
            return Optional.empty();
        }
        MetricSample latest = null;
        for (MetricSample sample : queue) {
            if (sample.isFresh()) {
                latest = sample;
            }
        }
        return Optional.ofNullable(latest);
    }

    public synchronized List<MetricSample> samples(String signal) {
        EvictingQueue<MetricSample> queue = bySignal.get(signal);
        return queue == null ? List.of() : List.copyOf(queue);
    }

    public synchronized List<MetricSample> all() {
        List<MetricSample> out = new ArrayList<>();
        bySignal.values().forEach(out::addAll);
        return out;
    }
}
