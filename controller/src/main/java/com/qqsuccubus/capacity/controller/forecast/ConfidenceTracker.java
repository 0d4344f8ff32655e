package com.qqsuccubus.capacity.controller.forecast;

import com.google.common.collect.EvictingQueue;

import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Out-of-sample accuracy per target: {@code 1 - EW-MAPE} over the last N prediction errors.
 */
public class ConfidenceTracker {
    private final int window;
    private final double alpha;
    private final int minEvaluations;
    private final Map<String, EvictingQueue<Double>> errors = new ConcurrentHashMap<>();

    public ConfidenceTracker(int window, double alpha, int minEvaluations) {
        this.window = window;
        this.alpha = alpha;
        this.minEvaluations = minEvaluations;
    }

    public void record(String targetId, double actual, double predicted) {
        EvictingQueue<Double> queue = errors.computeIfAbsent(targetId, id -> EvictingQueue.create(window));
        synchronized (queue) {
            queue.add(percentageError(actual, predicted));
        }
    }

    /**
     * Empty until {@code minEvaluations} errors have been recorded.
     */
    public OptionalDouble confidence(String targetId) {
        EvictingQueue<Double> queue = errors.get(targetId);
        if (queue == null) {
            return OptionalDouble.empty();
        }
        synchronized (queue) {
            if (queue.size() < minEvaluations) {
                return OptionalDouble.empty();
            }
            Double ew = null;
            for (double error : queue) {
                ew = ew == null ? error : alpha * error + (1 - alpha) * ew;
            }
            return OptionalDouble.of(Math.max(0.0, 1.0 - ew));
        }
    }

    public int evaluations(String targetId) {
        EvictingQueue<Double> queue = errors.get(targetId);
        if (queue == null) {
            return 0;
        }
        synchronized (queue) {
            return queue.size();
        }
    }

    static double percentageError(double actual, double predicted) {
        if (actual == 0.0) {
            return predicted == 0.0 ? 0.0 : 1.0;
        }
        return Math.abs(actual - predicted) / Math.abs(actual);
    }
}
