package com.qqsuccubus.capacity.controller.forecast;

import com.google.common.math.LinearTransformation;
import com.google.common.math.PairedStatsAccumulator;
import com.qqsuccubus.capacity.core.model.MetricSample;

import java.time.Instant;
import java.util.List;

/**
 * Least-squares line through all raw samples, x in hours since the first sample.
 */
public final class LinearTrendModel implements EnsembleMember {
    private final Instant origin;
    private final LinearTransformation fit;

    private LinearTrendModel(Instant origin, LinearTransformation fit) {
        this.origin = origin;
        this.fit = fit;
    }

    /**
     * @throws IllegalArgumentException when the samples do not span two distinct instants
     */
    public static LinearTrendModel fit(List<MetricSample> samples) {
        if (samples.size() < 2) {
            throw new IllegalArgumentException("at least two samples required");
        }
        Instant origin = samples.get(0).getTimestamp();
        PairedStatsAccumulator acc = new PairedStatsAccumulator();
        for (MetricSample sample : samples) {
            acc.add(hoursBetween(origin, sample.getTimestamp()), sample.getValue());
        }
        if (!(acc.xStats().populationVariance() > 0)) {
            throw new IllegalArgumentException("samples share a single timestamp");
        }
        return new LinearTrendModel(origin, acc.leastSquaresFit());
    }

    @Override
    public String name() {
        return "linear-trend";
    }

    @Override
    public double predict(Instant at) {
        return fit.transform(hoursBetween(origin, at));
    }

    static double hoursBetween(Instant from, Instant to) {
        return (to.toEpochMilli() - from.toEpochMilli()) / 3_600_000.0;
    }
}
