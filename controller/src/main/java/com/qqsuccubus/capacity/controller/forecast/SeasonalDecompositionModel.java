package com.qqsuccubus.capacity.controller.forecast;

import com.google.common.math.LinearTransformation;
import com.google.common.math.PairedStatsAccumulator;
import com.google.common.math.StatsAccumulator;
import com.qqsuccubus.capacity.core.model.MetricSample;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Additive trend + daily seasonality decomposition.
 * <p>
 * Samples are averaged into hourly buckets. The trend is a least-squares line over the bucket means;
 * the seasonal component is the mean residual per UTC hour of day. Hours never observed get no
 * seasonal adjustment.
 * </p>
 */
public final class SeasonalDecompositionModel implements EnsembleMember {
    private static final long HOUR_MS = 3_600_000L;

    private final long originHour;
    private final LinearTransformation trend;
    private final double[] seasonal;

    private SeasonalDecompositionModel(long originHour, LinearTransformation trend, double[] seasonal) {
        this.originHour = originHour;
        this.trend = trend;
        this.seasonal = seasonal;
    }

    /**
     * @throws IllegalArgumentException when the samples cover fewer than two hourly buckets
     */
    public static SeasonalDecompositionModel fit(List<MetricSample> samples) {
        Map<Long, StatsAccumulator> buckets = new TreeMap<>();
        for (MetricSample sample : samples) {
            long hour = Math.floorDiv(sample.getTimestamp().toEpochMilli(), HOUR_MS);
            buckets.computeIfAbsent(hour, h -> new StatsAccumulator()).add(sample.getValue());
        }
        if (buckets.size() < 2) {
            throw new IllegalArgumentException("at least two hourly buckets required, got " + buckets.size());
        }

        long originHour = buckets.keySet().iterator().next();
        PairedStatsAccumulator trendAcc = new PairedStatsAccumulator();
        buckets.forEach((hour, stats) -> trendAcc.add(hour - originHour, stats.mean()));
        LinearTransformation trend = trendAcc.leastSquaresFit();

        StatsAccumulator[] residuals = new StatsAccumulator[24];
        buckets.forEach((hour, stats) -> {
            int hourOfDay = (int) Math.floorMod(hour, 24L);
            if (residuals[hourOfDay] == null) {
                residuals[hourOfDay] = new StatsAccumulator();
            }
            residuals[hourOfDay].add(stats.mean() - trend.transform(hour - originHour));
        });

        double[] seasonal = new double[24];
        for (int h = 0; h < 24; h++) {
            seasonal[h] = residuals[h] == null ? 0.0 : residuals[h].mean();
        }
        return new SeasonalDecompositionModel(originHour, trend, seasonal);
    }

    @Override
    public String name() {
        return "seasonal-decomposition";
    }

    @Override
    public double predict(Instant at) {
        double x = at.toEpochMilli() / (double) HOUR_MS - originHour;
        int hourOfDay = at.atZone(ZoneOffset.UTC).getHour();
        return trend.transform(x) + seasonal[hourOfDay];
    }
}
