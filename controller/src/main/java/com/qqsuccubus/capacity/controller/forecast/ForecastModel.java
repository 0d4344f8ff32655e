package com.qqsuccubus.capacity.controller.forecast;

import com.google.common.math.StatsAccumulator;
import com.qqsuccubus.capacity.core.error.ModelUnavailableException;
import com.qqsuccubus.capacity.core.model.MetricSample;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Trained ensemble for one target. Replaced as a whole on retrain, never mutated.
 */
@Value
public class ForecastModel {
    static final int MIN_TRAINING_SAMPLES = 12;

    String targetId;

    List<EnsembleMember> members;

    Instant windowStart;

    Instant trainedAt;

    int sampleCount;

    /**
     * {@code 1 - MAPE} of the ensemble against its own hourly training means, clipped to [0, 1].
     */
    double inSampleAccuracy;

    /**
     * Fits every ensemble member on the demand samples in {@code [windowStart, trainedAt]}.
     *
     * @throws ModelUnavailableException when there is too little history to fit the ensemble
     */
    public static ForecastModel train(String targetId, List<MetricSample> history, Instant windowStart, Instant trainedAt) {
        List<MetricSample> samples = history.stream()
            .filter(MetricSample::isFresh)
            .sorted(Comparator.comparing(MetricSample::getTimestamp))
            .collect(Collectors.toList());
        if (samples.size() < MIN_TRAINING_SAMPLES) {
            throw new ModelUnavailableException(targetId, String.format(
                "%d demand samples since %s, need %d", samples.size(), windowStart, MIN_TRAINING_SAMPLES));
        }

        List<EnsembleMember> members = new ArrayList<>();
        try {
            members.add(SeasonalDecompositionModel.fit(samples));
            members.add(LinearTrendModel.fit(samples));
        } catch (IllegalArgumentException e) {
            throw new ModelUnavailableException(targetId, "history too short to fit: " + e.getMessage());
        }

        ForecastModel unscored = new ForecastModel(targetId, List.copyOf(members), windowStart, trainedAt, samples.size(), 0.0);
        return new ForecastModel(targetId, unscored.members, windowStart, trainedAt, samples.size(),
            unscored.score(samples));
    }

    /**
     * Mean of the members' predictions, each clipped at zero.
     */
    public double predict(Instant at) {
        double sum = 0.0;
        for (EnsembleMember member : members) {
            sum += Math.max(0.0, member.predict(at));
        }
        return sum / members.size();
    }

    /**
     * Highest prediction over {@code (now, now + horizon]}, sampled every {@code step}.
     */
    public double peak(Instant now, Duration horizon, Duration step) {
        double peak = 0.0;
        Instant end = now.plus(horizon);
        for (Instant at = now.plus(step); !at.isAfter(end); at = at.plus(step)) {
            peak = Math.max(peak, predict(at));
        }
        return peak;
    }

    private double score(List<MetricSample> samples) {
        Map<Long, StatsAccumulator> hourly = new TreeMap<>();
        for (MetricSample sample : samples) {
            long hour = Math.floorDiv(sample.getTimestamp().toEpochMilli(), 3_600_000L);
            hourly.computeIfAbsent(hour, h -> new StatsAccumulator()).add(sample.getValue());
        }
        StatsAccumulator errors = new StatsAccumulator();
        hourly.forEach((hour, stats) -> {
            Instant mid = Instant.ofEpochMilli(hour * 3_600_000L + 1_800_000L);
            errors.add(ConfidenceTracker.percentageError(stats.mean(), predict(mid)));
        });
        return Math.max(0.0, Math.min(1.0, 1.0 - errors.mean()));
    }
}
