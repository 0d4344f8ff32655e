package com.qqsuccubus.capacity.controller.cost;

import com.qqsuccubus.capacity.core.model.SpendHorizon;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Integrates the hourly spend rate over time, per calendar period.
 * <p>
 * The rate reported at one evaluation is charged for the interval up to the next evaluation. When a
 * period rolls over, only the part of the interval inside the new period is kept.
 * </p>
 */
public class SpendEstimator {
    private final Map<SpendHorizon, Double> accrued = new EnumMap<>(SpendHorizon.class);
    private final Map<SpendHorizon, Instant> periodStarts = new EnumMap<>(SpendHorizon.class);

    private Instant lastAt;
    private double lastRate;

    /**
     * @param rate current spend rate per hour
     * @return estimated spend so far in the current period of every horizon
     */
    public synchronized Map<SpendHorizon, Double> accrue(double rate, Instant now) {
        for (SpendHorizon horizon : SpendHorizon.values()) {
            Instant start = horizon.periodStart(now);
            if (!start.equals(periodStarts.get(horizon))) {
                double carried = lastAt == null ? 0.0 : lastRate * hours(later(lastAt, start), now);
                accrued.put(horizon, carried);
                periodStarts.put(horizon, start);
            } else {
                accrued.merge(horizon, lastRate * hours(lastAt, now), Double::sum);
            }
        }
        lastAt = now;
        lastRate = rate;
        return new EnumMap<>(accrued);
    }

    private static Instant later(Instant a, Instant b) {
        return a.isAfter(b) ? a : b;
    }

    private static double hours(Instant from, Instant to) {
        if (from == null || !to.isAfter(from)) {
            return 0.0;
        }
        return Duration.between(from, to).toMillis() / 3_600_000.0;
    }
}
