package com.qqsuccubus.capacity.core.model;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;

/**
 * Budget period. Periods are calendar aligned in UTC; weeks start on Monday.
 */
public enum SpendHorizon {
    HOUR,
    DAY,
    WEEK,
    MONTH;

    public Instant periodStart(Instant now) {
        ZonedDateTime t = now.atZone(ZoneOffset.UTC);
        switch (this) {
            case HOUR:
                return t.truncatedTo(ChronoUnit.HOURS).toInstant();
            case DAY:
                return t.truncatedTo(ChronoUnit.DAYS).toInstant();
            case WEEK:
                return t.truncatedTo(ChronoUnit.DAYS)
                    .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY))
                    .toInstant();
            case MONTH:
                return t.truncatedTo(ChronoUnit.DAYS)
                    .with(TemporalAdjusters.firstDayOfMonth())
                    .toInstant();
            default:
                throw new IllegalStateException("Unknown horizon " + this);
        }
    }

    public Instant periodEnd(Instant now) {
        ZonedDateTime start = periodStart(now).atZone(ZoneOffset.UTC);
        switch (this) {
            case HOUR:
                return start.plusHours(1).toInstant();
            case DAY:
                return start.plusDays(1).toInstant();
            case WEEK:
                return start.plusWeeks(1).toInstant();
            case MONTH:
                return start.plusMonths(1).toInstant();
            default:
                throw new IllegalStateException("Unknown horizon " + this);
        }
    }

    /**
     * Hours left until the end of the period containing {@code now}.
     */
    public double hoursRemaining(Instant now) {
        return Duration.between(now, periodEnd(now)).toMillis() / 3_600_000.0;
    }
}
