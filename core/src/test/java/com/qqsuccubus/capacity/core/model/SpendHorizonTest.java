package com.qqsuccubus.capacity.core.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SpendHorizonTest {

    // A Wednesday
    private static final Instant NOW = Instant.parse("2026-03-11T14:45:00Z");

    @Test
    void testPeriodStart_CalendarAlignedInUtc() {
        assertEquals(Instant.parse("2026-03-11T14:00:00Z"), SpendHorizon.HOUR.periodStart(NOW));
        assertEquals(Instant.parse("2026-03-11T00:00:00Z"), SpendHorizon.DAY.periodStart(NOW));
        assertEquals(Instant.parse("2026-03-09T00:00:00Z"), SpendHorizon.WEEK.periodStart(NOW));
        assertEquals(Instant.parse("2026-03-01T00:00:00Z"), SpendHorizon.MONTH.periodStart(NOW));
    }

    @Test
    void testPeriodEnd() {
        assertEquals(Instant.parse("2026-03-11T15:00:00Z"), SpendHorizon.HOUR.periodEnd(NOW));
        assertEquals(Instant.parse("2026-03-16T00:00:00Z"), SpendHorizon.WEEK.periodEnd(NOW));
        assertEquals(Instant.parse("2026-04-01T00:00:00Z"), SpendHorizon.MONTH.periodEnd(NOW));
    }

    @Test
    void testHoursRemaining() {
        assertEquals(0.25, SpendHorizon.HOUR.hoursRemaining(NOW), 1e-9);
        assertEquals(9.25, SpendHorizon.DAY.hoursRemaining(NOW), 1e-9);
        assertEquals(1.0, SpendHorizon.HOUR.hoursRemaining(Instant.parse("2026-03-11T14:00:00Z")), 1e-9);
    }

    @Test
    void testMondayStartsItsOwnWeek() {
        Instant monday = Instant.parse("2026-03-09T00:00:00Z");

        assertEquals(monday, SpendHorizon.WEEK.periodStart(monday));
        assertEquals(Instant.parse("2026-03-02T00:00:00Z"),
            SpendHorizon.WEEK.periodStart(monday.minusSeconds(1)));
    }
}
