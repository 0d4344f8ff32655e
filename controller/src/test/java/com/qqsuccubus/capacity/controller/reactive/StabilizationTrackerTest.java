package com.qqsuccubus.capacity.controller.reactive;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StabilizationTrackerTest {

    private static final Instant T0 = Instant.parse("2026-03-10T10:00:00Z");
    private static final Duration WINDOW = Duration.ofSeconds(60);

    @Test
    void testUncoveredWindow_NoLevel() {
        StabilizationTracker tracker = new StabilizationTracker();
        tracker.record("t", T0, 7, Duration.ofMinutes(5));
        tracker.record("t", T0.plusSeconds(30), 7, Duration.ofMinutes(5));

        assertTrue(tracker.upLevel("t", T0.plusSeconds(30), WINDOW).isEmpty());
        assertTrue(tracker.upLevel("unknown", T0, WINDOW).isEmpty());
    }

    @Test
    void testLevels_IncludeRecommendationInEffectAtWindowStart() {
        StabilizationTracker tracker = new StabilizationTracker();
        tracker.record("t", T0, 5, Duration.ofMinutes(5));
        tracker.record("t", T0.plusSeconds(30), 9, Duration.ofMinutes(5));
        tracker.record("t", T0.plusSeconds(70), 8, Duration.ofMinutes(5));

        // window (10s, 70s]: 9 and 8, plus 5 in effect at 10s
        OptionalInt up = tracker.upLevel("t", T0.plusSeconds(70), WINDOW);
        OptionalInt down = tracker.downLevel("t", T0.plusSeconds(70), WINDOW);
        assertEquals(5, up.getAsInt());
        assertEquals(9, down.getAsInt());

        // window (40s, 100s]: 8, plus 9 in effect at 40s
        assertEquals(8, tracker.upLevel("t", T0.plusSeconds(100), WINDOW).getAsInt());
    }

    @Test
    void testPrune_KeepsRecordInEffectAtRetentionCutoff() {
        StabilizationTracker tracker = new StabilizationTracker();
        for (int sec = 0; sec <= 600; sec += 15) {
            tracker.record("t", T0.plusSeconds(sec), 3, Duration.ofSeconds(60));
        }

        assertEquals(3, tracker.upLevel("t", T0.plusSeconds(600), WINDOW).getAsInt());
    }
}
