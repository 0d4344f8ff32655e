package com.qqsuccubus.capacity.controller.reactive;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Map;
import java.util.OptionalInt;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-target history of raw capacity recommendations, used to decide whether a trend has held for a
 * whole stabilization window.
 * <p>
 * The level over a window is taken across every recommendation issued inside the window plus the one
 * that was in effect when the window opened. If no recommendation predates the window start, the
 * history does not cover the window yet and no level is reported.
 * </p>
 */
public class StabilizationTracker {

    private final Map<String, Deque<Recommendation>> history = new ConcurrentHashMap<>();

    public void record(String targetId, Instant at, int recommendation, Duration retention) {
        Deque<Recommendation> deque = history.computeIfAbsent(targetId, id -> new ArrayDeque<>());
        synchronized (deque) {
            deque.addLast(new Recommendation(at, recommendation));
            prune(deque, at.minus(retention));
        }
    }

    /**
     * Lowest recommendation over the window ending at {@code now}: the capacity every recommendation in
     * the window agreed to exceed.
     */
    public OptionalInt upLevel(String targetId, Instant now, Duration window) {
        return level(targetId, now, window, true);
    }

    /**
     * Highest recommendation over the window ending at {@code now}.
     */
    public OptionalInt downLevel(String targetId, Instant now, Duration window) {
        return level(targetId, now, window, false);
    }

    private OptionalInt level(String targetId, Instant now, Duration window, boolean lowest) {
        Deque<Recommendation> deque = history.get(targetId);
        if (deque == null) {
            return OptionalInt.empty();
        }
        Instant cutoff = now.minus(window);
        synchronized (deque) {
            Recommendation inEffect = null;
            Integer level = null;
            for (Recommendation rec : deque) {
                if (!rec.at.isAfter(cutoff)) {
                    inEffect = rec;
                    continue;
                }
                if (rec.at.isAfter(now)) {
                    break;
                }
                level = level == null ? rec.value : pick(level, rec.value, lowest);
            }
            if (inEffect == null) {
                return OptionalInt.empty();
            }
            return OptionalInt.of(level == null ? inEffect.value : pick(level, inEffect.value, lowest));
        }
    }

    private static int pick(int a, int b, boolean lowest) {
        return lowest ? Math.min(a, b) : Math.max(a, b);
    }

    // Keep the newest record at or before the cutoff; it is still in effect at the window start.
    private static void prune(Deque<Recommendation> deque, Instant cutoff) {
        while (deque.size() > 1) {
            Iterator<Recommendation> it = deque.iterator();
            it.next();
            if (it.next().at.isAfter(cutoff)) {
                return;
            }
            deque.removeFirst();
        }
    }

    private static final class Recommendation {
        private final Instant at;
        private final int value;

        private Recommendation(Instant at, int value) {
            this.at = at;
            this.value = value;
        }
    }
}
