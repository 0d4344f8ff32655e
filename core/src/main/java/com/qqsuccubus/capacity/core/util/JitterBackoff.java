package com.qqsuccubus.capacity.core.util;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry delays for orchestrator calls: {@code min(max, base * 2^attempt) + uniform[0, jitter]}.
 */
public final class JitterBackoff {
    private static final int MAX_EXPONENT = 20;

    private JitterBackoff() {
    }

    /**
     * @param attempt zero-based retry number
     * @param jitter  upper bound of the random extra delay; zero disables jitter
     */
    public static Duration next(int attempt, Duration base, Duration max, Duration jitter) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must not be negative: " + attempt);
        }
        long exponential = base.toMillis() << Math.min(attempt, MAX_EXPONENT);
        long capped = Math.min(exponential, max.toMillis());
        long jitterMs = jitter.toMillis();
        long extra = jitterMs > 0 ? ThreadLocalRandom.current().nextLong(jitterMs + 1) : 0;
        return Duration.ofMillis(capped + extra);
    }
}
