package com.qqsuccubus.capacity.controller.cost;

import com.qqsuccubus.capacity.core.model.SpendHorizon;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SpendEstimatorTest {

    private static final Instant T0 = Instant.parse("2026-03-10T10:00:00Z");

    @Test
    void testFirstEvaluation_NothingAccrued() {
        Map<SpendHorizon, Double> spend = new SpendEstimator().accrue(10.0, T0);

        for (SpendHorizon horizon : SpendHorizon.values()) {
            assertEquals(0.0, spend.get(horizon), 1e-9);
        }
    }

    @Test
    void testRate_ChargedUntilNextEvaluation() {
        SpendEstimator estimator = new SpendEstimator();
        estimator.accrue(10.0, T0);

        Map<SpendHorizon, Double> spend = estimator.accrue(20.0, T0.plus(Duration.ofMinutes(30)));

        assertEquals(5.0, spend.get(SpendHorizon.HOUR), 1e-9);
        assertEquals(5.0, spend.get(SpendHorizon.DAY), 1e-9);
        assertEquals(5.0, spend.get(SpendHorizon.MONTH), 1e-9);
    }

    @Test
    void testPeriodRollover_KeepsOnlyPartInsideNewPeriod() {
        SpendEstimator estimator = new SpendEstimator();
        estimator.accrue(10.0, T0);
        estimator.accrue(20.0, T0.plus(Duration.ofMinutes(30)));

        Map<SpendHorizon, Double> spend = estimator.accrue(20.0, T0.plus(Duration.ofMinutes(90)));

        // 11:00 to 11:30 at 20/h
        assertEquals(10.0, spend.get(SpendHorizon.HOUR), 1e-9);
        // 5 plus 10:30 to 11:30 at 20/h
        assertEquals(25.0, spend.get(SpendHorizon.DAY), 1e-9);
    }
}
