package com.qqsuccubus.capacity.controller.forecast;

import java.time.Instant;

/**
 * One fitted model of a forecast ensemble. Immutable once fitted.
 */
public interface EnsembleMember {
    String name();

    /**
     * Predicted demand at {@code at}, in capacity units. May be negative; the ensemble clips it.
     */
    double predict(Instant at);
}
