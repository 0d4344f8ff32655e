package com.qqsuccubus.capacity.core.model;

/**
 * Spend level relative to budget. Ordered by severity.
 */
public enum BudgetTier {
    NORMAL,
    WARNING,
    EMERGENCY;

    public boolean isWorseThan(BudgetTier other) {
        return compareTo(other) > 0;
    }
}
