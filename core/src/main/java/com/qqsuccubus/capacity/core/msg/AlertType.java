package com.qqsuccubus.capacity.core.msg;

public enum AlertType {
    TIER_TRANSITION,
    COST_OVERRIDE,
    APPLY_FAILED,
    SOURCE_UNAVAILABLE,
    BUDGET_DATA_UNAVAILABLE,
    CYCLE_ABANDONED,
    RIGHTSIZING_REPORT
}
