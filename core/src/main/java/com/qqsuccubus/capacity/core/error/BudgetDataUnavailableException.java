package com.qqsuccubus.capacity.core.error;

/**
 * Billing data could not be read. The cost governor keeps its last tier when this happens.
 */
public class BudgetDataUnavailableException extends CapacityControlException {
    public BudgetDataUnavailableException(String message, Throwable cause) {
        super(null, message, cause);
    }

    public BudgetDataUnavailableException(String message) {
        super(null, message);
    }
}
