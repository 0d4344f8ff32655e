package com.qqsuccubus.capacity.core.error;

/**
 * The orchestration API rejected a capacity change.
 */
public class ApplyFailedException extends CapacityControlException {
    public ApplyFailedException(String targetId, String message) {
        super(targetId, message);
    }

    public ApplyFailedException(String targetId, String message, Throwable cause) {
        super(targetId, message, cause);
    }
}
