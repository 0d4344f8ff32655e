package com.qqsuccubus.capacity.core.error;

/**
 * A metrics or history source could not be reached or returned no data.
 */
public class SourceUnavailableException extends CapacityControlException {
    public SourceUnavailableException(String targetId, String message) {
        super(targetId, message);
    }

    public SourceUnavailableException(String targetId, String message, Throwable cause) {
        super(targetId, message, cause);
    }
}
