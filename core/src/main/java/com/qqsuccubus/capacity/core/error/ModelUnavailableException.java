package com.qqsuccubus.capacity.core.error;

/**
 * The forecaster has no trained model for a target yet.
 */
public class ModelUnavailableException extends CapacityControlException {
    public ModelUnavailableException(String targetId, String message) {
        super(targetId, message);
    }
}
