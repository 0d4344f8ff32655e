package com.qqsuccubus.capacity.core.error;

/**
 * Invalid or unreadable controller configuration. Fatal at startup.
 */
public class ConfigurationException extends CapacityControlException {
    public ConfigurationException(String message) {
        super(null, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(null, message, cause);
    }
}
