package com.qqsuccubus.capacity.core.error;

/**
 * Base of all failures raised by the capacity controller.
 * <p>
 * Apart from {@link ConfigurationException}, these never escape a control cycle: each component
 * turns them into a stale sample, an abstention or a held capacity.
 * </p>
 */
public abstract class CapacityControlException extends RuntimeException {
    private final String targetId;

    protected CapacityControlException(String targetId, String message) {
        super(message);
        this.targetId = targetId;
    }

    protected CapacityControlException(String targetId, String message, Throwable cause) {
        super(message, cause);
        this.targetId = targetId;
    }

    /**
     * Target the failure relates to, or {@code null} for controller-wide failures.
     */
    public String getTargetId() {
        return targetId;
    }
}
