package com.qqsuccubus.capacity.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 * <p>
 * Consistent tagging enables aggregation and filtering in Prometheus/Grafana.
 * </p>
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    public static final String TARGET = "target";

    public static final String SIGNAL = "signal";

    /**
     * Tag key for scaling direction (up/down/hold/abstain).
     */
    public static final String DIRECTION = "direction";

    public static final String OUTCOME = "outcome";

    public static final String TIER = "tier";

    public static final String STATUS = "status";

    /**
     * Tag key for the target class of a control loop.
     */
    public static final String CLASS = "class";
}
