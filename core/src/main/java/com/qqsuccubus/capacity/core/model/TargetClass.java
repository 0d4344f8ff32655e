package com.qqsuccubus.capacity.core.model;

import java.time.Duration;

/**
 * Scheduling class of a target. Each class runs on its own control loop with its own polling interval.
 */
public enum TargetClass {
    /**
     * Latency-sensitive services, polled every 15 seconds.
     */
    INTERACTIVE(Duration.ofSeconds(15)),

    /**
     * Batch workloads and cluster capacity, polled every 5 minutes.
     */
    BATCH(Duration.ofMinutes(5));

    private final Duration defaultPollInterval;

    TargetClass(Duration defaultPollInterval) {
        this.defaultPollInterval = defaultPollInterval;
    }

    public Duration getDefaultPollInterval() {
        return defaultPollInterval;
    }

    public static TargetClass defaultFor(TargetKind kind) {
        return kind == TargetKind.CLUSTER_CAPACITY ? BATCH : INTERACTIVE;
    }
}
