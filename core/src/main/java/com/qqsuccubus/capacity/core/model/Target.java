package com.qqsuccubus.capacity.core.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.With;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * A scalable unit: a service's replica count or a cluster's node / broker count.
 * <p>
 * Instances are immutable snapshots. The registry keeps the base configuration and builds a fresh
 * snapshot with the last-applied capacity for every cycle; the cost governor derives temporarily
 * clamped copies through {@link #withBounds(int, int)} without touching the base configuration.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
public class Target {
    String id;

    TargetKind kind;

    TargetClass targetClass;

    int minCapacity;

    int maxCapacity;

    /**
     * Last successfully applied capacity.
     */
    int currentCapacity;

    /**
     * When the last decision for this target was applied. {@code null} if never.
     */
    Instant lastScaledAt;

    @Builder.Default
    Duration cooldown = Duration.ofMinutes(3);

    /**
     * Critical targets are never forced down by the emergency budget tier.
     */
    boolean critical;

    /**
     * Cost of one capacity unit per hour, in budget currency.
     */
    double unitCostPerHour;

    /**
     * Per-target emergency floor. {@code null} means the budget-wide floor.
     */
    Integer emergencyFloor;

    @Singular
    List<SignalPolicy> signals;

    @Builder.Default
    ScalingBehavior behavior = ScalingBehavior.DEFAULT;

    WorkloadRef workload;

    public int clamp(int capacity) {
        return Math.max(minCapacity, Math.min(maxCapacity, capacity));
    }

    public Target withBounds(int min, int max) {
        return toBuilder().minCapacity(min).maxCapacity(max).build();
    }

    public boolean inCooldown(Instant now) {
        return lastScaledAt != null && now.isBefore(lastScaledAt.plus(cooldown));
    }

    public double hourlyCost() {
        return currentCapacity * unitCostPerHour;
    }
}
