package com.qqsuccubus.capacity.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Duration;

/**
 * Stabilization windows and per-cycle step limits of a target.
 * <p>
 * Scale-up may grow by {@code max(ceil(current * scaleUpPercent / 100), scaleUpPods)} per cycle
 * (largest change wins). Scale-down may shrink by {@code max(1, floor(current * scaleDownPercent / 100))}
 * per cycle (percent policy only, slower shrink).
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
public class ScalingBehavior {
    public static final ScalingBehavior DEFAULT = ScalingBehavior.builder().build();

    @Builder.Default
    Duration scaleUpStabilization = Duration.ofSeconds(60);

    @Builder.Default
    Duration scaleDownStabilization = Duration.ofSeconds(300);

    @Builder.Default
    double scaleUpPercent = 100.0;

    @Builder.Default
    int scaleUpPods = 4;

    @Builder.Default
    double scaleDownPercent = 50.0;

    public Duration longestWindow() {
        return scaleUpStabilization.compareTo(scaleDownStabilization) >= 0
            ? scaleUpStabilization
            : scaleDownStabilization;
    }
}
