package com.qqsuccubus.capacity.controller.support;

import com.qqsuccubus.capacity.core.model.ScalingBehavior;
import com.qqsuccubus.capacity.core.model.SignalKind;
import com.qqsuccubus.capacity.core.model.SignalPolicy;
import com.qqsuccubus.capacity.core.model.Target;
import com.qqsuccubus.capacity.core.model.TargetClass;
import com.qqsuccubus.capacity.core.model.TargetKind;
import com.qqsuccubus.capacity.core.model.WorkloadRef;

import java.time.Duration;

/**
 * Target fixtures.
 */
public final class Targets {
    private Targets() {
    }

    public static SignalPolicy cpu(double target) {
        return SignalPolicy.builder().name("cpu").kind(SignalKind.UTILIZATION).targetValue(target).build();
    }

    public static SignalPolicy memory(double target) {
        return SignalPolicy.builder().name("memory").kind(SignalKind.UTILIZATION).targetValue(target).build();
    }

    /**
     * Non-critical service: bounds [1, 10], 2 replicas, cpu target 30%, scale-up step 100% / 2 pods.
     */
    public static Target.TargetBuilder svcA() {
        return Target.builder()
            .id("svc-A")
            .kind(TargetKind.POD_BASED)
            .targetClass(TargetClass.INTERACTIVE)
            .minCapacity(1)
            .maxCapacity(10)
            .currentCapacity(2)
            .cooldown(Duration.ofMinutes(3))
            .critical(false)
            .unitCostPerHour(0.5)
            .signal(cpu(0.3))
            .behavior(ScalingBehavior.builder().scaleUpPods(2).build())
            .workload(WorkloadRef.builder().namespace("default").kind("Deployment").name("svc-a").build());
    }
}
