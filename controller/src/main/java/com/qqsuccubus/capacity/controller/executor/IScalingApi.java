package com.qqsuccubus.capacity.controller.executor;

import com.qqsuccubus.capacity.core.model.Target;
import reactor.core.publisher.Mono;

/**
 * Orchestrator call that changes a target's desired capacity.
 */
public interface IScalingApi {
    Mono<Void> setDesiredCapacity(Target target, int capacity);

    /**
     * Capacity the orchestrator currently wants for the target.
     */
    Mono<Integer> currentCapacity(Target target);

    default void close() {
    }
}
