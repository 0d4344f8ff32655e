package com.qqsuccubus.capacity.controller.executor;

import com.qqsuccubus.capacity.core.model.Target;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Logs scaling calls instead of sending them, and remembers the capacities it was asked for.
 */
public class DryRunScalingApi implements IScalingApi {
    private static final Logger log = LoggerFactory.getLogger(DryRunScalingApi.class);

    private final Map<String, Integer> desired = new ConcurrentHashMap<>();

    @Override
    public Mono<Void> setDesiredCapacity(Target target, int capacity) {
        return Mono.fromRunnable(() -> {
            Integer previous = desired.put(target.getId(), capacity);
            log.info("[dry-run] {} -> {} (was {})", target.getId(), capacity,
                previous != null ? previous : target.getCurrentCapacity());
        });
    }

    @Override
    public Mono<Integer> currentCapacity(Target target) {
        return Mono.fromSupplier(() -> desired.getOrDefault(target.getId(), target.getCurrentCapacity()));
    }
}
