package com.qqsuccubus.capacity.controller.registry;

import com.qqsuccubus.capacity.core.model.Target;
import com.qqsuccubus.capacity.core.model.TargetClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Registered targets plus their mutable apply state.
 * <p>
 * The base configuration never changes after startup. Last-applied capacity and the cooldown start are
 * kept apart and merged into a fresh {@link Target} snapshot on every read.
 * </p>
 */
public class TargetRegistry {
    private static final Logger log = LoggerFactory.getLogger(TargetRegistry.class);

    private final Map<String, Target> base;
    private final Map<String, AppliedState> applied = new ConcurrentHashMap<>();

    public TargetRegistry(Collection<Target> targets) {
        Map<String, Target> byId = new LinkedHashMap<>();
        for (Target target : targets) {
            byId.put(target.getId(), target);
            applied.put(target.getId(), new AppliedState(target.getCurrentCapacity(), target.getLastScaledAt()));
        }
        this.base = byId;
        log.info("Registered {} targets: {}", byId.size(), byId.keySet());
    }

    public Optional<Target> snapshot(String targetId) {
        Target target = base.get(targetId);
        if (target == null) {
            return Optional.empty();
        }
        AppliedState state = applied.get(targetId);
        return Optional.of(target.toBuilder()
            .currentCapacity(state.capacity)
            .lastScaledAt(state.scaledAt)
            .build());
    }

    public List<Target> snapshots(TargetClass targetClass) {
        return base.values().stream()
            .filter(target -> target.getTargetClass() == targetClass)
            .map(target -> snapshot(target.getId()).orElseThrow())
            .collect(Collectors.toList());
    }

    public List<Target> all() {
        return base.keySet().stream()
            .map(id -> snapshot(id).orElseThrow())
            .collect(Collectors.toList());
    }

    /**
     * Records a successful apply and starts the target's cooldown.
     */
    public void recordApplied(String targetId, int capacity, Instant at) {
        applied.computeIfPresent(targetId, (id, previous) -> new AppliedState(capacity, at));
    }

    /**
     * Adopts the capacity read from the orchestrator without starting a cooldown.
     */
    public void syncCurrent(String targetId, int capacity) {
        applied.computeIfPresent(targetId, (id, previous) -> {
            if (previous.capacity != capacity) {
                log.info("Target {} runs at {} (configured {})", targetId, capacity, previous.capacity);
            }
            return new AppliedState(capacity, previous.scaledAt);
        });
    }

    private static final class AppliedState {
        private final int capacity;
        private final Instant scaledAt;

        private AppliedState(int capacity, Instant scaledAt) {
            this.capacity = capacity;
            this.scaledAt = scaledAt;
        }
    }
}
