package com.qqsuccubus.capacity.controller.cost;

import com.qqsuccubus.capacity.core.model.BudgetState;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-local budget state, used when no Redis URL is configured. Only survives leadership changes
 * within this process.
 */
public class InMemoryBudgetStateStore implements IBudgetStateStore {
    private final AtomicReference<BudgetState> saved = new AtomicReference<>();

    @Override
    public Mono<BudgetState> load() {
        return Mono.fromSupplier(saved::get);
    }

    @Override
    public Mono<Void> save(BudgetState state) {
        return Mono.fromRunnable(() -> saved.set(state));
    }

    @Override
    public void close() {
        saved.set(null);
    }
}
