package com.qqsuccubus.capacity.controller.cost;

import com.qqsuccubus.capacity.core.model.BudgetState;
import reactor.core.publisher.Mono;

/**
 * Latest budget state, shared between controller replicas so a new leader inherits the tier.
 */
public interface IBudgetStateStore {
    /**
     * @return the last saved state, or empty when nothing was saved yet
     */
    Mono<BudgetState> load();

    Mono<Void> save(BudgetState state);

    void close();
}
