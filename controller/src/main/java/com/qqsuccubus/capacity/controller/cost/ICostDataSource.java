package com.qqsuccubus.capacity.controller.cost;

import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Billed spend totals. Billing data usually lags, so values may undercount recent spend.
 */
public interface ICostDataSource {
    /**
     * Spend billed between {@code from} and {@code to}, in budget currency.
     * Errors with {@link com.qqsuccubus.capacity.core.error.BudgetDataUnavailableException} when the
     * billing source cannot answer.
     */
    Mono<Double> spendBetween(Instant from, Instant to);
}
