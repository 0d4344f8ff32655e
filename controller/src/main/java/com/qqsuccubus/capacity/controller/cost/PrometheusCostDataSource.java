package com.qqsuccubus.capacity.controller.cost;

import com.qqsuccubus.capacity.controller.metrics.PrometheusQueryService;
import com.qqsuccubus.capacity.core.error.BudgetDataUnavailableException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;

/**
 * Reads billed spend from a cost exporter scraped by Prometheus.
 * <p>
 * The query template gets the window length in seconds, e.g.
 * {@code sum(increase(cloud_cost_usd_total[%ds]))}, and is evaluated at the current instant, so only
 * windows ending now are supported.
 * </p>
 */
public class PrometheusCostDataSource implements ICostDataSource {

    private final PrometheusQueryService queryService;
    private final String queryTemplate;

    public PrometheusCostDataSource(PrometheusQueryService queryService, String queryTemplate) {
        this.queryService = queryService;
        this.queryTemplate = queryTemplate;
    }

    @Override
    public Mono<Double> spendBetween(Instant from, Instant to) {
        long seconds = Duration.between(from, to).getSeconds();
        if (seconds <= 0) {
            return Mono.just(0.0);
        }
        String query = String.format(queryTemplate, seconds);
        return queryService.queryScalar(query)
            .switchIfEmpty(Mono.error(() -> new BudgetDataUnavailableException("No cost series for query: " + query)))
            .onErrorMap(err -> !(err instanceof BudgetDataUnavailableException),
                err -> new BudgetDataUnavailableException("Cost query failed: " + err.getMessage(), err));
    }
}
