package com.qqsuccubus.capacity.controller.metrics;

import com.qqsuccubus.capacity.core.error.SourceUnavailableException;
import com.qqsuccubus.capacity.core.model.SignalPolicy;
import com.qqsuccubus.capacity.core.model.Target;
import reactor.core.publisher.Mono;

/**
 * Reads signals with the PromQL query configured on each signal policy.
 * <p>
 * {@code {target}} in the query is replaced with the target id. Signals without a query fall back to the
 * conventional {@code capacity_signal} gauge.
 * </p>
 */
public class PrometheusMetricsSource implements IMetricsSource {
    static final String DEFAULT_QUERY = "avg(capacity_signal{target=\"{target}\",signal=\"%s\"})";

    private final PrometheusQueryService queryService;

    public PrometheusMetricsSource(PrometheusQueryService queryService) {
        this.queryService = queryService;
    }

    @Override
    public Mono<Double> fetch(Target target, SignalPolicy signal) {
        return queryService.queryScalar(queryFor(target, signal))
            .onErrorMap(SourceUnavailableException.class,
                err -> new SourceUnavailableException(target.getId(), err.getMessage(), err));
    }

    static String queryFor(Target target, SignalPolicy signal) {
        String template = signal.getQuery() != null && !signal.getQuery().isBlank()
            ? signal.getQuery()
            : String.format(DEFAULT_QUERY, signal.getName());
        return template.replace("{target}", target.getId());
    }
}
