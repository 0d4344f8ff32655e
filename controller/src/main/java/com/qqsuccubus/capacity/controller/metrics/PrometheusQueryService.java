package com.qqsuccubus.capacity.controller.metrics;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.qqsuccubus.capacity.core.error.SourceUnavailableException;
import com.qqsuccubus.capacity.core.util.JsonUtils;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Queries the Prometheus HTTP API using reactor-netty HttpClient.
 * <p>
 * Unlike a dashboard client, failures are not turned into zeroes: a transport error, a non-success
 * status or an unparsable body is signalled as {@link SourceUnavailableException} so the aggregator
 * can mark the affected samples stale.
 * </p>
 */
public class PrometheusQueryService {
    private static final Logger log = LoggerFactory.getLogger(PrometheusQueryService.class);

    private final HttpClient httpClient;

    /**
     * @param prometheusHost  Prometheus host (e.g. "prometheus" or "prometheus-service.monitoring.svc.cluster.local")
     * @param prometheusPort  Prometheus port (typically 9090)
     * @param responseTimeout upper bound for a single HTTP exchange
     */
    public PrometheusQueryService(String prometheusHost, int prometheusPort, Duration responseTimeout) {
        this.httpClient = HttpClient.create()
                .host(prometheusHost)
                .port(prometheusPort)
                .headers(h -> h.set(HttpHeaderNames.ACCEPT, HttpHeaderValues.APPLICATION_JSON))
                .responseTimeout(responseTimeout);

        log.info("PrometheusQueryService initialized with {}:{}", prometheusHost, prometheusPort);
    }

    /**
     * Executes an instant PromQL query.
     *
     * @param query PromQL query string
     * @return the parsed result, or an error when Prometheus is unreachable or rejects the query
     */
    public Mono<PrometheusQueryResult> query(String query) {
        String uri = "/api/v1/query?query=" + URLEncoder.encode(query, StandardCharsets.UTF_8);

        log.debug("Executing Prometheus query: {}", query);

        return httpClient.get()
                .uri(uri)
                .responseContent()
                .aggregate()
                .asString()
                .switchIfEmpty(Mono.error(() -> new SourceUnavailableException(null,
                        "Empty Prometheus response for query: " + query)))
                .flatMap(responseBody -> parse(query, responseBody))
                .onErrorMap(err -> !(err instanceof SourceUnavailableException),
                        err -> new SourceUnavailableException(null,
                                "Prometheus query failed: " + err.getMessage(), err));
    }

    /**
     * Executes a query expected to return one number.
     *
     * @return the value, or an empty Mono when the query matched no series
     */
    public Mono<Double> queryScalar(String query) {
        return query(query).flatMap(result -> Mono.justOrEmpty(result.scalar()));
    }

    /**
     * Health check - tests Prometheus connectivity.
     *
     * @return true if Prometheus is reachable
     */
    public Mono<Boolean> healthCheck() {
        return httpClient.get()
                .uri("/-/healthy")
                .responseSingle((response, body) -> Mono.just(response.status().code() == 200))
                .timeout(Duration.ofSeconds(3))
                .doOnNext(healthy -> {
                    if (!healthy) {
                        log.warn("Prometheus health check: FAILED");
                    }
                })
                .onErrorReturn(false);
    }

    private Mono<PrometheusQueryResult> parse(String query, String responseBody) {
        PrometheusResponse response;
        try {
            response = JsonUtils.mapper().readValue(responseBody, PrometheusResponse.class);
        } catch (Exception e) {
            return Mono.error(new SourceUnavailableException(null,
                    "Unparsable Prometheus response: " + e.getMessage(), e));
        }

        if (!"success".equalsIgnoreCase(response.getStatus())) {
            return Mono.error(new SourceUnavailableException(null, String.format(
                    "Prometheus rejected query '%s': %s (%s)", query, response.getError(), response.getErrorType())));
        }

        PrometheusQueryResult result = PrometheusQueryResult.from(response);
        log.debug("Prometheus query '{}' returned {} series", query, result.seriesCount());
        return Mono.just(result);
    }

    /**
     * Data class for Prometheus API response.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PrometheusResponse {
        private String status;
        private PrometheusData data;
        private String error;
        private String errorType;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PrometheusData {
        private String resultType;
        private List<PrometheusResult> result;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PrometheusResult {
        private Map<String, String> metric;
        private List<Object> value;
    }
}
