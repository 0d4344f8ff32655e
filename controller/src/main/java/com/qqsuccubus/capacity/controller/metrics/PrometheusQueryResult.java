package com.qqsuccubus.capacity.controller.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Instant-vector result of a PromQL query.
 */
public class PrometheusQueryResult {
    private static final Logger log = LoggerFactory.getLogger(PrometheusQueryResult.class);

    private final List<PrometheusQueryService.PrometheusResult> series;

    private PrometheusQueryResult(List<PrometheusQueryService.PrometheusResult> series) {
        this.series = series == null ? List.of() : List.copyOf(series);
    }

    public static PrometheusQueryResult from(PrometheusQueryService.PrometheusResponse response) {
        if (response == null || response.getData() == null) {
            return new PrometheusQueryResult(null);
        }
        return new PrometheusQueryResult(response.getData().getResult());
    }

    /**
     * Reading of the first series, for queries aggregated down to one number.
     * <p>
     * Prometheus encodes a sample as {@code [unixSeconds, "value"]}. NaN and infinities mean there was
     * nothing to aggregate and are reported as no reading, never as zero.
     * </p>
     */
    public Optional<Double> scalar() {
        if (series.isEmpty()) {
            return Optional.empty();
        }
        List<Object> sample = series.get(0).getValue();
        if (sample == null || sample.size() < 2) {
            return Optional.empty();
        }
        double reading;
        Object raw = sample.get(1);
        if (raw instanceof Number) {
            reading = ((Number) raw).doubleValue();
        } else if (raw instanceof String) {
            try {
                reading = Double.parseDouble((String) raw);
            } catch (NumberFormatException e) {
                log.warn("Non-numeric sample from Prometheus: {}", raw);
                return Optional.empty();
            }
        } else {
            return Optional.empty();
        }
        if (!Double.isFinite(reading)) {
            log.debug("Dropping non-finite sample {}", raw);
            return Optional.empty();
        }
        return Optional.of(reading);
    }

    public int seriesCount() {
        return series.size();
    }
}
