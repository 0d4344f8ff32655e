package com.qqsuccubus.capacity.controller.metrics;

import com.qqsuccubus.capacity.core.metrics.MetricsNames;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.core.instrument.distribution.DistributionStatisticConfig;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.netty.Metrics;

/**
 * Backs {@code GET /metrics}. Every controller component registers on {@link #getRegistry()}: stale and
 * excluded samples from the aggregator, forecast and retrain outcomes, governor decisions with the
 * budget tier gauge, executor applies and control-loop cycle timings.
 * <p>
 * Cycle durations are published as a histogram so overruns of the poll interval can be alerted on.
 * </p>
 */
public class PrometheusMetricsExporter {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsExporter.class);

    @Getter
    private final MeterRegistry registry;
    private final PrometheusMeterRegistry scrapeRegistry;

    public PrometheusMetricsExporter(String nodeId) {
        this.scrapeRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        scrapeRegistry.config().meterFilter(cycleHistogram());

        // shared with reactor-netty so HTTP meters land in the same scrape
        this.registry = Metrics.REGISTRY;
        if (registry instanceof CompositeMeterRegistry) {
            ((CompositeMeterRegistry) registry).add(scrapeRegistry);
        }
        registry.config().commonTags("app", "capacity-controller", "node_id", nodeId);
        log.info("Controller meters exported for scraping, node {}", nodeId);
    }

    public String scrape() {
        return scrapeRegistry.scrape();
    }

    static MeterFilter cycleHistogram() {
        return new MeterFilter() {
            @Override
            public DistributionStatisticConfig configure(Meter.Id id, DistributionStatisticConfig config) {
                if (!id.getName().equals(MetricsNames.LOOP_CYCLE_DURATION)) {
                    return config;
                }
                return DistributionStatisticConfig.builder()
                    .percentilesHistogram(true)
                    .build()
                    .merge(config);
            }
        };
    }
}
