package com.qqsuccubus.capacity.controller.metrics;

import com.qqsuccubus.capacity.controller.config.ControllerConfig;
import com.qqsuccubus.capacity.controller.kafka.ControlEvents;
import com.qqsuccubus.capacity.controller.kafka.IControlPublisher;
import com.qqsuccubus.capacity.core.metrics.MetricsNames;
import com.qqsuccubus.capacity.core.metrics.MetricsTags;
import com.qqsuccubus.capacity.core.model.MetricSample;
import com.qqsuccubus.capacity.core.model.SampleFreshness;
import com.qqsuccubus.capacity.core.model.SignalPolicy;
import com.qqsuccubus.capacity.core.model.Target;
import com.qqsuccubus.capacity.core.msg.AlertType;
import com.qqsuccubus.capacity.core.msg.ControlMessages;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Polls every signal of every target and keeps the per-target sample buffers.
 * <p>
 * A failed, timed-out or empty read never fails the cycle: the signal gets a {@code STALE} sample
 * carrying its last-known-good value (or no sample if it never had one). A target whose signals stay
 * stale for more than {@code maxStaleCycles} consecutive cycles is marked excluded, and a
 * {@code SOURCE_UNAVAILABLE} alert fires once for the outage.
 * </p>
 */
public class MetricsAggregator {
    private static final Logger log = LoggerFactory.getLogger(MetricsAggregator.class);

    private final ControllerConfig config;
    private final IMetricsSource source;
    private final IControlPublisher publisher;
    private final MeterRegistry meterRegistry;

    private final Map<String, TargetState> states = new ConcurrentHashMap<>();

    public MetricsAggregator(
        ControllerConfig config,
        IMetricsSource source,
        IControlPublisher publisher,
        MeterRegistry meterRegistry
    ) {
        this.config = config;
        this.source = source;
        this.publisher = publisher;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Collects one sample per signal for all targets, fanning out over at most
     * {@code min(targets, workerPoolCap)} concurrent target reads.
     */
    public Mono<Map<String, SignalBundle>> collect(Collection<Target> targets, Instant now) {
        if (targets.isEmpty()) {
            return Mono.just(Map.of());
        }
        int concurrency = Math.max(1, Math.min(targets.size(), config.getWorkerPoolCap()));

        return Flux.fromIterable(targets)
            .flatMap(target -> collectTarget(target, now), concurrency)
            .collectMap(SignalBundle::getTargetId);
    }

    /**
     * Appends the decision pipeline's demand estimate (in capacity units) to the target's buffer.
     *
     * @return the recorded sample, for forwarding to the forecast history store
     */
    public MetricSample recordFeedback(Target target, double demand, Instant now) {
        MetricSample sample = MetricSample.builder()
            .targetId(target.getId())
            .signal(MetricSample.DEMAND_SIGNAL)
            .value(demand)
            .timestamp(now)
            .freshness(SampleFreshness.FRESH)
            .build();
        stateOf(target).buffer.append(sample);
        return sample;
    }

    /**
     * Buffered fresh samples of one signal, oldest first. Empty for unknown targets.
     */
    public List<MetricSample> freshSamples(String targetId, String signal) {
        TargetState state = states.get(targetId);
        if (state == null) {
            return List.of();
        }
        return state.buffer.samples(signal).stream()
            .filter(MetricSample::isFresh)
            .collect(Collectors.toList());
    }

    public int staleCycles(String targetId) {
        TargetState state = states.get(targetId);
        return state == null ? 0 : state.staleCycles.get();
    }

    private Mono<SignalBundle> collectTarget(Target target, Instant now) {
        TargetState state = stateOf(target);

        return Flux.fromIterable(target.getSignals())
            .flatMap(signal -> read(target, signal, state, now))
            .collectList()
            .flatMap(readings -> {
                readings.forEach(state.buffer::append);

                boolean anyFresh = readings.stream().anyMatch(MetricSample::isFresh);
                int stale = anyFresh ? resetStale(target, state) : state.staleCycles.incrementAndGet();
                boolean excluded = stale > config.getMaxStaleCycles();

                SignalBundle.SignalBundleBuilder bundle = SignalBundle.builder()
                    .targetId(target.getId())
                    .samples(state.buffer.all())
                    .staleCycles(stale)
                    .excluded(excluded);
                readings.forEach(sample -> bundle.latest(sample.getSignal(), sample));

                if (!excluded) {
                    return Mono.just(bundle.build());
                }

                meterRegistry.counter(MetricsNames.AGGREGATOR_EXCLUSIONS_TOTAL, MetricsTags.TARGET, target.getId())
                    .increment();
                if (stale == config.getMaxStaleCycles() + 1) {
                    log.warn("Target {} excluded from reactive decisions: no fresh metrics for {} cycles",
                        target.getId(), stale);
                    return ControlEvents.fire(publisher, ControlEvents.alert(
                            AlertType.SOURCE_UNAVAILABLE,
                            ControlMessages.Severity.WARNING,
                            target.getId(),
                            String.format("No fresh metrics for %d consecutive cycles; reactive scaling suspended", stale),
                            Map.of("staleCycles", stale, "maxStaleCycles", config.getMaxStaleCycles()),
                            now))
                        .thenReturn(bundle.build());
                }
                return Mono.just(bundle.build());
            });
    }

    private Mono<MetricSample> read(Target target, SignalPolicy signal, TargetState state, Instant now) {
        return source.fetch(target, signal)
            .timeout(config.getMetricsTimeout())
            .map(value -> MetricSample.builder()
                .targetId(target.getId())
                .signal(signal.getName())
                .value(value)
                .timestamp(now)
                .build())
            .doOnNext(sample -> log.debug("Sample {}/{} = {}", target.getId(), signal.getName(), sample.getValue()))
            .onErrorResume(err -> {
                log.warn("Metrics read failed for {}/{}: {}", target.getId(), signal.getName(), err.toString());
                return Mono.empty();
            })
            .switchIfEmpty(Mono.defer(() -> staleSample(target, signal, state, now)));
    }

    private Mono<MetricSample> staleSample(Target target, SignalPolicy signal, TargetState state, Instant now) {
        log.debug("No fresh reading for {}/{}", target.getId(), signal.getName());
        staleCounter(target, signal).increment();
        Optional<MetricSample> lastGood = state.buffer.lastKnownGood(signal.getName());
        return Mono.justOrEmpty(lastGood.map(sample -> sample.asStale(now)));
    }

    private int resetStale(Target target, TargetState state) {
        int previous = state.staleCycles.getAndSet(0);
        if (previous > config.getMaxStaleCycles()) {
            log.info("Metrics for {} recovered after {} stale cycles", target.getId(), previous);
        }
        return 0;
    }

    private Counter staleCounter(Target target, SignalPolicy signal) {
        return meterRegistry.counter(MetricsNames.AGGREGATOR_STALE_SAMPLES_TOTAL,
            MetricsTags.TARGET, target.getId(),
            MetricsTags.SIGNAL, signal.getName());
    }

    private TargetState stateOf(Target target) {
        return states.computeIfAbsent(target.getId(), id -> new TargetState(new SampleRingBuffer(
            SampleRingBuffer.capacityFor(target, config.pollIntervalFor(target.getTargetClass()),
                config.getMinBufferWindow()))));
    }

    private static final class TargetState {
        private final SampleRingBuffer buffer;
        private final AtomicInteger staleCycles = new AtomicInteger();

        private TargetState(SampleRingBuffer buffer) {
            this.buffer = buffer;
        }
    }
}
