package com.qqsuccubus.capacity.controller.loop;

import com.qqsuccubus.capacity.controller.forecast.PredictiveForecaster;
import com.qqsuccubus.capacity.controller.kafka.ControlEvents;
import com.qqsuccubus.capacity.controller.kafka.IControlPublisher;
import com.qqsuccubus.capacity.controller.registry.TargetRegistry;
import com.qqsuccubus.capacity.core.metrics.MetricsNames;
import com.qqsuccubus.capacity.core.metrics.MetricsTags;
import com.qqsuccubus.capacity.core.model.DecisionLogEntry;
import com.qqsuccubus.capacity.core.model.Target;
import com.qqsuccubus.capacity.core.model.TargetClass;
import com.qqsuccubus.capacity.core.msg.AlertType;
import com.qqsuccubus.capacity.core.msg.ControlMessages;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;

/**
 * Fixed-interval ticker driving the scaling cycle for one target class.
 * <p>
 * A tick that arrives while the previous cycle still runs is dropped. Collect and decide must finish
 * within {@code deadlineFactor * interval}; otherwise the tick is abandoned and nothing is applied.
 * </p>
 */
public class ControlLoop {
    private static final Logger log = LoggerFactory.getLogger(ControlLoop.class);

    private final TargetClass targetClass;
    private final Duration interval;
    private final Duration deadline;
    private final TargetRegistry registry;
    private final ScalingCycle cycle;
    private final PredictiveForecaster forecaster;
    private final BooleanSupplier leader;
    private final IControlPublisher publisher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final String classTag;

    private Disposable ticker;

    public ControlLoop(
        TargetClass targetClass,
        Duration interval,
        double deadlineFactor,
        TargetRegistry registry,
        ScalingCycle cycle,
        PredictiveForecaster forecaster,
        BooleanSupplier leader,
        IControlPublisher publisher,
        MeterRegistry meterRegistry,
        Clock clock
    ) {
        this.targetClass = targetClass;
        this.interval = interval;
        this.deadline = Duration.ofMillis((long) (interval.toMillis() * deadlineFactor));
        this.registry = registry;
        this.cycle = cycle;
        this.forecaster = forecaster;
        this.leader = leader;
        this.publisher = publisher;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.classTag = targetClass.name().toLowerCase(Locale.ROOT);
    }

    public void start() {
        log.info("Starting {} control loop: interval={}, deadline={}", classTag, interval, deadline);
        ticker = Flux.interval(interval)
            .onBackpressureDrop(tick -> log.warn("{} tick {} dropped: previous cycle still running", classTag, tick))
            .flatMap(tick -> runCycle(clock.instant()), 1)
            .subscribe();
    }

    public void stop() {
        if (ticker != null) {
            ticker.dispose();
            log.info("{} control loop stopped", classTag);
        }
    }

    /**
     * Runs one cycle. Completes empty when this replica is not the leader, the class has no targets
     * or the cycle was abandoned.
     */
    public Mono<List<DecisionLogEntry>> runCycle(Instant now) {
        if (!leader.getAsBoolean()) {
            log.debug("Not the leader, skipping {} cycle", classTag);
            return Mono.empty();
        }
        List<Target> targets = registry.snapshots(targetClass);
        if (targets.isEmpty()) {
            return Mono.empty();
        }

        targets.forEach(target -> forecaster.retrainIfDue(target, now).subscribe());

        Timer.Sample timer = Timer.start(meterRegistry);
        return cycle.decide(targets, now)
            .timeout(deadline)
            .onErrorResume(TimeoutException.class, err -> abandon(targets.size(), now).then(Mono.<CyclePlan>empty()))
            .flatMap(cycle::execute)
            .doOnNext(entries -> log.debug("{} cycle finished: {} decisions", classTag, entries.size()))
            .onErrorResume(err -> {
                log.error("{} cycle failed", classTag, err);
                return Mono.empty();
            })
            .doFinally(signal -> timer.stop(meterRegistry.timer(MetricsNames.LOOP_CYCLE_DURATION, MetricsTags.CLASS, classTag)));
    }

    private Mono<Void> abandon(int targetCount, Instant now) {
        log.warn("{} cycle abandoned: collect and decide exceeded {}", classTag, deadline);
        meterRegistry.counter(MetricsNames.LOOP_ABANDONED_TOTAL, MetricsTags.CLASS, classTag).increment();
        return ControlEvents.fire(publisher, ControlEvents.alert(
            AlertType.CYCLE_ABANDONED,
            ControlMessages.Severity.WARNING,
            null,
            String.format("%s cycle abandoned after %s; no decisions applied", classTag, deadline),
            Map.of("class", classTag, "targets", targetCount, "deadlineMs", deadline.toMillis()),
            now));
    }
}
