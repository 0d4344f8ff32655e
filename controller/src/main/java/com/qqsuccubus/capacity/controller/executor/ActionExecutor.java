package com.qqsuccubus.capacity.controller.executor;

import com.qqsuccubus.capacity.controller.config.ControllerConfig;
import com.qqsuccubus.capacity.controller.kafka.ControlEvents;
import com.qqsuccubus.capacity.controller.kafka.IControlPublisher;
import com.qqsuccubus.capacity.controller.registry.TargetRegistry;
import com.qqsuccubus.capacity.core.error.ApplyFailedException;
import com.qqsuccubus.capacity.core.metrics.MetricsNames;
import com.qqsuccubus.capacity.core.metrics.MetricsTags;
import com.qqsuccubus.capacity.core.model.Decision;
import com.qqsuccubus.capacity.core.model.DecisionLogEntry;
import com.qqsuccubus.capacity.core.model.DecisionStatus;
import com.qqsuccubus.capacity.core.model.Target;
import com.qqsuccubus.capacity.core.msg.AlertType;
import com.qqsuccubus.capacity.core.msg.ControlMessages;
import com.qqsuccubus.capacity.core.util.JitterBackoff;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;
import reactor.core.publisher.MonoSink;
import reactor.core.publisher.Sinks;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Turns decisions into orchestrator calls.
 * <p>
 * Decisions for one target run strictly one after another through a per-target queue; different
 * targets run in parallel. Every decision ends in exactly one decision log entry:
 * <ul>
 *   <li>NO_OP: capacity equals the last applied capacity, nothing is sent</li>
 *   <li>SUPPRESSED_COOLDOWN: the target is cooling down and the decision is not an emergency</li>
 *   <li>APPLIED: the orchestrator accepted the change</li>
 *   <li>FAILED: every attempt failed; the last applied capacity stays as it was</li>
 * </ul>
 * </p>
 */
public class ActionExecutor {
    private static final Logger log = LoggerFactory.getLogger(ActionExecutor.class);

    private final ControllerConfig config;
    private final Clock clock;
    private final TargetRegistry registry;
    private final IScalingApi scalingApi;
    private final DecisionLog decisionLog;
    private final IControlPublisher publisher;
    private final MeterRegistry meterRegistry;

    private final Map<String, Sinks.Many<Job>> queues = new ConcurrentHashMap<>();
    private final Disposable.Composite workers = Disposables.composite();

    public ActionExecutor(
        ControllerConfig config,
        Clock clock,
        TargetRegistry registry,
        IScalingApi scalingApi,
        DecisionLog decisionLog,
        IControlPublisher publisher,
        MeterRegistry meterRegistry
    ) {
        this.config = config;
        this.clock = clock;
        this.registry = registry;
        this.scalingApi = scalingApi;
        this.decisionLog = decisionLog;
        this.publisher = publisher;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Queues the decision behind any decision already running for the same target.
     *
     * @return the log entry recorded for this decision
     */
    public Mono<DecisionLogEntry> apply(Decision decision) {
        return Mono.create(sink -> queueOf(decision.getTargetId())
            .emitNext(new Job(decision, sink), Sinks.EmitFailureHandler.busyLooping(Duration.ofSeconds(1))));
    }

    public void close() {
        workers.dispose();
        queues.values().forEach(Sinks.Many::tryEmitComplete);
    }

    private Sinks.Many<Job> queueOf(String targetId) {
        return queues.computeIfAbsent(targetId, id -> {
            Sinks.Many<Job> queue = Sinks.many().unicast().onBackpressureBuffer();
            workers.add(queue.asFlux()
                .concatMap(job -> execute(job.decision)
                    .doOnNext(job.sink::success)
                    .onErrorResume(err -> {
                        log.error("Unexpected failure applying decision for {}", id, err);
                        job.sink.error(err);
                        return Mono.empty();
                    }))
                .subscribe());
            return queue;
        });
    }

    private Mono<DecisionLogEntry> execute(Decision decision) {
        Target target = registry.snapshot(decision.getTargetId()).orElse(null);
        if (target == null) {
            return record(decision, DecisionStatus.FAILED, decision.getRationale() + "; unknown target", 0);
        }

        Instant now = clock.instant();
        if (decision.getCapacity() == target.getCurrentCapacity()) {
            log.debug("No-op for {}: already at {}", target.getId(), decision.getCapacity());
            return record(decision, DecisionStatus.NO_OP, decision.getRationale(), 0);
        }

        if (target.inCooldown(now) && !decision.isEmergency()) {
            Instant until = target.getLastScaledAt().plus(target.getCooldown());
            log.info("Suppressed {} -> {} for {}: cooling down until {}",
                target.getCurrentCapacity(), decision.getCapacity(), target.getId(), until);
            return record(decision, DecisionStatus.SUPPRESSED_COOLDOWN,
                decision.getRationale() + "; cooldown until " + until, 0);
        }

        AtomicInteger attempts = new AtomicInteger();
        return Mono.defer(() -> {
                attempts.incrementAndGet();
                return scalingApi.setDesiredCapacity(target, decision.getCapacity())
                    .timeout(config.getApplyTimeout());
            })
            .retryWhen(backoff(target))
            .then(Mono.defer(() -> {
                registry.recordApplied(target.getId(), decision.getCapacity(), clock.instant());
                log.info("Applied {} -> {} for {} [{}] {}", target.getCurrentCapacity(), decision.getCapacity(),
                    target.getId(), decision.getTier(), decision.getRationale());
                return record(decision, DecisionStatus.APPLIED, decision.getRationale(), attempts.get());
            }))
            .onErrorResume(err -> {
                Throwable cause = err instanceof ApplyFailedException && err.getCause() != null ? err.getCause() : err;
                log.error("Failed to apply {} for {} after {} attempts: {}", decision.getCapacity(),
                    target.getId(), attempts.get(), cause.toString());
                return ControlEvents.fire(publisher, ControlEvents.alert(
                        AlertType.APPLY_FAILED,
                        ControlMessages.Severity.CRITICAL,
                        target.getId(),
                        String.format("Scaling %s to %d failed after %d attempts: %s",
                            target.getId(), decision.getCapacity(), attempts.get(), cause.getMessage()),
                        Map.of("capacity", decision.getCapacity(), "attempts", attempts.get()),
                        clock.instant()))
                    .then(record(decision, DecisionStatus.FAILED,
                        decision.getRationale() + "; apply failed: " + cause.getMessage(), attempts.get()));
            });
    }

    private Retry backoff(Target target) {
        Duration base = config.getApplyBackoffBase();
        Duration max = config.getApplyBackoffMax();
        return Retry.from(signals -> signals.concatMap(signal -> {
            long failed = signal.totalRetries() + 1;
            if (failed >= config.getApplyMaxAttempts()) {
                return Mono.error(new ApplyFailedException(target.getId(),
                    "Giving up after " + failed + " attempts", signal.failure()));
            }
            Duration delay = JitterBackoff.next((int) signal.totalRetries(), base, max, base.dividedBy(2));
            log.warn("Apply attempt {} for {} failed ({}), retrying in {} ms", failed, target.getId(),
                signal.failure().toString(), delay.toMillis());
            return Mono.delay(delay);
        }));
    }

    private Mono<DecisionLogEntry> record(Decision decision, DecisionStatus status, String rationale, int attempts) {
        DecisionLogEntry entry = DecisionLogEntry.builder()
            .decision(decision)
            .status(status)
            .rationale(rationale)
            .attempts(attempts)
            .recordedAt(clock.instant())
            .build();
        decisionLog.append(entry);
        meterRegistry.counter(MetricsNames.EXECUTOR_DECISIONS_TOTAL,
            MetricsTags.STATUS, status.name().toLowerCase(Locale.ROOT)).increment();
        return ControlEvents.audit(publisher, entry).thenReturn(entry);
    }

    private static final class Job {
        private final Decision decision;
        private final MonoSink<DecisionLogEntry> sink;

        private Job(Decision decision, MonoSink<DecisionLogEntry> sink) {
            this.decision = decision;
            this.sink = sink;
        }
    }
}
