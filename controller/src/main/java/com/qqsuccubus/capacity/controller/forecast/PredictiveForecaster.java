package com.qqsuccubus.capacity.controller.forecast;

import com.qqsuccubus.capacity.controller.config.ControllerConfig;
import com.qqsuccubus.capacity.core.error.ModelUnavailableException;
import com.qqsuccubus.capacity.core.metrics.MetricsNames;
import com.qqsuccubus.capacity.core.metrics.MetricsTags;
import com.qqsuccubus.capacity.core.model.MetricSample;
import com.qqsuccubus.capacity.core.model.ProposalOrigin;
import com.qqsuccubus.capacity.core.model.ScalingProposal;
import com.qqsuccubus.capacity.core.model.Target;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Capacity forecast per target from an ensemble fitted on the demand history.
 * <p>
 * Inference only reads the current model reference; retraining builds a new model on a bounded-elastic
 * worker and swaps the reference when done, so a forecast never waits for training. A proposal is only
 * emitted once the model's recent out-of-sample confidence clears the configured threshold.
 * </p>
 */
public class PredictiveForecaster {
    private static final Logger log = LoggerFactory.getLogger(PredictiveForecaster.class);

    static final int CONFIDENCE_WINDOW = 12;
    static final double CONFIDENCE_ALPHA = 0.3;
    static final int MIN_EVALUATIONS = 3;
    public static final Duration HORIZON_STEP = Duration.ofMinutes(5);

    private final ControllerConfig config;
    private final IForecastHistoryStore historyStore;
    private final ConfidenceTracker confidence;
    private final MeterRegistry meterRegistry;

    private final Map<String, ForecastModel> models = new ConcurrentHashMap<>();
    private final Map<String, Instant> lastScored = new ConcurrentHashMap<>();
    private final Set<String> retraining = ConcurrentHashMap.newKeySet();

    public PredictiveForecaster(ControllerConfig config, IForecastHistoryStore historyStore, MeterRegistry meterRegistry) {
        this.config = config;
        this.historyStore = historyStore;
        this.meterRegistry = meterRegistry;
        this.confidence = new ConfidenceTracker(CONFIDENCE_WINDOW, CONFIDENCE_ALPHA, MIN_EVALUATIONS);
    }

    /**
     * Scores the current model against the newest observed demand in {@code history}, then proposes the
     * peak predicted demand over the look-ahead horizon.
     *
     * @param history recent demand samples of the target
     * @return the proposal, or {@code null} when there is no model or confidence is below threshold
     */
    public ScalingProposal forecast(Target target, List<MetricSample> history, Instant now) {
        ForecastModel model;
        try {
            model = currentModel(target.getId());
        } catch (ModelUnavailableException e) {
            log.debug("Forecaster abstains: {}", e.getMessage());
            count("no_model");
            return null;
        }

        scoreLatest(target.getId(), model, history);

        OptionalDouble score = confidence.confidence(target.getId());
        if (score.isEmpty() || score.getAsDouble() < config.getForecastConfidenceThreshold()) {
            log.debug("Forecaster abstains for {}: confidence {} below {}", target.getId(),
                score.isPresent() ? String.format(Locale.ROOT, "%.2f", score.getAsDouble()) : "n/a",
                config.getForecastConfidenceThreshold());
            count("low_confidence");
            return null;
        }

        double peak = model.peak(now, config.getForecastHorizon(), HORIZON_STEP);
        int capacity = (int) Math.ceil(peak);
        count("proposed");

        return ScalingProposal.builder()
            .targetId(target.getId())
            .capacity(capacity)
            .origin(ProposalOrigin.PREDICTIVE)
            .rationale(String.format(Locale.ROOT, "predictive: peak demand %.2f within %s (confidence %.2f)",
                peak, config.getForecastHorizon(), score.getAsDouble()))
            .confidence(score.getAsDouble())
            .demand(peak)
            .build();
    }

    /**
     * Retrains when the target has no model or its model is older than the retrain interval.
     */
    public Mono<ForecastModel> retrainIfDue(Target target, Instant now) {
        ForecastModel current = models.get(target.getId());
        if (current != null && current.getTrainedAt().plus(config.getForecastRetrainInterval()).isAfter(now)) {
            return Mono.empty();
        }
        return retrain(target, now);
    }

    /**
     * Fits a new model from the training window and swaps it in. A retrain already running for the same
     * target absorbs this call.
     */
    public Mono<ForecastModel> retrain(Target target, Instant now) {
        String targetId = target.getId();
        return Mono.defer(() -> {
            if (!retraining.add(targetId)) {
                log.debug("Retrain of {} already in progress", targetId);
                return Mono.<ForecastModel>empty();
            }
            Instant from = now.minus(config.getForecastTrainingWindow());
            return historyStore.range(targetId, MetricSample.DEMAND_SIGNAL, from, now)
                .collectList()
                .timeout(config.getHistoryTimeout())
                .publishOn(Schedulers.boundedElastic())
                .map(samples -> ForecastModel.train(targetId, samples, from, now))
                .doOnNext(model -> {
                    models.put(targetId, model);
                    meterRegistry.counter(MetricsNames.FORECAST_RETRAIN_TOTAL, MetricsTags.OUTCOME, "success").increment();
                    log.info("Forecast model for {} retrained on {} samples (in-sample accuracy {})",
                        targetId, model.getSampleCount(), String.format(Locale.ROOT, "%.2f", model.getInSampleAccuracy()));
                })
                .onErrorResume(ModelUnavailableException.class, err -> {
                    log.info("Forecast model for {} not trained: {}", targetId, err.getMessage());
                    meterRegistry.counter(MetricsNames.FORECAST_RETRAIN_TOTAL, MetricsTags.OUTCOME, "insufficient_data").increment();
                    return Mono.empty();
                })
                .onErrorResume(err -> {
                    log.warn("Forecast retrain for {} failed, keeping previous model: {}", targetId, err.toString());
                    meterRegistry.counter(MetricsNames.FORECAST_RETRAIN_TOTAL, MetricsTags.OUTCOME, "failure").increment();
                    return Mono.empty();
                })
                // cleared before the result is delivered so a follow-up call is not absorbed
                .doOnTerminate(() -> retraining.remove(targetId))
                .doOnCancel(() -> retraining.remove(targetId));
        });
    }

    /**
     * Appends a demand observation to the training history. Failures are logged, never propagated.
     */
    public Mono<Void> recordDemand(MetricSample sample) {
        return historyStore.append(sample)
            .timeout(config.getHistoryTimeout())
            .onErrorResume(err -> {
                log.warn("Demand sample for {} not stored: {}", sample.getTargetId(), err.toString());
                return Mono.empty();
            });
    }

    public ForecastModel currentModel(String targetId) {
        ForecastModel model = models.get(targetId);
        if (model == null) {
            throw new ModelUnavailableException(targetId, "no trained forecast model for " + targetId);
        }
        return model;
    }

    public Optional<ForecastModel> model(String targetId) {
        return Optional.ofNullable(models.get(targetId));
    }

    public OptionalDouble confidence(String targetId) {
        return confidence.confidence(targetId);
    }

    private void scoreLatest(String targetId, ForecastModel model, List<MetricSample> history) {
        Optional<MetricSample> latest = history.stream()
            .filter(MetricSample::isFresh)
            .filter(s -> MetricSample.DEMAND_SIGNAL.equals(s.getSignal()))
            .max(Comparator.comparing(MetricSample::getTimestamp));
        if (latest.isEmpty()) {
            return;
        }
        MetricSample sample = latest.get();
        Instant previous = lastScored.get(targetId);
        if (previous != null && !sample.getTimestamp().isAfter(previous)) {
            return;
        }
        lastScored.put(targetId, sample.getTimestamp());
        confidence.record(targetId, sample.getValue(), model.predict(sample.getTimestamp()));
    }

    private void count(String outcome) {
        meterRegistry.counter(MetricsNames.FORECAST_TOTAL, MetricsTags.OUTCOME, outcome).increment();
    }
}
