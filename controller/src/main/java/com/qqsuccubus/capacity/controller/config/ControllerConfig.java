package com.qqsuccubus.capacity.controller.config;

import com.qqsuccubus.capacity.controller.forecast.PredictiveForecaster;
import com.qqsuccubus.capacity.core.error.ConfigurationException;
import com.qqsuccubus.capacity.core.model.TargetClass;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Process-level configuration of the capacity controller, loaded from environment variables.
 * <p>
 * Per-target bounds, signals and the budget live in the targets file ({@link TargetsConfigLoader}).
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class ControllerConfig {

    String nodeId;
    int httpPort;

    /**
     * Empty disables Kafka; alerts and decision events are then only logged.
     */
    String kafkaBootstrap;

    /**
     * Empty keeps forecast history in memory.
     */
    String redisUrl;

    String prometheusHost;
    int prometheusPort;

    String kubernetesNamespace;
    boolean enableLeaderElection;

    /**
     * Scaling calls are logged instead of sent to Kubernetes.
     */
    boolean dryRun;

    /**
     * JSON file with targets and budget. Empty falls back to the classpath {@code targets.json}.
     */
    String targetsConfigPath;

    // Loop cadence
    Duration interactivePollInterval;
    Duration batchPollInterval;
    Duration costEvaluationInterval;
    Duration rightsizingInterval;
    double cycleDeadlineFactor;    // hard deadline = factor * poll interval

    // Aggregator
    Duration metricsTimeout;
    int workerPoolCap;
    int maxStaleCycles;
    Duration minBufferWindow;

    // Forecaster
    double forecastConfidenceThreshold;
    double forecastOverrideThreshold;
    Duration forecastHorizon;
    Duration forecastTrainingWindow;
    Duration forecastRetrainInterval;
    Duration historyTimeout;

    // Executor
    Duration applyTimeout;
    int applyMaxAttempts;
    Duration applyBackoffBase;
    Duration applyBackoffMax;
    int decisionLogCapacity;

    // Cost governor
    Duration costDataTimeout;
    String costQueryTemplate;

    public static ControllerConfig fromEnv() {
        return ControllerConfig.builder()
            .nodeId(getEnv("NODE_ID", "capacity-controller-1"))
            .httpPort(Integer.parseInt(getEnv("HTTP_PORT", "8080")))
            .kafkaBootstrap(getEnv("KAFKA_BOOTSTRAP", ""))
            .redisUrl(getEnv("REDIS_URL", ""))
            .prometheusHost(getEnv("PROMETHEUS_HOST", "prometheus"))
            .prometheusPort(Integer.parseInt(getEnv("PROMETHEUS_PORT", "9090")))
            .kubernetesNamespace(getEnv("KUBERNETES_NAMESPACE", "default"))
            .enableLeaderElection(Boolean.parseBoolean(getEnv("ENABLE_LEADER_ELECTION", "false")))
            .dryRun(Boolean.parseBoolean(getEnv("DRY_RUN", "false")))
            .targetsConfigPath(getEnv("TARGETS_CONFIG_PATH", ""))
            .interactivePollInterval(Duration.ofSeconds(Long.parseLong(getEnv("INTERACTIVE_POLL_SEC", "15"))))
            .batchPollInterval(Duration.ofSeconds(Long.parseLong(getEnv("BATCH_POLL_SEC", "300"))))
            .costEvaluationInterval(Duration.ofSeconds(Long.parseLong(getEnv("COST_EVALUATION_SEC", "60"))))
            .rightsizingInterval(Duration.ofHours(Long.parseLong(getEnv("RIGHTSIZING_INTERVAL_HOURS", "24"))))
            .cycleDeadlineFactor(Double.parseDouble(getEnv("CYCLE_DEADLINE_FACTOR", "2.0")))
            .metricsTimeout(Duration.ofMillis(Long.parseLong(getEnv("METRICS_TIMEOUT_MS", "5000"))))
            .workerPoolCap(Integer.parseInt(getEnv("WORKER_POOL_CAP", "16")))
            .maxStaleCycles(Integer.parseInt(getEnv("MAX_STALE_CYCLES", "3")))
            .minBufferWindow(Duration.ofMinutes(Long.parseLong(getEnv("MIN_BUFFER_WINDOW_MIN", "10"))))
            .forecastConfidenceThreshold(Double.parseDouble(getEnv("FORECAST_CONFIDENCE_THRESHOLD", "0.8")))
            .forecastOverrideThreshold(Double.parseDouble(getEnv("FORECAST_OVERRIDE_THRESHOLD", "0.95")))
            .forecastHorizon(Duration.ofMinutes(Long.parseLong(getEnv("FORECAST_HORIZON_MIN", "60"))))
            .forecastTrainingWindow(Duration.ofDays(Long.parseLong(getEnv("FORECAST_TRAINING_DAYS", "30"))))
            .forecastRetrainInterval(Duration.ofHours(Long.parseLong(getEnv("FORECAST_RETRAIN_HOURS", "24"))))
            .historyTimeout(Duration.ofMillis(Long.parseLong(getEnv("HISTORY_TIMEOUT_MS", "2000"))))
            .applyTimeout(Duration.ofMillis(Long.parseLong(getEnv("APPLY_TIMEOUT_MS", "10000"))))
            .applyMaxAttempts(Integer.parseInt(getEnv("APPLY_MAX_ATTEMPTS", "4")))
            .applyBackoffBase(Duration.ofMillis(Long.parseLong(getEnv("APPLY_BACKOFF_BASE_MS", "1000"))))
            .applyBackoffMax(Duration.ofMillis(Long.parseLong(getEnv("APPLY_BACKOFF_MAX_MS", "30000"))))
            .decisionLogCapacity(Integer.parseInt(getEnv("DECISION_LOG_CAPACITY", "10000")))
            .costDataTimeout(Duration.ofMillis(Long.parseLong(getEnv("COST_DATA_TIMEOUT_MS", "5000"))))
            .costQueryTemplate(getEnv("COST_QUERY_TEMPLATE", "sum(increase(cloud_cost_usd_total[%ds]))"))
            .build()
            .validate();
    }

    /**
     * Rejects settings the controller cannot run with.
     *
     * @return this config
     */
    public ControllerConfig validate() {
        if (forecastHorizon.compareTo(PredictiveForecaster.HORIZON_STEP) < 0) {
            // a horizon shorter than one sampling step leaves nothing to forecast
            throw new ConfigurationException(String.format(
                "FORECAST_HORIZON_MIN must be at least %d minutes, got %s",
                PredictiveForecaster.HORIZON_STEP.toMinutes(), forecastHorizon));
        }
        return this;
    }

    /**
     * Defaults without reading the environment; used by tests and as a base for overrides.
     */
    public static ControllerConfig defaults() {
        return ControllerConfig.builder()
            .nodeId("capacity-controller-test")
            .httpPort(8080)
            .kafkaBootstrap("")
            .redisUrl("")
            .prometheusHost("localhost")
            .prometheusPort(9090)
            .kubernetesNamespace("default")
            .targetsConfigPath("")
            .interactivePollInterval(TargetClass.INTERACTIVE.getDefaultPollInterval())
            .batchPollInterval(TargetClass.BATCH.getDefaultPollInterval())
            .costEvaluationInterval(Duration.ofSeconds(60))
            .rightsizingInterval(Duration.ofHours(24))
            .cycleDeadlineFactor(2.0)
            .metricsTimeout(Duration.ofSeconds(5))
            .workerPoolCap(16)
            .maxStaleCycles(3)
            .minBufferWindow(Duration.ofMinutes(10))
            .forecastConfidenceThreshold(0.8)
            .forecastOverrideThreshold(0.95)
            .forecastHorizon(Duration.ofHours(1))
            .forecastTrainingWindow(Duration.ofDays(30))
            .forecastRetrainInterval(Duration.ofHours(24))
            .historyTimeout(Duration.ofSeconds(2))
            .applyTimeout(Duration.ofSeconds(10))
            .applyMaxAttempts(4)
            .applyBackoffBase(Duration.ofSeconds(1))
            .applyBackoffMax(Duration.ofSeconds(30))
            .decisionLogCapacity(10_000)
            .costDataTimeout(Duration.ofSeconds(5))
            .costQueryTemplate("sum(increase(cloud_cost_usd_total[%ds]))")
            .build();
    }

    public Duration pollIntervalFor(TargetClass targetClass) {
        return targetClass == TargetClass.BATCH
            ? batchPollInterval
            : interactivePollInterval;
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
