package com.qqsuccubus.capacity.controller;

import com.qqsuccubus.capacity.controller.arbiter.DecisionArbiter;
import com.qqsuccubus.capacity.controller.config.ControllerConfig;
import com.qqsuccubus.capacity.controller.config.TargetsConfig;
import com.qqsuccubus.capacity.controller.config.TargetsConfigLoader;
import com.qqsuccubus.capacity.controller.cost.CostGovernor;
import com.qqsuccubus.capacity.controller.cost.IBudgetStateStore;
import com.qqsuccubus.capacity.controller.cost.InMemoryBudgetStateStore;
import com.qqsuccubus.capacity.controller.cost.PrometheusCostDataSource;
import com.qqsuccubus.capacity.controller.cost.RightsizingAdvisor;
import com.qqsuccubus.capacity.controller.executor.ActionExecutor;
import com.qqsuccubus.capacity.controller.executor.DecisionLog;
import com.qqsuccubus.capacity.controller.executor.DryRunScalingApi;
import com.qqsuccubus.capacity.controller.executor.IScalingApi;
import com.qqsuccubus.capacity.controller.forecast.IForecastHistoryStore;
import com.qqsuccubus.capacity.controller.forecast.InMemoryForecastHistoryStore;
import com.qqsuccubus.capacity.controller.forecast.PredictiveForecaster;
import com.qqsuccubus.capacity.controller.http.HttpServer;
import com.qqsuccubus.capacity.controller.k8s.KubernetesScalingApi;
import com.qqsuccubus.capacity.controller.k8s.LeaderElectionService;
import com.qqsuccubus.capacity.controller.kafka.IControlPublisher;
import com.qqsuccubus.capacity.controller.kafka.KafkaControlPublisher;
import com.qqsuccubus.capacity.controller.kafka.LoggingControlPublisher;
import com.qqsuccubus.capacity.controller.loop.ControlLoop;
import com.qqsuccubus.capacity.controller.loop.CostEvaluationLoop;
import com.qqsuccubus.capacity.controller.loop.ScalingCycle;
import com.qqsuccubus.capacity.controller.metrics.MetricsAggregator;
import com.qqsuccubus.capacity.controller.metrics.PrometheusMetricsExporter;
import com.qqsuccubus.capacity.controller.metrics.PrometheusMetricsSource;
import com.qqsuccubus.capacity.controller.metrics.PrometheusQueryService;
import com.qqsuccubus.capacity.controller.reactive.ReactivePolicyEvaluator;
import com.qqsuccubus.capacity.controller.redis.RedisBudgetStateStore;
import com.qqsuccubus.capacity.controller.redis.RedisForecastHistoryStore;
import com.qqsuccubus.capacity.controller.registry.TargetRegistry;
import com.qqsuccubus.capacity.core.model.Target;
import com.qqsuccubus.capacity.core.model.TargetClass;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.netty.DisposableServer;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

public class CapacityControllerApp {
    private static final Logger log = LoggerFactory.getLogger(CapacityControllerApp.class);

    public static void main(String[] args) {
        ControllerConfig config = ControllerConfig.fromEnv();
        MDC.put("nodeId", config.getNodeId());

        log.info("Starting capacity controller");
        log.info("  Kafka: {}", config.getKafkaBootstrap().isEmpty() ? "disabled" : config.getKafkaBootstrap());
        log.info("  Redis: {}", config.getRedisUrl().isEmpty() ? "disabled (in-memory history)" : config.getRedisUrl());
        log.info("  Leader Election: {}", config.isEnableLeaderElection());
        log.info("  Dry run: {}", config.isDryRun());

        TargetsConfig targetsConfig = new TargetsConfigLoader(config.getKubernetesNamespace())
            .load(config.getTargetsConfigPath());

        Clock clock = Clock.systemUTC();
        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(config.getNodeId());
        MeterRegistry meterRegistry = metricsExporter.getRegistry();
        PrometheusQueryService prometheus = new PrometheusQueryService(
            config.getPrometheusHost(), config.getPrometheusPort(), config.getMetricsTimeout());
        if (!Boolean.TRUE.equals(prometheus.healthCheck().block())) {
            log.warn("Prometheus is not reachable yet, signals stay stale until it answers");
        }

        LeaderElectionService leaderElection = null;
        BooleanSupplier leader = () -> true;
        if (config.isEnableLeaderElection()) {
            leaderElection = new LeaderElectionService(config.getKubernetesNamespace(), config.getNodeId());
            leaderElection.start();
            leader = leaderElection::isLeader;
        }

        IControlPublisher publisher = config.getKafkaBootstrap().isEmpty()
            ? new LoggingControlPublisher()
            : new KafkaControlPublisher(config);
        IForecastHistoryStore historyStore = config.getRedisUrl().isEmpty()
            ? new InMemoryForecastHistoryStore(config.getForecastTrainingWindow())
            : new RedisForecastHistoryStore(config.getRedisUrl(), config.getForecastTrainingWindow());
        IBudgetStateStore budgetStore = config.getRedisUrl().isEmpty()
            ? new InMemoryBudgetStateStore()
            : new RedisBudgetStateStore(config.getRedisUrl());
        IScalingApi scalingApi = config.isDryRun()
            ? new DryRunScalingApi()
            : new KubernetesScalingApi(config.getKubernetesNamespace());

        TargetRegistry registry = new TargetRegistry(targetsConfig.getTargets());
        syncCapacities(registry, scalingApi);

        MetricsAggregator aggregator = new MetricsAggregator(
            config, new PrometheusMetricsSource(prometheus), publisher, meterRegistry);
        PredictiveForecaster forecaster = new PredictiveForecaster(config, historyStore, meterRegistry);
        CostGovernor governor = new CostGovernor(
            config,
            targetsConfig.getBudget(),
            new PrometheusCostDataSource(prometheus, config.getCostQueryTemplate()),
            publisher,
            meterRegistry,
            clock.instant()
        );
        DecisionLog decisionLog = new DecisionLog(config.getDecisionLogCapacity());
        ActionExecutor executor = new ActionExecutor(
            config, clock, registry, scalingApi, decisionLog, publisher, meterRegistry);
        ScalingCycle cycle = new ScalingCycle(
            aggregator,
            new ReactivePolicyEvaluator(meterRegistry),
            forecaster,
            new DecisionArbiter(config.getForecastOverrideThreshold()),
            governor,
            executor
        );
        RightsizingAdvisor advisor = new RightsizingAdvisor(aggregator, publisher);

        List<ControlLoop> loops = new ArrayList<>();
        for (TargetClass targetClass : TargetClass.values()) {
            if (registry.snapshots(targetClass).isEmpty()) {
                continue;
            }
            loops.add(new ControlLoop(
                targetClass,
                config.pollIntervalFor(targetClass),
                config.getCycleDeadlineFactor(),
                registry,
                cycle,
                forecaster,
                leader,
                publisher,
                meterRegistry,
                clock
            ));
        }
        CostEvaluationLoop costLoop = new CostEvaluationLoop(
            config.getCostEvaluationInterval(),
            config.getRightsizingInterval(),
            registry,
            governor,
            budgetStore,
            config.getCostDataTimeout(),
            advisor,
            leader,
            clock
        );

        HttpServer httpServer = new HttpServer(
            config, metricsExporter, registry, decisionLog, governor, advisor, leader);
        DisposableServer disposableServer = httpServer.start();

        costLoop.start();
        loops.forEach(ControlLoop::start);

        log.info("Capacity controller is ready: {} targets, {} control loops", registry.all().size(), loops.size());

        handleShutDown(loops, costLoop, executor, httpServer, publisher, historyStore, budgetStore, scalingApi, leaderElection);

        disposableServer.onDispose().block();
    }

    private static void syncCapacities(TargetRegistry registry, IScalingApi scalingApi) {
        for (Target target : registry.all()) {
            try {
                Integer current = scalingApi.currentCapacity(target).block(Duration.ofSeconds(10));
                if (current != null) {
                    registry.syncCurrent(target.getId(), current);
                }
            } catch (RuntimeException e) {
                log.warn("Could not read current capacity of {}, using configured {}: {}",
                    target.getId(), target.getCurrentCapacity(), e.getMessage());
            }
        }
    }

    private static void handleShutDown(
        List<ControlLoop> loops,
        CostEvaluationLoop costLoop,
        ActionExecutor executor,
        HttpServer httpServer,
        IControlPublisher publisher,
        IForecastHistoryStore historyStore,
        IBudgetStateStore budgetStore,
        IScalingApi scalingApi,
        LeaderElectionService leaderElection
    ) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received");

            loops.forEach(ControlLoop::stop);
            costLoop.stop();
            executor.close();

            httpServer.stop();
            publisher.close();
            historyStore.close();
            budgetStore.close();
            scalingApi.close();

            if (leaderElection != null) {
                leaderElection.stop();
            }

            log.info("Shutdown complete");
        }));
    }
}
