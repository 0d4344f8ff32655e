package com.qqsuccubus.capacity.controller.http;

import com.qqsuccubus.capacity.controller.config.ControllerConfig;
import com.qqsuccubus.capacity.controller.cost.CostGovernor;
import com.qqsuccubus.capacity.controller.cost.RightsizingAdvisor;
import com.qqsuccubus.capacity.controller.executor.DecisionLog;
import com.qqsuccubus.capacity.controller.metrics.PrometheusMetricsExporter;
import com.qqsuccubus.capacity.controller.registry.TargetRegistry;
import com.qqsuccubus.capacity.core.model.Target;
import com.qqsuccubus.capacity.core.util.JsonUtils;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServerResponse;
import reactor.netty.http.server.HttpServerRoutes;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

/**
 * Read-only operational endpoints of the controller.
 */
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    static final int DEFAULT_DECISION_LIMIT = 100;
    static final int MAX_DECISION_LIMIT = 1000;

    private final ControllerConfig config;
    private final PrometheusMetricsExporter metricsExporter;
    private final TargetRegistry registry;
    private final DecisionLog decisionLog;
    private final CostGovernor governor;
    private final RightsizingAdvisor advisor;
    private final BooleanSupplier leader;

    private DisposableServer server;

    public HttpServer(
        ControllerConfig config,
        PrometheusMetricsExporter metricsExporter,
        TargetRegistry registry,
        DecisionLog decisionLog,
        CostGovernor governor,
        RightsizingAdvisor advisor,
        BooleanSupplier leader
    ) {
        this.config = config;
        this.metricsExporter = metricsExporter;
        this.registry = registry;
        this.decisionLog = decisionLog;
        this.governor = governor;
        this.advisor = advisor;
        this.leader = leader;
    }

    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
            .port(config.getHttpPort())
            .route(this::configureRoutes)
            .bind()
            .doOnNext(bound -> log.info("HTTP server started on port {}", bound.port()))
            .doOnError(err -> log.error("Failed to start HTTP server", err))
            .block(Duration.ofSeconds(45));
        return server;
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(20));
        }
    }

    private void configureRoutes(HttpServerRoutes routes) {
        routes
            .get("/healthz", (req, res) ->
                res.status(200).sendString(Mono.just(leader.getAsBoolean() ? "OK leader" : "OK standby"))
            )
            .get("/metrics", (req, res) ->
                res.addHeader("Content-Type", "text/plain; version=0.0.4; charset=utf-8")
                    .sendString(Mono.just(metricsExporter.scrape()))
                    .then()
            )
            .get("/api/v1/targets", (req, res) -> json(res, this::targetsView))
            .get("/api/v1/decisions", (req, res) -> {
                QueryStringDecoder decoder = new QueryStringDecoder(req.uri());
                String targetId = param(decoder, "targetId");
                int limit;
                try {
                    limit = parseLimit(param(decoder, "limit"));
                } catch (IllegalArgumentException e) {
                    return res.status(HttpResponseStatus.BAD_REQUEST)
                        .sendString(Mono.just("{\"error\":\"" + e.getMessage() + "\"}"));
                }
                return json(res, () -> decisionLog.recent(targetId, limit));
            })
            .get("/api/v1/budget", (req, res) -> json(res, this::budgetView))
            .get("/api/v1/recommendations", (req, res) -> json(res, advisor::latest));
    }

    private Publisher<Void> json(HttpServerResponse res, Callable<Object> body) {
        return Mono.fromCallable(() -> JsonUtils.writeValueAsString(body.call()))
            .flatMap(json -> res.header("Content-Type", "application/json")
                .sendString(Mono.just(json)).then())
            .onErrorResume(err -> {
                log.error("Failed to render response", err);
                return res.status(HttpResponseStatus.INTERNAL_SERVER_ERROR)
                    .sendString(Mono.just("{\"error\":\"Serialization failed\"}")).then();
            });
    }

    List<Map<String, Object>> targetsView() {
        return registry.all().stream()
            .map(HttpServer::targetView)
            .collect(Collectors.toList());
    }

    Map<String, Object> budgetView() {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("state", governor.currentState());
        view.put("budgets", governor.getPolicy().getBudgets());
        view.put("warningRatio", governor.getPolicy().getWarningRatio());
        view.put("deEscalationEvaluations", governor.deEscalationEvaluations());
        return view;
    }

    static int parseLimit(String raw) {
        if (raw == null || raw.isEmpty()) {
            return DEFAULT_DECISION_LIMIT;
        }
        int limit;
        try {
            limit = Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("limit must be a number");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return Math.min(limit, MAX_DECISION_LIMIT);
    }

    private static Map<String, Object> targetView(Target target) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", target.getId());
        view.put("kind", target.getKind());
        view.put("targetClass", target.getTargetClass());
        view.put("minCapacity", target.getMinCapacity());
        view.put("maxCapacity", target.getMaxCapacity());
        view.put("currentCapacity", target.getCurrentCapacity());
        view.put("lastScaledAt", target.getLastScaledAt());
        view.put("cooldownSec", target.getCooldown().getSeconds());
        view.put("critical", target.isCritical());
        view.put("hourlyCost", target.hourlyCost());
        view.put("signals", target.getSignals().stream().map(s -> s.getName()).collect(Collectors.toList()));
        return view;
    }

    private static String param(QueryStringDecoder decoder, String name) {
        List<String> values = decoder.parameters().get(name);
        return values == null || values.isEmpty() || values.get(0).isEmpty() ? null : values.get(0);
    }
}
