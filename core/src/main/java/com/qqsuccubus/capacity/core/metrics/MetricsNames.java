package com.qqsuccubus.capacity.core.metrics;

/**
 * Micrometer metric names used by the controller.
 * <p>
 * <b>Naming convention:</b> {@code capacity.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 *   <li>Timers: {@code .duration} suffix</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Counter: Samples marked stale because the metrics source failed.
     * <p>
     * Tags: target, signal
     * </p>
     */
    public static final String AGGREGATOR_STALE_SAMPLES_TOTAL = "capacity.aggregator.stale.samples.total";

    /**
     * Counter: Targets excluded from reactive decisions after exceeding the staleness limit.
     * <p>
     * Tags: target
     * </p>
     */
    public static final String AGGREGATOR_EXCLUSIONS_TOTAL = "capacity.aggregator.exclusions.total";

    /**
     * Counter: Reactive evaluations.
     * <p>
     * Tags: direction (up/down/hold/abstain)
     * </p>
     */
    public static final String REACTIVE_EVALUATIONS_TOTAL = "capacity.reactive.evaluations.total";

    /**
     * Counter: Forecasts.
     * <p>
     * Tags: outcome (proposed/low_confidence/no_model)
     * </p>
     */
    public static final String FORECAST_TOTAL = "capacity.forecast.total";

    /**
     * Counter: Completed model retrains.
     * <p>
     * Tags: outcome (success/failure)
     * </p>
     */
    public static final String FORECAST_RETRAIN_TOTAL = "capacity.forecast.retrain.total";

    /**
     * Counter: Decisions issued by the cost governor.
     * <p>
     * Tags: tier (normal/cost_capped/emergency)
     * </p>
     */
    public static final String GOVERNOR_DECISIONS_TOTAL = "capacity.governor.decisions.total";

    /**
     * Gauge: Current budget tier (0 normal, 1 warning, 2 emergency).
     */
    public static final String GOVERNOR_BUDGET_TIER = "capacity.governor.budget.tier";

    /**
     * Gauge: Estimated spend rate of all targets per hour.
     */
    public static final String GOVERNOR_HOURLY_RATE = "capacity.governor.hourly.rate";

    /**
     * Counter: Decisions handled by the executor.
     * <p>
     * Tags: status (applied/no_op/suppressed_cooldown/failed)
     * </p>
     */
    public static final String EXECUTOR_DECISIONS_TOTAL = "capacity.executor.decisions.total";

    /**
     * Timer: Duration of a full control cycle.
     * <p>
     * Tags: class (interactive/batch)
     * </p>
     */
    public static final String LOOP_CYCLE_DURATION = "capacity.loop.cycle.duration";

    /**
     * Counter: Cycles abandoned after exceeding their hard deadline.
     * <p>
     * Tags: class (interactive/batch)
     * </p>
     */
    public static final String LOOP_ABANDONED_TOTAL = "capacity.loop.abandoned.total";
}
