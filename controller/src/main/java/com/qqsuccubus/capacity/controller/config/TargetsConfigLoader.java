package com.qqsuccubus.capacity.controller.config;

import com.qqsuccubus.capacity.core.error.ConfigurationException;
import com.qqsuccubus.capacity.core.model.BudgetPolicy;
import com.qqsuccubus.capacity.core.model.ScalingBehavior;
import com.qqsuccubus.capacity.core.model.SignalKind;
import com.qqsuccubus.capacity.core.model.SignalPolicy;
import com.qqsuccubus.capacity.core.model.SpendHorizon;
import com.qqsuccubus.capacity.core.model.Target;
import com.qqsuccubus.capacity.core.model.TargetClass;
import com.qqsuccubus.capacity.core.model.TargetKind;
import com.qqsuccubus.capacity.core.model.WorkloadRef;
import com.qqsuccubus.capacity.core.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Loads and validates the targets file. Every problem is reported as a {@link ConfigurationException},
 * which stops the controller at startup.
 */
public class TargetsConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(TargetsConfigLoader.class);

    static final String CLASSPATH_FALLBACK = "targets.json";

    private final String defaultNamespace;

    public TargetsConfigLoader(String defaultNamespace) {
        this.defaultNamespace = defaultNamespace;
    }

    public TargetsConfig load(String path) {
        if (path == null || path.isBlank()) {
            return loadClasspath(CLASSPATH_FALLBACK);
        }
        try (InputStream in = Files.newInputStream(Path.of(path))) {
            log.info("Loading targets from {}", path);
            return parse(in);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read targets file " + path + ": " + e.getMessage(), e);
        }
    }

    public TargetsConfig loadClasspath(String resource) {
        try (InputStream in = TargetsConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new ConfigurationException("Targets resource not found on classpath: " + resource);
            }
            log.info("Loading targets from classpath resource {}", resource);
            return parse(in);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read targets resource " + resource + ": " + e.getMessage(), e);
        }
    }

    TargetsConfig parse(InputStream in) {
        TargetsFile file;
        try {
            file = JsonUtils.readValue(in, TargetsFile.class);
        } catch (IOException e) {
            throw new ConfigurationException("Malformed targets file: " + e.getMessage(), e);
        }
        return toConfig(file);
    }

    TargetsConfig toConfig(TargetsFile file) {
        if (file.getTargets() == null || file.getTargets().isEmpty()) {
            throw new ConfigurationException("No targets configured");
        }

        List<Target> targets = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        for (TargetsFile.TargetEntry entry : file.getTargets()) {
            Target target = toTarget(entry);
            if (!ids.add(target.getId())) {
                throw new ConfigurationException("Duplicate target id: " + target.getId());
            }
            targets.add(target);
        }

        BudgetPolicy budget = toBudget(file.getBudget() != null ? file.getBudget() : new TargetsFile.BudgetEntry());
        log.info("Loaded {} targets, budgets={}", targets.size(), budget.getBudgets());
        return new TargetsConfig(List.copyOf(targets), budget);
    }

    private Target toTarget(TargetsFile.TargetEntry entry) {
        String id = entry.getId();
        if (id == null || id.isBlank()) {
            throw new ConfigurationException("Target without id");
        }
        if (entry.getMin() < 0 || entry.getMax() < entry.getMin()) {
            throw new ConfigurationException(String.format(
                "Target %s: invalid bounds [%d, %d]", id, entry.getMin(), entry.getMax()));
        }
        int initial = entry.getInitialCapacity() != null ? entry.getInitialCapacity() : entry.getMin();
        if (initial < entry.getMin() || initial > entry.getMax()) {
            throw new ConfigurationException(String.format(
                "Target %s: initial capacity %d outside [%d, %d]", id, initial, entry.getMin(), entry.getMax()));
        }
        if (entry.getUnitCostPerHour() < 0) {
            throw new ConfigurationException("Target " + id + ": negative unit cost");
        }
        if (entry.getEmergencyFloor() != null && entry.getEmergencyFloor() < 0) {
            throw new ConfigurationException("Target " + id + ": negative emergency floor");
        }
        if (entry.getSignals() == null || entry.getSignals().isEmpty()) {
            throw new ConfigurationException("Target " + id + ": at least one signal is required");
        }

        TargetKind kind = parseEnum(TargetKind.class, entry.getKind(), "kind", id);
        TargetClass targetClass = entry.getTargetClass() != null
            ? parseEnum(TargetClass.class, entry.getTargetClass(), "targetClass", id)
            : TargetClass.defaultFor(kind);

        Target.TargetBuilder builder = Target.builder()
            .id(id)
            .kind(kind)
            .targetClass(targetClass)
            .minCapacity(entry.getMin())
            .maxCapacity(entry.getMax())
            .currentCapacity(initial)
            .cooldown(Duration.ofSeconds(entry.getCooldownSec()))
            .critical(entry.isCritical())
            .unitCostPerHour(entry.getUnitCostPerHour())
            .emergencyFloor(entry.getEmergencyFloor())
            .behavior(toBehavior(id, entry.getBehavior()))
            .workload(toWorkload(id, entry.getWorkload()));

        Set<String> signalNames = new HashSet<>();
        for (TargetsFile.SignalEntry signal : entry.getSignals()) {
            SignalPolicy policy = toSignal(id, signal);
            if (!signalNames.add(policy.getName())) {
                throw new ConfigurationException("Target " + id + ": duplicate signal " + policy.getName());
            }
            builder.signal(policy);
        }
        return builder.build();
    }

    private ScalingBehavior toBehavior(String id, TargetsFile.BehaviorEntry entry) {
        if (entry == null) {
            return ScalingBehavior.DEFAULT;
        }
        if (entry.getScaleUpPercent() <= 0 || entry.getScaleDownPercent() <= 0 || entry.getScaleUpPods() < 0) {
            throw new ConfigurationException("Target " + id + ": step limits must be positive");
        }
        return ScalingBehavior.builder()
            .scaleUpStabilization(Duration.ofSeconds(entry.getScaleUpStabilizationSec()))
            .scaleDownStabilization(Duration.ofSeconds(entry.getScaleDownStabilizationSec()))
            .scaleUpPercent(entry.getScaleUpPercent())
            .scaleUpPods(entry.getScaleUpPods())
            .scaleDownPercent(entry.getScaleDownPercent())
            .build();
    }

    private WorkloadRef toWorkload(String id, TargetsFile.WorkloadEntry entry) {
        if (entry == null) {
            return WorkloadRef.builder().namespace(defaultNamespace).kind("Deployment").name(id).build();
        }
        return WorkloadRef.builder()
            .namespace(entry.getNamespace() != null ? entry.getNamespace() : defaultNamespace)
            .kind(entry.getKind())
            .name(entry.getName() != null ? entry.getName() : id)
            .build();
    }

    private SignalPolicy toSignal(String targetId, TargetsFile.SignalEntry entry) {
        if (entry.getName() == null || entry.getName().isBlank()) {
            throw new ConfigurationException("Target " + targetId + ": signal without name");
        }
        if (entry.getTarget() <= 0) {
            throw new ConfigurationException(String.format(
                "Target %s: signal %s needs a positive target value", targetId, entry.getName()));
        }
        return SignalPolicy.builder()
            .name(entry.getName())
            .kind(parseEnum(SignalKind.class, entry.getKind(), "signal kind", targetId))
            .targetValue(entry.getTarget())
            .aggregation(entry.getAggregation() != null
                ? parseEnum(SignalKind.Aggregation.class, entry.getAggregation(), "aggregation", targetId)
                : null)
            .window(entry.getWindowSec() != null ? Duration.ofSeconds(entry.getWindowSec()) : null)
            .query(entry.getQuery())
            .build();
    }

    private BudgetPolicy toBudget(TargetsFile.BudgetEntry entry) {
        if (entry.getWarningRatio() <= 0 || entry.getWarningRatio() > 1) {
            throw new ConfigurationException("Budget warningRatio must be in (0, 1]");
        }
        if (entry.getEmergencyFloor() < 0) {
            throw new ConfigurationException("Budget emergencyFloor must not be negative");
        }
        BudgetPolicy.BudgetPolicyBuilder builder = BudgetPolicy.builder()
            .warningRatio(entry.getWarningRatio())
            .emergencyFloor(entry.getEmergencyFloor())
            .deEscalationWindow(Duration.ofSeconds(entry.getDeEscalationWindowSec()))
            .freezeScaleUpInWarning(entry.isFreezeScaleUpInWarning());
        putBudget(builder, SpendHorizon.HOUR, entry.getHourly());
        putBudget(builder, SpendHorizon.DAY, entry.getDaily());
        putBudget(builder, SpendHorizon.WEEK, entry.getWeekly());
        putBudget(builder, SpendHorizon.MONTH, entry.getMonthly());
        return builder.build();
    }

    private void putBudget(BudgetPolicy.BudgetPolicyBuilder builder, SpendHorizon horizon, Double amount) {
        if (amount == null) {
            return;
        }
        if (amount <= 0) {
            throw new ConfigurationException("Budget for " + horizon + " must be positive");
        }
        builder.budget(horizon, amount);
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, String field, String targetId) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (RuntimeException e) {
            throw new ConfigurationException(String.format(
                "Target %s: unknown %s '%s'", targetId, field, value), e);
        }
    }
}
