package com.qqsuccubus.capacity.controller.config;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON shape of the targets file. Mapped into immutable core model objects by {@link TargetsConfigLoader}.
 */
@Data
public class TargetsFile {
    private BudgetEntry budget = new BudgetEntry();
    private List<TargetEntry> targets = new ArrayList<>();

    @Data
    public static class BudgetEntry {
        private Double hourly;
        private Double daily;
        private Double weekly;
        private Double monthly;
        private double warningRatio = 0.8;
        private int emergencyFloor = 1;
        private long deEscalationWindowSec = 900;
        private boolean freezeScaleUpInWarning;
    }

    @Data
    public static class TargetEntry {
        private String id;
        private String kind = "POD_BASED";
        private String targetClass;
        private int min = 1;
        private int max = 1;
        private Integer initialCapacity;
        private long cooldownSec = 180;
        private boolean critical;
        private double unitCostPerHour;
        private Integer emergencyFloor;
        private BehaviorEntry behavior = new BehaviorEntry();
        private WorkloadEntry workload;
        private List<SignalEntry> signals = new ArrayList<>();
    }

    @Data
    public static class BehaviorEntry {
        private long scaleUpStabilizationSec = 60;
        private long scaleDownStabilizationSec = 300;
        private double scaleUpPercent = 100.0;
        private int scaleUpPods = 4;
        private double scaleDownPercent = 50.0;
    }

    @Data
    public static class WorkloadEntry {
        private String namespace;
        private String kind = "Deployment";
        private String name;
    }

    @Data
    public static class SignalEntry {
        private String name;
        private String kind = "UTILIZATION";
        private double target;
        private String aggregation;
        private Long windowSec;
        private String query;
    }
}
