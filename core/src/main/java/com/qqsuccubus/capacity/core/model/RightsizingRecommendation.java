package com.qqsuccubus.capacity.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * Rightsizing advice for a target based on its average utilization.
 */
@Value
@Builder
public class RightsizingRecommendation {
    String targetId;

    double cpuUtilization;

    double memoryUtilization;

    RecommendationType type;

    String action;

    /**
     * Estimated monthly cost of the target at its current capacity.
     */
    double monthlyCost;

    double potentialMonthlySavings;
}
