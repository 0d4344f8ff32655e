package com.qqsuccubus.capacity.controller.config;

import com.qqsuccubus.capacity.core.model.BudgetPolicy;
import com.qqsuccubus.capacity.core.model.Target;
import lombok.Value;

import java.util.List;

/**
 * Validated targets and budget, as registered at controller start.
 */
@Value
public class TargetsConfig {
    List<Target> targets;
    BudgetPolicy budget;
}
