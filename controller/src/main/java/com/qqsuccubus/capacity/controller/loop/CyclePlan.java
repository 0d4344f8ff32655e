package com.qqsuccubus.capacity.controller.loop;

import com.qqsuccubus.capacity.core.model.Decision;
import com.qqsuccubus.capacity.core.model.MetricSample;
import lombok.Value;

import java.util.List;

/**
 * Output of the decide phase: one decision per target, plus the demand observations to feed back into
 * the forecast history.
 */
@Value
public class CyclePlan {
    List<Decision> decisions;
    List<MetricSample> demand;
}
