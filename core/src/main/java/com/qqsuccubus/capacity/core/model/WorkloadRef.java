package com.qqsuccubus.capacity.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * Reference to the orchestrator object that carries a target's desired capacity.
 */
@Value
@Builder(toBuilder = true)
public class WorkloadRef {
    String namespace;

    /**
     * "Deployment" or "StatefulSet".
     */
    String kind;

    String name;
}
