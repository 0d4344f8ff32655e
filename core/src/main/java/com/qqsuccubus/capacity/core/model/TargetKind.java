package com.qqsuccubus.capacity.core.model;

/**
 * What a target's capacity counts.
 */
public enum TargetKind {
    /**
     * Replica count of a service (Deployment / StatefulSet).
     */
    POD_BASED,

    /**
     * Node, broker or shard count of a storage / messaging cluster.
     */
    CLUSTER_CAPACITY
}
