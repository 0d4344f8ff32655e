package com.qqsuccubus.capacity.core.redis;

/**
 * Redis keyspace definitions for forecast history and budget state.
 * <p>
 * <b>Key design principles:</b>
 * <ul>
 *   <li>Use namespace prefixes to avoid collisions (hist:, budget:)</li>
 *   <li>Trim by score so retention follows the training window</li>
 *   <li>Use sorted sets scored by epoch millis for time-range queries</li>
 * </ul>
 * </p>
 */
public final class Keys {
    private Keys() {
    }

    /**
     * History series of one signal of one target: {@code hist:{targetId}:{signal}}
     * <p>
     * <b>Type:</b> Sorted set
     * <br>
     * <b>Score:</b> sample timestamp (epoch millis)
     * <br>
     * <b>Member:</b> {@code {epochMillis}:{value}} so equal values at different times stay distinct
     * <br>
     * <b>Retention:</b> trimmed to the forecast training window on every append
     * </p>
     *
     * @param targetId Target identifier
     * @param signal   Signal name
     * @return Redis key
     */
    public static String history(String targetId, String signal) {
        return "hist:" + targetId + ":" + signal;
    }

    /**
     * Budget state of the last cost evaluation: {@code budget:state}
     * <p>
     * <b>Type:</b> String (JSON)
     * <br>
     * <b>Writer:</b> the leader, after every cost evaluation
     * </p>
     */
    public static String budgetState() {
        return "budget:state";
    }
}
