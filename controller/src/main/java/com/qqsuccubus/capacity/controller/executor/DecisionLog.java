package com.qqsuccubus.capacity.controller.executor;

import com.google.common.collect.EvictingQueue;
import com.qqsuccubus.capacity.core.model.DecisionLogEntry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Bounded in-memory decision log. The oldest entries are evicted first; the Kafka decision topic
 * keeps the full audit trail.
 */
public class DecisionLog {
    private final EvictingQueue<DecisionLogEntry> entries;

    public DecisionLog(int capacity) {
        this.entries = EvictingQueue.create(capacity);
    }

    public synchronized void append(DecisionLogEntry entry) {
        entries.add(entry);
    }

    /**
     * Newest entries first, optionally filtered by target.
     *
     * @param targetId target to filter on, {@code null} for all targets
     */
    public synchronized List<DecisionLogEntry> recent(String targetId, int limit) {
        List<DecisionLogEntry> result = new ArrayList<>();
        for (DecisionLogEntry entry : entries) {
            if (targetId == null || targetId.equals(entry.getTargetId())) {
                result.add(entry);
            }
        }
        Collections.reverse(result);
        return result.size() > limit ? new ArrayList<>(result.subList(0, limit)) : result;
    }

    public synchronized int size() {
        return entries.size();
    }
}
