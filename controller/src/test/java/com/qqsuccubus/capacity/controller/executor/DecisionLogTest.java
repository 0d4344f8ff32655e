package com.qqsuccubus.capacity.controller.executor;

import com.qqsuccubus.capacity.core.model.Decision;
import com.qqsuccubus.capacity.core.model.DecisionLogEntry;
import com.qqsuccubus.capacity.core.model.DecisionStatus;
import com.qqsuccubus.capacity.core.model.DecisionTier;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class DecisionLogTest {

    private static final Instant T0 = Instant.parse("2026-03-10T10:00:00Z");

    @Test
    void testRecent_NewestFirstAndFiltered() {
        DecisionLog log = new DecisionLog(10);
        log.append(entry("a", 1));
        log.append(entry("b", 2));
        log.append(entry("a", 3));

        List<DecisionLogEntry> all = log.recent(null, 10);
        assertEquals(3, all.get(0).getDecision().getCapacity());
        assertEquals(1, all.get(2).getDecision().getCapacity());

        List<DecisionLogEntry> onlyA = log.recent("a", 10);
        assertEquals(2, onlyA.size());
        assertEquals(3, onlyA.get(0).getDecision().getCapacity());

        assertEquals(1, log.recent(null, 1).size());
    }

    @Test
    void testCapacity_EvictsOldest() {
        DecisionLog log = new DecisionLog(2);
        log.append(entry("a", 1));
        log.append(entry("a", 2));
        log.append(entry("a", 3));

        assertEquals(2, log.size());
        assertEquals(2, log.recent(null, 10).get(1).getDecision().getCapacity());
    }

    private static DecisionLogEntry entry(String targetId, int capacity) {
        Decision decision = Decision.builder()
            .targetId(targetId)
            .capacity(capacity)
            .previousCapacity(0)
            .tier(DecisionTier.NORMAL)
            .rationale("test")
            .issuedAt(T0)
            .build();
        return DecisionLogEntry.builder()
            .decision(decision)
            .status(DecisionStatus.APPLIED)
            .rationale("test")
            .attempts(1)
            .recordedAt(T0)
            .build();
    }
}
