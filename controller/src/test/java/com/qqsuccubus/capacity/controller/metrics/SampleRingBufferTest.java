package com.qqsuccubus.capacity.controller.metrics;

import com.qqsuccubus.capacity.controller.support.Targets;
import com.qqsuccubus.capacity.core.model.MetricSample;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SampleRingBufferTest {

    private static final Instant T0 = Instant.parse("2026-03-10T10:00:00Z");

    @Test
    void testCapacityFor_CoversLongestWindowAtPollInterval() {
        // scale-down stabilization 300s dominates the 60s signal window; min window 10 min dominates both
        assertEquals(41, SampleRingBuffer.capacityFor(Targets.svcA().build(), Duration.ofSeconds(15),
            Duration.ofMinutes(10)));
        assertEquals(21, SampleRingBuffer.capacityFor(Targets.svcA().build(), Duration.ofSeconds(15),
            Duration.ZERO));
    }

    @Test
    void testAppend_EvictsOldest() {
        SampleRingBuffer buffer = new SampleRingBuffer(3);
        for (int i = 0; i < 5; i++) {
            buffer.append(sample(i, T0.plusSeconds(i)));
        }

        assertEquals(3, buffer.samples("cpu").size());
        assertEquals(2.0, buffer.samples("cpu").get(0).getValue(), 1e-9);
    }

    @Test
    void testLastKnownGood_SkipsStaleSamples() {
        SampleRingBuffer buffer = new SampleRingBuffer(5);
        buffer.append(sample(0.4, T0));
        buffer.append(sample(0.4, T0).asStale(T0.plusSeconds(15)));

        assertEquals(T0, buffer.lastKnownGood("cpu").get().getTimestamp());
        assertTrue(buffer.lastKnownGood("memory").isEmpty());
    }

    @Test
    void testInvalidCapacity_Rejected() {
        assertThrows(IllegalArgumentException.class, () -> new SampleRingBuffer(0));
    }

    private static MetricSample sample(double value, Instant at) {
        return MetricSample.builder().targetId("svc-A").signal("cpu").value(value).timestamp(at).build();
    }
}
