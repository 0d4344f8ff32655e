package com.qqsuccubus.capacity.controller.config;

import com.qqsuccubus.capacity.core.error.ConfigurationException;
import com.qqsuccubus.capacity.core.model.SignalKind;
import com.qqsuccubus.capacity.core.model.SpendHorizon;
import com.qqsuccubus.capacity.core.model.Target;
import com.qqsuccubus.capacity.core.model.TargetClass;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TargetsConfigLoaderTest {

    private final TargetsConfigLoader loader = new TargetsConfigLoader("shop");

    @Test
    void testBundledTargets_LoadWithDefaults() {
        TargetsConfig config = loader.load("");

        assertEquals(3, config.getTargets().size());
        assertEquals(50.0, config.getBudget().getBudgets().get(SpendHorizon.HOUR).doubleValue());
        assertNull(config.getBudget().getBudgets().get(SpendHorizon.WEEK));

        Target recommendations = config.getTargets().get(1);
        assertEquals("recommendations", recommendations.getId());
        assertEquals(1, recommendations.getCurrentCapacity(), "initial capacity defaults to min");
        assertEquals(TargetClass.INTERACTIVE, recommendations.getTargetClass());
        assertEquals(2, recommendations.getBehavior().getScaleUpPods());
        assertEquals(Duration.ofSeconds(60), recommendations.getBehavior().getScaleUpStabilization());
        assertEquals("shop", recommendations.getWorkload().getNamespace());

        Target kafka = config.getTargets().get(2);
        assertEquals(TargetClass.BATCH, kafka.getTargetClass());
        assertEquals("StatefulSet", kafka.getWorkload().getKind());
        assertEquals(Duration.ofMinutes(10), kafka.getSignals().get(0).effectiveWindow());

        Target checkout = config.getTargets().get(0);
        assertTrue(checkout.isCritical());
        assertEquals(SignalKind.Aggregation.P95, checkout.getSignals().get(2).effectiveAggregation());
    }

    @Test
    void testInvalidBounds_Rejected() {
        assertRejected(target("\"id\": \"a\", \"min\": 5, \"max\": 2, " + CPU));
    }

    @Test
    void testInitialCapacityOutsideBounds_Rejected() {
        assertRejected(target("\"id\": \"a\", \"min\": 1, \"max\": 2, \"initialCapacity\": 3, " + CPU));
    }

    @Test
    void testDuplicateIds_Rejected() {
        String entry = "{\"id\": \"a\", \"min\": 1, \"max\": 2, " + CPU + "}";
        assertRejected("{\"targets\": [" + entry + ", " + entry + "]}");
    }

    @Test
    void testTargetWithoutSignals_Rejected() {
        assertRejected(target("\"id\": \"a\", \"min\": 1, \"max\": 2"));
    }

    @Test
    void testUnknownKind_Rejected() {
        assertRejected(target("\"id\": \"a\", \"kind\": \"LAMBDA\", \"min\": 1, \"max\": 2, " + CPU));
    }

    @Test
    void testUnknownProperty_Rejected() {
        assertRejected(target("\"id\": \"a\", \"min\": 1, \"max\": 2, \"replicas\": 3, " + CPU));
    }

    @Test
    void testNonPositiveBudget_Rejected() {
        assertRejected("{\"budget\": {\"daily\": 0}, \"targets\": [{\"id\": \"a\", \"min\": 1, \"max\": 2, " + CPU + "}]}");
    }

    @Test
    void testMissingFile_Rejected() {
        assertThrows(ConfigurationException.class, () -> loader.load("/nonexistent/targets.json"));
    }

    @Test
    void testMinimalTarget_DefaultBudgetAndBehavior() {
        TargetsConfig config = parse(target("\"id\": \"a\", \"kind\": \"cluster-capacity\", \"min\": 0, \"max\": 4, " + CPU));

        Target target = config.getTargets().get(0);
        assertEquals(TargetClass.BATCH, target.getTargetClass());
        assertEquals(0, target.getCurrentCapacity());
        assertEquals(Duration.ofMinutes(3), target.getCooldown());
        assertTrue(config.getBudget().getBudgets().isEmpty());
        assertEquals(Duration.ofMinutes(15), config.getBudget().getDeEscalationWindow());
    }

    private static final String CPU = "\"signals\": [{\"name\": \"cpu\", \"target\": 0.5}]";

    private static String target(String fields) {
        return "{\"targets\": [{" + fields + "}]}";
    }

    private TargetsConfig parse(String json) {
        return loader.parse(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
    }

    private void assertRejected(String json) {
        assertThrows(ConfigurationException.class, () -> parse(json));
    }
}
