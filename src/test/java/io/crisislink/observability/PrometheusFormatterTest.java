package io.crisislink.observability;

import io.crisislink.runtime.StatsSnapshot;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

final class PrometheusFormatterTest {
    @Test
    void rendersGaugesWithLabels() {
        Map<String, Integer> byRole = new LinkedHashMap<>();
        byRole.put("PERSON_IN_CRISIS", 3);
        byRole.put("VOLUNTEER", 1);
        Map<String, String> circuits = new LinkedHashMap<>();
        circuits.put("notify:hotline-988", "OPEN");
        circuits.put("notify:supervisor-on-call", "CLOSED");

        String text = PrometheusFormatter.format(snapshot(byRole, circuits));

        Assertions.assertTrue(text.contains("crisislink_connections 4\n"));
        Assertions.assertTrue(text.contains("crisislink_connections_by_role{role=\"person_in_crisis\"} 3\n"));
        Assertions.assertTrue(text.contains("crisislink_messages_total{outcome=\"failed\"} 2\n"));
        Assertions.assertTrue(text.contains("crisislink_delivery_latency_ms{quantile=\"0.95\"} 9\n"));
        Assertions.assertTrue(text.contains("crisislink_delivery_within_budget_ratio 0.9950\n"));
        Assertions.assertTrue(text.contains("crisislink_circuit_state{service=\"notify:hotline-988\"} 2\n"));
        Assertions.assertTrue(text.contains("crisislink_circuit_state{service=\"notify:supervisor-on-call\"} 0\n"));
        Assertions.assertTrue(text.contains("crisislink_stability{state=\"unstable\"} 1\n"));
        Assertions.assertTrue(text.contains("crisislink_escalations_by_level 0\n"));
    }

    @Test
    void helpAndTypeAppearOncePerMetric() {
        String text = PrometheusFormatter.format(snapshot(Map.of(), Map.of()));

        Assertions.assertEquals(1, count(text, "# HELP crisislink_messages_total "));
        Assertions.assertEquals(1, count(text, "# TYPE crisislink_messages_total gauge"));
        Assertions.assertEquals(3, count(text, "crisislink_messages_total{"));
    }

    private static int count(String text, String needle) {
        int n = 0;
        int at = text.indexOf(needle);
        while (at >= 0) {
            n++;
            at = text.indexOf(needle, at + needle.length());
        }
        return n;
    }

    private static StatsSnapshot snapshot(Map<String, Integer> byRole, Map<String, String> circuits) {
        return new StatsSnapshot(
                4, 2000, byRole, 10L, 1L,
                Map.of("ACTIVE", 2), 1, 0,
                400L, 2L, 5L, 3L, 0L,
                4L, 9L, 30L, 0.995d,
                0L, Map.of(), 0.0d, 0L, 0L,
                circuits, 1L, 0L, 0L,
                100.0d, 96.0d, 3.5d, "UNSTABLE",
                1200L, 0L, 900L, 0L
        );
    }
}
