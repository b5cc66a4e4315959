package io.crisislink.observability;

import io.crisislink.runtime.StatsSnapshot;

import java.util.Locale;
import java.util.Map;

public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(StatsSnapshot stats) {
        StringBuilder sb = new StringBuilder();
        appendGauge(sb, "crisislink_connections", "Live connections", null, null, stats.connections());
        appendGauge(sb, "crisislink_connections_max", "Connection ceiling", null, null, stats.maxConnections());
        appendMapGauge(sb, "crisislink_connections_by_role", "Live connections grouped by role", "role", stats.connectionsByRole());
        appendGauge(sb, "crisislink_connections_admitted_total", "Connections admitted since start", null, null, stats.connectionsAdmittedTotal());
        appendGauge(sb, "crisislink_connections_rejected_total", "Connections rejected at admission", null, null, stats.connectionsRejectedTotal());
        appendMapGauge(sb, "crisislink_sessions", "Sessions grouped by status", "status", stats.sessionsByStatus());
        appendGauge(sb, "crisislink_sessions_waiting_for_volunteer", "Sessions in the volunteer wait queue", null, null, stats.waitingForVolunteer());
        appendGauge(sb, "crisislink_volunteers_available", "Volunteers with free capacity", null, null, stats.availableVolunteers());

        appendGauge(sb, "crisislink_messages_total", "Messages grouped by final delivery outcome", "outcome", "delivered", stats.messagesDelivered());
        appendGauge(sb, "crisislink_messages_total", "Messages grouped by final delivery outcome", "outcome", "failed", stats.messagesFailed());
        appendGauge(sb, "crisislink_messages_total", "Messages grouped by final delivery outcome", "outcome", "best_effort_dropped", stats.bestEffortDropped());
        appendGauge(sb, "crisislink_messages_queued_offline_total", "Messages held while their link was down", null, null, stats.messagesQueuedOffline());
        appendGauge(sb, "crisislink_outbox_pending", "Messages waiting in session outboxes", null, null, stats.outboxPending());
        appendGauge(sb, "crisislink_delivery_latency_ms", "Delivery latency percentiles in milliseconds", "quantile", "0.5", stats.deliveryP50Ms());
        appendGauge(sb, "crisislink_delivery_latency_ms", "Delivery latency percentiles in milliseconds", "quantile", "0.95", stats.deliveryP95Ms());
        appendGauge(sb, "crisislink_delivery_latency_ms", "Delivery latency percentiles in milliseconds", "quantile", "0.99", stats.deliveryP99Ms());
        appendGauge(sb, "crisislink_delivery_within_budget_ratio", "Share of deliveries inside the latency budget", null, null, stats.deliveryWithinBudgetRatio());

        appendGauge(sb, "crisislink_escalations_total", "Escalations fanned out", null, null, stats.escalationsTotal());
        appendMapGauge(sb, "crisislink_escalations_by_level", "Escalations grouped by level", "level", stats.escalationsByLevel());
        appendGauge(sb, "crisislink_escalation_elapsed_avg_ms", "Average escalation fan-out time in milliseconds", null, null, stats.escalationAvgMs());
        appendGauge(sb, "crisislink_escalation_elapsed_max_ms", "Slowest escalation fan-out in milliseconds", null, null, stats.escalationMaxMs());
        appendGauge(sb, "crisislink_escalation_channel_failures_total", "Channels not reached during escalation", null, null, stats.escalationChannelFailures());

        for (Map.Entry<String, String> entry : stats.circuitStates().entrySet()) {
            appendGauge(sb, "crisislink_circuit_state", "Circuit state per service (0=closed,1=half_open,2=open)", "service", entry.getKey(), circuitValue(entry.getValue()));
        }
        appendGauge(sb, "crisislink_circuits_open", "Circuits currently open", null, null, stats.circuitsOpen());
        appendGauge(sb, "crisislink_rate_limited_total", "Messages rejected by the rate limiter", null, null, stats.rateLimitedTotal());
        appendGauge(sb, "crisislink_rate_limit_warnings_total", "Admissions above the rate limit warning threshold", null, null, stats.rateLimitWarningsTotal());

        appendGauge(sb, "crisislink_connection_success_rate", "Handshake success rate in percent over the recent window", null, null, stats.connectionSuccessRate());
        appendGauge(sb, "crisislink_delivery_rate", "Delivery success rate in percent over the recent window", null, null, stats.deliveryRate());
        appendGauge(sb, "crisislink_handshake_avg_ms", "Average handshake time in milliseconds", null, null, stats.averageHandshakeMs());
        appendGauge(sb, "crisislink_stability", "Load stability (1 for the current state)", "state", stats.stability().toLowerCase(Locale.ROOT), 1L);

        appendGauge(sb, "crisislink_events_published_total", "Session events published", null, null, stats.eventsPublished());
        appendGauge(sb, "crisislink_event_listener_failures_total", "Event listener invocations that threw", null, null, stats.eventListenerFailures());
        appendGauge(sb, "crisislink_persistence_written_total", "Store writes completed", null, null, stats.persistenceWrittenTotal());
        appendGauge(sb, "crisislink_persistence_failed_total", "Store writes that failed", null, null, stats.persistenceFailedTotal());
        return sb.toString();
    }

    private static long circuitValue(String state) {
        return switch (state) {
            case "OPEN" -> 2L;
            case "HALF_OPEN" -> 1L;
            default -> 0L;
        };
    }

    private static void appendMapGauge(StringBuilder sb, String metric, String help, String label, Map<String, ? extends Number> values) {
        if (values == null || values.isEmpty()) {
            appendGauge(sb, metric, help, null, null, 0L);
            return;
        }
        for (Map.Entry<String, ? extends Number> entry : values.entrySet()) {
            appendGauge(sb, metric, help, label, entry.getKey().toLowerCase(Locale.ROOT), entry.getValue().longValue());
        }
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, String label, String labelValue, long value) {
        appendSample(sb, metric, help, label, labelValue, Long.toString(value));
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, String label, String labelValue, double value) {
        appendSample(sb, metric, help, label, labelValue, String.format(Locale.ROOT, "%.4f", value));
    }

    private static void appendSample(StringBuilder sb, String metric, String help, String label, String labelValue, String value) {
        if (sb.indexOf("# HELP " + metric + " ") < 0) {
            sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
            sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        }
        sb.append(metric);
        if (label != null && labelValue != null) {
            sb.append('{').append(label).append("=\"").append(escapeLabel(labelValue)).append("\"}");
        }
        sb.append(' ').append(value).append('\n');
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
