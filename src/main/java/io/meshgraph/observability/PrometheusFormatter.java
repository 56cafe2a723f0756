package io.meshgraph.observability;

import io.meshgraph.listener.ConnectionState;
import io.meshgraph.listener.ListenerStats;

import java.util.Map;

public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(ListenerStats.Snapshot stats, ConnectionState state) {
        return format(stats, state, null);
    }

    public static String format(ListenerStats.Snapshot stats, ConnectionState state, String broker) {
        StringBuilder sb = new StringBuilder();
        appendGauge(sb, "meshgraph_payloads_received_total", "Payloads received from the broker", null, null, stats.received());
        appendMapGauge(sb, "meshgraph_events_total", "Decoded events grouped by outcome", "outcome", Map.of(
                "stored", stats.stored(),
                "duplicate", stats.duplicates(),
                "unknown", stats.unknownEvents(),
                "lost", stats.lostEvents()
        ));
        appendGauge(sb, "meshgraph_decode_errors_total", "Payloads skipped as undecodable", null, null, stats.decodeErrors());
        appendGauge(sb, "meshgraph_reconnects_total", "Broker reconnect attempts scheduled", null, null, stats.reconnects());
        for (ConnectionState s : ConnectionState.values()) {
            appendGauge(sb, "meshgraph_connection_state", "Current broker connection state (1=active)",
                    "state", s.name().toLowerCase(), s == state ? 1L : 0L);
        }
        if (broker != null && !broker.isBlank()) {
            appendGauge(sb, "meshgraph_broker_info", "Broker the collector is bound to", "broker", broker.trim(), 1L);
        }
        return sb.toString();
    }

    private static void appendMapGauge(StringBuilder sb, String metric, String help, String label, Map<String, Long> values) {
        sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        values.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> sb.append(metric).append('{')
                        .append(label).append("=\"").append(escapeLabel(e.getKey())).append("\"}")
                        .append(' ').append(e.getValue()).append('\n'));
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, String label, String labelValue, long value) {
        if (!sb.toString().contains("# HELP " + metric + " ")) {
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
