package io.mnet.observability;

import io.mnet.transport.TransportStats;

import java.util.Map;

public final class MetricsFormatter {
    private MetricsFormatter() {
    }

    public static String format(TransportStats.Snapshot stats) {
        return format(stats, null);
    }

    public static String format(TransportStats.Snapshot stats, String hostname) {
        StringBuilder sb = new StringBuilder();
        appendMapGauge(sb, "mnet_frames_total", "Frames grouped by direction", "direction", Map.of(
                "sent", stats.framesSent(),
                "received", stats.framesReceived(),
                "forwarded", stats.framesForwarded()
        ));
        appendMapGauge(sb, "mnet_frames_dropped_total", "Inbound frames discarded before delivery", "reason", Map.of(
                "duplicate", stats.duplicates(),
                "malformed", stats.malformed(),
                "wrong_channel", stats.wrongChannel()
        ));
        appendGauge(sb, "mnet_retransmissions_total", "Reliable fragments sent again after the retransmit interval", null, null, stats.retransmissions());
        appendGauge(sb, "mnet_acks_total", "Acknowledgements grouped by direction", "direction", "sent", stats.acksSent());
        appendGauge(sb, "mnet_acks_total", "Acknowledgements grouped by direction", "direction", "received", stats.acksReceived());
        appendGauge(sb, "mnet_resync_total", "Pending sends forced to carry SYN after an unexpected ack", null, null, stats.resyncs());
        appendGauge(sb, "mnet_messages_delivered_total", "Complete messages handed to the application", null, null, stats.delivered());
        appendGauge(sb, "mnet_messages_lost_total", "Reliable fragments dropped without acknowledgement", null, null, stats.lost());
        appendGauge(sb, "mnet_transmit_failures_total", "Frames a medium failed to transmit", null, null, stats.transmitFailures());
        appendGauge(sb, "mnet_pending_sends", "Reliable fragments waiting for acknowledgement", null, null, stats.pendingSends());
        appendGauge(sb, "mnet_dedup_entries", "Packet ids held in the duplicate cache", null, null, stats.dedupEntries());
        String base = sb.toString();
        String host = hostname == null ? "" : hostname.trim();
        if (host.isBlank()) {
            return base;
        }
        String escapedHost = escapeLabel(host);
        StringBuilder withHost = new StringBuilder(base.length() + 64);
        for (String line : base.split("\\r?\\n")) {
            if (line.isBlank()) {
                continue;
            }
            if (line.startsWith("#")) {
                withHost.append(line).append('\n');
                continue;
            }
            int sep = line.lastIndexOf(' ');
            String sample = line.substring(0, sep);
            String value = line.substring(sep + 1);
            int brace = sample.indexOf('{');
            if (brace >= 0 && sample.endsWith("}")) {
                sample = sample.substring(0, brace + 1)
                        + "host=\"" + escapedHost + "\","
                        + sample.substring(brace + 1);
            } else {
                sample = sample + "{host=\"" + escapedHost + "\"}";
            }
            withHost.append(sample).append(' ').append(value).append('\n');
        }
        return withHost.toString();
    }

    private static void appendMapGauge(StringBuilder sb, String metric, String help, String label, Map<String, Long> values) {
        sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" counter").append('\n');
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
