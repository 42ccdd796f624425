package io.mnet.observability;

import io.mnet.transport.TransportStats;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MetricsFormatterTest {
    private static final TransportStats.Snapshot SNAPSHOT = new TransportStats.Snapshot(
            11L, 7L, 3L, 4L, 1L, 2L, 5L, 6L, 8L, 1L, 9L, 1L, 0L, 2L, 40L);

    @Test
    void formatShouldRenderCountersAndGauges() {
        String text = MetricsFormatter.format(SNAPSHOT);

        assertTrue(text.contains("# TYPE mnet_frames_total counter\n"));
        assertTrue(text.contains("mnet_frames_total{direction=\"forwarded\"} 3\n"));
        assertTrue(text.contains("mnet_frames_total{direction=\"sent\"} 11\n"));
        assertTrue(text.contains("mnet_frames_dropped_total{reason=\"wrong_channel\"} 2\n"));
        assertTrue(text.contains("mnet_acks_total{direction=\"received\"} 8\n"));
        assertTrue(text.contains("mnet_pending_sends 2\n"));
        assertTrue(text.contains("mnet_dedup_entries 40\n"));
        assertEquals(text.indexOf("# HELP mnet_acks_total "), text.lastIndexOf("# HELP mnet_acks_total "));
        assertTrue(text.indexOf("direction=\"forwarded\"") < text.indexOf("direction=\"received\""));
    }

    @Test
    void formatShouldLabelEverySampleWithHost() {
        String text = MetricsFormatter.format(SNAPSHOT, "node\"7");

        assertTrue(text.contains("mnet_frames_total{host=\"node\\\"7\",direction=\"sent\"} 11\n"));
        assertTrue(text.contains("mnet_messages_delivered_total{host=\"node\\\"7\"} 9\n"));
        for (String line : text.split("\n")) {
            if (!line.startsWith("#")) {
                assertTrue(line.contains("host=\"node\\\"7\""), line);
            }
        }
        assertFalse(MetricsFormatter.format(SNAPSHOT, " ").contains("host="));
    }
}
