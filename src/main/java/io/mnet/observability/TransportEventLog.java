package io.mnet.observability;

import io.mnet.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Appends one JSON row per protocol event to a JSON-lines file. A log created by
 * {@link #disabled()} accepts events and writes nothing.
 */
public final class TransportEventLog {
    private static final TransportEventLog DISABLED = new TransportEventLog();

    private final Path eventFile;
    private final String hostname;
    private final Clock clock;

    private TransportEventLog() {
        this.eventFile = null;
        this.hostname = "";
        this.clock = Clock.systemUTC();
    }

    public TransportEventLog(Path eventFile, String hostname, Clock clock) {
        this.eventFile = eventFile;
        this.hostname = hostname == null ? "" : hostname.trim();
        this.clock = clock == null ? Clock.systemUTC() : clock;
        try {
            Path parent = eventFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(eventFile, new byte[0], StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize event log file: " + eventFile, e);
        }
    }

    public static TransportEventLog disabled() {
        return DISABLED;
    }

    public boolean enabled() {
        return eventFile != null;
    }

    public Path eventFile() {
        return eventFile;
    }

    public synchronized void log(String action, String peer, Map<String, Object> details) {
        if (eventFile == null) {
            return;
        }
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.ofEpochMilli(clock.millis()).toString());
        row.put("host", hostname);
        row.put("action", action);
        row.put("peer", peer);
        row.put("details", details == null ? Map.of() : details);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(eventFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write event log", e);
        }
    }
}
