package io.mnet.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class MnetConfig {
    public static final int DEFAULT_CHANNEL = 2048;
    public static final int DEFAULT_MAX_PACKET_SIZE = 8192;
    // id, sequence, flags, both host names, port and JSON framing.
    public static final int PACKET_OVERHEAD = 150;
    public static final int DEFAULT_MTU_BYTES = DEFAULT_MAX_PACKET_SIZE - PACKET_OVERHEAD;
    public static final long DEFAULT_RETRANSMIT_INTERVAL_MS = 3_000L;
    public static final long DEFAULT_DROP_TIMEOUT_MS = 12_000L;
    public static final long DEFAULT_ROUTE_TIMEOUT_MS = 30_000L;
    public static final long DEFAULT_MAX_SEQUENCE = 1L << 32;
    public static final long DEFAULT_ACK_POLL_INTERVAL_MS = 50L;
    public static final String SETTINGS_FILE_NAME = "mnet-settings.json";
    public static final String EVENT_LOG_FILE_NAME = "events.jsonl";

    private final Path rootDir;

    public MnetConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static MnetConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(".")
                : Paths.get(root);
        return new MnetConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE_NAME);
    }

    public Path eventLogFile() {
        return rootDir.resolve("log").resolve(EVENT_LOG_FILE_NAME);
    }

    public TransportSettings loadSettings() {
        return TransportSettings.load(settingsFile());
    }
}
