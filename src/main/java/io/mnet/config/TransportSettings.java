package io.mnet.config;

import io.mnet.model.Hosts;
import io.mnet.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Tuning for one transport instance. Values read from a settings file are clamped to
 * sane minimums instead of being rejected.
 */
public record TransportSettings(
        String hostname,
        int channel,
        int mtu,
        long retransmitIntervalMs,
        long dropTimeoutMs,
        long maxSequence,
        boolean forwarding,
        boolean routeCache,
        long routeTimeoutMs,
        long ackPollIntervalMs
) {
    public TransportSettings {
        if (hostname == null || hostname.isBlank()) {
            throw new IllegalArgumentException("Hostname must not be blank");
        }
        if (Hosts.isBroadcast(hostname) || Hosts.LOCALHOST.equals(hostname)) {
            throw new IllegalArgumentException("Hostname is reserved: " + hostname);
        }
        if (mtu < 1) {
            throw new IllegalArgumentException("MTU must be positive: " + mtu);
        }
        if (maxSequence < 4) {
            throw new IllegalArgumentException("Max sequence must be at least 4: " + maxSequence);
        }
        if (retransmitIntervalMs < 1 || dropTimeoutMs < retransmitIntervalMs) {
            throw new IllegalArgumentException(
                    "Drop timeout " + dropTimeoutMs + " must not be shorter than retransmit interval " + retransmitIntervalMs);
        }
    }

    public static TransportSettings defaults() {
        return defaults(defaultHostname());
    }

    public static TransportSettings defaults(String hostname) {
        return new TransportSettings(
                hostname,
                MnetConfig.DEFAULT_CHANNEL,
                MnetConfig.DEFAULT_MTU_BYTES,
                MnetConfig.DEFAULT_RETRANSMIT_INTERVAL_MS,
                MnetConfig.DEFAULT_DROP_TIMEOUT_MS,
                MnetConfig.DEFAULT_MAX_SEQUENCE,
                true,
                false,
                MnetConfig.DEFAULT_ROUTE_TIMEOUT_MS,
                MnetConfig.DEFAULT_ACK_POLL_INTERVAL_MS
        );
    }

    /**
     * Reads {@code path} on top of the defaults. A missing file yields the defaults.
     */
    public static TransportSettings load(Path path) {
        TransportSettings defaults = defaults();
        if (path == null || !Files.exists(path)) {
            return defaults;
        }
        try {
            SettingsFile file = Jsons.mapper().readValue(path.toFile(), SettingsFile.class);
            return fromFile(file, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load transport settings: " + path, e);
        }
    }

    static TransportSettings fromFile(SettingsFile file, TransportSettings defaults) {
        if (file == null) {
            return defaults;
        }
        String hostname = sanitizeHostname(file.hostname(), defaults.hostname());
        int channel = sanitizeInt(file.channel(), defaults.channel(), 0);
        int mtu = sanitizeInt(file.mtu(), defaults.mtu(), 1);
        long retransmit = sanitizeLong(file.retransmitIntervalMs(), defaults.retransmitIntervalMs(), 1L);
        long drop = sanitizeLong(file.dropTimeoutMs(), defaults.dropTimeoutMs(), retransmit);
        long maxSequence = sanitizeLong(file.maxSequence(), defaults.maxSequence(), 4L);
        boolean forwarding = sanitizeBoolean(file.forwarding(), defaults.forwarding());
        boolean routeCache = sanitizeBoolean(file.routeCache(), defaults.routeCache());
        long routeTimeout = sanitizeLong(file.routeTimeoutMs(), defaults.routeTimeoutMs(), 1L);
        long ackPoll = sanitizeLong(file.ackPollIntervalMs(), defaults.ackPollIntervalMs(), 1L);
        return new TransportSettings(
                hostname,
                channel,
                mtu,
                retransmit,
                drop,
                maxSequence,
                forwarding,
                routeCache,
                routeTimeout,
                ackPoll
        );
    }

    public TransportSettings withHostname(String value) {
        return new TransportSettings(value, channel, mtu, retransmitIntervalMs, dropTimeoutMs, maxSequence,
                forwarding, routeCache, routeTimeoutMs, ackPollIntervalMs);
    }

    public TransportSettings withChannel(int value) {
        return new TransportSettings(hostname, value, mtu, retransmitIntervalMs, dropTimeoutMs, maxSequence,
                forwarding, routeCache, routeTimeoutMs, ackPollIntervalMs);
    }

    public TransportSettings withMtu(int value) {
        return new TransportSettings(hostname, channel, value, retransmitIntervalMs, dropTimeoutMs, maxSequence,
                forwarding, routeCache, routeTimeoutMs, ackPollIntervalMs);
    }

    public TransportSettings withTimeouts(long retransmitMs, long dropMs) {
        return new TransportSettings(hostname, channel, mtu, retransmitMs, dropMs, maxSequence,
                forwarding, routeCache, routeTimeoutMs, ackPollIntervalMs);
    }

    public TransportSettings withMaxSequence(long value) {
        return new TransportSettings(hostname, channel, mtu, retransmitIntervalMs, dropTimeoutMs, value,
                forwarding, routeCache, routeTimeoutMs, ackPollIntervalMs);
    }

    public TransportSettings withForwarding(boolean value) {
        return new TransportSettings(hostname, channel, mtu, retransmitIntervalMs, dropTimeoutMs, maxSequence,
                value, routeCache, routeTimeoutMs, ackPollIntervalMs);
    }

    public TransportSettings withRouteCache(boolean enabled, long timeoutMs) {
        return new TransportSettings(hostname, channel, mtu, retransmitIntervalMs, dropTimeoutMs, maxSequence,
                forwarding, enabled, timeoutMs, ackPollIntervalMs);
    }

    private static String defaultHostname() {
        String env = System.getenv("HOSTNAME");
        if (env != null && !env.isBlank() && !Hosts.isBroadcast(env.trim())) {
            return env.trim();
        }
        return Long.toHexString(ThreadLocalRandom.current().nextLong() & 0xffffffffL).toLowerCase(Locale.ROOT);
    }

    private static String sanitizeHostname(String raw, String fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        String trimmed = raw.trim();
        if (Hosts.isBroadcast(trimmed) || Hosts.LOCALHOST.equals(trimmed)) {
            return fallback;
        }
        return trimmed;
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static boolean sanitizeBoolean(Boolean raw, boolean fallback) {
        if (raw == null) {
            return fallback;
        }
        return raw;
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    record SettingsFile(
            String hostname,
            Integer channel,
            Integer mtu,
            Long retransmitIntervalMs,
            Long dropTimeoutMs,
            Long maxSequence,
            Boolean forwarding,
            Boolean routeCache,
            Long routeTimeoutMs,
            Long ackPollIntervalMs
    ) {
    }
}
