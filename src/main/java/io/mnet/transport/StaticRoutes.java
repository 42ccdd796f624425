package io.mnet.transport;

import io.mnet.medium.Medium;
import io.mnet.model.Hosts;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed routes configured at build time. An entry names the local device and the
 * neighbour address to unicast to. The {@link Hosts#BROADCAST} entry is a catch-all: it
 * carries every packet without a host-specific entry, broadcasts included, and turns off
 * route learning.
 */
public final class StaticRoutes {
    private static final StaticRoutes NONE = new StaticRoutes(Map.of());

    private final Map<String, Entry> entries;

    private StaticRoutes(Map<String, Entry> entries) {
        this.entries = Map.copyOf(entries);
    }

    public static StaticRoutes none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the host-specific entry, never the catch-all
     */
    public Optional<Entry> lookup(String host) {
        if (host == null || Hosts.isBroadcast(host)) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.get(host));
    }

    public Optional<Entry> catchAll() {
        return Optional.ofNullable(entries.get(Hosts.BROADCAST));
    }

    /**
     * A learned route for {@code source} would either be shadowed or is disabled outright.
     */
    public boolean blocksLearning(String source) {
        return entries.containsKey(Hosts.BROADCAST) || (source != null && entries.containsKey(source));
    }

    public Map<String, Entry> entries() {
        return entries;
    }

    public record Entry(Medium device, String neighborAddress) {
    }

    public static final class Builder {
        private final Map<String, Entry> entries = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder route(String host, Medium device, String neighborAddress) {
            if (host == null || host.isBlank()) {
                throw new IllegalArgumentException("Static route host must not be blank");
            }
            if (device == null) {
                throw new IllegalArgumentException("Static route for " + host + " needs a device");
            }
            if (neighborAddress == null || neighborAddress.isBlank()) {
                throw new IllegalArgumentException("Static route for " + host + " needs a neighbour address");
            }
            entries.put(host.trim(), new Entry(device, neighborAddress.trim()));
            return this;
        }

        public StaticRoutes build() {
            return entries.isEmpty() ? NONE : new StaticRoutes(entries);
        }
    }
}
