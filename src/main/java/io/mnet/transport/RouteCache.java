package io.mnet.transport;

import io.mnet.medium.Medium;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Remembers the first neighbour each source host was heard through. Entries expire a
 * fixed time after they were learned, even if traffic keeps arriving.
 */
public final class RouteCache {
    private final Map<String, Route> routes = new HashMap<>();

    public void learn(String host, Medium device, String neighborAddress, long nowMs) {
        if (host == null || neighborAddress == null) {
            return;
        }
        routes.putIfAbsent(host, new Route(device, neighborAddress, nowMs));
    }

    public Optional<Route> lookup(String host) {
        return Optional.ofNullable(routes.get(host));
    }

    public void forget(String host) {
        routes.remove(host);
    }

    public int evictOlderThan(long horizonMs) {
        int before = routes.size();
        routes.values().removeIf(route -> route.learnedAtMs() < horizonMs);
        return before - routes.size();
    }

    public int size() {
        return routes.size();
    }

    public record Route(Medium device, String neighborAddress, long learnedAtMs) {
    }
}
