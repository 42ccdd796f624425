package io.mnet.transport;

import java.util.HashMap;
import java.util.Map;

/**
 * Packet ids seen recently, both received and transmitted, with the time they were
 * first seen. Not thread-safe; the transport guards it.
 */
public final class DedupCache {
    private final Map<Long, Long> firstSeen = new HashMap<>();

    public boolean seen(long id) {
        return firstSeen.containsKey(id);
    }

    /**
     * @return false when the id was already present
     */
    public boolean record(long id, long nowMs) {
        return firstSeen.putIfAbsent(id, nowMs) == null;
    }

    public int evictOlderThan(long horizonMs) {
        int before = firstSeen.size();
        firstSeen.values().removeIf(seenAt -> seenAt < horizonMs);
        return before - firstSeen.size();
    }

    public int size() {
        return firstSeen.size();
    }
}
