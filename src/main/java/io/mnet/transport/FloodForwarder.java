package io.mnet.transport;

import io.mnet.medium.Medium;
import io.mnet.model.Hosts;
import io.mnet.model.Packet;
import io.mnet.observability.TransportEventLog;
import io.mnet.wire.FrameCodec;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Puts frames on the media. Own packets are recorded in the dedup cache before they
 * leave so echoes coming back from neighbours are ignored. Relayed frames keep their
 * original bytes and id.
 */
public final class FloodForwarder {
    private final List<Medium> media;
    private final DedupCache dedup;
    private final RouteCache routes;
    private final StaticRoutes staticRoutes;
    private final TransportStats stats;
    private final TransportEventLog eventLog;

    /**
     * @param routes null to never use learned routes
     */
    public FloodForwarder(
            List<Medium> media,
            DedupCache dedup,
            RouteCache routes,
            StaticRoutes staticRoutes,
            TransportStats stats,
            TransportEventLog eventLog
    ) {
        this.media = List.copyOf(media);
        this.dedup = dedup;
        this.routes = routes;
        this.staticRoutes = staticRoutes == null ? StaticRoutes.none() : staticRoutes;
        this.stats = stats;
        this.eventLog = eventLog;
    }

    public void transmit(Packet packet, long nowMs) {
        dedup.record(packet.id(), nowMs);
        byte[] frame = FrameCodec.encode(packet);
        if (route(packet.destination(), frame)) {
            stats.framesSent.incrementAndGet();
        }
    }

    public void forward(Packet packet, byte[] frame) {
        if (route(packet.destination(), frame)) {
            stats.framesForwarded.incrementAndGet();
        }
        eventLog.log("forward", packet.destination(), Map.of(
                "id", packet.id(),
                "source", packet.source(),
                "sequence", packet.sequence()
        ));
    }

    public List<Medium> media() {
        return media;
    }

    /**
     * Host-specific static entry first, then a learned route, then the static catch-all.
     * A failed unicast falls through to the next choice and finally to flooding.
     */
    private boolean route(String destination, byte[] frame) {
        Optional<StaticRoutes.Entry> fixed = staticRoutes.lookup(destination).filter(this::ownsDevice);
        if (fixed.isPresent() && unicast(fixed.get().device(), fixed.get().neighborAddress(), destination, frame)) {
            return true;
        }
        Optional<StaticRoutes.Entry> catchAll = staticRoutes.catchAll().filter(this::ownsDevice);
        if (catchAll.isEmpty() && routes != null && !Hosts.isBroadcast(destination)) {
            Optional<RouteCache.Route> cached = routes.lookup(destination).filter(r -> media.contains(r.device()));
            if (cached.isPresent()) {
                RouteCache.Route route = cached.get();
                if (unicast(route.device(), route.neighborAddress(), destination, frame)) {
                    return true;
                }
                routes.forget(destination);
            }
        }
        if (catchAll.isPresent() && unicast(catchAll.get().device(), catchAll.get().neighborAddress(), destination, frame)) {
            return true;
        }
        boolean any = false;
        for (Medium medium : media) {
            try {
                medium.broadcast(frame);
                any = true;
            } catch (IOException e) {
                recordFailure(medium, destination, e);
            }
        }
        return any;
    }

    private boolean unicast(Medium device, String neighborAddress, String destination, byte[] frame) {
        try {
            device.send(neighborAddress, frame);
            return true;
        } catch (IOException e) {
            recordFailure(device, destination, e);
            return false;
        }
    }

    private boolean ownsDevice(StaticRoutes.Entry entry) {
        return media.contains(entry.device());
    }

    private void recordFailure(Medium medium, String destination, IOException e) {
        stats.transmitFailures.incrementAndGet();
        eventLog.log("transmit_failed", destination, Map.of(
                "device", medium.address(),
                "error", String.valueOf(e.getMessage())
        ));
    }
}
