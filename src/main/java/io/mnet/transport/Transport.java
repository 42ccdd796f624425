package io.mnet.transport;

import io.mnet.config.TransportSettings;
import io.mnet.medium.InboundFrame;
import io.mnet.medium.Medium;
import io.mnet.model.ConnectionLostListener;
import io.mnet.model.Delivery;
import io.mnet.model.Hosts;
import io.mnet.model.Packet;
import io.mnet.model.SendHandle;
import io.mnet.model.StreamKey;
import io.mnet.observability.TransportEventLog;
import io.mnet.wire.FrameCodec;
import io.mnet.wire.MalformedFrameException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Random;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Message transport for one host. There is no background protocol thread: retransmission,
 * forwarding, acknowledgement and reassembly all happen inside {@link #poll} and
 * {@link #receive}, so callers must keep calling one of them even when they have nothing
 * to read.
 *
 * <p>Sends may come from any thread. Only one thread pumps at a time.
 */
public final class Transport implements AutoCloseable {
    private final TransportSettings settings;
    private final List<Medium> media;
    private final Clock clock;
    private final TransportEventLog eventLog;
    private final ConnectionLostListener defaultListener;
    private final TransportStats stats = new TransportStats();
    private final DedupCache dedup = new DedupCache();
    private final RouteCache routes;
    private final StaticRoutes staticRoutes;
    private final FloodForwarder forwarder;
    private final SendEngine sendEngine;
    private final ReceiveEngine receiveEngine;
    private final LinkedBlockingQueue<InboundFrame> inbound = new LinkedBlockingQueue<>();
    private final ArrayDeque<Delivery> ready = new ArrayDeque<>();
    private final Object lock = new Object();
    private final ReentrantLock pumpLock = new ReentrantLock();
    private volatile boolean closed;

    private Transport(Builder builder) {
        this.settings = builder.settings;
        this.media = List.copyOf(builder.media);
        this.clock = builder.clock;
        this.eventLog = builder.eventLog;
        this.defaultListener = builder.listener;
        this.routes = settings.routeCache() ? new RouteCache() : null;
        this.staticRoutes = builder.staticRoutes.build();
        this.forwarder = new FloodForwarder(media, dedup, routes, staticRoutes, stats, eventLog);
        this.sendEngine = new SendEngine(settings, forwarder, stats, eventLog, builder.random);
        this.receiveEngine = new ReceiveEngine(settings, sendEngine, forwarder, stats, eventLog, builder.random);
    }

    public static Builder builder(TransportSettings settings) {
        return new Builder(settings);
    }

    public String hostname() {
        return settings.hostname();
    }

    public TransportSettings settings() {
        return settings;
    }

    public Optional<SendHandle> send(String host, int port, String message, boolean reliable) {
        return send(host, port, message.getBytes(StandardCharsets.UTF_8), reliable, false);
    }

    public Optional<SendHandle> send(String host, int port, byte[] message, boolean reliable) {
        return send(host, port, message, reliable, false);
    }

    /**
     * Sends {@code message} to {@code host} on virtual {@code port}. With {@code waitForAck}
     * a reliable send blocks until the last fragment is acknowledged (handle returned) or
     * times out (empty), pumping the transport itself when no other thread is.
     *
     * @throws IllegalArgumentException for a reliable broadcast or invalid arguments
     */
    public Optional<SendHandle> send(String host, int port, byte[] message, boolean reliable, boolean waitForAck) {
        ensureOpen();
        if (reliable && Hosts.isBroadcast(host)) {
            throw new IllegalArgumentException("Broadcast address not allowed for reliable transmission");
        }
        if (isLoopback(host)) {
            return sendLocal(port, message, reliable);
        }
        Optional<SendHandle> handle;
        synchronized (lock) {
            handle = sendEngine.send(host, port, message, reliable, clock.millis());
        }
        if (handle.isPresent() && waitForAck) {
            return awaitAck(handle.get());
        }
        return handle;
    }

    /**
     * Blocks until the handle is acknowledged or dropped by the drop timeout.
     */
    public Optional<SendHandle> awaitAck(SendHandle handle) {
        return awaitAck(handle, null);
    }

    /**
     * Like {@link #awaitAck(SendHandle)} but gives up after {@code timeout} of wall-clock
     * time. A null timeout waits for the protocol outcome.
     */
    public Optional<SendHandle> awaitAck(SendHandle handle, Duration timeout) {
        long deadline = timeout == null ? Long.MAX_VALUE : System.nanoTime() + timeout.toNanos();
        long pollMs = settings.ackPollIntervalMs();
        while (!handle.isDone() && !closed) {
            if (System.nanoTime() - deadline >= 0) {
                return Optional.empty();
            }
            if (pumpLock.tryLock()) {
                try {
                    pumpOnce(pollMs, defaultListener);
                } finally {
                    pumpLock.unlock();
                }
                continue;
            }
            try {
                handle.acknowledgement().get(pollMs, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                continue;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (ExecutionException e) {
                throw new RuntimeException("Acknowledgement failed for " + handle, e);
            }
        }
        return handle.isAcknowledged() ? Optional.of(handle) : Optional.empty();
    }

    public Optional<Delivery> receive(long timeoutMs) {
        return receive(timeoutMs, defaultListener);
    }

    /**
     * Returns a buffered message if one is ready, otherwise pumps once (waiting up to
     * {@code timeoutMs} for a frame) and returns what that produced.
     */
    public Optional<Delivery> receive(long timeoutMs, ConnectionLostListener listener) {
        Optional<Delivery> buffered = takeReady();
        if (buffered.isPresent() || closed) {
            return buffered;
        }
        poll(timeoutMs, listener);
        return takeReady();
    }

    public boolean poll(long timeoutMs) {
        return poll(timeoutMs, defaultListener);
    }

    /**
     * Runs housekeeping and processes at most one inbound frame. Completed messages are
     * queued for {@link #receive}.
     *
     * @return true when a frame was taken off the queue
     */
    public boolean poll(long timeoutMs, ConnectionLostListener listener) {
        pumpLock.lock();
        try {
            return pumpOnce(timeoutMs, listener);
        } finally {
            pumpLock.unlock();
        }
    }

    public TransportStats.Snapshot stats() {
        synchronized (lock) {
            return stats.snapshot(sendEngine.pendingCount(), dedup.size());
        }
    }

    public OptionalLong lastDelivered(String host) {
        synchronized (lock) {
            return receiveEngine.lastDelivered(host);
        }
    }

    public OptionalLong lastSent(String host, boolean reliable) {
        synchronized (lock) {
            return sendEngine.lastSent(new StreamKey(host, reliable));
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        for (Medium medium : media) {
            medium.close();
        }
        eventLog.log("close", null, Map.of());
    }

    private boolean pumpOnce(long timeoutMs, ConnectionLostListener listener) {
        List<SendEngine.LostSend> lost;
        synchronized (lock) {
            lost = housekeeping(clock.millis());
        }
        ConnectionLostListener callback = listener == null ? ConnectionLostListener.NONE : listener;
        for (SendEngine.LostSend send : lost) {
            callback.onConnectionLost(send.handle(), send.port(), send.payload());
        }
        InboundFrame frame;
        try {
            frame = timeoutMs <= 0 ? inbound.poll() : inbound.poll(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        if (frame == null) {
            return false;
        }
        synchronized (lock) {
            process(frame, clock.millis());
        }
        return true;
    }

    private List<SendEngine.LostSend> housekeeping(long nowMs) {
        List<SendEngine.LostSend> lost = sendEngine.housekeeping(nowMs);
        long dropHorizon = nowMs - settings.dropTimeoutMs();
        dedup.evictOlderThan(dropHorizon);
        receiveEngine.evictOlderThan(dropHorizon);
        if (routes != null) {
            routes.evictOlderThan(nowMs - settings.routeTimeoutMs());
        }
        return lost;
    }

    private void process(InboundFrame frame, long nowMs) {
        if (frame.channel() != settings.channel()) {
            stats.wrongChannel.incrementAndGet();
            return;
        }
        Packet packet;
        try {
            packet = FrameCodec.decode(frame.data());
        } catch (MalformedFrameException e) {
            stats.malformed.incrementAndGet();
            eventLog.log("drop", frame.senderAddress(), Map.of("reason", String.valueOf(e.getMessage())));
            return;
        }
        if (!dedup.record(packet.id(), nowMs)) {
            stats.duplicates.incrementAndGet();
            return;
        }
        stats.framesReceived.incrementAndGet();
        String hostname = settings.hostname();
        if (routes != null && !hostname.equals(packet.source()) && !staticRoutes.blocksLearning(packet.source())) {
            routes.learn(packet.source(), frame.device(), frame.senderAddress(), nowMs);
        }
        if (!hostname.equals(packet.destination()) && settings.forwarding()) {
            forwarder.forward(packet, frame.data());
        }
        if (packet.addressedTo(hostname)) {
            ready.addAll(receiveEngine.accept(packet, nowMs));
        }
    }

    private Optional<SendHandle> sendLocal(int port, byte[] message, boolean reliable) {
        if (port < 0) {
            throw new IllegalArgumentException("Invalid port: " + port);
        }
        if (message == null) {
            throw new IllegalArgumentException("Message must not be null");
        }
        String hostname = settings.hostname();
        long sequence;
        synchronized (lock) {
            sequence = sendEngine.allocateSequence(StreamKey.unreliable(hostname));
            ready.add(new Delivery(hostname, port, message.clone()));
        }
        stats.delivered.incrementAndGet();
        eventLog.log("loopback", hostname, Map.of("port", port, "bytes", message.length));
        return reliable ? Optional.of(SendHandle.acknowledged(hostname, sequence)) : Optional.empty();
    }

    private Optional<Delivery> takeReady() {
        synchronized (lock) {
            return Optional.ofNullable(ready.poll());
        }
    }

    private boolean isLoopback(String host) {
        return Hosts.LOCALHOST.equals(host) || settings.hostname().equals(host);
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Transport is closed: " + settings.hostname());
        }
    }

    public static final class Builder {
        private final TransportSettings settings;
        private final List<Medium> media = new ArrayList<>();
        private Clock clock = Clock.systemUTC();
        private Random random = new Random();
        private TransportEventLog eventLog = TransportEventLog.disabled();
        private ConnectionLostListener listener = ConnectionLostListener.NONE;
        private final StaticRoutes.Builder staticRoutes = StaticRoutes.builder();

        private Builder(TransportSettings settings) {
            if (settings == null) {
                throw new IllegalArgumentException("Settings must not be null");
            }
            this.settings = settings;
        }

        public Builder medium(Medium medium) {
            media.add(medium);
            return this;
        }

        public Builder clock(Clock value) {
            this.clock = value;
            return this;
        }

        public Builder random(Random value) {
            this.random = value;
            return this;
        }

        public Builder eventLog(TransportEventLog value) {
            this.eventLog = value == null ? TransportEventLog.disabled() : value;
            return this;
        }

        /**
         * Listener used by {@link Transport#receive(long)} and by sends that wait for an ack.
         */
        public Builder connectionLostListener(ConnectionLostListener value) {
            this.listener = value == null ? ConnectionLostListener.NONE : value;
            return this;
        }

        /**
         * Pins traffic for {@code host} to one neighbour reached through {@code device},
         * which must also be added with {@link #medium}. Host "*" routes everything
         * without its own entry, broadcasts included, and disables route learning.
         */
        public Builder staticRoute(String host, Medium device, String neighborAddress) {
            staticRoutes.route(host, device, neighborAddress);
            return this;
        }

        public Transport build() {
            for (StaticRoutes.Entry entry : staticRoutes.build().entries().values()) {
                if (!media.contains(entry.device())) {
                    throw new IllegalArgumentException(
                            "Static route uses device " + entry.device().address() + " that is not attached");
                }
            }
            Transport transport = new Transport(this);
            for (Medium medium : transport.media) {
                try {
                    medium.open(transport.inbound::offer);
                } catch (IOException e) {
                    transport.close();
                    throw new RuntimeException("Failed to open medium " + medium.address(), e);
                }
            }
            return transport;
        }
    }
}
