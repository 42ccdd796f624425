package io.mnet.transport;

import io.mnet.config.TransportSettings;
import io.mnet.model.Hosts;
import io.mnet.model.Packet;
import io.mnet.model.PacketFlags;
import io.mnet.model.SendHandle;
import io.mnet.model.SequenceKey;
import io.mnet.model.StreamKey;
import io.mnet.observability.TransportEventLog;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Random;

/**
 * Fragments outgoing messages, numbers them per peer stream and keeps reliable
 * fragments until they are acknowledged or time out. Not thread-safe; the transport
 * guards it.
 */
public final class SendEngine {
    private final TransportSettings settings;
    private final FloodForwarder link;
    private final TransportStats stats;
    private final TransportEventLog eventLog;
    private final Random random;
    private final Map<StreamKey, Long> lastSent = new HashMap<>();
    private final Map<SequenceKey, SendRecord> records = new LinkedHashMap<>();

    public SendEngine(
            TransportSettings settings,
            FloodForwarder link,
            TransportStats stats,
            TransportEventLog eventLog,
            Random random
    ) {
        this.settings = settings;
        this.link = link;
        this.stats = stats;
        this.eventLog = eventLog;
        this.random = random;
    }

    /**
     * Splits {@code message} into MTU-sized fragments and transmits each one.
     *
     * @return the handle of the last fragment for reliable sends, empty otherwise
     * @throws IllegalArgumentException for a reliable broadcast or invalid arguments
     */
    public Optional<SendHandle> send(String host, int port, byte[] message, boolean reliable, long nowMs) {
        validate(host, port, message, reliable);
        StreamKey stream = new StreamKey(host, reliable);
        int mtu = settings.mtu();
        int count = message.length <= mtu ? 1 : (message.length + mtu - 1) / mtu;
        SendRecord last = null;
        long firstSequence = 0L;
        for (int i = 1; i <= count; i++) {
            byte[] chunk = count == 1
                    ? message.clone()
                    : Arrays.copyOfRange(message, (i - 1) * mtu, Math.min(i * mtu, message.length));
            PacketFlags flags = count == 1 ? PacketFlags.data(reliable) : PacketFlags.fragment(reliable, i, count);
            Allocation allocation = allocate(stream);
            if (allocation.syn()) {
                flags = flags.withSyn();
            }
            if (i == 1) {
                firstSequence = allocation.sequence();
            }
            Packet packet = new Packet(
                    random.nextLong(),
                    allocation.sequence(),
                    flags,
                    host,
                    settings.hostname(),
                    port,
                    chunk
            );
            link.transmit(packet, nowMs);
            if (reliable) {
                SendRecord record = new SendRecord(stream.at(allocation.sequence()), nowMs, packet.id(), flags, port, chunk);
                SendRecord replaced = records.put(record.key(), record);
                if (replaced != null && replaced.pending()) {
                    // More than maxSequence fragments in flight on one stream.
                    replaced.drop();
                }
                last = record;
            }
        }
        eventLog.log("send", host, Map.of(
                "port", port,
                "reliable", reliable,
                "first_sequence", firstSequence,
                "fragments", count,
                "bytes", message.length
        ));
        return last == null ? Optional.empty() : Optional.of(last.handle());
    }

    /**
     * Takes the next sequence of a stream without transmitting anything.
     */
    long allocateSequence(StreamKey stream) {
        return allocate(stream).sequence();
    }

    /**
     * Handles an acknowledgement from {@code host} naming the last sequence it delivered
     * in order.
     */
    public void onAck(String host, long sequence, long nowMs) {
        stats.acksReceived.incrementAndGet();
        StreamKey stream = StreamKey.reliable(host);
        long max = settings.maxSequence();
        SendRecord record = records.get(stream.at(sequence));
        if (record != null) {
            long seq = sequence;
            int steps = 0;
            while (record != null && record.pending() && steps++ < records.size()) {
                record.acknowledge();
                seq = Sequences.previous(seq, max);
                record = records.get(stream.at(seq));
            }
            if (steps > 0) {
                eventLog.log("ack", host, Map.of("sequence", sequence, "cleared", steps));
            }
            return;
        }
        resynchronize(stream, sequence);
    }

    /**
     * Retransmits overdue fragments and removes records past the drop timeout.
     *
     * @return fragments that were still pending when they timed out
     */
    public List<LostSend> housekeeping(long nowMs) {
        List<LostSend> lost = new ArrayList<>();
        Iterator<SendRecord> it = records.values().iterator();
        while (it.hasNext()) {
            SendRecord record = it.next();
            if (nowMs - record.createdAtMs() >= settings.dropTimeoutMs()) {
                if (record.pending()) {
                    SendHandle handle = record.handle();
                    int port = record.port();
                    byte[] payload = record.drop();
                    lost.add(new LostSend(handle, port, payload));
                    stats.lost.incrementAndGet();
                    eventLog.log("lost", handle.host(), Map.of("sequence", handle.sequence(), "port", port));
                }
                it.remove();
            } else if (record.pending() && nowMs - record.lastTransmitAtMs() >= settings.retransmitIntervalMs()) {
                retransmit(record, nowMs);
            }
        }
        return lost;
    }

    public int pendingCount() {
        int pending = 0;
        for (SendRecord record : records.values()) {
            if (record.pending()) {
                pending++;
            }
        }
        return pending;
    }

    public OptionalLong lastSent(StreamKey stream) {
        Long last = lastSent.get(stream);
        return last == null ? OptionalLong.empty() : OptionalLong.of(last);
    }

    private void retransmit(SendRecord record, long nowMs) {
        SequenceKey key = record.key();
        Packet packet = new Packet(
                random.nextLong(),
                key.sequence(),
                record.flags(),
                key.stream().host(),
                settings.hostname(),
                record.port(),
                record.payload()
        );
        long replacedId = record.lastId();
        link.transmit(packet, nowMs);
        record.retransmitted(packet.id(), nowMs);
        stats.retransmissions.incrementAndGet();
        eventLog.log("retransmit", key.stream().host(), Map.of(
                "sequence", key.sequence(),
                "id", packet.id(),
                "replaced_id", replacedId,
                "flags", record.flags().toToken()
        ));
    }

    /**
     * The peer acknowledged a sequence we hold no record for, so it lost track of this
     * stream. Unless it names the sequence right before our oldest pending fragment, that
     * fragment carries SYN on its next retransmission.
     */
    private void resynchronize(StreamKey stream, long ackSequence) {
        Long last = lastSent.get(stream);
        if (last == null) {
            return;
        }
        long max = settings.maxSequence();
        SendRecord first = records.get(stream.at(last));
        if (first == null || !first.pending()) {
            return;
        }
        long firstSequence = last;
        int steps = 0;
        while (steps++ < records.size()) {
            long before = Sequences.previous(firstSequence, max);
            SendRecord candidate = records.get(stream.at(before));
            if (candidate == null || !candidate.pending()) {
                break;
            }
            first = candidate;
            firstSequence = before;
        }
        if (Sequences.previous(firstSequence, max) != ackSequence && first.forceSyn()) {
            stats.resyncs.incrementAndGet();
            eventLog.log("resync", stream.host(), Map.of(
                    "ack_sequence", ackSequence,
                    "syn_sequence", firstSequence
            ));
        }
    }

    private Allocation allocate(StreamKey stream) {
        long max = settings.maxSequence();
        Long previous = lastSent.get(stream);
        boolean syn = previous == null;
        long sequence = Sequences.next(syn ? Sequences.random(random, max) : previous, max);
        lastSent.put(stream, sequence);
        return new Allocation(sequence, syn);
    }

    private static void validate(String host, int port, byte[] message, boolean reliable) {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("Host must not be blank");
        }
        if (port < 0) {
            throw new IllegalArgumentException("Invalid port: " + port);
        }
        if (message == null) {
            throw new IllegalArgumentException("Message must not be null");
        }
        if (reliable && Hosts.isBroadcast(host)) {
            throw new IllegalArgumentException("Broadcast address not allowed for reliable transmission");
        }
    }

    private record Allocation(long sequence, boolean syn) {
    }

    public record LostSend(SendHandle handle, int port, byte[] payload) {
    }
}
