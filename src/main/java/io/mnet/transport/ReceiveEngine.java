package io.mnet.transport;

import io.mnet.config.TransportSettings;
import io.mnet.model.Delivery;
import io.mnet.model.Packet;
import io.mnet.model.PacketFlags;
import io.mnet.model.SequenceKey;
import io.mnet.model.StreamKey;
import io.mnet.observability.TransportEventLog;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Random;

/**
 * Consumes packets addressed to this host: routes acks to the send engine, orders
 * reliable streams, reassembles fragments and acknowledges reliable data. Not
 * thread-safe; the transport guards it.
 */
public final class ReceiveEngine {
    private final TransportSettings settings;
    private final SendEngine sendEngine;
    private final FloodForwarder link;
    private final TransportStats stats;
    private final TransportEventLog eventLog;
    private final Random random;
    private final Map<SequenceKey, ReceiveRecord> records = new HashMap<>();
    private final Map<StreamKey, PeerReceiveState> peers = new HashMap<>();

    public ReceiveEngine(
            TransportSettings settings,
            SendEngine sendEngine,
            FloodForwarder link,
            TransportStats stats,
            TransportEventLog eventLog,
            Random random
    ) {
        this.settings = settings;
        this.sendEngine = sendEngine;
        this.link = link;
        this.stats = stats;
        this.eventLog = eventLog;
        this.random = random;
    }

    /**
     * @return complete messages that became deliverable, in order
     */
    public List<Delivery> accept(Packet packet, long nowMs) {
        PacketFlags flags = packet.flags();
        if (flags.ack()) {
            sendEngine.onAck(packet.source(), packet.sequence(), nowMs);
            return List.of();
        }
        long max = settings.maxSequence();
        if (packet.sequence() < 1 || packet.sequence() > max) {
            stats.malformed.incrementAndGet();
            return List.of();
        }
        StreamKey stream = new StreamKey(packet.source(), flags.reliable());
        long seq = packet.sequence();
        SequenceKey key = stream.at(seq);
        ReceiveRecord existing = records.get(key);
        ReceiveRecord incoming = new ReceiveRecord(nowMs, flags, packet.port(), packet.payload());

        if (!stream.reliable()) {
            // Flood copies are already filtered by id, so a reused sequence is a new message.
            records.put(key, incoming);
            List<Delivery> out = new ArrayList<>(1);
            assembleUnordered(stream, seq, out);
            return out;
        }

        PeerReceiveState peer = peers.computeIfAbsent(stream, k -> new PeerReceiveState());
        Long last = peer.lastDelivered;
        // Only a sequence we still hold a record for can be a replay. Unknown sequences are
        // buffered wherever they fall in the window.
        boolean behind = existing != null && last != null && !Sequences.isAhead(seq, last, max);
        List<Delivery> out = new ArrayList<>();
        if (behind && (existing.consumed() || flags.syn())) {
            stats.duplicates.incrementAndGet();
        } else if (flags.syn() || (last != null && seq == Sequences.next(last, max))) {
            records.put(key, incoming);
            if (flags.syn()) {
                eventLog.log("connect", stream.host(), Map.of(
                        "sequence", seq,
                        "previous", last == null ? 0L : last
                ));
            }
            peer.lastDelivered = seq;
            deliverInOrder(stream, seq, out);
            long next = Sequences.next(seq, max);
            int steps = 0;
            ReceiveRecord buffered = records.get(stream.at(next));
            while (buffered != null && !buffered.consumed() && steps++ < records.size()) {
                peer.lastDelivered = next;
                deliverInOrder(stream, next, out);
                next = Sequences.next(next, max);
                buffered = records.get(stream.at(next));
            }
        } else {
            records.put(key, incoming);
        }
        sendAck(stream.host(), packet.port(), peer.lastDelivered == null ? 0L : peer.lastDelivered, nowMs);
        return out;
    }

    public int evictOlderThan(long horizonMs) {
        int before = records.size();
        records.values().removeIf(record -> record.arrivedAtMs() < horizonMs);
        return before - records.size();
    }

    public OptionalLong lastDelivered(String host) {
        PeerReceiveState peer = peers.get(StreamKey.reliable(host));
        return peer == null || peer.lastDelivered == null ? OptionalLong.empty() : OptionalLong.of(peer.lastDelivered);
    }

    private void deliverInOrder(StreamKey stream, long seq, List<Delivery> out) {
        ReceiveRecord record = records.get(stream.at(seq));
        if (record == null || record.consumed()) {
            return;
        }
        PacketFlags flags = record.flags();
        if (!flags.fragmented()) {
            deliver(stream.host(), record.port(), record.take(), out);
        } else if (flags.terminalFragment()) {
            collectFragments(stream, seq, out);
        }
    }

    private void assembleUnordered(StreamKey stream, long seq, List<Delivery> out) {
        ReceiveRecord record = records.get(stream.at(seq));
        if (!record.flags().fragmented()) {
            deliver(stream.host(), record.port(), record.take(), out);
            return;
        }
        long max = settings.maxSequence();
        long terminal = seq;
        int steps = 0;
        while (record != null && !record.consumed() && record.flags().moreFragments()) {
            if (steps++ >= records.size()) {
                return;
            }
            terminal = Sequences.next(terminal, max);
            record = records.get(stream.at(terminal));
        }
        if (record == null || record.consumed() || !record.flags().terminalFragment()) {
            return;
        }
        collectFragments(stream, terminal, out);
    }

    /**
     * Walks back from a terminal fragment and concatenates the chain if every piece is
     * present. Leaves everything in place otherwise.
     */
    private void collectFragments(StreamKey stream, long terminal, List<Delivery> out) {
        long max = settings.maxSequence();
        ReceiveRecord last = records.get(stream.at(terminal));
        int count = last.flags().fragmentCount();
        if (count > records.size()) {
            return;
        }
        ReceiveRecord[] chain = new ReceiveRecord[count];
        long seq = terminal;
        for (int i = count - 1; i >= 0; i--) {
            ReceiveRecord piece = records.get(stream.at(seq));
            boolean expected = i == count - 1
                    ? piece != null && piece.flags().terminalFragment()
                    : piece != null && piece.flags().moreFragments();
            if (!expected || piece.consumed()) {
                return;
            }
            chain[i] = piece;
            seq = Sequences.previous(seq, max);
        }
        ByteArrayOutputStream message = new ByteArrayOutputStream();
        for (ReceiveRecord piece : chain) {
            message.writeBytes(piece.take());
        }
        deliver(stream.host(), last.port(), message.toByteArray(), out);
    }

    private void deliver(String host, int port, byte[] message, List<Delivery> out) {
        out.add(new Delivery(host, port, message));
        stats.delivered.incrementAndGet();
        eventLog.log("deliver", host, Map.of("port", port, "bytes", message.length));
    }

    private void sendAck(String host, int port, long sequence, long nowMs) {
        Packet ack = new Packet(
                random.nextLong(),
                sequence,
                PacketFlags.ACK,
                host,
                settings.hostname(),
                port,
                null
        );
        link.transmit(ack, nowMs);
        stats.acksSent.incrementAndGet();
    }
}
