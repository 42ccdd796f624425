package io.mnet.transport;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Running counters for one transport. Updated from the pump and from senders.
 */
public final class TransportStats {
    final AtomicLong framesSent = new AtomicLong();
    final AtomicLong framesReceived = new AtomicLong();
    final AtomicLong framesForwarded = new AtomicLong();
    final AtomicLong duplicates = new AtomicLong();
    final AtomicLong malformed = new AtomicLong();
    final AtomicLong wrongChannel = new AtomicLong();
    final AtomicLong retransmissions = new AtomicLong();
    final AtomicLong acksSent = new AtomicLong();
    final AtomicLong acksReceived = new AtomicLong();
    final AtomicLong resyncs = new AtomicLong();
    final AtomicLong delivered = new AtomicLong();
    final AtomicLong lost = new AtomicLong();
    final AtomicLong transmitFailures = new AtomicLong();

    Snapshot snapshot(long pendingSends, long dedupEntries) {
        return new Snapshot(
                framesSent.get(),
                framesReceived.get(),
                framesForwarded.get(),
                duplicates.get(),
                malformed.get(),
                wrongChannel.get(),
                retransmissions.get(),
                acksSent.get(),
                acksReceived.get(),
                resyncs.get(),
                delivered.get(),
                lost.get(),
                transmitFailures.get(),
                pendingSends,
                dedupEntries
        );
    }

    public record Snapshot(
            long framesSent,
            long framesReceived,
            long framesForwarded,
            long duplicates,
            long malformed,
            long wrongChannel,
            long retransmissions,
            long acksSent,
            long acksReceived,
            long resyncs,
            long delivered,
            long lost,
            long transmitFailures,
            long pendingSends,
            long dedupEntries
    ) {
    }
}
