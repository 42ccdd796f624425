package io.mnet.transport;

import io.mnet.model.PacketFlags;
import io.mnet.model.SendHandle;
import io.mnet.model.SequenceKey;

import java.util.concurrent.CompletableFuture;

/**
 * A reliable fragment kept for retransmission. The payload is cleared once the peer
 * acknowledged it; the record itself stays until the drop timeout so late acks still
 * match.
 */
final class SendRecord {
    private final SequenceKey key;
    private final long createdAtMs;
    private final int port;
    private final CompletableFuture<Boolean> acknowledgement = new CompletableFuture<>();
    private long lastTransmitAtMs;
    private long lastId;
    private PacketFlags flags;
    private byte[] payload;

    SendRecord(SequenceKey key, long createdAtMs, long id, PacketFlags flags, int port, byte[] payload) {
        this.key = key;
        this.createdAtMs = createdAtMs;
        this.lastTransmitAtMs = createdAtMs;
        this.lastId = id;
        this.flags = flags;
        this.port = port;
        this.payload = payload;
    }

    SequenceKey key() {
        return key;
    }

    long createdAtMs() {
        return createdAtMs;
    }

    long lastTransmitAtMs() {
        return lastTransmitAtMs;
    }

    long lastId() {
        return lastId;
    }

    PacketFlags flags() {
        return flags;
    }

    int port() {
        return port;
    }

    byte[] payload() {
        return payload;
    }

    boolean pending() {
        return payload != null;
    }

    SendHandle handle() {
        return new SendHandle(key.stream().host(), key.sequence(), acknowledgement);
    }

    void retransmitted(long id, long nowMs) {
        this.lastId = id;
        this.lastTransmitAtMs = nowMs;
    }

    /**
     * @return true when the flag was not already set
     */
    boolean forceSyn() {
        if (flags.syn()) {
            return false;
        }
        flags = flags.withSyn();
        return true;
    }

    void acknowledge() {
        payload = null;
        acknowledgement.complete(Boolean.TRUE);
    }

    byte[] drop() {
        byte[] lost = payload;
        payload = null;
        acknowledgement.complete(Boolean.FALSE);
        return lost;
    }
}
