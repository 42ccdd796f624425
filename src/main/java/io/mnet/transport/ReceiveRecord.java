package io.mnet.transport;

import io.mnet.model.PacketFlags;

final class ReceiveRecord {
    private final long arrivedAtMs;
    private final PacketFlags flags;
    private final int port;
    private byte[] payload;

    ReceiveRecord(long arrivedAtMs, PacketFlags flags, int port, byte[] payload) {
        this.arrivedAtMs = arrivedAtMs;
        this.flags = flags;
        this.port = port;
        this.payload = payload;
    }

    long arrivedAtMs() {
        return arrivedAtMs;
    }

    PacketFlags flags() {
        return flags;
    }

    int port() {
        return port;
    }

    boolean consumed() {
        return payload == null;
    }

    byte[] payload() {
        return payload;
    }

    byte[] take() {
        byte[] out = payload;
        payload = null;
        return out;
    }
}
