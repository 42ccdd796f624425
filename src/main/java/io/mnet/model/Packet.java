package io.mnet.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Unit transmitted on the medium. {@code id} only identifies one physical transmission
 * for de-duplication; ordering is carried by {@code sequence}.
 */
public record Packet(
        long id,
        long sequence,
        PacketFlags flags,
        String destination,
        String source,
        int port,
        byte[] payload
) {
    private static final byte[] EMPTY = new byte[0];

    public Packet {
        Objects.requireNonNull(flags, "flags");
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(source, "source");
        payload = payload == null ? EMPTY : payload;
    }

    public boolean addressedTo(String hostname) {
        return destination.equals(hostname) || Hosts.isBroadcast(destination);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Packet other)) {
            return false;
        }
        return id == other.id
                && sequence == other.sequence
                && port == other.port
                && flags.equals(other.flags)
                && destination.equals(other.destination)
                && source.equals(other.source)
                && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(id, sequence, flags, destination, source, port);
        return 31 * result + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "Packet[id=" + id + ", seq=" + sequence + ", flags=" + flags.toToken()
                + ", " + source + " -> " + destination + ":" + port + ", bytes=" + payload.length + "]";
    }
}
