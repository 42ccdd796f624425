package io.mnet.model;

/**
 * One direction of traffic with one peer. Reliable and unreliable traffic keep separate
 * sequence spaces so their host-sequence pairs never collide.
 */
public record StreamKey(String host, boolean reliable) {
    public static StreamKey reliable(String host) {
        return new StreamKey(host, true);
    }

    public static StreamKey unreliable(String host) {
        return new StreamKey(host, false);
    }

    public SequenceKey at(long sequence) {
        return new SequenceKey(this, sequence);
    }

    @Override
    public String toString() {
        return (reliable ? "r" : "u") + host;
    }
}
