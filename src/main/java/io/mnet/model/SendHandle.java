package io.mnet.model;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Identifies the last fragment of a reliable send. The acknowledgement future completes
 * with {@code true} once the peer acknowledged it and {@code false} once it timed out.
 */
public final class SendHandle {
    private final String host;
    private final long sequence;
    private final CompletableFuture<Boolean> acknowledgement;

    public SendHandle(String host, long sequence, CompletableFuture<Boolean> acknowledgement) {
        this.host = Objects.requireNonNull(host, "host");
        this.sequence = sequence;
        this.acknowledgement = Objects.requireNonNull(acknowledgement, "acknowledgement");
    }

    public static SendHandle acknowledged(String host, long sequence) {
        return new SendHandle(host, sequence, CompletableFuture.completedFuture(Boolean.TRUE));
    }

    public String host() {
        return host;
    }

    public long sequence() {
        return sequence;
    }

    public CompletableFuture<Boolean> acknowledgement() {
        return acknowledgement;
    }

    public boolean isDone() {
        return acknowledgement.isDone();
    }

    public boolean isAcknowledged() {
        return acknowledgement.isDone() && Boolean.TRUE.equals(acknowledgement.getNow(Boolean.FALSE));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SendHandle other)) {
            return false;
        }
        return sequence == other.sequence && host.equals(other.host);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, sequence);
    }

    @Override
    public String toString() {
        return host + "," + sequence;
    }
}
