package io.mnet.model;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * A complete message handed to the application by {@code receive}.
 */
public record Delivery(String host, int port, byte[] message) {
    public Delivery {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(message, "message");
    }

    public String messageText() {
        return new String(message, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Delivery other)) {
            return false;
        }
        return port == other.port && host.equals(other.host) && Arrays.equals(message, other.message);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(host, port) + Arrays.hashCode(message);
    }

    @Override
    public String toString() {
        return "Delivery[host=" + host + ", port=" + port + ", bytes=" + message.length + "]";
    }
}
