package io.mnet.model;

/**
 * Receives reliable fragments that stayed unacknowledged past the drop timeout.
 * The handle matches the one returned by {@code send} only for the last fragment
 * of a message.
 */
@FunctionalInterface
public interface ConnectionLostListener {
    ConnectionLostListener NONE = (handle, port, payload) -> {
    };

    void onConnectionLost(SendHandle handle, int port, byte[] payload);
}
