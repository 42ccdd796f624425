package io.mnet.medium;

import java.util.Objects;

/**
 * Raw bytes heard on a medium, with the interface that heard them and the channel they
 * arrived on.
 */
public record InboundFrame(Medium device, String senderAddress, int channel, byte[] data) {
    public InboundFrame {
        Objects.requireNonNull(device, "device");
        Objects.requireNonNull(data, "data");
    }
}
