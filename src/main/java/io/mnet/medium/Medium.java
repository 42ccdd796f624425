package io.mnet.medium;

import java.io.Closeable;
import java.io.IOException;
import java.util.function.Consumer;

/**
 * One network interface the transport can transmit on. Implementations push every frame
 * they hear into the sink given to {@link #open(Consumer)}; they never run protocol logic.
 */
public interface Medium extends Closeable {
    /**
     * Address of this interface as neighbours see it in {@link InboundFrame#senderAddress()}.
     */
    String address();

    void open(Consumer<InboundFrame> sink) throws IOException;

    /**
     * Transmits to every neighbour in range.
     */
    void broadcast(byte[] frame) throws IOException;

    /**
     * Transmits to a single neighbour interface.
     */
    void send(String neighborAddress, byte[] frame) throws IOException;

    @Override
    void close();
}
