package io.mnet.wire;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.mnet.model.Packet;
import io.mnet.model.PacketFlags;
import io.mnet.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Converts packets to and from the compact JSON frame carried by a medium.
 *
 * <pre>{"id":..,"sequence":..,"flags":"s1r1f3","destination":..,"source":..,"port":..,"payload":"base64"}</pre>
 */
public final class FrameCodec {
    private FrameCodec() {
    }

    public static byte[] encode(Packet packet) {
        WireFrame frame = new WireFrame(
                packet.id(),
                packet.sequence(),
                packet.flags().toToken(),
                packet.destination(),
                packet.source(),
                packet.port(),
                Base64.getEncoder().encodeToString(packet.payload())
        );
        try {
            return Jsons.compact().writeValueAsBytes(frame);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to encode frame " + packet, e);
        }
    }

    /**
     * @throws MalformedFrameException when the bytes are not a complete mnet frame
     */
    public static Packet decode(byte[] data) throws MalformedFrameException {
        if (data == null || data.length == 0) {
            throw new MalformedFrameException("Empty frame");
        }
        WireFrame frame;
        try {
            frame = Jsons.compact().readValue(data, WireFrame.class);
        } catch (IOException e) {
            throw new MalformedFrameException("Unreadable frame: " + preview(data), e);
        }
        if (frame == null
                || frame.id() == null
                || frame.sequence() == null
                || frame.destination() == null
                || frame.source() == null
                || frame.port() == null) {
            throw new MalformedFrameException("Incomplete frame: " + preview(data));
        }
        try {
            PacketFlags flags = PacketFlags.parse(frame.flags());
            byte[] payload = frame.payload() == null || frame.payload().isEmpty()
                    ? new byte[0]
                    : Base64.getDecoder().decode(frame.payload());
            return new Packet(
                    frame.id(),
                    frame.sequence(),
                    flags,
                    frame.destination(),
                    frame.source(),
                    frame.port(),
                    payload
            );
        } catch (IllegalArgumentException e) {
            throw new MalformedFrameException("Invalid frame field: " + e.getMessage(), e);
        }
    }

    private static String preview(byte[] data) {
        int len = Math.min(data.length, 64);
        return new String(data, 0, len, StandardCharsets.UTF_8);
    }

    record WireFrame(
            Long id,
            Long sequence,
            String flags,
            String destination,
            String source,
            Integer port,
            String payload
    ) {
    }
}
