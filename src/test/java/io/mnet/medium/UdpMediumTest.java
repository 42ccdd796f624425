package io.mnet.medium;

import io.mnet.config.TransportSettings;
import io.mnet.model.Delivery;
import io.mnet.transport.Transport;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.List;
import java.util.Optional;

final class UdpMediumTest {

    @Test
    void transportsExchangeReliableMessagesOverLoopbackUdp() throws Exception {
        UdpMedium mediumA = new UdpMedium(2048, new InetSocketAddress("127.0.0.1", 0), List.of());
        UdpMedium mediumB = new UdpMedium(2048, new InetSocketAddress("127.0.0.1", 0), List.of());
        try (Transport a = Transport.builder(TransportSettings.defaults("udp-a")).medium(mediumA).build();
             Transport b = Transport.builder(TransportSettings.defaults("udp-b")).medium(mediumB).build()) {
            mediumA.addTarget(new InetSocketAddress("127.0.0.1", mediumB.localPort()));
            mediumB.addTarget(new InetSocketAddress("127.0.0.1", mediumA.localPort()));
            Assertions.assertNotEquals(0, mediumA.localPort());

            a.send("udp-b", 3, "over udp", true);

            Optional<Delivery> received = Optional.empty();
            long deadline = System.currentTimeMillis() + 5_000L;
            while (received.isEmpty() && System.currentTimeMillis() < deadline) {
                received = b.receive(100);
            }
            Assertions.assertEquals("over udp", received.orElseThrow().messageText());
            Assertions.assertEquals("udp-a", received.get().host());

            while (a.stats().pendingSends() > 0 && System.currentTimeMillis() < deadline) {
                a.poll(100);
            }
            Assertions.assertEquals(0L, a.stats().pendingSends());
        }
    }

    @Test
    void rejectsUseBeforeOpenAndBadNeighbours() throws Exception {
        UdpMedium medium = new UdpMedium(2048, new InetSocketAddress("127.0.0.1", 0), List.of());
        Assertions.assertThrows(IOException.class, () -> medium.broadcast(new byte[] {1}));
        medium.open(frame -> {
        });
        try {
            Assertions.assertThrows(IllegalStateException.class, () -> medium.open(frame -> {
            }));
            Assertions.assertThrows(IOException.class, () -> medium.send("no-port", new byte[] {1}));
            Assertions.assertThrows(IOException.class, () -> medium.send("127.0.0.1:http", new byte[] {1}));
            Assertions.assertTrue(medium.address().startsWith("127.0.0.1:"));
        } finally {
            medium.close();
        }
        Assertions.assertThrows(IOException.class, () -> medium.broadcast(new byte[] {1}));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new UdpMedium(70_000, new InetSocketAddress(0), List.of()));
    }
}
