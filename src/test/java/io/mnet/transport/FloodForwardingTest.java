package io.mnet.transport;

import io.mnet.config.TransportSettings;
import io.mnet.medium.SimulationClock;
import io.mnet.model.Delivery;
import io.mnet.model.Packet;
import io.mnet.model.PacketFlags;
import io.mnet.wire.FrameCodec;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class FloodForwardingTest {

    @Test
    void relayCarriesReliableTrafficAcrossALine() {
        try (MeshFixture mesh = new MeshFixture()) {
            Transport a = mesh.add("a");
            Transport b = mesh.add("b");
            mesh.add("c");
            mesh.link("a", "b");
            mesh.link("b", "c");

            a.send("c", 8, "over the hill", true);
            mesh.settle();

            assertEquals(List.of("over the hill"), mesh.deliveredTexts("c"));
            assertTrue(mesh.delivered("b").isEmpty());
            assertEquals(2L, b.stats().framesForwarded());
            assertEquals(0L, a.stats().pendingSends());
            // The relay's copy of our own frame comes back and is discarded.
            assertTrue(a.stats().duplicates() >= 1);
        }
    }

    @Test
    void leafHostDoesNotRelay() {
        try (MeshFixture mesh = new MeshFixture()) {
            Transport a = mesh.add("a");
            Transport b = mesh.add(TransportSettings.defaults("b").withForwarding(false));
            mesh.add("c");
            mesh.link("a", "b");
            mesh.link("b", "c");

            a.send("c", 8, "stuck", true);
            a.send("*", 8, "hello all", false);
            mesh.settle();

            assertTrue(mesh.delivered("c").isEmpty());
            assertEquals(List.of("hello all"), mesh.deliveredTexts("b"));
            assertEquals(0L, b.stats().framesForwarded());
            assertEquals(1L, a.stats().pendingSends());
        }
    }

    @Test
    void broadcastReachesEveryHostOnceInATriangle() {
        try (MeshFixture mesh = new MeshFixture()) {
            Transport a = mesh.add("a");
            Transport b = mesh.add("b");
            Transport c = mesh.add("c");
            mesh.network.linkAll();

            a.send("*", 30, "everyone", false);
            mesh.settle();

            assertEquals(List.of("everyone"), mesh.deliveredTexts("b"));
            assertEquals(List.of("everyone"), mesh.deliveredTexts("c"));
            assertTrue(mesh.delivered("a").isEmpty());
            assertEquals(30, mesh.delivered("b").get(0).port());
            assertEquals("a", mesh.delivered("c").get(0).host());
            assertTrue(b.stats().duplicates() + c.stats().duplicates() >= 1);
            assertEquals(2L, a.stats().duplicates());
        }
    }

    @Test
    void broadcastTravelsThroughRelays() {
        try (MeshFixture mesh = new MeshFixture()) {
            Transport a = mesh.add("a");
            mesh.add("b");
            mesh.add("c");
            mesh.add("d");
            mesh.link("a", "b");
            mesh.link("b", "c");
            mesh.link("c", "d");

            a.send("*", 1, "ripple", false);
            mesh.settle();

            assertEquals(List.of("ripple"), mesh.deliveredTexts("b"));
            assertEquals(List.of("ripple"), mesh.deliveredTexts("c"));
            assertEquals(List.of("ripple"), mesh.deliveredTexts("d"));
            assertEquals(0L, a.stats().pendingSends());
        }
    }

    @Test
    void learnedRoutesStopFloodingToUninvolvedNeighbours() {
        try (MeshFixture mesh = new MeshFixture()) {
            Transport a = mesh.add(TransportSettings.defaults("a").withRouteCache(true, 30_000L));
            mesh.add(TransportSettings.defaults("b").withRouteCache(true, 30_000L));
            mesh.add(TransportSettings.defaults("c").withRouteCache(true, 30_000L));
            Transport d = mesh.add(TransportSettings.defaults("d").withRouteCache(true, 30_000L));
            mesh.link("a", "b");
            mesh.link("b", "c");
            mesh.link("b", "d");

            a.send("c", 2, "first", true);
            mesh.settle();
            long heardByD = d.stats().framesReceived() + d.stats().duplicates();
            assertTrue(heardByD > 0);

            a.send("c", 2, "second", true);
            mesh.settle();

            assertEquals(List.of("first", "second"), mesh.deliveredTexts("c"));
            assertEquals(heardByD, d.stats().framesReceived() + d.stats().duplicates());
            assertEquals(0L, a.stats().pendingSends());
        }
    }

    @Test
    void framesFromAnotherChannelAreIgnored() {
        try (MeshFixture mesh = new MeshFixture()) {
            Transport a = mesh.add("a");
            Transport b = mesh.add(TransportSettings.defaults("b").withChannel(7));
            mesh.link("a", "b");

            a.send("b", 1, "wrong band", false);
            mesh.settle();

            assertTrue(mesh.delivered("b").isEmpty());
            assertEquals(1L, b.stats().wrongChannel());
            assertEquals(0L, b.stats().framesReceived());
        }
    }

    @Test
    void malformedAndRepeatedFramesAreCountedAndDropped() {
        CapturingMedium medium = new CapturingMedium("radio0", 2048);
        try (Transport me = Transport.builder(TransportSettings.defaults("me"))
                .medium(medium)
                .clock(new SimulationClock())
                .build()) {
            medium.inject("not a frame".getBytes(StandardCharsets.UTF_8));
            medium.inject(new byte[0]);
            byte[] frame = FrameCodec.encode(new Packet(
                    77L, 5L, PacketFlags.data(false), "me", "peer-host", 4, "hi".getBytes(StandardCharsets.UTF_8)));
            medium.inject(frame);
            medium.inject(frame);

            Optional<Delivery> delivery = me.receive(0);
            for (int i = 0; i < 4 && delivery.isEmpty(); i++) {
                delivery = me.receive(0);
            }
            while (me.poll(0)) {
                assertTrue(me.receive(0).isEmpty());
            }

            assertEquals("hi", delivery.orElseThrow().messageText());
            assertEquals("peer-host", delivery.get().host());
            assertEquals(2L, me.stats().malformed());
            assertEquals(1L, me.stats().duplicates());
            assertEquals(1L, me.stats().framesReceived());
            assertTrue(medium.broadcasts.isEmpty());
        }
    }

    @Test
    void framesForOtherHostsAreRelayedByteForByte() {
        CapturingMedium medium = new CapturingMedium("radio0", 2048);
        try (Transport me = Transport.builder(TransportSettings.defaults("me"))
                .medium(medium)
                .clock(new SimulationClock())
                .build()) {
            byte[] frame = FrameCodec.encode(new Packet(
                    91L, 12L, PacketFlags.data(true), "far-away", "peer-host", 4, new byte[] {1, 2, 3}));
            medium.inject(frame);
            me.poll(0);

            assertEquals(1, medium.broadcasts.size());
            assertArrayEquals(frame, medium.broadcasts.get(0));
            assertTrue(medium.unicastTargets.isEmpty());
            assertTrue(me.receive(0).isEmpty());
            assertEquals(1L, me.stats().framesForwarded());
            assertEquals(0L, me.stats().acksSent());
        }
    }

    @Test
    void staticRouteWinsOverALearnedOne() {
        CapturingMedium medium = new CapturingMedium("radio0", 2048);
        try (Transport me = Transport.builder(TransportSettings.defaults("me").withRouteCache(true, 30_000L))
                .medium(medium)
                .clock(new SimulationClock())
                .staticRoute("far", medium, "gateway")
                .build()) {
            medium.inject(FrameCodec.encode(new Packet(
                    31L, 1L, PacketFlags.data(false), "me", "far", 4, "from far".getBytes(StandardCharsets.UTF_8))));
            medium.inject(FrameCodec.encode(new Packet(
                    32L, 1L, PacketFlags.data(false), "me", "near", 4, "from near".getBytes(StandardCharsets.UTF_8))));
            while (me.poll(0)) {
                me.receive(0);
            }

            me.send("far", 4, "pinned", false);
            me.send("near", 4, "learned", false);
            me.send("*", 4, "everyone", false);

            assertEquals(List.of("gateway", "peer"), medium.unicastTargets);
            assertEquals(3, medium.broadcasts.size());
        }
    }

    @Test
    void catchAllStaticRouteCarriesBroadcastsAndDisablesLearning() {
        CapturingMedium radio = new CapturingMedium("radio0", 2048);
        CapturingMedium wired = new CapturingMedium("wired0", 2048);
        try (Transport me = Transport.builder(TransportSettings.defaults("me").withRouteCache(true, 30_000L))
                .medium(radio)
                .medium(wired)
                .clock(new SimulationClock())
                .staticRoute("*", wired, "hub")
                .staticRoute("far", radio, "gateway")
                .build()) {
            radio.inject(FrameCodec.encode(new Packet(
                    41L, 1L, PacketFlags.data(false), "me", "near", 4, "hello".getBytes(StandardCharsets.UTF_8))));
            while (me.poll(0)) {
                me.receive(0);
            }

            me.send("near", 4, "via hub", false);
            me.send("*", 4, "via hub too", false);
            me.send("far", 4, "pinned", false);

            assertEquals(List.of("hub", "hub"), wired.unicastTargets);
            assertEquals(List.of("gateway"), radio.unicastTargets);
            assertEquals(1, radio.broadcasts.size());
        }
    }

    @Test
    void staticRouteThroughUnattachedDeviceIsRejected() {
        CapturingMedium attached = new CapturingMedium("radio0", 2048);
        CapturingMedium stray = new CapturingMedium("radio1", 2048);
        Transport.Builder builder = Transport.builder(TransportSettings.defaults("me"))
                .medium(attached)
                .staticRoute("far", stray, "gateway");

        assertThrows(IllegalArgumentException.class, builder::build);
        assertThrows(IllegalArgumentException.class,
                () -> Transport.builder(TransportSettings.defaults("me")).staticRoute("far", attached, " "));
    }

    @Test
    void staticRoutesSteerReliableTrafficAroundAHost() {
        try (MeshFixture mesh = new MeshFixture()) {
            Transport a = mesh.add(TransportSettings.defaults("a"), Map.of("c", "dev-b"));
            mesh.add("b");
            mesh.add(TransportSettings.defaults("c"), Map.of("a", "dev-b"));
            Transport d = mesh.add("d");
            mesh.link("a", "b");
            mesh.link("a", "d");
            mesh.link("b", "c");
            mesh.link("d", "c");

            a.send("c", 2, "through b", true);
            mesh.settle();

            assertEquals(List.of("through b"), mesh.deliveredTexts("c"));
            assertEquals(0L, d.stats().framesReceived() + d.stats().duplicates());
            assertEquals(0L, a.stats().pendingSends());
        }
    }
}
