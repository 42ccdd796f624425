package io.mnet.transport;

import io.mnet.config.TransportSettings;
import io.mnet.medium.SimulatedNetwork;
import io.mnet.model.Packet;
import io.mnet.model.SendHandle;
import io.mnet.wire.FrameCodec;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class ReliableDeliveryTest {

    @Test
    void fragmentedMessageIsReassembledByteForByte() throws Exception {
        try (MeshFixture mesh = new MeshFixture()) {
            Transport a = mesh.add(TransportSettings.defaults("a").withMtu(4));
            mesh.add("b");
            mesh.link("a", "b");
            byte[] message = new byte[23];
            for (int i = 0; i < message.length; i++) {
                message[i] = (byte) (i * 11 - 128);
            }

            SendHandle handle = a.send("b", 9, message, true).orElseThrow();
            mesh.settle();

            assertEquals(1, mesh.delivered("b").size());
            assertArrayEquals(message, mesh.delivered("b").get(0).message());
            assertEquals(6L, a.stats().framesSent());
            assertTrue(handle.isAcknowledged());
            assertEquals(0L, a.stats().pendingSends());
        }
    }

    @Test
    void unreliableFragmentsAssembleInAnyArrivalOrder() throws Exception {
        try (MeshFixture mesh = new MeshFixture()) {
            Transport a = mesh.add(TransportSettings.defaults("a").withMtu(3));
            mesh.add("b");
            mesh.link("a", "b");
            mesh.network.setAutoDeliver(false);

            a.send("b", 2, "abcdefghij", false);
            List<SimulatedNetwork.Transmission> frames = new ArrayList<>(mesh.network.inFlight());
            assertEquals(4, frames.size());
            Collections.reverse(frames);
            for (SimulatedNetwork.Transmission frame : frames) {
                mesh.network.deliver(frame);
            }
            mesh.settle();

            assertEquals(List.of("abcdefghij"), mesh.deliveredTexts("b"));
        }
    }

    @Test
    void reliableMessagesArriveInSendOrderDespiteReordering() throws Exception {
        try (MeshFixture mesh = new MeshFixture()) {
            Transport a = mesh.add(TransportSettings.defaults("a").withMtu(5));
            mesh.add("b");
            mesh.link("a", "b");
            mesh.network.setAutoDeliver(false);

            a.send("b", 1, "first message", true);
            a.send("b", 1, "second", true);
            a.send("b", 1, "third one here", true);
            List<SimulatedNetwork.Transmission> frames = new ArrayList<>(mesh.network.inFlight());
            Collections.shuffle(frames, new Random(42));
            Collections.reverse(frames);
            for (SimulatedNetwork.Transmission frame : frames) {
                mesh.network.deliver(frame);
                mesh.settle();
            }
            mesh.network.deliverAll();
            mesh.settle();

            assertEquals(List.of("first message", "second", "third one here"), mesh.deliveredTexts("b"));
        }
    }

    @Test
    void retransmittedDuplicateIsNotDeliveredTwice() throws Exception {
        try (MeshFixture mesh = new MeshFixture()) {
            Transport a = mesh.add("a");
            Transport b = mesh.add("b");
            mesh.link("a", "b");
            mesh.network.setAutoDeliver(false);

            a.send("b", 4, "only once", true);
            mesh.network.deliverAll();
            mesh.settle();
            long delivered = b.lastDelivered("a").orElseThrow();
            // Lose the ack so the sender retransmits.
            assertEquals(1, mesh.network.dropAll());

            mesh.advance(3_000L);
            assertEquals(1L, a.stats().retransmissions());
            mesh.network.deliverAll();
            mesh.settle();

            assertEquals(List.of("only once"), mesh.deliveredTexts("b"));
            assertEquals(1L, b.stats().duplicates());
            assertEquals(delivered, b.lastDelivered("a").orElseThrow());
            mesh.network.deliverAll();
            mesh.settle();
            assertEquals(0L, a.stats().pendingSends());
        }
    }

    @Test
    void retransmitsWithFreshIdAfterIntervalAndReportsLossAfterDropTimeout() throws Exception {
        try (MeshFixture mesh = new MeshFixture()) {
            Transport a = mesh.add("a");
            mesh.add("b");
            mesh.link("a", "b");
            mesh.network.setAutoDeliver(false);

            SendHandle handle = a.send("b", 12, "into the void", true).orElseThrow();
            Packet original = FrameCodec.decode(mesh.network.inFlight().get(0).data());
            mesh.network.dropAll();

            mesh.advance(2_999L);
            assertTrue(mesh.network.inFlight().isEmpty());

            mesh.advance(1L);
            assertEquals(1, mesh.network.inFlight().size());
            Packet again = FrameCodec.decode(mesh.network.inFlight().get(0).data());
            assertNotEquals(original.id(), again.id());
            assertEquals(original.sequence(), again.sequence());
            assertEquals(original.flags(), again.flags());
            assertArrayEquals(original.payload(), again.payload());
            mesh.network.dropAll();

            mesh.advance(3_000L);
            mesh.advance(3_000L);
            mesh.network.dropAll();
            mesh.advance(2_999L);
            mesh.network.dropAll();
            assertTrue(mesh.lost("a").isEmpty());
            assertFalse(handle.isDone());

            mesh.advance(1L);
            assertEquals(List.of(handle), mesh.lost("a"));
            assertTrue(handle.isDone());
            assertFalse(handle.isAcknowledged());
            assertEquals(3L, a.stats().retransmissions());
            assertEquals(0L, a.stats().pendingSends());
        }
    }

    @Test
    void sequenceWrapsAroundWithoutLosingOrder() {
        try (MeshFixture mesh = new MeshFixture()) {
            Transport a = mesh.add(TransportSettings.defaults("a").withMaxSequence(8));
            mesh.add(TransportSettings.defaults("b").withMaxSequence(8));
            mesh.link("a", "b");
            List<String> expected = new ArrayList<>();

            for (int i = 0; i < 13; i++) {
                String text = "msg-" + i;
                expected.add(text);
                a.send("b", 1, text, true);
                if (i % 3 == 2) {
                    mesh.settle();
                }
            }
            mesh.settle();

            assertEquals(expected, mesh.deliveredTexts("b"));
            assertEquals(0L, a.stats().pendingSends());
            long last = a.lastSent("b", true).orElseThrow();
            assertTrue(last >= 1 && last <= 8);
        }
    }

    @Test
    void framesFarAheadInTheWindowAreBufferedNotDropped() {
        try (MeshFixture mesh = new MeshFixture()) {
            Transport a = mesh.add(TransportSettings.defaults("a").withMaxSequence(8));
            Transport b = mesh.add(TransportSettings.defaults("b").withMaxSequence(8));
            mesh.link("a", "b");
            a.send("b", 1, "m0", true);
            mesh.settle();
            long first = b.lastDelivered("a").orElseThrow();
            mesh.network.setAutoDeliver(false);

            for (int i = 1; i <= 6; i++) {
                a.send("b", 1, "m" + i, true);
            }
            List<SimulatedNetwork.Transmission> frames = new ArrayList<>(mesh.network.inFlight());
            assertEquals(6, frames.size());
            Collections.reverse(frames);
            for (SimulatedNetwork.Transmission frame : frames) {
                mesh.network.deliver(frame);
                mesh.settle();
            }
            mesh.network.deliverAll();
            mesh.settle();

            assertEquals(List.of("m0", "m1", "m2", "m3", "m4", "m5", "m6"), mesh.deliveredTexts("b"));
            assertEquals((first + 5) % 8 + 1, b.lastDelivered("a").orElseThrow());
            assertEquals(0L, b.stats().duplicates());
            assertEquals(0L, a.stats().retransmissions());
            assertEquals(0L, a.stats().pendingSends());
        }
    }

    @Test
    void unreliableMessagesKeepFlowingAfterSequenceWraps() {
        try (MeshFixture mesh = new MeshFixture()) {
            Transport a = mesh.add(TransportSettings.defaults("a").withMaxSequence(8));
            Transport b = mesh.add(TransportSettings.defaults("b").withMaxSequence(8));
            mesh.link("a", "b");
            List<String> expected = new ArrayList<>();

            for (int i = 0; i < 13; i++) {
                String text = "beacon-" + i;
                expected.add(text);
                a.send("b", 3, text, false);
                mesh.settle();
            }

            assertEquals(expected, mesh.deliveredTexts("b"));
            assertEquals(0L, b.stats().duplicates());
        }
    }
}
