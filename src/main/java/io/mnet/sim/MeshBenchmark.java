package io.mnet.sim;

import io.mnet.config.TransportSettings;
import io.mnet.medium.LossyMedium;
import io.mnet.medium.SimulatedNetwork;
import io.mnet.medium.SimulationClock;
import io.mnet.model.ConnectionLostListener;
import io.mnet.model.Delivery;
import io.mnet.model.Hosts;
import io.mnet.transport.Transport;
import io.mnet.transport.TransportStats;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs a line of simulated hosts over a lossy radio on a stepped clock, exchanging random
 * reliable, unreliable and broadcast messages, then checks what arrived.
 */
public final class MeshBenchmark {
    public static final int BENCHMARK_PORT = 100;
    private static final String PAD_CHARS = "abcdefghijklmnopqrstuvwxyz0123456789";
    private static final int PUMP_LIMIT = 100_000;

    private MeshBenchmark() {
    }

    public static Outcome run(Options options) {
        Options opts = options.sanitized();
        Random random = new Random(opts.seed());
        SimulationClock clock = new SimulationClock();
        SimulatedNetwork network = new SimulatedNetwork();
        List<Node> nodes = new ArrayList<>(opts.hosts());
        for (int i = 1; i <= opts.hosts(); i++) {
            String hostname = "host" + i;
            TransportSettings settings = TransportSettings.defaults(hostname).withMtu(opts.mtu());
            SimulatedNetwork.Device device = network.device("dev-" + hostname, settings.channel());
            LossyMedium lossy = new LossyMedium(device, opts.dropChance(), opts.swapChance(),
                    LossyMedium.DEFAULT_MAX_SWAP_OFFSET, new Random(random.nextLong()));
            Node node = new Node(hostname, lossy);
            node.transport = Transport.builder(settings)
                    .medium(lossy)
                    .clock(clock)
                    .random(new Random(random.nextLong()))
                    .connectionLostListener(node.listener)
                    .build();
            nodes.add(node);
        }
        for (int i = 1; i < nodes.size(); i++) {
            network.link("dev-" + nodes.get(i - 1).hostname, "dev-" + nodes.get(i).hostname);
        }

        Tally tally = new Tally();
        Map<String, Long> nextIndex = new HashMap<>();
        for (int round = 0; round < opts.rounds(); round++) {
            for (Node node : nodes) {
                if (random.nextDouble() < opts.sendChance()) {
                    sendRandom(node, nodes, opts, random, nextIndex, tally);
                }
            }
            pumpAll(nodes, tally);
            clock.advanceMillis(opts.stepMs());
        }

        long drainSteps = Math.max(1L, (nodes.get(0).transport.settings().dropTimeoutMs() * 2) / opts.stepMs());
        for (long step = 0; step < drainSteps; step++) {
            // Nothing new is sent now, so held frames would otherwise wait forever.
            flushAll(nodes);
            pumpAll(nodes, tally);
            if (settled(nodes)) {
                break;
            }
            clock.advanceMillis(opts.stepMs());
        }
        flushAll(nodes);
        pumpAll(nodes, tally);

        long framesSent = 0L;
        long framesForwarded = 0L;
        long retransmissions = 0L;
        long lostFragments = 0L;
        long droppedFrames = 0L;
        for (Node node : nodes) {
            TransportStats.Snapshot stats = node.transport.stats();
            framesSent += stats.framesSent();
            framesForwarded += stats.framesForwarded();
            retransmissions += stats.retransmissions();
            lostFragments += node.lostFragments.get();
            droppedFrames += node.medium.dropped();
            node.transport.close();
        }
        return new Outcome(
                opts.hosts(),
                opts.rounds(),
                tally.reliableSent,
                tally.reliableDelivered,
                tally.unreliableSent,
                tally.unreliableDelivered,
                tally.broadcastSent,
                tally.broadcastDeliveries,
                tally.duplicates,
                tally.orderViolations,
                lostFragments,
                framesSent,
                framesForwarded,
                retransmissions,
                droppedFrames
        );
    }

    private static void sendRandom(
            Node from,
            List<Node> nodes,
            Options opts,
            Random random,
            Map<String, Long> nextIndex,
            Tally tally
    ) {
        boolean reliable = random.nextDouble() < opts.reliableChance();
        boolean broadcast = !reliable && random.nextDouble() < opts.broadcastChance();
        String to = broadcast ? Hosts.BROADCAST : nodes.get(random.nextInt(nodes.size())).hostname;
        char kind = broadcast ? 'b' : reliable ? 'r' : 'u';
        String streamKey = from.hostname + "|" + to + "|" + kind;
        long index = nextIndex.merge(streamKey, 1L, Long::sum);
        StringBuilder message = new StringBuilder()
                .append(from.hostname).append('|')
                .append(to).append('|')
                .append(kind).append('|')
                .append(index).append('|');
        int padding = opts.messageLengthMin() + random.nextInt(opts.messageLengthMax() - opts.messageLengthMin() + 1);
        for (int i = 0; i < padding; i++) {
            message.append(PAD_CHARS.charAt(random.nextInt(PAD_CHARS.length())));
        }
        from.transport.send(to, BENCHMARK_PORT, message.toString().getBytes(StandardCharsets.UTF_8), reliable, false);
        switch (kind) {
            case 'r' -> tally.reliableSent++;
            case 'u' -> tally.unreliableSent++;
            default -> tally.broadcastSent++;
        }
    }

    private static void flushAll(List<Node> nodes) {
        for (Node node : nodes) {
            try {
                node.medium.flush();
            } catch (IOException e) {
                throw new RuntimeException("Failed to flush held frames for " + node.hostname, e);
            }
        }
    }

    private static void pumpAll(List<Node> nodes, Tally tally) {
        boolean progress = true;
        int guard = 0;
        while (progress && guard++ < PUMP_LIMIT) {
            progress = false;
            for (Node node : nodes) {
                progress |= pump(node, tally);
            }
        }
    }

    /**
     * Drains everything currently queued on one host.
     */
    private static boolean pump(Node node, Tally tally) {
        boolean any = false;
        for (int i = 0; i < PUMP_LIMIT; i++) {
            Optional<Delivery> delivery = node.transport.receive(0, node.listener);
            if (delivery.isPresent()) {
                record(node, delivery.get(), tally);
                any = true;
                continue;
            }
            if (!node.transport.poll(0, node.listener)) {
                break;
            }
            any = true;
        }
        return any;
    }

    private static void record(Node node, Delivery delivery, Tally tally) {
        String[] parts = delivery.messageText().split("\\|", 5);
        if (parts.length < 4) {
            return;
        }
        String key = parts[0] + "|" + parts[1] + "|" + parts[2] + "@" + node.hostname;
        long index = Long.parseLong(parts[3]);
        Set<Long> seen = tally.seen.computeIfAbsent(key, k -> new HashSet<>());
        if (!seen.add(index)) {
            tally.duplicates++;
            return;
        }
        switch (parts[2]) {
            case "r" -> {
                tally.reliableDelivered++;
                Long previous = tally.lastReliable.put(key, index);
                if (previous != null && index <= previous) {
                    tally.orderViolations++;
                }
            }
            case "u" -> tally.unreliableDelivered++;
            default -> tally.broadcastDeliveries++;
        }
    }

    private static boolean settled(List<Node> nodes) {
        for (Node node : nodes) {
            if (node.transport.stats().pendingSends() > 0) {
                return false;
            }
        }
        return true;
    }

    private static final class Node {
        private final String hostname;
        private final LossyMedium medium;
        private final AtomicLong lostFragments = new AtomicLong();
        private final ConnectionLostListener listener = (handle, port, payload) -> lostFragments.incrementAndGet();
        private Transport transport;

        private Node(String hostname, LossyMedium medium) {
            this.hostname = hostname;
            this.medium = medium;
        }
    }

    private static final class Tally {
        private final Map<String, Set<Long>> seen = new HashMap<>();
        private final Map<String, Long> lastReliable = new HashMap<>();
        private long reliableSent;
        private long reliableDelivered;
        private long unreliableSent;
        private long unreliableDelivered;
        private long broadcastSent;
        private long broadcastDeliveries;
        private long duplicates;
        private long orderViolations;
    }

    public record Options(
            int hosts,
            int rounds,
            long stepMs,
            double sendChance,
            int messageLengthMin,
            int messageLengthMax,
            double reliableChance,
            double broadcastChance,
            double dropChance,
            double swapChance,
            int mtu,
            long seed
    ) {
        public static Options defaults() {
            return new Options(4, 200, 250L, 0.25, 0, 32, 0.5, 0.2,
                    LossyMedium.DEFAULT_DROP_CHANCE, LossyMedium.DEFAULT_SWAP_CHANCE, 10, 1L);
        }

        Options sanitized() {
            int safeMin = Math.max(0, messageLengthMin);
            return new Options(
                    Math.max(2, hosts),
                    Math.max(1, rounds),
                    Math.max(1L, stepMs),
                    clamp(sendChance),
                    safeMin,
                    Math.max(safeMin, messageLengthMax),
                    clamp(reliableChance),
                    clamp(broadcastChance),
                    clamp(dropChance),
                    clamp(swapChance),
                    Math.max(1, mtu),
                    seed
            );
        }

        private static double clamp(double value) {
            return Math.max(0.0, Math.min(1.0, value));
        }
    }

    public record Outcome(
            int hosts,
            int rounds,
            long reliableSent,
            long reliableDelivered,
            long unreliableSent,
            long unreliableDelivered,
            long broadcastSent,
            long broadcastDeliveries,
            long duplicates,
            long orderViolations,
            long lostFragments,
            long framesSent,
            long framesForwarded,
            long retransmissions,
            long droppedFrames
    ) {
    }
}
