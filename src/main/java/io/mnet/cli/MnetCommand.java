package io.mnet.cli;

import io.mnet.config.MnetConfig;
import io.mnet.config.TransportSettings;
import io.mnet.medium.UdpMedium;
import io.mnet.model.Delivery;
import io.mnet.model.SendHandle;
import io.mnet.observability.MetricsFormatter;
import io.mnet.observability.TransportEventLog;
import io.mnet.sim.MeshBenchmark;
import io.mnet.transport.Transport;
import io.mnet.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

@Command(
        name = "mnet",
        mixinStandardHelpOptions = true,
        description = "Mesh transport over UDP broadcast",
        subcommands = {
                MnetCommand.NodeCommand.class,
                MnetCommand.SendCommand.class,
                MnetCommand.BenchmarkCommand.class
        }
)
public final class MnetCommand implements Runnable {
    @Option(names = {"--root"}, description = "Directory holding mnet-settings.json and the event log", defaultValue = ".")
    String root;

    @Option(names = {"--hostname"}, description = "Override the hostname from settings")
    String hostname;

    @Option(names = {"--channel"}, description = "Override the hardware channel (UDP port) from settings")
    Integer channel;

    @Option(names = {"--event-log"}, defaultValue = "false", description = "Write protocol events to log/events.jsonl under --root")
    boolean eventLog;

    @Override
    public void run() {
        System.out.println("Use subcommands: node | send | benchmark");
    }

    MnetConfig config() {
        return MnetConfig.fromRoot(root);
    }

    TransportSettings settings() {
        TransportSettings settings = config().loadSettings();
        if (hostname != null && !hostname.isBlank()) {
            settings = settings.withHostname(hostname.trim());
        }
        if (channel != null) {
            settings = settings.withChannel(channel);
        }
        return settings;
    }

    Transport openTransport(TransportSettings settings, String bind, List<String> targets) {
        UdpMedium medium;
        if (bind == null && (targets == null || targets.isEmpty())) {
            medium = UdpMedium.broadcastOn(settings.channel());
        } else {
            InetSocketAddress bindAddress = bind == null
                    ? new InetSocketAddress(settings.channel())
                    : parseEndpoint(bind);
            List<InetSocketAddress> parsed = new ArrayList<>();
            if (targets != null) {
                for (String target : targets) {
                    parsed.add(parseEndpoint(target));
                }
            }
            if (parsed.isEmpty()) {
                parsed.add(new InetSocketAddress("255.255.255.255", settings.channel()));
            }
            medium = new UdpMedium(settings.channel(), bindAddress, parsed);
        }
        TransportEventLog log = eventLog
                ? new TransportEventLog(config().eventLogFile(), settings.hostname(), Clock.systemUTC())
                : TransportEventLog.disabled();
        return Transport.builder(settings)
                .medium(medium)
                .eventLog(log)
                .connectionLostListener((handle, port, payload) -> System.out.println(Jsons.toCompactJson(Map.of(
                        "event", "connection_lost",
                        "host", handle.host(),
                        "sequence", handle.sequence(),
                        "port", port
                ))))
                .build();
    }

    static InetSocketAddress parseEndpoint(String raw) {
        String value = raw == null ? "" : raw.trim();
        int sep = value.lastIndexOf(':');
        if (sep <= 0 || sep == value.length() - 1) {
            throw new IllegalArgumentException("Endpoint must be host:port, got: " + raw);
        }
        try {
            return new InetSocketAddress(value.substring(0, sep), Integer.parseInt(value.substring(sep + 1)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid endpoint port: " + raw, e);
        }
    }

    static Map<String, Object> deliveryRow(Delivery delivery) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("event", "message");
        row.put("host", delivery.host());
        row.put("port", delivery.port());
        row.put("message", delivery.messageText());
        return row;
    }

    @Command(name = "node", description = "Run a node: print received messages and accept console commands on stdin")
    static final class NodeCommand implements Callable<Integer> {
        @ParentCommand
        MnetCommand parent;

        @Option(names = {"--bind"}, description = "Local UDP endpoint host:port (default: all interfaces on the channel)")
        String bind;

        @Option(names = {"--targets"}, split = ",", description = "Broadcast targets host:port, comma-separated")
        List<String> targets;

        @Option(names = {"--duration-ms"}, defaultValue = "0", description = "Stop after this long; 0 runs until quit")
        long durationMs;

        @Option(names = {"--receive-timeout-ms"}, defaultValue = "100", description = "Wait per receive call")
        long receiveTimeoutMs;

        @Override
        public Integer call() throws Exception {
            TransportSettings settings = parent.settings();
            LinkedBlockingQueue<String> console = new LinkedBlockingQueue<>();
            AtomicBoolean running = new AtomicBoolean(true);
            Thread reader = new Thread(() -> readConsole(console, running), "mnet-console");
            reader.setDaemon(true);
            reader.start();
            Runtime.getRuntime().addShutdownHook(new Thread(() -> running.set(false), "mnet-shutdown-hook"));

            long deadline = durationMs > 0 ? System.currentTimeMillis() + durationMs : Long.MAX_VALUE;
            try (Transport transport = parent.openTransport(settings, bind, targets)) {
                System.out.println(Jsons.toCompactJson(Map.of(
                        "event", "started",
                        "hostname", transport.hostname(),
                        "channel", settings.channel()
                )));
                while (running.get() && System.currentTimeMillis() < deadline) {
                    String line;
                    while ((line = console.poll()) != null) {
                        if (!handleLine(transport, line)) {
                            running.set(false);
                            break;
                        }
                    }
                    Optional<Delivery> delivery = transport.receive(Math.max(1L, receiveTimeoutMs));
                    delivery.ifPresent(d -> System.out.println(Jsons.toCompactJson(deliveryRow(d))));
                }
                System.out.println(Jsons.toJson(transport.stats()));
            }
            return 0;
        }

        private boolean handleLine(Transport transport, String line) {
            ConsoleCommandParser.ConsoleCommand command;
            try {
                command = ConsoleCommandParser.parse(line);
            } catch (IllegalArgumentException e) {
                System.out.println(Jsons.toCompactJson(Map.of("event", "error", "error", e.getMessage())));
                return true;
            }
            if (command == null) {
                return true;
            }
            switch (command.op()) {
                case SEND -> {
                    Optional<SendHandle> handle = transport.send(
                            command.host(),
                            command.port(),
                            command.message().getBytes(StandardCharsets.UTF_8),
                            command.reliable(),
                            false
                    );
                    Map<String, Object> row = new LinkedHashMap<>();
                    row.put("event", "sent");
                    row.put("host", command.host());
                    row.put("port", command.port());
                    row.put("reliable", command.reliable());
                    row.put("handle", handle.map(SendHandle::toString).orElse(null));
                    System.out.println(Jsons.toCompactJson(row));
                }
                case STATS -> System.out.println(Jsons.toJson(transport.stats()));
                case METRICS -> System.out.print(MetricsFormatter.format(transport.stats(), transport.hostname()));
                case QUIT -> {
                    return false;
                }
                default -> throw new IllegalStateException("Unhandled console command: " + command.op());
            }
            return true;
        }

        private static void readConsole(LinkedBlockingQueue<String> console, AtomicBoolean running) {
            try (BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
                String line;
                while (running.get() && (line = in.readLine()) != null) {
                    console.offer(line);
                }
            } catch (IOException e) {
                console.offer("quit");
            }
        }
    }

    @Command(name = "send", description = "Send one message and exit")
    static final class SendCommand implements Callable<Integer> {
        @ParentCommand
        MnetCommand parent;

        @Parameters(index = "0", description = "Destination host, or * to broadcast")
        String host;

        @Parameters(index = "1", description = "Virtual port")
        int port;

        @Parameters(index = "2", description = "Message text")
        String message;

        @Option(names = {"--reliable"}, defaultValue = "false", description = "Use the reliable stream and wait for the ack")
        boolean reliable;

        @Option(names = {"--bind"}, description = "Local UDP endpoint host:port")
        String bind;

        @Option(names = {"--targets"}, split = ",", description = "Broadcast targets host:port, comma-separated")
        List<String> targets;

        @Option(names = {"--timeout-ms"}, defaultValue = "15000", description = "Give up waiting for the ack after this long")
        long timeoutMs;

        @Override
        public Integer call() {
            TransportSettings settings = parent.settings();
            try (Transport transport = parent.openTransport(settings, bind, targets)) {
                Optional<SendHandle> handle = transport.send(
                        host,
                        port,
                        message.getBytes(StandardCharsets.UTF_8),
                        reliable,
                        false
                );
                boolean acknowledged = false;
                if (handle.isPresent()) {
                    acknowledged = transport.awaitAck(handle.get(), Duration.ofMillis(Math.max(1L, timeoutMs))).isPresent();
                }
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("host", host);
                row.put("port", port);
                row.put("reliable", reliable);
                row.put("sequence", handle.map(SendHandle::sequence).orElse(null));
                row.put("acknowledged", acknowledged);
                System.out.println(Jsons.toJson(row));
                return reliable && !acknowledged ? 2 : 0;
            }
        }
    }

    @Command(name = "benchmark", description = "Run the simulated lossy mesh benchmark and print the outcome")
    static final class BenchmarkCommand implements Callable<Integer> {
        @Option(names = {"--hosts"}, defaultValue = "4", description = "Hosts in the line topology")
        int hosts;

        @Option(names = {"--rounds"}, defaultValue = "200", description = "Simulation steps with traffic")
        int rounds;

        @Option(names = {"--step-ms"}, defaultValue = "250", description = "Simulated time per step")
        long stepMs;

        @Option(names = {"--drop-chance"}, defaultValue = "0.1", description = "Probability to drop a transmitted frame")
        double dropChance;

        @Option(names = {"--swap-chance"}, defaultValue = "0.1", description = "Probability to reorder a transmitted frame")
        double swapChance;

        @Option(names = {"--mtu"}, defaultValue = "10", description = "Payload bytes per fragment")
        int mtu;

        @Option(names = {"--seed"}, defaultValue = "1", description = "Random seed")
        long seed;

        @Override
        public Integer call() {
            MeshBenchmark.Options defaults = MeshBenchmark.Options.defaults();
            MeshBenchmark.Options options = new MeshBenchmark.Options(
                    hosts,
                    rounds,
                    stepMs,
                    defaults.sendChance(),
                    defaults.messageLengthMin(),
                    defaults.messageLengthMax(),
                    defaults.reliableChance(),
                    defaults.broadcastChance(),
                    dropChance,
                    swapChance,
                    mtu,
                    seed
            );
            MeshBenchmark.Outcome outcome = MeshBenchmark.run(options);
            System.out.println(Jsons.toJson(outcome));
            return outcome.duplicates() == 0 && outcome.orderViolations() == 0 ? 0 : 1;
        }
    }
}
