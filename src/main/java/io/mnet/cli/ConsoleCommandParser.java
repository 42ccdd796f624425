package io.mnet.cli;

import io.mnet.model.Hosts;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parses lines typed into a running node:
 * <pre>
 * send &lt;host&gt; &lt;port&gt; &lt;message...&gt;
 * rsend &lt;host&gt; &lt;port&gt; &lt;message...&gt;
 * broadcast &lt;port&gt; &lt;message...&gt;
 * stats | metrics | quit
 * </pre>
 */
final class ConsoleCommandParser {
    private ConsoleCommandParser() {
    }

    static ConsoleCommand parse(String raw) {
        List<String> tokens = parseTokens(raw);
        if (tokens.isEmpty()) {
            return null;
        }
        String op = tokens.get(0).toLowerCase(Locale.ROOT);
        switch (op) {
            case "send", "rsend" -> {
                if (tokens.size() < 3) {
                    throw new IllegalArgumentException("Usage: " + op + " <host> <port> <message>");
                }
                boolean reliable = "rsend".equals(op);
                String host = tokens.get(1);
                if (reliable && Hosts.isBroadcast(host)) {
                    throw new IllegalArgumentException("Broadcast address not allowed for rsend");
                }
                return new ConsoleCommand(Op.SEND, host, parsePort(tokens.get(2)), joinTail(tokens, 3), reliable);
            }
            case "broadcast" -> {
                if (tokens.size() < 2) {
                    throw new IllegalArgumentException("Usage: broadcast <port> <message>");
                }
                return new ConsoleCommand(Op.SEND, Hosts.BROADCAST, parsePort(tokens.get(1)), joinTail(tokens, 2), false);
            }
            case "stats" -> {
                return new ConsoleCommand(Op.STATS, null, 0, "", false);
            }
            case "metrics" -> {
                return new ConsoleCommand(Op.METRICS, null, 0, "", false);
            }
            case "quit", "exit" -> {
                return new ConsoleCommand(Op.QUIT, null, 0, "", false);
            }
            default -> throw new IllegalArgumentException("Unknown command: " + tokens.get(0));
        }
    }

    static List<String> parseTokens(String raw) {
        List<String> out = new ArrayList<>();
        if (raw == null || raw.isBlank()) {
            return out;
        }
        for (String token : raw.trim().split("\\s+")) {
            if (!token.isBlank()) {
                out.add(token.trim());
            }
        }
        return out;
    }

    static String joinTail(List<String> tokens, int startIndex) {
        if (tokens == null || tokens.isEmpty() || startIndex >= tokens.size()) {
            return "";
        }
        return String.join(" ", tokens.subList(startIndex, tokens.size()));
    }

    private static int parsePort(String raw) {
        try {
            int port = Integer.parseInt(raw);
            if (port < 0) {
                throw new IllegalArgumentException("Invalid port: " + raw);
            }
            return port;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port: " + raw, e);
        }
    }

    enum Op {
        SEND,
        STATS,
        METRICS,
        QUIT
    }

    record ConsoleCommand(Op op, String host, int port, String message, boolean reliable) {
    }
}
