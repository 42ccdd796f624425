package io.mnet.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import io.mnet.model.Delivery;
import io.mnet.model.Hosts;
import io.mnet.model.SendHandle;
import io.mnet.transport.Transport;
import io.mnet.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Remote calls on top of one transport port. Both sides declare a call name; the
 * receiving side binds a handler. Messages look like {@code s,name[args]} (synchronous
 * request), {@code a,name[args]} (asynchronous request) or {@code r,name[results]}.
 *
 * <p>{@link #callSync} blocks until the results come back, so some other thread must be
 * feeding received messages to {@link #handleMessage} (for example through
 * {@link #serve}) while it waits.
 */
public final class MeshRpcServer {
    private final Transport transport;
    private final int port;
    private final long resultsTimeoutMs;
    private final Map<String, CallDeclaration> declarations = new ConcurrentHashMap<>();
    private final Map<String, RpcHandler> handlers = new ConcurrentHashMap<>();
    private final ReentrantLock syncLock = new ReentrantLock();
    private volatile PendingCall pending;

    public MeshRpcServer(Transport transport, int port) {
        this(transport, port, transport.settings().dropTimeoutMs() + 1_000L);
    }

    public MeshRpcServer(Transport transport, int port, long resultsTimeoutMs) {
        if (port < 0) {
            throw new IllegalArgumentException("Invalid port: " + port);
        }
        this.transport = transport;
        this.port = port;
        this.resultsTimeoutMs = Math.max(1L, resultsTimeoutMs);
    }

    public int port() {
        return port;
    }

    /**
     * @param argumentCount maximum number of arguments, or -1 for any
     */
    public void declare(String name, int argumentCount) {
        declare(name, CallDeclaration.ofArgumentCount(argumentCount));
    }

    /**
     * Declares {@code name} with typed arguments and results. Both sides of a call must
     * declare it the same way.
     */
    public void declare(String name, CallDeclaration declaration) {
        if (name == null || name.isBlank() || name.indexOf('[') >= 0 || name.indexOf(',') >= 0) {
            throw new IllegalArgumentException("Invalid call name: " + name);
        }
        declarations.put(name, declaration == null ? CallDeclaration.untyped() : declaration);
    }

    public void addDeclarations(Map<String, CallDeclaration> declarationMap) {
        for (Map.Entry<String, CallDeclaration> entry : declarationMap.entrySet()) {
            declare(entry.getKey(), entry.getValue());
        }
    }

    /**
     * Reads a JSON object mapping call names to declarations and declares each one.
     */
    public void addDeclarations(Path file) {
        Map<String, CallDeclaration> declarationMap;
        try {
            declarationMap = Jsons.mapper().readValue(file.toFile(), new TypeReference<Map<String, CallDeclaration>>() {
            });
        } catch (IOException e) {
            throw new RuntimeException("Failed to load call declarations: " + file, e);
        }
        if (declarationMap == null) {
            throw new IllegalArgumentException("No call declarations in " + file);
        }
        addDeclarations(declarationMap);
    }

    public void bind(String name, RpcHandler handler) {
        requireDeclared(name);
        handlers.put(name, handler);
    }

    /**
     * Requests {@code host} to run {@code name} without waiting for results. Reliable
     * unless the host is the broadcast address.
     */
    public Optional<SendHandle> callAsync(String host, String name, Object... args) {
        String message = encode('a', name, args);
        return transport.send(host, port, message.getBytes(StandardCharsets.UTF_8), !Hosts.isBroadcast(host), false);
    }

    /**
     * Requests {@code host} to run {@code name} and blocks for the results.
     *
     * @throws IllegalStateException when the request or its results time out
     * @throws IllegalArgumentException when arguments or results do not match the declaration
     */
    public ArrayNode callSync(String host, String name, Object... args) {
        if (Hosts.isBroadcast(host)) {
            throw new IllegalArgumentException("Broadcast address not allowed for synchronous call");
        }
        String message = encode('s', name, args);
        syncLock.lock();
        try {
            PendingCall call = new PendingCall(name, new CompletableFuture<>());
            pending = call;
            Optional<SendHandle> sent = transport.send(host, port, message.getBytes(StandardCharsets.UTF_8), true, true);
            if (sent.isEmpty()) {
                throw new IllegalStateException("Remote call to \"" + name + "\" for host \"" + host + "\" timed out");
            }
            try {
                return call.results().get(resultsTimeoutMs, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                throw new IllegalStateException("Results from call to \"" + name + "\" for host \"" + host + "\" timed out", e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for results of \"" + name + "\"", e);
            } catch (ExecutionException e) {
                if (e.getCause() instanceof IllegalArgumentException mismatch) {
                    throw mismatch;
                }
                throw new IllegalStateException("Remote call to \"" + name + "\" failed", e.getCause());
            }
        } finally {
            pending = null;
            syncLock.unlock();
        }
    }

    /**
     * Dispatches a received message: runs the bound handler for requests and completes a
     * waiting {@link #callSync} for results.
     *
     * @return true when the message belonged to this server
     */
    public boolean handleMessage(Delivery delivery) {
        if (delivery == null || delivery.port() != port) {
            return false;
        }
        String text = delivery.messageText();
        int bracket = text.indexOf('[');
        if (text.length() < 3 || text.charAt(1) != ',' || bracket < 2) {
            return false;
        }
        char type = text.charAt(0);
        String name = text.substring(2, bracket);
        ArrayNode values;
        try {
            JsonNode parsed = Jsons.compact().readTree(text.substring(bracket));
            if (!(parsed instanceof ArrayNode array)) {
                return false;
            }
            values = array;
        } catch (JsonProcessingException e) {
            return false;
        }
        if (type == 'r') {
            PendingCall call = pending;
            if (call != null && call.name().equals(name)) {
                try {
                    requireDeclared(name).checkResults(name, elements(values));
                    call.results().complete(values);
                } catch (IllegalArgumentException e) {
                    call.results().completeExceptionally(e);
                }
            }
            return true;
        }
        if (type != 's' && type != 'a') {
            return false;
        }
        RpcHandler handler = handlers.get(name);
        if (handler == null) {
            return true;
        }
        List<?> results;
        try {
            results = handler.call(delivery.host(), values);
        } catch (Exception e) {
            throw new RuntimeException("Failed to run remote call \"" + name + "\" from " + delivery.host(), e);
        }
        if (type == 's') {
            Object[] out = results == null ? new Object[0] : results.toArray();
            requireDeclared(name).checkResults(name, toNodes(out));
            String reply = "r," + name + toJsonArray(out);
            transport.send(delivery.host(), port, reply.getBytes(StandardCharsets.UTF_8), true, false);
        }
        return true;
    }

    /**
     * Receives one message and dispatches it.
     *
     * @return the message when it was not for this server
     */
    public Optional<Delivery> serve(long timeoutMs) {
        Optional<Delivery> received = transport.receive(timeoutMs);
        if (received.isPresent() && handleMessage(received.get())) {
            return Optional.empty();
        }
        return received;
    }

    private String encode(char type, String name, Object[] args) {
        CallDeclaration declaration = requireDeclared(name);
        Object[] safeArgs = args == null ? new Object[0] : args;
        declaration.checkArguments(name, toNodes(safeArgs));
        return type + "," + name + toJsonArray(safeArgs);
    }

    private CallDeclaration requireDeclared(String name) {
        CallDeclaration declaration = name == null ? null : declarations.get(name);
        if (declaration == null) {
            throw new IllegalArgumentException("Call name not declared: " + name);
        }
        return declaration;
    }

    private static List<JsonNode> toNodes(Object[] values) {
        List<JsonNode> nodes = new ArrayList<>(values.length);
        for (Object value : values) {
            nodes.add(Jsons.compact().valueToTree(value));
        }
        return nodes;
    }

    private static List<JsonNode> elements(ArrayNode values) {
        List<JsonNode> nodes = new ArrayList<>(values.size());
        values.forEach(nodes::add);
        return nodes;
    }

    private static String toJsonArray(Object[] values) {
        try {
            return Jsons.compact().writeValueAsString(Arrays.asList(values));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize remote call values", e);
        }
    }

    private record PendingCall(String name, CompletableFuture<ArrayNode> results) {
    }
}
