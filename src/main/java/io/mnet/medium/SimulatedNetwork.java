package io.mnet.medium;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * In-memory radio. Devices only hear devices they are linked to. Frames are handed over
 * immediately, or held in the air when auto delivery is off so a test can reorder or
 * drop them.
 */
public final class SimulatedNetwork {
    private final Map<String, Device> devices = new LinkedHashMap<>();
    private final Map<String, Set<String>> links = new HashMap<>();
    private final List<Transmission> inFlight = new ArrayList<>();
    private boolean autoDeliver = true;

    public synchronized Device device(String address, int channel) {
        if (devices.containsKey(address)) {
            throw new IllegalArgumentException("Device address already in use: " + address);
        }
        Device device = new Device(address, channel);
        devices.put(address, device);
        links.put(address, new LinkedHashSet<>());
        return device;
    }

    public synchronized void link(String a, String b) {
        requireDevice(a);
        requireDevice(b);
        if (a.equals(b)) {
            throw new IllegalArgumentException("Cannot link a device to itself: " + a);
        }
        links.get(a).add(b);
        links.get(b).add(a);
    }

    public synchronized void unlink(String a, String b) {
        if (links.containsKey(a)) {
            links.get(a).remove(b);
        }
        if (links.containsKey(b)) {
            links.get(b).remove(a);
        }
    }

    /**
     * Links every device to every other one, like hosts sharing one radio range.
     */
    public synchronized void linkAll() {
        List<String> addresses = new ArrayList<>(devices.keySet());
        for (int i = 0; i < addresses.size(); i++) {
            for (int j = i + 1; j < addresses.size(); j++) {
                link(addresses.get(i), addresses.get(j));
            }
        }
    }

    public synchronized void setAutoDeliver(boolean value) {
        this.autoDeliver = value;
    }

    public synchronized List<Transmission> inFlight() {
        return Collections.unmodifiableList(new ArrayList<>(inFlight));
    }

    public synchronized boolean deliver(Transmission transmission) {
        if (!inFlight.remove(transmission)) {
            return false;
        }
        handOver(transmission);
        return true;
    }

    public synchronized boolean drop(Transmission transmission) {
        return inFlight.remove(transmission);
    }

    /**
     * @return number of frames handed over
     */
    public synchronized int deliverAll() {
        List<Transmission> pending = new ArrayList<>(inFlight);
        inFlight.clear();
        for (Transmission transmission : pending) {
            handOver(transmission);
        }
        return pending.size();
    }

    public synchronized int dropAll() {
        int dropped = inFlight.size();
        inFlight.clear();
        return dropped;
    }

    private void transmit(Device from, String target, byte[] data) {
        Set<String> neighbours = links.getOrDefault(from.address, Set.of());
        for (String neighbour : neighbours) {
            if (target != null && !target.equals(neighbour)) {
                continue;
            }
            Transmission transmission = new Transmission(from.address, neighbour, from.channel, data.clone());
            if (autoDeliver) {
                handOver(transmission);
            } else {
                inFlight.add(transmission);
            }
        }
    }

    private void handOver(Transmission transmission) {
        Device to = devices.get(transmission.to());
        if (to == null || to.sink == null) {
            return;
        }
        to.sink.accept(new InboundFrame(to, transmission.from(), transmission.channel(), transmission.data()));
    }

    private void requireDevice(String address) {
        if (!devices.containsKey(address)) {
            throw new IllegalArgumentException("Unknown device: " + address);
        }
    }

    /**
     * A frame on its way from one device to one neighbour. Compared by identity so
     * identical retransmissions stay distinct.
     */
    public static final class Transmission {
        private final String from;
        private final String to;
        private final int channel;
        private final byte[] data;

        Transmission(String from, String to, int channel, byte[] data) {
            this.from = from;
            this.to = to;
            this.channel = channel;
            this.data = data;
        }

        public String from() {
            return from;
        }

        public String to() {
            return to;
        }

        public int channel() {
            return channel;
        }

        public byte[] data() {
            return data;
        }

        @Override
        public String toString() {
            return from + " -> " + to + " (" + data.length + " bytes)";
        }
    }

    public final class Device implements Medium {
        private final String address;
        private final int channel;
        private Consumer<InboundFrame> sink;

        private Device(String address, int channel) {
            this.address = address;
            this.channel = channel;
        }

        @Override
        public String address() {
            return address;
        }

        public int channel() {
            return channel;
        }

        @Override
        public void open(Consumer<InboundFrame> frameSink) {
            synchronized (SimulatedNetwork.this) {
                this.sink = frameSink;
            }
        }

        @Override
        public void broadcast(byte[] frame) {
            synchronized (SimulatedNetwork.this) {
                if (sink != null) {
                    transmit(this, null, frame);
                }
            }
        }

        @Override
        public void send(String neighborAddress, byte[] frame) {
            synchronized (SimulatedNetwork.this) {
                if (sink != null) {
                    transmit(this, neighborAddress, frame);
                }
            }
        }

        @Override
        public void close() {
            synchronized (SimulatedNetwork.this) {
                this.sink = null;
            }
        }

        @Override
        public String toString() {
            return "Device[" + address + "]";
        }
    }
}
