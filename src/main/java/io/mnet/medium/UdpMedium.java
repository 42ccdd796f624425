package io.mnet.medium;

import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Medium backed by one UDP socket. "Broadcast" sends a datagram to every configured
 * target; by default that is the IPv4 limited broadcast address on the channel port.
 * A daemon reader thread only pushes received datagrams into the sink.
 */
public final class UdpMedium implements Medium {
    private static final int MAX_DATAGRAM = 65_507;
    private static final int READ_TIMEOUT_MS = 250;

    private final int channel;
    private final InetSocketAddress bindAddress;
    private final List<InetSocketAddress> targets;
    private final AtomicLong readErrors = new AtomicLong();
    private volatile DatagramSocket socket;
    private volatile boolean closed;
    private volatile Thread reader;

    public UdpMedium(int channel, InetSocketAddress bindAddress, List<InetSocketAddress> targets) {
        if (channel < 0 || channel > 65_535) {
            throw new IllegalArgumentException("Invalid channel: " + channel);
        }
        this.channel = channel;
        this.bindAddress = bindAddress;
        this.targets = new CopyOnWriteArrayList<>(targets == null ? List.of() : targets);
    }

    /**
     * Binds every interface on the channel port and broadcasts to 255.255.255.255.
     */
    public static UdpMedium broadcastOn(int channel) {
        return new UdpMedium(
                channel,
                new InetSocketAddress(channel),
                List.of(new InetSocketAddress("255.255.255.255", channel))
        );
    }

    public void addTarget(InetSocketAddress target) {
        targets.add(target);
    }

    public List<InetSocketAddress> targets() {
        return new ArrayList<>(targets);
    }

    public long readErrors() {
        return readErrors.get();
    }

    /**
     * Port the socket is bound to; differs from the configured one when that was 0.
     */
    public int localPort() {
        DatagramSocket current = socket;
        return current == null ? bindAddress.getPort() : current.getLocalPort();
    }

    @Override
    public String address() {
        DatagramSocket current = socket;
        if (current == null) {
            return bindAddress.getHostString() + ":" + bindAddress.getPort();
        }
        return current.getLocalAddress().getHostAddress() + ":" + current.getLocalPort();
    }

    @Override
    public synchronized void open(Consumer<InboundFrame> sink) throws IOException {
        if (socket != null) {
            throw new IllegalStateException("Medium already open: " + address());
        }
        DatagramSocket opened = new DatagramSocket(null);
        try {
            opened.setReuseAddress(true);
            opened.setBroadcast(true);
            opened.bind(bindAddress);
            opened.setSoTimeout(READ_TIMEOUT_MS);
        } catch (SocketException e) {
            opened.close();
            throw e;
        }
        this.socket = opened;
        this.reader = new Thread(() -> readLoop(opened, sink), "mnet-udp-reader-" + opened.getLocalPort());
        reader.setDaemon(true);
        reader.start();
    }

    @Override
    public void broadcast(byte[] frame) throws IOException {
        DatagramSocket current = requireSocket();
        IOException failure = null;
        for (InetSocketAddress target : targets) {
            try {
                current.send(new DatagramPacket(frame, frame.length, target));
            } catch (IOException e) {
                failure = e;
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    @Override
    public void send(String neighborAddress, byte[] frame) throws IOException {
        DatagramSocket current = requireSocket();
        int sep = neighborAddress == null ? -1 : neighborAddress.lastIndexOf(':');
        if (sep <= 0) {
            throw new IOException("Invalid neighbour address: " + neighborAddress);
        }
        int port;
        try {
            port = Integer.parseInt(neighborAddress.substring(sep + 1));
        } catch (NumberFormatException e) {
            throw new IOException("Invalid neighbour port: " + neighborAddress, e);
        }
        InetAddress host = InetAddress.getByName(neighborAddress.substring(0, sep));
        current.send(new DatagramPacket(frame, frame.length, host, port));
    }

    @Override
    public void close() {
        closed = true;
        DatagramSocket current = socket;
        if (current != null) {
            current.close();
        }
        Thread thread = reader;
        if (thread != null && thread != Thread.currentThread()) {
            try {
                thread.join(READ_TIMEOUT_MS * 4L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void readLoop(DatagramSocket current, Consumer<InboundFrame> sink) {
        byte[] buf = new byte[MAX_DATAGRAM];
        while (!closed) {
            DatagramPacket incoming = new DatagramPacket(buf, buf.length);
            try {
                current.receive(incoming);
            } catch (SocketTimeoutException timeout) {
                continue;
            } catch (IOException e) {
                if (closed || current.isClosed()) {
                    break;
                }
                readErrors.incrementAndGet();
                continue;
            }
            byte[] data = Arrays.copyOfRange(incoming.getData(), incoming.getOffset(), incoming.getOffset() + incoming.getLength());
            String sender = incoming.getAddress().getHostAddress() + ":" + incoming.getPort();
            sink.accept(new InboundFrame(this, sender, channel, data));
        }
    }

    private DatagramSocket requireSocket() throws IOException {
        DatagramSocket current = socket;
        if (current == null || closed) {
            throw new IOException("Medium is not open: " + address());
        }
        return current;
    }
}
