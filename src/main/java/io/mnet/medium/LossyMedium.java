package io.mnet.medium;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Wraps a medium and makes its transmissions unreliable: each outgoing frame may be
 * dropped, or held back until up to {@code maxSwapOffset} later frames went out first.
 * Receiving is untouched.
 */
public final class LossyMedium implements Medium {
    public static final double DEFAULT_DROP_CHANCE = 0.1;
    public static final double DEFAULT_SWAP_CHANCE = 0.1;
    public static final int DEFAULT_MAX_SWAP_OFFSET = 3;

    private final Medium delegate;
    private final double dropChance;
    private final double swapChance;
    private final int maxSwapOffset;
    private final Random random;
    private final List<HeldFrame> held = new ArrayList<>();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong swapped = new AtomicLong();

    public LossyMedium(Medium delegate, double dropChance, double swapChance, int maxSwapOffset, Random random) {
        if (dropChance < 0.0 || dropChance > 1.0 || swapChance < 0.0 || swapChance > 1.0) {
            throw new IllegalArgumentException("Probabilities must be within [0, 1]");
        }
        if (maxSwapOffset < 1) {
            throw new IllegalArgumentException("Max swap offset must be positive: " + maxSwapOffset);
        }
        this.delegate = delegate;
        this.dropChance = dropChance;
        this.swapChance = swapChance;
        this.maxSwapOffset = maxSwapOffset;
        this.random = random;
    }

    public LossyMedium(Medium delegate, Random random) {
        this(delegate, DEFAULT_DROP_CHANCE, DEFAULT_SWAP_CHANCE, DEFAULT_MAX_SWAP_OFFSET, random);
    }

    @Override
    public String address() {
        return delegate.address();
    }

    @Override
    public void open(Consumer<InboundFrame> sink) throws IOException {
        delegate.open(sink);
    }

    @Override
    public void broadcast(byte[] frame) throws IOException {
        transmit(new HeldFrame(null, frame, 0));
    }

    @Override
    public void send(String neighborAddress, byte[] frame) throws IOException {
        transmit(new HeldFrame(neighborAddress, frame, 0));
    }

    /**
     * Sends every frame still held back.
     */
    public synchronized void flush() throws IOException {
        List<HeldFrame> pending = new ArrayList<>(held);
        held.clear();
        for (HeldFrame frame : pending) {
            emit(frame);
        }
    }

    public long dropped() {
        return dropped.get();
    }

    public long swapped() {
        return swapped.get();
    }

    @Override
    public void close() {
        synchronized (this) {
            held.clear();
        }
        delegate.close();
    }

    private synchronized void transmit(HeldFrame frame) throws IOException {
        if (random.nextDouble() < dropChance) {
            dropped.incrementAndGet();
            return;
        }
        if (random.nextDouble() < swapChance) {
            swapped.incrementAndGet();
            held.add(new HeldFrame(frame.neighbor(), frame.data(), 1 + random.nextInt(maxSwapOffset)));
        } else {
            emit(frame);
        }
        Iterator<HeldFrame> it = held.iterator();
        List<HeldFrame> due = new ArrayList<>();
        while (it.hasNext()) {
            HeldFrame waiting = it.next();
            waiting.remaining--;
            if (waiting.remaining < 0) {
                it.remove();
                due.add(waiting);
            }
        }
        for (HeldFrame waiting : due) {
            emit(waiting);
        }
    }

    private void emit(HeldFrame frame) throws IOException {
        if (frame.neighbor() == null) {
            delegate.broadcast(frame.data());
        } else {
            delegate.send(frame.neighbor(), frame.data());
        }
    }

    private static final class HeldFrame {
        private final String neighbor;
        private final byte[] data;
        private int remaining;

        private HeldFrame(String neighbor, byte[] data, int remaining) {
            this.neighbor = neighbor;
            this.data = data;
            this.remaining = remaining;
        }

        String neighbor() {
            return neighbor;
        }

        byte[] data() {
            return data;
        }
    }
}
