package io.mnet.medium;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Clock that only moves when told to. Shared by every host of a simulated network.
 */
public final class SimulationClock extends Clock {
    private final AtomicLong millis;

    public SimulationClock(long startMillis) {
        this.millis = new AtomicLong(startMillis);
    }

    public SimulationClock() {
        this(1_000_000L);
    }

    public void advance(Duration step) {
        advanceMillis(step.toMillis());
    }

    public void advanceMillis(long step) {
        if (step < 0) {
            throw new IllegalArgumentException("Simulation time cannot go backwards: " + step);
        }
        millis.addAndGet(step);
    }

    @Override
    public long millis() {
        return millis.get();
    }

    @Override
    public Instant instant() {
        return Instant.ofEpochMilli(millis.get());
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        if (ZoneOffset.UTC.equals(zone)) {
            return this;
        }
        throw new UnsupportedOperationException("Simulation clock is fixed to UTC");
    }
}
