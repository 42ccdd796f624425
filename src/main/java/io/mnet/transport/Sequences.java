package io.mnet.transport;

import java.util.Random;

/**
 * Arithmetic on sequence numbers in {@code [1, max]}. Zero is never a valid sequence.
 */
final class Sequences {
    private Sequences() {
    }

    static long next(long sequence, long max) {
        return sequence % max + 1;
    }

    static long previous(long sequence, long max) {
        return Math.floorMod(sequence - 2, max) + 1;
    }

    static long random(Random random, long max) {
        return Math.floorMod(random.nextLong(), max) + 1;
    }

    /**
     * True when {@code sequence} comes after {@code reference}, treating the space as a
     * circle and anything within half of it as ahead.
     */
    static boolean isAhead(long sequence, long reference, long max) {
        long offset = Math.floorMod(sequence - reference, max);
        return offset != 0 && offset <= max / 2;
    }
}
