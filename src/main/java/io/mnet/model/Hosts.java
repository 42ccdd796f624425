package io.mnet.model;

/**
 * Reserved host names.
 */
public final class Hosts {
    /** Destination that every host in range consumes. Only valid for unreliable sends. */
    public static final String BROADCAST = "*";
    /** Alias for the local host, delivered through the loopback interface. */
    public static final String LOCALHOST = "localhost";

    private Hosts() {
    }

    public static boolean isBroadcast(String host) {
        return BROADCAST.equals(host);
    }
}
