package io.mnet.transport;

/**
 * Ordering state for one reliable peer stream. {@code lastDelivered} stays null until a
 * SYN packet opens the connection.
 */
final class PeerReceiveState {
    Long lastDelivered;
}
