/**
 * Protocol core.
 *
 * <p>{@link io.mnet.transport.Transport} owns all per-host state and only advances it
 * when a caller pumps it: retransmission, drop timeouts, flood forwarding,
 * acknowledgement and reassembly happen inside {@code poll} and {@code receive}.
 */
package io.mnet.transport;
