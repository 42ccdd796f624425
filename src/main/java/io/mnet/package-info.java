/**
 * mnet source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.mnet.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.mnet.transport.Transport} is the per-host API: send, receive and the poll pump.</li>
 *   <li>{@code io.mnet.transport.SendEngine} and {@code io.mnet.transport.ReceiveEngine} hold the reliable stream protocol.</li>
 *   <li>{@code io.mnet.medium.Medium} abstracts the radio; UDP and simulated implementations live next to it.</li>
 * </ul>
 */
package io.mnet;
