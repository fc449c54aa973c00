/**
 * RoundRelay source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.roundrelay.runtime.RoundOrchestrator} runs scatter/gather rounds and the stop broadcast.</li>
 *   <li>{@code io.roundrelay.runtime.RunCoordinator} wraps a run so the stop broadcast always happens.</li>
 *   <li>{@code io.roundrelay.transport.TransportAdapter} turns envelopes into transport writes and polls.</li>
 *   <li>{@code io.roundrelay.spi} holds the transport, cipher and codec seams supplied by the caller.</li>
 * </ul>
 */
package io.roundrelay;
