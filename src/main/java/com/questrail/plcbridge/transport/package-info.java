/**
 * Bridge Transport Ports
 * =============================================================================
 *
 * These interfaces define the boundary between a concrete messaging
 * implementation (NATS, a simulator, a test double) and the bridge core.
 *
 * <p>Everything above this boundary sees only decoded
 * {@code BridgeEvent} instances on the inbound side and
 * {@link com.questrail.plcbridge.api.ModuleCommand} values on the outbound
 * side. No client-library types leak into the core.</p>
 *
 * <h2>Constraints</h2>
 * Implementations:
 * <ul>
 *   <li>perform messaging I/O and payload decoding only</li>
 *   <li>do not touch the registry, filter state or publisher</li>
 *   <li>hand every decoded event to the sink supplied at start</li>
 * </ul>
 */
package com.questrail.plcbridge.transport;
