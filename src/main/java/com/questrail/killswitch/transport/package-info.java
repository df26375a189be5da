/**
 * Alarm Transport Ports
 * =============================================================================
 *
 * These interfaces define the <em>framework-agnostic transport boundary</em>
 * between a concrete networking implementation (Netty UDP, a simulator, or a
 * test double) and the alarm stack.
 *
 * <h2>Why these ports exist</h2>
 * Netty runs the sockets in production, but Netty types must not leak into
 * the bus or the watchdogs. Everything above the transport adapter sees only:
 * <ul>
 *   <li>Raw datagram payloads as {@code byte[]}</li>
 *   <li>Remote endpoints as standard {@link java.net.SocketAddress}</li>
 *   <li>Transport lifecycle notifications (up/down)</li>
 * </ul>
 *
 * <h2>Architectural constraints (binding)</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O only</li>
 *   <li>Not decode alarm records</li>
 *   <li>Not raise or clear alarms</li>
 *   <li>Not schedule timeouts; a silent transport is reported by the watchdog,
 *       not by the transport</li>
 * </ul>
 */
package com.questrail.killswitch.transport;
