/**
 * Transport Ports
 * =============================================================================
 *
 * Framework-agnostic boundary between a concrete stream implementation (Netty
 * TCP, or a test double) and the framed channel.
 *
 * <p>Everything above the adapter sees only:</p>
 * <ul>
 *   <li>Raw inbound chunks as {@code byte[]}</li>
 *   <li>Outbound payloads as {@code byte[]}</li>
 *   <li>Lifecycle notifications (up, end of stream, down)</li>
 * </ul>
 *
 * <h2>Constraints</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform I/O only</li>
 *   <li>Not split, join or parse frames</li>
 *   <li>Not retry sends</li>
 * </ul>
 */
package com.questrail.tictactoe.protocol.transport;
