/**
 * Frame Codec: Wire-Level Implementation
 * =============================================================================
 *
 * <p>This package defines the <strong>codec layer</strong> of the turn
 * protocol. It implements the wire rules and nothing else:</p>
 *
 * <ul>
 *   <li>Frames are UTF-8 JSON objects, one per line</li>
 *   <li>A single {@code '\n'} byte terminates every frame</li>
 *   <li>The delimiter never occurs inside an encoded payload: compact JSON
 *       escapes control characters inside strings, and a multi-byte UTF-8
 *       sequence never contains {@code 0x0A}</li>
 *   <li>Every frame carries a string {@code type} field</li>
 * </ul>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   byte[] chunk (from the stream)
 *        → LineFraming           (delimiters located, partial frames buffered)
 *            → FrameDecoder      (JSON parsed, type checked)
 *                → Frame
 *                    → ProtocolMessageDecoder
 *                        → ProtocolMessage
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>No class here knows what an {@code assign_role} or a {@code move_request} means.</li>
 *   <li>No class here performs I/O.</li>
 *   <li>Decode failures are reported, never repaired: the channel closes.</li>
 * </ul>
 */
package com.questrail.tictactoe.protocol.codec;
