package com.questrail.tictactoe.protocol.codec;

import com.questrail.tictactoe.protocol.model.Frame;

/**
 * FrameDecoder
 * -----------------------------------------------------------------------------
 * Payload-level decoder: one delimited payload in, one {@link Frame} out.
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Parsing the payload as a single UTF-8 JSON object</li>
 *   <li>Checking that it carries a string {@code type}</li>
 * </ul>
 *
 * <p>It is <strong>not</strong> responsible for locating delimiters (see
 * {@code LineFraming}), for interpreting message semantics, or for deciding
 * what happens to the channel after a failure.</p>
 */
public interface FrameDecoder
{
    /**
     * @param payload bytes between two delimiters, delimiter excluded
     * @return the decoded frame
     * @throws FrameDecodeException if the payload is not a JSON object with a string {@code type}
     */
    Frame decode(byte[] payload);
}
