package com.questrail.tictactoe.protocol.codec.impl;

import com.questrail.tictactoe.protocol.codec.FrameDecodeException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * LineFraming
 * -----------------------------------------------------------------------------
 * Turns an arbitrary sequence of stream chunks back into delimited payloads.
 *
 * <p>Chunks are appended to an internal buffer; every complete payload (the
 * bytes before a {@value #DELIMITER} byte) is extracted in order and the
 * remainder is kept for the next chunk. The delimiter itself is dropped.</p>
 *
 * <p>A buffered partial payload that grows past {@code maxFrameLength} without
 * a delimiter is rejected; the peer is either broken or not speaking this
 * protocol.</p>
 *
 * <p>Not thread-safe. One instance belongs to one reading thread.</p>
 */
public final class LineFraming
{
    /** Frame terminator ({@code '\n'}). */
    public static final byte DELIMITER = '\n';

    private final int maxFrameLength;

    private byte[] buffer = new byte[256];
    private int length;

    public LineFraming(int maxFrameLength)
    {
        if (maxFrameLength <= 0) {
            throw new IllegalArgumentException("maxFrameLength must be positive (was " + maxFrameLength + ")");
        }
        this.maxFrameLength = maxFrameLength;
    }

    /**
     * Append {@code chunk} and return every payload it completes, oldest first.
     *
     * @throws FrameDecodeException if a payload exceeds the maximum frame length
     */
    public List<byte[]> append(byte[] chunk)
    {
        if (chunk.length == 0) {
            return List.of();
        }
        ensureCapacity(length + chunk.length);
        System.arraycopy(chunk, 0, buffer, length, chunk.length);
        int scanFrom = length;
        length += chunk.length;

        List<byte[]> payloads = new ArrayList<>();
        int start = 0;
        for (int i = scanFrom; i < length; i++) {
            if (buffer[i] != DELIMITER) {
                continue;
            }
            if (i - start > maxFrameLength) {
                throw oversized(i - start);
            }
            payloads.add(Arrays.copyOfRange(buffer, start, i));
            start = i + 1;
        }

        // Keep the unterminated tail.
        int remaining = length - start;
        if (remaining > maxFrameLength) {
            throw oversized(remaining);
        }
        if (start > 0) {
            System.arraycopy(buffer, start, buffer, 0, remaining);
            length = remaining;
        }
        return payloads;
    }

    /**
     * Bytes of an incomplete payload currently held back.
     */
    public int buffered()
    {
        return length;
    }

    private void ensureCapacity(int required)
    {
        if (required <= buffer.length) {
            return;
        }
        int capacity = buffer.length;
        while (capacity < required) {
            capacity *= 2;
        }
        buffer = Arrays.copyOf(buffer, capacity);
    }

    private FrameDecodeException oversized(int size)
    {
        return new FrameDecodeException("Frame of " + size + " bytes exceeds the limit of " + maxFrameLength + " bytes");
    }
}
