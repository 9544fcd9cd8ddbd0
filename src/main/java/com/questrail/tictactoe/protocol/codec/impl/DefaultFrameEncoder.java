package com.questrail.tictactoe.protocol.codec.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.tictactoe.protocol.codec.FrameEncoder;
import com.questrail.tictactoe.protocol.model.Frame;

import java.util.Arrays;
import java.util.Objects;

/**
 * DefaultFrameEncoder
 * -----------------------------------------------------------------------------
 * Jackson-backed {@link FrameEncoder}; the inverse of {@link DefaultFrameDecoder}.
 *
 * <p>Writes compact JSON (no indentation, so no raw newlines) and appends the
 * {@link LineFraming#DELIMITER}.</p>
 */
public final class DefaultFrameEncoder implements FrameEncoder
{
    private final ObjectMapper mapper;

    public DefaultFrameEncoder()
    {
        this(new ObjectMapper());
    }

    public DefaultFrameEncoder(ObjectMapper mapper)
    {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public byte[] encode(Frame frame)
    {
        Objects.requireNonNull(frame, "frame");

        final byte[] json;
        try {
            json = mapper.writeValueAsBytes(frame.fields());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Frame cannot be encoded as JSON: " + frame, e);
        }

        for (byte b : json) {
            if (b == LineFraming.DELIMITER) {
                throw new IllegalArgumentException("Encoded frame contains the delimiter byte: " + frame);
            }
        }

        byte[] framed = Arrays.copyOf(json, json.length + 1);
        framed[json.length] = LineFraming.DELIMITER;
        return framed;
    }
}
