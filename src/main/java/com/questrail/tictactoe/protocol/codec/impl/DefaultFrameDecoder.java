package com.questrail.tictactoe.protocol.codec.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.tictactoe.protocol.codec.FrameDecodeException;
import com.questrail.tictactoe.protocol.codec.FrameDecoder;
import com.questrail.tictactoe.protocol.model.Frame;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;

/**
 * DefaultFrameDecoder
 * -----------------------------------------------------------------------------
 * Jackson-backed {@link FrameDecoder}.
 *
 * <p>Steps, in order:</p>
 * <ol>
 *   <li>Parse the payload as exactly one JSON value (trailing tokens rejected)</li>
 *   <li>Require a JSON object</li>
 *   <li>Require a textual {@code type} field</li>
 *   <li>Convert to plain Java values and build the {@link Frame}</li>
 * </ol>
 */
public final class DefaultFrameDecoder implements FrameDecoder
{
    private static final TypeReference<Map<String, Object>> FIELDS = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public DefaultFrameDecoder()
    {
        this(new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS));
    }

    public DefaultFrameDecoder(ObjectMapper mapper)
    {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public Frame decode(byte[] payload)
    {
        Objects.requireNonNull(payload, "payload");
        if (payload.length == 0) {
            throw new FrameDecodeException("Empty frame");
        }

        final JsonNode node;
        try {
            node = mapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new FrameDecodeException("Frame is not valid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new FrameDecodeException("Frame could not be read", e);
        }

        if (node == null || !node.isObject()) {
            throw new FrameDecodeException("Frame must be a JSON object");
        }

        JsonNode type = node.get(Frame.TYPE_FIELD);
        if (type == null || !type.isTextual()) {
            throw new FrameDecodeException("Frame has no string '" + Frame.TYPE_FIELD + "' field");
        }

        Map<String, Object> fields = mapper.convertValue(node, FIELDS);
        return Frame.of(fields);
    }
}
