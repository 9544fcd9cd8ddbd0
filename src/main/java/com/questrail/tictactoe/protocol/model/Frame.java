package com.questrail.tictactoe.protocol.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Frame
 * -----------------------------------------------------------------------------
 * One delimited unit on the wire, after framing and JSON parsing and before any
 * protocol interpretation.
 *
 * <p>A frame is a mapping from field names to JSON-compatible values
 * ({@code String}, {@code Number}, {@code Boolean}, {@code null}, {@code List},
 * {@code Map}). It always carries a string {@value #TYPE_FIELD} field used for
 * dispatch.</p>
 */
public final class Frame
{
    public static final String TYPE_FIELD = "type";

    private final Map<String, Object> fields;

    private Frame(Map<String, Object> fields)
    {
        this.fields = fields;
    }

    /**
     * @throws IllegalArgumentException if {@code fields} has no string {@value #TYPE_FIELD}
     */
    public static Frame of(Map<String, ?> fields)
    {
        Objects.requireNonNull(fields, "fields");
        if (!(fields.get(TYPE_FIELD) instanceof String)) {
            throw new IllegalArgumentException("Frame requires a string '" + TYPE_FIELD + "' field");
        }
        return new Frame(Collections.unmodifiableMap(new LinkedHashMap<>(fields)));
    }

    public static Builder builder(String type)
    {
        return new Builder(type);
    }

    public String type()
    {
        return (String) fields.get(TYPE_FIELD);
    }

    public Map<String, Object> fields()
    {
        return fields;
    }

    public boolean has(String name)
    {
        return fields.containsKey(name);
    }

    public Object get(String name)
    {
        return fields.get(name);
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (!(o instanceof Frame that)) return false;
        return fields.equals(that.fields);
    }

    @Override
    public int hashCode()
    {
        return fields.hashCode();
    }

    @Override
    public String toString()
    {
        return "Frame" + fields;
    }

    public static final class Builder
    {
        private final Map<String, Object> fields = new LinkedHashMap<>();

        private Builder(String type)
        {
            fields.put(TYPE_FIELD, Objects.requireNonNull(type, "type"));
        }

        public Builder put(String name, Object value)
        {
            Objects.requireNonNull(name, "name");
            if (TYPE_FIELD.equals(name)) {
                throw new IllegalArgumentException("'" + TYPE_FIELD + "' is set by the builder");
            }
            fields.put(name, value);
            return this;
        }

        public Frame build()
        {
            return Frame.of(fields);
        }
    }
}
