package com.dimensional.units.json;

import com.dimensional.units.Unit;
import com.dimensional.units.UnitAliasManager;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Objects;

/**
 * JSON serialization of units and of objects holding units, bound to one alias registry.
 */
public final class UnitJson {

    private final ObjectMapper mapper;

    public UnitJson(UnitAliasManager registry) {
        this.mapper = createMapper(Objects.requireNonNull(registry, "registry must not be null"));
    }

    /** An {@link ObjectMapper} with {@link UnitJsonModule} registered. */
    public static ObjectMapper createMapper(UnitAliasManager registry) {
        return new ObjectMapper().registerModule(new UnitJsonModule(registry));
    }

    /**
     * Serializes a value to JSON; units appear as formula strings.
     *
     * @throws UnitJsonException if serialization fails
     */
    public String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UnitJsonException("Failed to serialize " + value, e);
        }
    }

    /**
     * Reads a value of {@code type} from JSON.
     *
     * @throws UnitJsonException if the JSON is malformed or a formula cannot be parsed
     */
    public <T> T fromJson(String json, Class<T> type) {
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new UnitJsonException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }

    /** Reads a single unit from a JSON string literal such as {@code "\"km/h\""}. */
    public Unit unitFromJson(String json) {
        return fromJson(json, Unit.class);
    }

    /** Returns the underlying mapper (for advanced use). */
    public ObjectMapper objectMapper() {
        return mapper;
    }

    /**
     * Exception thrown when unit serialization/deserialization fails.
     */
    public static class UnitJsonException extends RuntimeException {
        public UnitJsonException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
