package io.tiller.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.tiller.core.plan.ExecutionPlan;
import io.tiller.core.suspend.SuspendState;

/// Utility class for serializing suspend states and execution plans to/from JSON.
///
/// Provides a pre-configured `ObjectMapper` with the Tiller type handlers and
/// `java.time` support.
///
/// ### Usage
/// {@snippet :
/// String json = TillerSerializer.toJson(state);
/// SuspendState restored = TillerSerializer.fromJson(json);
///
/// ObjectMapper mapper = TillerSerializer.createMapper();
/// }
///
/// @implNote Thread-safe. A mapper is created per call via `createMapper()`. For
/// high-throughput scenarios, cache the mapper.
///
/// @see TillerJacksonModule for the registered type handlers
public final class TillerSerializer {

    private TillerSerializer() {}

    /// Serializes a suspend state to JSON.
    ///
    /// @param state the state to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(SuspendState state) {
        try {
            return createMapper().writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize suspend state: " + e.getMessage(), e);
        }
    }

    /// Deserializes a suspend state from JSON.
    ///
    /// @param json JSON string, not null
    /// @return deserialized state, never null
    /// @throws IllegalArgumentException if deserialization fails
    public static SuspendState fromJson(String json) {
        try {
            return createMapper().readValue(json, SuspendState.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize suspend state: " + e.getMessage(), e);
        }
    }

    public static String planToJson(ExecutionPlan plan) {
        try {
            return createMapper().writeValueAsString(plan);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize plan: " + e.getMessage(), e);
        }
    }

    public static ExecutionPlan planFromJson(String json) {
        try {
            return createMapper().readValue(json, ExecutionPlan.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to deserialize plan: " + e.getMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for Tiller types.
    ///
    /// Registers:
    /// - `TillerJacksonModule` for field sets, plans and suspend states
    /// - `JavaTimeModule` for `Instant` and `LocalDate` values
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - Timestamps written as ISO-8601 strings (not numeric)
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new TillerJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
