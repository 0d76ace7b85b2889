package io.verso.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.verso.core.state.WorkflowState;
import io.verso.core.storage.RunSnapshot;

/// Utility class for serializing run snapshots and states to and from JSON.
///
/// ### Usage
/// {@snippet :
/// String json = RunSnapshotSerializer.toJson(snapshot);
/// RunSnapshot restored = RunSnapshotSerializer.fromJson(json);
/// }
///
/// @implNote Thread-safe. Each call creates its mapper via {@link #createMapper()}; cache
/// the mapper for high-throughput use, as {@link FileRunStateRepository} does.
/// @see VersoJacksonModule for the registered type handlers
public final class RunSnapshotSerializer {

    private RunSnapshotSerializer() {}

    /// Serializes a snapshot to pretty-printed JSON.
    ///
    /// @param snapshot the snapshot to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(RunSnapshot snapshot) {
        try {
            return createMapper().writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize run snapshot: " + e.getMessage(), e);
        }
    }

    /// Deserializes a snapshot from JSON.
    ///
    /// @param json JSON string, not null
    /// @return deserialized snapshot, never null
    /// @throws IllegalArgumentException if deserialization fails or the state names an
    ///     undeclared field
    public static RunSnapshot fromJson(String json) {
        try {
            return createMapper().readValue(json, RunSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to deserialize run snapshot: " + e.getMessage(), e);
        }
    }

    /// Serializes a bare state.
    ///
    /// @throws IllegalArgumentException if serialization fails
    public static String stateToJson(WorkflowState state) {
        try {
            return createMapper().writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize state: " + e.getMessage(), e);
        }
    }

    /// Deserializes a bare state of the report pipeline schema.
    ///
    /// @throws IllegalArgumentException if deserialization fails
    public static WorkflowState stateFromJson(String json) {
        try {
            return createMapper().readValue(json, WorkflowState.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to deserialize state: " + e.getMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for snapshot serialization.
    ///
    /// Registers:
    /// - `VersoJacksonModule` for coded enums and schema-driven state
    /// - `JavaTimeModule` for `Instant` fields
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - Timestamps written as ISO-8601 strings (not numeric)
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new VersoJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
