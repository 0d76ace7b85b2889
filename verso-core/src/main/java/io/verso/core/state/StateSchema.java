package io.verso.core.state;

import io.verso.core.exception.UnknownStateFieldException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Ordered declaration of every field a {@link WorkflowState} holds.
///
/// ### Contracts
/// - **Precondition**: field names are unique
/// - **Invariant**: the default state materialises every declared field
///
/// @implNote Immutable and thread-safe after construction.
public final class StateSchema {

    private final Map<String, StateField<?, ?>> fields;

    private StateSchema(Map<String, StateField<?, ?>> fields) {
        this.fields = Collections.unmodifiableMap(fields);
    }

    /// Creates a schema from the given fields in declaration order.
    ///
    /// @param fields field declarations, not null
    /// @return the schema, never null
    /// @throws IllegalArgumentException if two fields share a name
    public static StateSchema of(List<StateField<?, ?>> fields) {
        Map<String, StateField<?, ?>> byName = new LinkedHashMap<>();
        for (StateField<?, ?> field : fields) {
            if (byName.putIfAbsent(field.name(), field) != null) {
                throw new IllegalArgumentException("Duplicate state field: " + field.name());
            }
        }
        return new StateSchema(byName);
    }

    public Optional<StateField<?, ?>> field(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    /// Looks up a declared field by name.
    ///
    /// @throws UnknownStateFieldException if the schema has no such field
    public StateField<?, ?> require(String name) {
        StateField<?, ?> field = fields.get(name);
        if (field == null) {
            throw new UnknownStateFieldException(name);
        }
        return field;
    }

    public boolean declares(StateField<?, ?> field) {
        return field.equals(fields.get(field.name()));
    }

    public List<StateField<?, ?>> fields() {
        return List.copyOf(fields.values());
    }

    /// Returns a fresh state holding every field's default value.
    public WorkflowState defaultState() {
        Map<String, Object> values = new LinkedHashMap<>();
        for (StateField<?, ?> field : fields.values()) {
            values.put(field.name(), field.defaultValue());
        }
        return new WorkflowState(this, values);
    }
}
