package io.verso.core.state;

import io.verso.core.exception.StateTypeMismatchException;
import io.verso.core.exception.UnknownStateFieldException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Immutable value holding every field of one pipeline run.
///
/// A state is created from {@link StateSchema#defaultState()} and only ever replaced by
/// the result of {@link #apply(StateUpdate)}. Every declared field is present, so readers
/// never need to distinguish "unset" from "default".
///
/// ### Contracts
/// - **Invariant**: the key set equals the schema's field names
/// - **Invariant**: stored lists and maps are unmodifiable
///
/// @implNote Immutable and thread-safe; concurrent sub-steps may share one instance.
/// @see StateUpdate
/// @see StateField
public final class WorkflowState {

    private final StateSchema schema;
    private final Map<String, Object> values;

    WorkflowState(StateSchema schema, Map<String, Object> values) {
        this.schema = schema;
        this.values = Collections.unmodifiableMap(values);
    }

    /// Rebuilds a state from a flat name/value mapping, e.g. a persisted snapshot.
    ///
    /// Fields missing from `values`, or stored as null, take their defaults.
    ///
    /// @param schema schema of the run, not null
    /// @param values stored values keyed by field name, not null
    /// @return the restored state, never null
    /// @throws UnknownStateFieldException for an undeclared name
    /// @throws StateTypeMismatchException for a value of the wrong runtime type
    public static WorkflowState restore(StateSchema schema, Map<String, ?> values) {
        Objects.requireNonNull(schema, "schema must not be null");
        Objects.requireNonNull(values, "values must not be null");
        Map<String, Object> restored = new LinkedHashMap<>(schema.defaultState().values);
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            StateField<?, ?> field = schema.require(entry.getKey());
            Object value = entry.getValue();
            if (value != null && !field.valueType().isInstance(value)) {
                throw new StateTypeMismatchException(
                        "Field '"
                                + field.name()
                                + "' holds "
                                + field.valueType().getSimpleName()
                                + " but got "
                                + value.getClass().getSimpleName());
            }
            restored.put(
                    field.name(), value == null ? field.defaultValue() : Reducers.freeze(value));
        }
        return new WorkflowState(schema, restored);
    }

    /// Returns the value of a declared field.
    ///
    /// @throws UnknownStateFieldException if the field belongs to another schema
    public <V> V get(StateField<V, ?> field) {
        if (!schema.declares(field)) {
            throw new UnknownStateFieldException(field.name());
        }
        return field.cast(values.get(field.name()));
    }

    /// Returns the value of a declared field by name.
    public Object get(String name) {
        schema.require(name);
        return values.get(name);
    }

    /// Merges a partial update through each touched field's reducer.
    ///
    /// ### Contracts
    /// - **Postcondition**: untouched fields keep their values
    /// - **Postcondition**: neither this state nor `update` is modified
    ///
    /// @param update partial update, not null
    /// @return the next state; a new instance unless `update` is empty
    /// @throws UnknownStateFieldException if `update` touches an undeclared field
    /// @throws StateTypeMismatchException if a value does not fit its field's reducer
    public WorkflowState apply(StateUpdate update) {
        Objects.requireNonNull(update, "update must not be null");
        if (update.isEmpty()) {
            return this;
        }
        Map<String, Object> next = new LinkedHashMap<>(values);
        for (Map.Entry<StateField<?, ?>, FieldChange> entry : update.changes().entrySet()) {
            StateField<?, ?> declared = schema.require(entry.getKey().name());
            if (declared.shape() != entry.getKey().shape()) {
                throw new StateTypeMismatchException(
                        "Field '"
                                + declared.name()
                                + "' is declared "
                                + declared.shape()
                                + " but the update uses "
                                + entry.getKey().shape());
            }
            if (entry.getValue() instanceof FieldChange.Assign assign) {
                next.put(declared.name(), declared.reduce(next.get(declared.name()), assign.value()));
            } else {
                next.put(declared.name(), declared.defaultValue());
            }
        }
        return new WorkflowState(schema, next);
    }

    public StateSchema schema() {
        return schema;
    }

    /// Returns the flat name/value view used for persistence and payload projection.
    public Map<String, Object> toMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WorkflowState other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "WorkflowState" + values;
    }
}
