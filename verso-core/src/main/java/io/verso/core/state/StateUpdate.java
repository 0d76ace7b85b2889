package io.verso.core.state;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Immutable partial update of a {@link WorkflowState}.
///
/// Each entry pairs a {@link StateField} with a {@link FieldChange}. Fields that are not
/// mentioned keep their current value when the update is applied.
///
/// ### Example
/// {@snippet :
/// StateUpdate update = StateUpdate.builder()
///         .set(ReportFields.OUTLINE, outline)
///         .set(ReportFields.EVALUATION_HISTORY, record)
///         .clear(ReportFields.OUTLINE_FEEDBACK)
///         .build();
/// }
///
/// @implNote Immutable and thread-safe.
/// @see WorkflowState#apply(StateUpdate)
public final class StateUpdate {

    private static final StateUpdate EMPTY = new StateUpdate(Map.of());

    private final Map<StateField<?, ?>, FieldChange> changes;

    private StateUpdate(Map<StateField<?, ?>, FieldChange> changes) {
        this.changes = changes;
    }

    public static StateUpdate empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Builds an update from an untyped mapping of field names to values, as received
    /// from a review surface or a persisted document.
    ///
    /// A `null` value is an explicit clear, except on append-only logs (`errors`,
    /// `evaluationHistory`, `escalations`) where it is ignored: a log can only be reset
    /// through {@link Builder#clear}. Names and value types are validated against
    /// `schema` before the update is returned.
    ///
    /// @param schema schema declaring the accepted fields, not null
    /// @param values field name to update value, not null
    /// @return the typed update, never null
    /// @throws io.verso.core.exception.UnknownStateFieldException for an undeclared name
    /// @throws io.verso.core.exception.StateTypeMismatchException for an ill-typed value
    public static StateUpdate fromMap(StateSchema schema, Map<String, ?> values) {
        Objects.requireNonNull(schema, "schema must not be null");
        Objects.requireNonNull(values, "values must not be null");
        Builder builder = builder();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            StateField<?, ?> field = schema.require(entry.getKey());
            Object value = entry.getValue();
            if (value == null) {
                if (!field.shape().isAppend()) {
                    builder.clear(field);
                }
            } else {
                field.checkUpdate(value);
                builder.changes.put(field, new FieldChange.Assign(value));
            }
        }
        return builder.build();
    }

    public boolean isEmpty() {
        return changes.isEmpty();
    }

    public int size() {
        return changes.size();
    }

    public boolean touches(StateField<?, ?> field) {
        return changes.containsKey(field);
    }

    /// Returns the assigned update value for `field`, or null when the field is absent
    /// or cleared.
    public <U> U valueOf(StateField<?, U> field) {
        FieldChange change = changes.get(field);
        return change instanceof FieldChange.Assign assign ? field.castUpdate(assign.value()) : null;
    }

    public Map<StateField<?, ?>, FieldChange> changes() {
        return changes;
    }

    /// Combines this update with `later`; entries of `later` win for fields both touch.
    public StateUpdate mergedWith(StateUpdate later) {
        if (later.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return later;
        }
        Map<StateField<?, ?>, FieldChange> merged = new LinkedHashMap<>(changes);
        merged.putAll(later.changes);
        return new StateUpdate(Collections.unmodifiableMap(merged));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StateUpdate other)) return false;
        return changes.equals(other.changes);
    }

    @Override
    public int hashCode() {
        return changes.hashCode();
    }

    @Override
    public String toString() {
        return "StateUpdate" + changes.keySet();
    }

    /// Builder for {@link StateUpdate}. A later call for the same field replaces the
    /// earlier one.
    public static final class Builder {
        private final Map<StateField<?, ?>, FieldChange> changes = new LinkedHashMap<>();

        private Builder() {}

        /// Adds a value for the field's reducer.
        ///
        /// @param field target field, not null
        /// @param value update value, not null; use {@link #clear} to reset a field
        /// @return this builder for chaining
        public <U> Builder set(StateField<?, U> field, U value) {
            Objects.requireNonNull(field, "field must not be null");
            changes.put(field, new FieldChange.Assign(value));
            return this;
        }

        /// Resets the field to its declared default.
        public Builder clear(StateField<?, ?> field) {
            Objects.requireNonNull(field, "field must not be null");
            changes.put(field, FieldChange.CLEAR);
            return this;
        }

        /// Copies every entry of `other` into this builder.
        public Builder include(StateUpdate other) {
            changes.putAll(other.changes);
            return this;
        }

        public StateUpdate build() {
            if (changes.isEmpty()) {
                return EMPTY;
            }
            return new StateUpdate(Collections.unmodifiableMap(new LinkedHashMap<>(changes)));
        }
    }
}
