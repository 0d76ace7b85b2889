package io.verso.core.state;

import java.util.Objects;

/// One entry of a {@link StateUpdate}: either a value for the field's reducer or an
/// explicit reset to the field's default.
///
/// A field that is absent from an update is left untouched, so "no update" needs no
/// representation of its own.
public sealed interface FieldChange {

    /// Value to be combined with the current one by the field's reducer.
    ///
    /// @param value update value, not null
    record Assign(Object value) implements FieldChange {
        public Assign {
            Objects.requireNonNull(value, "value must not be null, use Clear to reset a field");
        }
    }

    /// Resets the field to its declared default, bypassing the reducer.
    record Clear() implements FieldChange {}

    Clear CLEAR = new Clear();
}
