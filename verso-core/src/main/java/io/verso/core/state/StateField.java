package io.verso.core.state;

import io.verso.core.exception.StateTypeMismatchException;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Typed key of a {@link WorkflowState} slot, bundling the field's name, default value
/// and reducer.
///
/// The two type parameters let {@link StateUpdate.Builder#set} reject ill-typed
/// updates at compile time: a replace field takes its own value type, an append-single
/// field takes one element, an append-list field takes a list of elements.
///
/// ### Contracts
/// - **Invariant**: two fields are equal when name and shape are equal
/// - **Invariant**: list and map defaults are immutable
///
/// @param <V> stored value type
/// @param <U> update type accepted by the reducer
/// @implNote Immutable and thread-safe. Declare fields as `static final` constants.
/// @see StateSchema
public final class StateField<V, U> {

    private final String name;
    private final FieldShape shape;
    private final Class<?> valueType;
    private final Class<?> elementType;
    private final Object defaultValue;
    private final Reducer<V, U> reducer;

    private StateField(
            String name,
            FieldShape shape,
            Class<?> valueType,
            Class<?> elementType,
            V defaultValue,
            Reducer<V, U> reducer) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.shape = Objects.requireNonNull(shape, "shape must not be null");
        this.valueType = Objects.requireNonNull(valueType, "valueType must not be null");
        this.elementType = elementType;
        this.defaultValue = Reducers.freeze(defaultValue);
        this.reducer = Objects.requireNonNull(reducer, "reducer must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (defaultValue != null && !valueType.isInstance(defaultValue)) {
            throw new IllegalArgumentException(
                    "Default of field '" + name + "' is not a " + valueType.getSimpleName());
        }
    }

    /// Declares a field whose updates overwrite the stored value.
    ///
    /// @param name field name, not blank
    /// @param valueType runtime type of values, used to validate untyped updates
    /// @param defaultValue value of a fresh state and of an explicit clear, may be null
    /// @return the field, never null
    public static <V> StateField<V, V> replace(String name, Class<?> valueType, V defaultValue) {
        return new StateField<>(
                name, FieldShape.REPLACE, valueType, null, defaultValue, Reducers.replace());
    }

    /// Declares a replace field holding a list whose elements must be of `elementType`.
    public static <E> StateField<List<E>, List<E>> replaceList(
            String name, Class<E> elementType, List<E> defaultValue) {
        return new StateField<>(
                name, FieldShape.REPLACE, List.class, elementType, defaultValue, Reducers.replace());
    }

    /// Declares an ordered log whose updates are lists concatenated onto it.
    public static <E> StateField<List<E>, List<E>> appendList(String name, Class<E> elementType) {
        return new StateField<>(
                name,
                FieldShape.APPEND_LIST,
                List.class,
                Objects.requireNonNull(elementType, "elementType must not be null"),
                List.of(),
                Reducers.appendList());
    }

    /// Declares an ordered log whose updates are single appended elements.
    public static <E> StateField<List<E>, E> appendSingle(String name, Class<E> elementType) {
        return new StateField<>(
                name,
                FieldShape.APPEND_SINGLE,
                List.class,
                Objects.requireNonNull(elementType, "elementType must not be null"),
                List.of(),
                Reducers.appendSingle());
    }

    /// Declares a mapping whose updates are shallow-merged into it.
    public static StateField<Map<String, Object>, Map<String, Object>> mergeObject(String name) {
        return new StateField<>(
                name, FieldShape.MERGE_OBJECT, Map.class, null, Map.of(), Reducers.mergeObject());
    }

    public String name() {
        return name;
    }

    public FieldShape shape() {
        return shape;
    }

    /// Returns the runtime type of stored values (`List` or `Map` for collection shapes).
    public Class<?> valueType() {
        return valueType;
    }

    /// Returns the element type of list fields, or null when elements are untyped.
    public Class<?> elementType() {
        return elementType;
    }

    /// Returns the runtime type an update value must have.
    public Class<?> updateType() {
        return switch (shape) {
            case REPLACE -> valueType;
            case APPEND_LIST -> List.class;
            case APPEND_SINGLE -> elementType;
            case MERGE_OBJECT -> Map.class;
        };
    }

    public V defaultValue() {
        return narrow(defaultValue);
    }

    /// Returns a stored value typed as this field's value type.
    ///
    /// @throws StateTypeMismatchException if `value` is not a {@link #valueType()}
    V cast(Object value) {
        if (value != null && !valueType.isInstance(value)) {
            throw new StateTypeMismatchException(
                    "Field '" + name + "' holds " + value.getClass().getSimpleName());
        }
        return narrow(value);
    }

    /// Returns an update value typed as this field's update type.
    U castUpdate(Object update) {
        if (update != null) {
            checkUpdate(update);
        }
        return narrow(update);
    }

    /// Verifies that `update` can be handed to this field's reducer.
    ///
    /// @param update candidate update, not null
    /// @throws StateTypeMismatchException if the value or one of its elements has the
    ///     wrong runtime type
    public void checkUpdate(Object update) {
        Class<?> expected = updateType();
        if (!expected.isInstance(update)) {
            throw new StateTypeMismatchException(
                    "Field '"
                            + name
                            + "' ("
                            + shape
                            + ") expects "
                            + expected.getSimpleName()
                            + " but got "
                            + update.getClass().getSimpleName());
        }
        if (elementType != null && update instanceof List<?> list) {
            for (Object element : list) {
                if (element != null && !elementType.isInstance(element)) {
                    throw new StateTypeMismatchException(
                            "Field '"
                                    + name
                                    + "' expects elements of "
                                    + elementType.getSimpleName()
                                    + " but got "
                                    + element.getClass().getSimpleName());
                }
            }
        }
    }

    /// Applies the reducer after {@link #checkUpdate(Object)} and returns the frozen
    /// result.
    Object reduce(Object current, Object update) {
        U checked = castUpdate(update);
        return Reducers.freeze(reducer.reduce(cast(current), checked));
    }

    // Only called on values whose runtime type was checked against valueType or updateType.
    @SuppressWarnings("unchecked")
    private static <T> T narrow(Object value) {
        return (T) value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StateField<?, ?> other)) return false;
        return name.equals(other.name) && shape == other.shape;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, shape);
    }

    @Override
    public String toString() {
        return name + "(" + shape + ")";
    }
}
