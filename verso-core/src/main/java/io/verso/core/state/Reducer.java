package io.verso.core.state;

/// Combines the current value of a state field with an incoming update.
///
/// ### Contracts
/// - **Precondition**: `update` is non-null; `current` may be null for fields whose
///   declared default is null
/// - **Postcondition**: returns a new value; neither argument is mutated
///
/// @param <V> stored value type
/// @param <U> update type
/// @see Reducers
@FunctionalInterface
public interface Reducer<V, U> {

    /// Computes the next field value.
    ///
    /// @param current the value currently stored, may be null
    /// @param update the incoming partial value, not null
    /// @return the merged value
    V reduce(V current, U update);
}
