package io.verso.core.state;

/// Merge rule family of a {@link StateField}.
///
/// @see Reducers for the reducer behind each shape
public enum FieldShape {
    /// New value overwrites the old one.
    REPLACE,
    /// Update is a list whose elements are concatenated onto the current list.
    APPEND_LIST,
    /// Update is a single element appended to the current list.
    APPEND_SINGLE,
    /// Update is a mapping shallow-merged into the current mapping.
    MERGE_OBJECT;

    /// Returns true for the two append-only log shapes.
    public boolean isAppend() {
        return this == APPEND_LIST || this == APPEND_SINGLE;
    }
}
