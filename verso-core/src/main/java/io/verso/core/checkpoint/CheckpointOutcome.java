package io.verso.core.checkpoint;

import java.util.Objects;

/// Result of entering a checkpoint.
///
/// ### Permitted Subtypes
/// - {@link Skipped} - the skip predicate held, control passes straight through
/// - {@link Suspended} - the run must yield with a payload for the reviewer
public sealed interface CheckpointOutcome {

    record Skipped() implements CheckpointOutcome {}

    /// @param payload projection shown to the reviewer, not null
    record Suspended(CheckpointPayload payload) implements CheckpointOutcome {
        public Suspended {
            Objects.requireNonNull(payload, "payload must not be null");
        }
    }

    default boolean isSuspended() {
        return this instanceof Suspended;
    }
}
