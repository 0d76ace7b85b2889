package io.verso.core.checkpoint;

/// Lifecycle of the checkpoint a run last reached.
public enum CheckpointStatus {
    /// No reviewer input is outstanding.
    PENDING,
    /// The run yielded and waits for a {@link HumanDecision}.
    SUSPENDED,
    /// A decision was merged and the run continued.
    RESUMED
}
