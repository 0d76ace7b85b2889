package io.verso.core.execution.parallel;

/// Why a sub-step did not produce a value.
public enum FailureReason {
    /// The sub-step threw.
    ERROR,
    /// The sub-step did not finish within the configured timeout.
    TIMEOUT,
    /// The run was cancelled before the sub-step finished.
    CANCELLED
}
