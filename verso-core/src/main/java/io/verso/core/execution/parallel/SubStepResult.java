package io.verso.core.execution.parallel;

import java.util.Objects;

/// Outcome of one sub-step.
///
/// ### Permitted Subtypes
/// - {@link Succeeded} - the sub-step returned a value
/// - {@link Failed} - the sub-step threw, timed out or was cancelled
///
/// @param <T> result type
public sealed interface SubStepResult<T> {

    record Succeeded<T>(T value) implements SubStepResult<T> {}

    /// @param reason failure category, not null
    /// @param message human-readable cause, not null
    record Failed<T>(FailureReason reason, String message) implements SubStepResult<T> {
        public Failed {
            Objects.requireNonNull(reason, "reason must not be null");
            message = message != null ? message : reason.name();
        }
    }

    static <T> SubStepResult<T> succeeded(T value) {
        return new Succeeded<>(value);
    }

    static <T> SubStepResult<T> failed(FailureReason reason, String message) {
        return new Failed<>(reason, message);
    }

    default boolean isSuccess() {
        return this instanceof Succeeded;
    }
}
