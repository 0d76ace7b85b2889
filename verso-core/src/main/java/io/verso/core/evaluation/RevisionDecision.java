package io.verso.core.evaluation;

import java.util.List;
import java.util.Objects;

/// Control decision taken by the {@link RevisionGate} after an evaluation.
///
/// ### Permitted Subtypes
/// - {@link Proceed} - the artifact is ready, continue to its checkpoint
/// - {@link Revise} - regenerate automatically as attempt `nextAttempt`
/// - {@link Escalate} - the cap is reached, hand the issues to a reviewer
public sealed interface RevisionDecision {

    record Proceed() implements RevisionDecision {}

    /// @param nextAttempt revision counter value after the increment
    record Revise(int nextAttempt) implements RevisionDecision {}

    /// @param cap the revision cap that was reached
    /// @param reason reviewer-facing explanation, not null
    /// @param issues outstanding issues, not null
    record Escalate(int cap, String reason, List<String> issues) implements RevisionDecision {
        public Escalate {
            Objects.requireNonNull(reason, "reason must not be null");
            issues = List.copyOf(Objects.requireNonNullElse(issues, List.of()));
        }
    }
}
