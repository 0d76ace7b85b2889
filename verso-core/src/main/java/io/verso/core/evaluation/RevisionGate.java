package io.verso.core.evaluation;

import io.verso.core.pipeline.ArtifactKind;
import io.verso.core.pipeline.ReportFields;
import io.verso.core.state.StateUpdate;
import io.verso.core.state.WorkflowState;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Turns the latest evaluation verdict into control flow: proceed, revise or escalate.
///
/// This is the only place that increments a revision counter after an automatic
/// evaluation. With cap `C`, attempts `0..C-1` may be revised; a non-ready verdict on
/// attempt `C` escalates instead of starting attempt `C+1`.
///
/// ### Contracts
/// - **Precondition**: the current attempt of the kind has been evaluated
/// - **Postcondition**: a revise update increments the counter by exactly one and moves
///   the artifact to its previous-output field
/// - **Postcondition**: an escalate update appends one escalation record and requests
///   the kind's checkpoint
///
/// @implNote Immutable and thread-safe.
public final class RevisionGate {

    private static final Logger logger = Logger.getLogger(RevisionGate.class.getName());

    private final Map<ArtifactKind, Integer> caps;

    /// Creates a gate with the given caps; kinds without an entry use their default cap.
    public RevisionGate(Map<ArtifactKind, Integer> caps) {
        Map<ArtifactKind, Integer> resolved = new EnumMap<>(ArtifactKind.class);
        for (ArtifactKind kind : ArtifactKind.values()) {
            int cap = caps.getOrDefault(kind, kind.defaultCap());
            if (cap < 0) {
                throw new IllegalArgumentException("Revision cap for " + kind + " must be >= 0");
            }
            resolved.put(kind, cap);
        }
        this.caps = resolved;
    }

    public RevisionGate() {
        this(Map.of());
    }

    public int capFor(ArtifactKind kind) {
        return caps.get(kind);
    }

    /// Decides what follows the latest evaluation of `kind`.
    ///
    /// @throws IllegalStateException if the current attempt has not been evaluated
    public RevisionDecision decide(ArtifactKind kind, WorkflowState state) {
        EvaluationRecord latest =
                EvaluationLog.currentAttempt(state, kind)
                        .orElseThrow(
                                () ->
                                        new IllegalStateException(
                                                "No evaluation of the current " + kind + " attempt"));
        if (latest.ready()) {
            return new RevisionDecision.Proceed();
        }
        int count = kind.revisionCount(state);
        int cap = capFor(kind);
        if (count < cap) {
            return new RevisionDecision.Revise(count + 1);
        }
        List<String> issues = latest.evaluation().issues();
        return new RevisionDecision.Escalate(
                cap, "Reached revision cap (" + cap + ") with issues: " + formatIssues(issues), issues);
    }

    /// Builds the state update carrying out `decision`.
    public StateUpdate toUpdate(ArtifactKind kind, WorkflowState state, RevisionDecision decision) {
        Objects.requireNonNull(decision, "decision must not be null");
        if (decision instanceof RevisionDecision.Revise revise) {
            logger.info("Revising " + kind + " as attempt " + revise.nextAttempt());
            StateUpdate.Builder update =
                    StateUpdate.builder()
                            .set(kind.counterField(), revise.nextAttempt())
                            .clear(kind.artifactField());
            Object current = kind.artifact(state);
            if (current != null) {
                update.include(
                        StateUpdate.fromMap(state.schema(), Map.of(kind.previousField().name(), current)));
            }
            return update.build();
        }
        if (decision instanceof RevisionDecision.Escalate escalate) {
            logger.warning("Escalating " + kind + " to review: " + escalate.reason());
            EscalationRecord record =
                    new EscalationRecord(
                            kind,
                            kind.revisionCount(state),
                            state.get(ReportFields.ROLLBACK_EPOCH),
                            escalate.reason(),
                            escalate.issues(),
                            Instant.now());
            return StateUpdate.builder()
                    .set(ReportFields.ESCALATIONS, record)
                    .set(ReportFields.AWAITING_APPROVAL, Boolean.TRUE)
                    .set(ReportFields.APPROVAL_TYPE, kind.approvalType())
                    .build();
        }
        return StateUpdate.empty();
    }

    /// Joins issues for a reviewer message.
    public static String formatIssues(List<String> issues) {
        if (issues == null || issues.isEmpty()) {
            return "unspecified issues";
        }
        return String.join("; ", issues);
    }
}
