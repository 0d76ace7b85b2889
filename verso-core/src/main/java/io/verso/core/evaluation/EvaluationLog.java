package io.verso.core.evaluation;

import io.verso.core.pipeline.ArtifactKind;
import io.verso.core.pipeline.ReportFields;
import io.verso.core.state.WorkflowState;
import java.util.List;
import java.util.Optional;

/// Read-only queries over the `evaluationHistory` and `escalations` logs.
///
/// Only entries of the current rollback epoch describe the live attempt; older entries
/// stay in the logs for inspection.
public final class EvaluationLog {

    private EvaluationLog() {}

    /// Returns the latest evaluation of `kind` recorded in the current epoch.
    public static Optional<EvaluationRecord> latest(WorkflowState state, ArtifactKind kind) {
        int epoch = state.get(ReportFields.ROLLBACK_EPOCH);
        List<EvaluationRecord> history = state.get(ReportFields.EVALUATION_HISTORY);
        for (int i = history.size() - 1; i >= 0; i--) {
            EvaluationRecord record = history.get(i);
            if (record.kind() == kind && record.epoch() == epoch) {
                return Optional.of(record);
            }
        }
        return Optional.empty();
    }

    /// Returns the evaluation of the attempt identified by the kind's current revision
    /// counter, if that attempt has been evaluated.
    public static Optional<EvaluationRecord> currentAttempt(WorkflowState state, ArtifactKind kind) {
        int attempt = kind.revisionCount(state);
        return latest(state, kind).filter(record -> record.attempt() == attempt);
    }

    /// Whether the current attempt of `kind` has already been handed to a reviewer.
    public static boolean isEscalated(WorkflowState state, ArtifactKind kind) {
        return latestEscalation(state, kind)
                .filter(escalation -> escalation.attempt() == kind.revisionCount(state))
                .isPresent();
    }

    public static Optional<EscalationRecord> latestEscalation(WorkflowState state, ArtifactKind kind) {
        int epoch = state.get(ReportFields.ROLLBACK_EPOCH);
        List<EscalationRecord> escalations = state.get(ReportFields.ESCALATIONS);
        for (int i = escalations.size() - 1; i >= 0; i--) {
            EscalationRecord escalation = escalations.get(i);
            if (escalation.kind() == kind && escalation.epoch() == epoch) {
                return Optional.of(escalation);
            }
        }
        return Optional.empty();
    }

    /// Returns every evaluation of `kind` in the current epoch, oldest first.
    public static List<EvaluationRecord> history(WorkflowState state, ArtifactKind kind) {
        int epoch = state.get(ReportFields.ROLLBACK_EPOCH);
        return state.get(ReportFields.EVALUATION_HISTORY).stream()
                .filter(record -> record.kind() == kind && record.epoch() == epoch)
                .toList();
    }
}
