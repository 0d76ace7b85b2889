package io.verso.core.storage;

import io.verso.core.checkpoint.CheckpointPayload;
import io.verso.core.checkpoint.CheckpointStatus;
import io.verso.core.pipeline.ApprovalType;
import io.verso.core.pipeline.ArtifactKind;
import io.verso.core.pipeline.Phase;
import io.verso.core.pipeline.ReportFields;
import io.verso.core.state.WorkflowState;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/// Immutable snapshot of a run for persistence and resume.
///
/// The full {@link WorkflowState} is the source of truth; the remaining fields are
/// denormalised for listing and inspection without loading the state.
///
/// ### Contracts
/// - **Precondition**: `runId` and `state` must not be null
/// - **Invariant**: `pendingCheckpoint` is non-null iff `checkpointStatus` is
///   {@link CheckpointStatus#SUSPENDED}
///
/// ### Usage
/// {@snippet :
/// RunSnapshot snapshot = RunSnapshot.from(runId, state, "step:generateOutline");
/// repository.save(snapshot);
///
/// WorkflowState restored = repository.findByRunId(runId).orElseThrow().state();
/// }
///
/// @param runId unique identifier of the run, not null
/// @param state complete run state, not null
/// @param currentPhase phase of `state`, not null
/// @param approvalType pending approval, null when not suspended
/// @param revisionCounts revision counter per artifact kind, not null
/// @param checkpointStatus suspension status, not null
/// @param pendingCheckpoint payload shown to the reviewer, null when not suspended
/// @param createdAt when this snapshot was created, not null
/// @param reason why this snapshot was taken, may be null
public record RunSnapshot(
        String runId,
        WorkflowState state,
        Phase currentPhase,
        ApprovalType approvalType,
        Map<ArtifactKind, Integer> revisionCounts,
        CheckpointStatus checkpointStatus,
        CheckpointPayload pendingCheckpoint,
        Instant createdAt,
        String reason) {

    public RunSnapshot {
        Objects.requireNonNull(runId, "runId must not be null");
        Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(currentPhase, "currentPhase must not be null");
        Objects.requireNonNull(checkpointStatus, "checkpointStatus must not be null");
        revisionCounts =
                revisionCounts == null || revisionCounts.isEmpty()
                        ? Map.of()
                        : Collections.unmodifiableMap(new EnumMap<>(revisionCounts));
        createdAt = createdAt != null ? createdAt : Instant.now();
        if ((checkpointStatus == CheckpointStatus.SUSPENDED) != (pendingCheckpoint != null)) {
            throw new IllegalArgumentException(
                    "pendingCheckpoint must be present exactly when the run is suspended");
        }
    }

    /// Creates a snapshot of a run with no reviewer input outstanding.
    public static RunSnapshot from(String runId, WorkflowState state, String reason) {
        return from(runId, state, CheckpointStatus.PENDING, null, reason);
    }

    /// Creates a snapshot of a run that just merged a reviewer decision.
    public static RunSnapshot resumed(String runId, WorkflowState state, String reason) {
        return from(runId, state, CheckpointStatus.RESUMED, null, reason);
    }

    /// Creates a snapshot of a run suspended at `pending`.
    public static RunSnapshot suspended(
            String runId, WorkflowState state, CheckpointPayload pending, String reason) {
        Objects.requireNonNull(pending, "pending must not be null");
        return from(runId, state, CheckpointStatus.SUSPENDED, pending, reason);
    }

    private static RunSnapshot from(
            String runId,
            WorkflowState state,
            CheckpointStatus status,
            CheckpointPayload pending,
            String reason) {
        Objects.requireNonNull(state, "state must not be null");
        Map<ArtifactKind, Integer> counts = new EnumMap<>(ArtifactKind.class);
        for (ArtifactKind kind : ArtifactKind.values()) {
            counts.put(kind, kind.revisionCount(state));
        }
        return new RunSnapshot(
                runId,
                state,
                state.get(ReportFields.CURRENT_PHASE),
                state.get(ReportFields.APPROVAL_TYPE),
                counts,
                status,
                pending,
                Instant.now(),
                reason);
    }

    public boolean isSuspended() {
        return checkpointStatus == CheckpointStatus.SUSPENDED;
    }

    /// Whether the run reached a terminal phase.
    public boolean isFinished() {
        return currentPhase.isTerminal();
    }
}
