package io.verso.core.execution;

import io.verso.core.checkpoint.CheckpointPayload;
import io.verso.core.pipeline.ApprovalType;
import io.verso.core.pipeline.ErrorRecord;
import io.verso.core.state.WorkflowState;
import java.util.Objects;

/// Outcome of driving a run until it can go no further.
///
/// ### Permitted Subtypes
/// - {@link Completed} - the run reached the `complete` phase
/// - {@link Suspended} - the run waits for a {@link io.verso.core.checkpoint.HumanDecision}
/// - {@link Failed} - the run halted in the `error` phase or was cancelled
public sealed interface RunResult {

    /// Final state of the drive.
    WorkflowState state();

    record Completed(WorkflowState state) implements RunResult {
        public Completed {
            Objects.requireNonNull(state, "state must not be null");
        }
    }

    /// @param runId run waiting for input, not null
    /// @param approvalType decision being requested, not null
    /// @param payload projection shown to the reviewer, not null
    /// @param state persisted state of the suspended run, not null
    record Suspended(String runId, ApprovalType approvalType, CheckpointPayload payload, WorkflowState state)
            implements RunResult {
        public Suspended {
            Objects.requireNonNull(runId, "runId must not be null");
            Objects.requireNonNull(approvalType, "approvalType must not be null");
            Objects.requireNonNull(payload, "payload must not be null");
            Objects.requireNonNull(state, "state must not be null");
        }
    }

    /// @param state persisted state, not null
    /// @param error the failure that stopped the run, may be null when none was recorded
    record Failed(WorkflowState state, ErrorRecord error) implements RunResult {
        public Failed {
            Objects.requireNonNull(state, "state must not be null");
        }
    }
}
