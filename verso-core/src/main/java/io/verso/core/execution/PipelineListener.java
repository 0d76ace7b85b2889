package io.verso.core.execution;

import io.verso.core.checkpoint.CheckpointPayload;
import io.verso.core.pipeline.ErrorRecord;
import io.verso.core.pipeline.Step;
import io.verso.core.state.WorkflowState;

/// Listener for pipeline run lifecycle events.
///
/// All methods have default no-op implementations, allowing listeners to override only
/// the events they care about.
///
/// ### Callback Lifecycle
/// Each iteration of the control loop triggers callbacks in this order:
///
/// ```
/// onStepStart(runId, step)          about to execute a node or enter a checkpoint
/// onStepComplete(runId, step, s)    update merged, snapshot persisted
///   or onStepFailed(runId, step, e) node threw, error recorded
/// onSuspended(runId, payload)       checkpoint yielded to a reviewer
/// ```
///
/// @implNote Sub-step callbacks may arrive from pool threads; implementations must be
/// thread-safe.
public interface PipelineListener {

    /// Called before a step runs.
    ///
    /// @param runId run identifier, not null
    /// @param step step selected by the router, not null
    default void onStepStart(String runId, Step step) {}

    /// Called once the step's update has been merged and persisted.
    ///
    /// @param runId run identifier, not null
    /// @param step completed step, not null
    /// @param state merged state, not null
    default void onStepComplete(String runId, Step step, WorkflowState state) {}

    /// Called when a node failed and its error was recorded.
    default void onStepFailed(String runId, Step step, ErrorRecord error) {}

    /// Called when one sub-step of a scatter-gather resolved to a failure.
    default void onSubStepFailed(String runId, String subStep, String message) {}

    /// Called when the run yields at a checkpoint.
    default void onSuspended(String runId, CheckpointPayload payload) {}

    /// Called after a rollback has been persisted.
    default void onRolledBack(String runId, String pointId, WorkflowState state) {}

    /// Called when the run reaches a terminal step.
    default void onFinished(String runId, WorkflowState state) {}

    /// No-op listener instance that ignores all events.
    PipelineListener NOOP = new PipelineListener() {};
}
