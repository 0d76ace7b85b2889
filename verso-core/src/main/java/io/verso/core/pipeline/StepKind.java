package io.verso.core.pipeline;

/// How the engine dispatches a {@link Step}.
public enum StepKind {
    /// Executed by a registered {@link io.verso.core.execution.node.PipelineNode}.
    NODE,
    /// Handled by a registered {@link io.verso.core.checkpoint.CheckpointDefinition}.
    CHECKPOINT,
    /// Ends the control loop.
    TERMINAL
}
