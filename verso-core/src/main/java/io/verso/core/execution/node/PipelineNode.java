package io.verso.core.execution.node;

import io.verso.core.execution.NodeContext;
import io.verso.core.pipeline.Step;
import io.verso.core.state.StateUpdate;
import io.verso.core.state.WorkflowState;

/// Unit of work selected by the router.
///
/// A node reads the state and returns a partial update; it never mutates the state. The
/// engine merges the update, persists the result and routes again.
///
/// ### Contracts
/// - **Precondition**: `state` is the fully merged state of the run
/// - **Postcondition**: the returned update only touches declared fields
///
/// @implNote Implementations should be stateless; collaborators are obtained through
/// {@link NodeContext#service(Class)}.
/// @see NodeRegistry
public interface PipelineNode {

    /// Returns the step this node implements.
    ///
    /// @return the step, never null
    Step getStep();

    /// Executes the node.
    ///
    /// @param state current run state, not null
    /// @param context services of the run, not null
    /// @return the partial update, never null (use {@link StateUpdate#empty()})
    /// @throws Exception on failure; the engine records it in `errors`
    StateUpdate execute(WorkflowState state, NodeContext context) throws Exception;
}
