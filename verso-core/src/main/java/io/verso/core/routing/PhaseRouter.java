package io.verso.core.routing;

import io.verso.core.pipeline.Step;
import io.verso.core.state.WorkflowState;

/// Chooses the next step of a run from its current state.
///
/// ### Contracts
/// - **Precondition**: `state` is fully merged
/// - **Postcondition**: same state, same answer; no side effects
@FunctionalInterface
public interface PhaseRouter {

    /// @param state current run state, not null
    /// @return the step to run next, never null
    Step route(WorkflowState state);
}
