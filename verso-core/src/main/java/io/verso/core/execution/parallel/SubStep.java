package io.verso.core.execution.parallel;

import io.verso.core.state.WorkflowState;

/// Independent unit of work of a scatter-gather.
///
/// Sub-steps read the shared immutable state and return a value; they never write state.
///
/// @param <T> result type
@FunctionalInterface
public interface SubStep<T> {

    /// @param state snapshot shared by all sub-steps of the same node, not null
    /// @return the result, may be null
    /// @throws Exception on failure; resolves the sub-step to {@link FailureReason#ERROR}
    T run(WorkflowState state) throws Exception;
}
