package io.verso.core.rollback;

import io.verso.core.exception.InvalidRollbackPointException;
import io.verso.core.pipeline.ApprovalType;
import io.verso.core.pipeline.ReportFields;
import io.verso.core.state.StateField;
import io.verso.core.state.StateUpdate;
import io.verso.core.state.WorkflowState;
import java.util.Objects;
import java.util.logging.Logger;

/// Rewinds a run to a checkpoint by resetting the fields that checkpoint's decision fed.
///
/// ### Contracts
/// - **Precondition**: the target is listed in {@link RollbackTable}
/// - **Postcondition**: every field outside the plan (and outside the control fields)
///   keeps its value
/// - **Postcondition**: `rollbackEpoch` is incremented, so evaluations and escalations
///   recorded before the rollback no longer count for routing
///
/// @implNote Stateless and thread-safe.
/// @see RollbackTable
public final class RollbackService {

    private static final Logger logger = Logger.getLogger(RollbackService.class.getName());

    /// Rolls back to a point given by identifier.
    ///
    /// @param state state to rewind, not null
    /// @param pointId rollback point identifier, e.g. `"outline"`
    /// @return the rewound state, never null
    /// @throws InvalidRollbackPointException if `pointId` is not a rollback point
    public WorkflowState rollback(WorkflowState state, String pointId) {
        Objects.requireNonNull(state, "state must not be null");
        return apply(state, RollbackTable.resolve(pointId));
    }

    /// Rolls back to the checkpoint waiting for `point`.
    ///
    /// @throws InvalidRollbackPointException if `point` is not a rollback point
    public WorkflowState rollback(WorkflowState state, ApprovalType point) {
        Objects.requireNonNull(point, "point must not be null");
        return rollback(state, point.id());
    }

    /// Computes the update a rollback merges, without applying it.
    public StateUpdate updateFor(WorkflowState state, RollbackPlan plan) {
        StateUpdate.Builder update = StateUpdate.builder();
        for (StateField<?, ?> field : plan.clearedFields()) {
            update.clear(field);
        }
        for (StateField<Integer, Integer> counter : plan.counterFields()) {
            update.set(counter, 0);
        }
        return update.set(ReportFields.AWAITING_APPROVAL, Boolean.FALSE)
                .clear(ReportFields.APPROVAL_TYPE)
                .clear(ReportFields.NEXT_STEP_OVERRIDE)
                .set(ReportFields.CURRENT_PHASE, plan.reentryStep().phase())
                .set(ReportFields.ROLLBACK_EPOCH, state.get(ReportFields.ROLLBACK_EPOCH) + 1)
                .build();
    }

    private WorkflowState apply(WorkflowState state, RollbackPlan plan) {
        WorkflowState rewound = state.apply(updateFor(state, plan));
        logger.info(
                "Rolled back to '"
                        + plan.point().id()
                        + "', cleared "
                        + plan.clearedFields().size()
                        + " fields, re-entering at "
                        + plan.reentryStep());
        return rewound;
    }
}
