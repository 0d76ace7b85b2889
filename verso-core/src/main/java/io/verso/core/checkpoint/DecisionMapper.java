package io.verso.core.checkpoint;

import io.verso.core.exception.StateContractException;
import io.verso.core.state.StateField;
import io.verso.core.state.StateUpdate;
import io.verso.core.state.WorkflowState;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/// Converts a reviewer's {@link HumanDecision} into the partial update merged on resume.
///
/// Mappers only compute the update; the engine applies it.
@FunctionalInterface
public interface DecisionMapper {

    /// @param state state of the suspended run, not null
    /// @param decision reviewer answer, not null
    /// @return update to merge, never null; empty when the decision carries nothing
    /// @throws StateContractException if the decision names a field the checkpoint
    ///     does not accept or a value of the wrong type
    StateUpdate toUpdate(WorkflowState state, HumanDecision decision);

    /// Accepts exactly the listed fields, copied into state through their reducers.
    static DecisionMapper fields(List<StateField<?, ?>> accepted) {
        Set<String> names = accepted.stream().map(StateField::name).collect(Collectors.toSet());
        return (state, decision) -> {
            for (String key : decision.fields().keySet()) {
                if (!names.contains(key)) {
                    throw new StateContractException(
                            "Field '"
                                    + key
                                    + "' is not accepted at checkpoint "
                                    + decision.approvalType()
                                    + ", expected one of "
                                    + names);
                }
            }
            return StateUpdate.fromMap(state.schema(), decision.fields());
        };
    }

    /// Accepts the listed fields as optional edits and marks `approvalFlag` true.
    ///
    /// A decision without an `approved` entry, including an empty one, is an approval.
    /// Only `approved: false` leaves the state unchanged, edits included.
    static DecisionMapper approveWith(
            StateField<Boolean, Boolean> approvalFlag, List<StateField<?, ?>> editable) {
        DecisionMapper edits = fields(editable);
        return (state, decision) -> {
            Map<String, Object> values = new LinkedHashMap<>(decision.fields());
            Object approved = values.remove(HumanDecision.APPROVED);
            if (Boolean.FALSE.equals(approved)) {
                return StateUpdate.empty();
            }
            HumanDecision stripped = HumanDecision.of(decision.approvalType(), values);
            return StateUpdate.builder()
                    .include(edits.toUpdate(state, stripped))
                    .set(approvalFlag, Boolean.TRUE)
                    .build();
        };
    }
}
