package io.verso.core.checkpoint;

import io.verso.core.exception.StateContractException;
import io.verso.core.pipeline.ArtifactKind;
import io.verso.core.pipeline.ReportFields;
import io.verso.core.state.StateField;
import io.verso.core.state.StateUpdate;
import io.verso.core.state.WorkflowState;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Maps the answer to an artifact review (arc selection, outline, article).
///
/// ### Accepted decisions
/// - approval: `approved=true` for outline and article, a non-empty `selectedArcs` for
///   arcs; an edited artifact may be sent along under the artifact's field name
/// - rejection: `approved=false` (or no selection) plus non-blank `feedback`; the current
///   artifact becomes the previous output, the revision counter grows by one and the
///   router sends the run to the kind's revise step
/// - anything else without feedback: no change, the checkpoint suspends again
public final class ArtifactReviewMapper implements DecisionMapper {

    private final ArtifactKind kind;

    public ArtifactReviewMapper(ArtifactKind kind) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    @Override
    public StateUpdate toUpdate(WorkflowState state, HumanDecision decision) {
        Map<String, Object> fields = decision.fields();
        checkKeys(fields, decision);

        Object feedback = fields.get(HumanDecision.FEEDBACK);
        if (feedback != null && !(feedback instanceof String)) {
            throw new StateContractException("feedback must be a string");
        }

        StateUpdate.Builder update = StateUpdate.builder();
        Object edited = fields.get(kind.artifactField().name());
        if (edited != null) {
            update.include(StateUpdate.fromMap(state.schema(), Map.of(kind.artifactField().name(), edited)));
        }

        if (isApproval(fields)) {
            if (kind == ArtifactKind.ARCS) {
                update.include(
                        StateUpdate.fromMap(
                                state.schema(),
                                Map.of(
                                        ReportFields.SELECTED_ARCS.name(),
                                        fields.get(ReportFields.SELECTED_ARCS.name()))));
            } else {
                update.set(approvalFlag(), Boolean.TRUE);
            }
            return update.clear(kind.feedbackField()).build();
        }

        String text = (String) feedback;
        if (text == null || text.isBlank()) {
            return StateUpdate.empty();
        }
        return rejection(state, text);
    }

    /// Builds the update that sends the current artifact back with reviewer feedback.
    StateUpdate rejection(WorkflowState state, String feedback) {
        StateUpdate.Builder update =
                StateUpdate.builder()
                        .set(kind.feedbackField(), feedback)
                        .set(kind.counterField(), kind.revisionCount(state) + 1)
                        .clear(kind.artifactField());
        Object current = kind.artifact(state);
        if (current != null) {
            update.include(
                    StateUpdate.fromMap(state.schema(), Map.of(kind.previousField().name(), current)));
        }
        if (kind != ArtifactKind.ARCS) {
            update.set(approvalFlag(), Boolean.FALSE);
        }
        return update.build();
    }

    private boolean isApproval(Map<String, Object> fields) {
        if (kind == ArtifactKind.ARCS) {
            Object selected = fields.get(ReportFields.SELECTED_ARCS.name());
            return selected instanceof List<?> list && !list.isEmpty();
        }
        return Boolean.TRUE.equals(fields.get(HumanDecision.APPROVED));
    }

    private StateField<Boolean, Boolean> approvalFlag() {
        return kind == ArtifactKind.OUTLINE
                ? ReportFields.OUTLINE_APPROVED
                : ReportFields.ARTICLE_APPROVED;
    }

    private void checkKeys(Map<String, Object> fields, HumanDecision decision) {
        Set<String> accepted =
                kind == ArtifactKind.ARCS
                        ? Set.of(
                                ReportFields.SELECTED_ARCS.name(),
                                HumanDecision.FEEDBACK,
                                kind.artifactField().name())
                        : Set.of(
                                HumanDecision.APPROVED,
                                HumanDecision.FEEDBACK,
                                kind.artifactField().name());
        for (String key : fields.keySet()) {
            if (!accepted.contains(key)) {
                throw new StateContractException(
                        "Field '"
                                + key
                                + "' is not accepted at checkpoint "
                                + decision.approvalType()
                                + ", expected one of "
                                + accepted);
            }
        }
    }
}
