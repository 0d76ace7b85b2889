package io.verso.core.execution.node;

import io.verso.core.evaluation.ArtifactEvaluator;
import io.verso.core.evaluation.Evaluation;
import io.verso.core.evaluation.EvaluationRecord;
import io.verso.core.execution.NodeContext;
import io.verso.core.pipeline.ArtifactKind;
import io.verso.core.pipeline.ReportFields;
import io.verso.core.pipeline.Step;
import io.verso.core.state.StateUpdate;
import io.verso.core.state.WorkflowState;
import java.time.Instant;
import java.util.Objects;

/// Scores the current artifact of one kind and appends the verdict to
/// `evaluationHistory`, tagged with the current attempt and rollback epoch.
///
/// Never touches revision counters; deciding what follows is {@link RevisionGateNode}'s
/// job.
public final class EvaluateArtifactNode implements PipelineNode {

    private final ArtifactKind kind;

    public EvaluateArtifactNode(ArtifactKind kind) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    @Override
    public Step getStep() {
        return kind.evaluateStep();
    }

    @Override
    public StateUpdate execute(WorkflowState state, NodeContext context) throws Exception {
        Evaluation evaluation = context.service(ArtifactEvaluator.class).evaluate(kind, state);
        EvaluationRecord record =
                new EvaluationRecord(
                        kind,
                        kind.revisionCount(state),
                        state.get(ReportFields.ROLLBACK_EPOCH),
                        evaluation,
                        Instant.now());
        return StateUpdate.builder()
                .set(ReportFields.EVALUATION_HISTORY, record)
                .set(ReportFields.CURRENT_PHASE, getStep().phase())
                .build();
    }
}
