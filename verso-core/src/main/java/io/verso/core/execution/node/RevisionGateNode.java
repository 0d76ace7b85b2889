package io.verso.core.execution.node;

import io.verso.core.evaluation.RevisionDecision;
import io.verso.core.evaluation.RevisionGate;
import io.verso.core.execution.NodeContext;
import io.verso.core.pipeline.ArtifactKind;
import io.verso.core.pipeline.Step;
import io.verso.core.state.StateUpdate;
import io.verso.core.state.WorkflowState;
import java.util.Objects;

/// Applies the {@link RevisionGate} verdict for one artifact kind, with the caps of the
/// engine configuration.
public final class RevisionGateNode implements PipelineNode {

    private final ArtifactKind kind;

    public RevisionGateNode(ArtifactKind kind) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    @Override
    public Step getStep() {
        return kind.gateStep();
    }

    @Override
    public StateUpdate execute(WorkflowState state, NodeContext context) {
        RevisionGate gate = new RevisionGate(context.getConfig().getRevisionCaps());
        RevisionDecision decision = gate.decide(kind, state);
        return gate.toUpdate(kind, state, decision);
    }
}
