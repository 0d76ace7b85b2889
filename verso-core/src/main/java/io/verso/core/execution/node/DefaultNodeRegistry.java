package io.verso.core.execution.node;

import io.verso.core.pipeline.ArtifactKind;
import io.verso.core.pipeline.Step;
import io.verso.core.pipeline.StepKind;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// Default implementation of {@link NodeRegistry}.
///
/// Pre-registers the built-in nodes that need no model access: the evaluation and
/// revision gate of every artifact kind, the specialist scatter-gather and the source
/// fetch. Generation nodes are registered by the application.
///
/// All built-in nodes are stateless; they obtain collaborators from the node context at
/// execution time.
public class DefaultNodeRegistry implements NodeRegistry {

    private final Map<Step, PipelineNode> nodes = new ConcurrentHashMap<>();

    /// Creates a registry with the built-in nodes pre-registered.
    public DefaultNodeRegistry() {
        for (ArtifactKind kind : ArtifactKind.values()) {
            register(new EvaluateArtifactNode(kind));
            register(new RevisionGateNode(kind));
        }
        register(new ArcSpecialistsNode());
        register(new FetchSourcesNode());
    }

    @Override
    public Optional<PipelineNode> findNode(Step step) {
        return Optional.ofNullable(nodes.get(step));
    }

    @Override
    public void register(PipelineNode node) {
        Objects.requireNonNull(node, "node must not be null");
        Step step = Objects.requireNonNull(node.getStep(), "node step must not be null");
        if (step.kind() != StepKind.NODE) {
            throw new IllegalArgumentException("Step " + step + " is not a node step");
        }
        nodes.put(step, node);
    }

    @Override
    public boolean hasNode(Step step) {
        return nodes.containsKey(step);
    }
}
