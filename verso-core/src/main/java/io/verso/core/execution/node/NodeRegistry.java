package io.verso.core.execution.node;

import io.verso.core.exception.StepNotRegisteredException;
import io.verso.core.pipeline.Step;
import java.util.Optional;

/// Registry of pipeline nodes keyed by the step they implement.
///
/// ### Example usage
/// {@snippet :
/// registry.register(new GenerateOutlineNode());
/// PipelineNode node = registry.getNode(Step.GENERATE_OUTLINE);
/// }
public interface NodeRegistry {

    /// @param step step to look up, not null
    /// @return the node, empty if none is registered
    Optional<PipelineNode> findNode(Step step);

    /// @throws StepNotRegisteredException if no node is registered for `step`
    default PipelineNode getNode(Step step) {
        return findNode(step)
                .orElseThrow(() -> new StepNotRegisteredException("No node registered for step: " + step));
    }

    /// Registers `node` under {@link PipelineNode#getStep()}, replacing any earlier node.
    ///
    /// @throws IllegalArgumentException if the step is a checkpoint or terminal step
    void register(PipelineNode node);

    boolean hasNode(Step step);
}
