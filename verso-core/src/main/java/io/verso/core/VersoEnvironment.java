package io.verso.core;

import io.verso.core.checkpoint.CheckpointRegistry;
import io.verso.core.evaluation.QualityRubricRepository;
import io.verso.core.execution.PipelineEngine;
import io.verso.core.execution.node.NodeRegistry;
import io.verso.core.storage.RunStateRepository;
import java.util.concurrent.ExecutorService;

/// Container holding the wired components of a pipeline deployment.
///
/// Implements {@link AutoCloseable} to release the sub-step thread pool.
///
/// ### Contracts
/// - **Postcondition**: all getters return the instances passed to the constructor
/// - **Invariant**: component references are immutable after construction
///
/// @apiNote Create instances via {@link VersoFactory#builder()} rather than direct
/// construction.
/// @see VersoFactory
public final class VersoEnvironment implements AutoCloseable {

    private final PipelineEngine engine;
    private final NodeRegistry nodeRegistry;
    private final CheckpointRegistry checkpointRegistry;
    private final QualityRubricRepository rubricRepository;
    private final RunStateRepository runStateRepository;
    private final ExecutorService executorService;

    /// @param engine the control loop, not null
    /// @param nodeRegistry nodes of the pipeline, not null
    /// @param checkpointRegistry checkpoint catalogue, not null
    /// @param rubricRepository rubrics used by the evaluator, not null
    /// @param runStateRepository snapshot storage, not null
    /// @param executorService pool for scatter-gather sub-steps, not null
    public VersoEnvironment(
            PipelineEngine engine,
            NodeRegistry nodeRegistry,
            CheckpointRegistry checkpointRegistry,
            QualityRubricRepository rubricRepository,
            RunStateRepository runStateRepository,
            ExecutorService executorService) {
        this.engine = engine;
        this.nodeRegistry = nodeRegistry;
        this.checkpointRegistry = checkpointRegistry;
        this.rubricRepository = rubricRepository;
        this.runStateRepository = runStateRepository;
        this.executorService = executorService;
    }

    public PipelineEngine getEngine() {
        return engine;
    }

    /// Returns the node registry; generation nodes registered after construction are
    /// picked up by the next drive.
    public NodeRegistry getNodeRegistry() {
        return nodeRegistry;
    }

    public CheckpointRegistry getCheckpointRegistry() {
        return checkpointRegistry;
    }

    public QualityRubricRepository getRubricRepository() {
        return rubricRepository;
    }

    public RunStateRepository getRunStateRepository() {
        return runStateRepository;
    }

    /// Shuts down the underlying executor service.
    ///
    /// @apiNote **Side effects**:
    /// - Previously submitted sub-steps continue to execute
    /// - No new sub-steps are accepted after this call
    ///
    /// @implNote Calls `ExecutorService.shutdown()` which does not block.
    @Override
    public void close() {
        executorService.shutdown();
    }
}
