package io.verso.core;

import io.verso.core.checkpoint.CheckpointRegistry;
import io.verso.core.checkpoint.ReportCheckpoints;
import io.verso.core.evaluation.ArtifactEvaluator;
import io.verso.core.evaluation.ArtifactShapeValidator;
import io.verso.core.evaluation.CriterionScorer;
import io.verso.core.evaluation.InMemoryQualityRubricRepository;
import io.verso.core.evaluation.QualityRubricRepository;
import io.verso.core.evaluation.QualityRubrics;
import io.verso.core.execution.LoggingPipelineListener;
import io.verso.core.execution.PipelineEngine;
import io.verso.core.execution.PipelineListener;
import io.verso.core.execution.node.DefaultNodeRegistry;
import io.verso.core.execution.node.NodeRegistry;
import io.verso.core.execution.node.PipelineNode;
import io.verso.core.storage.InMemoryRunStateRepository;
import io.verso.core.storage.RunStateRepository;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/// Factory for wiring a {@link VersoEnvironment}.
///
/// ### Usage
/// {@snippet :
/// try (VersoEnvironment env = VersoFactory.builder()
///         .config(EngineConfig.builder().revisionCap(ArtifactKind.OUTLINE, 2).build())
///         .criterionScorer(modelScorer)
///         .node(new GenerateOutlineNode())
///         .service(SourceFetcher.class, fetcher)
///         .build()) {
///     RunResult result = env.getEngine().start("run-1", input);
/// }
/// }
///
/// @see VersoEnvironment
/// @see EngineConfig
public final class VersoFactory {

    private VersoFactory() {}

    public static Builder builder() {
        return new Builder();
    }

    /// Creates a rubric repository holding the default rubrics with the configured
    /// structural threshold.
    static QualityRubricRepository defaultRubrics(EngineConfig config) {
        InMemoryQualityRubricRepository repository = new InMemoryQualityRubricRepository();
        QualityRubrics.defaults()
                .values()
                .forEach(rubric -> repository.save(rubric.withThreshold(config.getStructuralThreshold())));
        return repository;
    }

    /// Fluent builder for {@link VersoEnvironment}.
    ///
    /// Required: `criterionScorer`. Everything else has an in-memory or built-in default.
    public static final class Builder {
        private EngineConfig config = EngineConfig.defaults();
        private CriterionScorer criterionScorer;
        private ArtifactShapeValidator shapeValidator = ArtifactShapeValidator.reportShapes();
        private QualityRubricRepository rubricRepository;
        private RunStateRepository runStateRepository;
        private ExecutorService executorService;
        private PipelineListener listener = new LoggingPipelineListener();
        private final List<PipelineNode> nodes = new ArrayList<>();
        private final Map<Class<?>, Object> services = new LinkedHashMap<>();

        private Builder() {}

        public Builder config(EngineConfig config) {
            this.config = config;
            return this;
        }

        /// Sets the scorer behind the artifact evaluator.
        public Builder criterionScorer(CriterionScorer criterionScorer) {
            this.criterionScorer = criterionScorer;
            return this;
        }

        public Builder shapeValidator(ArtifactShapeValidator shapeValidator) {
            this.shapeValidator = shapeValidator;
            return this;
        }

        /// Overrides the default rubrics; the configured structural threshold is then
        /// not applied.
        public Builder rubricRepository(QualityRubricRepository rubricRepository) {
            this.rubricRepository = rubricRepository;
            return this;
        }

        public Builder runStateRepository(RunStateRepository runStateRepository) {
            this.runStateRepository = runStateRepository;
            return this;
        }

        /// Uses an externally managed pool; it is still shut down by
        /// {@link VersoEnvironment#close()}.
        public Builder executorService(ExecutorService executorService) {
            this.executorService = executorService;
            return this;
        }

        public Builder listener(PipelineListener listener) {
            this.listener = listener;
            return this;
        }

        /// Registers an application node, replacing a built-in node for the same step.
        public Builder node(PipelineNode node) {
            nodes.add(Objects.requireNonNull(node, "node must not be null"));
            return this;
        }

        /// Registers a collaborator nodes look up at execution time.
        public <T> Builder service(Class<T> type, T service) {
            services.put(
                    Objects.requireNonNull(type, "type must not be null"),
                    Objects.requireNonNull(service, "service must not be null"));
            return this;
        }

        /// Wires the environment.
        ///
        /// @apiNote **Side effects**: creates a fixed thread pool of
        /// {@link EngineConfig#getThreadPoolSize()} threads unless one was supplied.
        ///
        /// @return the environment, never null
        /// @throws NullPointerException if no criterion scorer was set
        public VersoEnvironment build() {
            Objects.requireNonNull(config, "config must not be null");
            Objects.requireNonNull(criterionScorer, "criterionScorer must not be null");
            Objects.requireNonNull(shapeValidator, "shapeValidator must not be null");

            QualityRubricRepository rubrics =
                    rubricRepository != null ? rubricRepository : defaultRubrics(config);
            RunStateRepository repository =
                    runStateRepository != null ? runStateRepository : new InMemoryRunStateRepository();
            ExecutorService pool =
                    executorService != null
                            ? executorService
                            : Executors.newFixedThreadPool(config.getThreadPoolSize());

            NodeRegistry nodeRegistry = new DefaultNodeRegistry();
            nodes.forEach(nodeRegistry::register);
            CheckpointRegistry checkpointRegistry = ReportCheckpoints.create();

            PipelineEngine.Builder engine =
                    PipelineEngine.builder()
                            .nodeRegistry(nodeRegistry)
                            .checkpointRegistry(checkpointRegistry)
                            .repository(repository)
                            .executorService(pool)
                            .config(config)
                            .listener(listener)
                            .service(
                                    ArtifactEvaluator.class,
                                    new ArtifactEvaluator(rubrics, criterionScorer, shapeValidator));
            services.forEach((type, service) -> register(engine, type, service));

            return new VersoEnvironment(
                    engine.build(), nodeRegistry, checkpointRegistry, rubrics, repository, pool);
        }

        private static <T> void register(PipelineEngine.Builder engine, Class<T> type, Object service) {
            engine.service(type, type.cast(service));
        }
    }
}
