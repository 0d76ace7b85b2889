package io.verso.core.execution.node;

import static io.verso.core.pipeline.ReportStates.evaluated;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.verso.core.EngineConfig;
import io.verso.core.evaluation.ArtifactEvaluator;
import io.verso.core.evaluation.EvaluationRecord;
import io.verso.core.exception.StepNotRegisteredException;
import io.verso.core.execution.NodeContext;
import io.verso.core.pipeline.ApprovalType;
import io.verso.core.pipeline.ArtifactKind;
import io.verso.core.pipeline.Phase;
import io.verso.core.pipeline.ReportFields;
import io.verso.core.pipeline.ReportStates;
import io.verso.core.pipeline.Step;
import io.verso.core.state.StateUpdate;
import io.verso.core.state.WorkflowState;
import java.util.concurrent.ExecutorService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("DefaultNodeRegistry")
class DefaultNodeRegistryTest {

    private final DefaultNodeRegistry registry = new DefaultNodeRegistry();

    @Nested
    @DisplayName("registration")
    class Registration {

        @Test
        void shouldPreRegisterBuiltInNodes() {
            for (ArtifactKind kind : ArtifactKind.values()) {
                assertThat(registry.hasNode(kind.evaluateStep())).isTrue();
                assertThat(registry.hasNode(kind.gateStep())).isTrue();
            }
            assertThat(registry.hasNode(Step.ARC_SPECIALISTS)).isTrue();
            assertThat(registry.hasNode(Step.FETCH_SOURCES)).isTrue();
            assertThat(registry.hasNode(Step.GENERATE_OUTLINE)).isFalse();
        }

        @Test
        void shouldReplaceNodeForSameStep() {
            PipelineNode custom = mock(PipelineNode.class);
            when(custom.getStep()).thenReturn(Step.FETCH_SOURCES);

            registry.register(custom);

            assertThat(registry.getNode(Step.FETCH_SOURCES)).isSameAs(custom);
        }

        @Test
        void shouldRejectCheckpointStep() {
            PipelineNode invalid = mock(PipelineNode.class);
            when(invalid.getStep()).thenReturn(Step.OUTLINE_CHECKPOINT);

            assertThatThrownBy(() -> registry.register(invalid))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("outlineCheckpoint");
        }

        @Test
        void shouldFailForMissingNode() {
            assertThatThrownBy(() -> registry.getNode(Step.ASSEMBLE_HTML))
                    .isInstanceOf(StepNotRegisteredException.class)
                    .hasMessage("No node registered for step: assembleHtml");
        }
    }

    @Nested
    @DisplayName("built-in artifact nodes")
    class ArtifactNodes {

        private NodeContext context(ArtifactEvaluator evaluator, EngineConfig config) {
            return NodeContext.builder()
                    .runId("run-1")
                    .executorService(mock(ExecutorService.class))
                    .config(config)
                    .service(ArtifactEvaluator.class, evaluator)
                    .build();
        }

        @Test
        void evaluateNodeShouldRecordAttemptAndEpoch() throws Exception {
            ArtifactEvaluator evaluator = mock(ArtifactEvaluator.class);
            WorkflowState state =
                    ReportStates.arcsSelected()
                            .apply(
                                    StateUpdate.builder()
                                            .set(ReportFields.OUTLINE, ReportStates.OUTLINE)
                                            .set(ReportFields.OUTLINE_REVISION_COUNT, 1)
                                            .set(ReportFields.ROLLBACK_EPOCH, 2)
                                            .build());
            when(evaluator.evaluate(ArtifactKind.OUTLINE, state)).thenReturn(ReportStates.readyEvaluation());

            WorkflowState next =
                    state.apply(
                            registry.getNode(Step.EVALUATE_OUTLINE)
                                    .execute(state, context(evaluator, EngineConfig.defaults())));

            EvaluationRecord record = next.get(ReportFields.EVALUATION_HISTORY).get(0);
            assertThat(record.kind()).isEqualTo(ArtifactKind.OUTLINE);
            assertThat(record.attempt()).isEqualTo(1);
            assertThat(record.epoch()).isEqualTo(2);
            assertThat(record.ready()).isTrue();
            assertThat(next.get(ReportFields.CURRENT_PHASE)).isEqualTo(Phase.OUTLINE_EVALUATION);
            assertThat(next.get(ReportFields.OUTLINE_REVISION_COUNT)).isEqualTo(1);
        }

        @Test
        void gateNodeShouldUseConfiguredCap() throws Exception {
            WorkflowState state =
                    evaluated(
                            ReportStates.arcsSelected()
                                    .apply(
                                            StateUpdate.builder()
                                                    .set(ReportFields.OUTLINE, ReportStates.OUTLINE)
                                                    .build()),
                            ArtifactKind.OUTLINE,
                            false);
            EngineConfig noRevisions = EngineConfig.builder().revisionCap(ArtifactKind.OUTLINE, 0).build();

            WorkflowState next =
                    state.apply(
                            registry.getNode(Step.OUTLINE_REVISION_GATE)
                                    .execute(state, context(mock(ArtifactEvaluator.class), noRevisions)));

            assertThat(next.get(ReportFields.ESCALATIONS)).hasSize(1);
            assertThat(next.get(ReportFields.APPROVAL_TYPE)).isEqualTo(ApprovalType.OUTLINE);
        }
    }
}
