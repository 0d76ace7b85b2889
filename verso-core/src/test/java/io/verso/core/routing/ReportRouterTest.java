package io.verso.core.routing;

import static io.verso.core.pipeline.ReportStates.evaluated;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.verso.core.evaluation.EscalationRecord;
import io.verso.core.pipeline.ApprovalType;
import io.verso.core.pipeline.ArtifactKind;
import io.verso.core.pipeline.Phase;
import io.verso.core.pipeline.ReportFields;
import io.verso.core.pipeline.ReportStates;
import io.verso.core.pipeline.Step;
import io.verso.core.state.StateUpdate;
import io.verso.core.state.WorkflowState;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ReportRouter")
class ReportRouterTest {

    private final ReportRouter router = new ReportRouter();

    private static WorkflowState with(WorkflowState state, StateUpdate update) {
        return state.apply(update);
    }

    @Nested
    @DisplayName("precedence")
    class Precedence {

        @Test
        @DisplayName("error phase halts even with a pending approval")
        void shouldHaltInErrorPhase() {
            WorkflowState state =
                    with(
                            ReportStates.outlineApproved(),
                            StateUpdate.builder()
                                    .set(ReportFields.CURRENT_PHASE, Phase.ERROR)
                                    .set(ReportFields.AWAITING_APPROVAL, true)
                                    .set(ReportFields.APPROVAL_TYPE, ApprovalType.ARTICLE)
                                    .build());

            assertThat(router.route(state)).isEqualTo(Step.HALT);
        }

        @Test
        void shouldCompleteInCompletePhase() {
            WorkflowState state =
                    with(
                            ReportStates.initial(),
                            StateUpdate.builder().set(ReportFields.CURRENT_PHASE, Phase.COMPLETE).build());

            assertThat(router.route(state)).isEqualTo(Step.COMPLETE);
        }

        @Test
        @DisplayName("pending approval wins over the one-step override")
        void shouldRoutePendingApprovalBeforeOverride() {
            WorkflowState state =
                    with(
                            ReportStates.arcsSelected(),
                            StateUpdate.builder()
                                    .set(ReportFields.AWAITING_APPROVAL, true)
                                    .set(ReportFields.APPROVAL_TYPE, ApprovalType.OUTLINE)
                                    .set(ReportFields.NEXT_STEP_OVERRIDE, Step.ASSEMBLE_HTML)
                                    .build());

            assertThat(router.route(state)).isEqualTo(Step.OUTLINE_CHECKPOINT);
        }

        @Test
        void shouldFollowOverrideBeforeDataRouting() {
            WorkflowState state =
                    with(
                            ReportStates.initial(),
                            StateUpdate.builder().set(ReportFields.NEXT_STEP_OVERRIDE, Step.FETCH_SOURCES).build());

            assertThat(router.route(state)).isEqualTo(Step.FETCH_SOURCES);
        }

        @Test
        void shouldRejectPendingApprovalWithoutType() {
            WorkflowState state =
                    with(
                            ReportStates.initial(),
                            StateUpdate.builder().set(ReportFields.AWAITING_APPROVAL, true).build());

            assertThatThrownBy(() -> router.route(state)).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("routing the same state twice gives the same step")
        void shouldBeIdempotent() {
            WorkflowState withOutline =
                    with(
                            ReportStates.arcsSelected(),
                            StateUpdate.builder().set(ReportFields.OUTLINE, ReportStates.OUTLINE).build());
            WorkflowState state = evaluated(withOutline, ArtifactKind.OUTLINE, false);

            Step first = router.route(state);

            assertThat(router.route(state)).isEqualTo(first).isEqualTo(Step.OUTLINE_REVISION_GATE);
        }
    }

    @Nested
    @DisplayName("input and evidence")
    class InputAndEvidence {

        @Test
        void shouldAwaitFullContextOnFreshState() {
            assertThat(router.route(ReportStates.initial())).isEqualTo(Step.AWAIT_FULL_CONTEXT);
        }

        @Test
        void shouldTreatBlankContextAsMissing() {
            WorkflowState state =
                    with(
                            ReportStates.withFullContext(),
                            StateUpdate.builder()
                                    .set(ReportFields.RAW_SESSION_INPUT, Map.of("directorNotes", "  "))
                                    .build());

            assertThat(router.route(state)).isEqualTo(Step.AWAIT_FULL_CONTEXT);
        }

        @Test
        void shouldParseOnceContextIsComplete() {
            assertThat(router.route(ReportStates.withFullContext())).isEqualTo(Step.PARSE_INPUT);
        }

        @Test
        @DisplayName("restored document with null flags routes like defaults")
        void shouldRouteRestoredStateWithNullFlags() {
            Map<String, Object> stored = new HashMap<>(ReportStates.withFullContext().toMap());
            stored.put(ReportFields.AWAITING_APPROVAL.name(), null);
            stored.put(ReportFields.INPUT_APPROVED.name(), null);
            stored.put(ReportFields.CURRENT_PHASE.name(), null);

            WorkflowState restored = WorkflowState.restore(ReportFields.SCHEMA, stored);

            assertThat(router.route(restored)).isEqualTo(Step.PARSE_INPUT);
        }

        @Test
        void shouldWaitForRosterAfterPaperEvidence() {
            WorkflowState state =
                    with(ReportStates.evidenceApproved(), StateUpdate.builder().clear(ReportFields.ROSTER).build());

            assertThat(router.route(state)).isEqualTo(Step.AWAIT_ROSTER);
        }

        @Test
        void shouldFetchWhenAnySourceIsMissing() {
            WorkflowState state =
                    with(
                            ReportStates.evidenceApproved(),
                            StateUpdate.builder().clear(ReportFields.SESSION_PHOTOS).build());

            assertThat(router.route(state)).isEqualTo(Step.FETCH_SOURCES);
        }

        @Test
        void shouldTreatEmptyFetchedListAsFetched() {
            WorkflowState state =
                    with(
                            ReportStates.evidenceApproved(),
                            StateUpdate.builder().set(ReportFields.SESSION_PHOTOS, List.of()).build());

            assertThat(router.route(state)).isEqualTo(Step.ARC_SPECIALISTS);
        }
    }

    @Nested
    @DisplayName("revisable artifacts")
    class Artifacts {

        @Test
        void shouldSynthesiseArcsOnceSpecialistsAreDone() {
            assertThat(router.route(ReportStates.specialistsComplete())).isEqualTo(Step.ARC_SYNTHESIS);
        }

        @Test
        void shouldEvaluateFreshArtifact() {
            WorkflowState state =
                    with(
                            ReportStates.specialistsComplete(),
                            StateUpdate.builder().set(ReportFields.NARRATIVE_ARCS, ReportStates.ARCS).build());

            assertThat(router.route(state)).isEqualTo(Step.EVALUATE_ARCS);
        }

        @Test
        void shouldReachCheckpointWhenReady() {
            WorkflowState state =
                    evaluated(
                            with(
                                    ReportStates.specialistsComplete(),
                                    StateUpdate.builder().set(ReportFields.NARRATIVE_ARCS, ReportStates.ARCS).build()),
                            ArtifactKind.ARCS,
                            true);

            assertThat(router.route(state)).isEqualTo(Step.ARC_SELECTION);
        }

        @Test
        void shouldReachCheckpointWhenEscalated() {
            WorkflowState notReady =
                    evaluated(
                            with(
                                    ReportStates.arcsSelected(),
                                    StateUpdate.builder()
                                            .set(ReportFields.OUTLINE, ReportStates.OUTLINE)
                                            .set(ReportFields.OUTLINE_REVISION_COUNT, 3)
                                            .build()),
                            ArtifactKind.OUTLINE,
                            false);
            WorkflowState escalated =
                    with(
                            notReady,
                            StateUpdate.builder()
                                    .set(
                                            ReportFields.ESCALATIONS,
                                            new EscalationRecord(
                                                    ArtifactKind.OUTLINE, 3, 0, "cap", List.of("issue"), Instant.now()))
                                    .build());

            assertThat(router.route(notReady)).isEqualTo(Step.OUTLINE_REVISION_GATE);
            assertThat(router.route(escalated)).isEqualTo(Step.OUTLINE_CHECKPOINT);
        }

        @Test
        @DisplayName("a revised attempt with no artifact goes to the revise step")
        void shouldReviseAfterGateIncrement() {
            WorkflowState state =
                    with(
                            evaluated(
                                    with(
                                            ReportStates.arcsSelected(),
                                            StateUpdate.builder().set(ReportFields.OUTLINE, ReportStates.OUTLINE).build()),
                                    ArtifactKind.OUTLINE,
                                    false),
                            StateUpdate.builder()
                                    .set(ReportFields.OUTLINE_REVISION_COUNT, 1)
                                    .clear(ReportFields.OUTLINE)
                                    .set(ReportFields.PREVIOUS_OUTLINE, ReportStates.OUTLINE)
                                    .build());

            assertThat(router.route(state)).isEqualTo(Step.REVISE_OUTLINE);
        }

        @Test
        void shouldReviseWhenOnlyHumanFeedbackExists() {
            WorkflowState state =
                    with(
                            ReportStates.outlineApproved(),
                            StateUpdate.builder().set(ReportFields.ARTICLE_FEEDBACK, "Shorter lede").build());

            assertThat(router.route(state)).isEqualTo(Step.REVISE_ARTICLE);
        }

        @Test
        @DisplayName("evaluations from before a rollback are ignored")
        void shouldIgnoreEvaluationsOfEarlierEpoch() {
            WorkflowState state =
                    with(
                            evaluated(
                                    with(
                                            ReportStates.arcsSelected(),
                                            StateUpdate.builder().set(ReportFields.OUTLINE, ReportStates.OUTLINE).build()),
                                    ArtifactKind.OUTLINE,
                                    true),
                            StateUpdate.builder().set(ReportFields.ROLLBACK_EPOCH, 1).build());

            assertThat(router.route(state)).isEqualTo(Step.EVALUATE_OUTLINE);
        }

        @Test
        void shouldGenerateArticleAfterOutlineApproval() {
            assertThat(router.route(ReportStates.outlineApproved())).isEqualTo(Step.GENERATE_ARTICLE);
        }
    }

    @Nested
    @DisplayName("completion")
    class Completion {

        @Test
        void shouldAssembleOnceEveryArtifactIsApproved() {
            assertThat(router.route(ReportStates.articleApproved())).isEqualTo(Step.ASSEMBLE_HTML);
        }

        @Test
        void shouldCompleteOnceHtmlIsAssembled() {
            WorkflowState state =
                    with(
                            ReportStates.articleApproved(),
                            StateUpdate.builder().set(ReportFields.ASSEMBLED_HTML, "<html></html>").build());

            assertThat(router.route(state)).isEqualTo(Step.COMPLETE);
        }
    }
}
