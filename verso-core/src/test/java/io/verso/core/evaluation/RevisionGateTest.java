package io.verso.core.evaluation;

import static io.verso.core.pipeline.ReportStates.evaluated;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.verso.core.pipeline.ApprovalType;
import io.verso.core.pipeline.ArtifactKind;
import io.verso.core.pipeline.ReportFields;
import io.verso.core.pipeline.ReportStates;
import io.verso.core.pipeline.Step;
import io.verso.core.routing.ReportRouter;
import io.verso.core.state.StateUpdate;
import io.verso.core.state.WorkflowState;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("RevisionGate")
class RevisionGateTest {

    private final RevisionGate gate = new RevisionGate(Map.of(ArtifactKind.OUTLINE, 2));

    private static WorkflowState withOutline(WorkflowState state) {
        return state.apply(StateUpdate.builder().set(ReportFields.OUTLINE, ReportStates.OUTLINE).build());
    }

    @Nested
    @DisplayName("decide")
    class Decide {

        @Test
        void shouldProceedWhenReady() {
            WorkflowState state = evaluated(withOutline(ReportStates.arcsSelected()), ArtifactKind.OUTLINE, true);

            assertThat(gate.decide(ArtifactKind.OUTLINE, state)).isInstanceOf(RevisionDecision.Proceed.class);
        }

        @Test
        void shouldReviseBelowCap() {
            WorkflowState state = evaluated(withOutline(ReportStates.arcsSelected()), ArtifactKind.OUTLINE, false);

            assertThat(gate.decide(ArtifactKind.OUTLINE, state)).isEqualTo(new RevisionDecision.Revise(1));
        }

        @Test
        void shouldEscalateAtCap() {
            WorkflowState state =
                    evaluated(
                            withOutline(ReportStates.arcsSelected())
                                    .apply(StateUpdate.builder().set(ReportFields.OUTLINE_REVISION_COUNT, 2).build()),
                            ArtifactKind.OUTLINE,
                            false);

            RevisionDecision decision = gate.decide(ArtifactKind.OUTLINE, state);

            assertThat(decision).isInstanceOf(RevisionDecision.Escalate.class);
            RevisionDecision.Escalate escalate = (RevisionDecision.Escalate) decision;
            assertThat(escalate.cap()).isEqualTo(2);
            assertThat(escalate.reason()).startsWith("Reached revision cap (2)").contains("arcCoverage");
        }

        @Test
        void shouldRequireEvaluationOfCurrentAttempt() {
            WorkflowState state = withOutline(ReportStates.arcsSelected());

            assertThatThrownBy(() -> gate.decide(ArtifactKind.OUTLINE, state))
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        void shouldFallBackToDefaultCap() {
            assertThat(gate.capFor(ArtifactKind.ARTICLE)).isEqualTo(ArtifactKind.ARTICLE.defaultCap());
            assertThat(new RevisionGate().capFor(ArtifactKind.ARCS)).isEqualTo(2);
        }

        @Test
        void shouldRejectNegativeCap() {
            assertThatThrownBy(() -> new RevisionGate(Map.of(ArtifactKind.ARCS, -1)))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("toUpdate")
    class ToUpdate {

        @Test
        void shouldIncrementCounterAndKeepPreviousOutput() {
            WorkflowState state = evaluated(withOutline(ReportStates.arcsSelected()), ArtifactKind.OUTLINE, false);

            WorkflowState next =
                    state.apply(gate.toUpdate(ArtifactKind.OUTLINE, state, gate.decide(ArtifactKind.OUTLINE, state)));

            assertThat(next.get(ReportFields.OUTLINE_REVISION_COUNT)).isEqualTo(1);
            assertThat(next.get(ReportFields.OUTLINE)).isNull();
            assertThat(next.get(ReportFields.PREVIOUS_OUTLINE)).isEqualTo(ReportStates.OUTLINE);
        }

        @Test
        void shouldRequestCheckpointOnEscalation() {
            WorkflowState state =
                    evaluated(
                            withOutline(ReportStates.arcsSelected())
                                    .apply(StateUpdate.builder().set(ReportFields.OUTLINE_REVISION_COUNT, 2).build()),
                            ArtifactKind.OUTLINE,
                            false);

            WorkflowState next =
                    state.apply(gate.toUpdate(ArtifactKind.OUTLINE, state, gate.decide(ArtifactKind.OUTLINE, state)));

            assertThat(next.get(ReportFields.ESCALATIONS))
                    .singleElement()
                    .satisfies(
                            escalation -> {
                                assertThat(escalation.kind()).isEqualTo(ArtifactKind.OUTLINE);
                                assertThat(escalation.attempt()).isEqualTo(2);
                            });
            assertThat(next.get(ReportFields.AWAITING_APPROVAL)).isTrue();
            assertThat(next.get(ReportFields.APPROVAL_TYPE)).isEqualTo(ApprovalType.OUTLINE);
            assertThat(next.get(ReportFields.OUTLINE)).isEqualTo(ReportStates.OUTLINE);
        }

        @Test
        void shouldChangeNothingOnProceed() {
            WorkflowState state = evaluated(withOutline(ReportStates.arcsSelected()), ArtifactKind.OUTLINE, true);

            assertThat(gate.toUpdate(ArtifactKind.OUTLINE, state, new RevisionDecision.Proceed()).isEmpty()).isTrue();
        }
    }

    @Nested
    @DisplayName("bounded loop")
    class BoundedLoop {

        private final ReportRouter router = new ReportRouter();

        @Test
        @DisplayName("with cap 2 the third non-ready evaluation escalates exactly once")
        void shouldEscalateOnThirdFailure() {
            WorkflowState state = withOutline(ReportStates.arcsSelected());
            int gateVisits = 0;
            int revisions = 0;

            for (int guard = 0; guard < 20; guard++) {
                Step step = router.route(state);
                if (step == Step.OUTLINE_CHECKPOINT) {
                    break;
                }
                if (step == Step.EVALUATE_OUTLINE) {
                    state = evaluated(state, ArtifactKind.OUTLINE, false);
                } else if (step == Step.OUTLINE_REVISION_GATE) {
                    gateVisits++;
                    RevisionDecision decision = gate.decide(ArtifactKind.OUTLINE, state);
                    state = state.apply(gate.toUpdate(ArtifactKind.OUTLINE, state, decision));
                } else if (step == Step.REVISE_OUTLINE) {
                    revisions++;
                    state = withOutline(state);
                } else {
                    throw new AssertionError("Unexpected step " + step);
                }
            }

            assertThat(router.route(state)).isEqualTo(Step.OUTLINE_CHECKPOINT);
            assertThat(revisions).isEqualTo(2);
            assertThat(gateVisits).isEqualTo(3);
            assertThat(EvaluationLog.history(state, ArtifactKind.OUTLINE)).hasSize(3);
            assertThat(state.get(ReportFields.ESCALATIONS)).hasSize(1);
            assertThat(state.get(ReportFields.OUTLINE_REVISION_COUNT)).isEqualTo(2);
        }
    }
}
