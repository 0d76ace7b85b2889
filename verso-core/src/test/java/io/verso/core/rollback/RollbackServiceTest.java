package io.verso.core.rollback;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.verso.core.exception.InvalidRollbackPointException;
import io.verso.core.pipeline.ApprovalType;
import io.verso.core.pipeline.ArtifactKind;
import io.verso.core.pipeline.Phase;
import io.verso.core.pipeline.ReportFields;
import io.verso.core.pipeline.ReportStates;
import io.verso.core.routing.ReportRouter;
import io.verso.core.state.StateField;
import io.verso.core.state.StateUpdate;
import io.verso.core.state.WorkflowState;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("RollbackService")
class RollbackServiceTest {

    private static final Set<String> CONTROL_FIELDS =
            Set.of(
                    ReportFields.AWAITING_APPROVAL.name(),
                    ReportFields.APPROVAL_TYPE.name(),
                    ReportFields.NEXT_STEP_OVERRIDE.name(),
                    ReportFields.CURRENT_PHASE.name(),
                    ReportFields.ROLLBACK_EPOCH.name(),
                    ReportFields.ARC_REVISION_COUNT.name(),
                    ReportFields.OUTLINE_REVISION_COUNT.name(),
                    ReportFields.ARTICLE_REVISION_COUNT.name());

    private final RollbackService service = new RollbackService();

    /// A finished run that went through one revision of every artifact.
    private static WorkflowState completedRun() {
        WorkflowState state = ReportStates.articleApproved();
        for (ArtifactKind kind : ArtifactKind.values()) {
            state = ReportStates.evaluated(state, kind, true);
        }
        return state.apply(
                StateUpdate.builder()
                        .set(ReportFields.ASSEMBLED_HTML, "<html></html>")
                        .set(ReportFields.ARC_REVISION_COUNT, 1)
                        .set(ReportFields.OUTLINE_REVISION_COUNT, 2)
                        .set(ReportFields.ARTICLE_REVISION_COUNT, 1)
                        .set(ReportFields.CURRENT_PHASE, Phase.COMPLETE)
                        .build());
    }

    @Nested
    @DisplayName("table")
    class Table {

        @Test
        @DisplayName("earlier points clear a superset of later points")
        void shouldClearSupersetsTowardsEarlierPoints() {
            List<RollbackPlan> plans = RollbackTable.plans();

            for (int i = 1; i < plans.size(); i++) {
                assertThat(plans.get(i).clearedFieldNames())
                        .as(plans.get(i).point().id())
                        .containsAll(plans.get(i - 1).clearedFieldNames());
            }
        }

        @Test
        void shouldListPointsLatestFirst() {
            assertThat(RollbackTable.pointIds())
                    .containsExactly(
                            "article",
                            "outline",
                            "arc-selection",
                            "evidence-and-photos",
                            "pre-curation",
                            "character-ids",
                            "await-roster",
                            "paper-evidence-selection",
                            "input-review");
        }

        @Test
        void shouldRejectUnknownPoints() {
            assertThatThrownBy(() -> RollbackTable.resolve("await-full-context"))
                    .isInstanceOf(InvalidRollbackPointException.class)
                    .hasMessageContaining("await-full-context");
            assertThatThrownBy(() -> RollbackTable.resolve(null))
                    .isInstanceOf(InvalidRollbackPointException.class);
            assertThat(RollbackTable.plan(ApprovalType.AWAIT_FULL_CONTEXT)).isEmpty();
        }
    }

    @Nested
    @DisplayName("rollback")
    class Rollback {

        @Test
        @DisplayName("every point routes to its re-entry step")
        void shouldReenterAtPlannedStep() {
            ReportRouter router = new ReportRouter();
            WorkflowState completed = completedRun();

            for (RollbackPlan plan : RollbackTable.plans()) {
                WorkflowState rewound = service.rollback(completed, plan.point());

                assertThat(router.route(rewound)).as(plan.point().id()).isEqualTo(plan.reentryStep());
                assertThat(rewound.get(ReportFields.CURRENT_PHASE)).isEqualTo(plan.reentryStep().phase());
            }
        }

        @Test
        @DisplayName("outline rollback keeps arcs and resets outline and article counters")
        void shouldRollBackToOutline() {
            WorkflowState rewound = service.rollback(completedRun(), "outline");

            assertThat(rewound.get(ReportFields.OUTLINE)).isNull();
            assertThat(rewound.get(ReportFields.CONTENT_BUNDLE)).isNull();
            assertThat(rewound.get(ReportFields.OUTLINE_APPROVED)).isFalse();
            assertThat(rewound.get(ReportFields.OUTLINE_REVISION_COUNT)).isZero();
            assertThat(rewound.get(ReportFields.ARTICLE_REVISION_COUNT)).isZero();
            assertThat(rewound.get(ReportFields.ARC_REVISION_COUNT)).isEqualTo(1);
            assertThat(rewound.get(ReportFields.SELECTED_ARCS)).containsExactly("The ledger");
            assertThat(rewound.get(ReportFields.ROLLBACK_EPOCH)).isEqualTo(1);
        }

        @Test
        void shouldKeepFieldsOutsideThePlan() {
            WorkflowState completed = completedRun();

            for (RollbackPlan plan : RollbackTable.plans()) {
                WorkflowState rewound = service.rollback(completed, plan.point());
                Set<String> cleared = plan.clearedFieldNames();

                for (StateField<?, ?> field : ReportFields.SCHEMA.fields()) {
                    if (!cleared.contains(field.name()) && !CONTROL_FIELDS.contains(field.name())) {
                        assertThat(rewound.get(field.name()))
                                .as(plan.point().id() + " keeps " + field.name())
                                .isEqualTo(completed.get(field.name()));
                    }
                }
            }
        }

        @Test
        void shouldReleasePendingApproval() {
            WorkflowState suspended =
                    ReportStates.articleApproved()
                            .apply(
                                    StateUpdate.builder()
                                            .set(ReportFields.AWAITING_APPROVAL, true)
                                            .set(ReportFields.APPROVAL_TYPE, ApprovalType.ARTICLE)
                                            .build());

            WorkflowState rewound = service.rollback(suspended, ApprovalType.ARC_SELECTION);

            assertThat(rewound.get(ReportFields.AWAITING_APPROVAL)).isFalse();
            assertThat(rewound.get(ReportFields.APPROVAL_TYPE)).isNull();
            assertThat(rewound.get(ReportFields.SPECIALIST_ANALYSES)).isEmpty();
        }

        @Test
        void shouldRejectInvalidPointWithoutTouchingState() {
            WorkflowState completed = completedRun();

            assertThatThrownBy(() -> service.rollback(completed, "nowhere"))
                    .isInstanceOf(InvalidRollbackPointException.class);
            assertThat(completed.get(ReportFields.OUTLINE)).isNotNull();
        }
    }
}
