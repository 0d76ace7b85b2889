package io.verso.core.rollback;

import static io.verso.core.pipeline.ReportFields.*;

import io.verso.core.exception.InvalidRollbackPointException;
import io.verso.core.pipeline.ApprovalType;
import io.verso.core.pipeline.Step;
import io.verso.core.state.StateField;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Static catalogue of rollback points, ordered from the latest checkpoint to the
/// earliest.
///
/// Each point clears its own fields plus everything cleared by the points after it in
/// pipeline order, so the clear set of an earlier point is always a superset of the
/// clear set of a later one. Points at or before arc selection reset every revision
/// counter; `outline` resets the outline and article counters; `article` only its own.
///
/// `await-full-context` is not a rollback point: its input cannot be re-requested.
public final class RollbackTable {

    private static final List<StateField<Integer, Integer>> ALL_COUNTERS =
            List.of(ARC_REVISION_COUNT, OUTLINE_REVISION_COUNT, ARTICLE_REVISION_COUNT);

    private static final Map<String, RollbackPlan> PLANS = buildPlans();

    private RollbackTable() {}

    /// Resolves a point identifier.
    ///
    /// @param pointId identifier as received from the review surface, may be null
    /// @return the plan, never null
    /// @throws InvalidRollbackPointException if the identifier is not a rollback point
    public static RollbackPlan resolve(String pointId) {
        RollbackPlan plan = pointId == null ? null : PLANS.get(pointId);
        if (plan == null) {
            throw new InvalidRollbackPointException(pointId);
        }
        return plan;
    }

    public static Optional<RollbackPlan> plan(ApprovalType point) {
        return Optional.ofNullable(PLANS.get(point.id()));
    }

    /// Returns the valid identifiers, latest checkpoint first.
    public static List<String> pointIds() {
        return List.copyOf(PLANS.keySet());
    }

    public static List<RollbackPlan> plans() {
        return List.copyOf(PLANS.values());
    }

    private static Map<String, RollbackPlan> buildPlans() {
        Map<String, RollbackPlan> plans = new LinkedHashMap<>();
        List<StateField<?, ?>> cleared = new ArrayList<>();

        cleared.addAll(
                List.of(
                        CONTENT_BUNDLE,
                        ARTICLE_APPROVED,
                        ARTICLE_FEEDBACK,
                        PREVIOUS_CONTENT_BUNDLE,
                        ASSEMBLED_HTML,
                        VALIDATION_RESULTS));
        add(plans, ApprovalType.ARTICLE, cleared, List.of(ARTICLE_REVISION_COUNT), Step.GENERATE_ARTICLE);

        cleared.addAll(
                List.of(HERO_IMAGE, OUTLINE, OUTLINE_APPROVED, OUTLINE_FEEDBACK, PREVIOUS_OUTLINE));
        add(
                plans,
                ApprovalType.OUTLINE,
                cleared,
                List.of(OUTLINE_REVISION_COUNT, ARTICLE_REVISION_COUNT),
                Step.GENERATE_OUTLINE);

        cleared.addAll(
                List.of(
                        SPECIALIST_ANALYSES,
                        NARRATIVE_ARCS,
                        SELECTED_ARCS,
                        PREVIOUS_ARCS,
                        ARC_FEEDBACK,
                        EVALUATION_HISTORY));
        add(plans, ApprovalType.ARC_SELECTION, cleared, ALL_COUNTERS, Step.ARC_SPECIALISTS);

        cleared.addAll(List.of(EVIDENCE_BUNDLE, EVIDENCE_APPROVED));
        add(plans, ApprovalType.EVIDENCE_AND_PHOTOS, cleared, ALL_COUNTERS, Step.CURATE_EVIDENCE);

        cleared.add(PRE_CURATION_APPROVED);
        add(plans, ApprovalType.PRE_CURATION, cleared, ALL_COUNTERS, Step.PRE_CURATION);

        cleared.addAll(List.of(CHARACTER_ID_MAPPINGS, PREPROCESSED_EVIDENCE));
        add(plans, ApprovalType.CHARACTER_IDS, cleared, ALL_COUNTERS, Step.CHARACTER_IDS);

        cleared.addAll(List.of(ROSTER, WHITEBOARD_ANALYSIS, PHOTO_ANALYSES));
        add(plans, ApprovalType.AWAIT_ROSTER, cleared, ALL_COUNTERS, Step.AWAIT_ROSTER);

        cleared.add(SELECTED_PAPER_EVIDENCE);
        add(
                plans,
                ApprovalType.PAPER_EVIDENCE_SELECTION,
                cleared,
                ALL_COUNTERS,
                Step.PAPER_EVIDENCE_SELECTION);

        cleared.addAll(
                List.of(
                        SESSION_CONFIG,
                        DIRECTOR_NOTES,
                        PLAYER_FOCUS,
                        INPUT_APPROVED,
                        MEMORY_TOKENS,
                        PAPER_EVIDENCE,
                        SESSION_PHOTOS));
        add(plans, ApprovalType.INPUT_REVIEW, cleared, ALL_COUNTERS, Step.PARSE_INPUT);

        return Collections.unmodifiableMap(plans);
    }

    private static void add(
            Map<String, RollbackPlan> plans,
            ApprovalType point,
            List<StateField<?, ?>> cleared,
            List<StateField<Integer, Integer>> counters,
            Step reentry) {
        plans.put(point.id(), new RollbackPlan(point, cleared, counters, reentry));
    }
}
