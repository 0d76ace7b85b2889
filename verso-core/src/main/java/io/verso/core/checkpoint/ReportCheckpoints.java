package io.verso.core.checkpoint;

import io.verso.core.evaluation.EvaluationLog;
import io.verso.core.pipeline.ApprovalType;
import io.verso.core.pipeline.ArtifactKind;
import io.verso.core.pipeline.ReportFields;
import io.verso.core.routing.ReportConditions;
import java.util.List;
import java.util.Map;

/// Checkpoint catalogue of the report pipeline.
///
/// Skip predicates are the negation of the router's conditions for the same step, so a
/// checkpoint selected by the router suspends unless it was reached through a pending
/// approval that is already satisfied.
public final class ReportCheckpoints {

    private ReportCheckpoints() {}

    public static CheckpointRegistry create() {
        CheckpointRegistry registry = new CheckpointRegistry();

        registry.register(
                CheckpointDefinition.builder(ApprovalType.AWAIT_FULL_CONTEXT)
                        .skipWhen(ReportConditions::hasFullContext)
                        .show(ReportFields.RAW_SESSION_INPUT)
                        .show("missing", state -> missingContext(state.get(ReportFields.RAW_SESSION_INPUT)))
                        .message("Provide the accusation, session report and director notes to continue.")
                        .decisionMapper(DecisionMapper.fields(List.of(ReportFields.RAW_SESSION_INPUT)))
                        .build());

        registry.register(
                CheckpointDefinition.builder(ApprovalType.INPUT_REVIEW)
                        .skipWhen(ReportConditions::inputApproved)
                        .show(
                                ReportFields.SESSION_CONFIG,
                                ReportFields.DIRECTOR_NOTES,
                                ReportFields.PLAYER_FOCUS)
                        .message("Review the parsed session input. Edit any field or approve as is.")
                        .decisionMapper(
                                DecisionMapper.approveWith(
                                        ReportFields.INPUT_APPROVED,
                                        List.of(
                                                ReportFields.SESSION_CONFIG,
                                                ReportFields.DIRECTOR_NOTES,
                                                ReportFields.PLAYER_FOCUS)))
                        .build());

        registry.register(
                CheckpointDefinition.builder(ApprovalType.PAPER_EVIDENCE_SELECTION)
                        .skipWhen(ReportConditions::paperEvidenceSelected)
                        .show(ReportFields.PAPER_EVIDENCE)
                        .message("Select the paper evidence that was unlocked during the session.")
                        .decisionMapper(
                                DecisionMapper.fields(List.of(ReportFields.SELECTED_PAPER_EVIDENCE)))
                        .build());

        registry.register(
                CheckpointDefinition.builder(ApprovalType.AWAIT_ROSTER)
                        .skipWhen(ReportConditions::hasRoster)
                        .show(ReportFields.WHITEBOARD_PHOTO_PATH, ReportFields.SESSION_PHOTOS)
                        .message("Provide the player roster to continue.")
                        .decisionMapper(
                                DecisionMapper.fields(
                                        List.of(ReportFields.ROSTER, ReportFields.WHITEBOARD_PHOTO_PATH)))
                        .build());

        registry.register(
                CheckpointDefinition.builder(ApprovalType.CHARACTER_IDS)
                        .skipWhen(ReportConditions::charactersIdentified)
                        .show(ReportFields.PHOTO_ANALYSES, ReportFields.ROSTER, ReportFields.SESSION_PHOTOS)
                        .message("Identify which characters appear in each photo.")
                        .decisionMapper(DecisionMapper.fields(List.of(ReportFields.CHARACTER_ID_MAPPINGS)))
                        .build());

        registry.register(
                CheckpointDefinition.builder(ApprovalType.PRE_CURATION)
                        .skipWhen(ReportConditions::preCurationApproved)
                        .show(ReportFields.PREPROCESSED_EVIDENCE)
                        .message("Approve the preprocessed evidence before curation.")
                        .decisionMapper(
                                DecisionMapper.approveWith(ReportFields.PRE_CURATION_APPROVED, List.of()))
                        .build());

        registry.register(
                CheckpointDefinition.builder(ApprovalType.EVIDENCE_AND_PHOTOS)
                        .skipWhen(ReportConditions::evidenceApproved)
                        .show(ReportFields.EVIDENCE_BUNDLE, ReportFields.PHOTO_ANALYSES)
                        .message("Review the curated evidence bundle and photo analyses.")
                        .decisionMapper(
                                DecisionMapper.approveWith(
                                        ReportFields.EVIDENCE_APPROVED,
                                        List.of(ReportFields.EVIDENCE_BUNDLE)))
                        .build());

        registry.register(artifactReview(ArtifactKind.ARCS, "Select the narrative arcs to develop."));
        registry.register(artifactReview(ArtifactKind.OUTLINE, "Approve the outline or send it back with feedback."));
        registry.register(artifactReview(ArtifactKind.ARTICLE, "Approve the article or send it back with feedback."));
        return registry;
    }

    private static CheckpointDefinition artifactReview(ArtifactKind kind, String message) {
        CheckpointDefinition.Builder builder =
                CheckpointDefinition.builder(kind.approvalType())
                        .skipWhen(kind::isApproved)
                        .show(kind.artifactField());
        if (kind == ArtifactKind.OUTLINE) {
            builder.show(ReportFields.HERO_IMAGE);
        }
        return builder.show("revisionCount", kind::revisionCount)
                .show("evaluations", state -> EvaluationLog.history(state, kind))
                .show("escalation", state -> EvaluationLog.latestEscalation(state, kind).orElse(null))
                .message(message)
                .decisionMapper(new ArtifactReviewMapper(kind))
                .build();
    }

    private static List<String> missingContext(Map<String, Object> raw) {
        return ReportConditions.FULL_CONTEXT_KEYS.stream()
                .filter(key -> !ReportConditions.isPresent(raw.get(key)))
                .toList();
    }
}
