package io.verso.core.pipeline;

import io.verso.core.evaluation.EscalationRecord;
import io.verso.core.evaluation.EvaluationRecord;
import io.verso.core.state.StateField;
import io.verso.core.state.StateSchema;
import java.util.List;
import java.util.Map;

/// Field declarations of the report pipeline's {@link io.verso.core.state.WorkflowState}.
///
/// Artifacts that have not been produced yet default to `null`; collections that are
/// only ever grown default to empty. The revision counters and control fields are
/// ordinary replace fields, so every change to them also goes through
/// {@link io.verso.core.state.WorkflowState#apply}.
public final class ReportFields {

    private ReportFields() {}

    // Session
    public static final StateField<String, String> SESSION_ID =
            StateField.replace("sessionId", String.class, null);
    public static final StateField<String, String> THEME =
            StateField.replace("theme", String.class, "journalist");

    // Raw input and its parsed form
    public static final StateField<Map<String, Object>, Map<String, Object>> RAW_SESSION_INPUT =
            StateField.mergeObject("rawSessionInput");
    public static final StateField<Map<String, Object>, Map<String, Object>> SESSION_CONFIG =
            StateField.replace("sessionConfig", Map.class, Map.of());
    public static final StateField<Map<String, Object>, Map<String, Object>> DIRECTOR_NOTES =
            StateField.replace("directorNotes", Map.class, Map.of());
    public static final StateField<Map<String, Object>, Map<String, Object>> PLAYER_FOCUS =
            StateField.replace("playerFocus", Map.class, Map.of());
    public static final StateField<Boolean, Boolean> INPUT_APPROVED = flag("inputApproved");

    // Fetched sources, null until fetched
    public static final StateField<List<Object>, List<Object>> MEMORY_TOKENS = list("memoryTokens");
    public static final StateField<List<Object>, List<Object>> PAPER_EVIDENCE = list("paperEvidence");
    public static final StateField<List<Object>, List<Object>> SESSION_PHOTOS = list("sessionPhotos");

    // Incremental human input
    public static final StateField<List<Object>, List<Object>> SELECTED_PAPER_EVIDENCE =
            list("selectedPaperEvidence");
    public static final StateField<List<String>, List<String>> ROSTER =
            StateField.replaceList("roster", String.class, List.of());
    public static final StateField<String, String> WHITEBOARD_PHOTO_PATH = text("whiteboardPhotoPath");
    public static final StateField<Map<String, Object>, Map<String, Object>> WHITEBOARD_ANALYSIS =
            object("whiteboardAnalysis");

    // Photos
    public static final StateField<Map<String, Object>, Map<String, Object>> PHOTO_ANALYSES =
            object("photoAnalyses");
    public static final StateField<Map<String, Object>, Map<String, Object>> CHARACTER_ID_MAPPINGS =
            object("characterIdMappings");

    // Evidence
    public static final StateField<Map<String, Object>, Map<String, Object>> PREPROCESSED_EVIDENCE =
            object("preprocessedEvidence");
    public static final StateField<Boolean, Boolean> PRE_CURATION_APPROVED = flag("preCurationApproved");
    public static final StateField<Map<String, Object>, Map<String, Object>> EVIDENCE_BUNDLE =
            object("evidenceBundle");
    public static final StateField<Boolean, Boolean> EVIDENCE_APPROVED = flag("evidenceApproved");

    // Arcs
    public static final StateField<Map<String, Object>, Map<String, Object>> SPECIALIST_ANALYSES =
            StateField.mergeObject("specialistAnalyses");
    public static final StateField<List<Object>, List<Object>> NARRATIVE_ARCS = list("narrativeArcs");
    public static final StateField<List<Object>, List<Object>> SELECTED_ARCS =
            StateField.replace("selectedArcs", List.class, List.of());
    public static final StateField<List<Object>, List<Object>> PREVIOUS_ARCS = list("previousArcs");
    public static final StateField<String, String> ARC_FEEDBACK = text("arcFeedback");

    // Outline
    public static final StateField<String, String> HERO_IMAGE = text("heroImage");
    public static final StateField<Map<String, Object>, Map<String, Object>> OUTLINE = object("outline");
    public static final StateField<Boolean, Boolean> OUTLINE_APPROVED = flag("outlineApproved");
    public static final StateField<Map<String, Object>, Map<String, Object>> PREVIOUS_OUTLINE =
            object("previousOutline");
    public static final StateField<String, String> OUTLINE_FEEDBACK = text("outlineFeedback");

    // Article
    public static final StateField<Map<String, Object>, Map<String, Object>> CONTENT_BUNDLE =
            object("contentBundle");
    public static final StateField<Boolean, Boolean> ARTICLE_APPROVED = flag("articleApproved");
    public static final StateField<Map<String, Object>, Map<String, Object>> PREVIOUS_CONTENT_BUNDLE =
            object("previousContentBundle");
    public static final StateField<String, String> ARTICLE_FEEDBACK = text("articleFeedback");

    // Output
    public static final StateField<String, String> ASSEMBLED_HTML = text("assembledHtml");
    public static final StateField<Map<String, Object>, Map<String, Object>> VALIDATION_RESULTS =
            object("validationResults");

    // Evaluation logs
    public static final StateField<List<EvaluationRecord>, EvaluationRecord> EVALUATION_HISTORY =
            StateField.appendSingle("evaluationHistory", EvaluationRecord.class);
    public static final StateField<List<EscalationRecord>, EscalationRecord> ESCALATIONS =
            StateField.appendSingle("escalations", EscalationRecord.class);

    // Counters
    public static final StateField<Integer, Integer> ARC_REVISION_COUNT = counter("arcRevisionCount");
    public static final StateField<Integer, Integer> OUTLINE_REVISION_COUNT =
            counter("outlineRevisionCount");
    public static final StateField<Integer, Integer> ARTICLE_REVISION_COUNT =
            counter("articleRevisionCount");
    public static final StateField<Integer, Integer> ROLLBACK_EPOCH = counter("rollbackEpoch");

    // Control
    public static final StateField<Phase, Phase> CURRENT_PHASE =
            StateField.replace("currentPhase", Phase.class, Phase.INIT);
    public static final StateField<Phase, Phase> LAST_GOOD_PHASE =
            StateField.replace("lastGoodPhase", Phase.class, null);
    public static final StateField<Boolean, Boolean> AWAITING_APPROVAL = flag("awaitingApproval");
    public static final StateField<ApprovalType, ApprovalType> APPROVAL_TYPE =
            StateField.replace("approvalType", ApprovalType.class, null);
    public static final StateField<Step, Step> NEXT_STEP_OVERRIDE =
            StateField.replace("nextStepOverride", Step.class, null);
    public static final StateField<List<ErrorRecord>, List<ErrorRecord>> ERRORS =
            StateField.appendList("errors", ErrorRecord.class);

    /// Schema of the report pipeline, in declaration order.
    public static final StateSchema SCHEMA =
            StateSchema.of(
                    List.of(
                            SESSION_ID,
                            THEME,
                            RAW_SESSION_INPUT,
                            SESSION_CONFIG,
                            DIRECTOR_NOTES,
                            PLAYER_FOCUS,
                            INPUT_APPROVED,
                            MEMORY_TOKENS,
                            PAPER_EVIDENCE,
                            SESSION_PHOTOS,
                            SELECTED_PAPER_EVIDENCE,
                            ROSTER,
                            WHITEBOARD_PHOTO_PATH,
                            WHITEBOARD_ANALYSIS,
                            PHOTO_ANALYSES,
                            CHARACTER_ID_MAPPINGS,
                            PREPROCESSED_EVIDENCE,
                            PRE_CURATION_APPROVED,
                            EVIDENCE_BUNDLE,
                            EVIDENCE_APPROVED,
                            SPECIALIST_ANALYSES,
                            NARRATIVE_ARCS,
                            SELECTED_ARCS,
                            PREVIOUS_ARCS,
                            ARC_FEEDBACK,
                            HERO_IMAGE,
                            OUTLINE,
                            OUTLINE_APPROVED,
                            PREVIOUS_OUTLINE,
                            OUTLINE_FEEDBACK,
                            CONTENT_BUNDLE,
                            ARTICLE_APPROVED,
                            PREVIOUS_CONTENT_BUNDLE,
                            ARTICLE_FEEDBACK,
                            ASSEMBLED_HTML,
                            VALIDATION_RESULTS,
                            EVALUATION_HISTORY,
                            ESCALATIONS,
                            ARC_REVISION_COUNT,
                            OUTLINE_REVISION_COUNT,
                            ARTICLE_REVISION_COUNT,
                            ROLLBACK_EPOCH,
                            CURRENT_PHASE,
                            LAST_GOOD_PHASE,
                            AWAITING_APPROVAL,
                            APPROVAL_TYPE,
                            NEXT_STEP_OVERRIDE,
                            ERRORS));

    private static StateField<Boolean, Boolean> flag(String name) {
        return StateField.replace(name, Boolean.class, Boolean.FALSE);
    }

    private static StateField<Integer, Integer> counter(String name) {
        return StateField.replace(name, Integer.class, 0);
    }

    private static StateField<String, String> text(String name) {
        return StateField.replace(name, String.class, null);
    }

    private static StateField<List<Object>, List<Object>> list(String name) {
        return StateField.replace(name, List.class, null);
    }

    private static StateField<Map<String, Object>, Map<String, Object>> object(String name) {
        return StateField.replace(name, Map.class, null);
    }
}
