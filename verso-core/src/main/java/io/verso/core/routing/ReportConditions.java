package io.verso.core.routing;

import io.verso.core.pipeline.ReportFields;
import io.verso.core.state.WorkflowState;
import java.util.List;
import java.util.Map;

/// Data predicates shared by {@link ReportRouter} and the checkpoint skip predicates, so
/// that the router never selects a checkpoint that would pass straight through.
public final class ReportConditions {

    /// Raw input keys a run needs before it can be parsed.
    public static final List<String> FULL_CONTEXT_KEYS =
            List.of("accusation", "sessionReport", "directorNotes");

    /// Domains analysed in parallel before arc synthesis.
    public static final List<String> SPECIALIST_DOMAINS =
            List.of("financial", "behavioral", "victimization");

    private ReportConditions() {}

    public static boolean hasFullContext(WorkflowState state) {
        Map<String, Object> raw = state.get(ReportFields.RAW_SESSION_INPUT);
        return FULL_CONTEXT_KEYS.stream().allMatch(key -> isPresent(raw.get(key)));
    }

    public static boolean hasParsedInput(WorkflowState state) {
        return !state.get(ReportFields.SESSION_CONFIG).isEmpty();
    }

    public static boolean inputApproved(WorkflowState state) {
        return state.get(ReportFields.INPUT_APPROVED);
    }

    public static boolean sourcesFetched(WorkflowState state) {
        return state.get(ReportFields.MEMORY_TOKENS) != null
                && state.get(ReportFields.PAPER_EVIDENCE) != null
                && state.get(ReportFields.SESSION_PHOTOS) != null;
    }

    public static boolean paperEvidenceSelected(WorkflowState state) {
        return state.get(ReportFields.SELECTED_PAPER_EVIDENCE) != null;
    }

    public static boolean hasRoster(WorkflowState state) {
        return !state.get(ReportFields.ROSTER).isEmpty();
    }

    public static boolean whiteboardAnalyzed(WorkflowState state) {
        return state.get(ReportFields.WHITEBOARD_ANALYSIS) != null;
    }

    public static boolean photosAnalyzed(WorkflowState state) {
        return state.get(ReportFields.PHOTO_ANALYSES) != null;
    }

    public static boolean charactersIdentified(WorkflowState state) {
        return state.get(ReportFields.CHARACTER_ID_MAPPINGS) != null;
    }

    public static boolean evidencePreprocessed(WorkflowState state) {
        return state.get(ReportFields.PREPROCESSED_EVIDENCE) != null;
    }

    public static boolean preCurationApproved(WorkflowState state) {
        return state.get(ReportFields.PRE_CURATION_APPROVED);
    }

    public static boolean evidenceCurated(WorkflowState state) {
        return state.get(ReportFields.EVIDENCE_BUNDLE) != null;
    }

    public static boolean evidenceApproved(WorkflowState state) {
        return state.get(ReportFields.EVIDENCE_APPROVED);
    }

    public static boolean specialistsComplete(WorkflowState state) {
        Map<String, Object> analyses = state.get(ReportFields.SPECIALIST_ANALYSES);
        return SPECIALIST_DOMAINS.stream().allMatch(domain -> isPresent(analyses.get(domain)));
    }

    /// Whether a raw value counts as provided: not null, not blank, not an empty mapping.
    public static boolean isPresent(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof String text) {
            return !text.isBlank();
        }
        if (value instanceof Map<?, ?> map) {
            return !map.isEmpty();
        }
        return true;
    }
}
