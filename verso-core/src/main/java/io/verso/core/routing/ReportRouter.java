package io.verso.core.routing;

import io.verso.core.evaluation.EvaluationLog;
import io.verso.core.evaluation.EvaluationRecord;
import io.verso.core.pipeline.ApprovalType;
import io.verso.core.pipeline.ArtifactKind;
import io.verso.core.pipeline.Phase;
import io.verso.core.pipeline.ReportFields;
import io.verso.core.pipeline.Step;
import io.verso.core.state.WorkflowState;
import java.util.Optional;

/// Data-driven router of the report pipeline.
///
/// Decisions follow the presence of artifacts rather than the phase alone, so any
/// persisted state, including one restored after a crash or a rollback, routes to the
/// step that produces its first missing artifact.
///
/// ### Precedence
/// 1. terminal phases
/// 2. a pending approval
/// 3. the one-step override set by the previous node
/// 4. the first missing input, artifact or approval, in pipeline order
///
/// For each revisable artifact (arcs, outline, article) the order within step 4 is:
/// approved → move on; current attempt evaluated ready → checkpoint; evaluated not ready
/// → checkpoint when already escalated, otherwise the revision gate; artifact absent →
/// regenerate (prior output or feedback exists) or generate; otherwise evaluate.
///
/// @implNote Stateless and thread-safe.
public final class ReportRouter implements PhaseRouter {

    @Override
    public Step route(WorkflowState state) {
        Phase phase = state.get(ReportFields.CURRENT_PHASE);
        if (phase == Phase.ERROR) {
            return Step.HALT;
        }
        if (phase == Phase.COMPLETE) {
            return Step.COMPLETE;
        }

        if (state.get(ReportFields.AWAITING_APPROVAL)) {
            ApprovalType pending = state.get(ReportFields.APPROVAL_TYPE);
            if (pending == null) {
                throw new IllegalStateException("awaitingApproval is set without an approvalType");
            }
            return Step.checkpointFor(pending);
        }

        Step override = state.get(ReportFields.NEXT_STEP_OVERRIDE);
        if (override != null) {
            return override;
        }

        if (!ReportConditions.hasFullContext(state)) {
            return Step.AWAIT_FULL_CONTEXT;
        }
        if (!ReportConditions.hasParsedInput(state)) {
            return Step.PARSE_INPUT;
        }
        if (!ReportConditions.inputApproved(state)) {
            return Step.INPUT_REVIEW;
        }
        if (!ReportConditions.sourcesFetched(state)) {
            return Step.FETCH_SOURCES;
        }
        if (!ReportConditions.paperEvidenceSelected(state)) {
            return Step.PAPER_EVIDENCE_SELECTION;
        }
        if (!ReportConditions.hasRoster(state)) {
            return Step.AWAIT_ROSTER;
        }
        if (!ReportConditions.whiteboardAnalyzed(state)) {
            return Step.ANALYZE_WHITEBOARD;
        }
        if (!ReportConditions.photosAnalyzed(state)) {
            return Step.ANALYZE_PHOTOS;
        }
        if (!ReportConditions.charactersIdentified(state)) {
            return Step.CHARACTER_IDS;
        }
        if (!ReportConditions.evidencePreprocessed(state)) {
            return Step.PREPROCESS_EVIDENCE;
        }
        if (!ReportConditions.preCurationApproved(state)) {
            return Step.PRE_CURATION;
        }
        if (!ReportConditions.evidenceCurated(state)) {
            return Step.CURATE_EVIDENCE;
        }
        if (!ReportConditions.evidenceApproved(state)) {
            return Step.EVIDENCE_AND_PHOTOS;
        }

        for (ArtifactKind kind : ArtifactKind.values()) {
            if (!kind.isApproved(state)) {
                return routeArtifact(kind, state);
            }
        }

        if (state.get(ReportFields.ASSEMBLED_HTML) == null) {
            return Step.ASSEMBLE_HTML;
        }
        return Step.COMPLETE;
    }

    private Step routeArtifact(ArtifactKind kind, WorkflowState state) {
        Optional<EvaluationRecord> evaluated = EvaluationLog.currentAttempt(state, kind);
        if (evaluated.isPresent()) {
            if (evaluated.get().ready() || EvaluationLog.isEscalated(state, kind)) {
                return kind.checkpointStep();
            }
            return kind.gateStep();
        }

        if (kind.artifact(state) != null) {
            return kind.evaluateStep();
        }
        if (kind == ArtifactKind.ARCS && !ReportConditions.specialistsComplete(state)) {
            return Step.ARC_SPECIALISTS;
        }
        String feedback = state.get(kind.feedbackField());
        boolean hasFeedback = feedback != null && !feedback.isBlank();
        if (kind.previousOutput(state) != null || hasFeedback) {
            return kind.reviseStep();
        }
        return kind.generateStep();
    }
}
