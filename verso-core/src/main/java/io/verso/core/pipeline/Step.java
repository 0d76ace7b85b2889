package io.verso.core.pipeline;

import java.util.Arrays;
import java.util.Optional;

/// Every step the router can select, with the phase a run reports while on it.
///
/// Checkpoint steps carry their {@link ApprovalType}; the generate, revise, evaluate and
/// gate steps of a revisable artifact carry its {@link ArtifactKind}.
public enum Step {
    AWAIT_FULL_CONTEXT("awaitFullContext", ApprovalType.AWAIT_FULL_CONTEXT),
    PARSE_INPUT("parseInput", Phase.PARSE_INPUT),
    INPUT_REVIEW("inputReview", ApprovalType.INPUT_REVIEW),
    FETCH_SOURCES("fetchSources", Phase.FETCH_SOURCES),
    PAPER_EVIDENCE_SELECTION("paperEvidenceSelection", ApprovalType.PAPER_EVIDENCE_SELECTION),
    AWAIT_ROSTER("awaitRoster", ApprovalType.AWAIT_ROSTER),
    ANALYZE_WHITEBOARD("analyzeWhiteboard", Phase.ANALYZE_WHITEBOARD),
    ANALYZE_PHOTOS("analyzePhotos", Phase.ANALYZE_PHOTOS),
    CHARACTER_IDS("characterIds", ApprovalType.CHARACTER_IDS),
    PREPROCESS_EVIDENCE("preprocessEvidence", Phase.PREPROCESS_EVIDENCE),
    PRE_CURATION("preCuration", ApprovalType.PRE_CURATION),
    CURATE_EVIDENCE("curateEvidence", Phase.CURATE_EVIDENCE),
    EVIDENCE_AND_PHOTOS("evidenceAndPhotos", ApprovalType.EVIDENCE_AND_PHOTOS),

    ARC_SPECIALISTS("arcSpecialists", Phase.ARC_SPECIALISTS, ArtifactKind.ARCS),
    ARC_SYNTHESIS("arcSynthesis", Phase.ARC_SYNTHESIS, ArtifactKind.ARCS),
    REVISE_ARCS("reviseArcs", Phase.ARC_REVISION, ArtifactKind.ARCS),
    EVALUATE_ARCS("evaluateArcs", Phase.ARC_EVALUATION, ArtifactKind.ARCS),
    ARC_REVISION_GATE("arcRevisionGate", Phase.ARC_EVALUATION, ArtifactKind.ARCS),
    ARC_SELECTION("arcSelection", ApprovalType.ARC_SELECTION),

    GENERATE_OUTLINE("generateOutline", Phase.OUTLINE_GENERATION, ArtifactKind.OUTLINE),
    REVISE_OUTLINE("reviseOutline", Phase.OUTLINE_REVISION, ArtifactKind.OUTLINE),
    EVALUATE_OUTLINE("evaluateOutline", Phase.OUTLINE_EVALUATION, ArtifactKind.OUTLINE),
    OUTLINE_REVISION_GATE("outlineRevisionGate", Phase.OUTLINE_EVALUATION, ArtifactKind.OUTLINE),
    OUTLINE_CHECKPOINT("outlineCheckpoint", ApprovalType.OUTLINE),

    GENERATE_ARTICLE("generateArticle", Phase.ARTICLE_GENERATION, ArtifactKind.ARTICLE),
    REVISE_ARTICLE("reviseArticle", Phase.ARTICLE_REVISION, ArtifactKind.ARTICLE),
    EVALUATE_ARTICLE("evaluateArticle", Phase.ARTICLE_EVALUATION, ArtifactKind.ARTICLE),
    ARTICLE_REVISION_GATE("articleRevisionGate", Phase.ARTICLE_EVALUATION, ArtifactKind.ARTICLE),
    ARTICLE_CHECKPOINT("articleCheckpoint", ApprovalType.ARTICLE),

    ASSEMBLE_HTML("assembleHtml", Phase.ASSEMBLE_HTML),
    COMPLETE("complete", Phase.COMPLETE, StepKind.TERMINAL),
    HALT("halt", Phase.ERROR, StepKind.TERMINAL);

    private final String id;
    private final Phase phase;
    private final StepKind kind;
    private final ApprovalType approvalType;
    private final ArtifactKind artifactKind;

    Step(String id, Phase phase) {
        this(id, phase, StepKind.NODE, null, null);
    }

    Step(String id, Phase phase, StepKind kind) {
        this(id, phase, kind, null, null);
    }

    Step(String id, Phase phase, ArtifactKind artifactKind) {
        this(id, phase, StepKind.NODE, null, artifactKind);
    }

    Step(String id, ApprovalType approvalType) {
        this(id, approvalType.phase(), StepKind.CHECKPOINT, approvalType, null);
    }

    Step(String id, Phase phase, StepKind kind, ApprovalType approvalType, ArtifactKind artifactKind) {
        this.id = id;
        this.phase = phase;
        this.kind = kind;
        this.approvalType = approvalType;
        this.artifactKind = artifactKind;
    }

    public String id() {
        return id;
    }

    public Phase phase() {
        return phase;
    }

    public StepKind kind() {
        return kind;
    }

    /// Approval type of a checkpoint step, null for other steps.
    public ApprovalType approvalType() {
        return approvalType;
    }

    /// Revisable artifact this step produces or assesses, null for other steps.
    public ArtifactKind artifactKind() {
        return artifactKind;
    }

    /// Returns the checkpoint step waiting for `type`.
    public static Step checkpointFor(ApprovalType type) {
        return Arrays.stream(values())
                .filter(step -> step.approvalType == type)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No checkpoint step for " + type));
    }

    public static Optional<Step> findById(String id) {
        return Arrays.stream(values()).filter(step -> step.id.equals(id)).findFirst();
    }

    /// Resolves a step identifier.
    ///
    /// @throws IllegalArgumentException if no step has the identifier
    public static Step fromId(String id) {
        return findById(id).orElseThrow(() -> new IllegalArgumentException("Unknown step: " + id));
    }

    @Override
    public String toString() {
        return id;
    }
}
