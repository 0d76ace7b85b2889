package io.verso.core.pipeline;

import io.verso.core.state.StateField;
import io.verso.core.state.WorkflowState;
import java.util.Collection;
import java.util.Map;

/// Artifacts that go through automatic evaluation and bounded revision.
///
/// The default revision cap is lower for the cheaper, earlier artifact so a struggling
/// run reaches a reviewer sooner.
///
/// @implNote Step and field lookups are switch methods rather than constructor
/// arguments, since {@link Step} itself refers to this enum.
public enum ArtifactKind {
    ARCS("arcs", 2),
    OUTLINE("outline", 3),
    ARTICLE("article", 3);

    private final String id;
    private final int defaultCap;

    ArtifactKind(String id, int defaultCap) {
        this.id = id;
        this.defaultCap = defaultCap;
    }

    public String id() {
        return id;
    }

    public int defaultCap() {
        return defaultCap;
    }

    /// Field holding the current artifact.
    public StateField<?, ?> artifactField() {
        return switch (this) {
            case ARCS -> ReportFields.NARRATIVE_ARCS;
            case OUTLINE -> ReportFields.OUTLINE;
            case ARTICLE -> ReportFields.CONTENT_BUNDLE;
        };
    }

    /// Field holding the output of the attempt that was sent back for revision.
    public StateField<?, ?> previousField() {
        return switch (this) {
            case ARCS -> ReportFields.PREVIOUS_ARCS;
            case OUTLINE -> ReportFields.PREVIOUS_OUTLINE;
            case ARTICLE -> ReportFields.PREVIOUS_CONTENT_BUNDLE;
        };
    }

    public StateField<String, String> feedbackField() {
        return switch (this) {
            case ARCS -> ReportFields.ARC_FEEDBACK;
            case OUTLINE -> ReportFields.OUTLINE_FEEDBACK;
            case ARTICLE -> ReportFields.ARTICLE_FEEDBACK;
        };
    }

    public StateField<Integer, Integer> counterField() {
        return switch (this) {
            case ARCS -> ReportFields.ARC_REVISION_COUNT;
            case OUTLINE -> ReportFields.OUTLINE_REVISION_COUNT;
            case ARTICLE -> ReportFields.ARTICLE_REVISION_COUNT;
        };
    }

    public ApprovalType approvalType() {
        return switch (this) {
            case ARCS -> ApprovalType.ARC_SELECTION;
            case OUTLINE -> ApprovalType.OUTLINE;
            case ARTICLE -> ApprovalType.ARTICLE;
        };
    }

    public Step generateStep() {
        return switch (this) {
            case ARCS -> Step.ARC_SYNTHESIS;
            case OUTLINE -> Step.GENERATE_OUTLINE;
            case ARTICLE -> Step.GENERATE_ARTICLE;
        };
    }

    public Step reviseStep() {
        return switch (this) {
            case ARCS -> Step.REVISE_ARCS;
            case OUTLINE -> Step.REVISE_OUTLINE;
            case ARTICLE -> Step.REVISE_ARTICLE;
        };
    }

    public Step evaluateStep() {
        return switch (this) {
            case ARCS -> Step.EVALUATE_ARCS;
            case OUTLINE -> Step.EVALUATE_OUTLINE;
            case ARTICLE -> Step.EVALUATE_ARTICLE;
        };
    }

    public Step gateStep() {
        return switch (this) {
            case ARCS -> Step.ARC_REVISION_GATE;
            case OUTLINE -> Step.OUTLINE_REVISION_GATE;
            case ARTICLE -> Step.ARTICLE_REVISION_GATE;
        };
    }

    public Step checkpointStep() {
        return Step.checkpointFor(approvalType());
    }

    /// Returns the current artifact, or null when it is absent or empty.
    public Object artifact(WorkflowState state) {
        return presentOrNull(state.get(artifactField().name()));
    }

    public Object previousOutput(WorkflowState state) {
        return presentOrNull(state.get(previousField().name()));
    }

    public int revisionCount(WorkflowState state) {
        return state.get(counterField());
    }

    /// Whether a reviewer has accepted this artifact, which ends its revision loop.
    public boolean isApproved(WorkflowState state) {
        return switch (this) {
            case ARCS -> !state.get(ReportFields.SELECTED_ARCS).isEmpty();
            case OUTLINE ->
                    state.get(ReportFields.OUTLINE_APPROVED) && artifact(state) != null;
            case ARTICLE ->
                    state.get(ReportFields.ARTICLE_APPROVED) && artifact(state) != null;
        };
    }

    public static ArtifactKind fromId(String id) {
        for (ArtifactKind kind : values()) {
            if (kind.id.equals(id)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown artifact kind: " + id);
    }

    private static Object presentOrNull(Object value) {
        if (value instanceof Collection<?> collection && collection.isEmpty()) {
            return null;
        }
        if (value instanceof Map<?, ?> map && map.isEmpty()) {
            return null;
        }
        return value;
    }

    @Override
    public String toString() {
        return id;
    }
}
