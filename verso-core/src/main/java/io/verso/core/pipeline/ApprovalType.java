package io.verso.core.pipeline;

import java.util.Arrays;
import java.util.Optional;

/// Kinds of human decision a checkpoint can wait for.
///
/// Identifiers double as rollback point identifiers, see
/// {@link io.verso.core.rollback.RollbackTable}.
public enum ApprovalType {
    AWAIT_FULL_CONTEXT("await-full-context", Phase.AWAIT_FULL_CONTEXT),
    INPUT_REVIEW("input-review", Phase.REVIEW_INPUT),
    PAPER_EVIDENCE_SELECTION("paper-evidence-selection", Phase.SELECT_PAPER_EVIDENCE),
    AWAIT_ROSTER("await-roster", Phase.AWAIT_ROSTER),
    CHARACTER_IDS("character-ids", Phase.CHARACTER_IDS),
    PRE_CURATION("pre-curation", Phase.PRE_CURATION),
    EVIDENCE_AND_PHOTOS("evidence-and-photos", Phase.EVIDENCE_AND_PHOTOS),
    ARC_SELECTION("arc-selection", Phase.ARC_SELECTION),
    OUTLINE("outline", Phase.OUTLINE_CHECKPOINT),
    ARTICLE("article", Phase.ARTICLE_CHECKPOINT);

    private final String id;
    private final Phase phase;

    ApprovalType(String id, Phase phase) {
        this.id = id;
        this.phase = phase;
    }

    public String id() {
        return id;
    }

    /// Phase a run reports while suspended at this checkpoint.
    public Phase phase() {
        return phase;
    }

    public static Optional<ApprovalType> findById(String id) {
        return Arrays.stream(values()).filter(type -> type.id.equals(id)).findFirst();
    }

    /// Resolves an identifier.
    ///
    /// @throws IllegalArgumentException if no approval type has the identifier
    public static ApprovalType fromId(String id) {
        return findById(id)
                .orElseThrow(() -> new IllegalArgumentException("Unknown approval type: " + id));
    }

    @Override
    public String toString() {
        return id;
    }
}
