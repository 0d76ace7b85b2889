package io.verso.core.pipeline;

import java.util.Arrays;

/// Pipeline phases in normal progress order, each with its stable string code.
///
/// The code is what gets persisted and shown to reviewers; the enum order is the order
/// a run passes through when nothing is rolled back.
public enum Phase {
    INIT("init"),
    AWAIT_FULL_CONTEXT("0.05"),
    PARSE_INPUT("0.1"),
    REVIEW_INPUT("0.2"),
    FETCH_SOURCES("1.2"),
    SELECT_PAPER_EVIDENCE("1.35"),
    AWAIT_ROSTER("1.51"),
    ANALYZE_WHITEBOARD("1.55"),
    ANALYZE_PHOTOS("1.65"),
    CHARACTER_IDS("1.66"),
    PREPROCESS_EVIDENCE("1.7"),
    PRE_CURATION("1.75"),
    CURATE_EVIDENCE("1.8"),
    EVIDENCE_AND_PHOTOS("1.85"),
    ARC_SPECIALISTS("2.1"),
    ARC_SYNTHESIS("2.2"),
    ARC_REVISION("2.25"),
    ARC_EVALUATION("2.3"),
    ARC_SELECTION("2.35"),
    OUTLINE_GENERATION("3.1"),
    OUTLINE_REVISION("3.15"),
    OUTLINE_EVALUATION("3.2"),
    OUTLINE_CHECKPOINT("3.25"),
    ARTICLE_GENERATION("4.1"),
    ARTICLE_REVISION("4.15"),
    ARTICLE_EVALUATION("4.2"),
    ARTICLE_CHECKPOINT("4.25"),
    ASSEMBLE_HTML("5"),
    COMPLETE("complete"),
    ERROR("error");

    private final String code;

    Phase(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public boolean isTerminal() {
        return this == COMPLETE || this == ERROR;
    }

    /// Resolves a persisted phase code.
    ///
    /// @throws IllegalArgumentException if no phase has the code
    public static Phase fromCode(String code) {
        return Arrays.stream(values())
                .filter(phase -> phase.code.equals(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown phase code: " + code));
    }

    @Override
    public String toString() {
        return code;
    }
}
