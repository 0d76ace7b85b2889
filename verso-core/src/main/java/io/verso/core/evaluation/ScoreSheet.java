package io.verso.core.evaluation;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Raw scores returned by a {@link CriterionScorer}.
///
/// @param scores score per criterion id, each expected in `[0, 1]`, not null
/// @param issues free-form issues found by the scorer, not null
/// @param revisionGuidance scorer's advice for the next attempt, may be empty
public record ScoreSheet(Map<String, Double> scores, List<String> issues, String revisionGuidance) {

    public ScoreSheet {
        scores = Map.copyOf(Objects.requireNonNull(scores, "scores must not be null"));
        issues = List.copyOf(Objects.requireNonNullElse(issues, List.of()));
        revisionGuidance = Objects.requireNonNullElse(revisionGuidance, "");
    }

    public static ScoreSheet of(Map<String, Double> scores) {
        return new ScoreSheet(scores, List.of(), "");
    }
}
