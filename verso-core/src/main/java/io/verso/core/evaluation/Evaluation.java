package io.verso.core.evaluation;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Verdict of scoring one artifact against its {@link QualityRubric}.
///
/// @param ready true iff every structural criterion cleared the threshold
/// @param overallScore weighted sum of all criterion scores, 0.0 to 1.0
/// @param issues structural issues followed by issues reported by the scorer, not null
/// @param revisionGuidance instructions for a regeneration, not null (may be empty)
/// @param criterionScores score per criterion id, not null
/// @param structuralIssues failed structural criteria, not null
/// @param advisoryWarnings advisory criteria below the threshold, not null
public record Evaluation(
        boolean ready,
        double overallScore,
        List<String> issues,
        String revisionGuidance,
        Map<String, Double> criterionScores,
        List<String> structuralIssues,
        List<String> advisoryWarnings) {

    public Evaluation {
        issues = List.copyOf(Objects.requireNonNullElse(issues, List.of()));
        revisionGuidance = Objects.requireNonNullElse(revisionGuidance, "");
        criterionScores = Map.copyOf(Objects.requireNonNullElse(criterionScores, Map.of()));
        structuralIssues = List.copyOf(Objects.requireNonNullElse(structuralIssues, List.of()));
        advisoryWarnings = List.copyOf(Objects.requireNonNullElse(advisoryWarnings, List.of()));
    }

    /// Creates a not-ready verdict for an artifact that could not be scored at all, such
    /// as a missing or malformed artifact or a failed generation attempt.
    public static Evaluation structuralFailure(List<String> issues, String revisionGuidance) {
        return new Evaluation(false, 0.0, issues, revisionGuidance, Map.of(), issues, List.of());
    }
}
