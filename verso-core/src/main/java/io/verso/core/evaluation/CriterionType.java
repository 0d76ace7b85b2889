package io.verso.core.evaluation;

/// Role of a {@link QualityCriterion} in the readiness decision.
public enum CriterionType {
    /// Must individually reach the rubric threshold for the artifact to be ready.
    STRUCTURAL,
    /// Contributes to the overall score only.
    ADVISORY
}
