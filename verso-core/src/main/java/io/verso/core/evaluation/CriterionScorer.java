package io.verso.core.evaluation;

import io.verso.core.pipeline.ArtifactKind;
import io.verso.core.state.WorkflowState;

/// Scores an artifact against each criterion of its rubric.
///
/// Implementations call out to a language model or another judge; the readiness rule
/// stays in {@link ArtifactEvaluator}.
@FunctionalInterface
public interface CriterionScorer {

    /// @param kind artifact kind being scored, not null
    /// @param rubric rubric whose criteria must be scored, not null
    /// @param state current run state holding the artifact, not null
    /// @return per-criterion scores, never null
    /// @throws Exception if the external judge fails
    ScoreSheet score(ArtifactKind kind, QualityRubric rubric, WorkflowState state) throws Exception;
}
