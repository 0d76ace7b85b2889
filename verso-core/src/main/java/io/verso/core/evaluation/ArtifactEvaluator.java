package io.verso.core.evaluation;

import io.verso.core.pipeline.ArtifactKind;
import io.verso.core.state.WorkflowState;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/// Scores an artifact against its rubric and decides readiness.
///
/// The artifact is ready iff every structural criterion reaches the rubric threshold.
/// The overall score is the weighted sum of all criteria, advisory ones included. A
/// malformed artifact is reported as a structural failure without calling the scorer.
///
/// ### Contracts
/// - **Postcondition**: never changes state, never touches revision counters
/// - **Invariant**: scores are clamped to `[0, 1]`; an unscored criterion counts as 0
///
/// @implNote Thread-safe if the repository, scorer and validator are.
/// @see RevisionGate for what happens with the verdict
public final class ArtifactEvaluator {

    private static final Logger logger = Logger.getLogger(ArtifactEvaluator.class.getName());

    private final QualityRubricRepository rubrics;
    private final CriterionScorer scorer;
    private final ArtifactShapeValidator validator;

    public ArtifactEvaluator(
            QualityRubricRepository rubrics, CriterionScorer scorer, ArtifactShapeValidator validator) {
        this.rubrics = Objects.requireNonNull(rubrics, "rubrics must not be null");
        this.scorer = Objects.requireNonNull(scorer, "scorer must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
    }

    /// Evaluates the current artifact of `kind`.
    ///
    /// @param kind artifact kind, not null
    /// @param state run state holding the artifact, not null
    /// @return the verdict, never null
    /// @throws Exception if the scorer fails
    public Evaluation evaluate(ArtifactKind kind, WorkflowState state) throws Exception {
        QualityRubric rubric = rubrics.getByKind(kind);

        List<String> violations = validator.validate(kind, kind.artifact(state));
        if (!violations.isEmpty()) {
            logger.info("Artifact " + kind + " failed shape validation: " + violations);
            return Evaluation.structuralFailure(
                    violations, "Regenerate the " + kind + " so that: " + String.join("; ", violations));
        }

        Evaluation evaluation = score(rubric, scorer.score(kind, rubric, state));
        logger.info(
                "Evaluated "
                        + kind
                        + ": ready="
                        + evaluation.ready()
                        + ", score="
                        + format(evaluation.overallScore()));
        return evaluation;
    }

    /// Applies the readiness rule to raw scores.
    ///
    /// @param rubric rubric the scores belong to, not null
    /// @param sheet raw scores, not null
    /// @return the verdict, never null
    public static Evaluation score(QualityRubric rubric, ScoreSheet sheet) {
        Map<String, Double> scores = new LinkedHashMap<>();
        List<String> structuralIssues = new ArrayList<>();
        List<String> advisoryWarnings = new ArrayList<>();
        double overall = 0.0;

        for (QualityCriterion criterion : rubric.getCriteria()) {
            Double raw = sheet.scores().get(criterion.getId());
            double score = raw == null || raw.isNaN() ? 0.0 : Math.max(0.0, Math.min(1.0, raw));
            scores.put(criterion.getId(), score);
            overall += score * criterion.getWeight();

            if (score < rubric.getThreshold()) {
                String issue =
                        criterion.getId()
                                + ": "
                                + criterion.getDescription()
                                + (raw == null
                                        ? " (not scored)"
                                        : " (" + format(score) + " < " + format(rubric.getThreshold()) + ")");
                if (criterion.isStructural()) {
                    structuralIssues.add(issue);
                } else {
                    advisoryWarnings.add(issue);
                }
            }
        }

        boolean ready = structuralIssues.isEmpty();
        List<String> issues = new ArrayList<>(structuralIssues);
        issues.addAll(sheet.issues());

        String guidance = sheet.revisionGuidance();
        if (guidance.isBlank() && !ready) {
            guidance =
                    "Fix the structural criteria: "
                            + rubric.getStructuralCriteria().stream()
                                    .filter(c -> scores.get(c.getId()) < rubric.getThreshold())
                                    .map(QualityCriterion::getId)
                                    .collect(Collectors.joining(", "));
        }

        return new Evaluation(
                ready, overall, issues, guidance, scores, structuralIssues, advisoryWarnings);
    }

    static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
