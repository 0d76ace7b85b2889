package io.verso.core.evaluation;

import io.verso.core.pipeline.ArtifactKind;
import io.verso.core.state.WorkflowState;
import io.verso.core.util.JsonText;
import java.util.Locale;

/// Assembles the revision instructions for a regeneration step.
///
/// Section order is fixed: human feedback first (only when non-blank), then the attempt
/// statement, then the evaluator's issues and guidance. The previous output is always
/// rendered verbatim in a separate block.
public final class RevisionContextBuilder {

    private RevisionContextBuilder() {}

    /// Builds the context from explicit inputs.
    ///
    /// @param kind artifact being revised, not null
    /// @param attemptNumber revision attempt about to run, 1 for the first revision
    /// @param priorEvaluation verdict on the previous attempt, may be null after a
    ///     purely human rejection
    /// @param priorOutput previous artifact, may be null
    /// @param humanFeedback reviewer feedback, may be null or blank
    /// @return the context, never null
    public static RevisionContext build(
            ArtifactKind kind,
            int attemptNumber,
            Evaluation priorEvaluation,
            Object priorOutput,
            String humanFeedback) {
        String label = kind.id().toUpperCase(Locale.ROOT);
        StringBuilder context = new StringBuilder();

        if (humanFeedback != null && !humanFeedback.isBlank()) {
            context.append("## HUMAN FEEDBACK (HIGHEST PRIORITY)\n")
                    .append(humanFeedback.strip())
                    .append("\n\nAddress this feedback before any automated guidance below.\n\n");
        }

        context.append("## REVISION CONTEXT: ")
                .append(label)
                .append(" (Attempt ")
                .append(attemptNumber)
                .append(")\n");

        if (priorEvaluation != null) {
            context.append("Previous overall score: ")
                    .append(ArtifactEvaluator.format(priorEvaluation.overallScore()))
                    .append('\n');
            if (!priorEvaluation.issues().isEmpty()) {
                context.append("\n### Issues to fix\n");
                priorEvaluation.issues().forEach(issue -> context.append("- ").append(issue).append('\n'));
            }
            if (!priorEvaluation.advisoryWarnings().isEmpty()) {
                context.append("\n### Advisory warnings\n");
                priorEvaluation.advisoryWarnings()
                        .forEach(warning -> context.append("- ").append(warning).append('\n'));
            }
            if (!priorEvaluation.revisionGuidance().isBlank()) {
                context.append("\n### Guidance\n").append(priorEvaluation.revisionGuidance()).append('\n');
            }
        }
        context.append("\nKeep what works in the previous ")
                .append(kind.id())
                .append(" and change what the points above require.\n");

        String priorOutputBlock =
                "## PREVIOUS " + label + " (for reference)\n" + JsonText.render(priorOutput) + "\n";
        return new RevisionContext(context.toString(), priorOutputBlock);
    }

    /// Builds the context for the attempt a state is about to regenerate: the attempt
    /// number is the kind's revision counter, the prior evaluation the latest one in the
    /// current epoch.
    public static RevisionContext forState(ArtifactKind kind, WorkflowState state) {
        Evaluation prior = EvaluationLog.latest(state, kind).map(EvaluationRecord::evaluation).orElse(null);
        return build(
                kind,
                kind.revisionCount(state),
                prior,
                kind.previousOutput(state),
                state.get(kind.feedbackField()));
    }
}
