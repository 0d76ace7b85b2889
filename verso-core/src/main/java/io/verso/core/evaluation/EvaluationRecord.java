package io.verso.core.evaluation;

import io.verso.core.pipeline.ArtifactKind;
import java.time.Instant;
import java.util.Objects;

/// Entry of the `evaluationHistory` log.
///
/// @param kind evaluated artifact kind, not null
/// @param attempt revision counter of the kind when the evaluation ran
/// @param epoch rollback epoch of the run when the evaluation ran
/// @param evaluation the verdict, not null
/// @param timestamp when the verdict was recorded, not null
public record EvaluationRecord(
        ArtifactKind kind, int attempt, int epoch, Evaluation evaluation, Instant timestamp) {

    public EvaluationRecord {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(evaluation, "evaluation must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    public boolean ready() {
        return evaluation.ready();
    }
}
