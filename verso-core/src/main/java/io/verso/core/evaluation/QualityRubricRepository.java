package io.verso.core.evaluation;

import io.verso.core.pipeline.ArtifactKind;
import java.util.Optional;

/// Storage of the rubric used for each artifact kind.
public interface QualityRubricRepository {

    /// Stores a rubric, replacing any previous rubric for the same kind.
    void save(QualityRubric rubric);

    Optional<QualityRubric> findByKind(ArtifactKind kind);

    /// @throws IllegalStateException if no rubric is stored for `kind`
    default QualityRubric getByKind(ArtifactKind kind) {
        return findByKind(kind)
                .orElseThrow(() -> new IllegalStateException("No rubric registered for " + kind));
    }
}
