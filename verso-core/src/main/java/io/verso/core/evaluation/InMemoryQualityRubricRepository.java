package io.verso.core.evaluation;

import io.verso.core.pipeline.ArtifactKind;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// Thread-safe in-memory rubric storage.
public class InMemoryQualityRubricRepository implements QualityRubricRepository {

    private final Map<ArtifactKind, QualityRubric> rubrics = new ConcurrentHashMap<>();

    /// Creates a repository preloaded with {@link QualityRubrics#defaults()}.
    public static InMemoryQualityRubricRepository withDefaults() {
        InMemoryQualityRubricRepository repository = new InMemoryQualityRubricRepository();
        QualityRubrics.defaults().values().forEach(repository::save);
        return repository;
    }

    @Override
    public void save(QualityRubric rubric) {
        rubrics.put(rubric.getKind(), rubric);
    }

    @Override
    public Optional<QualityRubric> findByKind(ArtifactKind kind) {
        return Optional.ofNullable(rubrics.get(kind));
    }
}
