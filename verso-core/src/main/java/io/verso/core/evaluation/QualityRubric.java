package io.verso.core.evaluation;

import io.verso.core.pipeline.ArtifactKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Immutable weighted rubric for one {@link ArtifactKind}.
///
/// ### Validation Rules
/// - At least one criterion, at least one of them structural
/// - Criterion weights sum to 1.0 (tolerance 1e-6)
/// - Criterion ids are unique
/// - Threshold in `[0, 1]`
///
/// @implNote Immutable and thread-safe after construction.
/// @see QualityRubrics for the built-in rubrics
public final class QualityRubric {

    static final double WEIGHT_TOLERANCE = 1e-6;
    public static final double DEFAULT_THRESHOLD = 0.8;

    private final ArtifactKind kind;
    private final double threshold;
    private final List<QualityCriterion> criteria;

    private QualityRubric(Builder builder) {
        this.kind = Objects.requireNonNull(builder.kind, "Artifact kind required");
        this.threshold = builder.threshold;
        this.criteria = List.copyOf(builder.criteria);

        validate();
    }

    private void validate() {
        if (threshold < 0 || threshold > 1) {
            throw new IllegalArgumentException("Threshold must be between 0 and 1");
        }
        if (criteria.isEmpty()) {
            throw new IllegalArgumentException("Rubric must have at least one criterion");
        }
        if (criteria.stream().noneMatch(QualityCriterion::isStructural)) {
            throw new IllegalArgumentException("Rubric for " + kind + " needs a structural criterion");
        }
        long distinct = criteria.stream().map(QualityCriterion::getId).distinct().count();
        if (distinct != criteria.size()) {
            throw new IllegalArgumentException("Duplicate criterion id in rubric for " + kind);
        }
        double total = criteria.stream().mapToDouble(QualityCriterion::getWeight).sum();
        if (Math.abs(total - 1.0) > WEIGHT_TOLERANCE) {
            throw new IllegalArgumentException(
                    "Criterion weights for " + kind + " must sum to 1.0, got " + total);
        }
    }

    public ArtifactKind getKind() {
        return kind;
    }

    /// Minimum score each structural criterion must reach.
    public double getThreshold() {
        return threshold;
    }

    public List<QualityCriterion> getCriteria() {
        return criteria;
    }

    public List<QualityCriterion> getStructuralCriteria() {
        return criteria.stream().filter(QualityCriterion::isStructural).toList();
    }

    public List<QualityCriterion> getAdvisoryCriteria() {
        return criteria.stream().filter(criterion -> !criterion.isStructural()).toList();
    }

    /// Returns a copy of this rubric with another threshold.
    public QualityRubric withThreshold(double threshold) {
        Builder builder = builder(kind).threshold(threshold);
        criteria.forEach(builder::criterion);
        return builder.build();
    }

    public static Builder builder(ArtifactKind kind) {
        return new Builder(kind);
    }

    /// Builder for {@link QualityRubric}.
    public static final class Builder {
        private final ArtifactKind kind;
        private final List<QualityCriterion> criteria = new ArrayList<>();
        private double threshold = DEFAULT_THRESHOLD;

        private Builder(ArtifactKind kind) {
            this.kind = kind;
        }

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder criterion(QualityCriterion criterion) {
            criteria.add(Objects.requireNonNull(criterion, "criterion must not be null"));
            return this;
        }

        public Builder structural(String id, double weight, String description) {
            return criterion(QualityCriterion.structural(id, weight, description));
        }

        public Builder advisory(String id, double weight, String description) {
            return criterion(QualityCriterion.advisory(id, weight, description));
        }

        public QualityRubric build() {
            return new QualityRubric(this);
        }
    }
}
