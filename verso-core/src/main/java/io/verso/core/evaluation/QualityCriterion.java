package io.verso.core.evaluation;

import java.util.Objects;

/// Immutable criterion of a {@link QualityRubric}.
///
/// ### Validation Rules
/// - Weight must be in `(0, 1]`
///
/// @implNote Immutable and thread-safe after construction.
public final class QualityCriterion {

    private final String id;
    private final String description;
    private final double weight;
    private final CriterionType type;

    private QualityCriterion(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Criterion ID required");
        this.description = Objects.requireNonNull(builder.description, "Description required");
        this.weight = builder.weight;
        this.type = Objects.requireNonNull(builder.type, "Type required");

        validate();
    }

    private void validate() {
        if (weight <= 0 || weight > 1) {
            throw new IllegalArgumentException(
                    "Weight of criterion " + id + " must be in (0, 1], got " + weight);
        }
    }

    public String getId() {
        return id;
    }

    public String getDescription() {
        return description;
    }

    public double getWeight() {
        return weight;
    }

    public CriterionType getType() {
        return type;
    }

    public boolean isStructural() {
        return type == CriterionType.STRUCTURAL;
    }

    public static QualityCriterion structural(String id, double weight, String description) {
        return builder().id(id).weight(weight).description(description).type(CriterionType.STRUCTURAL).build();
    }

    public static QualityCriterion advisory(String id, double weight, String description) {
        return builder().id(id).weight(weight).description(description).type(CriterionType.ADVISORY).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Builder for {@link QualityCriterion}. Required fields: `id`, `description`, `weight`.
    public static final class Builder {
        private String id;
        private String description;
        private double weight;
        private CriterionType type = CriterionType.ADVISORY;

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder weight(double weight) {
            this.weight = weight;
            return this;
        }

        public Builder type(CriterionType type) {
            this.type = type;
            return this;
        }

        public QualityCriterion build() {
            return new QualityCriterion(this);
        }
    }

    @Override
    public String toString() {
        return id + "(" + type + ", " + weight + ")";
    }
}
