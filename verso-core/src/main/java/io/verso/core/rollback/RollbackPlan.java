package io.verso.core.rollback;

import io.verso.core.pipeline.ApprovalType;
import io.verso.core.pipeline.Step;
import io.verso.core.state.StateField;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/// What a rollback to one checkpoint resets.
///
/// @param point checkpoint rolled back to, not null
/// @param clearedFields fields reset to their defaults, in table order, not null
/// @param counterFields revision counters reset to zero, not null
/// @param reentryStep step the router selects right after the rollback, not null
public record RollbackPlan(
        ApprovalType point,
        List<StateField<?, ?>> clearedFields,
        List<StateField<Integer, Integer>> counterFields,
        Step reentryStep) {

    public RollbackPlan {
        Objects.requireNonNull(point, "point must not be null");
        Objects.requireNonNull(reentryStep, "reentryStep must not be null");
        clearedFields = List.copyOf(Objects.requireNonNull(clearedFields, "clearedFields must not be null"));
        counterFields = List.copyOf(Objects.requireNonNull(counterFields, "counterFields must not be null"));
    }

    /// Names of the cleared fields, for superset checks and log lines.
    public Set<String> clearedFieldNames() {
        return clearedFields.stream()
                .map(StateField::name)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
