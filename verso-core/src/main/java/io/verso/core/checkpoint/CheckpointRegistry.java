package io.verso.core.checkpoint;

import io.verso.core.exception.StepNotRegisteredException;
import io.verso.core.pipeline.ApprovalType;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/// Lookup of checkpoint definitions by approval type.
public class CheckpointRegistry {

    private final Map<ApprovalType, CheckpointDefinition> definitions =
            new EnumMap<>(ApprovalType.class);

    public CheckpointRegistry register(CheckpointDefinition definition) {
        definitions.put(definition.type(), definition);
        return this;
    }

    public Optional<CheckpointDefinition> find(ApprovalType type) {
        return Optional.ofNullable(definitions.get(type));
    }

    /// @throws StepNotRegisteredException if no definition handles `type`
    public CheckpointDefinition get(ApprovalType type) {
        return find(type)
                .orElseThrow(
                        () -> new StepNotRegisteredException("No checkpoint registered for: " + type));
    }

    public boolean has(ApprovalType type) {
        return definitions.containsKey(type);
    }
}
