package io.verso.core.checkpoint;

import io.verso.core.pipeline.ApprovalType;
import io.verso.core.pipeline.Phase;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Read-only projection of the state a reviewer needs for one approval type.
///
/// @param approvalType decision being requested, not null
/// @param phase phase of the suspended run, not null
/// @param fields projected values keyed by name, not null; values may be null
public record CheckpointPayload(ApprovalType approvalType, Phase phase, Map<String, Object> fields) {

    public CheckpointPayload {
        Objects.requireNonNull(approvalType, "approvalType must not be null");
        Objects.requireNonNull(phase, "phase must not be null");
        fields =
                Collections.unmodifiableMap(
                        new LinkedHashMap<>(Objects.requireNonNullElse(fields, Map.of())));
    }

    public Object get(String name) {
        return fields.get(name);
    }
}
