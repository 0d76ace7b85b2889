package io.verso.core.evaluation;

import io.verso.core.pipeline.ArtifactKind;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/// Entry of the `escalations` log, written once automatic revision of an artifact
/// gives up and hands the decision to a reviewer.
///
/// @param kind escalated artifact kind, not null
/// @param attempt revision counter at the time of escalation
/// @param epoch rollback epoch at the time of escalation
/// @param reason reviewer-facing explanation, not null
/// @param issues outstanding issues of the last evaluation, not null
/// @param timestamp when the escalation happened, not null
public record EscalationRecord(
        ArtifactKind kind,
        int attempt,
        int epoch,
        String reason,
        List<String> issues,
        Instant timestamp) {

    public EscalationRecord {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        issues = List.copyOf(Objects.requireNonNullElse(issues, List.of()));
    }
}
