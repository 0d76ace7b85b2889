package io.verso.core.pipeline;

import java.time.Instant;
import java.util.Objects;

/// Entry of the run's `errors` log.
///
/// @param kind machine-readable failure kind, e.g. `generateOutline-failed`, not null
/// @param message human-readable cause, not null
/// @param phase code of the phase during which the failure happened, not null
/// @param step identifier of the failing step, may be null for sub-step markers
/// @param timestamp when the failure was recorded, not null
public record ErrorRecord(String kind, String message, String phase, String step, Instant timestamp) {

    public ErrorRecord {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(phase, "phase must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        message = message != null ? message : "";
    }

    /// Records a failure of `step` at the current instant.
    public static ErrorRecord of(String kind, String message, Phase phase, String step) {
        return new ErrorRecord(kind, message, phase.code(), step, Instant.now());
    }
}
