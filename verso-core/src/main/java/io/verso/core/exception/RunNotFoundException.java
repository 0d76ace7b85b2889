package io.verso.core.exception;

import java.io.Serial;

/// Thrown when no persisted snapshot exists for a run identifier.
public class RunNotFoundException extends Exception {
    @Serial private static final long serialVersionUID = 8841250967102235470L;

    public RunNotFoundException(String runId) {
        super("No persisted run found: " + runId);
    }
}
