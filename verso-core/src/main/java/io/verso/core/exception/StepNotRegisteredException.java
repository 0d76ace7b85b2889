package io.verso.core.exception;

import java.io.Serial;

/// Thrown when the router selects a step with no registered node or checkpoint.
public class StepNotRegisteredException extends IllegalStateException {
    @Serial private static final long serialVersionUID = 4569044560797025331L;

    public StepNotRegisteredException(String message) {
        super(message);
    }
}
