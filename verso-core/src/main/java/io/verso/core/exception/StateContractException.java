package io.verso.core.exception;

import java.io.Serial;

/// Base type for programming errors against the state contract.
///
/// These are never recorded in a run's error log; they propagate to the caller.
public class StateContractException extends IllegalArgumentException {
    @Serial private static final long serialVersionUID = 6120348811925403127L;

    public StateContractException(String message) {
        super(message);
    }
}
