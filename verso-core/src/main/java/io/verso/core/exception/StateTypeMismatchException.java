package io.verso.core.exception;

import java.io.Serial;

/// Thrown when an update value does not fit the reducer declared for its field.
public class StateTypeMismatchException extends StateContractException {
    @Serial private static final long serialVersionUID = 2290511635848803546L;

    public StateTypeMismatchException(String message) {
        super(message);
    }
}
