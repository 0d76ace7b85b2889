package io.verso.serialization;

import java.io.Serial;

/// Thrown when a snapshot cannot be written to or read from durable storage.
public class RunStatePersistenceException extends RuntimeException {
    @Serial private static final long serialVersionUID = -2264861095318020412L;

    public RunStatePersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
