package io.verso.core.exception;

import java.io.Serial;

/// Thrown when a rollback is requested for an identifier missing from the rollback table.
public class InvalidRollbackPointException extends StateContractException {
    @Serial private static final long serialVersionUID = -1853934404581265311L;

    private final String pointId;

    public InvalidRollbackPointException(String pointId) {
        super("Invalid rollback point: '" + pointId + "'");
        this.pointId = pointId;
    }

    public String getPointId() {
        return pointId;
    }
}
