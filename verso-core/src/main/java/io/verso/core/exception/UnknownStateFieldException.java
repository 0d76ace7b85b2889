package io.verso.core.exception;

import java.io.Serial;

/// Thrown when a partial update or lookup names a field the schema does not declare.
public class UnknownStateFieldException extends StateContractException {
    @Serial private static final long serialVersionUID = -3317730452211865099L;

    private final String fieldName;

    public UnknownStateFieldException(String fieldName) {
        super("Unknown state field: '" + fieldName + "'");
        this.fieldName = fieldName;
    }

    public String getFieldName() {
        return fieldName;
    }
}
