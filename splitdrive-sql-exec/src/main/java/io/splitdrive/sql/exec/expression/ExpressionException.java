package io.splitdrive.sql.exec.expression;

import io.splitdrive.sql.exec.QueryHarnessException;

public class ExpressionException extends QueryHarnessException {

    public ExpressionException(String message) {
        super(message);
    }

    public ExpressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
