package io.splitdrive.sql.exec;

/**
 * Base of every failure raised by the harness. Nothing in the harness retries, these always
 * reach the caller.
 */
public class QueryHarnessException extends RuntimeException {

    public QueryHarnessException(String message) {
        super(message);
    }

    public QueryHarnessException(String message, Throwable cause) {
        super(message, cause);
    }
}
