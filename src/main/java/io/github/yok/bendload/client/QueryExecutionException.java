package io.github.yok.bendload.client;

/**
 * Raised when the query service could not execute a statement.
 *
 * <p>
 * Covers transport failures, non-2xx responses and errors reported in the response body.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class QueryExecutionException extends Exception {

    private static final long serialVersionUID = 1L;

    public QueryExecutionException(String message) {
        super(message);
    }

    public QueryExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
