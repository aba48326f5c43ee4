package org.carball.askdb.executor;

/**
 * The store rejected, failed or timed out on a filter query. Fatal for the question being answered.
 */
public class QueryExecutionException extends Exception {

    public QueryExecutionException(String message) {
        super(message);
    }

    public QueryExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
