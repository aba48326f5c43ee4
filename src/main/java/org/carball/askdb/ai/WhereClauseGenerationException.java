package org.carball.askdb.ai;

public class WhereClauseGenerationException extends Exception {

    public WhereClauseGenerationException(String message) {
        super(message);
    }

    public WhereClauseGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
