package com.vp.querylang;

/**
 * Exception thrown when configuration or record input cannot be read.
 * Query text itself never causes this exception.
 */
public class QueryLanguageException extends RuntimeException {

    public QueryLanguageException(String message) {
        super(message);
    }

    public QueryLanguageException(String message, Throwable cause) {
        super(message, cause);
    }
}
