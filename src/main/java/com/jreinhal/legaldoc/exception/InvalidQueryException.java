package com.jreinhal.legaldoc.exception;

/**
 * Raised before the pipeline starts when the query or conversation id cannot be accepted.
 */
public class InvalidQueryException extends IllegalArgumentException {
    public InvalidQueryException(String message) {
        super(message);
    }
}
