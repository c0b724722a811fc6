package com.jreinhal.legaldoc.exception;

public class QueryCancelledException extends RuntimeException {
    public QueryCancelledException(String message) {
        super(message);
    }

    public QueryCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
