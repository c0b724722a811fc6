package com.jreinhal.legaldoc.exception;

public class DocumentIndexingException extends RuntimeException {
    public DocumentIndexingException(String message, Throwable cause) {
        super(message, cause);
    }
}
