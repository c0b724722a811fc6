package com.jreinhal.legaldoc.exception;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps pipeline and indexing exceptions to JSON error bodies. Client-facing messages never carry
 * class names, paths or stack content.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    private static final Pattern QUALIFIED_NAME = Pattern.compile("\\w+(\\.\\w+){2,}");
    private static final int MAX_CLIENT_MESSAGE = 200;

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException ex) {
        return respond(HttpStatus.BAD_REQUEST, "Invalid request", clientMessage(ex.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        log.debug("Unreadable request body: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid request", "Malformed request body");
    }

    @ExceptionHandler({RejectedExecutionException.class, QueryCancelledException.class})
    public ResponseEntity<Map<String, Object>> handleOverload(RuntimeException ex) {
        log.warn("Query not completed: {}", ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Service busy, retry later", null);
    }

    @ExceptionHandler(DocumentIndexingException.class)
    public ResponseEntity<Map<String, Object>> handleIndexing(DocumentIndexingException ex) {
        log.error("Document indexing failed", ex);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Document could not be indexed", null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnhandled(Exception ex) {
        log.error("Unhandled exception", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", null);
    }

    private static ResponseEntity<Map<String, Object>> respond(HttpStatus status, String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        if (message != null) {
            body.put("message", message);
        }
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.status(status).body(body);
    }

    private static String clientMessage(String message) {
        if (message == null || message.isBlank() || message.length() > MAX_CLIENT_MESSAGE) {
            return "Invalid request";
        }
        boolean internal = message.contains("/") || message.contains("\\") || message.contains("Exception")
                || message.contains("at ") || QUALIFIED_NAME.matcher(message).find();
        return internal ? "Invalid request" : message;
    }
}
