package com.jreinhal.assay.exception;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    private static final Pattern PACKAGE_PATTERN = Pattern.compile("\\w+(\\.\\w+){2,}");

    @ExceptionHandler(RagException.class)
    public ResponseEntity<Map<String, Object>> handleRag(RagException ex) {
        ErrorKind kind = ex.getKind();
        if (kind == ErrorKind.INTERNAL) {
            log.error("Pipeline failure at stage {}", ex.getStage(), ex);
        } else if (kind.isRetryable()) {
            log.warn("Retryable pipeline failure: kind={}, stage={}, message={}", kind, ex.getStage(), ex.getMessage());
        } else {
            log.info("Pipeline request rejected: kind={}, stage={}", kind, ex.getStage());
        }
        ResponseEntity<Map<String, Object>> response =
                body(kind.status(), kind.name(), sanitizeExceptionMessage(ex.getMessage()), ex.getStage());
        response.getBody().put("retryable", kind.isRetryable());
        return response;
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .orElse("Invalid request");
        return body(HttpStatus.BAD_REQUEST, ErrorKind.INVALID_QUERY.name(), sanitizeExceptionMessage(message), "validation");
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        log.debug("Unreadable request body: {}", ex.getMessage());
        return body(HttpStatus.BAD_REQUEST, ErrorKind.INVALID_QUERY.name(), "Malformed request body", "validation");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException ex) {
        return body(HttpStatus.BAD_REQUEST, ErrorKind.INVALID_QUERY.name(), sanitizeExceptionMessage(ex.getMessage()), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnhandled(Exception ex) {
        log.error("Unhandled exception", ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, ErrorKind.INTERNAL.name(), "Internal server error", null);
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String error, String message, String stage) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        if (stage != null) {
            body.put("stage", stage);
        }
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.status(status).body(body);
    }

    // Never echo paths, class names or stack-trace fragments back to the caller.
    static String sanitizeExceptionMessage(String message) {
        if (message == null || message.isBlank()) {
            return "Invalid request";
        }
        if (message.contains("/") || message.contains("\\")
                || message.contains("Exception") || message.contains("at ")
                || PACKAGE_PATTERN.matcher(message).find()
                || message.length() > 200) {
            return "Invalid request";
        }
        return message;
    }
}
