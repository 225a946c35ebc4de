package com.jreinhal.assay.exception;

import org.springframework.http.HttpStatus;

/**
 * Failure taxonomy of the answering pipeline. Each kind carries the HTTP status the
 * REST surface answers with and whether a caller may retry.
 */
public enum ErrorKind {
    INVALID_QUERY(HttpStatus.BAD_REQUEST, false),
    AUTHORIZATION(HttpStatus.FORBIDDEN, false),
    RETRIEVAL_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, true),
    GENERATION_RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS, true),
    GENERATION_QUOTA_EXHAUSTED(HttpStatus.PAYMENT_REQUIRED, true),
    GENERATION_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, true),
    GROUNDING_FAILED(HttpStatus.UNPROCESSABLE_ENTITY, false),
    CANCELLED(HttpStatus.SERVICE_UNAVAILABLE, true),
    INTERNAL(HttpStatus.INTERNAL_SERVER_ERROR, false);

    private final HttpStatus status;
    private final boolean retryable;

    ErrorKind(HttpStatus status, boolean retryable) {
        this.status = status;
        this.retryable = retryable;
    }

    public HttpStatus status() {
        return status;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
