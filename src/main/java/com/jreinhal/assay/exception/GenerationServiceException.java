package com.jreinhal.assay.exception;

/**
 * Failure of the external text generator, already classified into rate limit,
 * exhausted quota or plain unavailability.
 */
public class GenerationServiceException extends RagException {

    public GenerationServiceException(ErrorKind kind, String message, Throwable cause) {
        super(kind, message, "generation", cause);
        if (kind != ErrorKind.GENERATION_RATE_LIMITED
                && kind != ErrorKind.GENERATION_QUOTA_EXHAUSTED
                && kind != ErrorKind.GENERATION_UNAVAILABLE) {
            throw new IllegalArgumentException("Not a generation error kind: " + kind);
        }
    }
}
