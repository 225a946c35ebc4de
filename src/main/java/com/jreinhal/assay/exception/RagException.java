package com.jreinhal.assay.exception;

/**
 * Base failure of the answering pipeline. The message is safe to show to a caller;
 * causes stay server-side.
 */
public class RagException extends RuntimeException {
    private final ErrorKind kind;
    private String stage;

    public RagException(ErrorKind kind, String message) {
        this(kind, message, null, null);
    }

    public RagException(ErrorKind kind, String message, String stage) {
        this(kind, message, stage, null);
    }

    public RagException(ErrorKind kind, String message, String stage, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.stage = stage;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getStage() {
        return stage;
    }

    /**
     * Records the pipeline stage when the thrower did not know it.
     */
    public RagException atStage(String stage) {
        if (this.stage == null) {
            this.stage = stage;
        }
        return this;
    }
}
