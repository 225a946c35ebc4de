package com.jreinhal.assay.exception;

public class RetrievalUnavailableException extends RagException {

    public RetrievalUnavailableException(String message, Throwable cause) {
        super(ErrorKind.RETRIEVAL_UNAVAILABLE, message, "retrieval", cause);
    }
}
