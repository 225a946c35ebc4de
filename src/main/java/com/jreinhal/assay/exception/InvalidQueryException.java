package com.jreinhal.assay.exception;

public class InvalidQueryException extends RagException {

    public InvalidQueryException(String message) {
        super(ErrorKind.INVALID_QUERY, message, "validation");
    }
}
