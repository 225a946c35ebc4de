package com.jreinhal.assay.exception;

public class AuthorizationException extends RagException {

    public AuthorizationException(String message) {
        super(ErrorKind.AUTHORIZATION, message, "validation");
    }
}
