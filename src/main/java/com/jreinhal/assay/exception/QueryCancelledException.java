package com.jreinhal.assay.exception;

public class QueryCancelledException extends RagException {

    public QueryCancelledException(String stage) {
        super(ErrorKind.CANCELLED, "Query was cancelled", stage);
    }
}
