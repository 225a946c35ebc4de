package com.jreinhal.assay.exception;

import java.util.List;

public class GroundingFailedException extends RagException {
    private final List<String> issues;

    public GroundingFailedException(List<String> issues) {
        super(ErrorKind.GROUNDING_FAILED, "Answer contains values that could not be traced to evidence", "assembly");
        this.issues = List.copyOf(issues);
    }

    public List<String> getIssues() {
        return issues;
    }
}
