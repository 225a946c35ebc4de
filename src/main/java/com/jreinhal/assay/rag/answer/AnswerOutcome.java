package com.jreinhal.assay.rag.answer;

public enum AnswerOutcome {
    /** Generated and numerically verified. */
    ANSWERED,
    /** Generated, but unverifiable values were withheld. */
    DEGRADED,
    /** Structured evidence was required and none was found; nothing was generated. */
    INSUFFICIENT_EVIDENCE,
    /** No source in scope matched the question; nothing was generated. */
    NO_RESULTS
}
