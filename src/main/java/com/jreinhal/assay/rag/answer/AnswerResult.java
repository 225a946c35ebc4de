package com.jreinhal.assay.rag.answer;

import com.jreinhal.assay.rag.critical.CriticalDocument;
import com.jreinhal.assay.rag.intent.QueryIntent;
import java.util.List;

/**
 * Final outcome of one answer request. {@code intent} is {@code null} only when the request failed
 * before classification.
 */
public record AnswerResult(String responseText,
                           List<CitedSource> citations,
                           int chunksUsed,
                           boolean verified,
                           List<String> verificationIssues,
                           AnswerOutcome outcome,
                           QueryIntent intent,
                           List<CriticalDocument> criticalDocuments,
                           List<String> diagnostics,
                           long latencyMs,
                           String traceId) {

    public AnswerResult {
        citations = List.copyOf(citations);
        verificationIssues = List.copyOf(verificationIssues);
        criticalDocuments = List.copyOf(criticalDocuments);
        diagnostics = List.copyOf(diagnostics);
    }
}
