package com.jreinhal.assay.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.jreinhal.assay.rag.answer.AnswerResult;
import com.jreinhal.assay.rag.answer.CitedSource;
import com.jreinhal.assay.rag.critical.CriticalDocument;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AnswerResponse(String responseText,
                             List<CitationView> citations,
                             int chunksUsed,
                             boolean verified,
                             List<String> verificationIssues,
                             String outcome,
                             Map<String, Object> intent,
                             String complexity,
                             List<CriticalDocumentView> criticalDocuments,
                             List<String> diagnostics,
                             long latencyMs,
                             String traceId) {

    public static AnswerResponse from(AnswerResult result) {
        return new AnswerResponse(result.responseText(),
                result.citations().stream().map(CitationView::from).toList(),
                result.chunksUsed(),
                result.verified(),
                result.verificationIssues(),
                result.outcome().name(),
                result.intent() != null ? result.intent().toMap() : Map.of(),
                result.intent() != null ? result.intent().tier().name().toLowerCase(Locale.ROOT) : null,
                result.criticalDocuments().stream().map(CriticalDocumentView::from).toList(),
                result.diagnostics(),
                result.latencyMs(),
                result.traceId());
    }

    public record CitationView(int citation, String type, String id, String title, String project, String excerpt) {

        static CitationView from(CitedSource source) {
            return new CitationView(source.citation(), source.type(), source.id(), source.title(), source.project(),
                    source.excerpt());
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record CriticalDocumentView(String docId, int score, String reason) {

        static CriticalDocumentView from(CriticalDocument doc) {
            return new CriticalDocumentView(doc.docId(), doc.score(), doc.reason());
        }
    }
}
