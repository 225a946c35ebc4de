package com.jreinhal.assay.service;

import com.jreinhal.assay.model.ConversationTurn;
import com.jreinhal.assay.rag.alias.AliasResolution;
import com.jreinhal.assay.rag.alias.AliasResolver;
import com.jreinhal.assay.rag.intent.QueryIntent;
import com.jreinhal.assay.rag.intent.QueryIntentClassifier;
import com.jreinhal.assay.rag.normalize.QueryTermExtractor;
import com.jreinhal.assay.rag.normalize.QueryTermExtractor.ExtractedTerms;
import com.jreinhal.assay.rag.normalize.Term;
import com.jreinhal.assay.reasoning.ReasoningStep.StepType;
import com.jreinhal.assay.reasoning.ReasoningTracer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Service;

/**
 * Query understanding: term extraction, alias resolution of the metric candidates and intent
 * classification. Resolved canonical keys become the target metrics; everything else is only
 * reported.
 */
@Service
public class QueryAnalyzer {
    private final QueryTermExtractor termExtractor;
    private final AliasResolver aliasResolver;
    private final QueryIntentClassifier intentClassifier;
    private final ReasoningTracer reasoningTracer;

    public QueryAnalyzer(QueryTermExtractor termExtractor, AliasResolver aliasResolver,
                         QueryIntentClassifier intentClassifier, ReasoningTracer reasoningTracer) {
        this.termExtractor = termExtractor;
        this.aliasResolver = aliasResolver;
        this.intentClassifier = intentClassifier;
        this.reasoningTracer = reasoningTracer;
    }

    public QueryAnalysis analyze(String query, List<ConversationTurn> history) {
        long start = System.currentTimeMillis();
        ExtractedTerms terms = this.termExtractor.extract(query);
        this.reasoningTracer.addStep(StepType.QUERY_ANALYSIS, "Term extraction",
                terms.metricCandidates().size() + " metric candidates, " + terms.valueTerms().size() + " values",
                System.currentTimeMillis() - start);

        long resolveStart = System.currentTimeMillis();
        List<AliasResolution> resolutions = this.aliasResolver.resolveAll(terms.metricCandidates());
        Set<String> targetMetrics = new LinkedHashSet<>();
        Set<String> metricNames = new LinkedHashSet<>();
        List<String> notes = new ArrayList<>();
        for (AliasResolution resolution : resolutions) {
            if (resolution.isResolved()) {
                if (targetMetrics.add(resolution.canonicalKey())) {
                    metricNames.addAll(this.aliasResolver.namesFor(resolution.canonicalKey()));
                }
            } else if (resolution.status() == AliasResolution.Status.AMBIGUOUS) {
                notes.add("term '" + resolution.term().normalized() + "' is ambiguous: " + resolution.reason());
            }
        }
        for (Term value : terms.valueTerms()) {
            if (value.isRangeSkipped()) {
                notes.add("range '" + value.original() + "' left unconverted");
            }
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("targetMetrics", List.copyOf(targetMetrics));
        data.put("candidates", resolutions.size());
        this.reasoningTracer.addStep(StepType.ALIAS_RESOLUTION, "Alias resolution",
                targetMetrics.size() + " of " + resolutions.size() + " terms resolved",
                System.currentTimeMillis() - resolveStart, data);

        QueryIntent intent = this.intentClassifier.classify(query, history, targetMetrics.size());
        return new QueryAnalysis(terms, resolutions, List.copyOf(targetMetrics), metricNames, intent, notes);
    }

    /**
     * @param metricNames every stored name of the target metrics, used to look up measurements
     */
    public record QueryAnalysis(ExtractedTerms terms,
                                List<AliasResolution> resolutions,
                                List<String> targetMetrics,
                                Set<String> metricNames,
                                QueryIntent intent,
                                List<String> notes) {

        public QueryAnalysis {
            resolutions = List.copyOf(resolutions);
            targetMetrics = List.copyOf(targetMetrics);
            metricNames = Set.copyOf(metricNames);
            notes = List.copyOf(notes);
        }
    }
}
