package com.jreinhal.assay.rag.critical;

import com.jreinhal.assay.config.AnswerProperties;
import com.jreinhal.assay.rag.evidence.EvidenceGraph;
import com.jreinhal.assay.rag.evidence.EvidenceGraph.ExperimentNode;
import com.jreinhal.assay.rag.evidence.EvidenceGraph.InsightRef;
import com.jreinhal.assay.reasoning.ReasoningStep.StepType;
import com.jreinhal.assay.reasoning.ReasoningTracer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Ranks the source documents that carry the most weight for an answer.
 *
 * <p>Score per document: +3 for each verified insight drawn from it, +1 for each unverified one,
 * and for each experiment citing it +2 per measurement, counting at most
 * {@code measurementCap} measurements per experiment. Ties keep document id order.</p>
 */
@Service
public class CriticalDocumentSelector {
    private static final Logger log = LoggerFactory.getLogger(CriticalDocumentSelector.class);
    static final int VERIFIED_INSIGHT = 3;
    static final int UNVERIFIED_INSIGHT = 1;
    static final int PER_MEASUREMENT = 2;

    private final ReasoningTracer reasoningTracer;
    private final AnswerProperties answerProperties;

    @Value("${assay.critical.measurement-cap:3}")
    private int measurementCap = 3;

    public CriticalDocumentSelector(ReasoningTracer reasoningTracer, AnswerProperties answerProperties) {
        this.reasoningTracer = reasoningTracer;
        this.answerProperties = answerProperties;
    }

    /**
     * Scores with the insights already attached to the graph as seeds.
     */
    public List<CriticalDocument> select(EvidenceGraph graph) {
        List<InsightSeed> seeds = graph.insightsUsed().stream()
                .map(InsightSeed::of)
                .toList();
        return select(graph, seeds);
    }

    public List<CriticalDocument> select(EvidenceGraph graph, List<InsightSeed> seeds) {
        long start = System.currentTimeMillis();
        Map<String, int[]> scores = new LinkedHashMap<>();
        Map<String, List<String>> reasons = new LinkedHashMap<>();

        for (InsightSeed seed : seeds) {
            if (seed.docId() == null) {
                continue;
            }
            if (seed.verified()) {
                add(scores, reasons, seed.docId(), VERIFIED_INSIGHT, "verified_insight");
            } else {
                add(scores, reasons, seed.docId(), UNVERIFIED_INSIGHT, "unverified_insight");
            }
        }
        for (ExperimentNode experiment : graph.experiments()) {
            int count = experiment.measurementCount();
            if (count == 0) {
                continue;
            }
            int points = PER_MEASUREMENT * Math.min(count, this.measurementCap);
            for (String docId : experiment.docIds()) {
                add(scores, reasons, docId, points, "has_" + count + "_measurements");
            }
        }

        List<CriticalDocument> ranked = new ArrayList<>(scores.size());
        scores.forEach((docId, score) -> ranked.add(new CriticalDocument(docId, score[0], String.join(", ", reasons.get(docId)))));
        ranked.sort(Comparator.comparingInt(CriticalDocument::score).reversed()
                .thenComparing(CriticalDocument::docId));
        List<CriticalDocument> selected = ranked.stream().limit(this.answerProperties.getCriticalDocumentCap()).toList();

        long elapsed = System.currentTimeMillis() - start;
        log.debug("Critical documents: {} scored, {} selected", ranked.size(), selected.size());
        this.reasoningTracer.addStep(StepType.DOCUMENT_SELECTION, "Critical documents",
                selected.size() + " of " + ranked.size() + " documents", elapsed);
        return selected;
    }

    private static void add(Map<String, int[]> scores, Map<String, List<String>> reasons, String docId, int points,
                            String reason) {
        scores.computeIfAbsent(docId, k -> new int[1])[0] += points;
        reasons.computeIfAbsent(docId, k -> new ArrayList<>()).add(reason);
    }

    public record InsightSeed(String docId, boolean verified) {

        static InsightSeed of(InsightRef insight) {
            return new InsightSeed(insight.docId(), insight.verified());
        }
    }
}
