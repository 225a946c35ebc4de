package com.jreinhal.assay.rag.answer;

import com.jreinhal.assay.config.AnswerProperties;
import com.jreinhal.assay.model.Chunk;
import com.jreinhal.assay.rag.critical.CriticalDocument;
import com.jreinhal.assay.rag.evidence.EvidenceGraph;
import com.jreinhal.assay.rag.evidence.EvidenceGraph.ExperimentNode;
import com.jreinhal.assay.rag.evidence.EvidenceGraph.InsightRef;
import com.jreinhal.assay.rag.evidence.EvidenceGraph.MeasurementNode;
import com.jreinhal.assay.rag.evidence.EvidenceGraph.VariantNode;
import com.jreinhal.assay.util.NumberFormats;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.StringJoiner;
import org.springframework.stereotype.Component;

/**
 * Numbers the sources the generator may cite: retrieved chunks first, in rank order, then critical
 * documents that no chunk already covers. Critical documents are described by the experiment
 * measurements and insights that point at them.
 */
@Component
public class CitationPlanner {
    static final String DOCUMENT_TYPE = "document";
    static final String CHUNK_TYPE = "chunk";

    private final AnswerProperties properties;

    public CitationPlanner(AnswerProperties properties) {
        this.properties = properties;
    }

    public List<Citation> plan(List<Chunk> chunks, List<CriticalDocument> criticalDocuments, EvidenceGraph graph) {
        List<Citation> citations = new ArrayList<>(chunks.size() + criticalDocuments.size());
        Set<String> covered = new HashSet<>();
        for (Chunk chunk : chunks) {
            String id = chunk.sourceId() != null ? chunk.sourceId() : chunk.chunkId();
            String type = chunk.sourceType() != null ? chunk.sourceType() : CHUNK_TYPE;
            citations.add(new Citation(citations.size() + 1, type, id, chunk.title(), chunk.projectName(),
                    truncate(chunk.text())));
            covered.add(id);
        }
        for (CriticalDocument doc : criticalDocuments) {
            if (!covered.add(doc.docId())) {
                continue;
            }
            citations.add(describe(citations.size() + 1, doc.docId(), graph));
        }
        return citations;
    }

    private Citation describe(int number, String docId, EvidenceGraph graph) {
        String title = null;
        String project = null;
        StringJoiner text = new StringJoiner("\n");
        for (ExperimentNode experiment : graph.experiments()) {
            if (!experiment.docIds().contains(docId)) {
                continue;
            }
            if (title == null) {
                title = experiment.title();
                project = experiment.projectId();
            }
            text.add("Experiment: " + experiment.title());
            for (VariantNode variant : experiment.variants()) {
                for (MeasurementNode m : variant.measurements()) {
                    text.add("- " + variant.label() + " / " + m.metric() + " = " + NumberFormats.plain(m.value())
                            + (m.unit() != null ? " " + m.unit() : "") + ": \"" + m.excerpt() + "\"");
                }
            }
        }
        for (InsightRef insight : graph.insightsUsed()) {
            if (docId.equals(insight.docId())) {
                if (title == null) {
                    title = insight.title();
                }
                text.add("Insight" + (insight.verified() ? " (verified)" : "") + ": " + insight.title());
            }
        }
        return new Citation(number, DOCUMENT_TYPE, docId, title != null ? title : docId, project, truncate(text.toString()));
    }

    private String truncate(String text) {
        int max = this.properties.getSourceTextMaxChars();
        if (text == null || text.length() <= max) {
            return text;
        }
        return text.substring(0, max) + "...";
    }
}
