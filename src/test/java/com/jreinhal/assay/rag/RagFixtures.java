package com.jreinhal.assay.rag;

import com.jreinhal.assay.model.Chunk;
import com.jreinhal.assay.rag.evidence.EvidenceGraph;
import com.jreinhal.assay.rag.evidence.EvidenceGraph.ExperimentNode;
import com.jreinhal.assay.rag.evidence.EvidenceGraph.MeasurementNode;
import com.jreinhal.assay.rag.evidence.EvidenceGraph.VariantNode;
import com.jreinhal.assay.rag.intent.ComplexityTier;
import com.jreinhal.assay.rag.intent.EvidenceMode;
import com.jreinhal.assay.rag.intent.QueryIntent;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Shared builders for answer pipeline tests.
 */
public final class RagFixtures {

    private RagFixtures() {
    }

    public static QueryIntent intent(ComplexityTier tier, EvidenceMode mode) {
        return new QueryIntent(false, false, false, false, true, List.of(), List.of(), List.of(), null, 0, tier, mode);
    }

    public static QueryIntent interpretiveIntent() {
        return new QueryIntent(false, false, true, false, true, List.of("what it demonstrated"), List.of(), List.of(),
                null, 2, ComplexityTier.STANDARD, EvidenceMode.FULL);
    }

    public static QueryIntent navigationalIntent() {
        return new QueryIntent(false, false, false, true, false, List.of(), List.of(), List.of(), null, 0,
                ComplexityTier.SIMPLE, EvidenceMode.CHUNK_ONLY);
    }

    /**
     * One experiment on {@code doc-1} with flexural strength 131.5 MPa and modulus 8.2 GPa (8200 MPa).
     */
    public static EvidenceGraph flexuralGraph() {
        return new EvidenceGraph("What is the flexural strength?", List.of("p1"),
                List.of("flexural_strength", "elastic_modulus"),
                List.of(new ExperimentNode("e1", "p1", "Filler series", "Raise filler load", null,
                        LocalDate.of(2024, 2, 1), List.of("doc-1"),
                        List.of(new VariantNode("v60", "60 wt% filler", Map.of("cure_time", "20 s"), List.of(
                                new MeasurementNode("m1", "flexural_strength", "FS", 131.5, "MPa", 131.5, "MPa", "high",
                                        "FS 131.5 MPa"),
                                new MeasurementNode("m2", "elastic_modulus", "E", 8.2, "GPa", 8200.0, "MPa", "high",
                                        "E = 8.2 GPa")))))),
                List.of(new EvidenceGraph.InsightRef("i1", "Strength peaks at 60 wt%", "finding", "doc-1", true)),
                List.of());
    }

    public static Chunk chunk(String chunkId, String sourceId, String text) {
        return new Chunk(chunkId, "p1", "Resins", "document", sourceId, "Report " + sourceId, text, 0, null,
                0.5, 0.5, 0.5);
    }
}
