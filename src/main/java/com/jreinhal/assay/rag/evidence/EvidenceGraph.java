package com.jreinhal.assay.rag.evidence;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structured evidence for one question: experiments (oldest first) with their variants, conditions
 * and excerpt-backed measurements, plus the insights that mention the target metrics. Serialized
 * as-is into the generation prompt.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EvidenceGraph(String question,
                            List<String> projectIds,
                            List<String> targetMetrics,
                            List<ExperimentNode> experiments,
                            List<InsightRef> insightsUsed,
                            List<String> diagnostics) {

    public EvidenceGraph {
        projectIds = List.copyOf(projectIds);
        targetMetrics = List.copyOf(targetMetrics);
        experiments = List.copyOf(experiments);
        insightsUsed = List.copyOf(insightsUsed);
        diagnostics = List.copyOf(diagnostics);
    }

    public static EvidenceGraph empty(String question, List<String> projectIds, String diagnostic) {
        return new EvidenceGraph(question, projectIds, List.of(), List.of(), List.of(), List.of(diagnostic));
    }

    @JsonIgnore
    public boolean isEmpty() {
        return experiments.isEmpty() && insightsUsed.isEmpty();
    }

    @JsonIgnore
    public int measurementCount() {
        return experiments.stream().mapToInt(ExperimentNode::measurementCount).sum();
    }

    @JsonIgnore
    public List<MeasurementNode> allMeasurements() {
        return experiments.stream()
                .flatMap(e -> e.variants().stream())
                .flatMap(v -> v.measurements().stream())
                .toList();
    }

    /**
     * Source documents referenced anywhere in the graph.
     */
    @JsonIgnore
    public Set<String> documentIds() {
        Set<String> ids = new LinkedHashSet<>();
        experiments.forEach(e -> ids.addAll(e.docIds()));
        insightsUsed.stream().map(InsightRef::docId).filter(id -> id != null).forEach(ids::add);
        return ids;
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record ExperimentNode(String experimentId,
                                 String projectId,
                                 String title,
                                 String objective,
                                 String hypothesis,
                                 LocalDate evidenceDate,
                                 List<String> docIds,
                                 List<VariantNode> variants) {

        public ExperimentNode {
            docIds = List.copyOf(docIds);
            variants = List.copyOf(variants);
        }

        @JsonIgnore
        public int measurementCount() {
            return variants.stream().mapToInt(v -> v.measurements().size()).sum();
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record VariantNode(String variantId,
                              String label,
                              Map<String, String> conditions,
                              List<MeasurementNode> measurements) {

        public VariantNode {
            conditions = Map.copyOf(conditions);
            measurements = List.copyOf(measurements);
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record MeasurementNode(String measurementId,
                                  String metric,
                                  String rawMetricName,
                                  double value,
                                  String unit,
                                  Double valueCanonical,
                                  String unitCanonical,
                                  String confidence,
                                  String excerpt) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record InsightRef(String id, String title, String category, String docId, boolean verified) {
    }
}
