package com.jreinhal.assay.rag.evidence;

import com.jreinhal.assay.model.Chunk;
import com.jreinhal.assay.model.Experiment;
import com.jreinhal.assay.model.ExperimentCondition;
import com.jreinhal.assay.model.ExperimentVariant;
import com.jreinhal.assay.model.Insight;
import com.jreinhal.assay.model.Measurement;
import com.jreinhal.assay.model.ProjectScope;
import com.jreinhal.assay.rag.evidence.EvidenceGraph.ExperimentNode;
import com.jreinhal.assay.rag.evidence.EvidenceGraph.InsightRef;
import com.jreinhal.assay.rag.evidence.EvidenceGraph.MeasurementNode;
import com.jreinhal.assay.rag.evidence.EvidenceGraph.VariantNode;
import com.jreinhal.assay.reasoning.ReasoningStep.StepType;
import com.jreinhal.assay.reasoning.ReasoningTracer;
import com.jreinhal.assay.util.LogSanitizer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Assembles the {@link EvidenceGraph} for a question.
 *
 * <p>Each level (experiments, then variants, measurements and conditions) is fetched in one batch
 * and grouped by id before the graph is folded together, so the store sees a fixed number of
 * queries regardless of graph size. Measurements whose excerpt does not show their value are left
 * out, and an experiment without any remaining measurement is left out with them.</p>
 */
@Service
public class EvidenceGraphBuilder {
    private static final Logger log = LoggerFactory.getLogger(EvidenceGraphBuilder.class);
    static final String DEFAULT_VARIANT = "default";
    private static final String EXPERIMENT_SOURCE = "experiment";

    private final EvidenceStore evidenceStore;
    private final ReasoningTracer reasoningTracer;

    @Value("${assay.evidence.max-insights:10}")
    private int maxInsights = 10;

    public EvidenceGraphBuilder(EvidenceStore evidenceStore, ReasoningTracer reasoningTracer) {
        this.evidenceStore = evidenceStore;
        this.reasoningTracer = reasoningTracer;
    }

    public EvidenceGraph build(EvidenceRequest request) {
        long start = System.currentTimeMillis();
        ProjectScope scope = request.scope();
        List<String> diagnostics = new ArrayList<>();

        // level 1: which experiments
        Set<String> experimentIds = new LinkedHashSet<>();
        Set<String> metricsWithData = new LinkedHashSet<>();
        if (!request.targetMetrics().isEmpty()) {
            for (Measurement m : this.evidenceStore.findMeasurementsByMetrics(request.metricNames(), scope)) {
                if (m.getExperimentId() != null) {
                    experimentIds.add(m.getExperimentId());
                    metricsWithData.add(m.getMetric());
                }
            }
        }
        List<Experiment> experiments = new ArrayList<>(this.evidenceStore.findExperiments(experimentIds, scope));
        if (request.targetMetrics().isEmpty()) {
            experiments.addAll(chunkLinkedExperiments(request.chunks(), scope));
            if (experiments.isEmpty()) {
                diagnostics.add("no target metrics resolved and no retrieved source is linked to an experiment");
            }
        }
        Map<String, Experiment> experimentsById = new LinkedHashMap<>();
        for (Experiment experiment : experiments) {
            if (scope.permits(experiment.getProjectId()) && experiment.getDeletedAt() == null) {
                experimentsById.putIfAbsent(experiment.getId(), experiment);
            }
        }

        // level 2: children of all kept experiments in one batch each
        Set<String> keptIds = experimentsById.keySet();
        Map<String, List<ExperimentVariant>> variantsByExperiment = groupBy(this.evidenceStore.findVariants(keptIds),
                ExperimentVariant::getExperimentId);
        Map<String, List<Measurement>> measurementsByExperiment = groupBy(this.evidenceStore.findMeasurements(keptIds),
                Measurement::getExperimentId);
        Map<String, List<ExperimentCondition>> conditionsByExperiment = groupBy(this.evidenceStore.findConditions(keptIds),
                ExperimentCondition::getExperimentId);

        int excluded = 0;
        List<ExperimentNode> nodes = new ArrayList<>();
        for (Experiment experiment : experimentsById.values()) {
            List<Measurement> valid = new ArrayList<>();
            for (Measurement m : measurementsByExperiment.getOrDefault(experiment.getId(), List.of())) {
                if (ExcerptValidator.containsValue(m.getSourceExcerpt(), m.getValue())) {
                    valid.add(m);
                } else {
                    excluded++;
                }
            }
            if (valid.isEmpty()) {
                diagnostics.add("experiment " + experiment.getId() + " has no measurement backed by a source excerpt");
                continue;
            }
            nodes.add(foldExperiment(experiment, valid,
                    variantsByExperiment.getOrDefault(experiment.getId(), List.of()),
                    conditionsByExperiment.getOrDefault(experiment.getId(), List.of())));
        }
        nodes.sort(Comparator.comparing(ExperimentNode::evidenceDate, Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing(ExperimentNode::experimentId));
        if (excluded > 0) {
            diagnostics.add(excluded + " measurements excluded: value not found in source excerpt");
        }
        for (String metric : request.targetMetrics()) {
            if (!metricsWithData.contains(metric)) {
                diagnostics.add("no measurements recorded for metric " + metric);
            }
        }

        List<InsightRef> insights = insights(request, scope);
        if (insights.isEmpty()) {
            diagnostics.add("no insights matched the question");
        }

        EvidenceGraph graph = new EvidenceGraph(request.question(), List.copyOf(scope.projectIds()),
                request.targetMetrics(), nodes, insights, diagnostics);
        long elapsed = System.currentTimeMillis() - start;
        log.info("Evidence graph for query {}: {} experiments, {} measurements ({} excluded), {} insights, {}ms",
                LogSanitizer.querySummary(request.question()), nodes.size(), graph.measurementCount(), excluded,
                insights.size(), elapsed);
        this.reasoningTracer.addStep(StepType.EVIDENCE_GRAPH, "Evidence graph",
                nodes.size() + " experiments, " + insights.size() + " insights", elapsed,
                Map.of("experiments", nodes.size(), "measurements", graph.measurementCount(),
                        "excludedMeasurements", excluded, "insights", insights.size()));
        return graph;
    }

    private List<Experiment> chunkLinkedExperiments(List<Chunk> chunks, ProjectScope scope) {
        Set<String> experimentIds = new LinkedHashSet<>();
        Set<String> documentIds = new LinkedHashSet<>();
        for (Chunk chunk : chunks) {
            if (chunk.sourceId() == null) {
                continue;
            }
            if (EXPERIMENT_SOURCE.equals(chunk.sourceType())) {
                experimentIds.add(chunk.sourceId());
            } else {
                documentIds.add(chunk.sourceId());
            }
        }
        List<Experiment> linked = new ArrayList<>(this.evidenceStore.findExperiments(experimentIds, scope));
        linked.addAll(this.evidenceStore.findExperimentsBySourceDocuments(documentIds, scope));
        return linked;
    }

    private static ExperimentNode foldExperiment(Experiment experiment, List<Measurement> measurements,
                                                 List<ExperimentVariant> variants, List<ExperimentCondition> conditions) {
        Map<String, String> labels = new LinkedHashMap<>();
        for (ExperimentVariant variant : variants) {
            labels.put(variant.getId(), variant.getLabel());
        }
        Map<String, String> sharedConditions = new LinkedHashMap<>();
        Map<String, Map<String, String>> variantConditions = new LinkedHashMap<>();
        for (ExperimentCondition condition : conditions) {
            if (condition.getVariantId() == null) {
                sharedConditions.put(condition.getKey(), condition.getValue());
            } else {
                variantConditions.computeIfAbsent(condition.getVariantId(), k -> new LinkedHashMap<>())
                        .put(condition.getKey(), condition.getValue());
            }
        }
        Map<String, List<MeasurementNode>> byVariant = new LinkedHashMap<>();
        for (Measurement m : measurements) {
            String variantId = m.getVariantId() != null && labels.containsKey(m.getVariantId()) ? m.getVariantId() : DEFAULT_VARIANT;
            byVariant.computeIfAbsent(variantId, k -> new ArrayList<>()).add(new MeasurementNode(m.getId(), m.getMetric(),
                    m.getRawMetricName(), m.getValue(), m.getUnit(), m.getValueCanonical(), m.getUnitCanonical(),
                    m.getConfidence(), m.getSourceExcerpt()));
        }
        List<VariantNode> variantNodes = new ArrayList<>(byVariant.size());
        byVariant.forEach((variantId, nodes) -> {
            Map<String, String> merged = new LinkedHashMap<>(sharedConditions);
            merged.putAll(variantConditions.getOrDefault(variantId, Map.of()));
            merged.values().removeIf(v -> v == null);
            merged.keySet().removeIf(k -> k == null);
            variantNodes.add(new VariantNode(variantId, labels.getOrDefault(variantId, variantId), merged, nodes));
        });
        List<String> docIds = experiment.getSourceFileId() != null ? List.of(experiment.getSourceFileId()) : List.of();
        return new ExperimentNode(experiment.getId(), experiment.getProjectId(), experiment.getTitle(),
                experiment.getObjective(), experiment.getHypothesis(), experiment.getEvidenceDate(), docIds, variantNodes);
    }

    private List<InsightRef> insights(EvidenceRequest request, ProjectScope scope) {
        Set<String> terms = new LinkedHashSet<>();
        for (String name : request.metricNames()) {
            terms.add(name.replace('_', ' '));
        }
        if (terms.isEmpty()) {
            return List.of();
        }
        List<InsightRef> refs = new ArrayList<>();
        for (Insight insight : this.evidenceStore.findInsights(terms, scope, this.maxInsights)) {
            if (!scope.permits(insight.getProjectId()) || insight.getDeletedAt() != null) {
                continue;
            }
            refs.add(new InsightRef(insight.getId(), insight.getTitle(), insight.getCategory(),
                    insight.getSourceFileId(), insight.isVerified()));
        }
        return refs;
    }

    private static <T> Map<String, List<T>> groupBy(Collection<T> items, Function<T, String> key) {
        Map<String, List<T>> grouped = new LinkedHashMap<>();
        for (T item : items) {
            String k = key.apply(item);
            if (k != null) {
                grouped.computeIfAbsent(k, x -> new ArrayList<>()).add(item);
            }
        }
        return grouped;
    }

    /**
     * @param metricNames canonical keys plus every alias they are stored under
     */
    public record EvidenceRequest(String question,
                                  List<String> targetMetrics,
                                  Set<String> metricNames,
                                  ProjectScope scope,
                                  List<Chunk> chunks) {

        public EvidenceRequest {
            targetMetrics = List.copyOf(targetMetrics);
            metricNames = Set.copyOf(metricNames);
            chunks = List.copyOf(chunks);
        }
    }
}
