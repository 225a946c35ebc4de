package com.jreinhal.assay.rag.evidence;

import com.jreinhal.assay.model.Experiment;
import com.jreinhal.assay.model.ExperimentCondition;
import com.jreinhal.assay.model.ExperimentVariant;
import com.jreinhal.assay.model.Insight;
import com.jreinhal.assay.model.Measurement;
import com.jreinhal.assay.model.ProjectScope;
import com.jreinhal.assay.util.TextFolding;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * List-backed store for tests. Queries honour scope and soft deletion like the Mongo store.
 */
class InMemoryEvidenceStore implements EvidenceStore {
    final List<Experiment> experiments = new ArrayList<>();
    final List<ExperimentVariant> variants = new ArrayList<>();
    final List<Measurement> measurements = new ArrayList<>();
    final List<ExperimentCondition> conditions = new ArrayList<>();
    final List<Insight> insights = new ArrayList<>();

    @Override
    public List<Measurement> findMeasurementsByMetrics(Collection<String> metricNames, ProjectScope scope) {
        Set<String> inScope = experiments.stream()
                .filter(e -> scope.permits(e.getProjectId()) && e.getDeletedAt() == null)
                .map(Experiment::getId)
                .collect(Collectors.toSet());
        return measurements.stream()
                .filter(m -> metricNames.contains(m.getMetric()) && inScope.contains(m.getExperimentId()))
                .toList();
    }

    @Override
    public List<Experiment> findExperiments(Collection<String> experimentIds, ProjectScope scope) {
        return experiments.stream()
                .filter(e -> experimentIds.contains(e.getId()) && scope.permits(e.getProjectId()) && e.getDeletedAt() == null)
                .toList();
    }

    @Override
    public List<Experiment> findExperimentsBySourceDocuments(Collection<String> documentIds, ProjectScope scope) {
        return experiments.stream()
                .filter(e -> documentIds.contains(e.getSourceFileId()) && scope.permits(e.getProjectId()))
                .toList();
    }

    @Override
    public List<ExperimentVariant> findVariants(Collection<String> experimentIds) {
        return variants.stream().filter(v -> experimentIds.contains(v.getExperimentId())).toList();
    }

    @Override
    public List<Measurement> findMeasurements(Collection<String> experimentIds) {
        return measurements.stream().filter(m -> experimentIds.contains(m.getExperimentId())).toList();
    }

    @Override
    public List<ExperimentCondition> findConditions(Collection<String> experimentIds) {
        return conditions.stream().filter(c -> experimentIds.contains(c.getExperimentId())).toList();
    }

    @Override
    public List<Insight> findInsights(Collection<String> terms, ProjectScope scope, int limit) {
        return insights.stream()
                .filter(i -> terms.stream().anyMatch(t -> TextFolding.fold(i.getTitle()).contains(t)))
                .limit(limit)
                .toList();
    }

    Experiment experiment(String id, String projectId, String sourceFileId, LocalDate evidenceDate) {
        Experiment e = new Experiment();
        e.setId(id);
        e.setProjectId(projectId);
        e.setSourceFileId(sourceFileId);
        e.setTitle("Experiment " + id);
        e.setEvidenceDate(evidenceDate);
        experiments.add(e);
        return e;
    }

    Measurement measurement(String id, String experimentId, String metric, double value, String unit, String excerpt) {
        Measurement m = new Measurement();
        m.setId(id);
        m.setExperimentId(experimentId);
        m.setMetric(metric);
        m.setRawMetricName(metric);
        m.setValue(value);
        m.setUnit(unit);
        m.setSourceExcerpt(excerpt);
        measurements.add(m);
        return m;
    }

    Insight insight(String id, String projectId, String title, String sourceFileId, boolean verified) {
        Insight i = new Insight();
        i.setId(id);
        i.setProjectId(projectId);
        i.setTitle(title);
        i.setSourceFileId(sourceFileId);
        if (verified) {
            i.setValidatedAt(Instant.parse("2024-05-01T00:00:00Z"));
        }
        insights.add(i);
        return i;
    }
}
