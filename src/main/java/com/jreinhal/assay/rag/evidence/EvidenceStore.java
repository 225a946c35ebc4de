package com.jreinhal.assay.rag.evidence;

import com.jreinhal.assay.model.Experiment;
import com.jreinhal.assay.model.ExperimentCondition;
import com.jreinhal.assay.model.ExperimentVariant;
import com.jreinhal.assay.model.Insight;
import com.jreinhal.assay.model.Measurement;
import com.jreinhal.assay.model.ProjectScope;
import java.util.Collection;
import java.util.List;

/**
 * Read access to structured experiment data. Every lookup that returns project-owned records takes
 * the scope and must not return records outside it; soft-deleted records are never returned.
 */
public interface EvidenceStore {

    /**
     * Measurements of any of the metric names, restricted to live experiments inside the scope.
     */
    List<Measurement> findMeasurementsByMetrics(Collection<String> metricNames, ProjectScope scope);

    List<Experiment> findExperiments(Collection<String> experimentIds, ProjectScope scope);

    List<Experiment> findExperimentsBySourceDocuments(Collection<String> documentIds, ProjectScope scope);

    List<ExperimentVariant> findVariants(Collection<String> experimentIds);

    List<Measurement> findMeasurements(Collection<String> experimentIds);

    List<ExperimentCondition> findConditions(Collection<String> experimentIds);

    /**
     * Insights whose title or content mention any of the terms.
     */
    List<Insight> findInsights(Collection<String> terms, ProjectScope scope, int limit);
}
