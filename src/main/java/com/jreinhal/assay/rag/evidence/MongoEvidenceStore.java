package com.jreinhal.assay.rag.evidence;

import com.jreinhal.assay.model.Experiment;
import com.jreinhal.assay.model.ExperimentCondition;
import com.jreinhal.assay.model.ExperimentVariant;
import com.jreinhal.assay.model.Insight;
import com.jreinhal.assay.model.Measurement;
import com.jreinhal.assay.model.ProjectScope;
import com.jreinhal.assay.repository.ExperimentConditionRepository;
import com.jreinhal.assay.repository.ExperimentRepository;
import com.jreinhal.assay.repository.ExperimentVariantRepository;
import com.jreinhal.assay.repository.MeasurementRepository;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

@Component
public class MongoEvidenceStore implements EvidenceStore {
    private final ExperimentRepository experimentRepository;
    private final ExperimentVariantRepository variantRepository;
    private final MeasurementRepository measurementRepository;
    private final ExperimentConditionRepository conditionRepository;
    private final MongoTemplate mongoTemplate;

    public MongoEvidenceStore(ExperimentRepository experimentRepository,
                              ExperimentVariantRepository variantRepository,
                              MeasurementRepository measurementRepository,
                              ExperimentConditionRepository conditionRepository,
                              MongoTemplate mongoTemplate) {
        this.experimentRepository = experimentRepository;
        this.variantRepository = variantRepository;
        this.measurementRepository = measurementRepository;
        this.conditionRepository = conditionRepository;
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public List<Measurement> findMeasurementsByMetrics(Collection<String> metricNames, ProjectScope scope) {
        if (metricNames.isEmpty() || scope.isEmpty()) {
            return List.of();
        }
        Query inScope = new Query(new Criteria().andOperator(
                Criteria.where("projectId").in(scope.projectIds()),
                Criteria.where("deletedAt").is(null)));
        inScope.fields().include("_id");
        List<String> experimentIds = this.mongoTemplate.find(inScope, Experiment.class).stream()
                .map(Experiment::getId)
                .toList();
        if (experimentIds.isEmpty()) {
            return List.of();
        }
        return this.measurementRepository.findByMetricInAndExperimentIdIn(metricNames, experimentIds);
    }

    @Override
    public List<Experiment> findExperiments(Collection<String> experimentIds, ProjectScope scope) {
        if (experimentIds.isEmpty() || scope.isEmpty()) {
            return List.of();
        }
        return this.experimentRepository.findByIdInAndProjectIdInAndDeletedAtIsNull(experimentIds, scope.projectIds());
    }

    @Override
    public List<Experiment> findExperimentsBySourceDocuments(Collection<String> documentIds, ProjectScope scope) {
        if (documentIds.isEmpty() || scope.isEmpty()) {
            return List.of();
        }
        return this.experimentRepository.findBySourceFileIdInAndProjectIdInAndDeletedAtIsNull(documentIds, scope.projectIds());
    }

    @Override
    public List<ExperimentVariant> findVariants(Collection<String> experimentIds) {
        return experimentIds.isEmpty() ? List.of() : this.variantRepository.findByExperimentIdIn(experimentIds);
    }

    @Override
    public List<Measurement> findMeasurements(Collection<String> experimentIds) {
        return experimentIds.isEmpty() ? List.of() : this.measurementRepository.findByExperimentIdIn(experimentIds);
    }

    @Override
    public List<ExperimentCondition> findConditions(Collection<String> experimentIds) {
        return experimentIds.isEmpty() ? List.of() : this.conditionRepository.findByExperimentIdIn(experimentIds);
    }

    @Override
    public List<Insight> findInsights(Collection<String> terms, ProjectScope scope, int limit) {
        if (terms.isEmpty() || scope.isEmpty()) {
            return List.of();
        }
        List<Criteria> mentions = new ArrayList<>();
        for (String term : terms) {
            Pattern pattern = Pattern.compile(Pattern.quote(term), Pattern.CASE_INSENSITIVE);
            mentions.add(Criteria.where("title").regex(pattern));
            mentions.add(Criteria.where("content").regex(pattern));
        }
        Query query = new Query(new Criteria().andOperator(
                Criteria.where("projectId").in(scope.projectIds()),
                Criteria.where("deletedAt").is(null),
                new Criteria().orOperator(mentions.toArray(new Criteria[0]))))
                .limit(limit);
        return this.mongoTemplate.find(query, Insight.class);
    }
}
