package com.jreinhal.assay.repository;

import com.jreinhal.assay.model.ExperimentCondition;
import java.util.Collection;
import java.util.List;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface ExperimentConditionRepository extends MongoRepository<ExperimentCondition, String> {

    List<ExperimentCondition> findByExperimentIdIn(Collection<String> experimentIds);
}
