package com.jreinhal.assay.repository;

import com.jreinhal.assay.model.ExperimentVariant;
import java.util.Collection;
import java.util.List;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface ExperimentVariantRepository extends MongoRepository<ExperimentVariant, String> {

    List<ExperimentVariant> findByExperimentIdIn(Collection<String> experimentIds);
}
