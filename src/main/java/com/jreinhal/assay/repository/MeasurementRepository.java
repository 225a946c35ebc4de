package com.jreinhal.assay.repository;

import com.jreinhal.assay.model.Measurement;
import java.util.Collection;
import java.util.List;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface MeasurementRepository extends MongoRepository<Measurement, String> {

    List<Measurement> findByMetricInAndExperimentIdIn(Collection<String> metrics, Collection<String> experimentIds);

    List<Measurement> findByExperimentIdIn(Collection<String> experimentIds);
}
