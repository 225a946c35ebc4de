package com.jreinhal.assay.repository;

import com.jreinhal.assay.model.Experiment;
import java.util.Collection;
import java.util.List;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface ExperimentRepository extends MongoRepository<Experiment, String> {

    List<Experiment> findByIdInAndProjectIdInAndDeletedAtIsNull(Collection<String> ids, Collection<String> projectIds);

    List<Experiment> findBySourceFileIdInAndProjectIdInAndDeletedAtIsNull(Collection<String> sourceFileIds,
                                                                          Collection<String> projectIds);
}
