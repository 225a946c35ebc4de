package com.jreinhal.assay.repository;

import com.jreinhal.assay.model.MetricCatalogEntry;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface MetricCatalogRepository extends MongoRepository<MetricCatalogEntry, String> {
}
