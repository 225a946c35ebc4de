package com.jreinhal.assay.repository;

import com.jreinhal.assay.model.EntityAlias;
import java.util.List;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface EntityAliasRepository extends MongoRepository<EntityAlias, String> {

    List<EntityAlias> findByEntityTypeAndApprovedTrueAndDeletedAtIsNull(String entityType);

    boolean existsByEntityTypeAndAliasNorm(String entityType, String aliasNorm);
}
