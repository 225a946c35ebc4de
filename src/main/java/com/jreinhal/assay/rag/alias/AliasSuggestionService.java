package com.jreinhal.assay.rag.alias;

import com.jreinhal.assay.model.EntityAlias;
import com.jreinhal.assay.repository.EntityAliasRepository;
import com.jreinhal.assay.util.LogSanitizer;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

/**
 * Records fuzzy alias matches as unapproved suggestions for a curator to review.
 */
@Service
public class AliasSuggestionService {
    private static final Logger log = LoggerFactory.getLogger(AliasSuggestionService.class);
    static final String SUGGESTION_SOURCE = "user_query_suggest";

    private final EntityAliasRepository entityAliasRepository;

    public AliasSuggestionService(EntityAliasRepository entityAliasRepository) {
        this.entityAliasRepository = entityAliasRepository;
    }

    /**
     * Returns true when a new suggestion row was written. Storage failures are logged and reported
     * as false; a suggestion never affects the answer being produced.
     */
    public boolean suggest(String alias, String aliasNorm, String canonicalKey, double confidence) {
        try {
            if (this.entityAliasRepository.existsByEntityTypeAndAliasNorm(MongoAliasCatalog.METRIC_ENTITY, aliasNorm)) {
                return false;
            }
            EntityAlias suggestion = new EntityAlias();
            suggestion.setEntityType(MongoAliasCatalog.METRIC_ENTITY);
            suggestion.setCanonicalName(canonicalKey);
            suggestion.setAlias(alias);
            suggestion.setAliasNorm(aliasNorm);
            suggestion.setConfidence(confidence);
            suggestion.setApproved(false);
            suggestion.setSource(SUGGESTION_SOURCE);
            suggestion.setCreatedAt(Instant.now());
            this.entityAliasRepository.save(suggestion);
            log.info("Alias suggestion recorded: '{}' -> {} (confidence {})",
                    LogSanitizer.sanitize(aliasNorm), canonicalKey, String.format("%.2f", confidence));
            return true;
        } catch (DuplicateKeyException e) {
            log.debug("Alias suggestion for '{}' already recorded concurrently", LogSanitizer.sanitize(aliasNorm));
            return false;
        } catch (DataAccessException e) {
            log.warn("Failed to record alias suggestion for '{}': {}", LogSanitizer.sanitize(aliasNorm), e.getMessage());
            return false;
        }
    }
}
