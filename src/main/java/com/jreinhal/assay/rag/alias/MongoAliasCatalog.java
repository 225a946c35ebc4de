package com.jreinhal.assay.rag.alias;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.jreinhal.assay.config.AliasResolverProperties;
import com.jreinhal.assay.model.EntityAlias;
import com.jreinhal.assay.model.MetricCatalogEntry;
import com.jreinhal.assay.repository.EntityAliasRepository;
import com.jreinhal.assay.repository.MetricCatalogRepository;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Metric catalog backed by {@code metrics_catalog} plus approved {@code entity_aliases}. The merged
 * view is read once per TTL window; a failed read yields an empty catalog so every term passes
 * through unresolved.
 */
@Component
public class MongoAliasCatalog implements AliasCatalog {
    private static final Logger log = LoggerFactory.getLogger(MongoAliasCatalog.class);
    static final String METRIC_ENTITY = "metric";
    private static final String SNAPSHOT_KEY = "catalog";

    private final MetricCatalogRepository metricCatalogRepository;
    private final EntityAliasRepository entityAliasRepository;
    private final LoadingCache<String, List<CatalogEntry>> snapshot;

    public MongoAliasCatalog(MetricCatalogRepository metricCatalogRepository,
                             EntityAliasRepository entityAliasRepository,
                             AliasResolverProperties properties) {
        this.metricCatalogRepository = metricCatalogRepository;
        this.entityAliasRepository = entityAliasRepository;
        this.snapshot = Caffeine.newBuilder()
                .maximumSize(1)
                .expireAfterWrite(Duration.ofSeconds(Math.max(1L, properties.getCatalogTtlSeconds())))
                .build(key -> this.load());
    }

    @Override
    public List<CatalogEntry> entries() {
        try {
            return this.snapshot.get(SNAPSHOT_KEY);
        } catch (DataAccessException e) {
            log.warn("Alias catalog unavailable, terms will pass through unresolved: {}", e.getMessage());
            return List.of();
        }
    }

    public void invalidate() {
        this.snapshot.invalidateAll();
    }

    private List<CatalogEntry> load() {
        long start = System.currentTimeMillis();
        Map<String, String> displayNames = new LinkedHashMap<>();
        Map<String, Set<String>> aliases = new LinkedHashMap<>();
        for (MetricCatalogEntry metric : this.metricCatalogRepository.findAll()) {
            if (metric.getCanonicalName() == null || metric.getCanonicalName().isBlank()) {
                continue;
            }
            displayNames.put(metric.getCanonicalName(), metric.getDisplayName());
            Set<String> known = aliases.computeIfAbsent(metric.getCanonicalName(), k -> new LinkedHashSet<>());
            if (metric.getDisplayName() != null) {
                known.add(metric.getDisplayName());
            }
            if (metric.getAliases() != null) {
                known.addAll(metric.getAliases());
            }
        }
        int approved = 0;
        for (EntityAlias alias : this.entityAliasRepository.findByEntityTypeAndApprovedTrueAndDeletedAtIsNull(METRIC_ENTITY)) {
            if (alias.getCanonicalName() == null || alias.getAlias() == null) {
                continue;
            }
            // aliases may point at metrics the catalog does not list yet
            aliases.computeIfAbsent(alias.getCanonicalName(), k -> new LinkedHashSet<>()).add(alias.getAlias());
            approved++;
        }
        List<CatalogEntry> entries = new ArrayList<>(aliases.size());
        aliases.forEach((key, names) -> entries.add(new CatalogEntry(key, displayNames.get(key), new ArrayList<>(names))));
        log.info("Alias catalog loaded: {} canonical metrics, {} approved aliases in {}ms",
                entries.size(), approved, System.currentTimeMillis() - start);
        return List.copyOf(entries);
    }
}
