package com.jreinhal.assay.rag.alias;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Process-lifetime memo of successful resolutions, keyed by normalized term. Entries never expire
 * and are written insert-if-absent, so concurrent resolutions of the same term agree on the first
 * stored answer.
 */
@Component
public class AliasResolutionCache {
    private final Cache<String, AliasResolution> resolutions = Caffeine.newBuilder().build();

    public Optional<AliasResolution> get(String normalizedTerm) {
        return Optional.ofNullable(this.resolutions.getIfPresent(normalizedTerm));
    }

    /**
     * Stores the resolution unless one is already present and returns whichever is cached.
     */
    public AliasResolution putIfAbsent(String normalizedTerm, AliasResolution resolution) {
        AliasResolution existing = this.resolutions.asMap().putIfAbsent(normalizedTerm, resolution);
        return existing != null ? existing : resolution;
    }

    public long size() {
        return this.resolutions.estimatedSize();
    }
}
