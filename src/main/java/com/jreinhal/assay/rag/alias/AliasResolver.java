package com.jreinhal.assay.rag.alias;

import com.jreinhal.assay.config.AliasResolverProperties;
import com.jreinhal.assay.exception.QueryCancelledException;
import com.jreinhal.assay.rag.alias.AliasCatalog.CatalogEntry;
import com.jreinhal.assay.rag.normalize.Term;
import com.jreinhal.assay.util.LogSanitizer;
import com.jreinhal.assay.util.TextFolding;
import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

/**
 * Maps free-text terms onto canonical catalog keys.
 *
 * <p>Resolution runs exact match, then trigram similarity, then (optionally) embedding similarity.
 * Fuzzy stages only accept a candidate that clears the stage threshold and beats the runner-up
 * canonical key by the ambiguity delta; otherwise the term stays unresolved and is passed on
 * unchanged. Successful resolutions are memoized for the life of the process.</p>
 */
@Service
public class AliasResolver {
    private static final Logger log = LoggerFactory.getLogger(AliasResolver.class);

    private final AliasCatalog catalog;
    private final AliasResolverProperties properties;
    private final AliasResolutionCache cache;
    @Nullable
    private final EmbeddingSimilarityService embeddingSimilarity;
    @Nullable
    private final AliasSuggestionService suggestionService;
    private final ExecutorService ragExecutor;

    public AliasResolver(AliasCatalog catalog,
                         AliasResolverProperties properties,
                         AliasResolutionCache cache,
                         @Nullable EmbeddingSimilarityService embeddingSimilarity,
                         @Nullable AliasSuggestionService suggestionService,
                         @Qualifier("ragExecutor") ExecutorService ragExecutor) {
        this.catalog = catalog;
        this.properties = properties;
        this.cache = cache;
        this.embeddingSimilarity = embeddingSimilarity;
        this.suggestionService = suggestionService;
        this.ragExecutor = ragExecutor;
    }

    @PostConstruct
    public void init() {
        this.properties.validate();
        log.info("Alias resolver initialized: trigramAccept={}, embeddingAccept={}, delta={}, embeddingFallback={}",
                this.properties.getTrigramAcceptThreshold(), this.properties.getEmbeddingAcceptThreshold(),
                this.properties.getAmbiguityDelta(),
                this.properties.isEmbeddingFallbackEnabled() && this.embeddingSimilarity != null);
    }

    public AliasResolution resolve(Term term) {
        String key = term.normalized();
        if (key == null || key.isBlank()) {
            return AliasResolution.unresolved(term, "empty term");
        }
        Optional<AliasResolution> cached = this.cache.get(key);
        if (cached.isPresent()) {
            return rebind(cached.get(), term);
        }
        List<CatalogEntry> entries = this.catalog.entries();
        if (entries.isEmpty()) {
            return AliasResolution.unresolved(term, "alias catalog is empty");
        }

        AliasCandidate exact = exactMatch(key, entries);
        if (exact != null) {
            return rebind(this.cache.putIfAbsent(key, AliasResolution.resolved(term, exact, List.of(exact))), term);
        }

        List<AliasCandidate> trigram = rankByTrigram(key, entries);
        AliasResolution fromTrigram = gate(term, trigram, this.properties.getTrigramAcceptThreshold());
        if (fromTrigram.isResolved()) {
            return accept(key, fromTrigram);
        }

        AliasResolution fromEmbedding = null;
        if (this.properties.isEmbeddingFallbackEnabled() && this.embeddingSimilarity != null) {
            List<AliasCandidate> embedded = rankByEmbedding(key, entries);
            if (!embedded.isEmpty()) {
                fromEmbedding = gate(term, embedded, this.properties.getEmbeddingAcceptThreshold());
                if (fromEmbedding.isResolved()) {
                    return accept(key, fromEmbedding);
                }
            }
        }

        if (fromTrigram.status() == AliasResolution.Status.AMBIGUOUS) {
            return fromTrigram;
        }
        if (fromEmbedding != null && fromEmbedding.status() == AliasResolution.Status.AMBIGUOUS) {
            return fromEmbedding;
        }
        return AliasResolution.unresolved(term, "no catalog match above threshold");
    }

    /**
     * Resolves the distinct terms concurrently and returns one resolution per input term, in input
     * order. A term whose resolution fails or times out comes back unresolved.
     */
    public List<AliasResolution> resolveAll(List<Term> terms) {
        if (terms.isEmpty()) {
            return List.of();
        }
        long start = System.currentTimeMillis();
        Map<String, CompletableFuture<AliasResolution>> futures = new LinkedHashMap<>();
        Map<String, Term> firstTerm = new LinkedHashMap<>();
        for (Term term : terms) {
            String key = term.normalized();
            if (futures.containsKey(key)) {
                continue;
            }
            firstTerm.put(key, term);
            try {
                futures.put(key, CompletableFuture.supplyAsync(() -> this.resolve(term), this.ragExecutor));
            } catch (RejectedExecutionException e) {
                log.debug("RAG thread pool overloaded; resolving term inline: {}", e.getMessage());
                futures.put(key, CompletableFuture.completedFuture(this.resolve(term)));
            }
        }

        long deadline = start + this.properties.getResolveTimeoutMs();
        Map<String, AliasResolution> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, CompletableFuture<AliasResolution>> entry : futures.entrySet()) {
            Term term = firstTerm.get(entry.getKey());
            long remainingMs = deadline - System.currentTimeMillis();
            if (remainingMs <= 0L) {
                entry.getValue().cancel(true);
                resolved.put(entry.getKey(), AliasResolution.unresolved(term, "resolution timed out"));
                continue;
            }
            try {
                resolved.put(entry.getKey(), entry.getValue().get(remainingMs, TimeUnit.MILLISECONDS));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.values().forEach(f -> f.cancel(true));
                throw new QueryCancelledException("alias_resolution");
            } catch (TimeoutException e) {
                log.warn("Alias resolution timed out for term {}", LogSanitizer.querySummary(entry.getKey()));
                entry.getValue().cancel(true);
                resolved.put(entry.getKey(), AliasResolution.unresolved(term, "resolution timed out"));
            } catch (ExecutionException e) {
                log.warn("Alias resolution failed for term {}: {}", LogSanitizer.querySummary(entry.getKey()),
                        e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
                resolved.put(entry.getKey(), AliasResolution.unresolved(term, "resolution failed"));
            }
        }

        List<AliasResolution> results = new ArrayList<>(terms.size());
        for (Term term : terms) {
            AliasResolution resolution = resolved.get(term.normalized());
            results.add(resolution.term().equals(term) ? resolution : rebind(resolution, term));
        }
        long resolvedCount = results.stream().filter(AliasResolution::isResolved).count();
        log.info("Alias resolution: {} terms, {} resolved, {}ms", results.size(), resolvedCount,
                System.currentTimeMillis() - start);
        return results;
    }

    /**
     * Folded names under which a canonical key may appear in stored measurements: the key itself
     * and every catalog alias.
     */
    public Set<String> namesFor(String canonicalKey) {
        Set<String> names = new LinkedHashSet<>();
        names.add(canonicalKey);
        for (CatalogEntry entry : this.catalog.entries()) {
            if (entry.canonicalKey().equals(canonicalKey)) {
                entry.aliases().forEach(alias -> names.add(TextFolding.fold(alias)));
            }
        }
        return names;
    }

    private AliasResolution accept(String key, AliasResolution resolution) {
        AliasResolution stored = this.cache.putIfAbsent(key, resolution);
        if (stored == resolution && this.suggestionService != null && this.properties.isSuggestionsEnabled()) {
            this.suggestionService.suggest(resolution.term().original(), key, resolution.canonicalKey(),
                    resolution.confidence());
        }
        return rebind(stored, resolution.term());
    }

    @Nullable
    private static AliasCandidate exactMatch(String key, List<CatalogEntry> entries) {
        for (CatalogEntry entry : entries) {
            if (foldName(entry.canonicalKey()).equals(key)) {
                return new AliasCandidate(entry.canonicalKey(), entry.canonicalKey(), 1.0, MatchMethod.EXACT);
            }
            for (String alias : entry.aliases()) {
                if (foldName(alias).equals(key)) {
                    return new AliasCandidate(entry.canonicalKey(), alias, 1.0, MatchMethod.EXACT);
                }
            }
        }
        return null;
    }

    private static List<AliasCandidate> rankByTrigram(String key, List<CatalogEntry> entries) {
        List<AliasCandidate> best = new ArrayList<>();
        for (CatalogEntry entry : entries) {
            AliasCandidate top = null;
            for (String name : namesOf(entry)) {
                double score = TrigramSimilarity.score(key, foldName(name));
                if (top == null || score > top.score()) {
                    top = new AliasCandidate(entry.canonicalKey(), name, score, MatchMethod.TRIGRAM);
                }
            }
            if (top != null) {
                best.add(top);
            }
        }
        best.sort(Comparator.comparingDouble(AliasCandidate::score).reversed());
        return best;
    }

    private List<AliasCandidate> rankByEmbedding(String key, List<CatalogEntry> entries) {
        Map<String, String> ownerByName = new LinkedHashMap<>();
        for (CatalogEntry entry : entries) {
            for (String name : namesOf(entry)) {
                ownerByName.putIfAbsent(name, entry.canonicalKey());
            }
        }
        Map<String, Double> scores;
        try {
            scores = this.embeddingSimilarity.similarities(key, ownerByName.keySet());
        } catch (RuntimeException e) {
            log.warn("Embedding similarity unavailable, skipping embedding match: {}", e.getMessage());
            return List.of();
        }
        Map<String, AliasCandidate> bestByKey = new LinkedHashMap<>();
        scores.forEach((name, score) -> {
            String owner = ownerByName.get(name);
            AliasCandidate current = bestByKey.get(owner);
            if (current == null || score > current.score()) {
                bestByKey.put(owner, new AliasCandidate(owner, name, score, MatchMethod.EMBEDDING));
            }
        });
        List<AliasCandidate> ranked = new ArrayList<>(bestByKey.values());
        ranked.sort(Comparator.comparingDouble(AliasCandidate::score).reversed());
        return ranked;
    }

    private AliasResolution gate(Term term, List<AliasCandidate> ranked, double threshold) {
        if (ranked.isEmpty()) {
            return AliasResolution.unresolved(term, "no candidates");
        }
        AliasCandidate best = ranked.get(0);
        double second = ranked.size() > 1 ? ranked.get(1).score() : 0.0;
        List<AliasCandidate> considered = ranked.subList(0, Math.min(3, ranked.size()));
        switch (AmbiguityGate.evaluate(best.score(), second, threshold, this.properties.getAmbiguityDelta())) {
            case ACCEPT:
                return AliasResolution.resolved(term, best, considered);
            case AMBIGUOUS:
                AliasCandidate runnerUp = ranked.size() > 1 ? ranked.get(1) : best;
                return AliasResolution.ambiguous(term, considered, String.format("ambiguous: %s (%.2f) vs %s (%.2f)",
                        best.canonicalKey(), best.score(), runnerUp.canonicalKey(), runnerUp.score()));
            default:
                return AliasResolution.unresolved(term, "best candidate below threshold");
        }
    }

    // canonical keys are stored snake_case, queries are typed with spaces
    static String foldName(String name) {
        return TextFolding.fold(name.replace('_', ' '));
    }

    private static List<String> namesOf(CatalogEntry entry) {
        List<String> names = new ArrayList<>(entry.aliases().size() + 1);
        names.add(entry.canonicalKey());
        names.addAll(entry.aliases());
        return names;
    }

    private static AliasResolution rebind(AliasResolution resolution, Term term) {
        return new AliasResolution(term, resolution.canonicalKey(), resolution.status(), resolution.method(),
                resolution.confidence(), resolution.candidates(), resolution.reason());
    }
}
