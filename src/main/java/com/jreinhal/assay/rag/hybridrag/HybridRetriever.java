package com.jreinhal.assay.rag.hybridrag;

import com.jreinhal.assay.config.RetrievalProperties;
import com.jreinhal.assay.constant.StopWords;
import com.jreinhal.assay.exception.QueryCancelledException;
import com.jreinhal.assay.exception.RetrievalUnavailableException;
import com.jreinhal.assay.model.Chunk;
import com.jreinhal.assay.model.ProjectScope;
import com.jreinhal.assay.reasoning.ReasoningStep;
import com.jreinhal.assay.reasoning.ReasoningTracer;
import com.jreinhal.assay.util.LogSanitizer;
import com.jreinhal.assay.util.TextFolding;
import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Hybrid chunk retrieval: full-text and vector search run concurrently and their scores are fused
 * as {@code semanticWeight * semantic + ftsWeight * fts}.
 *
 * <p>A path that fails, times out or is rejected by the pool is reported as degraded and the other
 * path's ranking is used on its own. When both paths come back empty the retriever falls back to
 * substring matching, capped at a low confidence. Every returned chunk is re-checked against the
 * project scope, and only the best chunk per source survives.</p>
 */
@Service
public class HybridRetriever {
    private static final Logger log = LoggerFactory.getLogger(HybridRetriever.class);
    static final String LEXICAL = "lexical";
    static final String SEMANTIC = "semantic";

    private final ChunkStore chunkStore;
    private final RetrievalProperties properties;
    private final ReasoningTracer reasoningTracer;
    private final ExecutorService ragExecutor;

    public HybridRetriever(ChunkStore chunkStore, RetrievalProperties properties, ReasoningTracer reasoningTracer,
                           @Qualifier("ragExecutor") ExecutorService ragExecutor) {
        this.chunkStore = chunkStore;
        this.properties = properties;
        this.reasoningTracer = reasoningTracer;
        this.ragExecutor = ragExecutor;
    }

    @PostConstruct
    public void init() {
        this.properties.validate();
        log.info("Hybrid retriever initialized: semanticWeight={}, ftsWeight={}, pathTimeout={}ms, substringCeiling={}",
                this.properties.getSemanticWeight(), this.properties.getFtsWeight(),
                this.properties.getPathTimeoutMs(), this.properties.getSubstringConfidenceCeiling());
    }

    public RetrievalResult retrieve(String query, ProjectScope scope, int limit) {
        long start = System.currentTimeMillis();
        int candidates = Math.max(limit, limit * Math.max(1, this.properties.getCandidateMultiplier()));

        CompletableFuture<List<Chunk>> lexicalFuture = submit(() -> this.chunkStore.lexicalSearch(query, scope, candidates));
        CompletableFuture<List<Chunk>> semanticFuture = submit(() -> this.chunkStore.semanticSearch(query, scope, candidates));
        long deadline = start + this.properties.getPathTimeoutMs();
        PathOutcome lexical = await(LEXICAL, lexicalFuture, deadline, start, semanticFuture);
        PathOutcome semantic = await(SEMANTIC, semanticFuture, deadline, start, lexicalFuture);

        int[] dropped = new int[1];
        List<Chunk> fused = fuse(lexical, semantic, scope, dropped);
        boolean substringFallback = false;
        if (fused.isEmpty()) {
            List<Chunk> fallback = substringFallback(query, scope, candidates, dropped);
            substringFallback = true;
            fused = fallback;
            if (fallback.isEmpty() && !lexical.isOk() && !semantic.isOk()) {
                throw new RetrievalUnavailableException("Chunk search is unavailable", null);
            }
        }
        List<Chunk> ranked = dedupeBySource(fused).stream().limit(limit).toList();
        RetrievalResult result = new RetrievalResult(ranked, lexical, semantic, substringFallback, dropped[0]);

        long elapsed = System.currentTimeMillis() - start;
        if (dropped[0] > 0) {
            log.warn("Hybrid retrieval discarded {} chunks outside scope {}", dropped[0], LogSanitizer.scopeSummary(scope.projectIds()));
        }
        log.info("Hybrid retrieval for query {}: lexical={} ({}), semantic={} ({}), substringFallback={}, returned={}, {}ms",
                LogSanitizer.querySummary(query), lexical.chunks().size(), lexical.status(),
                semantic.chunks().size(), semantic.status(), substringFallback, ranked.size(), elapsed);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("lexical", lexical.status().name());
        data.put("semantic", semantic.status().name());
        data.put("substringFallback", substringFallback);
        data.put("returned", ranked.size());
        this.reasoningTracer.addStep(ReasoningStep.StepType.HYBRID_RETRIEVAL, "Hybrid retrieval",
                String.format("%d chunks (lexical %d, semantic %d)", ranked.size(), lexical.chunks().size(),
                        semantic.chunks().size()), elapsed, data);
        return result;
    }

    /**
     * Loads caller-selected chunks, still confined to the scope.
     */
    public List<Chunk> loadSelected(Collection<String> chunkIds, ProjectScope scope) {
        List<Chunk> loaded = this.chunkStore.findByIds(chunkIds, scope);
        List<Chunk> permitted = loaded.stream().filter(scope::permits).toList();
        if (permitted.size() < loaded.size()) {
            log.warn("Discarded {} selected chunks outside scope {}", loaded.size() - permitted.size(),
                    LogSanitizer.scopeSummary(scope.projectIds()));
        }
        return permitted;
    }

    private CompletableFuture<List<Chunk>> submit(Supplier<List<Chunk>> search) {
        try {
            return CompletableFuture.supplyAsync(search, this.ragExecutor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private PathOutcome await(String path, CompletableFuture<List<Chunk>> future, long deadline, long start,
                              CompletableFuture<?> sibling) {
        long remainingMs = deadline - System.currentTimeMillis();
        try {
            if (remainingMs <= 0L && !future.isDone()) {
                throw new TimeoutException();
            }
            List<Chunk> chunks = future.get(Math.max(0L, remainingMs), TimeUnit.MILLISECONDS);
            return PathOutcome.ok(path, chunks, System.currentTimeMillis() - start);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            sibling.cancel(true);
            throw new QueryCancelledException("retrieval");
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Hybrid retrieval {} path exceeded {}ms; continuing without it", path, this.properties.getPathTimeoutMs());
            return PathOutcome.degraded(path, "timed out", System.currentTimeMillis() - start);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            String reason = cause instanceof RejectedExecutionException ? "worker pool saturated" : "search failed";
            log.warn("Hybrid retrieval {} path failed ({}): {}", path, reason, cause.getMessage());
            return PathOutcome.degraded(path, reason, System.currentTimeMillis() - start);
        }
    }

    private List<Chunk> fuse(PathOutcome lexical, PathOutcome semantic, ProjectScope scope, int[] dropped) {
        boolean bothOk = lexical.isOk() && semantic.isOk();
        double semanticWeight = bothOk ? this.properties.getSemanticWeight() : (semantic.isOk() ? 1.0 : 0.0);
        double ftsWeight = bothOk ? this.properties.getFtsWeight() : (lexical.isOk() ? 1.0 : 0.0);

        Map<String, Chunk> byId = new LinkedHashMap<>();
        Map<String, double[]> scores = new LinkedHashMap<>();
        for (Chunk chunk : lexical.chunks()) {
            if (!admit(chunk, scope, dropped)) {
                continue;
            }
            byId.putIfAbsent(chunk.chunkId(), chunk);
            double[] s = scores.computeIfAbsent(chunk.chunkId(), k -> new double[2]);
            s[0] = Math.max(s[0], chunk.scoreFts());
        }
        for (Chunk chunk : semantic.chunks()) {
            if (!admit(chunk, scope, dropped)) {
                continue;
            }
            byId.putIfAbsent(chunk.chunkId(), chunk);
            double[] s = scores.computeIfAbsent(chunk.chunkId(), k -> new double[2]);
            s[1] = Math.max(s[1], chunk.scoreSemantic());
        }
        List<Chunk> fused = new ArrayList<>(byId.size());
        byId.forEach((id, chunk) -> {
            double[] s = scores.get(id);
            fused.add(chunk.withScores(s[0], s[1], semanticWeight * s[1] + ftsWeight * s[0]));
        });
        return fused;
    }

    private List<Chunk> substringFallback(String query, ProjectScope scope, int limit, int[] dropped) {
        List<String> terms = substringTerms(query);
        if (terms.isEmpty()) {
            return List.of();
        }
        List<Chunk> found;
        try {
            found = this.chunkStore.substringSearch(terms, scope, limit);
        } catch (RuntimeException e) {
            log.warn("Substring fallback search failed: {}", e.getMessage());
            return List.of();
        }
        double ceiling = this.properties.getSubstringConfidenceCeiling();
        List<Chunk> scored = new ArrayList<>(found.size());
        for (Chunk chunk : found) {
            if (!admit(chunk, scope, dropped)) {
                continue;
            }
            String text = TextFolding.fold(chunk.text());
            long hits = terms.stream().filter(text::contains).count();
            double score = ceiling * hits / terms.size();
            scored.add(chunk.withScores(0.0, 0.0, Math.min(ceiling, score)));
        }
        return scored;
    }

    List<String> substringTerms(String query) {
        Set<String> terms = new LinkedHashSet<>();
        for (String word : TextFolding.fold(query).split("[^\\p{L}\\p{N}\\-]+")) {
            if (word.length() > 2 && !StopWords.KEYWORDS.contains(word) && !StopWords.TERM_EXTRACTION.contains(word)) {
                terms.add(word.toLowerCase(Locale.ROOT));
            }
            if (terms.size() >= this.properties.getMaxSubstringTerms()) {
                break;
            }
        }
        return new ArrayList<>(terms);
    }

    private static boolean admit(Chunk chunk, ProjectScope scope, int[] dropped) {
        if (scope.permits(chunk)) {
            return true;
        }
        dropped[0]++;
        return false;
    }

    static List<Chunk> dedupeBySource(List<Chunk> chunks) {
        Map<String, Chunk> best = new LinkedHashMap<>();
        for (Chunk chunk : chunks) {
            best.merge(chunk.sourceKey(), chunk, (a, b) -> b.scoreFinal() > a.scoreFinal() ? b : a);
        }
        List<Chunk> deduped = new ArrayList<>(best.values());
        deduped.sort(Comparator.comparingDouble(Chunk::scoreFinal).reversed()
                .thenComparing(Chunk::chunkId, Comparator.nullsLast(Comparator.naturalOrder())));
        return deduped;
    }
}
