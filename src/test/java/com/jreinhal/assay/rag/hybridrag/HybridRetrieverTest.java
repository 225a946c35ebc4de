package com.jreinhal.assay.rag.hybridrag;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.jreinhal.assay.config.RetrievalProperties;
import com.jreinhal.assay.exception.RetrievalUnavailableException;
import com.jreinhal.assay.model.Chunk;
import com.jreinhal.assay.model.ProjectScope;
import com.jreinhal.assay.reasoning.ReasoningTracer;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.ai.document.Document;

class HybridRetrieverTest {

    private static final ProjectScope SCOPE = ProjectScope.of("p1");

    private FakeChunkStore store;
    private RetrievalProperties properties;
    private ExecutorService executor;
    private HybridRetriever retriever;

    @BeforeEach
    void setUp() {
        store = new FakeChunkStore();
        properties = new RetrievalProperties();
        executor = Executors.newFixedThreadPool(2);
        retriever = new HybridRetriever(store, properties, new ReasoningTracer(), executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static Chunk chunk(String id, String projectId, String sourceId, double fts, double semantic, String text) {
        return new Chunk(id, projectId, "Project " + projectId, "document", sourceId, "Title " + id, text, 0,
                null, fts, semantic, Math.max(fts, semantic));
    }

    @Nested
    @DisplayName("Fusion")
    class Fusion {

        @Test
        void scoresAreFusedWithConfiguredWeights() {
            store.lexical = List.of(chunk("a", "p1", "doc-a", 1.0, 0.0, "a"));
            store.semantic = List.of(chunk("a", "p1", "doc-a", 0.0, 0.5, "a"), chunk("b", "p1", "doc-b", 0.0, 0.9, "b"));

            RetrievalResult result = retriever.retrieve("flexural strength", SCOPE, 10);

            assertThat(result.chunks()).extracting(Chunk::chunkId).containsExactly("a", "b");
            assertThat(result.chunks().get(0).scoreFinal()).isCloseTo(0.65 * 0.5 + 0.35 * 1.0, within(1e-9));
            assertThat(result.chunks().get(1).scoreFinal()).isCloseTo(0.65 * 0.9, within(1e-9));
            assertThat(result.isDegraded()).isFalse();
        }

        @Test
        void onlyTheBestChunkPerSourceSurvives() {
            store.semantic = List.of(chunk("a1", "p1", "doc-a", 0.0, 0.4, "a"), chunk("a2", "p1", "doc-a", 0.0, 0.8, "a"));

            RetrievalResult result = retriever.retrieve("flexural strength", SCOPE, 10);

            assertThat(result.chunks()).extracting(Chunk::chunkId).containsExactly("a2");
        }

        @Test
        void resultIsCappedAtLimit() {
            store.semantic = List.of(chunk("a", "p1", "doc-a", 0.0, 0.9, "a"), chunk("b", "p1", "doc-b", 0.0, 0.8, "b"),
                    chunk("c", "p1", "doc-c", 0.0, 0.7, "c"));

            assertThat(retriever.retrieve("query", SCOPE, 2).chunks()).extracting(Chunk::chunkId).containsExactly("a", "b");
        }
    }

    @Nested
    @DisplayName("Project scope")
    class Scope {

        @Test
        void chunksOutsideScopeAreDiscarded() {
            store.lexical = List.of(chunk("own", "p1", "doc-1", 0.9, 0.0, "x"), chunk("foreign", "p2", "doc-2", 1.0, 0.0, "x"));
            store.semantic = List.of(chunk("global", null, "doc-g", 0.0, 0.7, "x"));

            RetrievalResult result = retriever.retrieve("query", SCOPE, 10);

            assertThat(result.chunks()).extracting(Chunk::chunkId).containsExactlyInAnyOrder("own", "global");
            assertThat(result.droppedOutOfScope()).isEqualTo(1);
            assertThat(result.diagnostics()).contains("1 out-of-scope chunks discarded");
        }

        @Test
        void globalTaggedVectorOfAnotherProjectIsDiscarded() {
            Chunk tagged = MongoChunkStore.toChunk(Document.builder()
                    .id("vec-9")
                    .text("Notes from another lab")
                    .metadata(Map.of("scope", "global", "projectId", "p9", "sourceType", "document", "sourceId", "doc-9"))
                    .score(0.95)
                    .build());
            Chunk shared = MongoChunkStore.toChunk(Document.builder()
                    .id("vec-g")
                    .text("Shared glossary")
                    .metadata(Map.of("scope", "global", "sourceType", "document", "sourceId", "doc-g"))
                    .score(0.6)
                    .build());
            store.lexical = List.of(chunk("own", "p1", "doc-1", 0.9, 0.0, "x"));
            store.semantic = List.of(tagged, shared);

            RetrievalResult result = retriever.retrieve("query", SCOPE, 10);

            assertThat(result.chunks()).extracting(Chunk::chunkId).containsExactlyInAnyOrder("own", "vec-g");
            assertThat(result.droppedOutOfScope()).isEqualTo(1);
        }

        @Test
        void selectedChunksAreStillScoped() {
            store.byId = List.of(chunk("own", "p1", "doc-1", 0, 0, "x"), chunk("foreign", "p2", "doc-2", 0, 0, "x"));

            List<Chunk> loaded = retriever.loadSelected(List.of("own", "foreign"), SCOPE);

            assertThat(loaded).extracting(Chunk::chunkId).containsExactly("own");
        }
    }

    @Nested
    @DisplayName("Degraded paths")
    class Degraded {

        @Test
        void failedSemanticPathFallsBackToLexicalRanking() {
            store.lexical = List.of(chunk("a", "p1", "doc-a", 0.8, 0.0, "a"));
            store.semanticFailure = new IllegalStateException("vector index offline");

            RetrievalResult result = retriever.retrieve("query", SCOPE, 10);

            assertThat(result.semantic().isOk()).isFalse();
            assertThat(result.isDegraded()).isTrue();
            assertThat(result.diagnostics()).contains("semantic search degraded: search failed");
            assertThat(result.chunks().get(0).scoreFinal()).isCloseTo(0.8, within(1e-9));
        }

        @Test
        void slowPathIsAbandonedAtTimeout() {
            properties.setPathTimeoutMs(200);
            store.lexical = List.of(chunk("a", "p1", "doc-a", 0.8, 0.0, "a"));
            store.semanticDelayMs = 5_000;

            RetrievalResult result = retriever.retrieve("query", SCOPE, 10);

            assertThat(result.semantic().reason()).isEqualTo("timed out");
            assertThat(result.chunks()).extracting(Chunk::chunkId).containsExactly("a");
        }

        @Test
        void emptyStructuredResultsUseSubstringFallback() {
            store.substring = List.of(chunk("s", "p1", "doc-s", 0, 0, "BisGMA content was reduced"));

            RetrievalResult result = retriever.retrieve("bisgma yellowing", SCOPE, 10);

            assertThat(result.substringFallback()).isTrue();
            assertThat(result.chunks()).hasSize(1);
            assertThat(result.chunks().get(0).scoreFinal())
                    .isCloseTo(0.15, within(1e-9))
                    .isLessThanOrEqualTo(properties.getSubstringConfidenceCeiling());
        }

        @Test
        void allPathsFailingIsReportedAsUnavailable() {
            store.lexicalFailure = new IllegalStateException("text index missing");
            store.semanticFailure = new IllegalStateException("vector index offline");

            assertThatThrownBy(() -> retriever.retrieve("bisgma yellowing", SCOPE, 10))
                    .isInstanceOf(RetrievalUnavailableException.class);
        }

        @Test
        void bothPathsEmptyWithoutSubstringHitsIsNotAnError() {
            RetrievalResult result = retriever.retrieve("bisgma yellowing", SCOPE, 10);

            assertThat(result.chunks()).isEmpty();
            assertThat(result.substringFallback()).isTrue();
        }
    }

    @Test
    void substringTermsSkipStopWordsAndShortWords() {
        assertThat(retriever.substringTerms("What is the BisGMA content of it?"))
                .containsExactly("bisgma", "content");
    }

    static class FakeChunkStore implements ChunkStore {
        List<Chunk> lexical = List.of();
        List<Chunk> semantic = List.of();
        List<Chunk> substring = List.of();
        List<Chunk> byId = List.of();
        RuntimeException lexicalFailure;
        RuntimeException semanticFailure;
        long semanticDelayMs;

        @Override
        public List<Chunk> lexicalSearch(String query, ProjectScope scope, int limit) {
            if (lexicalFailure != null) {
                throw lexicalFailure;
            }
            return lexical;
        }

        @Override
        public List<Chunk> semanticSearch(String query, ProjectScope scope, int limit) {
            if (semanticFailure != null) {
                throw semanticFailure;
            }
            if (semanticDelayMs > 0) {
                try {
                    Thread.sleep(semanticDelayMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return List.of();
                }
            }
            return semantic;
        }

        @Override
        public List<Chunk> substringSearch(List<String> terms, ProjectScope scope, int limit) {
            return substring;
        }

        @Override
        public List<Chunk> findByIds(Collection<String> chunkIds, ProjectScope scope) {
            return byId;
        }
    }
}
