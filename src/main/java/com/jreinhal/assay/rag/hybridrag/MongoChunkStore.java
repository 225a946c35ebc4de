package com.jreinhal.assay.rag.hybridrag;

import com.jreinhal.assay.model.Chunk;
import com.jreinhal.assay.model.ProjectScope;
import com.jreinhal.assay.model.SearchChunk;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.ai.vectorstore.filter.Filter;
import org.springframework.ai.vectorstore.filter.FilterExpressionBuilder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.TextCriteria;
import org.springframework.data.mongodb.core.query.TextQuery;
import org.springframework.stereotype.Component;

/**
 * Lexical and substring search over {@code search_chunks} in MongoDB, semantic search through the
 * Spring AI {@link VectorStore}. Vector documents carry the chunk fields in their metadata; global
 * chunks are tagged {@code scope=global}.
 */
@Component
public class MongoChunkStore implements ChunkStore {
    static final String GLOBAL_SCOPE = "global";

    private final MongoTemplate mongoTemplate;
    private final VectorStore vectorStore;

    @Value("${assay.retrieval.semantic-similarity-threshold:0.2}")
    private double similarityThreshold = 0.2;

    public MongoChunkStore(MongoTemplate mongoTemplate, VectorStore vectorStore) {
        this.mongoTemplate = mongoTemplate;
        this.vectorStore = vectorStore;
    }

    @Override
    public List<Chunk> lexicalSearch(String query, ProjectScope scope, int limit) {
        TextCriteria text = TextCriteria.forDefaultLanguage().matching(query);
        Query mongoQuery = TextQuery.queryText(text)
                .sortByScore()
                .addCriteria(scopeCriteria(scope))
                .limit(limit);
        List<SearchChunk> docs = this.mongoTemplate.find(mongoQuery, SearchChunk.class);
        double max = docs.stream()
                .map(SearchChunk::getScore)
                .filter(score -> score != null)
                .mapToDouble(Float::doubleValue)
                .max()
                .orElse(0.0);
        List<Chunk> chunks = new ArrayList<>(docs.size());
        for (SearchChunk doc : docs) {
            double raw = doc.getScore() != null ? doc.getScore() : 0.0;
            chunks.add(Chunk.fromDocument(doc, max > 0 ? raw / max : 0.0));
        }
        return chunks;
    }

    @Override
    public List<Chunk> semanticSearch(String query, ProjectScope scope, int limit) {
        SearchRequest request = SearchRequest.builder()
                .query(query)
                .topK(limit)
                .similarityThreshold(this.similarityThreshold)
                .filterExpression(scopeFilter(scope))
                .build();
        List<Document> docs = this.vectorStore.similaritySearch(request);
        if (docs == null) {
            return List.of();
        }
        List<Chunk> chunks = new ArrayList<>(docs.size());
        for (Document doc : docs) {
            chunks.add(toChunk(doc));
        }
        return chunks;
    }

    @Override
    public List<Chunk> substringSearch(List<String> terms, ProjectScope scope, int limit) {
        if (terms.isEmpty()) {
            return List.of();
        }
        List<Criteria> anyTerm = new ArrayList<>(terms.size());
        for (String term : terms) {
            anyTerm.add(Criteria.where("chunkText").regex(Pattern.compile(Pattern.quote(term), Pattern.CASE_INSENSITIVE)));
        }
        Query mongoQuery = new Query(new Criteria().andOperator(
                scopeCriteria(scope),
                new Criteria().orOperator(anyTerm.toArray(new Criteria[0]))))
                .limit(limit);
        return this.mongoTemplate.find(mongoQuery, SearchChunk.class).stream()
                .map(doc -> Chunk.fromDocument(doc, 0.0))
                .toList();
    }

    @Override
    public List<Chunk> findByIds(Collection<String> chunkIds, ProjectScope scope) {
        if (chunkIds.isEmpty()) {
            return List.of();
        }
        Query mongoQuery = new Query(new Criteria().andOperator(
                Criteria.where("id").in(chunkIds),
                scopeCriteria(scope)));
        return this.mongoTemplate.find(mongoQuery, SearchChunk.class).stream()
                .map(doc -> Chunk.fromDocument(doc, 0.0))
                .toList();
    }

    private static Criteria scopeCriteria(ProjectScope scope) {
        return new Criteria().orOperator(
                Criteria.where("projectId").in(scope.projectIds()),
                Criteria.where("projectId").is(null));
    }

    static Filter.Expression scopeFilter(ProjectScope scope) {
        FilterExpressionBuilder b = new FilterExpressionBuilder();
        if (scope.isEmpty()) {
            return b.eq("scope", GLOBAL_SCOPE).build();
        }
        return b.or(b.in("projectId", scope.projectIds().toArray()), b.eq("scope", GLOBAL_SCOPE)).build();
    }

    static Chunk toChunk(Document doc) {
        Map<String, Object> meta = doc.getMetadata();
        String projectId = asString(meta.get("projectId"));
        Object index = meta.get("chunkIndex");
        double score = doc.getScore() != null ? Math.max(0.0, Math.min(1.0, doc.getScore())) : 0.0;
        String chunkId = meta.containsKey("chunkId") ? asString(meta.get("chunkId")) : doc.getId();
        return new Chunk(chunkId, projectId, asString(meta.get("projectName")), asString(meta.get("sourceType")),
                asString(meta.get("sourceId")), asString(meta.get("title")), doc.getText(),
                index instanceof Number n ? n.intValue() : 0, meta, 0.0, score, score);
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }
}
