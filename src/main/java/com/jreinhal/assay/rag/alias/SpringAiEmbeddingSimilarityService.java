package com.jreinhal.assay.rag.alias;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.stereotype.Service;

/**
 * Cosine similarity over {@link EmbeddingModel} vectors. Catalog alias vectors are cached since the
 * same aliases are compared against every unresolved term.
 */
@Service
public class SpringAiEmbeddingSimilarityService implements EmbeddingSimilarityService {
    private final EmbeddingModel embeddingModel;
    private final Cache<String, float[]> vectors = Caffeine.newBuilder()
            .maximumSize(5_000)
            .build();

    public SpringAiEmbeddingSimilarityService(EmbeddingModel embeddingModel) {
        this.embeddingModel = embeddingModel;
    }

    @Override
    public double similarity(String a, String b) {
        return cosine(vector(a), vector(b));
    }

    @Override
    public Map<String, Double> similarities(String term, Collection<String> candidates) {
        float[] termVector = vector(term);
        List<String> missing = new ArrayList<>();
        for (String candidate : candidates) {
            if (this.vectors.getIfPresent(candidate) == null) {
                missing.add(candidate);
            }
        }
        if (!missing.isEmpty()) {
            List<float[]> embedded = this.embeddingModel.embed(missing);
            for (int i = 0; i < missing.size() && i < embedded.size(); i++) {
                this.vectors.put(missing.get(i), embedded.get(i));
            }
        }
        Map<String, Double> scores = new LinkedHashMap<>();
        for (String candidate : candidates) {
            float[] candidateVector = this.vectors.getIfPresent(candidate);
            scores.put(candidate, candidateVector == null ? 0.0 : cosine(termVector, candidateVector));
        }
        return scores;
    }

    private float[] vector(String text) {
        return this.vectors.get(text, this.embeddingModel::embed);
    }

    static double cosine(float[] a, float[] b) {
        if (a == null || b == null || a.length == 0 || a.length != b.length) {
            return 0.0;
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        double cosine = dot / (Math.sqrt(normA) * Math.sqrt(normB));
        return Math.max(0.0, Math.min(1.0, cosine));
    }
}
