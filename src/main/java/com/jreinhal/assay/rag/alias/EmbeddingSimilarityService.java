package com.jreinhal.assay.rag.alias;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Semantic similarity between short strings, used as the last-resort alias match.
 */
public interface EmbeddingSimilarityService {

    /**
     * Similarity in [0, 1].
     */
    double similarity(String a, String b);

    default Map<String, Double> similarities(String term, Collection<String> candidates) {
        Map<String, Double> scores = new LinkedHashMap<>();
        for (String candidate : candidates) {
            scores.put(candidate, similarity(term, candidate));
        }
        return scores;
    }
}
