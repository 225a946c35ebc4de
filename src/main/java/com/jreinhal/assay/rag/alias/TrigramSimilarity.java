package com.jreinhal.assay.rag.alias;

import java.util.HashSet;
import java.util.Set;

/**
 * Character-trigram similarity (Dice coefficient over the two trigram sets). Symmetric, in [0, 1],
 * and 1.0 for identical strings.
 */
public final class TrigramSimilarity {

    private TrigramSimilarity() {
    }

    public static double score(String a, String b) {
        if (a == null || b == null) {
            return 0.0;
        }
        if (a.equals(b)) {
            return 1.0;
        }
        Set<String> left = trigrams(a);
        Set<String> right = trigrams(b);
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        int shared = 0;
        for (String gram : left) {
            if (right.contains(gram)) {
                shared++;
            }
        }
        return (2.0 * shared) / (left.size() + right.size());
    }

    static Set<String> trigrams(String text) {
        Set<String> grams = new HashSet<>();
        for (int i = 0; i + 3 <= text.length(); i++) {
            grams.add(text.substring(i, i + 3));
        }
        return grams;
    }
}
