package com.jreinhal.assay.constant;

import java.util.Set;

/**
 * Bilingual (Portuguese and English) stop word lists. Entries are already folded
 * (lower-case, no accents) so they compare directly against folded query text.
 */
public final class StopWords {
    public static final Set<String> TERM_EXTRACTION = Set.of(
            // en
            "the", "and", "for", "was", "are", "were", "been", "being", "have", "has", "had",
            "what", "where", "when", "who", "how", "why", "which", "that", "this", "these", "those",
            "tell", "about", "describe", "find", "show", "give", "also", "with", "from", "into",
            "does", "did", "doing", "over", "time", "between", "than", "then", "there", "their",
            "they", "them", "some", "more", "most", "other", "such", "only", "same", "very",
            "can", "could", "should", "would", "will", "just", "please", "explain", "summarize",
            "experiment", "experiments", "result", "results", "data", "value", "values",
            // pt
            "que", "qual", "quais", "quando", "onde", "como", "porque", "por", "para", "pela",
            "pelo", "pelas", "pelos", "com", "sem", "sobre", "entre", "uma", "umas", "uns",
            "dos", "das", "nos", "nas", "num", "numa", "esse", "essa", "esses", "essas",
            "este", "esta", "estes", "estas", "isso", "isto", "aquele", "aquela", "foi", "foram",
            "ser", "sao", "sera", "tem", "teve", "tinha", "mais", "menos", "muito", "muita",
            "ainda", "tambem", "depois", "antes", "cada", "todo", "toda", "todos", "todas",
            "explique", "resuma", "experimento", "experimentos", "resultado", "resultados",
            "dado", "dados", "valor", "valores", "ensaio", "ensaios"
    );

    public static final Set<String> KEYWORDS = Set.of(
            "the", "a", "an", "and", "or", "but", "in", "on", "at", "to",
            "for", "of", "with", "by", "from", "as", "is", "was", "are",
            "were", "what", "where", "when", "who", "how", "why", "about",
            "o", "os", "um", "uma", "de", "do", "da", "dos", "das",
            "e", "ou", "em", "no", "na", "que", "qual", "com", "por", "para"
    );

    private StopWords() {
    }
}
