package com.jreinhal.assay.rag.alias;

/**
 * Best-scoring alias of one canonical key for a term.
 */
public record AliasCandidate(String canonicalKey, String matchedAlias, double score, MatchMethod method) {
}
