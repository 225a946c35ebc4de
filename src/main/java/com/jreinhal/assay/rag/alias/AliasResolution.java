package com.jreinhal.assay.rag.alias;

import com.jreinhal.assay.rag.normalize.Term;
import java.util.List;

/**
 * Outcome of resolving one term. Only {@link Status#RESOLVED} carries a canonical key; ambiguous
 * and unresolved terms keep their normalized text and the candidates that were considered.
 */
public record AliasResolution(Term term,
                              String canonicalKey,
                              Status status,
                              MatchMethod method,
                              double confidence,
                              List<AliasCandidate> candidates,
                              String reason) {

    public AliasResolution {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public static AliasResolution resolved(Term term, AliasCandidate winner, List<AliasCandidate> candidates) {
        return new AliasResolution(term, winner.canonicalKey(), Status.RESOLVED, winner.method(), winner.score(),
                candidates, "matched '" + winner.matchedAlias() + "' by " + winner.method().name().toLowerCase());
    }

    public static AliasResolution ambiguous(Term term, List<AliasCandidate> candidates, String reason) {
        return new AliasResolution(term, null, Status.AMBIGUOUS, MatchMethod.NONE, 0.0, candidates, reason);
    }

    public static AliasResolution unresolved(Term term, String reason) {
        return new AliasResolution(term, null, Status.UNRESOLVED, MatchMethod.NONE, 0.0, List.of(), reason);
    }

    public boolean isResolved() {
        return status == Status.RESOLVED;
    }

    /**
     * The text downstream stages should use for this term: the canonical key when resolved,
     * otherwise the normalized term unchanged.
     */
    public String effectiveText() {
        return isResolved() ? canonicalKey : term.normalized();
    }

    public enum Status {
        RESOLVED,
        AMBIGUOUS,
        UNRESOLVED
    }
}
