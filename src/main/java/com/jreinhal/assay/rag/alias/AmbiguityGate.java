package com.jreinhal.assay.rag.alias;

/**
 * Decides whether the best candidate of a similarity ranking may be accepted. A best score under
 * the threshold is rejected; a best score that does not beat the runner-up by the configured
 * delta is ambiguous and must not be picked.
 */
public final class AmbiguityGate {
    private static final double EPSILON = 1e-9;

    private AmbiguityGate() {
    }

    public static Decision evaluate(double best, double secondBest, double acceptThreshold, double delta) {
        if (best + EPSILON < acceptThreshold) {
            return Decision.REJECT;
        }
        if (best - secondBest + EPSILON < delta) {
            return Decision.AMBIGUOUS;
        }
        return Decision.ACCEPT;
    }

    public enum Decision {
        ACCEPT,
        AMBIGUOUS,
        REJECT
    }
}
