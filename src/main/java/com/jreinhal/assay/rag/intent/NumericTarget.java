package com.jreinhal.assay.rag.intent;

/**
 * A number the question itself names, with the tolerance used when matching it against data.
 */
public record NumericTarget(double value, double tolerance) {

    public static NumericTarget of(double value) {
        return new NumericTarget(value, value > 10 ? 3.0 : 0.05);
    }

    public boolean matches(double candidate) {
        return Math.abs(candidate - value) <= tolerance;
    }
}
