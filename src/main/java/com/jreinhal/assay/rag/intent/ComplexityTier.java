package com.jreinhal.assay.rag.intent;

public enum ComplexityTier {
    SIMPLE,
    STANDARD,
    DEEP
}
