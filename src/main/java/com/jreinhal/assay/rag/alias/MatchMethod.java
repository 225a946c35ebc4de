package com.jreinhal.assay.rag.alias;

public enum MatchMethod {
    EXACT,
    TRIGRAM,
    EMBEDDING,
    NONE
}
