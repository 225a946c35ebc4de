package com.jreinhal.assay.rag.intent;

/**
 * How much structured evidence a query needs. {@code FULL} builds the evidence graph and fails
 * closed when it is empty; {@code CHUNK_ONLY} answers from retrieved chunks alone.
 */
public enum EvidenceMode {
    FULL,
    CHUNK_ONLY
}
