package com.jreinhal.assay.rag.critical;

public record CriticalDocument(String docId, int score, String reason) {
}
