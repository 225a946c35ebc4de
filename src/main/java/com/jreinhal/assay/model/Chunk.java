package com.jreinhal.assay.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A retrieved chunk with the scores each retrieval path gave it. {@code projectId} is
 * {@code null} for global chunks.
 */
public record Chunk(String chunkId,
                    String projectId,
                    String projectName,
                    String sourceType,
                    String sourceId,
                    String title,
                    String text,
                    int chunkIndex,
                    Map<String, Object> metadata,
                    double scoreFts,
                    double scoreSemantic,
                    double scoreFinal) {

    public Chunk {
        metadata = metadata == null ? Map.of() : copyWithoutNulls(metadata);
        text = text == null ? "" : text;
    }

    // stored chunk metadata may carry null values, which Map.copyOf rejects
    private static Map<String, Object> copyWithoutNulls(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, value);
            }
        });
        return Collections.unmodifiableMap(copy);
    }

    public boolean isGlobal() {
        return projectId == null || projectId.isBlank();
    }

    /**
     * Identity of the source the chunk was cut from; two chunks with the same key are duplicates
     * for ranking purposes.
     */
    public String sourceKey() {
        return sourceType + ":" + (sourceId != null ? sourceId : chunkId);
    }

    public Chunk withScores(double fts, double semantic, double fin) {
        return new Chunk(chunkId, projectId, projectName, sourceType, sourceId, title, text, chunkIndex, metadata,
                fts, semantic, fin);
    }

    public static Chunk fromDocument(SearchChunk doc, double ftsScore) {
        return new Chunk(doc.getId(), doc.getProjectId(), doc.getProjectName(), doc.getSourceType(), doc.getSourceId(),
                doc.getTitle(), doc.getChunkText(), doc.getChunkIndex(), doc.getMetadata(), ftsScore, 0.0, ftsScore);
    }
}
