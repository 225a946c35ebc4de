package com.jreinhal.assay.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ChunkTest {

    @Test
    void nullMetadataValuesAreDropped() {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("title", "T");
        metadata.put("page", null);

        Chunk chunk = new Chunk("c1", "p1", "Resins", "document", "doc-1", "T", "text", 0, metadata, 0, 0, 0.5);

        assertThat(chunk.metadata()).containsOnlyKeys("title").containsEntry("title", "T");
        assertThatThrownBy(() -> chunk.metadata().put("x", 1)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void storedChunkWithSparseMetadataConverts() {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("section", "Results");
        metadata.put("figure", null);
        SearchChunk doc = new SearchChunk();
        doc.setId("c2");
        doc.setProjectId("p1");
        doc.setSourceType("experiment");
        doc.setSourceId("e1");
        doc.setChunkText("Flexural strength reached 131.5 MPa");
        doc.setMetadata(metadata);

        Chunk chunk = Chunk.fromDocument(doc, 0.7);

        assertThat(chunk.metadata()).containsOnlyKeys("section");
        assertThat(chunk.scoreFts()).isEqualTo(0.7);
        assertThat(chunk.sourceKey()).isEqualTo("experiment:e1");
    }
}
