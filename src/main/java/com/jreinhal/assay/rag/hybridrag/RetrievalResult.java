package com.jreinhal.assay.rag.hybridrag;

import com.jreinhal.assay.model.Chunk;
import java.util.ArrayList;
import java.util.List;

public record RetrievalResult(List<Chunk> chunks,
                              PathOutcome lexical,
                              PathOutcome semantic,
                              boolean substringFallback,
                              int droppedOutOfScope) {

    public RetrievalResult {
        chunks = List.copyOf(chunks);
    }

    public boolean isDegraded() {
        return !lexical.isOk() || !semantic.isOk() || substringFallback;
    }

    public List<String> diagnostics() {
        List<String> notes = new ArrayList<>();
        if (!lexical.isOk()) {
            notes.add("lexical search degraded: " + lexical.reason());
        }
        if (!semantic.isOk()) {
            notes.add("semantic search degraded: " + semantic.reason());
        }
        if (substringFallback) {
            notes.add("structured search returned nothing; substring fallback used");
        }
        if (droppedOutOfScope > 0) {
            notes.add(droppedOutOfScope + " out-of-scope chunks discarded");
        }
        return notes;
    }
}
