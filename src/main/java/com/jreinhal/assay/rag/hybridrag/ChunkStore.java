package com.jreinhal.assay.rag.hybridrag;

import com.jreinhal.assay.model.Chunk;
import com.jreinhal.assay.model.ProjectScope;
import java.util.Collection;
import java.util.List;

/**
 * Chunk search backends. Implementations should already restrict results to the scope; the
 * retriever filters again either way.
 */
public interface ChunkStore {

    /**
     * Full-text search; {@code scoreFts} is normalized to [0, 1].
     */
    List<Chunk> lexicalSearch(String query, ProjectScope scope, int limit);

    /**
     * Vector similarity search; {@code scoreSemantic} is in [0, 1].
     */
    List<Chunk> semanticSearch(String query, ProjectScope scope, int limit);

    /**
     * Case-insensitive containment of any of the terms. Scores are left at zero for the caller to set.
     */
    List<Chunk> substringSearch(List<String> terms, ProjectScope scope, int limit);

    List<Chunk> findByIds(Collection<String> chunkIds, ProjectScope scope);
}
