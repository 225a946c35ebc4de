package com.jreinhal.assay.rag.hybridrag;

import com.jreinhal.assay.model.Chunk;
import java.util.List;

/**
 * Result of one retrieval path. A degraded path carries no chunks and the reason it failed.
 */
public record PathOutcome(String path, Status status, List<Chunk> chunks, String reason, long elapsedMs) {

    public PathOutcome {
        chunks = chunks == null ? List.of() : List.copyOf(chunks);
    }

    public static PathOutcome ok(String path, List<Chunk> chunks, long elapsedMs) {
        return new PathOutcome(path, Status.OK, chunks, null, elapsedMs);
    }

    public static PathOutcome degraded(String path, String reason, long elapsedMs) {
        return new PathOutcome(path, Status.DEGRADED, List.of(), reason, elapsedMs);
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    public enum Status {
        OK,
        DEGRADED
    }
}
