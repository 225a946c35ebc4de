package com.jreinhal.assay.model;

import java.util.Set;

/**
 * The set of projects a query may read from. Global records (no project) are always in scope.
 */
public record ProjectScope(Set<String> projectIds) {

    public ProjectScope {
        projectIds = Set.copyOf(projectIds);
    }

    public static ProjectScope of(String... projectIds) {
        return new ProjectScope(Set.of(projectIds));
    }

    public boolean permits(String projectId) {
        return projectId == null || projectId.isBlank() || projectIds.contains(projectId);
    }

    public boolean permits(Chunk chunk) {
        return chunk != null && permits(chunk.projectId());
    }

    public boolean isEmpty() {
        return projectIds.isEmpty();
    }
}
