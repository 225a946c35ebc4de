package com.jreinhal.assay.model;

import java.util.List;
import java.util.Set;

/**
 * Immutable input of one answer request. {@code projectScope} and {@code chunkIds} are optional
 * narrowing of what the caller is allowed to read.
 */
public record AnswerQuery(String text,
                          Set<String> authorizedProjectIds,
                          Set<String> projectScope,
                          List<String> chunkIds,
                          List<ConversationTurn> history) {

    public AnswerQuery {
        authorizedProjectIds = authorizedProjectIds == null ? Set.of() : Set.copyOf(authorizedProjectIds);
        projectScope = projectScope == null ? Set.of() : Set.copyOf(projectScope);
        chunkIds = chunkIds == null ? List.of() : List.copyOf(chunkIds);
        history = history == null ? List.of() : List.copyOf(history);
    }

    public static AnswerQuery of(String text, Set<String> authorizedProjectIds) {
        return new AnswerQuery(text, authorizedProjectIds, Set.of(), List.of(), List.of());
    }
}
