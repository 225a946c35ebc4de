package com.jreinhal.assay.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.jreinhal.assay.model.AnswerQuery;
import com.jreinhal.assay.model.ConversationTurn;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.Set;

/**
 * Body of {@code POST /api/rag/answer}. {@code authorizedProjectIds} is supplied by the gateway
 * that owns memberships; {@code projectIds} and {@code chunkIds} may only narrow it.
 */
public record AnswerRequest(@NotBlank String query,
                            @NotNull @JsonProperty("authorized_project_ids") Set<String> authorizedProjectIds,
                            @JsonProperty("project_ids") Set<String> projectIds,
                            @JsonProperty("chunk_ids") List<String> chunkIds,
                            @Valid @JsonProperty("conversation_history") List<HistoryTurn> conversationHistory) {

    public AnswerQuery toQuery() {
        List<ConversationTurn> history = conversationHistory == null ? List.of()
                : conversationHistory.stream().map(t -> new ConversationTurn(t.role(), t.content())).toList();
        return new AnswerQuery(query, authorizedProjectIds, projectIds, chunkIds, history);
    }

    public record HistoryTurn(String role, String content) {
    }
}
