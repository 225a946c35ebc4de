package com.jreinhal.assay.rag.answer;

import com.jreinhal.assay.model.ConversationTurn;
import java.util.List;

public record GenerationPrompt(String systemPrompt, String userPrompt, List<ConversationTurn> history, int maxTokens) {

    public GenerationPrompt {
        history = history == null ? List.of() : List.copyOf(history);
    }
}
