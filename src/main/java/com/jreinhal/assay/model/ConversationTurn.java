package com.jreinhal.assay.model;

public record ConversationTurn(String role, String content) {
    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";

    public boolean isDialogue() {
        return (USER.equals(role) || ASSISTANT.equals(role)) && content != null && !content.isBlank();
    }
}
