package com.aikb.rag.model;

/**
 * One prior message of the conversation. {@code role} is {@code user} or {@code model}.
 */
public record ConversationTurn(String role, String content) {

    public ConversationTurn withContent(String newContent) {
        return new ConversationTurn(role, newContent);
    }
}
