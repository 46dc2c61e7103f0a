package com.aikb.rag.model;

import com.aikb.rag.error.ValidationException;

import java.util.List;
import java.util.Objects;

public record QueryRequest(
        String queryText,
        String userId,
        UserProfile userProfile,
        List<ConversationTurn> conversationHistory
) {
    public void validate(int maxLength) {
        if (queryText == null || queryText.isBlank()) {
            throw new ValidationException("queryText is required");
        }
        if (queryText.length() > maxLength) {
            throw new ValidationException("queryText must be at most " + maxLength + " characters");
        }
        if (conversationHistory != null && conversationHistory.stream().anyMatch(Objects::isNull)) {
            throw new ValidationException("conversationHistory must not contain null turns");
        }
    }

    public String userIdOrAnonymous() {
        return userId == null || userId.isBlank() ? "anonymous" : userId;
    }

    public UserProfile profileOrDefault() {
        return userProfile != null ? userProfile : UserProfile.ANONYMOUS;
    }

    public List<ConversationTurn> historyOrEmpty() {
        return conversationHistory != null ? conversationHistory : List.of();
    }
}
