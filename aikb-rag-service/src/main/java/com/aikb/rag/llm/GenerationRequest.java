package com.aikb.rag.llm;

import com.aikb.rag.model.ConversationTurn;
import com.aikb.rag.model.UserProfile;

import java.util.List;

/**
 * @param question the user's question, unredacted
 * @param context  assembled context already cut to the token ceiling, may be empty
 * @param history  prior turns, already redacted
 */
public record GenerationRequest(
        String question,
        String context,
        List<ConversationTurn> history,
        UserProfile userProfile
) {
    public GenerationRequest {
        context = context == null ? "" : context;
        history = history == null ? List.of() : List.copyOf(history);
    }
}
