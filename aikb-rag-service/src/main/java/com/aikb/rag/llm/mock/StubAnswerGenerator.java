package com.aikb.rag.llm.mock;

import com.aikb.rag.budget.TokenEstimator;
import com.aikb.rag.json.Json;
import com.aikb.rag.llm.AnswerGenerator;
import com.aikb.rag.llm.GenerationRequest;
import com.aikb.rag.llm.GenerationResponse;
import com.aikb.rag.model.TokenUsage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Demo-mode generator: answers with a fixed, well-formed JSON payload that states it
 * received the question and how much context it was given.
 */
public final class StubAnswerGenerator implements AnswerGenerator {

    @Override
    public GenerationResponse generate(GenerationRequest request) {
        boolean hasContext = !request.context().isBlank();

        ObjectNode payload = Json.MAPPER.createObjectNode();
        payload.put("answer", "[MOCK RESPONSE] No generative model is configured. Received the question: \""
                + request.question() + "\" with "
                + (hasContext ? TokenEstimator.estimate(request.context()) + " tokens of context." : "no context."));
        payload.put("confidence", "Low");
        payload.putArray("citations");
        payload.put("missing_information", hasContext ? "None" : "No matching documents were found.");

        try {
            String text = Json.MAPPER.writeValueAsString(payload);
            int promptTokens = TokenEstimator.estimate(request.question()) + TokenEstimator.estimate(request.context());
            return new GenerationResponse(text, TokenUsage.of(promptTokens, TokenEstimator.estimate(text)));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize mock answer", e);
        }
    }
}
