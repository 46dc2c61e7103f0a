package com.aikb.rag.service;

import com.aikb.rag.error.MalformedResponseException;
import com.aikb.rag.json.Json;
import com.aikb.rag.model.AnswerCitation;
import com.aikb.rag.model.StructuredAnswer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Validates the generator's raw output against the answer schema
 * {@code {answer, confidence, citations[{source, quote}], missing_information}}.
 * Anything that does not match is rejected, never passed through as an answer.
 */
public class GeneratedAnswerParser {

    private static final Set<String> CONFIDENCE_LEVELS = Set.of("High", "Medium", "Low");

    public StructuredAnswer parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new MalformedResponseException("Generator returned an empty response");
        }

        JsonNode root;
        try {
            root = Json.MAPPER.readTree(stripCodeFence(raw.trim()));
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException("Generator response is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedResponseException("Generator response is not a JSON object");
        }

        String answer = requiredText(root, "answer");
        String confidence = normalizeConfidence(requiredText(root, "confidence"));

        List<AnswerCitation> citations = new ArrayList<>();
        JsonNode citationsNode = root.get("citations");
        if (citationsNode != null && !citationsNode.isNull()) {
            if (!citationsNode.isArray()) {
                throw new MalformedResponseException("'citations' must be an array");
            }
            for (JsonNode c : citationsNode) {
                if (!c.isObject()) {
                    throw new MalformedResponseException("Each citation must be an object");
                }
                citations.add(new AnswerCitation(requiredText(c, "source"), requiredText(c, "quote")));
            }
        }

        JsonNode missing = root.get("missing_information");
        if (missing != null && !missing.isNull() && !missing.isTextual()) {
            throw new MalformedResponseException("'missing_information' must be a string");
        }

        return new StructuredAnswer(answer, confidence, citations,
                missing == null || missing.isNull() ? null : missing.asText());
    }

    private static String requiredText(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || !v.isTextual()) {
            throw new MalformedResponseException("Missing or non-string field '" + field + "'");
        }
        return v.asText();
    }

    private static String normalizeConfidence(String value) {
        for (String level : CONFIDENCE_LEVELS) {
            if (level.equalsIgnoreCase(value.trim())) return level;
        }
        throw new MalformedResponseException("Unknown confidence level '" + value + "'");
    }

    // Some models wrap JSON in ```json fences even in JSON mode
    static String stripCodeFence(String text) {
        if (!text.startsWith("```")) return text;
        int firstNewline = text.indexOf('\n');
        int closing = text.lastIndexOf("```");
        if (firstNewline < 0 || closing <= firstNewline) return text;
        return text.substring(firstNewline + 1, closing).trim();
    }
}
