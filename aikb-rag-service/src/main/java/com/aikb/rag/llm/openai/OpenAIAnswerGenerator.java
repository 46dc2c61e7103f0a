package com.aikb.rag.llm.openai;

import com.aikb.rag.error.UpstreamException;
import com.aikb.rag.http.Http;
import com.aikb.rag.json.Json;
import com.aikb.rag.llm.AnswerGenerator;
import com.aikb.rag.llm.AnswerPrompts;
import com.aikb.rag.llm.GenerationRequest;
import com.aikb.rag.llm.GenerationResponse;
import com.aikb.rag.model.TokenUsage;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Chat-completions client for any OpenAI-compatible server (OpenAI, llama.cpp, Ollama).
 * Asks for a JSON object response; the pipeline validates the shape.
 */
public final class OpenAIAnswerGenerator implements AnswerGenerator {
    private static final Logger log = LoggerFactory.getLogger(OpenAIAnswerGenerator.class);

    private final String baseUrl;
    private final String model;
    private final String apiKey;
    private final double temperature;
    private final int maxTokens;

    public OpenAIAnswerGenerator(String baseUrl, String model, String apiKey, double temperature, int maxTokens) {
        this.baseUrl = baseUrl;
        this.model = model;
        this.apiKey = apiKey;
        this.temperature = temperature;
        this.maxTokens = maxTokens;
    }

    @Override
    public GenerationResponse generate(GenerationRequest request) {
        long startTime = System.currentTimeMillis();
        try {
            ObjectNode body = Json.MAPPER.createObjectNode();
            body.put("model", model);
            body.put("temperature", temperature);
            body.put("max_tokens", maxTokens);
            body.put("stream", false);
            body.putObject("response_format").put("type", "json_object");

            ArrayNode messages = body.putArray("messages");
            messages.addObject()
                    .put("role", "system")
                    .put("content", AnswerPrompts.SYSTEM);
            messages.addObject()
                    .put("role", "user")
                    .put("content", AnswerPrompts.user(request));

            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/v1/chat/completions"))
                    .timeout(Duration.ofSeconds(120))
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(Json.MAPPER.writeValueAsString(body)));
            if (apiKey != null && !apiKey.isBlank()) {
                builder.header("Authorization", "Bearer " + apiKey);
            }

            HttpResponse<String> resp = Http.CLIENT.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() / 100 != 2) {
                throw new UpstreamException("Chat endpoint returned HTTP " + resp.statusCode());
            }

            JsonNode root = Json.MAPPER.readTree(resp.body());
            JsonNode content = root.at("/choices/0/message/content");
            if (!content.isTextual()) {
                throw new UpstreamException("Chat response has no choices[0].message.content");
            }

            JsonNode usage = root.path("usage");
            TokenUsage tokens = new TokenUsage(
                    usage.path("prompt_tokens").asInt(0),
                    usage.path("completion_tokens").asInt(0),
                    usage.path("total_tokens").asInt(0));

            log.debug("[CHAT TIMING] total={}ms promptTokens={} completionTokens={}",
                    System.currentTimeMillis() - startTime, tokens.promptTokens(), tokens.completionTokens());
            return new GenerationResponse(content.asText(), tokens);
        } catch (IOException e) {
            throw new UpstreamException("Chat request failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamException("Chat request interrupted", e);
        }
    }
}
