package com.aikb.rag.llm.openai;

import com.aikb.rag.error.UpstreamException;
import com.aikb.rag.http.Http;
import com.aikb.rag.json.Json;
import com.aikb.rag.llm.EmbeddingsClient;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

public final class OpenAIEmbeddingsClient implements EmbeddingsClient {
    private static final Logger log = LoggerFactory.getLogger(OpenAIEmbeddingsClient.class);

    private final String baseUrl;
    private final String model;
    private final String apiKey;

    public OpenAIEmbeddingsClient(String baseUrl, String model, String apiKey) {
        this.baseUrl = baseUrl;
        this.model = model;
        this.apiKey = apiKey;
    }

    @Override
    public List<Double> embed(String text) {
        long startTime = System.currentTimeMillis();
        try {
            ObjectNode body = Json.MAPPER.createObjectNode()
                    .put("model", model)
                    .put("input", text);

            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/v1/embeddings"))
                    .timeout(Duration.ofSeconds(30))
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(Json.MAPPER.writeValueAsString(body)));
            if (apiKey != null && !apiKey.isBlank()) {
                builder.header("Authorization", "Bearer " + apiKey);
            }

            HttpResponse<String> resp = Http.CLIENT.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() / 100 != 2) {
                throw new UpstreamException("Embedding endpoint returned HTTP " + resp.statusCode());
            }

            JsonNode vec = Json.MAPPER.readTree(resp.body()).at("/data/0/embedding");
            if (!vec.isArray() || vec.isEmpty()) {
                throw new UpstreamException("Embedding response has no data[0].embedding array");
            }

            List<Double> out = new ArrayList<>(vec.size());
            for (JsonNode n : vec) out.add(n.asDouble());

            log.debug("[EMBED TIMING] total={}ms dim={} textLen={}",
                    System.currentTimeMillis() - startTime, out.size(), text.length());
            return out;
        } catch (IOException e) {
            throw new UpstreamException("Embedding request failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamException("Embedding request interrupted", e);
        }
    }
}
