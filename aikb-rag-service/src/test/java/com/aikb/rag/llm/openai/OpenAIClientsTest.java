package com.aikb.rag.llm.openai;

import com.aikb.rag.error.UpstreamException;
import com.aikb.rag.llm.GenerationRequest;
import com.aikb.rag.llm.GenerationResponse;
import com.aikb.rag.model.UserProfile;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Exercises the OpenAI-compatible clients against a local HTTP server.
 */
class OpenAIClientsTest {

    private HttpServer server;
    private String baseUrl;
    private final AtomicReference<String> lastBody = new AtomicReference<>();
    private final AtomicReference<String> lastAuth = new AtomicReference<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private void respond(String path, int status, String body) {
        server.createContext(path, exchange -> {
            lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            lastAuth.set(exchange.getRequestHeaders().getFirst("Authorization"));
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        });
    }

    @Test
    @DisplayName("Should parse the embedding vector")
    void shouldParseEmbedding() {
        respond("/v1/embeddings", 200, "{\"data\": [{\"embedding\": [0.1, -0.2, 0.3]}]}");

        List<Double> vector = new OpenAIEmbeddingsClient(baseUrl, "embed-model", "sk-test").embed("leave policy");

        assertThat(vector).containsExactly(0.1, -0.2, 0.3);
        assertThat(lastBody.get()).contains("\"model\":\"embed-model\"").contains("leave policy");
        assertThat(lastAuth.get()).isEqualTo("Bearer sk-test");
    }

    @Test
    @DisplayName("Should fail with UpstreamException on embedding HTTP errors")
    void shouldFailOnEmbeddingHttpError() {
        respond("/v1/embeddings", 500, "{\"error\": \"overloaded\"}");

        assertThatThrownBy(() -> new OpenAIEmbeddingsClient(baseUrl, "m", null).embed("x"))
                .isInstanceOf(UpstreamException.class)
                .hasMessageContaining("500");
    }

    @Test
    @DisplayName("Should return model content and token usage")
    void shouldReturnContentAndUsage() {
        respond("/v1/chat/completions", 200, """
                {"choices": [{"message": {"role": "assistant", "content": "{\\"answer\\": \\"25 days\\"}"}}],
                 "usage": {"prompt_tokens": 120, "completion_tokens": 30, "total_tokens": 150}}""");

        GenerationResponse response = new OpenAIAnswerGenerator(baseUrl, "chat-model", "", 0.2, 512)
                .generate(new GenerationRequest("How many days?", "SOURCE: Leave\nCONTENT: 25 days",
                        List.of(), UserProfile.ANONYMOUS));

        assertThat(response.text()).isEqualTo("{\"answer\": \"25 days\"}");
        assertThat(response.usage().totalTokens()).isEqualTo(150);
        assertThat(lastBody.get()).contains("json_object").contains("<context_data>");
        assertThat(lastAuth.get()).isNull();
    }

    @Test
    @DisplayName("Should fail with UpstreamException when the chat response has no content")
    void shouldFailOnMissingContent() {
        respond("/v1/chat/completions", 200, "{\"choices\": []}");

        assertThatThrownBy(() -> new OpenAIAnswerGenerator(baseUrl, "m", null, 0.2, 64)
                .generate(new GenerationRequest("q", "", List.of(), null)))
                .isInstanceOf(UpstreamException.class);
    }
}
