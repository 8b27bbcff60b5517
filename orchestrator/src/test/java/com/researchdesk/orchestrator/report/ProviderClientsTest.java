package com.researchdesk.orchestrator.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Wire format of the two provider clients, checked against a local JDK HttpServer.
 */
class ProviderClientsTest {

    private final ObjectMapper json = new ObjectMapper();

    private HttpServer server;
    private final AtomicInteger status = new AtomicInteger(200);
    private final AtomicReference<String> response = new AtomicReference<>("{}");
    private final AtomicReference<String> requestBody = new AtomicReference<>();
    private final AtomicReference<String> requestPath = new AtomicReference<>();
    private final AtomicReference<String> authorization = new AtomicReference<>();
    private final AtomicReference<String> apiKeyHeader = new AtomicReference<>();

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            requestPath.set(exchange.getRequestURI().getPath());
            requestBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            authorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
            apiKeyHeader.set(exchange.getRequestHeaders().getFirst("x-api-key"));
            byte[] bytes = response.get().getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status.get(), bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    @Test
    void openAiCompatible_postsChatCompletionWithBearerToken() throws Exception {
        response.set("""
                {"choices": [{"message": {"role": "assistant", "content": "# Findings"}}]}
                """);
        OpenAiCompatibleClient client = new OpenAiCompatibleClient("Groq", baseUrl(), "gsk-test",
                Duration.ofSeconds(5), 500, 0.1, json);

        String text = client.complete("llama", "system text", "user text");

        assertThat(text).isEqualTo("# Findings");
        assertThat(requestPath.get()).isEqualTo("/v1/chat/completions");
        assertThat(authorization.get()).isEqualTo("Bearer gsk-test");
        JsonNode body = json.readTree(requestBody.get());
        assertThat(body.path("model").asText()).isEqualTo("llama");
        assertThat(body.path("messages").get(0).path("role").asText()).isEqualTo("system");
        assertThat(body.path("messages").get(1).path("content").asText()).isEqualTo("user text");
    }

    @Test
    void anthropic_postsMessagesWithApiKeyAndSystemField() throws Exception {
        response.set("""
                {"content": [{"type": "text", "text": "# Summary"}], "stop_reason": "end_turn"}
                """);
        AnthropicClient client = new AnthropicClient(baseUrl(), "sk-ant-test", Duration.ofSeconds(5), 500, 0.1, json);

        String text = client.complete("claude", "system text", "user text");

        assertThat(text).isEqualTo("# Summary");
        assertThat(requestPath.get()).isEqualTo("/v1/messages");
        assertThat(apiKeyHeader.get()).isEqualTo("sk-ant-test");
        JsonNode body = json.readTree(requestBody.get());
        assertThat(body.path("system").asText()).isEqualTo("system text");
        assertThat(body.path("messages").get(0).path("content").asText()).isEqualTo("user text");
    }

    @Test
    void errorStatus_becomesGenerationExceptionWithStatusCode() {
        status.set(401);
        response.set("{\"error\": \"invalid key\"}");
        OpenAiCompatibleClient client = new OpenAiCompatibleClient("OpenAI", baseUrl(), "bad",
                Duration.ofSeconds(5), 500, 0.1, json);

        assertThatThrownBy(() -> client.complete("gpt-4", "s", "u"))
                .isInstanceOfSatisfying(GenerationException.class, e -> {
                    assertThat(e.statusCode()).isEqualTo(401);
                    assertThat(e.getMessage()).contains("OpenAI API error 401");
                });
    }

    @Test
    void unexpectedBody_becomesGenerationException() {
        response.set("{\"choices\": []}");
        OpenAiCompatibleClient client = new OpenAiCompatibleClient("OpenAI", baseUrl(), "key",
                Duration.ofSeconds(5), 500, 0.1, json);

        assertThatThrownBy(() -> client.complete("gpt-4", "s", "u")).isInstanceOf(GenerationException.class);
    }

    private String baseUrl() {
        return "http://127.0.0.1:" + server.getAddress().getPort() + "/v1";
    }
}
