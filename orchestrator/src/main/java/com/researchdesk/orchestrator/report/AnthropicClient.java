package com.researchdesk.orchestrator.report;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Thin wrapper around the Anthropic Messages API.
 *
 * Raw java.net.http rather than an SDK: one POST, one JSON shape, and the
 * exact status code is needed to report failures.
 */
class AnthropicClient implements LlmClient {

    private static final String API_VER = "2023-06-01";

    /**
     * The subset of the API response we care about.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record MessagesResponse(List<ContentBlock> content) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        record ContentBlock(String type, String text) {}

        String firstText() {
            if (content == null) {
                throw new GenerationException("Anthropic response has no content");
            }
            return content.stream()
                    .filter(b -> "text".equals(b.type()))
                    .map(ContentBlock::text)
                    .findFirst()
                    .orElseThrow(() -> new GenerationException("No text block in Anthropic response"));
        }
    }

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final String       apiKey;
    private final Duration     timeout;
    private final int          maxTokens;
    private final double       temperature;

    AnthropicClient(String baseUrl, String apiKey, Duration timeout, int maxTokens, double temperature,
                    ObjectMapper objectMapper) {
        this.baseUrl     = baseUrl;
        this.apiKey      = apiKey;
        this.timeout     = timeout;
        this.maxTokens   = maxTokens;
        this.temperature = temperature;
        this.json        = objectMapper;
        this.http        = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public String complete(String model, String systemPrompt, String userPrompt) {
        try {
            String requestBody = json.writeValueAsString(Map.of(
                    "model",       model,
                    "max_tokens",  maxTokens,
                    "temperature", temperature,
                    "system",      systemPrompt,
                    "messages",    List.of(Map.of("role", "user", "content", userPrompt))
            ));

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/messages"))
                    .timeout(timeout)
                    .header("content-type",      "application/json")
                    .header("x-api-key",         apiKey)
                    .header("anthropic-version", API_VER)
                    .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                    .build();

            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new GenerationException(
                        "Anthropic API error %d: %s".formatted(response.statusCode(), response.body()),
                        response.statusCode(), null);
            }
            return json.readValue(response.body(), MessagesResponse.class).firstText();

        } catch (GenerationException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationException("Anthropic API call interrupted", e);
        } catch (Exception e) {
            throw new GenerationException("Anthropic API call failed: " + e.getMessage(), e);
        }
    }
}
