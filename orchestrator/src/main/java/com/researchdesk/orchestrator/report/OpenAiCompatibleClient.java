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
 * Chat-completions client. Serves both OpenAI and Groq, which expose the
 * same wire format under different base URLs.
 */
class OpenAiCompatibleClient implements LlmClient {

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ChatResponse(List<Choice> choices) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        record Choice(Message message) {}

        @JsonIgnoreProperties(ignoreUnknown = true)
        record Message(String role, String content) {}

        String firstContent() {
            if (choices == null || choices.isEmpty() || choices.get(0).message() == null
                    || choices.get(0).message().content() == null) {
                throw new GenerationException("Chat completion response has no content");
            }
            return choices.get(0).message().content();
        }
    }

    private final String       providerName;
    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final String       apiKey;
    private final Duration     timeout;
    private final int          maxTokens;
    private final double       temperature;

    OpenAiCompatibleClient(String providerName, String baseUrl, String apiKey, Duration timeout,
                           int maxTokens, double temperature, ObjectMapper objectMapper) {
        this.providerName = providerName;
        this.baseUrl      = baseUrl;
        this.apiKey       = apiKey;
        this.timeout      = timeout;
        this.maxTokens    = maxTokens;
        this.temperature  = temperature;
        this.json         = objectMapper;
        this.http         = HttpClient.newBuilder()
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
                    "messages",    List.of(
                            Map.of("role", "system", "content", systemPrompt),
                            Map.of("role", "user",   "content", userPrompt))
            ));

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/chat/completions"))
                    .timeout(timeout)
                    .header("Content-Type",  "application/json")
                    .header("Authorization", "Bearer " + apiKey)
                    .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                    .build();

            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new GenerationException(
                        "%s API error %d: %s".formatted(providerName, response.statusCode(), response.body()),
                        response.statusCode(), null);
            }
            return json.readValue(response.body(), ChatResponse.class).firstContent();

        } catch (GenerationException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationException(providerName + " API call interrupted", e);
        } catch (Exception e) {
            throw new GenerationException(providerName + " API call failed: " + e.getMessage(), e);
        }
    }
}
