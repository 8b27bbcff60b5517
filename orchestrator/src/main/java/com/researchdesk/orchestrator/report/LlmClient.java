package com.researchdesk.orchestrator.report;

/**
 * One single-turn completion against a language-model provider.
 */
public interface LlmClient {

    /**
     * @return the assistant's text reply
     * @throws GenerationException on transport or API errors
     */
    String complete(String model, String systemPrompt, String userPrompt);
}
