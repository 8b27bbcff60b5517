package com.researchdesk.orchestrator.report;

import java.util.Locale;
import java.util.Optional;

/**
 * Language-model providers that can format a report.
 * OPENAI and GROQ speak the same chat-completions protocol.
 */
public enum LlmProvider {
    OPENAI,
    ANTHROPIC,
    GROQ;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<LlmProvider> fromWireName(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
