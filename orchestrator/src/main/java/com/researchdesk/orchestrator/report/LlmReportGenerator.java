package com.researchdesk.orchestrator.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.researchdesk.orchestrator.config.ResearchProperties;
import com.researchdesk.orchestrator.model.ReportOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.Function;

/**
 * {@link ReportGenerator} backed by hosted language models.
 *
 * A client exists only for providers whose API key is set; every other
 * provider reports {@link #isConfigured} = false.
 */
@Component
public class LlmReportGenerator implements ReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(LlmReportGenerator.class);

    private final Map<LlmProvider, LlmClient> clients = new EnumMap<>(LlmProvider.class);
    private final Map<LlmProvider, String>    defaultModels = new EnumMap<>(LlmProvider.class);

    @Autowired
    public LlmReportGenerator(ResearchProperties properties, ObjectMapper objectMapper) {
        ResearchProperties.Report report = properties.getReport();
        register(LlmProvider.OPENAI, report.getOpenai(), p -> new OpenAiCompatibleClient("OpenAI",
                p.getBaseUrl(), p.getApiKey(), report.getTimeout(), report.getMaxTokens(),
                report.getTemperature(), objectMapper));
        register(LlmProvider.GROQ, report.getGroq(), p -> new OpenAiCompatibleClient("Groq",
                p.getBaseUrl(), p.getApiKey(), report.getTimeout(), report.getMaxTokens(),
                report.getTemperature(), objectMapper));
        register(LlmProvider.ANTHROPIC, report.getAnthropic(), p -> new AnthropicClient(
                p.getBaseUrl(), p.getApiKey(), report.getTimeout(), report.getMaxTokens(),
                report.getTemperature(), objectMapper));
    }

    LlmReportGenerator(Map<LlmProvider, LlmClient> clients, Map<LlmProvider, String> defaultModels) {
        this.clients.putAll(clients);
        this.defaultModels.putAll(defaultModels);
    }

    @Override
    public boolean isConfigured(String provider) {
        return LlmProvider.fromWireName(provider).map(clients::containsKey).orElse(false);
    }

    @Override
    public String generate(String query, String rawData, ReportOptions options) {
        LlmProvider provider = LlmProvider.fromWireName(options.provider())
                .orElseThrow(() -> new GenerationException("Unknown provider: " + options.provider()));
        LlmClient client = clients.get(provider);
        if (client == null) {
            throw new GenerationException("Provider " + provider.wireName() + " is not configured");
        }
        String model = options.model() != null && !options.model().isBlank()
                ? options.model()
                : defaultModels.get(provider);

        log.info("Generating report with {} model {} ({} chars of research data)",
                provider.wireName(), model, rawData.length());
        String report = client.complete(model, ReportPrompts.SYSTEM, ReportPrompts.user(query, rawData));
        if (report == null || report.isBlank()) {
            throw new GenerationException(provider.wireName() + " returned an empty report");
        }
        return report;
    }

    private void register(LlmProvider provider, ResearchProperties.Provider settings,
                          Function<ResearchProperties.Provider, LlmClient> factory) {
        defaultModels.put(provider, settings.getDefaultModel());
        if (settings.hasApiKey()) {
            clients.put(provider, factory.apply(settings));
            log.info("Report provider {} configured (default model {})",
                    provider.wireName(), settings.getDefaultModel());
        } else {
            log.info("Report provider {} has no API key; reports requested from it will be skipped",
                    provider.wireName());
        }
    }
}
