package com.researchdesk.orchestrator.report;

import com.researchdesk.orchestrator.model.ReportOptions;

/**
 * Turns aggregated raw research text into formatted prose.
 */
public interface ReportGenerator {

    /**
     * Whether a report can be attempted for this provider at all. False when
     * no credentials are configured; the pipeline then skips generation.
     */
    boolean isConfigured(String provider);

    /**
     * @throws GenerationException if the provider call fails
     */
    String generate(String query, String rawData, ReportOptions options);
}
