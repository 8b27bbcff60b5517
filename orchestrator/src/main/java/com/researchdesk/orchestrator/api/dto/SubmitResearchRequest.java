package com.researchdesk.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request body for POST /research.
 *
 * Required: query
 * Optional: sources ("web", "academic", "both"), num_results, llm_provider,
 *   model. Missing values fall back to the configured defaults.
 */
public record SubmitResearchRequest(
        String query,
        String sources,
        @JsonProperty("num_results")  Integer numResults,
        @JsonProperty("llm_provider") String  llmProvider,
        String model
) {}
