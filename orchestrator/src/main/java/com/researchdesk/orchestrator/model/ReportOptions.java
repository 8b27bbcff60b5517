package com.researchdesk.orchestrator.model;

/**
 * Which language-model provider and model should format the final report.
 * model may be null, in which case the provider's default model is used.
 */
public record ReportOptions(String provider, String model) {}
