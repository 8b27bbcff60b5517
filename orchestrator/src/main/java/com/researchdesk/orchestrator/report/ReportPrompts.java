package com.researchdesk.orchestrator.report;

/**
 * Prompt text sent to the report provider.
 */
final class ReportPrompts {

    static final String SYSTEM =
            "You are a professional research analyst creating comprehensive reports.";

    private ReportPrompts() {}

    static String user(String query, String rawData) {
        return """
                Based on the following research data, create a comprehensive research report on: "%s"

                Research Data:
                %s

                Please create a well-structured report with the following sections:
                1. Executive Summary
                2. Key Findings
                3. Detailed Analysis
                4. Sources and References
                5. Conclusions and Implications

                Format the output in clean markdown with proper headings, bullet points, and citations where appropriate.
                Make the report professional, comprehensive, and easy to read.
                """.formatted(query, rawData);
    }
}
