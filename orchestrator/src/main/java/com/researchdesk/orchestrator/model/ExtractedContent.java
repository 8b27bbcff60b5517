package com.researchdesk.orchestrator.model;

import java.time.Instant;

/**
 * Readable content produced by the extractor for one hit.
 * content is already bounded to the configured maximum length.
 */
public record ExtractedContent(
        String  title,
        String  url,
        String  description,
        String  content,
        Instant extractedAt
) {}
