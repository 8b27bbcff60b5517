package com.researchdesk.orchestrator.extract;

import com.researchdesk.orchestrator.model.ExtractedContent;
import com.researchdesk.orchestrator.model.SourceHit;

/**
 * Reduces a page to bounded, plain readable text.
 *
 * Implementations are shared by all jobs and must be thread-safe.
 */
public interface ContentExtractor {

    /**
     * Fetch and extract one URL.
     *
     * Text longer than the configured maximum is truncated; documents above
     * the hard size ceiling fail with {@link ExtractionException.Kind#TOO_LARGE}.
     *
     * @throws ExtractionException on any failure
     */
    ExtractedContent extract(String url);

    /**
     * Extract content for a search hit. Implementations may use what the
     * backend already returned (an abstract, say) instead of fetching.
     */
    default ExtractedContent extract(SourceHit hit) {
        return extract(hit.url());
    }
}
