package com.researchdesk.orchestrator.model;

import java.util.Map;

/**
 * One result record returned by a search backend, before content extraction.
 *
 * metadata carries backend-specific extras; the academic backend stores
 * authors, year, venue and abstract there.
 */
public record SourceHit(
        String              title,
        String              url,
        String              snippet,
        BackendKind         backendKind,
        Map<String, String> metadata
) {
    public static final String META_AUTHORS  = "authors";
    public static final String META_YEAR     = "year";
    public static final String META_VENUE    = "venue";
    public static final String META_ABSTRACT = "abstract";

    public SourceHit {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public SourceHit(String title, String url, String snippet, BackendKind backendKind) {
        this(title, url, snippet, backendKind, Map.of());
    }

    public String meta(String key) {
        return metadata.get(key);
    }
}
