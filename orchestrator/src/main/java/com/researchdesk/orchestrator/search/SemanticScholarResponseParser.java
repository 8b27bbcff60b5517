package com.researchdesk.orchestrator.search;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.researchdesk.orchestrator.model.BackendKind;
import com.researchdesk.orchestrator.model.SourceHit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a Semantic Scholar paper-search response into {@link SourceHit}s.
 *
 * Individual malformed papers are skipped; a body that is not JSON at all is
 * a {@link SearchException.Kind#MALFORMED} failure.
 */
final class SemanticScholarResponseParser {

    private static final Logger log = LoggerFactory.getLogger(SemanticScholarResponseParser.class);

    private static final int MAX_TITLE   = 100;
    private static final int MAX_URL     = 150;
    private static final int MAX_AUTHORS = 3;

    private final ObjectMapper json;

    SemanticScholarResponseParser(ObjectMapper json) {
        this.json = json;
    }

    List<SourceHit> parse(String body, int count, int snippetLength) {
        JsonNode root;
        try {
            root = json.readTree(body);
        } catch (JsonProcessingException e) {
            throw new SearchException(BackendKind.ACADEMIC, SearchException.Kind.MALFORMED,
                    "response is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new SearchException(BackendKind.ACADEMIC, SearchException.Kind.MALFORMED,
                    "response is not a JSON object");
        }

        List<SourceHit> hits = new ArrayList<>();
        JsonNode papers = root.path("data");
        if (!papers.isArray()) {
            return hits;   // "no results" comes back without a data array
        }
        for (JsonNode paper : papers) {
            if (hits.size() >= count) break;
            if (!paper.isObject()) {
                log.warn("Skipping non-object paper entry in academic response");
                continue;
            }
            hits.add(toHit(paper, snippetLength));
        }
        return hits;
    }

    private SourceHit toHit(JsonNode paper, int snippetLength) {
        String title    = text(paper, "title", "Untitled Paper");
        String url      = text(paper, "url", "");
        String year     = paper.path("year").isNumber() ? paper.path("year").asText() : text(paper, "year", "");
        String venue    = text(paper, "venue", "");
        String abstrakt = text(paper, "abstract", "");
        String authors  = authors(paper.path("authors"));

        String pubInfo = authors + " (" + year + ")" + (venue.isEmpty() ? "" : " - " + venue);
        String abstractOrPlaceholder = abstrakt.isEmpty() ? "No abstract available" : abstrakt;
        String snippet = pubInfo.length() > 75
                ? pubInfo.substring(0, 75) + "... " + head(abstractOrPlaceholder, 125)
                : pubInfo + " " + abstractOrPlaceholder;

        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put(SourceHit.META_AUTHORS, authors);
        metadata.put(SourceHit.META_YEAR, year);
        metadata.put(SourceHit.META_VENUE, venue);
        metadata.put(SourceHit.META_ABSTRACT, abstrakt);

        return new SourceHit(head(title, MAX_TITLE), head(url, MAX_URL),
                head(snippet, snippetLength), BackendKind.ACADEMIC, metadata);
    }

    private static String authors(JsonNode authors) {
        if (!authors.isArray() || authors.isEmpty()) return "Unknown authors";
        List<String> names = new ArrayList<>();
        for (JsonNode author : authors) {
            String name = author.path("name").asText("");
            if (!name.isBlank() && names.size() < MAX_AUTHORS) names.add(name);
        }
        if (names.isEmpty()) return "Unknown authors";
        if (authors.size() > MAX_AUTHORS) names.add("et al.");
        return String.join(", ", names);
    }

    private static String text(JsonNode node, String field, String fallback) {
        JsonNode value = node.path(field);
        return value.isTextual() && !value.asText().isBlank() ? value.asText() : fallback;
    }

    private static String head(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max);
    }
}
