package com.researchdesk.orchestrator.pipeline;

import com.researchdesk.orchestrator.extract.TextUtils;
import com.researchdesk.orchestrator.model.BackendKind;
import com.researchdesk.orchestrator.model.ExtractedContent;
import com.researchdesk.orchestrator.model.ReportOptions;
import com.researchdesk.orchestrator.model.SourceHit;
import com.researchdesk.orchestrator.model.SourceSelection;
import com.researchdesk.orchestrator.search.SearchException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class RawDataFormatterTest {

    private final JobContext ctx = new JobContext(UUID.randomUUID(), "coral reef bleaching",
            SourceSelection.BOTH, 1, new ReportOptions("openai", null));

    @Test
    void format_includesHitsExtractedSourcesAndBackendNotes() {
        SourceHit web = new SourceHit("Reef report", "https://reefs.example/report", "Bleaching rises",
                BackendKind.WEB);
        SourceHit skipped = new SourceHit("Paywalled", "https://paywall.example/x", "Locked", BackendKind.WEB);
        ExtractedContent content = new ExtractedContent("Reef report", "https://reefs.example/report",
                "Annual survey", "Coral cover fell sharply this year.", Instant.now());

        String raw = new RawDataFormatter(20_000).format(ctx, List.of(
                new BackendResult(BackendKind.WEB, List.of(web, skipped), List.of(content), 1, null),
                BackendResult.failed(BackendKind.ACADEMIC,
                        SearchException.forStatus(BackendKind.ACADEMIC, 429))));

        assertThat(raw).startsWith("Research Query: coral reef bleaching");
        assertThat(raw).contains("Searched web and academic sources - Found 2 results");
        assertThat(raw).contains("SEARCH RESULTS:", "1. Reef report", "URL: https://reefs.example/report");
        assertThat(raw).contains("DETAILED CONTENT FROM TOP 1 SOURCES:", "SOURCE 1: Reef report",
                "Coral cover fell sharply this year.");
        assertThat(raw).doesNotContain("SOURCE 2:");
        assertThat(raw).contains("RESEARCH SUMMARY:", "target was 2, but only 1 valid sources found",
                "Skipped 1 sources");
        assertThat(raw).contains("BACKEND NOTES:", "academic search unavailable", "rate limited");
    }

    @Test
    void format_withoutDegradation_hasNoNotesSection() {
        ExtractedContent a = new ExtractedContent("A", "https://a.example", "d", "text a", Instant.now());
        ExtractedContent b = new ExtractedContent("B", "https://b.example", "d", "text b", Instant.now());

        String raw = new RawDataFormatter(20_000).format(ctx, List.of(
                new BackendResult(BackendKind.WEB,
                        List.of(new SourceHit("A", "https://a.example", "s", BackendKind.WEB)), List.of(a), 0, null),
                new BackendResult(BackendKind.ACADEMIC,
                        List.of(new SourceHit("B", "https://b.example", "s", BackendKind.ACADEMIC)), List.of(b), 0, null)));

        assertThat(raw).contains("(target of 2 achieved)");
        assertThat(raw).doesNotContain("BACKEND NOTES:");
    }

    @Test
    void format_isCappedAtMaxLength() {
        String longText = "Coral reefs are under pressure. ".repeat(200);
        ExtractedContent content = new ExtractedContent("Long", "https://long.example", "d", longText,
                Instant.now());

        String raw = new RawDataFormatter(1_000).format(ctx, List.of(
                new BackendResult(BackendKind.WEB,
                        List.of(new SourceHit("Long", "https://long.example", "s", BackendKind.WEB)),
                        List.of(content), 0, null)));

        assertThat(raw).endsWith(TextUtils.TRUNCATION_NOTICE);
        assertThat(raw.length()).isLessThanOrEqualTo(1_000 + 4 + TextUtils.TRUNCATION_NOTICE.length());
    }
}
