package com.researchdesk.orchestrator.pipeline;

import com.researchdesk.orchestrator.extract.TextUtils;
import com.researchdesk.orchestrator.model.ExtractedContent;
import com.researchdesk.orchestrator.model.SourceHit;
import com.researchdesk.orchestrator.model.SourceSelection;

import java.util.List;

/**
 * Renders a job's findings as the plain-text raw data stored on the job and
 * handed to the report generator.
 *
 * Sections: query header, SEARCH RESULTS, DETAILED CONTENT, RESEARCH SUMMARY
 * and, when something degraded, BACKEND NOTES.
 */
final class RawDataFormatter {

    private static final String SEPARATOR = "=".repeat(40);

    private final int maxLength;

    RawDataFormatter(int maxLength) {
        this.maxLength = maxLength;
    }

    String format(JobContext ctx, List<BackendResult> results) {
        List<SourceHit> hits = results.stream().flatMap(r -> r.hits().stream()).toList();
        List<ExtractedContent> sources = results.stream().flatMap(r -> r.extracted().stream()).toList();

        StringBuilder out = new StringBuilder();
        out.append("Research Query: ").append(ctx.query()).append("\n\n");
        out.append("Searched ").append(describe(ctx.sources()))
           .append(" - Found ").append(hits.size()).append(" results\n\n");

        if (!hits.isEmpty()) {
            out.append("SEARCH RESULTS:\n");
            int i = 1;
            for (SourceHit hit : hits) {
                out.append(i++).append(". ").append(hit.title()).append('\n');
                out.append("   URL: ").append(hit.url()).append('\n');
                out.append("   ").append(hit.snippet()).append("\n\n");
            }
        }

        if (!sources.isEmpty()) {
            out.append("DETAILED CONTENT FROM TOP ").append(sources.size()).append(" SOURCES:\n\n");
            int i = 1;
            for (ExtractedContent content : sources) {
                out.append(SEPARATOR).append('\n')
                   .append("SOURCE ").append(i++).append(": ").append(content.title()).append('\n')
                   .append(SEPARATOR).append("\n\n");
                out.append("URL: ").append(content.url()).append('\n');
                out.append("Description: ").append(content.description()).append("\n\n");
                out.append("Content:\n").append(content.content()).append("\n\n");
            }
        }

        out.append("\nRESEARCH SUMMARY:\n");
        appendSummary(out, ctx, hits.size(), sources.size(), results);

        List<String> notes = notes(results);
        if (!notes.isEmpty()) {
            out.append("\n\nBACKEND NOTES:\n");
            notes.forEach(note -> out.append("- ").append(note).append('\n'));
        }

        return TextUtils.safeTruncate(out.toString(), maxLength);
    }

    private static void appendSummary(StringBuilder out, JobContext ctx, int hitCount, int sourceCount,
                                      List<BackendResult> results) {
        int target = ctx.numResults() * ctx.backends().size();
        out.append("Completed research on: ").append(ctx.query()).append('\n');
        out.append("Found ").append(hitCount).append(" potential sources from ")
           .append(describe(ctx.sources())).append('\n');
        out.append("Successfully extracted valid content from ").append(sourceCount).append(" sources");
        if (sourceCount >= target) {
            out.append(" (target of ").append(target).append(" achieved)\n");
        } else {
            out.append(" (target was ").append(target).append(", but only ")
               .append(sourceCount).append(" valid sources found)\n");
        }
        int skipped = results.stream().mapToInt(BackendResult::skipped).sum();
        if (skipped > 0) {
            out.append("Skipped ").append(skipped)
               .append(" sources that could not be fetched or had low-quality content\n");
        }
        out.append("The information above represents the most relevant and accessible content found on this topic.");
    }

    private static List<String> notes(List<BackendResult> results) {
        return results.stream()
                .filter(BackendResult::isFailed)
                .map(r -> r.backend().wireName() + " search unavailable, results come from the remaining backends: "
                        + r.failure().getMessage())
                .toList();
    }

    private static String describe(SourceSelection sources) {
        return sources == SourceSelection.BOTH
                ? "web and academic sources"
                : sources.wireName() + " sources";
    }
}
