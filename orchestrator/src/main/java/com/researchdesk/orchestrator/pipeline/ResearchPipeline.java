package com.researchdesk.orchestrator.pipeline;

import com.researchdesk.orchestrator.config.ResearchProperties;
import com.researchdesk.orchestrator.extract.ContentExtractor;
import com.researchdesk.orchestrator.extract.ExtractionException;
import com.researchdesk.orchestrator.model.BackendKind;
import com.researchdesk.orchestrator.model.ExtractedContent;
import com.researchdesk.orchestrator.model.ReportOptions;
import com.researchdesk.orchestrator.model.SourceHit;
import com.researchdesk.orchestrator.report.GenerationException;
import com.researchdesk.orchestrator.report.ReportGenerator;
import com.researchdesk.orchestrator.search.SearchBackendRegistry;
import com.researchdesk.orchestrator.search.SearchException;
import com.researchdesk.orchestrator.service.JobLifecycle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Drives one job from QUEUED to a terminal status.
 *
 *   1. QUEUED -> RESEARCHING
 *   2. Every selected backend is searched concurrently (rate limits are
 *      retried inside the registry). Hits are extracted concurrently, at
 *      most {@code extraction-fan-out} at a time per job; spare hits replace
 *      the ones whose extraction fails.
 *   3. RESEARCHING -> GENERATING with the formatted raw data, or FAILED when
 *      no backend, no hit or no extraction produced anything.
 *   4. GENERATING -> COMPLETED, with a report when a provider is configured
 *      and answers, without one otherwise.
 *
 * A failed backend or hit is a note in the progress log, never an exception
 * out of this class. Deleting the job sets the context's cancellation flag;
 * it is checked before every network call and any write to a deleted job
 * unwinds the run with {@link JobCancelledException}.
 */
@Component
public class ResearchPipeline {

    private static final Logger log = LoggerFactory.getLogger(ResearchPipeline.class);

    private final SearchBackendRegistry backends;
    private final ContentExtractor      extractor;
    private final ReportGenerator       reportGenerator;
    private final JobLifecycle          lifecycle;
    private final ExecutorService       ioExecutor;
    private final RawDataFormatter      formatter;

    private final int startedProgress;
    private final int researchCompleteProgress;
    private final int searchMultiplier;
    private final int maxSearchResults;
    private final int extractionFanOut;

    public ResearchPipeline(SearchBackendRegistry backends,
                            ContentExtractor extractor,
                            ReportGenerator reportGenerator,
                            JobLifecycle lifecycle,
                            ResearchProperties properties,
                            @Qualifier("researchIoExecutor") ExecutorService ioExecutor) {
        this.backends        = backends;
        this.extractor       = extractor;
        this.reportGenerator = reportGenerator;
        this.lifecycle       = lifecycle;
        this.ioExecutor      = ioExecutor;
        this.formatter       = new RawDataFormatter(properties.getContent().getMaxRawDataLength());

        this.startedProgress          = properties.getProgress().getStarted();
        this.researchCompleteProgress = properties.getProgress().getResearchComplete();
        this.searchMultiplier         = Math.max(1, properties.getSearch().getSearchMultiplier());
        this.maxSearchResults         = properties.getSearch().getMaxResults();
        this.extractionFanOut         = Math.max(1, properties.getJobs().getExtractionFanOut());
    }

    // ------------------------------------------------------------------
    // Entry point, called by JobDispatcher on a job worker thread
    // ------------------------------------------------------------------

    public void run(JobContext ctx) {
        MDC.put("jobId", ctx.jobId().toString());
        try {
            log.info("Starting research pipeline: sources={} numResults={}",
                    ctx.sources().wireName(), ctx.numResults());

            ctx.checkCancelled();
            write(ctx, lifecycle.startResearch(ctx.jobId(), startedProgress,
                    "Starting search across " + describe(ctx) + " sources"));

            String rawData = research(ctx);
            if (rawData != null) {
                generate(ctx, rawData);
            }
        } catch (JobCancelledException e) {
            log.info("Pipeline abandoned: job was deleted");
        } catch (Exception e) {
            if (ctx.isCancelled()) {
                log.info("Pipeline abandoned after cancellation ({})", e.toString());
            } else {
                log.error("Unhandled error in research pipeline: {}", e.getMessage(), e);
                lifecycle.fail(ctx.jobId(), "Internal error: " + e.getMessage());
            }
        } finally {
            // Stops stray I/O tasks of this job; the run is over either way.
            ctx.cancel();
            MDC.clear();
        }
    }

    // ------------------------------------------------------------------
    // RESEARCHING
    // ------------------------------------------------------------------

    /** @return the raw data, or null if the job was failed */
    private String research(JobContext ctx) {
        List<BackendKind> kinds = List.copyOf(ctx.backends());
        int perBackendUnits = 1 + ctx.numResults();
        ProgressTracker tracker = new ProgressTracker(
                startedProgress, researchCompleteProgress, kinds.size() * perBackendUnits);
        Semaphore extractionSlots = new Semaphore(extractionFanOut);

        List<CompletableFuture<BackendResult>> running = kinds.stream()
                .map(kind -> CompletableFuture.supplyAsync(
                        withMdc(() -> searchAndExtract(ctx, kind, tracker, extractionSlots)), ioExecutor))
                .toList();

        List<BackendResult> results = new ArrayList<>();
        for (CompletableFuture<BackendResult> future : running) {
            results.add(await(ctx, future));
        }
        ctx.checkCancelled();

        if (results.stream().allMatch(BackendResult::isFailed)) {
            String reasons = results.stream()
                    .map(r -> r.failure().getMessage())
                    .collect(Collectors.joining("; "));
            write(ctx, lifecycle.fail(ctx.jobId(), "All selected search backends failed: " + reasons));
            return null;
        }

        int hitCount = results.stream().mapToInt(r -> r.hits().size()).sum();
        if (hitCount == 0) {
            write(ctx, lifecycle.fail(ctx.jobId(),
                    "No search results found for '" + ctx.query() + "' in " + describe(ctx) + " sources"));
            return null;
        }

        int sourceCount = results.stream().mapToInt(r -> r.extracted().size()).sum();
        if (sourceCount == 0) {
            write(ctx, lifecycle.fail(ctx.jobId(),
                    "Content extraction failed for all " + hitCount + " search results"));
            return null;
        }

        String rawData = formatter.format(ctx, results);
        long degraded = results.stream().filter(BackendResult::isFailed).count();
        String message = degraded == 0
                ? "Research complete: extracted %d sources".formatted(sourceCount)
                : "Research complete with %d of %d backends: extracted %d sources"
                        .formatted(results.size() - degraded, results.size(), sourceCount);
        write(ctx, lifecycle.finishResearch(ctx.jobId(), rawData, researchCompleteProgress, message));
        return rawData;
    }

    private BackendResult searchAndExtract(JobContext ctx, BackendKind kind, ProgressTracker tracker,
                                           Semaphore extractionSlots) {
        int wanted    = ctx.numResults();
        int requested = Math.max(wanted, Math.min(wanted * searchMultiplier, maxSearchResults));

        List<SourceHit> hits;
        try {
            hits = backends.search(kind, ctx.query(), requested, ctx::checkCancelled);
        } catch (SearchException e) {
            log.warn("{} search failed, continuing without it: {}", kind.wireName(), e.getMessage());
            int progress = tracker.complete(1 + wanted);
            write(ctx, lifecycle.recordProgress(ctx.jobId(), progress,
                    "%s search failed, continuing without it: %s".formatted(label(kind), e.getMessage())));
            return BackendResult.failed(kind, e);
        }
        ctx.checkCancelled();

        // Units for extractions that can never happen are done right away.
        int progress = tracker.complete(1 + Math.max(0, wanted - hits.size()));
        write(ctx, lifecycle.recordProgress(ctx.jobId(), progress,
                "%s search returned %d results".formatted(label(kind), hits.size())));

        List<ExtractedContent> extracted = new ArrayList<>();
        int skipped = 0;
        int next = 0;
        while (extracted.size() < wanted && next < hits.size()) {
            int wave = Math.min(wanted - extracted.size(), hits.size() - next);
            if (next > 0) {
                tracker.expand(wave);
                write(ctx, lifecycle.note(ctx.jobId(),
                        "%s search: retrying with %d spare hits".formatted(label(kind), wave)));
            }
            List<CompletableFuture<ExtractedContent>> batch = hits.subList(next, next + wave).stream()
                    .map(hit -> CompletableFuture.supplyAsync(
                            withMdc(() -> extractOne(ctx, hit, tracker, extractionSlots)), ioExecutor))
                    .toList();
            next += wave;

            for (CompletableFuture<ExtractedContent> future : batch) {
                ExtractedContent content = await(ctx, future);
                if (content != null) {
                    extracted.add(content);
                } else {
                    skipped++;
                }
            }
        }
        return new BackendResult(kind, List.copyOf(hits), List.copyOf(extracted), skipped, null);
    }

    /** @return the extracted content, or null if the hit was skipped */
    private ExtractedContent extractOne(JobContext ctx, SourceHit hit, ProgressTracker tracker,
                                        Semaphore extractionSlots) {
        try {
            extractionSlots.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JobCancelledException(ctx.jobId());
        }
        try {
            ctx.checkCancelled();
            ExtractedContent content = extractor.extract(hit);
            ctx.checkCancelled();
            write(ctx, lifecycle.recordProgress(ctx.jobId(), tracker.complete(1),
                    "Extracted content from " + hit.url()));
            return content;
        } catch (ExtractionException e) {
            log.warn("Skipping {}: {}", e.getUrl(), e.getMessage());
            write(ctx, lifecycle.recordProgress(ctx.jobId(), tracker.complete(1),
                    "Skipped source " + e.getUrl() + ": " + e.getMessage()));
            return null;
        } finally {
            extractionSlots.release();
        }
    }

    // ------------------------------------------------------------------
    // GENERATING
    // ------------------------------------------------------------------

    private void generate(JobContext ctx, String rawData) {
        ReportOptions options = ctx.reportOptions();
        if (options == null || !reportGenerator.isConfigured(options.provider())) {
            String provider = options == null ? "none" : options.provider();
            log.warn("No report provider configured ({}), completing with raw data only", provider);
            write(ctx, lifecycle.complete(ctx.jobId(), null,
                    "Report generation skipped: provider " + provider + " is not configured"));
            return;
        }

        ctx.checkCancelled();
        String report;
        try {
            report = reportGenerator.generate(ctx.query(), rawData, options);
        } catch (GenerationException e) {
            log.warn("Report generation failed, completing with raw data only: {}", e.getMessage());
            ctx.checkCancelled();
            write(ctx, lifecycle.complete(ctx.jobId(), null,
                    "Report generation failed, completed with raw data only: " + e.getMessage()));
            return;
        }
        ctx.checkCancelled();
        write(ctx, lifecycle.complete(ctx.jobId(), report,
                "Report generated with " + options.provider()));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** A rejected write means the job is gone; stop working on it. */
    private static void write(JobContext ctx, boolean applied) {
        if (!applied) {
            ctx.cancel();
            throw new JobCancelledException(ctx.jobId());
        }
    }

    private static <T> T await(JobContext ctx, CompletableFuture<T> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ctx.cancel();
            throw new JobCancelledException(ctx.jobId());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new IllegalStateException(cause);
        }
    }

    /** Carry the caller's MDC (jobId) into I/O tasks. */
    private static <T> Supplier<T> withMdc(Supplier<T> task) {
        Map<String, String> context = MDC.getCopyOfContextMap();
        return () -> {
            if (context != null) MDC.setContextMap(context);
            try {
                return task.get();
            } finally {
                MDC.clear();
            }
        };
    }

    private static String label(BackendKind kind) {
        return kind == BackendKind.WEB ? "Web" : "Academic";
    }

    private static String describe(JobContext ctx) {
        return ctx.backends().stream().map(BackendKind::wireName).collect(Collectors.joining(" and "));
    }
}
