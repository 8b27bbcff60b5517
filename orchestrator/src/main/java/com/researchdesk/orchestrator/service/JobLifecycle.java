package com.researchdesk.orchestrator.service;

import com.researchdesk.orchestrator.model.JobStatus;
import com.researchdesk.orchestrator.model.ResearchJob;
import com.researchdesk.orchestrator.repository.JobRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * All writes the pipeline makes to a job go through here.
 *
 * Every method returns false when the job is no longer in the store (it was
 * deleted while in flight) or has already reached a terminal status; the
 * pipeline treats that as cancellation. Nothing is written in that case, so
 * a deleted job never gets a terminal state.
 */
@Service
public class JobLifecycle {

    private static final Logger log = LoggerFactory.getLogger(JobLifecycle.class);

    private final JobRepository jobRepo;
    private final MeterRegistry meterRegistry;

    public JobLifecycle(JobRepository jobRepo, MeterRegistry meterRegistry) {
        this.jobRepo       = jobRepo;
        this.meterRegistry = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Research stage
    // ------------------------------------------------------------------

    public boolean startResearch(UUID jobId, int progress, String message) {
        return apply(jobId, job -> job.transitionTo(JobStatus.RESEARCHING, progress, message, Instant.now()));
    }

    public boolean recordProgress(UUID jobId, int progress, String message) {
        return apply(jobId, job -> job.recordProgress(progress, message, Instant.now()));
    }

    /** Append a log entry without moving progress. */
    public boolean note(UUID jobId, String message) {
        return apply(jobId, job -> job.note(message, Instant.now()));
    }

    /** Store the raw data and hand the job over to report generation. */
    public boolean finishResearch(UUID jobId, String rawData, int progress, String message) {
        boolean applied = apply(jobId, job -> {
            job.setRawData(rawData);
            job.transitionTo(JobStatus.GENERATING, progress, message, Instant.now());
        });
        if (applied) {
            log.info("Job {} research finished ({} chars of raw data)", jobId, rawData.length());
        }
        return applied;
    }

    // ------------------------------------------------------------------
    // Terminal transitions
    // ------------------------------------------------------------------

    /**
     * Move a GENERATING job to COMPLETED.
     *
     * @param report the generated report, or null when generation was skipped or failed
     */
    public boolean complete(UUID jobId, String report, String message) {
        boolean applied = apply(jobId, job -> {
            job.setReport(report);
            job.transitionTo(JobStatus.COMPLETED, 100, message, Instant.now());
            finished(JobStatus.COMPLETED);
        });
        if (applied) {
            log.info("Job {} COMPLETED (report={})", jobId, report != null);
        }
        return applied;
    }

    /** Move a non-terminal job to FAILED. Progress keeps its last value. */
    public boolean fail(UUID jobId, String error) {
        boolean applied = apply(jobId, job -> {
            job.setError(error);
            job.transitionTo(JobStatus.FAILED, job.getProgress(), "Research failed: " + error, Instant.now());
            finished(JobStatus.FAILED);
        });
        if (applied) {
            log.error("Job {} FAILED: {}", jobId, error);
        }
        return applied;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private boolean apply(UUID jobId, Consumer<ResearchJob> mutation) {
        AtomicBoolean applied = new AtomicBoolean();
        jobRepo.update(jobId, job -> {
            if (job.getStatus().isTerminal()) {
                log.warn("Ignoring update to job {}: already {}", jobId, job.getStatus());
                return;
            }
            mutation.accept(job);
            applied.set(true);
        });
        return applied.get();
    }

    // Counted under the job's guard so the metric is visible once the status is.
    private void finished(JobStatus status) {
        meterRegistry.counter("research.jobs.finished", "status", status.wireName()).increment();
    }
}
