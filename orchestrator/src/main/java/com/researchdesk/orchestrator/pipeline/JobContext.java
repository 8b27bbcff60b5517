package com.researchdesk.orchestrator.pipeline;

import com.researchdesk.orchestrator.model.BackendKind;
import com.researchdesk.orchestrator.model.ReportOptions;
import com.researchdesk.orchestrator.model.ResearchJob;
import com.researchdesk.orchestrator.model.SourceSelection;

import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Immutable inputs of one pipeline run plus its cancellation flag.
 *
 * The flag is shared between the job thread and the I/O tasks it spawns;
 * each of them calls {@link #checkCancelled()} before every network call.
 */
public final class JobContext {

    private final UUID            jobId;
    private final String          query;
    private final SourceSelection sources;
    private final int             numResults;
    private final ReportOptions   reportOptions;
    private final AtomicBoolean   cancelled = new AtomicBoolean();

    public JobContext(UUID jobId, String query, SourceSelection sources, int numResults,
                      ReportOptions reportOptions) {
        this.jobId         = jobId;
        this.query         = query;
        this.sources       = sources;
        this.numResults    = numResults;
        this.reportOptions = reportOptions;
    }

    public static JobContext of(ResearchJob job) {
        return new JobContext(job.getId(), job.getQuery(), job.getSources(), job.getNumResults(),
                job.getReportOptions());
    }

    public UUID            jobId()         { return jobId; }
    public String          query()         { return query; }
    public SourceSelection sources()       { return sources; }
    public Set<BackendKind> backends()     { return sources.backends(); }
    public int             numResults()    { return numResults; }
    public ReportOptions   reportOptions() { return reportOptions; }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * @throws JobCancelledException if the job was cancelled or the current
     *                               thread was interrupted
     */
    public void checkCancelled() {
        if (cancelled.get() || Thread.currentThread().isInterrupted()) {
            cancelled.set(true);
            throw new JobCancelledException(jobId);
        }
    }
}
