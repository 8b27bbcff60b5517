package com.researchdesk.orchestrator.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * One research request and the state it accumulates until it reaches
 * COMPLETED or FAILED.
 *
 * Instances are not thread-safe. The job store guards each record and only
 * the pipeline task that owns the job mutates it; everyone else reads
 * {@link JobSnapshot}s.
 *
 * Invariants kept here rather than by callers:
 *   - status only moves along {@link JobStatus#canTransitionTo}
 *   - progress never decreases
 *   - completedAt is set exactly once, when a terminal status is entered
 *   - progressLog is append-only with non-decreasing timestamps
 *   - rawData is written at most once
 */
public class ResearchJob {

    private final UUID            id;
    private final String          query;
    private final SourceSelection sources;
    private final int             numResults;
    private final ReportOptions   reportOptions;
    private final Instant         createdAt;

    private JobStatus status = JobStatus.QUEUED;
    private int       progress = 0;
    private String    rawData;
    private String    report;
    private String    error;
    private Instant   completedAt;

    private final List<ProgressEvent> progressLog = new ArrayList<>();

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    public ResearchJob(UUID id, String query, SourceSelection sources, int numResults,
                       ReportOptions reportOptions, Instant createdAt) {
        this.id            = id;
        this.query         = query;
        this.sources       = sources;
        this.numResults    = numResults;
        this.reportOptions = reportOptions;
        this.createdAt     = createdAt;
    }

    // ------------------------------------------------------------------
    // State changes
    // ------------------------------------------------------------------

    /**
     * Move to the next status, raising progress and appending a log event.
     *
     * @throws IllegalStateException if the transition is not part of the state machine
     */
    public void transitionTo(JobStatus next, int newProgress, String message, Instant at) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Job %s cannot move from %s to %s".formatted(id, status, next));
        }
        status = next;
        if (next != JobStatus.FAILED) {
            raiseProgress(newProgress);
        }
        if (next.isTerminal()) {
            completedAt = at;
        }
        append(message, at);
    }

    /** Raise progress within the current status and log why. */
    public void recordProgress(int newProgress, String message, Instant at) {
        requireNotTerminal();
        raiseProgress(newProgress);
        append(message, at);
    }

    /** Log a note without changing progress (degradations, skipped hits). */
    public void note(String message, Instant at) {
        requireNotTerminal();
        append(message, at);
    }

    public void setRawData(String rawData) {
        if (this.rawData != null) {
            throw new IllegalStateException("raw data of job " + id + " is already set");
        }
        this.rawData = rawData;
    }

    public void setReport(String report) { this.report = report; }
    public void setError(String error)   { this.error = error; }

    public JobSnapshot snapshot() {
        return new JobSnapshot(id, query, sources, numResults, reportOptions, status, progress,
                rawData, report, error, createdAt, completedAt, List.copyOf(progressLog));
    }

    private void raiseProgress(int newProgress) {
        progress = Math.max(progress, Math.min(100, newProgress));
    }

    private void append(String message, Instant at) {
        // Clock skew between threads must not reorder the log.
        if (!progressLog.isEmpty()) {
            Instant last = progressLog.get(progressLog.size() - 1).timestamp();
            if (at.isBefore(last)) at = last;
        }
        progressLog.add(new ProgressEvent(at, status, progress, message));
    }

    private void requireNotTerminal() {
        if (status.isTerminal()) {
            throw new IllegalStateException("Job " + id + " is already " + status);
        }
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public UUID            getId()            { return id; }
    public String          getQuery()         { return query; }
    public SourceSelection getSources()       { return sources; }
    public int             getNumResults()    { return numResults; }
    public ReportOptions   getReportOptions() { return reportOptions; }
    public JobStatus       getStatus()        { return status; }
    public int             getProgress()      { return progress; }
    public String          getRawData()       { return rawData; }
    public String          getReport()        { return report; }
    public String          getError()         { return error; }
    public Instant         getCreatedAt()     { return createdAt; }
    public Instant         getCompletedAt()   { return completedAt; }
    public List<ProgressEvent> getProgressLog() { return List.copyOf(progressLog); }
}
