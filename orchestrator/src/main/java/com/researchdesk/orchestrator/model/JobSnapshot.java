package com.researchdesk.orchestrator.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Immutable copy of a {@link ResearchJob} taken under the store's guard.
 * This is the only form in which jobs leave the store.
 */
public record JobSnapshot(
        UUID                id,
        String              query,
        SourceSelection     sources,
        int                 numResults,
        ReportOptions       reportOptions,
        JobStatus           status,
        int                 progress,
        String              rawData,
        String              report,
        String              error,
        Instant             createdAt,
        Instant             completedAt,
        List<ProgressEvent> progressLog
) {}
