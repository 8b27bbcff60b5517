package com.researchdesk.orchestrator.model;

import java.time.Instant;

/**
 * One entry of a job's append-only progress log.
 */
public record ProgressEvent(
        Instant   timestamp,
        JobStatus status,
        int       progress,
        String    message
) {}
