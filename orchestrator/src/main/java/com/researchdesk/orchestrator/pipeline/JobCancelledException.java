package com.researchdesk.orchestrator.pipeline;

import java.util.UUID;

/**
 * Unwinds a pipeline whose job was deleted while in flight.
 * Caught by {@link ResearchPipeline}; never reaches the caller.
 */
public class JobCancelledException extends RuntimeException {

    public JobCancelledException(UUID jobId) {
        super("Job " + jobId + " was cancelled");
    }
}
