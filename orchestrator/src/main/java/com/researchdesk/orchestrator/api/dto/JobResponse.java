package com.researchdesk.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.researchdesk.orchestrator.model.JobSnapshot;

import java.time.Instant;
import java.util.UUID;

/**
 * Response body for POST /research, GET /research/{id} and GET /research.
 * raw_data, report, error and completed_at are null until the job gets there.
 */
public record JobResponse(
        UUID    id,
        String  query,
        String  sources,
        @JsonProperty("num_results")  int     numResults,
        @JsonProperty("llm_provider") String  llmProvider,
        String  model,
        String  status,
        int     progress,
        @JsonProperty("raw_data")     String  rawData,
        String  report,
        String  error,
        @JsonProperty("created_at")   Instant createdAt,
        @JsonProperty("completed_at") Instant completedAt
) {
    public static JobResponse from(JobSnapshot job) {
        return new JobResponse(
                job.id(),
                job.query(),
                job.sources().wireName(),
                job.numResults(),
                job.reportOptions() == null ? null : job.reportOptions().provider(),
                job.reportOptions() == null ? null : job.reportOptions().model(),
                job.status().wireName(),
                job.progress(),
                job.rawData(),
                job.report(),
                job.error(),
                job.createdAt(),
                job.completedAt()
        );
    }
}
