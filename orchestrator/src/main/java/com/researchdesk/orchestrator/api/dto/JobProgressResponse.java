package com.researchdesk.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.researchdesk.orchestrator.model.JobSnapshot;
import com.researchdesk.orchestrator.model.ProgressEvent;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Response body for GET /research/{id}/progress: the job's current status
 * plus every progress event in the order it was recorded.
 */
public record JobProgressResponse(
        UUID    id,
        String  status,
        int     progress,
        String  error,
        @JsonProperty("created_at")   Instant createdAt,
        @JsonProperty("completed_at") Instant completedAt,
        @JsonProperty("progress_log") List<Event> progressLog
) {
    public record Event(Instant timestamp, String status, int progress, String message) {
        static Event from(ProgressEvent e) {
            return new Event(e.timestamp(), e.status().wireName(), e.progress(), e.message());
        }
    }

    public static JobProgressResponse from(JobSnapshot job) {
        return new JobProgressResponse(
                job.id(),
                job.status().wireName(),
                job.progress(),
                job.error(),
                job.createdAt(),
                job.completedAt(),
                job.progressLog().stream().map(Event::from).toList()
        );
    }
}
