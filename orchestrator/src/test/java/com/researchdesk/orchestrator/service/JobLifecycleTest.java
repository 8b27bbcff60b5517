package com.researchdesk.orchestrator.service;

import com.researchdesk.orchestrator.model.JobSnapshot;
import com.researchdesk.orchestrator.model.JobStatus;
import com.researchdesk.orchestrator.model.ReportOptions;
import com.researchdesk.orchestrator.model.ResearchJob;
import com.researchdesk.orchestrator.model.SourceSelection;
import com.researchdesk.orchestrator.repository.InMemoryJobRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class JobLifecycleTest {

    private final InMemoryJobRepository jobRepo = new InMemoryJobRepository();
    private final SimpleMeterRegistry   meters  = new SimpleMeterRegistry();
    private final JobLifecycle lifecycle = new JobLifecycle(jobRepo, meters);

    private UUID id;

    @BeforeEach
    void setUp() {
        ResearchJob job = new ResearchJob(UUID.randomUUID(), "q", SourceSelection.BOTH, 2,
                new ReportOptions("openai", null), Instant.now());
        jobRepo.create(job);
        id = job.getId();
    }

    @Test
    void fullLifecycle_setsRawDataReportAndCountsCompletion() {
        assertThat(lifecycle.startResearch(id, 5, "start")).isTrue();
        assertThat(lifecycle.recordProgress(id, 30, "halfway")).isTrue();
        assertThat(lifecycle.finishResearch(id, "raw", 60, "research done")).isTrue();
        assertThat(lifecycle.complete(id, "report", "done")).isTrue();

        JobSnapshot job = jobRepo.findById(id).orElseThrow();
        assertThat(job.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.rawData()).isEqualTo("raw");
        assertThat(job.report()).isEqualTo("report");
        assertThat(job.progress()).isEqualTo(100);
        assertThat(meters.counter("research.jobs.finished", "status", "completed").count()).isEqualTo(1.0);
    }

    @Test
    void fail_keepsProgressAndSetsError() {
        lifecycle.startResearch(id, 5, "start");
        lifecycle.recordProgress(id, 40, "some progress");

        assertThat(lifecycle.fail(id, "All selected search backends failed")).isTrue();

        JobSnapshot job = jobRepo.findById(id).orElseThrow();
        assertThat(job.status()).isEqualTo(JobStatus.FAILED);
        assertThat(job.progress()).isEqualTo(40);
        assertThat(job.error()).isEqualTo("All selected search backends failed");
        assertThat(job.completedAt()).isNotNull();
    }

    @Test
    void writesToTerminalJob_areIgnored() {
        lifecycle.fail(id, "boom");

        assertThat(lifecycle.recordProgress(id, 50, "late")).isFalse();
        assertThat(lifecycle.fail(id, "again")).isFalse();
        assertThat(meters.counter("research.jobs.finished", "status", "failed").count()).isEqualTo(1.0);
    }

    @Test
    void writesToDeletedJob_areIgnoredAndNotCounted() {
        lifecycle.startResearch(id, 5, "start");
        jobRepo.deleteById(id);

        assertThat(lifecycle.fail(id, "boom")).isFalse();
        assertThat(jobRepo.findById(id)).isEmpty();
        assertThat(meters.find("research.jobs.finished").counters()).isEmpty();
    }
}
