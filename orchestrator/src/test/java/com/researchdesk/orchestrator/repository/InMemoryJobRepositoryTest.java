package com.researchdesk.orchestrator.repository;

import com.researchdesk.orchestrator.model.JobSnapshot;
import com.researchdesk.orchestrator.model.JobStatus;
import com.researchdesk.orchestrator.model.ReportOptions;
import com.researchdesk.orchestrator.model.ResearchJob;
import com.researchdesk.orchestrator.model.SourceSelection;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryJobRepositoryTest {

    private final InMemoryJobRepository repo = new InMemoryJobRepository();

    @Test
    void create_thenFind_returnsSnapshot() {
        ResearchJob job = job(Instant.parse("2026-01-01T00:00:00Z"));

        JobSnapshot created = repo.create(job);

        assertThat(created.id()).isEqualTo(job.getId());
        assertThat(repo.findById(job.getId())).hasValueSatisfying(s -> {
            assertThat(s.query()).isEqualTo("graph neural networks");
            assertThat(s.status()).isEqualTo(JobStatus.QUEUED);
        });
    }

    @Test
    void create_duplicateId_isRejected() {
        ResearchJob job = job(Instant.now());
        repo.create(job);

        assertThatThrownBy(() -> repo.create(job)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void update_appliesMutationAndIsVisibleToReaders() {
        ResearchJob job = job(Instant.now());
        repo.create(job);

        boolean applied = repo.update(job.getId(),
                j -> j.transitionTo(JobStatus.RESEARCHING, 5, "start", Instant.now()));

        assertThat(applied).isTrue();
        assertThat(repo.findById(job.getId()).orElseThrow().status()).isEqualTo(JobStatus.RESEARCHING);
    }

    @Test
    void update_missingJob_returnsFalse() {
        assertThat(repo.update(UUID.randomUUID(), j -> { throw new AssertionError("must not run"); }))
                .isFalse();
    }

    @Test
    void update_afterDelete_doesNotResurrectJob() {
        ResearchJob job = job(Instant.now());
        repo.create(job);
        assertThat(repo.deleteById(job.getId())).isTrue();

        assertThat(repo.update(job.getId(), j -> j.note("late", Instant.now()))).isFalse();
        assertThat(repo.findById(job.getId())).isEmpty();
        assertThat(repo.deleteById(job.getId())).isFalse();
    }

    @Test
    void findAll_isOrderedByCreation() {
        ResearchJob later   = job(Instant.parse("2026-01-02T00:00:00Z"));
        ResearchJob earlier = job(Instant.parse("2026-01-01T00:00:00Z"));
        repo.create(later);
        repo.create(earlier);

        assertThat(repo.findAll()).extracting(JobSnapshot::id)
                .containsExactly(earlier.getId(), later.getId());
    }

    private static ResearchJob job(Instant createdAt) {
        return new ResearchJob(UUID.randomUUID(), "graph neural networks", SourceSelection.WEB, 2,
                new ReportOptions("openai", null), createdAt);
    }
}
