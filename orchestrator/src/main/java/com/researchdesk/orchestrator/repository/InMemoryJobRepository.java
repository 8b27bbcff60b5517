package com.researchdesk.orchestrator.repository;

import com.researchdesk.orchestrator.model.JobSnapshot;
import com.researchdesk.orchestrator.model.ResearchJob;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Consumer;

/**
 * Heap-backed {@link JobRepository}.
 *
 * The map handles insert/delete/list; each {@link ResearchJob} is its own
 * monitor for reads and writes of its fields. Jobs stay until deleted.
 */
@Repository
public class InMemoryJobRepository implements JobRepository {

    private final ConcurrentMap<UUID, ResearchJob> jobs = new ConcurrentHashMap<>();

    @Override
    public JobSnapshot create(ResearchJob job) {
        ResearchJob existing = jobs.putIfAbsent(job.getId(), job);
        if (existing != null) {
            throw new IllegalStateException("Job already exists: " + job.getId());
        }
        synchronized (job) {
            return job.snapshot();
        }
    }

    @Override
    public Optional<JobSnapshot> findById(UUID id) {
        ResearchJob job = jobs.get(id);
        if (job == null) return Optional.empty();
        synchronized (job) {
            return Optional.of(job.snapshot());
        }
    }

    @Override
    public List<JobSnapshot> findAll() {
        return jobs.values().stream()
                .map(job -> {
                    synchronized (job) {
                        return job.snapshot();
                    }
                })
                .sorted(Comparator.comparing(JobSnapshot::createdAt)
                        .thenComparing(JobSnapshot::id))
                .toList();
    }

    @Override
    public boolean update(UUID id, Consumer<ResearchJob> mutation) {
        ResearchJob job = jobs.get(id);
        if (job == null) return false;
        synchronized (job) {
            // Re-check under the guard: a delete may have raced the lookup.
            if (jobs.get(id) != job) return false;
            mutation.accept(job);
            return true;
        }
    }

    @Override
    public boolean deleteById(UUID id) {
        ResearchJob job = jobs.get(id);
        if (job == null) return false;
        synchronized (job) {
            return jobs.remove(id, job);
        }
    }
}
