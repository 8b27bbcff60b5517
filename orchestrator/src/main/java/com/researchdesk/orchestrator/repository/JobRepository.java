package com.researchdesk.orchestrator.repository;

import com.researchdesk.orchestrator.model.JobSnapshot;
import com.researchdesk.orchestrator.model.ResearchJob;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Process-wide store of research jobs keyed by id.
 *
 * Reads always return snapshots. The only way to change a stored job is
 * {@link #update}, which runs the mutation under that record's guard so a
 * concurrent {@link #findById} sees either all of it or none of it.
 */
public interface JobRepository {

    /**
     * Store a new job.
     *
     * @throws IllegalStateException if a job with the same id already exists
     */
    JobSnapshot create(ResearchJob job);

    Optional<JobSnapshot> findById(UUID id);

    /** All jobs, in a stable order for the duration of the call. */
    List<JobSnapshot> findAll();

    /**
     * Apply a mutation to a stored job.
     *
     * @return false if no job with this id exists (never created or deleted);
     *         the mutation is not applied in that case
     */
    boolean update(UUID id, Consumer<ResearchJob> mutation);

    /** @return false if no job with this id existed */
    boolean deleteById(UUID id);
}
