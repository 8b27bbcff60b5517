package com.researchdesk.orchestrator.service;

import com.researchdesk.orchestrator.config.ResearchProperties;
import com.researchdesk.orchestrator.model.JobSnapshot;
import com.researchdesk.orchestrator.model.ReportOptions;
import com.researchdesk.orchestrator.model.ResearchJob;
import com.researchdesk.orchestrator.model.SourceSelection;
import com.researchdesk.orchestrator.pipeline.JobContext;
import com.researchdesk.orchestrator.report.LlmProvider;
import com.researchdesk.orchestrator.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Caller-facing operations on research jobs.
 *
 * Only {@link JobValidationException} and {@link JobNotFoundException} are
 * thrown from here. Whatever goes wrong inside a pipeline ends up in the
 * job's status and error fields.
 */
@Service
public class ResearchOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ResearchOrchestrator.class);

    private final JobRepository              jobRepo;
    private final JobDispatcher              dispatcher;
    private final ResearchProperties.Jobs    limits;
    private final ResearchProperties.Report  reportSettings;

    public ResearchOrchestrator(JobRepository jobRepo,
                                JobDispatcher dispatcher,
                                ResearchProperties properties) {
        this.jobRepo        = jobRepo;
        this.dispatcher     = dispatcher;
        this.limits         = properties.getJobs();
        this.reportSettings = properties.getReport();
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    public JobSnapshot submit(String query, String sources, Integer numResults) {
        return submit(query, sources, numResults, null, null);
    }

    /**
     * Validate the request, store a QUEUED job and schedule its pipeline.
     * Returns without waiting for the pipeline to start.
     *
     * @param sources    "web", "academic" or "both"; null means the configured default
     * @param numResults results per backend; null means the configured default
     * @param provider   report provider; null means the configured default
     * @param model      model of that provider; null means the provider's default
     * @throws JobValidationException if any argument is out of bounds
     */
    public JobSnapshot submit(String query, String sources, Integer numResults,
                              String provider, String model) {
        if (query == null || query.isBlank()) {
            throw new JobValidationException("query must not be empty");
        }

        String sourcesValue = sources == null ? limits.getDefaultSources() : sources;
        SourceSelection selection = SourceSelection.fromWireName(sourcesValue)
                .orElseThrow(() -> new JobValidationException(
                        "sources must be one of web, academic, both (got '" + sourcesValue + "')"));

        int count = numResults == null ? limits.getDefaultResults() : numResults;
        if (count < limits.getMinResults() || count > limits.getMaxResults()) {
            throw new JobValidationException("num_results must be between %d and %d (got %d)"
                    .formatted(limits.getMinResults(), limits.getMaxResults(), count));
        }

        String providerValue = provider == null || provider.isBlank()
                ? reportSettings.getDefaultProvider()
                : provider;
        LlmProvider llm = LlmProvider.fromWireName(providerValue)
                .orElseThrow(() -> new JobValidationException(
                        "llm_provider must be one of openai, anthropic, groq (got '" + providerValue + "')"));
        String modelValue = model == null || model.isBlank() ? null : model;

        ResearchJob job = new ResearchJob(UUID.randomUUID(), query, selection, count,
                new ReportOptions(llm.wireName(), modelValue), Instant.now());
        JobSnapshot created = jobRepo.create(job);
        dispatcher.dispatch(JobContext.of(job));

        log.info("Job {} submitted: sources={} numResults={} provider={}",
                job.getId(), selection.wireName(), count, llm.wireName());
        return created;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public JobSnapshot get(UUID jobId) {
        return jobRepo.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    /** Oldest first. */
    public List<JobSnapshot> list() {
        return jobRepo.findAll();
    }

    // ------------------------------------------------------------------
    // Deletion
    // ------------------------------------------------------------------

    /**
     * Remove the job. If its pipeline is still queued or running it is
     * cancelled, and no terminal status is ever recorded for it.
     */
    public void delete(UUID jobId) {
        if (!jobRepo.deleteById(jobId)) {
            throw new JobNotFoundException(jobId);
        }
        boolean cancelled = dispatcher.cancel(jobId);
        log.info("Job {} deleted{}", jobId, cancelled ? " (pipeline cancelled)" : "");
    }
}
