package com.researchdesk.orchestrator.service;

import com.researchdesk.orchestrator.pipeline.JobContext;
import com.researchdesk.orchestrator.pipeline.ResearchPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.FutureTask;

/**
 * Hands jobs to the fixed-size job pool and keeps track of the ones still
 * queued or running, so they can be cancelled.
 *
 * The pool size is the max-concurrent-jobs limit. Jobs submitted beyond it
 * wait in the pool's queue and stay QUEUED until a worker frees up.
 */
@Component
public class JobDispatcher {

    private static final Logger log = LoggerFactory.getLogger(JobDispatcher.class);

    private record InFlight(JobContext context, FutureTask<Void> task) {}

    private final ExecutorService         workers;
    private final ResearchPipeline        pipeline;
    private final Map<UUID, InFlight>     inFlight = new ConcurrentHashMap<>();

    public JobDispatcher(@Qualifier("researchJobExecutor") ExecutorService workers,
                         ResearchPipeline pipeline) {
        this.workers  = workers;
        this.pipeline = pipeline;
    }

    public void dispatch(JobContext context) {
        UUID jobId = context.jobId();
        FutureTask<Void> task = new FutureTask<>(() -> {
            try {
                pipeline.run(context);
            } finally {
                inFlight.computeIfPresent(jobId, (id, entry) -> entry.context() == context ? null : entry);
            }
        }, null);

        // Registered before execution so a fast pipeline cannot finish first.
        inFlight.put(jobId, new InFlight(context, task));
        workers.execute(task);
        log.info("Job {} dispatched ({} in flight)", jobId, inFlight.size());
    }

    /**
     * Flag the job as cancelled and interrupt its worker if it is running.
     * A job still waiting in the queue never starts.
     *
     * @return false if the job was not queued or running
     */
    public boolean cancel(UUID jobId) {
        InFlight entry = inFlight.remove(jobId);
        if (entry == null) {
            return false;
        }
        entry.context().cancel();
        entry.task().cancel(true);
        log.info("Job {} cancelled", jobId);
        return true;
    }

    public boolean isInFlight(UUID jobId) {
        return inFlight.containsKey(jobId);
    }
}
