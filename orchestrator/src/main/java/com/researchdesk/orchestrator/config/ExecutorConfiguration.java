package com.researchdesk.orchestrator.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools used by the orchestrator.
 *
 *   researchJobExecutor: one thread per running job. The fixed size is the
 *                         max-concurrent-jobs limit; extra jobs wait in its queue.
 *   researchIoExecutor:  backend searches and extractions spawned by jobs.
 *                         Unbounded; each job caps its own fan-out.
 */
@Configuration
public class ExecutorConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ExecutorConfiguration.class);

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService researchJobExecutor(ResearchProperties properties) {
        int workers = Math.max(1, properties.getJobs().getMaxConcurrent());
        log.info("Creating research job executor with {} workers", workers);
        return Executors.newFixedThreadPool(workers, namedThreads("research-job-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService researchIoExecutor() {
        return Executors.newCachedThreadPool(namedThreads("research-io-"));
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
