package com.researchdesk.orchestrator.search;

import com.researchdesk.orchestrator.config.ResearchProperties;
import com.researchdesk.orchestrator.model.BackendKind;
import com.researchdesk.orchestrator.model.SourceHit;
import com.researchdesk.orchestrator.retry.RetryPolicy;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * In-process registry of search backends.
 *
 * All {@link SearchBackend} beans are collected at startup via constructor
 * injection, one per {@link BackendKind}.
 *
 * <p>Every call made through {@link #search} is:
 * <ol>
 *   <li>wrapped in the backend's {@link RetryPolicy}, which retries
 *       RATE_LIMITED failures only;</li>
 *   <li>timed and counted per attempt:
 * <pre>
 *   research.search.calls{backend, status="success|rate_limited|unreachable|malformed|error"}
 *   research.search.duration{backend}
 * </pre>
 *   </li>
 * </ol>
 */
@Component
public class SearchBackendRegistry {

    private static final Logger log = LoggerFactory.getLogger(SearchBackendRegistry.class);

    private final Map<BackendKind, SearchBackend> backends      = new EnumMap<>(BackendKind.class);
    private final Map<BackendKind, RetryPolicy>   retryPolicies = new EnumMap<>(BackendKind.class);
    private final MeterRegistry meterRegistry;

    @Autowired
    public SearchBackendRegistry(List<SearchBackend> allBackends,
                                 ResearchProperties properties,
                                 MeterRegistry meterRegistry) {
        this(allBackends, Map.of(
                BackendKind.WEB,      RetryPolicy.from(properties.getSearch().getWeb().getRetry()),
                BackendKind.ACADEMIC, RetryPolicy.from(properties.getSearch().getAcademic().getRetry())),
                meterRegistry);
    }

    public SearchBackendRegistry(List<SearchBackend> allBackends,
                                 Map<BackendKind, RetryPolicy> retryPolicies,
                                 MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.retryPolicies.putAll(retryPolicies);
        for (SearchBackend backend : allBackends) {
            SearchBackend previous = backends.put(backend.kind(), backend);
            if (previous != null) {
                throw new IllegalStateException("Two search backends registered for " + backend.kind()
                        + ": " + previous.getClass().getSimpleName()
                        + " and " + backend.getClass().getSimpleName());
            }
            log.info("Registered {} search backend {} (enabled={}, maxAttempts={})",
                    backend.kind().wireName(), backend.getClass().getSimpleName(),
                    backend.isEnabled(), retryPolicy(backend.kind()).maxAttempts());
        }
    }

    /** True if a backend of this kind is registered and enabled. */
    public boolean isAvailable(BackendKind kind) {
        SearchBackend backend = backends.get(kind);
        return backend != null && backend.isEnabled();
    }

    /**
     * Search one backend, retrying rate-limit failures.
     *
     * @throws SearchException the last failure once retries are exhausted, or
     *                         the first non-retryable failure
     */
    public List<SourceHit> search(BackendKind kind, String query, int count) {
        return search(kind, query, count, () -> {});
    }

    /**
     * Search one backend, running checkpoint before every attempt so a
     * cancelled job stops retrying.
     */
    public List<SourceHit> search(BackendKind kind, String query, int count, Runnable checkpoint) {
        SearchBackend backend = backends.get(kind);
        if (backend == null || !backend.isEnabled()) {
            throw new SearchException(kind, SearchException.Kind.UNREACHABLE, "backend is not available");
        }
        String label = kind.wireName() + " search";
        return retryPolicy(kind).execute(label,
                () -> instrumented(backend, query, count),
                e -> e instanceof SearchException se && se.isRateLimited(),
                checkpoint);
    }

    private List<SourceHit> instrumented(SearchBackend backend, String query, int count) {
        String backendTag = backend.kind().wireName();
        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            return backend.search(query, count);
        } catch (SearchException e) {
            status = e.getKind().name().toLowerCase();
            throw e;
        } catch (RuntimeException e) {
            status = "error";
            throw new SearchException(backend.kind(), SearchException.Kind.MALFORMED,
                    "unexpected error: " + e.getMessage(), e);
        } finally {
            sample.stop(meterRegistry.timer("research.search.duration", "backend", backendTag));
            meterRegistry.counter("research.search.calls",
                    "backend", backendTag, "status", status).increment();
        }
    }

    private RetryPolicy retryPolicy(BackendKind kind) {
        return retryPolicies.getOrDefault(kind, RetryPolicy.none());
    }
}
