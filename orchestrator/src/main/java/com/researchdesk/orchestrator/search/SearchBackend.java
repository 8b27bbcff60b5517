package com.researchdesk.orchestrator.search;

import com.researchdesk.orchestrator.model.BackendKind;
import com.researchdesk.orchestrator.model.SourceHit;

import java.util.List;

/**
 * One independent search source.
 *
 * New backends implement this interface and are registered as Spring beans;
 * {@link SearchBackendRegistry} picks them up by {@link #kind()}.
 *
 * Implementations must be stateless with respect to jobs (many jobs call
 * them concurrently) and must never block longer than their configured
 * timeout. A timeout is reported as {@link SearchException.Kind#UNREACHABLE}.
 */
public interface SearchBackend {

    BackendKind kind();

    /**
     * @param query free-text query, never blank
     * @param count maximum number of hits wanted, positive
     * @return at most count hits, in backend rank order
     * @throws SearchException on any failure
     */
    List<SourceHit> search(String query, int count);

    /** Disabled backends are treated as failed for every job that selects them. */
    default boolean isEnabled() {
        return true;
    }
}
