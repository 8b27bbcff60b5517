package com.researchdesk.orchestrator.pipeline;

import com.researchdesk.orchestrator.model.BackendKind;
import com.researchdesk.orchestrator.model.ExtractedContent;
import com.researchdesk.orchestrator.model.SourceHit;
import com.researchdesk.orchestrator.search.SearchException;

import java.util.List;

/**
 * What one backend contributed to a job: the hits it returned, the sources
 * that were extracted from them, or the search failure that ended it.
 */
record BackendResult(
        BackendKind            backend,
        List<SourceHit>        hits,
        List<ExtractedContent> extracted,
        int                    skipped,
        SearchException        failure
) {
    static BackendResult failed(BackendKind backend, SearchException failure) {
        return new BackendResult(backend, List.of(), List.of(), 0, failure);
    }

    boolean isFailed() {
        return failure != null;
    }
}
