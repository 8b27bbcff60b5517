package com.researchdesk.orchestrator.search;

import com.researchdesk.orchestrator.model.BackendKind;

/**
 * A search backend call failed.
 *
 * RATE_LIMITED is the only transient kind; the retry policy retries it and
 * nothing else.
 */
public class SearchException extends RuntimeException {

    public enum Kind { RATE_LIMITED, UNREACHABLE, MALFORMED }

    private final BackendKind backend;
    private final Kind        kind;

    public SearchException(BackendKind backend, Kind kind, String detail) {
        super(format(backend, kind, detail));
        this.backend = backend;
        this.kind    = kind;
    }

    public SearchException(BackendKind backend, Kind kind, String detail, Throwable cause) {
        super(format(backend, kind, detail), cause);
        this.backend = backend;
        this.kind    = kind;
    }

    /** Classify a non-2xx HTTP status. */
    public static SearchException forStatus(BackendKind backend, int status) {
        if (status == 429) {
            return new SearchException(backend, Kind.RATE_LIMITED, "rate limited (HTTP 429)");
        }
        if (status >= 500) {
            return new SearchException(backend, Kind.UNREACHABLE, "server error (HTTP " + status + ")");
        }
        return new SearchException(backend, Kind.MALFORMED, "unexpected response (HTTP " + status + ")");
    }

    public BackendKind getBackend() { return backend; }
    public Kind        getKind()    { return kind; }

    public boolean isRateLimited() { return kind == Kind.RATE_LIMITED; }

    private static String format(BackendKind backend, Kind kind, String detail) {
        return "Search error (%s, %s): %s".formatted(backend.wireName(), kind, detail);
    }
}
