package com.researchdesk.orchestrator.extract;

/**
 * Content could not be extracted for one hit.
 *
 * Never fatal on its own: the pipeline skips the hit and only fails the job
 * when every hit of every backend ends up here.
 */
public class ExtractionException extends RuntimeException {

    public enum Kind {
        FETCH_FAILED,   // network error, timeout or non-2xx response
        UNSUPPORTED,    // PDF or other non-text content
        TOO_LARGE,      // document above the hard extraction ceiling
        LOW_QUALITY     // fetched, but rejected by the quality filter
    }

    private final String url;
    private final Kind   kind;

    public ExtractionException(String url, Kind kind, String detail) {
        super("Extraction error for %s [%s]: %s".formatted(url, kind, detail));
        this.url  = url;
        this.kind = kind;
    }

    public ExtractionException(String url, Kind kind, String detail, Throwable cause) {
        super("Extraction error for %s [%s]: %s".formatted(url, kind, detail), cause);
        this.url  = url;
        this.kind = kind;
    }

    public String getUrl()  { return url; }
    public Kind   getKind() { return kind; }
}
