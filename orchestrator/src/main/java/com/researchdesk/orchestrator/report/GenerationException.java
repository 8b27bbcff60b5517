package com.researchdesk.orchestrator.report;

/**
 * The report stage failed. Always a soft failure: the job still completes
 * with its raw data.
 */
public class GenerationException extends RuntimeException {

    private final int statusCode;

    public GenerationException(String message) {
        this(message, -1, null);
    }

    public GenerationException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public GenerationException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /** HTTP status returned by the provider, or -1 if the call never got a response. */
    public int statusCode() { return statusCode; }
}
