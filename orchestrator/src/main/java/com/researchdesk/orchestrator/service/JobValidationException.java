package com.researchdesk.orchestrator.service;

/**
 * A submission was rejected before any job was created.
 */
public class JobValidationException extends RuntimeException {

    public JobValidationException(String message) {
        super(message);
    }
}
