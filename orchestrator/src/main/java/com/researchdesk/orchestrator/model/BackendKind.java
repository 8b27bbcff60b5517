package com.researchdesk.orchestrator.model;

/**
 * The independent search backends a job can draw from.
 */
public enum BackendKind {
    WEB,        // general web search
    ACADEMIC;   // academic paper search

    public String wireName() {
        return name().toLowerCase();
    }
}
