package com.researchdesk.orchestrator.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * States of a research job.
 *
 * Transitions:
 *   QUEUED → RESEARCHING → GENERATING → COMPLETED
 *
 * FAILED is reachable from every non-terminal state. A report that cannot be
 * generated does not fail the job: GENERATING always ends in COMPLETED unless
 * an internal fault occurs.
 */
public enum JobStatus {
    QUEUED,
    RESEARCHING,
    GENERATING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(JobStatus next) {
        return allowedNext().contains(next);
    }

    private Set<JobStatus> allowedNext() {
        return switch (this) {
            case QUEUED      -> EnumSet.of(RESEARCHING, FAILED);
            case RESEARCHING -> EnumSet.of(GENERATING, FAILED);
            case GENERATING  -> EnumSet.of(COMPLETED, FAILED);
            case COMPLETED, FAILED -> EnumSet.noneOf(JobStatus.class);
        };
    }

    /** Lower-case wire name, e.g. "researching". */
    public String wireName() {
        return name().toLowerCase();
    }
}
