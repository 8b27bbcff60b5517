package com.researchdesk.orchestrator.pipeline;

/**
 * Turns completed work units into a percentage between the research
 * start and research-complete marks.
 *
 * One unit per backend search plus one per expected extraction. The total
 * can grow when spare hits replace failed extractions; the reported value
 * never goes down and stays below {@code ceiling} until the research stage
 * itself finishes.
 */
final class ProgressTracker {

    private final int floor;
    private final int ceiling;

    private int totalUnits;
    private int doneUnits;
    private int lastReported;

    ProgressTracker(int floor, int ceiling, int totalUnits) {
        this.floor        = floor;
        this.ceiling      = Math.max(floor, ceiling);
        this.totalUnits   = Math.max(0, totalUnits);
        this.lastReported = floor;
    }

    synchronized void expand(int units) {
        totalUnits += Math.max(0, units);
    }

    /** Mark units as done and return the resulting percentage. */
    synchronized int complete(int units) {
        doneUnits = Math.min(totalUnits, doneUnits + Math.max(0, units));
        return current();
    }

    synchronized int current() {
        if (totalUnits > 0 && ceiling > floor) {
            int computed = floor + (ceiling - floor) * doneUnits / totalUnits;
            lastReported = Math.max(lastReported, Math.min(computed, ceiling - 1));
        }
        return lastReported;
    }
}
