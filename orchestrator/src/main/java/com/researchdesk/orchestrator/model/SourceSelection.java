package com.researchdesk.orchestrator.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Which backends a job searches. Fixed at submission time.
 */
public enum SourceSelection {
    WEB(EnumSet.of(BackendKind.WEB)),
    ACADEMIC(EnumSet.of(BackendKind.ACADEMIC)),
    BOTH(EnumSet.of(BackendKind.WEB, BackendKind.ACADEMIC));

    private final Set<BackendKind> backends;

    SourceSelection(Set<BackendKind> backends) {
        this.backends = backends;
    }

    /** Backends in declaration order (web before academic). */
    public Set<BackendKind> backends() {
        return EnumSet.copyOf(backends);
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<SourceSelection> fromWireName(String value) {
        if (value == null) return Optional.empty();
        for (SourceSelection s : values()) {
            if (s.wireName().equals(value.trim().toLowerCase(Locale.ROOT))) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }
}
