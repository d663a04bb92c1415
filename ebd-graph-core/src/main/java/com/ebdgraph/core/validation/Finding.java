package com.ebdgraph.core.validation;

import java.util.Objects;

/**
 * A single issue found in a graph.
 *
 * @param severity severity of the issue
 * @param kind kind of check that raised it
 * @param elementId id of the offending node or edge
 * @param message human-readable description
 */
public record Finding(
    Severity severity,
    FindingKind kind,
    String elementId,
    String message
) {
    /**
     * Compact constructor with validation.
     */
    public Finding {
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(elementId, "elementId must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    /**
     * Creates a finding with the default severity of its kind.
     *
     * @param kind kind of check
     * @param elementId offending node or edge
     * @param message description
     * @return new finding
     */
    public static Finding of(FindingKind kind, String elementId, String message) {
        return new Finding(kind.severity(), kind, elementId, message);
    }

    public boolean isFatal() {
        return severity == Severity.FATAL;
    }

    @Override
    public String toString() {
        return "[" + severity + "] " + kind + " " + elementId + ": " + message;
    }
}
