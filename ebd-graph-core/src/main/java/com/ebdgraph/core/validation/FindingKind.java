package com.ebdgraph.core.validation;

/**
 * Kinds of findings reported by the {@link GraphValidator}, in the order the checks run.
 */
public enum FindingKind {
    MISSING_START_NODE(Severity.FATAL),
    MULTIPLE_START_NODES(Severity.FATAL),
    UNREACHABLE_NODE(Severity.FATAL),
    DUPLICATE_OUTCOME_LABEL(Severity.FATAL),
    MALFORMED_OUTCOME_SET(Severity.FATAL),
    MALFORMED_TRANSITION(Severity.FATAL),
    UNEXPECTED_EMPTY_NODE(Severity.FATAL),
    CYCLE(Severity.WARNING);

    private final Severity severity;

    FindingKind(Severity severity) {
        this.severity = severity;
    }

    public Severity severity() {
        return severity;
    }
}
