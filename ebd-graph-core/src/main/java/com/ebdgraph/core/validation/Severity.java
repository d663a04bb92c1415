package com.ebdgraph.core.validation;

/**
 * Severity of a validation finding.
 */
public enum Severity {
    /** Blocks rendering; the graph is malformed */
    FATAL,

    /** Reported to the caller; rendering proceeds */
    WARNING
}
