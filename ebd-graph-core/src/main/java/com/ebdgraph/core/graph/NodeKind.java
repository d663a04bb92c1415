package com.ebdgraph.core.graph;

/**
 * Kinds of nodes in an EBD graph.
 */
public enum NodeKind {
    /** Entry of the decision process; exactly one per graph */
    START,

    /** One check step of the table */
    DECISION,

    /** A step without decision that always continues at the same next step */
    TRANSITION,

    /** Terminal result with an end code */
    OUTCOME,

    /** Result code after which the process continues at another step */
    TRANSITIONAL_OUTCOME,

    /** End of the process without a result code ("Ende") */
    END,

    /** Placeholder of a table without rows; shows the table remark */
    EMPTY,

    /** Multi-step instruction attached to its first step */
    ANNOTATION
}
