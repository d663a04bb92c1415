package com.ebdgraph.core.graph;

/**
 * Kinds of edges in an EBD graph.
 */
public enum EdgeKind {
    /** Start node to the first check step */
    START,

    /** Transition caused by an outcome code */
    OUTCOME,

    /** Unconditional continuation of a transition step or a transitional outcome */
    TRANSITION,

    /** Annotation node to the step it is anchored at; undirected in meaning */
    ANNOTATES
}
