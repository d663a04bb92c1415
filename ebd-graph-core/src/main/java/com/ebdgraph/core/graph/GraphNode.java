package com.ebdgraph.core.graph;

/**
 * A node of an {@link EbdGraph}.
 *
 * <p>Every node has an identity derived from its domain key (step number, end code, anchor step),
 * never from construction order, so that diagrams are reproducible across runs.
 */
public sealed interface GraphNode permits StartNode, StepNode, OutcomeNode, TransitionalOutcomeNode,
    EndNode, EmptyNode, AnnotationNode {

    /**
     * Returns the identifier of this node, unique within its graph.
     *
     * @return node identifier
     */
    String id();

    /**
     * Returns the kind of this node.
     *
     * @return node kind
     */
    NodeKind kind();
}
