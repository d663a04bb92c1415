package com.ebdgraph.core.graph;

/**
 * Entry point of the decision process.
 */
public record StartNode() implements GraphNode {

    public static final String ID = "Start";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.START;
    }
}
