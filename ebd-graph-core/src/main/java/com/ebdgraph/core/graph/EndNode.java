package com.ebdgraph.core.graph;

/**
 * Shared exit for all outcomes that end the process without a result code.
 */
public record EndNode() implements GraphNode {

    public static final String ID = "Ende";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.END;
    }
}
