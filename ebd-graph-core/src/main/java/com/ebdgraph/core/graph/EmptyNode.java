package com.ebdgraph.core.graph;

/**
 * Sole content of the graph of a table without rows. Diagrams show the EBD code and the table
 * remark instead of a decision tree.
 */
public record EmptyNode() implements GraphNode {

    public static final String ID = "Empty";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.EMPTY;
    }
}
