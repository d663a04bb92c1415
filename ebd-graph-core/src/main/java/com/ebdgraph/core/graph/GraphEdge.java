package com.ebdgraph.core.graph;

import java.util.Objects;

/**
 * A directed edge of an {@link EbdGraph}.
 *
 * <p>Outcome edges carry the outcome code that causes the transition. Edges that stem from one
 * multi-result share the outcome code and are told apart by their {@code branch} ordinal. Start,
 * transition and annotation edges carry neither.
 *
 * @param sourceId source node id
 * @param targetId target node id
 * @param kind edge kind
 * @param outcome outcome code (outcome edges only)
 * @param branch ordinal within a multi-result, or null
 */
public record GraphEdge(
    String sourceId,
    String targetId,
    EdgeKind kind,
    String outcome,
    Integer branch
) {
    /**
     * Compact constructor with validation.
     */
    public GraphEdge {
        Objects.requireNonNull(sourceId, "sourceId must not be null");
        Objects.requireNonNull(targetId, "targetId must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (kind == EdgeKind.OUTCOME && outcome == null) {
            throw new IllegalArgumentException("Outcome edge " + sourceId + " -> " + targetId + " needs an outcome");
        }
        if (kind != EdgeKind.OUTCOME && (outcome != null || branch != null)) {
            throw new IllegalArgumentException(kind + " edges carry no outcome");
        }
    }

    public static GraphEdge start(String targetId) {
        return new GraphEdge(StartNode.ID, targetId, EdgeKind.START, null, null);
    }

    public static GraphEdge outcome(String sourceId, String targetId, String outcome) {
        return new GraphEdge(sourceId, targetId, EdgeKind.OUTCOME, outcome, null);
    }

    public static GraphEdge branch(String sourceId, String targetId, String outcome, int branch) {
        return new GraphEdge(sourceId, targetId, EdgeKind.OUTCOME, outcome, branch);
    }

    public static GraphEdge transition(String sourceId, String targetId) {
        return new GraphEdge(sourceId, targetId, EdgeKind.TRANSITION, null, null);
    }

    public static GraphEdge annotates(String annotationId, String anchorId) {
        return new GraphEdge(annotationId, anchorId, EdgeKind.ANNOTATES, null, null);
    }

    /**
     * Returns the label that must be unique among the outcome edges of one decision node:
     * the outcome code, plus the branch ordinal for multi-result edges.
     *
     * @return identity label, or null for non-outcome edges
     */
    public String identityLabel() {
        if (outcome == null) {
            return null;
        }
        return branch == null ? outcome : outcome + "#" + branch;
    }

    /**
     * Returns a stable identifier of this edge derived from its endpoints and label.
     *
     * @return edge identifier
     */
    public String id() {
        return switch (kind) {
            case START -> sourceId + "->" + targetId;
            case TRANSITION -> sourceId + "=>" + targetId;
            case OUTCOME -> sourceId + "-[" + identityLabel() + "]->" + targetId;
            case ANNOTATES -> sourceId + "~" + targetId;
        };
    }
}
