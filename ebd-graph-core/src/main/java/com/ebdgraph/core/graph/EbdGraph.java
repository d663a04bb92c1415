package com.ebdgraph.core.graph;

import com.ebdgraph.core.table.EbdTableMetadata;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Directed graph derived from an EBD table.
 *
 * <p>Immutable once built. Node ids are unique and every edge connects existing nodes; all other
 * invariants (reachability, outcome coverage, ...) are checked by the graph validator so that
 * violations can be reported rather than thrown.
 *
 * @param metadata metadata of the source table
 * @param nodes all nodes
 * @param edges all edges
 */
public record EbdGraph(
    EbdTableMetadata metadata,
    List<GraphNode> nodes,
    List<GraphEdge> edges
) {
    /**
     * Compact constructor with validation.
     */
    public EbdGraph {
        Objects.requireNonNull(metadata, "metadata must not be null");
        Objects.requireNonNull(nodes, "nodes must not be null");
        Objects.requireNonNull(edges, "edges must not be null");
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);

        Set<String> ids = new HashSet<>();
        for (GraphNode node : nodes) {
            if (!ids.add(node.id())) {
                throw new IllegalArgumentException("Duplicate node id: " + node.id());
            }
        }
        for (GraphEdge edge : edges) {
            if (!ids.contains(edge.sourceId()) || !ids.contains(edge.targetId())) {
                throw new IllegalArgumentException("Edge " + edge.id() + " references an unknown node");
            }
        }
    }

    /**
     * Looks up a node by id.
     *
     * @param id node id
     * @return node, or empty if absent
     */
    public Optional<GraphNode> node(String id) {
        return nodes.stream().filter(node -> node.id().equals(id)).findFirst();
    }

    /**
     * Returns all nodes of one kind, in insertion order.
     *
     * @param kind node kind
     * @return matching nodes
     */
    public List<GraphNode> nodes(NodeKind kind) {
        return nodes.stream().filter(node -> node.kind() == kind).toList();
    }

    /**
     * Returns the decision nodes ordered by ascending step number.
     *
     * @return sorted decision nodes
     */
    public List<DecisionNode> decisionNodes() {
        return nodes.stream()
            .filter(DecisionNode.class::isInstance)
            .map(DecisionNode.class::cast)
            .sorted((a, b) -> a.stepNumber().compareTo(b.stepNumber()))
            .toList();
    }

    /**
     * Returns the decision and transition nodes ordered by ascending step number.
     *
     * @return sorted step nodes
     */
    public List<StepNode> stepNodes() {
        return nodes.stream()
            .filter(StepNode.class::isInstance)
            .map(StepNode.class::cast)
            .sorted((a, b) -> a.stepNumber().compareTo(b.stepNumber()))
            .toList();
    }

    /**
     * Returns whether this graph stands for a table without rows.
     *
     * @return true if the graph holds an {@link EmptyNode}
     */
    public boolean isEmptyTable() {
        return node(EmptyNode.ID).isPresent();
    }

    /**
     * Returns the annotation nodes ordered by ascending anchor step.
     *
     * @return sorted annotation nodes
     */
    public List<AnnotationNode> annotationNodes() {
        return nodes.stream()
            .filter(AnnotationNode.class::isInstance)
            .map(AnnotationNode.class::cast)
            .sorted((a, b) -> a.anchor().compareTo(b.anchor()))
            .toList();
    }

    /**
     * Returns the edges leaving a node, in insertion order.
     *
     * @param nodeId source node id
     * @return outgoing edges
     */
    public List<GraphEdge> outgoing(String nodeId) {
        return edges.stream().filter(edge -> edge.sourceId().equals(nodeId)).toList();
    }

    /**
     * Returns the edges entering a node, in insertion order.
     *
     * @param nodeId target node id
     * @return incoming edges
     */
    public List<GraphEdge> incoming(String nodeId) {
        return edges.stream().filter(edge -> edge.targetId().equals(nodeId)).toList();
    }
}
