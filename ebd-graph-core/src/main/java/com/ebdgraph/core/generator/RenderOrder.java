package com.ebdgraph.core.generator;

import com.ebdgraph.core.graph.EbdGraph;
import com.ebdgraph.core.graph.EdgeKind;
import com.ebdgraph.core.graph.EmptyNode;
import com.ebdgraph.core.graph.GraphEdge;
import com.ebdgraph.core.graph.GraphNode;
import com.ebdgraph.core.graph.NodeKind;
import com.ebdgraph.core.graph.StepNode;
import com.ebdgraph.core.table.StepNumber;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stable emission order of nodes and edges, independent of the order rows had in the table.
 *
 * <p>Nodes: start, step nodes by ascending step number, result nodes (outcome, transitional
 * outcome, end) in order of first discovery (walking the step nodes in that order, edges in row
 * order), annotation nodes by ascending anchor. Edges: start edge, outcome and transition edges per
 * step node in the same walk, each transitional outcome's own transition edge right after the edge
 * that discovered it, annotation edges by ascending anchor.
 *
 * <p>The graph of a table without rows renders as its empty-table node alone.
 *
 * @param nodes nodes in emission order
 * @param edges edges in emission order
 */
public record RenderOrder(List<GraphNode> nodes, List<GraphEdge> edges) {

    public RenderOrder {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    /**
     * Computes the emission order of a graph.
     *
     * @param graph graph to render
     * @return ordered nodes and edges
     */
    public static RenderOrder of(EbdGraph graph) {
        if (graph.isEmptyTable()) {
            return new RenderOrder(List.of(graph.node(EmptyNode.ID).orElseThrow()), List.of());
        }

        Map<String, GraphNode> byId = new LinkedHashMap<>();
        graph.nodes().forEach(node -> byId.put(node.id(), node));

        List<GraphNode> nodes = new ArrayList<>(graph.nodes(NodeKind.START));
        List<GraphEdge> edges = new ArrayList<>();
        graph.edges().stream().filter(edge -> edge.kind() == EdgeKind.START).forEach(edges::add);

        List<StepNode> steps = graph.stepNodes();
        nodes.addAll(steps);

        Map<String, GraphNode> results = new LinkedHashMap<>();
        for (StepNode step : steps) {
            for (GraphEdge edge : graph.outgoing(step.id())) {
                if (edge.kind() == EdgeKind.ANNOTATES) {
                    continue;
                }
                edges.add(edge);
                GraphNode target = byId.get(edge.targetId());
                if (isResult(target) && results.putIfAbsent(target.id(), target) == null
                    && target.kind() == NodeKind.TRANSITIONAL_OUTCOME) {
                    graph.outgoing(target.id()).stream()
                        .filter(next -> next.kind() == EdgeKind.TRANSITION)
                        .forEach(edges::add);
                }
            }
        }
        nodes.addAll(results.values());

        nodes.addAll(graph.annotationNodes());
        graph.edges().stream()
            .filter(edge -> edge.kind() == EdgeKind.ANNOTATES)
            .sorted(Comparator.comparing(edge -> anchorOf(byId, edge)))
            .forEach(edges::add);

        return new RenderOrder(nodes, edges);
    }

    private static boolean isResult(GraphNode node) {
        return node.kind() == NodeKind.OUTCOME
            || node.kind() == NodeKind.TRANSITIONAL_OUTCOME
            || node.kind() == NodeKind.END;
    }

    private static StepNumber anchorOf(Map<String, GraphNode> byId, GraphEdge edge) {
        return ((StepNode) byId.get(edge.targetId())).stepNumber();
    }
}
