package com.ebdgraph.core.validation;

import com.ebdgraph.core.graph.AnnotationNode;
import com.ebdgraph.core.graph.DecisionNode;
import com.ebdgraph.core.graph.EbdGraph;
import com.ebdgraph.core.graph.EdgeKind;
import com.ebdgraph.core.graph.EmptyNode;
import com.ebdgraph.core.graph.GraphEdge;
import com.ebdgraph.core.graph.GraphNode;
import com.ebdgraph.core.graph.NodeKind;
import com.ebdgraph.core.graph.StepNode;
import com.ebdgraph.core.graph.TransitionNode;
import com.ebdgraph.core.graph.TransitionalOutcomeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Checks the invariants of an {@link EbdGraph} after conversion.
 *
 * <p>Validation never throws for content issues and never changes the graph. Issues come back as
 * an ordered list of {@link Finding}s. Checks run in this order:
 * <ol>
 *   <li>exactly one start node (fatal)</li>
 *   <li>every node reachable from the start node (fatal, one finding per unreachable node)</li>
 *   <li>outcome labels of each decision node pairwise distinct (fatal)</li>
 *   <li>outcome labels of each decision node equal to its source row's outcome codes (fatal)</li>
 *   <li>transition steps and transitional outcomes continue at exactly one step, decisions never
 *       continue unconditionally (fatal)</li>
 *   <li>an empty-table node is the only node besides the start node (fatal)</li>
 *   <li>cycles (warning, one finding per back-edge)</li>
 * </ol>
 *
 * <p>Annotation nodes count as reachable when their anchor is, since the annotates edge is
 * undirected in meaning.
 */
public class GraphValidator {

    private static final Logger log = LoggerFactory.getLogger(GraphValidator.class);

    /**
     * Validates a graph.
     *
     * @param graph graph to check
     * @return findings in check order; empty for a well-formed acyclic graph
     */
    public List<Finding> validate(EbdGraph graph) {
        Objects.requireNonNull(graph, "graph must not be null");

        Map<String, List<GraphEdge>> outgoing = new HashMap<>();
        for (GraphEdge edge : graph.edges()) {
            outgoing.computeIfAbsent(edge.sourceId(), id -> new ArrayList<>()).add(edge);
        }

        List<Finding> findings = new ArrayList<>();
        List<GraphNode> starts = graph.nodes(NodeKind.START);
        checkStartNodes(starts, findings);
        if (!starts.isEmpty()) {
            checkReachability(graph, starts, outgoing, findings);
        }
        for (DecisionNode decision : graph.decisionNodes()) {
            checkOutcomeLabels(decision, outgoing.getOrDefault(decision.id(), List.of()), findings);
        }
        checkTransitions(graph, outgoing, findings);
        checkEmptyNode(graph, findings);
        checkCycles(graph, starts, outgoing, findings);

        log.debug("Validated graph {}: {} findings", graph.metadata().ebdCode(), findings.size());
        return findings;
    }

    /**
     * Validates a graph and fails if it must not be rendered.
     *
     * @param graph graph to check
     * @return report holding the remaining (non-fatal) findings; reporting them is up to the caller
     * @throws MalformedOutcomeSetException if a decision node's outcomes don't match its row
     * @throws GraphValidationException for any other fatal finding
     */
    public ValidationReport requireRenderable(EbdGraph graph) {
        ValidationReport report = new ValidationReport(validate(graph));
        if (!report.ofKind(FindingKind.MALFORMED_OUTCOME_SET).isEmpty()) {
            throw new MalformedOutcomeSetException(report.fatal());
        }
        if (report.hasFatal()) {
            throw new GraphValidationException(
                "Graph " + graph.metadata().ebdCode() + " has fatal findings", report.fatal());
        }
        report.warnings().forEach(warning -> log.debug("Non-fatal finding: {}", warning));
        return report;
    }

    private void checkStartNodes(List<GraphNode> starts, List<Finding> findings) {
        if (starts.isEmpty()) {
            findings.add(Finding.of(FindingKind.MISSING_START_NODE, "graph", "Graph has no start node"));
        } else if (starts.size() > 1) {
            findings.add(Finding.of(FindingKind.MULTIPLE_START_NODES, "graph",
                "Graph has " + starts.size() + " start nodes"));
        }
    }

    private void checkReachability(EbdGraph graph, List<GraphNode> starts,
                                   Map<String, List<GraphEdge>> outgoing, List<Finding> findings) {
        Set<String> reached = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        for (GraphNode start : starts) {
            reached.add(start.id());
            queue.add(start.id());
        }
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (GraphEdge edge : outgoing.getOrDefault(current, List.of())) {
                if (edge.kind() != EdgeKind.ANNOTATES && reached.add(edge.targetId())) {
                    queue.add(edge.targetId());
                }
            }
        }
        for (GraphEdge edge : graph.edges()) {
            if (edge.kind() == EdgeKind.ANNOTATES && reached.contains(edge.targetId())) {
                reached.add(edge.sourceId());
            }
        }

        for (GraphNode node : graph.nodes()) {
            if (!reached.contains(node.id())) {
                String message = node instanceof AnnotationNode
                    ? "Annotation is attached to an unreachable step"
                    : "Node is not reachable from the start node";
                findings.add(Finding.of(FindingKind.UNREACHABLE_NODE, node.id(), message));
            }
        }
    }

    private void checkOutcomeLabels(DecisionNode decision, List<GraphEdge> edges, List<Finding> findings) {
        Set<String> identities = new HashSet<>();
        Set<String> codes = new LinkedHashSet<>();
        for (GraphEdge edge : edges) {
            if (edge.kind() != EdgeKind.OUTCOME) {
                continue;
            }
            if (!identities.add(edge.identityLabel())) {
                findings.add(Finding.of(FindingKind.DUPLICATE_OUTCOME_LABEL, decision.id(),
                    "Outcome label '" + edge.identityLabel() + "' is used more than once"));
            }
            codes.add(edge.outcome());
        }

        Set<String> expected = new LinkedHashSet<>(decision.outcomeCodes());
        if (!codes.equals(expected)) {
            findings.add(Finding.of(FindingKind.MALFORMED_OUTCOME_SET, decision.id(),
                "Outcome edges " + codes + " do not match the row's outcome codes " + expected));
        }
    }

    private void checkTransitions(EbdGraph graph, Map<String, List<GraphEdge>> outgoing, List<Finding> findings) {
        for (StepNode step : graph.stepNodes()) {
            List<GraphEdge> edges = outgoing.getOrDefault(step.id(), List.of());
            long transitions = edges.stream().filter(edge -> edge.kind() == EdgeKind.TRANSITION).count();
            long outcomes = edges.stream().filter(edge -> edge.kind() == EdgeKind.OUTCOME).count();
            if (step instanceof TransitionNode && (transitions != 1 || outcomes != 0)) {
                findings.add(Finding.of(FindingKind.MALFORMED_TRANSITION, step.id(),
                    "Transition step has " + transitions + " transition and " + outcomes
                        + " outcome edges, expected exactly one transition"));
            } else if (step instanceof DecisionNode && transitions != 0) {
                findings.add(Finding.of(FindingKind.MALFORMED_TRANSITION, step.id(),
                    "Decision step continues unconditionally"));
            }
        }
        for (GraphNode node : graph.nodes(NodeKind.TRANSITIONAL_OUTCOME)) {
            TransitionalOutcomeNode transitional = (TransitionalOutcomeNode) node;
            List<GraphEdge> edges = outgoing.getOrDefault(node.id(), List.of());
            boolean continuesAtNextStep = edges.size() == 1
                && edges.get(0).kind() == EdgeKind.TRANSITION
                && edges.get(0).targetId().equals(transitional.nextStep().value());
            if (!continuesAtNextStep) {
                findings.add(Finding.of(FindingKind.MALFORMED_TRANSITION, node.id(),
                    "Transitional outcome must continue at step " + transitional.nextStep() + " only"));
            }
        }
    }

    private void checkEmptyNode(EbdGraph graph, List<Finding> findings) {
        if (!graph.isEmptyTable()) {
            return;
        }
        long others = graph.nodes().stream()
            .filter(node -> node.kind() != NodeKind.START && node.kind() != NodeKind.EMPTY)
            .count();
        if (others > 0) {
            findings.add(Finding.of(FindingKind.UNEXPECTED_EMPTY_NODE, EmptyNode.ID,
                "Empty-table node next to " + others + " other nodes"));
        }
    }

    /**
     * Depth-first search tracking the nodes on the current path; an edge into the current path
     * closes a cycle. Starts at the start node(s), then at any node not yet visited, so that loops
     * in unreachable parts are reported too.
     */
    private void checkCycles(EbdGraph graph, List<GraphNode> starts,
                             Map<String, List<GraphEdge>> outgoing, List<Finding> findings) {
        Set<String> visited = new HashSet<>();
        Set<String> onPath = new HashSet<>();
        for (GraphNode start : starts) {
            visit(start.id(), outgoing, visited, onPath, findings);
        }
        for (GraphNode node : graph.nodes()) {
            visit(node.id(), outgoing, visited, onPath, findings);
        }
    }

    private void visit(String root, Map<String, List<GraphEdge>> outgoing,
                       Set<String> visited, Set<String> onPath, List<Finding> findings) {
        if (!visited.add(root)) {
            return;
        }
        Deque<PathFrame> path = new ArrayDeque<>();
        onPath.add(root);
        path.push(new PathFrame(root, outgoing.getOrDefault(root, List.of())));
        while (!path.isEmpty()) {
            PathFrame frame = path.peek();
            if (!frame.edges.hasNext()) {
                path.pop();
                onPath.remove(frame.nodeId);
                continue;
            }
            GraphEdge edge = frame.edges.next();
            if (edge.kind() == EdgeKind.ANNOTATES) {
                continue;
            }
            String target = edge.targetId();
            if (onPath.contains(target)) {
                findings.add(Finding.of(FindingKind.CYCLE, edge.id(), cycleMessage(edge)));
            } else if (visited.add(target)) {
                onPath.add(target);
                path.push(new PathFrame(target, outgoing.getOrDefault(target, List.of())));
            }
        }
    }

    private static String cycleMessage(GraphEdge edge) {
        String message = "Step " + edge.sourceId() + " loops back to step " + edge.targetId();
        return edge.outcome() == null ? message : message + " for outcome '" + edge.outcome() + "'";
    }

    /**
     * A node on the current search path with the edges still to follow.
     */
    private static final class PathFrame {

        private final String nodeId;
        private final Iterator<GraphEdge> edges;

        PathFrame(String nodeId, List<GraphEdge> edges) {
            this.nodeId = nodeId;
            this.edges = edges.iterator();
        }
    }
}
