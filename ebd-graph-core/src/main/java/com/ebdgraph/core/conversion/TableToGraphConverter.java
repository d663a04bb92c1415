package com.ebdgraph.core.conversion;

import com.ebdgraph.core.graph.AnnotationNode;
import com.ebdgraph.core.graph.DecisionNode;
import com.ebdgraph.core.graph.EbdGraph;
import com.ebdgraph.core.graph.EmptyNode;
import com.ebdgraph.core.graph.EndNode;
import com.ebdgraph.core.graph.GraphEdge;
import com.ebdgraph.core.graph.GraphNode;
import com.ebdgraph.core.graph.OutcomeNode;
import com.ebdgraph.core.graph.StartNode;
import com.ebdgraph.core.graph.StepNode;
import com.ebdgraph.core.graph.TransitionNode;
import com.ebdgraph.core.graph.TransitionalOutcomeNode;
import com.ebdgraph.core.table.EbdTable;
import com.ebdgraph.core.table.MultiStepInstruction;
import com.ebdgraph.core.table.StepNumber;
import com.ebdgraph.core.table.StepResult;
import com.ebdgraph.core.table.TableRow;
import com.ebdgraph.core.util.EbdReferences;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Turns an {@link EbdTable} into an {@link EbdGraph}.
 *
 * <p>The conversion is total and deterministic: the same table always yields the same nodes and
 * edges, and permuting the rows yields an isomorphic graph. It does not trust the producer of the
 * table: references to missing steps abort the conversion with a typed exception and no graph is
 * returned.
 *
 * <h2>Mapping</h2>
 * <ul>
 *   <li>one {@link StartNode}, connected to the lowest step number</li>
 *   <li>one {@link DecisionNode} per check row, one {@link TransitionNode} per transition row</li>
 *   <li>one {@link OutcomeNode} per distinct (end code, label) pair</li>
 *   <li>one {@link TransitionalOutcomeNode} per distinct (end code, label, next step) triple,
 *       connected to its next step</li>
 *   <li>at most one {@link EndNode}, shared by all "Ende" results</li>
 *   <li>one {@link AnnotationNode} per multi-step instruction, attached to its first step</li>
 * </ul>
 *
 * <p>A table without rows becomes a {@link StartNode} connected to a single {@link EmptyNode}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * EbdGraph graph = new TableToGraphConverter().convert(table);
 * }</pre>
 */
public class TableToGraphConverter {

    private static final Logger log = LoggerFactory.getLogger(TableToGraphConverter.class);

    private static final int LABEL_DIGEST_BYTES = 4;

    /**
     * Converts a table into a graph.
     *
     * @param table table to convert
     * @return the graph
     * @throws UnresolvedReferenceException if an outcome continues at a missing step
     * @throws DanglingAnnotationException if an instruction is anchored at a missing step
     */
    public EbdGraph convert(EbdTable table) {
        Objects.requireNonNull(table, "table must not be null");
        log.debug("Converting table {} with {} rows", table.metadata().ebdCode(), table.rows().size());

        List<GraphNode> nodes = new ArrayList<>();
        List<GraphEdge> edges = new ArrayList<>();
        nodes.add(new StartNode());

        if (table.isEmpty()) {
            if (!table.multiStepInstructions().isEmpty()) {
                throw new DanglingAnnotationException(table.multiStepInstructions().get(0).firstStep());
            }
            nodes.add(new EmptyNode());
            edges.add(GraphEdge.start(EmptyNode.ID));
            log.info("Converted table {} without rows", table.metadata().ebdCode());
            return new EbdGraph(table.metadata(), nodes, edges);
        }

        Map<StepNumber, StepNode> steps = new LinkedHashMap<>();
        for (TableRow row : table.rows()) {
            StepNode step = row.isTransition()
                ? new TransitionNode(row.stepNumber(), row.description(), row.note())
                : new DecisionNode(row.stepNumber(), row.description(), row.note(),
                    List.copyOf(row.outcomes().keySet()));
            steps.put(row.stepNumber(), step);
            nodes.add(step);
        }

        TargetResolver resolver = new TargetResolver(steps, ambiguousEndCodes(table), ambiguousTransitions(table));
        for (TableRow row : table.rows()) {
            String sourceId = row.stepNumber().value();
            if (row.isTransition()) {
                if (!steps.containsKey(row.next())) {
                    throw new UnresolvedReferenceException(row.stepNumber(), row.next());
                }
                edges.add(GraphEdge.transition(sourceId, row.next().value()));
                continue;
            }
            for (Map.Entry<String, StepResult> outcome : row.outcomes().entrySet()) {
                resolver.current(row.stepNumber(), outcome.getKey());
                List<String> targets = outcome.getValue().accept(resolver);
                if (targets.size() == 1) {
                    edges.add(GraphEdge.outcome(sourceId, targets.get(0), outcome.getKey()));
                } else {
                    for (int branch = 0; branch < targets.size(); branch++) {
                        edges.add(GraphEdge.branch(sourceId, targets.get(branch), outcome.getKey(), branch));
                    }
                }
                edges.addAll(resolver.takeTransitions());
            }
        }
        nodes.addAll(resolver.terminalNodes());

        StepNumber entry = steps.keySet().stream().sorted().findFirst().orElseThrow();
        edges.add(0, GraphEdge.start(entry.value()));

        for (AnnotationNode annotation : annotations(table, steps)) {
            nodes.add(annotation);
            edges.add(GraphEdge.annotates(annotation.id(), annotation.anchor().value()));
        }

        EbdGraph graph = new EbdGraph(table.metadata(), nodes, edges);
        log.info("Converted table {}: {} nodes, {} edges",
            table.metadata().ebdCode(), graph.nodes().size(), graph.edges().size());
        return graph;
    }

    /**
     * Builds the annotation nodes, each covering the steps from its anchor up to its explicit last
     * step, the step before the next instruction, or the end of the table.
     */
    private List<AnnotationNode> annotations(EbdTable table, Map<StepNumber, StepNode> stepNodes) {
        List<MultiStepInstruction> instructions = table.multiStepInstructions().stream()
            .sorted(Comparator.comparing(MultiStepInstruction::firstStep))
            .toList();
        List<StepNumber> steps = stepNodes.keySet().stream().sorted().toList();

        List<AnnotationNode> result = new ArrayList<>();
        for (int i = 0; i < instructions.size(); i++) {
            MultiStepInstruction instruction = instructions.get(i);
            if (!stepNodes.containsKey(instruction.firstStep())) {
                throw new DanglingAnnotationException(instruction.firstStep());
            }
            StepNumber next = i + 1 < instructions.size() ? instructions.get(i + 1).firstStep() : null;
            StepNumber last = instruction.lastStep();
            List<StepNumber> covered = steps.stream()
                .filter(step -> step.compareTo(instruction.firstStep()) >= 0)
                .filter(step -> last == null || step.compareTo(last) <= 0)
                .filter(step -> next == null || step.compareTo(next) < 0)
                .toList();
            log.debug("Instruction at step {} covers steps {}", instruction.firstStep(), covered);
            result.add(new AnnotationNode(instruction.firstStep(), instruction.text(), covered));
        }
        return result;
    }

    /**
     * Finds the end codes used with more than one label. Their outcome node ids need the label
     * digest to stay unique.
     */
    private static Set<String> ambiguousEndCodes(EbdTable table) {
        Map<String, Set<String>> labelsByCode = new HashMap<>();
        for (TableRow row : table.rows()) {
            for (StepResult result : row.outcomes().values()) {
                for (StepResult leaf : result.leaves()) {
                    if (leaf instanceof StepResult.Terminal terminal) {
                        labelsByCode.computeIfAbsent(terminal.endCode(), code -> new HashSet<>())
                            .add(terminal.label());
                    }
                }
            }
        }
        return ambiguousKeys(labelsByCode);
    }

    /**
     * Finds the (end code, next step) pairs of transitional outcomes used with more than one label.
     */
    private static Set<String> ambiguousTransitions(EbdTable table) {
        Map<String, Set<String>> labelsById = new HashMap<>();
        for (TableRow row : table.rows()) {
            for (StepResult result : row.outcomes().values()) {
                for (StepResult leaf : result.leaves()) {
                    if (leaf instanceof StepResult.TransitionalOutcome transitional) {
                        labelsById.computeIfAbsent(
                                TransitionalOutcomeNode.idFor(transitional.endCode(), transitional.step()),
                                id -> new HashSet<>())
                            .add(transitional.label());
                    }
                }
            }
        }
        return ambiguousKeys(labelsById);
    }

    private static Set<String> ambiguousKeys(Map<String, Set<String>> labelsByKey) {
        Set<String> ambiguous = new HashSet<>();
        labelsByKey.forEach((key, labels) -> {
            if (labels.size() > 1) {
                ambiguous.add(key);
            }
        });
        return ambiguous;
    }

    private static String outcomeId(String baseId, String label, boolean ambiguous) {
        if (!ambiguous) {
            return baseId;
        }
        return baseId + "_" + digest(label == null ? "" : label);
    }

    private static String digest(String text) {
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(text.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder();
            for (int i = 0; i < LABEL_DIGEST_BYTES; i++) {
                hex.append(String.format("%02x", hash[i]));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Resolves a step result to the ids of the nodes it leads to, creating shared result nodes on
     * the way. The lookups only live for one conversion.
     */
    private static final class TargetResolver implements StepResult.Visitor<List<String>> {

        private final Map<StepNumber, StepNode> steps;
        private final Set<String> ambiguousEndCodes;
        private final Set<String> ambiguousTransitions;
        private final Map<OutcomeKey, GraphNode> outcomesByKey = new LinkedHashMap<>();
        private final List<GraphEdge> pendingTransitions = new ArrayList<>();
        private EndNode endNode;

        private StepNumber currentStep;
        private String currentOutcome;

        TargetResolver(Map<StepNumber, StepNode> steps, Set<String> ambiguousEndCodes,
                       Set<String> ambiguousTransitions) {
            this.steps = steps;
            this.ambiguousEndCodes = ambiguousEndCodes;
            this.ambiguousTransitions = ambiguousTransitions;
        }

        /**
         * Returns the transition edges of the transitional outcome nodes created since the last
         * call.
         */
        List<GraphEdge> takeTransitions() {
            List<GraphEdge> taken = List.copyOf(pendingTransitions);
            pendingTransitions.clear();
            return taken;
        }

        void current(StepNumber step, String outcome) {
            this.currentStep = step;
            this.currentOutcome = outcome;
        }

        List<GraphNode> terminalNodes() {
            List<GraphNode> result = new ArrayList<>();
            if (endNode != null) {
                result.add(endNode);
            }
            result.addAll(outcomesByKey.values());
            return result;
        }

        @Override
        public List<String> visitContinueAt(StepResult.ContinueAt result) {
            return List.of(resolveStep(result.step()).id());
        }

        @Override
        public List<String> visitTerminal(StepResult.Terminal result) {
            OutcomeKey key = new OutcomeKey(result.endCode(), result.label(), null);
            GraphNode node = outcomesByKey.computeIfAbsent(key, k -> new OutcomeNode(
                outcomeId(k.endCode(), k.label(), ambiguousEndCodes.contains(k.endCode())),
                k.endCode(),
                k.label(),
                EbdReferences.extract(k.label())));
            return List.of(node.id());
        }

        @Override
        public List<String> visitTransitionalOutcome(StepResult.TransitionalOutcome result) {
            StepNode next = resolveStep(result.step());
            OutcomeKey key = new OutcomeKey(result.endCode(), result.label(), result.step());
            GraphNode node = outcomesByKey.get(key);
            if (node == null) {
                String baseId = TransitionalOutcomeNode.idFor(result.endCode(), result.step());
                node = new TransitionalOutcomeNode(
                    outcomeId(baseId, result.label(), ambiguousTransitions.contains(baseId)),
                    result.endCode(),
                    result.label(),
                    result.step(),
                    EbdReferences.extract(result.label()));
                outcomesByKey.put(key, node);
                pendingTransitions.add(GraphEdge.transition(node.id(), next.id()));
            }
            return List.of(node.id());
        }

        @Override
        public List<String> visitEndOfProcess(StepResult.EndOfProcess result) {
            if (endNode == null) {
                endNode = new EndNode();
            }
            return List.of(endNode.id());
        }

        @Override
        public List<String> visitMultiResult(StepResult.MultiResult result) {
            List<String> targets = new ArrayList<>();
            for (StepResult member : result.results()) {
                targets.addAll(member.accept(this));
            }
            return targets;
        }

        private StepNode resolveStep(StepNumber step) {
            StepNode target = steps.get(step);
            if (target == null) {
                throw new UnresolvedReferenceException(currentStep, currentOutcome, step);
            }
            return target;
        }
    }

    private record OutcomeKey(String endCode, String label, StepNumber nextStep) {}
}
