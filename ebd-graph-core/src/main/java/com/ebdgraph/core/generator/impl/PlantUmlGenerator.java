package com.ebdgraph.core.generator.impl;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ebdgraph.core.generator.DiagramGenerator;
import com.ebdgraph.core.generator.GeneratedDiagram;
import com.ebdgraph.core.generator.GeneratorConfig;
import com.ebdgraph.core.graph.AnnotationNode;
import com.ebdgraph.core.graph.DecisionNode;
import com.ebdgraph.core.graph.EbdGraph;
import com.ebdgraph.core.graph.EdgeKind;
import com.ebdgraph.core.graph.GraphEdge;
import com.ebdgraph.core.graph.GraphNode;
import com.ebdgraph.core.graph.NodeKind;
import com.ebdgraph.core.graph.OutcomeNode;
import com.ebdgraph.core.graph.StepNode;
import com.ebdgraph.core.graph.TransitionalOutcomeNode;
import com.ebdgraph.core.table.EbdTableMetadata;
import com.ebdgraph.core.table.StepNumber;
import com.ebdgraph.core.util.LineBreaks;
import com.ebdgraph.core.validation.GraphValidator;

/**
 * Generates PlantUML activity diagrams from EBD graphs.
 *
 * <p>The graph is written as a tree starting at the entry step:
 * <ul>
 *   <li>a decision with two outcome codes becomes {@code if / else / endif}, any other count a
 *       {@code switch / case / endswitch}</li>
 *   <li>a multi-result becomes {@code split / split again / end split}</li>
 *   <li>an outcome becomes an activity with its label as note, followed by {@code kill}</li>
 *   <li>a transitional outcome becomes an activity with its label as note and continues at its
 *       next step, a transition step continues at its next step directly</li>
 *   <li>"Ende" becomes {@code end}</li>
 * </ul>
 *
 * <p>Each step is written once. A step entered from more than one place, loops included, is
 * marked with a connector named after its step number; the other places jump to that connector
 * and {@code detach}.
 *
 * <p>Annotations are left out unless {@link GeneratorConfig#annotationClusters()} is set; they are
 * then written as {@code '} comments naming the covered steps.
 *
 * @see <a href="https://plantuml.com/activity-diagram-beta">PlantUML Activity Diagram</a>
 */
public class PlantUmlGenerator implements DiagramGenerator {

    private static final Logger log = LoggerFactory.getLogger(PlantUmlGenerator.class);

    private static final String GENERATOR_ID = "plantuml";
    private static final String GENERATOR_DISPLAY_NAME = "PlantUML Activity Generator";
    private static final String FILE_EXTENSION = "puml";

    private static final String INDENT = "    ";
    private static final String LINE_BREAK = "\\n";

    private static final List<String> SKIN_PARAMS = List.of(
        "Shadowing false",
        "NoteBorderColor #f3f1f6",
        "NoteBackgroundColor #f3f1f6",
        "NoteFontSize 12",
        "ActivityBorderColor none",
        "ActivityBackgroundColor #7a8da1",
        "ActivityFontSize 16",
        "ArrowColor #7aab8a",
        "ArrowFontSize 16",
        "ActivityDiamondBackgroundColor #7aab8a",
        "ActivityDiamondBorderColor #7aab8a",
        "ActivityDiamondFontSize 18",
        "defaultFontName DejaVu Serif Condensed",
        "ActivityEndColor #669580"
    );

    private final GraphValidator validator = new GraphValidator();

    @Override
    public String getId() {
        return GENERATOR_ID;
    }

    @Override
    public String getDisplayName() {
        return GENERATOR_DISPLAY_NAME;
    }

    @Override
    public String getFileExtension() {
        return FILE_EXTENSION;
    }

    @Override
    public GeneratedDiagram generate(EbdGraph graph, GeneratorConfig config) {
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(config, "config must not be null");

        validator.requireRenderable(graph);
        log.debug("Generating PlantUML diagram for {}", graph.metadata().ebdCode());

        StringBuilder sb = new StringBuilder();
        sb.append("@startuml\n");
        SKIN_PARAMS.forEach(param -> sb.append("skinparam ").append(param).append("\n"));
        sb.append("\n");
        appendTitle(sb, graph.metadata());

        EbdTableMetadata metadata = graph.metadata();
        sb.append(":<b>").append(text(metadata.ebdCode())).append("</b>;\n");
        if (graph.isEmptyTable()) {
            if (metadata.remark() != null && !metadata.remark().isBlank()) {
                appendNote(sb, "note right", "end note", 0, wrap(metadata.remark(), config.labelWrapWidth()));
            }
        } else {
            if (metadata.role() != null) {
                appendNote(sb, "note right", "end note", 0, "<b><i>Prüfende Rolle: " + text(metadata.role()));
            }
            if (config.annotationClusters()) {
                graph.annotationNodes().forEach(annotation -> appendAnnotationComment(sb, annotation));
            }
            sb.append("\n");
            new TreeWriter(graph, config, sb).write();
        }

        sb.append("\n@enduml\n");
        return new GeneratedDiagram(metadata.ebdCode(), sb.toString(), FILE_EXTENSION);
    }

    // ==================== Header ====================

    private void appendTitle(StringBuilder sb, EbdTableMetadata metadata) {
        sb.append("title\n");
        if (metadata.chapter() == null && metadata.section() == null) {
            sb.append(text(metadata.ebdName() != null ? metadata.ebdName() : metadata.ebdCode())).append("\n");
        } else {
            if (metadata.chapter() != null) {
                sb.append(text(metadata.chapter())).append("\n\n");
            }
            if (metadata.section() != null) {
                sb.append(text(metadata.section())).append("\n");
            }
        }
        sb.append("end title\n");
    }

    private void appendAnnotationComment(StringBuilder sb, AnnotationNode annotation) {
        String steps = annotation.coveredSteps().stream()
            .map(StepNumber::value)
            .collect(Collectors.joining(", "));
        sb.append("' ").append(annotation.id())
            .append(" (steps ").append(steps).append("): ")
            .append(text(annotation.text()))
            .append("\n");
    }

    private static void appendNote(StringBuilder sb, String open, String close, int depth, String content) {
        String indent = INDENT.repeat(depth);
        sb.append(indent).append(open).append("\n");
        sb.append(indent).append(INDENT).append(content).append("\n");
        sb.append(indent).append(close).append("\n");
    }

    // ==================== Text ====================

    private static String wrap(String value, int width) {
        return text(LineBreaks.addLineBreaks(value, width, "\n")).replace("\n", LINE_BREAK);
    }

    /**
     * Single-line text: line breaks become PlantUML's escaped newline.
     */
    private static String text(String value) {
        return value.replace("\r", "").replace("\n", LINE_BREAK);
    }

    // ==================== Tree ====================

    /**
     * Writes the decision tree depth-first with an explicit task stack, so that deep tables
     * don't exhaust the call stack.
     */
    private static final class TreeWriter {

        private final EbdGraph graph;
        private final GeneratorConfig config;
        private final StringBuilder sb;
        private final Map<String, GraphNode> nodesById = new HashMap<>();
        private final Set<String> sharedSteps = new HashSet<>();
        private final Set<String> writtenSteps = new HashSet<>();
        private final Deque<Task> tasks = new ArrayDeque<>();

        TreeWriter(EbdGraph graph, GeneratorConfig config, StringBuilder sb) {
            this.graph = graph;
            this.config = config;
            this.sb = sb;
            graph.nodes().forEach(node -> nodesById.put(node.id(), node));

            Map<String, Integer> incoming = new HashMap<>();
            for (GraphEdge edge : graph.edges()) {
                if (edge.kind() != EdgeKind.ANNOTATES) {
                    incoming.merge(edge.targetId(), 1, Integer::sum);
                }
            }
            // a transitional outcome is written once per incoming edge, each time continuing at its step
            Map<String, Integer> visits = new HashMap<>();
            for (GraphEdge edge : graph.edges()) {
                if (edge.kind() == EdgeKind.ANNOTATES) {
                    continue;
                }
                int weight = nodesById.get(edge.sourceId()).kind() == NodeKind.TRANSITIONAL_OUTCOME
                    ? incoming.getOrDefault(edge.sourceId(), 1)
                    : 1;
                visits.merge(edge.targetId(), weight, Integer::sum);
            }
            for (StepNode step : graph.stepNodes()) {
                if (visits.getOrDefault(step.id(), 0) > 1) {
                    sharedSteps.add(step.id());
                }
            }
        }

        void write() {
            graph.edges().stream()
                .filter(edge -> edge.kind() == EdgeKind.START)
                .forEach(edge -> tasks.push(new Visit(0, edge.targetId())));
            while (!tasks.isEmpty()) {
                Task task = tasks.pop();
                if (task instanceof Line line) {
                    sb.append(INDENT.repeat(line.depth())).append(line.text()).append("\n");
                } else if (task instanceof Visit visit) {
                    schedule(expand(visit));
                }
            }
        }

        /**
         * Pushes tasks so that they run in list order.
         */
        private void schedule(List<Task> expanded) {
            for (int i = expanded.size() - 1; i >= 0; i--) {
                tasks.push(expanded.get(i));
            }
        }

        private List<Task> expand(Visit visit) {
            GraphNode node = nodesById.get(visit.nodeId());
            int depth = visit.depth();
            List<Task> result = new ArrayList<>();
            switch (node.kind()) {
                case DECISION, TRANSITION -> expandStep((StepNode) node, depth, result);
                case OUTCOME -> {
                    OutcomeNode outcome = (OutcomeNode) node;
                    addResult(outcome.endCode(), outcome.label(), depth, result);
                    result.add(new Line(depth, "kill;"));
                }
                case TRANSITIONAL_OUTCOME -> {
                    TransitionalOutcomeNode outcome = (TransitionalOutcomeNode) node;
                    addResult(outcome.endCode(), outcome.label(), depth, result);
                    result.add(new Visit(depth, outcome.nextStep().value()));
                }
                case END -> result.add(new Line(depth, "end"));
                case START, EMPTY, ANNOTATION ->
                    throw new IllegalStateException("Unexpected " + node.kind() + " node inside the tree: " + node.id());
            }
            return result;
        }

        private void expandStep(StepNode step, int depth, List<Task> result) {
            String connector = "(" + step.id() + ")";
            if (!writtenSteps.add(step.id())) {
                result.add(new Line(depth, connector));
                result.add(new Line(depth, "detach"));
                return;
            }
            if (sharedSteps.contains(step.id())) {
                result.add(new Line(depth, connector));
            }
            String label = wrap(step.stepNumber().value() + ": " + step.description(), config.labelWrapWidth());
            if (step instanceof DecisionNode decision) {
                expandDecision(decision, label, depth, result);
            } else {
                result.add(new Line(depth, ":" + label + ";"));
                if (step.note() != null) {
                    addNote(wrap(step.note(), config.labelWrapWidth()), depth, result);
                }
                graph.outgoing(step.id()).stream()
                    .filter(edge -> edge.kind() == EdgeKind.TRANSITION)
                    .forEach(edge -> result.add(new Visit(depth, edge.targetId())));
            }
        }

        private void expandDecision(DecisionNode decision, String label, int depth, List<Task> result) {
            Map<String, List<String>> targetsByCode = new LinkedHashMap<>();
            for (GraphEdge edge : graph.outgoing(decision.id())) {
                if (edge.kind() == EdgeKind.OUTCOME) {
                    targetsByCode.computeIfAbsent(edge.outcome(), code -> new ArrayList<>()).add(edge.targetId());
                }
            }
            List<String> codes = new ArrayList<>(targetsByCode.keySet());
            if (codes.size() == 2) {
                result.add(new Line(depth, "if (" + label + ") then (" + text(codes.get(0)) + ")"));
                addBranch(targetsByCode.get(codes.get(0)), depth + 1, result);
                result.add(new Line(depth, "else (" + text(codes.get(1)) + ")"));
                addBranch(targetsByCode.get(codes.get(1)), depth + 1, result);
                result.add(new Line(depth, "endif"));
            } else {
                result.add(new Line(depth, "switch (" + label + ")"));
                for (String code : codes) {
                    result.add(new Line(depth, "case (" + text(code) + ")"));
                    addBranch(targetsByCode.get(code), depth + 1, result);
                }
                result.add(new Line(depth, "endswitch"));
            }
        }

        private void addBranch(List<String> targets, int depth, List<Task> result) {
            if (targets.size() == 1) {
                result.add(new Visit(depth, targets.get(0)));
                return;
            }
            result.add(new Line(depth, "split"));
            for (int i = 0; i < targets.size(); i++) {
                if (i > 0) {
                    result.add(new Line(depth, "split again"));
                }
                result.add(new Visit(depth + 1, targets.get(i)));
            }
            result.add(new Line(depth, "end split"));
        }

        private void addResult(String endCode, String label, int depth, List<Task> result) {
            result.add(new Line(depth, ":" + text(endCode) + ";"));
            if (label != null) {
                addNote(wrap(label, config.labelWrapWidth()), depth, result);
            }
        }

        private void addNote(String content, int depth, List<Task> result) {
            result.add(new Line(depth, "note left"));
            result.add(new Line(depth + 1, content));
            result.add(new Line(depth, "endnote"));
        }
    }

    private sealed interface Task permits Line, Visit {}

    private record Line(int depth, String text) implements Task {}

    private record Visit(int depth, String nodeId) implements Task {}
}
