package com.ebdgraph.core.generator.impl;

import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ebdgraph.core.generator.DiagramGenerator;
import com.ebdgraph.core.generator.GeneratedDiagram;
import com.ebdgraph.core.generator.GeneratorConfig;
import com.ebdgraph.core.generator.RenderOrder;
import com.ebdgraph.core.graph.AnnotationNode;
import com.ebdgraph.core.graph.EbdGraph;
import com.ebdgraph.core.graph.EdgeKind;
import com.ebdgraph.core.graph.EndNode;
import com.ebdgraph.core.graph.GraphEdge;
import com.ebdgraph.core.graph.GraphNode;
import com.ebdgraph.core.graph.OutcomeNode;
import com.ebdgraph.core.graph.StepNode;
import com.ebdgraph.core.graph.TransitionalOutcomeNode;
import com.ebdgraph.core.table.StepNumber;
import com.ebdgraph.core.util.LineBreaks;
import com.ebdgraph.core.validation.GraphValidator;

/**
 * Generates Mermaid flowcharts from EBD graphs.
 *
 * <p>This is the simplified alternate dialect: nodes and labelled edges only, no per-kind
 * coloring. Output is Markdown with an embedded {@code ```mermaid} code block, suitable for
 * rendering in GitHub, GitLab and documentation sites.
 *
 * <p>Annotations are left out unless {@link GeneratorConfig#annotationClusters()} is set; they are
 * then written as {@code %%} comments naming the covered steps. A table without rows becomes a
 * single node showing the table remark.
 *
 * @see <a href="https://mermaid.js.org/syntax/flowchart.html">Mermaid Flowchart</a>
 */
public class MermaidGenerator implements DiagramGenerator {

    private static final Logger log = LoggerFactory.getLogger(MermaidGenerator.class);

    // Generator identification
    private static final String GENERATOR_ID = "mermaid";
    private static final String GENERATOR_DISPLAY_NAME = "Mermaid Flowchart Generator";
    private static final String FILE_EXTENSION = "md";

    // Markdown formatting
    private static final String MARKDOWN_HEADER_PREFIX = "# ";
    private static final String MARKDOWN_NEWLINE = "\n";
    private static final String CODE_BLOCK_START = "```mermaid\n";
    private static final String CODE_BLOCK_END = "```\n";

    private static final String FLOWCHART_TD = "flowchart TD\n";
    private static final String INDENT = "  ";
    private static final String LINE_BREAK = "<br/>";

    // Sanitization
    private static final String ID_SANITIZATION_PATTERN = "[^a-zA-Z0-9_]";
    private static final String ID_PREFIX = "n_";

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
        log.debug("Generating Mermaid diagram for {}", graph.metadata().ebdCode());

        RenderOrder order = RenderOrder.of(graph);
        StringBuilder sb = new StringBuilder();
        appendHeader(sb, graph);

        for (GraphNode node : order.nodes()) {
            if (node instanceof AnnotationNode annotation) {
                if (config.annotationClusters()) {
                    appendAnnotationComment(sb, annotation);
                }
                continue;
            }
            sb.append(INDENT).append(nodeToMermaid(node, graph, config.labelWrapWidth())).append("\n");
        }
        for (GraphEdge edge : order.edges()) {
            if (edge.kind() == EdgeKind.START || edge.kind() == EdgeKind.TRANSITION) {
                sb.append(INDENT).append(sanitizeId(edge.sourceId())).append(" --> ")
                    .append(sanitizeId(edge.targetId())).append("\n");
            } else if (edge.kind() == EdgeKind.OUTCOME) {
                sb.append(INDENT).append(sanitizeId(edge.sourceId()))
                    .append(" -->|").append(escape(edge.outcome().toUpperCase(Locale.ROOT))).append("| ")
                    .append(sanitizeId(edge.targetId())).append("\n");
            }
        }

        appendFooter(sb);
        return new GeneratedDiagram(graph.metadata().ebdCode(), sb.toString(), FILE_EXTENSION);
    }

    // ==================== Helper Methods ====================

    private void appendHeader(StringBuilder sb, EbdGraph graph) {
        String title = graph.metadata().ebdName() != null ? graph.metadata().ebdName() : graph.metadata().ebdCode();
        sb.append(MARKDOWN_HEADER_PREFIX).append(title).append(MARKDOWN_NEWLINE).append(MARKDOWN_NEWLINE);
        sb.append(CODE_BLOCK_START);
        sb.append(FLOWCHART_TD);
    }

    private void appendFooter(StringBuilder sb) {
        sb.append(CODE_BLOCK_END);
    }

    private String nodeToMermaid(GraphNode node, EbdGraph graph, int width) {
        String id = sanitizeId(node.id());
        return switch (node.kind()) {
            case START -> id + "([\"" + escape(graph.metadata().ebdCode()) + "\"])";
            case DECISION, TRANSITION -> {
                StepNode step = (StepNode) node;
                yield id + "[\"" + step.stepNumber().value() + ": " + wrap(step.description(), width) + "\"]";
            }
            case OUTCOME -> {
                OutcomeNode outcome = (OutcomeNode) node;
                yield id + "([\"" + resultLabel(outcome.endCode(), outcome.label(), width) + "\"])";
            }
            case TRANSITIONAL_OUTCOME -> {
                TransitionalOutcomeNode outcome = (TransitionalOutcomeNode) node;
                yield id + "([\"" + resultLabel(outcome.endCode(), outcome.label(), width) + "\"])";
            }
            case END -> id + "([\"" + EndNode.ID + "\"])";
            case EMPTY -> id + "([\"" + resultLabel(graph.metadata().ebdCode(), graph.metadata().remark(), width) + "\"])";
            case ANNOTATION -> throw new IllegalStateException("Annotations are rendered as comments");
        };
    }

    private String resultLabel(String code, String text, int width) {
        if (text == null || text.isBlank()) {
            return escape(code);
        }
        return escape(code) + LINE_BREAK + wrap(text, width);
    }

    private void appendAnnotationComment(StringBuilder sb, AnnotationNode annotation) {
        String steps = annotation.coveredSteps().stream()
            .map(StepNumber::value)
            .collect(Collectors.joining(", "));
        sb.append(INDENT).append("%% ").append(annotation.id())
            .append(" (steps ").append(steps).append("): ")
            .append(annotation.text().replace("\n", " ").replace("\r", " "))
            .append("\n");
    }

    private String wrap(String text, int width) {
        return escape(LineBreaks.addLineBreaks(text, width, "\n")).replace("\n", LINE_BREAK);
    }

    private String sanitizeId(String id) {
        return ID_PREFIX + id.replaceAll(ID_SANITIZATION_PATTERN, "_");
    }

    private String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("\"", "'").replace("\r", "");
    }
}
