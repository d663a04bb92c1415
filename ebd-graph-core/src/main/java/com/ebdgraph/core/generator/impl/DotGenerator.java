package com.ebdgraph.core.generator.impl;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ebdgraph.core.generator.DiagramGenerator;
import com.ebdgraph.core.generator.DiagramTheme;
import com.ebdgraph.core.generator.GeneratedDiagram;
import com.ebdgraph.core.generator.GeneratorConfig;
import com.ebdgraph.core.generator.NodeStyle;
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
import com.ebdgraph.core.table.EbdTableMetadata;
import com.ebdgraph.core.table.StepNumber;
import com.ebdgraph.core.util.EbdReferences;
import com.ebdgraph.core.util.LineBreaks;
import com.ebdgraph.core.validation.GraphValidator;

/**
 * Generates Graphviz DOT code from EBD graphs.
 *
 * <p>This is the primary dialect. Labels are HTML-like ({@code label=<...>}), word-wrapped and
 * joined with left-aligned line breaks. Node styling comes from the {@link DiagramTheme}.
 *
 * <h2>Layout</h2>
 * <ul>
 *   <li><b>Header:</b> chapter and section of the source document, placed at the top</li>
 *   <li><b>Nodes:</b> start, steps by step number, results, annotations</li>
 *   <li><b>Edges:</b> decision edges labelled with the upper-cased outcome code, transitions unlabelled</li>
 *   <li><b>Annotations:</b> dashed edge to the anchor, pinned to the anchor's rank</li>
 * </ul>
 *
 * <p>With {@link GeneratorConfig#annotationClusters()} every annotation and the steps it covers
 * are grouped in a dashed cluster. A step covered by more than one annotation joins the first.
 *
 * <p>With {@link GeneratorConfig#ebdLinkTemplate()} every "EBD E_xxxx" in an outcome label is
 * styled as a link, and an outcome referring to exactly one other EBD links to it. A table
 * without rows renders as a single node showing the table remark.
 *
 * @see <a href="https://graphviz.org/doc/info/lang.html">DOT Language</a>
 */
public class DotGenerator implements DiagramGenerator {

    private static final Logger log = LoggerFactory.getLogger(DotGenerator.class);

    private static final String GENERATOR_ID = "dot";
    private static final String GENERATOR_DISPLAY_NAME = "Graphviz DOT Generator";
    private static final String FILE_EXTENSION = "dot";

    private static final String INDENT = "    ";
    private static final String LINE_BREAK = "<BR align=\"left\"/>";
    private static final String CENTERED_LINE_BREAK = "<BR align=\"center\"/>";
    private static final String LINK_COLOR = "#0066cc";
    private static final char NO_BREAK_SPACE = '\u00a0';
    private static final Pattern UNBREAKABLE_REFERENCE = Pattern.compile("EBD" + NO_BREAK_SPACE + "(E_\\d{4})");
    private static final String NODE_MARGIN = "margin=\"0.2,0.12\"";

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
        log.debug("Generating DOT diagram for {}", graph.metadata().ebdCode());

        RenderOrder order = RenderOrder.of(graph);
        StringBuilder sb = new StringBuilder();
        sb.append("digraph D {\n");
        appendGraphAttributes(sb, graph.metadata());

        for (GraphNode node : order.nodes()) {
            sb.append(INDENT).append(nodeToDot(node, graph.metadata(), config)).append("\n");
        }
        sb.append("\n");
        if (config.annotationClusters()) {
            appendClusters(sb, graph.annotationNodes(), config.theme());
        }
        for (AnnotationNode annotation : graph.annotationNodes()) {
            sb.append(INDENT).append("{rank=same; ")
                .append(quote(annotation.id())).append("; ")
                .append(quote(annotation.anchor().value())).append(";}\n");
        }
        sb.append("\n");
        for (GraphEdge edge : order.edges()) {
            sb.append(INDENT).append(edgeToDot(edge, config.theme())).append("\n");
        }

        sb.append("\n").append(INDENT).append("bgcolor=\"transparent\";\n");
        sb.append(INDENT).append("fontname=\"").append(config.theme().fontName()).append("\";\n");
        sb.append("}\n");

        return new GeneratedDiagram(graph.metadata().ebdCode(), sb.toString(), FILE_EXTENSION);
    }

    // ==================== Graph attributes ====================

    private void appendGraphAttributes(StringBuilder sb, EbdTableMetadata metadata) {
        sb.append(INDENT).append("labelloc=\"t\";\n");
        sb.append(INDENT).append("label=<").append(header(metadata)).append(">;\n");
        sb.append(INDENT).append("ratio=\"compress\";\n");
        sb.append(INDENT).append("pack=true;\n");
        sb.append(INDENT).append("rankdir=TB;\n");
        sb.append(INDENT).append("packmode=\"array\";\n");
        sb.append(INDENT).append("size=\"20,20\";\n");
        sb.append(INDENT).append("fontsize=12;\n");
        sb.append(INDENT).append("pad=0.25;\n");
    }

    private String header(EbdTableMetadata metadata) {
        StringBuilder header = new StringBuilder();
        if (metadata.chapter() != null) {
            header.append("<B><FONT POINT-SIZE=\"18\">").append(LineBreaks.escapeHtml(metadata.chapter()))
                .append("</FONT></B>").append(LINE_BREAK).append("<BR/>");
        }
        if (metadata.section() != null) {
            header.append("<B><FONT POINT-SIZE=\"16\">").append(LineBreaks.escapeHtml(metadata.section()))
                .append("</FONT></B>").append(LINE_BREAK).append("<BR/>");
        }
        if (header.length() == 0) {
            header.append("<B>").append(LineBreaks.escapeHtml(metadata.ebdCode())).append("</B>");
        }
        return header.toString();
    }

    // ==================== Nodes ====================

    private String nodeToDot(GraphNode node, EbdTableMetadata metadata, GeneratorConfig config) {
        String label = switch (node.kind()) {
            case START -> startLabel(metadata);
            case DECISION, TRANSITION -> stepLabel((StepNode) node, config.labelWrapWidth());
            case OUTCOME -> {
                OutcomeNode outcome = (OutcomeNode) node;
                yield outcomeLabel(outcome.endCode(), outcome.label(), config);
            }
            case TRANSITIONAL_OUTCOME -> {
                TransitionalOutcomeNode outcome = (TransitionalOutcomeNode) node;
                yield outcomeLabel(outcome.endCode(), outcome.label(), config);
            }
            case END -> EndNode.ID;
            case EMPTY -> emptyLabel(metadata);
            case ANNOTATION -> annotationLabel((AnnotationNode) node, config.annotationWrapWidth());
        };
        NodeStyle style = config.theme().styleFor(node.kind());
        String href = href(node, config);
        return quote(node.id())
            + " [" + NODE_MARGIN
            + ", shape=" + style.shape()
            + ", style=" + styleValue(style.style())
            + ", penwidth=0.0"
            + ", fillcolor=\"" + style.fillColor() + "\""
            + (href == null ? "" : ", href=\"" + href + "\"")
            + ", label=<" + label + ">"
            + ", fontname=\"" + config.theme().fontName() + "\"];";
    }

    /**
     * Link target of an outcome referring to exactly one other EBD.
     */
    private String href(GraphNode node, GeneratorConfig config) {
        if (!config.linksEbdReferences()) {
            return null;
        }
        List<String> references = switch (node.kind()) {
            case OUTCOME -> ((OutcomeNode) node).ebdReferences();
            case TRANSITIONAL_OUTCOME -> ((TransitionalOutcomeNode) node).ebdReferences();
            default -> List.of();
        };
        if (references.size() != 1) {
            return null;
        }
        return LineBreaks.escapeHtml(EbdReferences.link(config.ebdLinkTemplate(), references.get(0)))
            .replace("\"", "&quot;");
    }

    private String startLabel(EbdTableMetadata metadata) {
        StringBuilder label = new StringBuilder();
        label.append("<B>").append(LineBreaks.escapeHtml(metadata.ebdCode())).append("</B>").append(LINE_BREAK);
        if (metadata.role() != null) {
            label.append("<FONT>Prüfende Rolle: <B>").append(LineBreaks.escapeHtml(metadata.role()))
                .append("</B></FONT><BR align=\"center\"/>");
        }
        return label.toString();
    }

    private String emptyLabel(EbdTableMetadata metadata) {
        StringBuilder label = new StringBuilder();
        label.append("<B>").append(LineBreaks.escapeHtml(metadata.ebdCode())).append("</B>").append(CENTERED_LINE_BREAK);
        if (metadata.remark() != null && !metadata.remark().isBlank()) {
            label.append("<FONT>").append(LineBreaks.escapeHtml(metadata.remark())).append("</FONT>")
                .append(CENTERED_LINE_BREAK);
        }
        return label.toString();
    }

    private String stepLabel(StepNode node, int width) {
        StringBuilder label = new StringBuilder();
        label.append("<B>").append(node.stepNumber().value()).append(": </B>")
            .append(formatText(node.description(), width)).append(LINE_BREAK);
        if (node.note() != null && !node.note().isBlank()) {
            label.append("<FONT><I>").append(formatText(node.note(), width)).append("</I></FONT>").append(LINE_BREAK);
        }
        return label.toString();
    }

    private String outcomeLabel(String endCode, String text, GeneratorConfig config) {
        StringBuilder label = new StringBuilder();
        label.append("<B>").append(LineBreaks.escapeHtml(endCode)).append("</B>")
            .append(LINE_BREAK).append(LINE_BREAK);
        if (text != null) {
            String formatted = config.linksEbdReferences()
                ? formatLinkedText(text, config.labelWrapWidth())
                : formatText(text, config.labelWrapWidth());
            label.append("<FONT>").append(formatted).append(LINE_BREAK).append("</FONT>");
        }
        return label.toString();
    }

    /**
     * Formats a label keeping each "EBD E_xxxx" on one line and styling it as a link.
     */
    private String formatLinkedText(String text, int width) {
        String unbreakable = EbdReferences.REFERENCE.matcher(text).replaceAll("EBD" + NO_BREAK_SPACE + "$1");
        Matcher matcher = UNBREAKABLE_REFERENCE.matcher(formatText(unbreakable, width));
        StringBuilder linked = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(linked, Matcher.quoteReplacement(
                "<FONT COLOR=\"" + LINK_COLOR + "\"><U>EBD " + matcher.group(1) + "</U></FONT>"));
        }
        matcher.appendTail(linked);
        return linked.toString();
    }

    private String annotationLabel(AnnotationNode node, int width) {
        return "<FONT><I>" + formatText(node.text(), width) + "</I></FONT>" + LINE_BREAK;
    }

    private String formatText(String text, int width) {
        String wrapped = LineBreaks.addLineBreaks(text, width, "\n");
        return LineBreaks.escapeHtml(wrapped).replace("\n", LINE_BREAK);
    }

    // ==================== Clusters ====================

    private void appendClusters(StringBuilder sb, List<AnnotationNode> annotations, DiagramTheme theme) {
        Set<StepNumber> clustered = new HashSet<>();
        for (AnnotationNode annotation : annotations) {
            sb.append(INDENT).append("subgraph ").append(quote("cluster_" + annotation.id())).append(" {\n");
            String inner = INDENT + INDENT;
            sb.append(inner).append("style=\"dashed,rounded\";\n");
            sb.append(inner).append("bgcolor=\"").append(theme.clusterFillColor()).append("\";\n");
            sb.append(inner).append("color=\"").append(theme.clusterColor()).append("\";\n");
            sb.append(inner).append("penwidth=1.5;\n");
            sb.append(inner).append("margin=16;\n");
            sb.append(inner).append(quote(annotation.id())).append(";\n");
            for (StepNumber step : annotation.coveredSteps()) {
                if (clustered.add(step)) {
                    sb.append(inner).append(quote(step.value())).append(";\n");
                }
            }
            sb.append(INDENT).append("}\n");
        }
    }

    // ==================== Edges ====================

    private String edgeToDot(GraphEdge edge, DiagramTheme theme) {
        String head = quote(edge.sourceId()) + " -> " + quote(edge.targetId());
        if (edge.kind() == EdgeKind.ANNOTATES) {
            return head + " [style=dashed, arrowhead=none, color=\"" + theme.annotationEdgeColor() + "\"];";
        }
        if (edge.kind() == EdgeKind.START || edge.kind() == EdgeKind.TRANSITION) {
            return head + " [color=\"" + theme.edgeColor() + "\"];";
        }
        return head + " [label=<<B>" + LineBreaks.escapeHtml(edge.outcome().toUpperCase(Locale.ROOT)) + "</B>>"
            + ", color=\"" + theme.edgeColor() + "\""
            + ", fontname=\"" + theme.fontName() + "\"];";
    }

    private String styleValue(String style) {
        return style.contains(",") ? "\"" + style + "\"" : style;
    }

    private String quote(String id) {
        return "\"" + id.replace("\"", "\\\"") + "\"";
    }
}
