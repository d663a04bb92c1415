package com.ebdgraph.core.generator;

import com.ebdgraph.core.graph.NodeKind;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable styling table handed to generators: node kind to visual attributes, plus edge and
 * cluster colors.
 *
 * @param nodeStyles style per node kind; must cover every kind
 * @param edgeColor color of start and outcome edges
 * @param annotationEdgeColor muted color of annotation edges
 * @param clusterColor border color of annotation clusters
 * @param clusterFillColor background of annotation clusters
 * @param fontName font for all labels
 */
public record DiagramTheme(
    Map<NodeKind, NodeStyle> nodeStyles,
    String edgeColor,
    String annotationEdgeColor,
    String clusterColor,
    String clusterFillColor,
    String fontName
) {
    /**
     * Compact constructor with validation.
     */
    public DiagramTheme {
        Objects.requireNonNull(nodeStyles, "nodeStyles must not be null");
        for (NodeKind kind : NodeKind.values()) {
            if (!nodeStyles.containsKey(kind)) {
                throw new IllegalArgumentException("No style for node kind " + kind);
            }
        }
        nodeStyles = Map.copyOf(nodeStyles);
        Objects.requireNonNull(edgeColor, "edgeColor must not be null");
        Objects.requireNonNull(annotationEdgeColor, "annotationEdgeColor must not be null");
        Objects.requireNonNull(clusterColor, "clusterColor must not be null");
        Objects.requireNonNull(clusterFillColor, "clusterFillColor must not be null");
        Objects.requireNonNull(fontName, "fontName must not be null");
    }

    /**
     * Creates the default theme: blue-grey boxes, outcomes in grey, annotations as light blue notes.
     *
     * @return default theme
     */
    public static DiagramTheme defaults() {
        Map<NodeKind, NodeStyle> styles = new EnumMap<>(NodeKind.class);
        styles.put(NodeKind.START, new NodeStyle("box", "filled,rounded", "#8ba2d7"));
        styles.put(NodeKind.DECISION, new NodeStyle("box", "filled,rounded", "#c2cee9"));
        styles.put(NodeKind.TRANSITION, new NodeStyle("box", "filled,rounded", "#c2cee9"));
        styles.put(NodeKind.OUTCOME, new NodeStyle("box", "filled,rounded", "#c4cac1"));
        styles.put(NodeKind.TRANSITIONAL_OUTCOME, new NodeStyle("box", "filled,rounded", "#c4cac1"));
        styles.put(NodeKind.END, new NodeStyle("box", "filled,rounded", "#8ba2d7"));
        styles.put(NodeKind.EMPTY, new NodeStyle("box", "filled,rounded", "#7a8da1"));
        styles.put(NodeKind.ANNOTATION, new NodeStyle("note", "filled", "#e6f3ff"));
        return new DiagramTheme(styles, "#88a0d6", "#888888", "#888888", "#f0f7ff", "Roboto, sans-serif");
    }

    /**
     * Returns the style of a node kind.
     *
     * @param kind node kind
     * @return style
     */
    public NodeStyle styleFor(NodeKind kind) {
        return nodeStyles.get(kind);
    }

    /**
     * Returns a copy of this theme using another font.
     *
     * @param font font name
     * @return new theme
     */
    public DiagramTheme withFontName(String font) {
        return new DiagramTheme(nodeStyles, edgeColor, annotationEdgeColor, clusterColor, clusterFillColor, font);
    }
}
