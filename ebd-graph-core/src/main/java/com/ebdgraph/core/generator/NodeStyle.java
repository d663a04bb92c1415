package com.ebdgraph.core.generator;

import java.util.Objects;

/**
 * Visual attributes of one node kind.
 *
 * @param shape node shape, e.g. "box" or "note"
 * @param style style list, e.g. "filled,rounded"
 * @param fillColor fill color as hex string
 */
public record NodeStyle(
    String shape,
    String style,
    String fillColor
) {
    /**
     * Compact constructor with validation.
     */
    public NodeStyle {
        Objects.requireNonNull(shape, "shape must not be null");
        Objects.requireNonNull(style, "style must not be null");
        Objects.requireNonNull(fillColor, "fillColor must not be null");
    }
}
