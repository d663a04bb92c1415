package com.ebdgraph.core.graph;

import com.ebdgraph.core.table.StepNumber;

import java.util.List;
import java.util.Objects;

/**
 * A multi-step instruction, attached to the step node of its first step.
 *
 * @param anchor first step the instruction applies to
 * @param text instruction text
 * @param coveredSteps all steps the instruction applies to, ascending, starting with the anchor
 */
public record AnnotationNode(
    StepNumber anchor,
    String text,
    List<StepNumber> coveredSteps
) implements GraphNode {

    public static final String ID_PREFIX = "msi";

    /**
     * Compact constructor with validation.
     */
    public AnnotationNode {
        Objects.requireNonNull(anchor, "anchor must not be null");
        Objects.requireNonNull(text, "text must not be null");
        coveredSteps = coveredSteps == null ? List.of(anchor) : List.copyOf(coveredSteps);
    }

    /**
     * Returns the identifier of the annotation anchored at the given step.
     *
     * @param anchor anchor step
     * @return identifier like {@code msi_100}
     */
    public static String idFor(StepNumber anchor) {
        return ID_PREFIX + "_" + anchor.value();
    }

    @Override
    public String id() {
        return idFor(anchor);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ANNOTATION;
    }
}
