package com.ebdgraph.core.graph;

import com.ebdgraph.core.table.StepNumber;

import java.util.Objects;

/**
 * A step without decision. It has exactly one outgoing {@link EdgeKind#TRANSITION} edge.
 *
 * @param stepNumber step number of the source row
 * @param description what happens in this step
 * @param note optional note of the source row
 */
public record TransitionNode(
    StepNumber stepNumber,
    String description,
    String note
) implements StepNode {

    /**
     * Compact constructor with validation.
     */
    public TransitionNode {
        Objects.requireNonNull(stepNumber, "stepNumber must not be null");
        Objects.requireNonNull(description, "description must not be null");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TRANSITION;
    }
}
