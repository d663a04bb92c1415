package com.ebdgraph.core.graph;

import com.ebdgraph.core.table.StepNumber;

import java.util.List;
import java.util.Objects;

/**
 * A check step. Its outgoing outcome edges must cover exactly {@code outcomeCodes}.
 *
 * @param stepNumber step number of the source row
 * @param description check description of the source row
 * @param note optional note of the source row
 * @param outcomeCodes outcome codes of the source row, in document order
 */
public record DecisionNode(
    StepNumber stepNumber,
    String description,
    String note,
    List<String> outcomeCodes
) implements StepNode {

    /**
     * Compact constructor with validation.
     */
    public DecisionNode {
        Objects.requireNonNull(stepNumber, "stepNumber must not be null");
        Objects.requireNonNull(description, "description must not be null");
        Objects.requireNonNull(outcomeCodes, "outcomeCodes must not be null");
        outcomeCodes = List.copyOf(outcomeCodes);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.DECISION;
    }
}
