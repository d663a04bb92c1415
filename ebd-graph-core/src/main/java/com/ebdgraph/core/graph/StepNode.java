package com.ebdgraph.core.graph;

import com.ebdgraph.core.table.StepNumber;

/**
 * A node created from a table row. Its id is the step number.
 */
public sealed interface StepNode extends GraphNode permits DecisionNode, TransitionNode {

    StepNumber stepNumber();

    String description();

    /**
     * Returns the note of the source row.
     *
     * @return note, or null
     */
    String note();

    @Override
    default String id() {
        return stepNumber().value();
    }
}
