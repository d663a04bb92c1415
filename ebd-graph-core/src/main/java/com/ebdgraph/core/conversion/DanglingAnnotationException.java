package com.ebdgraph.core.conversion;

import com.ebdgraph.core.table.StepNumber;

/**
 * Raised when a multi-step instruction is anchored at a step that does not exist in the table.
 */
public class DanglingAnnotationException extends GraphConversionException {

    private final StepNumber anchor;

    public DanglingAnnotationException(StepNumber anchor) {
        super("Multi-step instruction is anchored at unknown step " + anchor);
        this.anchor = anchor;
    }

    public StepNumber getAnchor() {
        return anchor;
    }
}
