package com.ebdgraph.core.validation;

import com.ebdgraph.core.conversion.GraphConversionException;

import java.util.List;

/**
 * Raised when a graph with fatal findings is about to be rendered.
 */
public class GraphValidationException extends GraphConversionException {

    private final List<Finding> findings;

    public GraphValidationException(String message, List<Finding> findings) {
        super(message + ": " + findings);
        this.findings = List.copyOf(findings);
    }

    /**
     * Returns the fatal findings that blocked rendering.
     *
     * @return fatal findings
     */
    public List<Finding> getFindings() {
        return findings;
    }
}
