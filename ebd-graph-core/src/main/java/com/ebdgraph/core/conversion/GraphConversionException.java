package com.ebdgraph.core.conversion;

/**
 * Base class of all errors raised while turning a table into a graph or gating a graph for
 * rendering. Callers that only need to reject the input can catch this type.
 */
public class GraphConversionException extends RuntimeException {

    public GraphConversionException(String message) {
        super(message);
    }
}
