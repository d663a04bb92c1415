package com.ebdgraph.core.validation;

import java.util.List;

/**
 * Raised when the outcome edges of a decision node do not match the outcome codes of its source row.
 */
public class MalformedOutcomeSetException extends GraphValidationException {

    public MalformedOutcomeSetException(List<Finding> findings) {
        super("Outcome edges do not match their source rows", findings);
    }
}
