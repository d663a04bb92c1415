package com.ebdgraph.core.conversion;

import com.ebdgraph.core.table.StepNumber;

/**
 * Raised when an outcome or a transition step continues at a step that does not exist in the table.
 */
public class UnresolvedReferenceException extends GraphConversionException {

    private final StepNumber sourceStep;
    private final String outcome;
    private final StepNumber missingStep;

    /**
     * Creates the exception.
     *
     * @param sourceStep step whose outcome holds the reference
     * @param outcome outcome code of the reference
     * @param missingStep referenced step that does not exist
     */
    public UnresolvedReferenceException(StepNumber sourceStep, String outcome, StepNumber missingStep) {
        super("Step %s refers to unknown step %s for outcome '%s'".formatted(sourceStep, missingStep, outcome));
        this.sourceStep = sourceStep;
        this.outcome = outcome;
        this.missingStep = missingStep;
    }

    /**
     * Creates the exception for a transition step.
     *
     * @param sourceStep transition step
     * @param missingStep referenced step that does not exist
     */
    public UnresolvedReferenceException(StepNumber sourceStep, StepNumber missingStep) {
        super("Transition step %s refers to unknown step %s".formatted(sourceStep, missingStep));
        this.sourceStep = sourceStep;
        this.outcome = null;
        this.missingStep = missingStep;
    }

    public StepNumber getSourceStep() {
        return sourceStep;
    }

    /**
     * Returns the outcome code holding the reference.
     *
     * @return outcome code, or null for a transition step
     */
    public String getOutcome() {
        return outcome;
    }

    public StepNumber getMissingStep() {
        return missingStep;
    }
}
