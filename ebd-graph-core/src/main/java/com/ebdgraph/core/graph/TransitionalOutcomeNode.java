package com.ebdgraph.core.graph;

import com.ebdgraph.core.table.StepNumber;

import java.util.List;
import java.util.Objects;

/**
 * A result code that is reported on the way: the process continues at {@code nextStep}.
 * Shared by every step yielding the same code, label and next step.
 *
 * @param id node identifier, {@code <endCode>_<nextStep>} plus a label digest where needed
 * @param endCode result code, e.g. "A90"
 * @param label optional outcome label
 * @param nextStep step the process continues at
 * @param ebdReferences codes of other EBDs named in the label, in order of appearance
 */
public record TransitionalOutcomeNode(
    String id,
    String endCode,
    String label,
    StepNumber nextStep,
    List<String> ebdReferences
) implements GraphNode {

    /**
     * Compact constructor with validation.
     */
    public TransitionalOutcomeNode {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(endCode, "endCode must not be null");
        Objects.requireNonNull(nextStep, "nextStep must not be null");
        ebdReferences = ebdReferences == null ? List.of() : List.copyOf(ebdReferences);
    }

    /**
     * Returns the base identifier of a transitional outcome.
     *
     * @param endCode result code
     * @param nextStep step the process continues at
     * @return identifier like {@code A90_20}
     */
    public static String idFor(String endCode, StepNumber nextStep) {
        return endCode + "_" + nextStep.value();
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TRANSITIONAL_OUTCOME;
    }
}
