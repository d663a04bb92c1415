package com.ebdgraph.core.graph;

import java.util.List;
import java.util.Objects;

/**
 * Terminal result of the decision process. Shared by every step that ends with the same
 * end code and label.
 *
 * @param id node identifier, derived from end code and label
 * @param endCode result code, e.g. "A01"
 * @param label optional outcome label
 * @param ebdReferences codes of other EBDs named in the label (e.g. "E_0621"), in order of appearance
 */
public record OutcomeNode(
    String id,
    String endCode,
    String label,
    List<String> ebdReferences
) implements GraphNode {

    /**
     * Compact constructor with validation.
     */
    public OutcomeNode {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(endCode, "endCode must not be null");
        ebdReferences = ebdReferences == null ? List.of() : List.copyOf(ebdReferences);
    }

    /**
     * Creates an outcome node without EBD references.
     */
    public OutcomeNode(String id, String endCode, String label) {
        this(id, endCode, label, List.of());
    }

    @Override
    public NodeKind kind() {
        return NodeKind.OUTCOME;
    }
}
