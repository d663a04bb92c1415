package com.ebdgraph.core.table;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * An EBD table: metadata, check steps in document order and multi-step instructions.
 *
 * <p>Construction enforces the structural invariants (unique step numbers, one instruction per
 * anchor step). Cross references and vocabulary are checked separately by {@link TableValidator}
 * so that a producer's mistakes can be reported instead of thrown.
 *
 * <p>A table without rows is valid: some EBD sections publish no decision tree, only a remark
 * such as "Es ist das EBD E_0527 zu nutzen." kept in {@link EbdTableMetadata#remark()}.
 *
 * @param metadata table metadata
 * @param rows check steps in document order
 * @param multiStepInstructions instructions spanning several steps
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EbdTable(
    @JsonProperty("metadata") EbdTableMetadata metadata,
    @JsonProperty("rows") List<TableRow> rows,
    @JsonProperty("multiStepInstructions") List<MultiStepInstruction> multiStepInstructions
) {
    /**
     * Compact constructor with validation.
     */
    public EbdTable {
        Objects.requireNonNull(metadata, "metadata must not be null");
        rows = rows == null ? List.of() : List.copyOf(rows);
        multiStepInstructions = multiStepInstructions == null ? List.of() : List.copyOf(multiStepInstructions);

        Set<StepNumber> stepNumbers = new HashSet<>();
        for (TableRow row : rows) {
            if (!stepNumbers.add(row.stepNumber())) {
                throw new IllegalArgumentException("Duplicate step number: " + row.stepNumber());
            }
        }
        Set<StepNumber> anchors = new HashSet<>();
        for (MultiStepInstruction instruction : multiStepInstructions) {
            if (!anchors.add(instruction.firstStep())) {
                throw new IllegalArgumentException(
                    "More than one multi-step instruction starts at step " + instruction.firstStep());
            }
        }
    }

    /**
     * Creates a table without multi-step instructions.
     *
     * @param metadata table metadata
     * @param rows rows in document order
     * @return new table
     */
    public static EbdTable of(EbdTableMetadata metadata, List<TableRow> rows) {
        return new EbdTable(metadata, rows, List.of());
    }

    /**
     * Creates a table without rows.
     *
     * @param metadata table metadata, usually with a remark
     * @return new empty table
     */
    public static EbdTable empty(EbdTableMetadata metadata) {
        return new EbdTable(metadata, List.of(), List.of());
    }

    /**
     * Returns whether the table has no rows.
     *
     * @return true for a section without decision tree
     */
    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * Finds the row with the given step number.
     *
     * @param stepNumber step to look up
     * @return row, or empty if the table has no such step
     */
    public Optional<TableRow> row(StepNumber stepNumber) {
        return rows.stream()
            .filter(row -> row.stepNumber().equals(stepNumber))
            .findFirst();
    }
}
