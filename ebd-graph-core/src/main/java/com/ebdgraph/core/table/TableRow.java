package com.ebdgraph.core.table;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One step of an EBD table.
 *
 * <p>A step is either a check with one result per outcome code, or a transition: a step without a
 * decision that always continues at {@code next} (e.g. "Vollständige Adressprüfung" followed by
 * the evaluation of its hits). A transition row has no outcomes.
 *
 * @param stepNumber step identifier ("Nr")
 * @param description check performed ("Prüfschritt"), usually phrased as a question
 * @param outcomes outcome code ("ja", "nein", ...) to result, in document order; empty for transitions
 * @param note optional free text shown alongside the step
 * @param next step a transition continues at, or null for a check
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TableRow(
    @JsonProperty("stepNumber") StepNumber stepNumber,
    @JsonProperty("description") String description,
    @JsonProperty("outcomes") Map<String, StepResult> outcomes,
    @JsonProperty("note") String note,
    @JsonProperty("next") StepNumber next
) {
    /**
     * Compact constructor with validation.
     */
    public TableRow {
        Objects.requireNonNull(stepNumber, "stepNumber must not be null");
        Objects.requireNonNull(description, "description must not be null");
        if (outcomes == null) {
            outcomes = Map.of();
        }
        if (next == null && outcomes.isEmpty()) {
            throw new IllegalArgumentException("Step " + stepNumber + " has no outcomes");
        }
        if (next != null && !outcomes.isEmpty()) {
            throw new IllegalArgumentException("Transition step " + stepNumber + " must not have outcomes");
        }
        outcomes.forEach((code, result) -> {
            Objects.requireNonNull(code, "outcome code must not be null");
            Objects.requireNonNull(result, "result for outcome '" + code + "' must not be null");
        });
        // keep document order
        outcomes = Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
        if (note != null && note.isBlank()) {
            note = null;
        }
    }

    /**
     * Creates a check row without a note.
     *
     * @param stepNumber step identifier
     * @param description check description
     * @param outcomes outcome code to result
     * @return new row
     */
    public static TableRow of(String stepNumber, String description, Map<String, StepResult> outcomes) {
        return new TableRow(StepNumber.of(stepNumber), description, outcomes, null, null);
    }

    /**
     * Creates a transition row.
     *
     * @param stepNumber step identifier
     * @param description what happens in this step
     * @param next step to continue at
     * @param note optional note
     * @return new row
     */
    public static TableRow transition(String stepNumber, String description, String next, String note) {
        return new TableRow(StepNumber.of(stepNumber), description, Map.of(), note, StepNumber.of(next));
    }

    /**
     * Returns whether this row is a transition without a decision.
     *
     * @return true if the row continues at {@link #next()} unconditionally
     */
    public boolean isTransition() {
        return next != null;
    }
}
