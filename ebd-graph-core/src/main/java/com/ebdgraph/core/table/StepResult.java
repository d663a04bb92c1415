package com.ebdgraph.core.table;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;
import java.util.Objects;

/**
 * What happens after a check step yields a given outcome code.
 *
 * <p>Exactly one of five forms. Consumers dispatch through {@link Visitor} so that adding a form
 * breaks every consumer at compile time instead of falling through a lookup.
 *
 * <p>In JSON and YAML tables the form is selected by the {@code type} property:
 * <pre>{@code
 * ja:   { type: continue, step: "2" }
 * nein: { type: terminal, endCode: "A01", label: "Cluster: Ablehnung" }
 * ja:   { type: transitional, endCode: "A90", step: "20" }
 * }</pre>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = StepResult.ContinueAt.class, name = "continue"),
    @JsonSubTypes.Type(value = StepResult.Terminal.class, name = "terminal"),
    @JsonSubTypes.Type(value = StepResult.TransitionalOutcome.class, name = "transitional"),
    @JsonSubTypes.Type(value = StepResult.EndOfProcess.class, name = "end"),
    @JsonSubTypes.Type(value = StepResult.MultiResult.class, name = "multi")
})
public sealed interface StepResult {

    /**
     * Applies the visitor matching this form.
     *
     * @param visitor visitor to apply
     * @param <R> visitor result type
     * @return visitor result
     */
    <R> R accept(Visitor<R> visitor);

    /**
     * Returns the single-target results this result is made of: the result itself, or the members
     * of a {@link MultiResult}.
     *
     * @return non-empty list of results, none of which is a {@link MultiResult}
     */
    List<StepResult> leaves();

    /**
     * Exhaustive dispatch over all result forms.
     *
     * @param <R> result type
     */
    interface Visitor<R> {
        R visitContinueAt(ContinueAt result);

        R visitTerminal(Terminal result);

        R visitTransitionalOutcome(TransitionalOutcome result);

        R visitEndOfProcess(EndOfProcess result);

        R visitMultiResult(MultiResult result);
    }

    /**
     * Continue at another step. The target may be lower than or equal to the current step.
     *
     * @param step target step number
     */
    record ContinueAt(@JsonProperty("step") StepNumber step) implements StepResult {
        public ContinueAt {
            Objects.requireNonNull(step, "step must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitContinueAt(this);
        }

        @Override
        public List<StepResult> leaves() {
            return List.of(this);
        }
    }

    /**
     * Terminal result with an end code (e.g. {@code A01}) and an optional outcome label.
     *
     * @param endCode result code
     * @param label free-text label, or null
     */
    record Terminal(
        @JsonProperty("endCode") String endCode,
        @JsonProperty("label") String label
    ) implements StepResult {
        public Terminal {
            Objects.requireNonNull(endCode, "endCode must not be null");
            if (label != null && label.isBlank()) {
                label = null;
            }
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTerminal(this);
        }

        @Override
        public List<StepResult> leaves() {
            return List.of(this);
        }
    }

    /**
     * A result code that does not end the process: the check continues at {@code step}.
     *
     * @param endCode result code
     * @param label free-text label, or null
     * @param step step the process continues at
     */
    record TransitionalOutcome(
        @JsonProperty("endCode") String endCode,
        @JsonProperty("label") String label,
        @JsonProperty("step") StepNumber step
    ) implements StepResult {
        public TransitionalOutcome {
            Objects.requireNonNull(endCode, "endCode must not be null");
            Objects.requireNonNull(step, "step must not be null");
            if (label != null && label.isBlank()) {
                label = null;
            }
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTransitionalOutcome(this);
        }

        @Override
        public List<StepResult> leaves() {
            return List.of(this);
        }
    }

    /**
     * The decision process ends without a result code ("Ende").
     */
    record EndOfProcess() implements StepResult {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitEndOfProcess(this);
        }

        @Override
        public List<StepResult> leaves() {
            return List.of(this);
        }
    }

    /**
     * Several simultaneous results for one outcome code, e.g. for checks phrased as
     * "any of the following applies".
     *
     * @param results at least two results, none of them a multi-result itself
     */
    record MultiResult(@JsonProperty("results") List<StepResult> results) implements StepResult {
        public MultiResult {
            Objects.requireNonNull(results, "results must not be null");
            if (results.size() < 2) {
                throw new IllegalArgumentException("A multi-result needs at least two results, got " + results.size());
            }
            for (StepResult result : results) {
                Objects.requireNonNull(result, "results must not contain null");
                if (result instanceof MultiResult) {
                    throw new IllegalArgumentException("Multi-results must not be nested");
                }
            }
            results = List.copyOf(results);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMultiResult(this);
        }

        @Override
        public List<StepResult> leaves() {
            return results;
        }
    }
}
