package com.ebdgraph.core.table;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Free-text instruction that applies to a run of consecutive steps.
 *
 * <p>The run starts at {@code firstStep}. It ends at {@code lastStep} when given; otherwise just
 * before the first step of the next instruction, or at the end of the table.
 *
 * @param firstStep first step the instruction applies to
 * @param text instruction text
 * @param lastStep optional last step the instruction applies to
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MultiStepInstruction(
    @JsonProperty("firstStep") StepNumber firstStep,
    @JsonProperty("text") String text,
    @JsonProperty("lastStep") StepNumber lastStep
) {
    /**
     * Compact constructor with validation.
     */
    public MultiStepInstruction {
        Objects.requireNonNull(firstStep, "firstStep must not be null");
        Objects.requireNonNull(text, "text must not be null");
        if (lastStep != null && lastStep.compareTo(firstStep) < 0) {
            throw new IllegalArgumentException(
                "lastStep " + lastStep + " lies before firstStep " + firstStep);
        }
    }

    /**
     * Creates an instruction that runs until the next instruction or the end of the table.
     *
     * @param firstStep first affected step
     * @param text instruction text
     * @return new instruction
     */
    public static MultiStepInstruction from(String firstStep, String text) {
        return new MultiStepInstruction(StepNumber.of(firstStep), text, null);
    }
}
