package com.ebdgraph.core.table;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Checks the referential and vocabulary invariants of an {@link EbdTable}.
 *
 * <p>Returns an empty list for a valid table, or one message per violation in document order.
 * Structural invariants (unique step numbers etc.) are already enforced when the table is built.
 */
public final class TableValidator {

    private TableValidator() {}

    /**
     * Validates a table against a vocabulary.
     *
     * @param table table to check
     * @param vocabulary allowed outcome codes and end codes
     * @return violation messages, empty if the table is valid
     */
    public static List<String> validate(EbdTable table, OutcomeVocabulary vocabulary) {
        var errors = new ArrayList<String>();
        Set<StepNumber> steps = table.rows().stream()
            .map(TableRow::stepNumber)
            .collect(Collectors.toSet());

        for (TableRow row : table.rows()) {
            if (row.isTransition() && !steps.contains(row.next())) {
                errors.add("Step %s: subsequent step %s not found".formatted(row.stepNumber(), row.next()));
            }
            for (Map.Entry<String, StepResult> outcome : row.outcomes().entrySet()) {
                String code = outcome.getKey();
                if (!vocabulary.isOutcomeCode(code)) {
                    errors.add("Step %s: outcome code '%s' is not one of %s"
                        .formatted(row.stepNumber(), code, new TreeSet<>(vocabulary.outcomeCodes())));
                }
                for (StepResult leaf : outcome.getValue().leaves()) {
                    String problem = leaf.accept(new LeafChecker(steps, vocabulary));
                    if (problem != null) {
                        errors.add("Step %s, outcome '%s': %s".formatted(row.stepNumber(), code, problem));
                    }
                }
            }
        }

        for (MultiStepInstruction instruction : table.multiStepInstructions()) {
            if (!steps.contains(instruction.firstStep())) {
                errors.add("Multi-step instruction starts at unknown step " + instruction.firstStep());
            }
            if (instruction.lastStep() != null && !steps.contains(instruction.lastStep())) {
                errors.add("Multi-step instruction ends at unknown step " + instruction.lastStep());
            }
        }
        return errors;
    }

    /**
     * Returns a problem description for a single result, or null if it is fine.
     */
    private record LeafChecker(Set<StepNumber> steps, OutcomeVocabulary vocabulary)
        implements StepResult.Visitor<String> {

        @Override
        public String visitContinueAt(StepResult.ContinueAt result) {
            return steps.contains(result.step()) ? null : "subsequent step " + result.step() + " not found";
        }

        @Override
        public String visitTerminal(StepResult.Terminal result) {
            return vocabulary.isEndCode(result.endCode())
                ? null
                : "end code '%s' does not match %s".formatted(result.endCode(), vocabulary.endCodePattern());
        }

        @Override
        public String visitTransitionalOutcome(StepResult.TransitionalOutcome result) {
            if (!vocabulary.isEndCode(result.endCode())) {
                return "end code '%s' does not match %s".formatted(result.endCode(), vocabulary.endCodePattern());
            }
            return steps.contains(result.step()) ? null : "subsequent step " + result.step() + " not found";
        }

        @Override
        public String visitEndOfProcess(StepResult.EndOfProcess result) {
            return null;
        }

        @Override
        public String visitMultiResult(StepResult.MultiResult result) {
            throw new IllegalStateException("leaves() never yields a multi-result");
        }
    }
}
