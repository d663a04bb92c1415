package com.ebdgraph.core.table;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigInteger;
import java.util.Comparator;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Identifier of a check step ("Prüfschritt") within an EBD table.
 *
 * <p>Step numbers are positive integers, optionally followed by an asterisk (e.g. {@code 4},
 * {@code 7*}). They are unique within a table but not necessarily contiguous. Ordering is by the
 * numeric part first, without an upper bound on the number of digits; an unstarred number sorts
 * before its starred sibling, and numbers differing only in leading zeros by their text.
 *
 * @param value textual step number as printed in the source document
 */
public record StepNumber(@JsonValue String value) implements Comparable<StepNumber> {

    private static final Pattern STEP_NUMBER_PATTERN = Pattern.compile("\\d+\\*?");
    private static final String STAR = "*";

    private static final Comparator<StepNumber> ORDER = Comparator
        .comparing(StepNumber::numericPart)
        .thenComparing(StepNumber::isStarred)
        .thenComparing(StepNumber::value);

    /**
     * Compact constructor with validation.
     */
    public StepNumber {
        Objects.requireNonNull(value, "value must not be null");
        if (!STEP_NUMBER_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid step number: '" + value + "'");
        }
    }

    /**
     * Creates a step number from its textual form.
     *
     * @param value textual step number, e.g. "12" or "6*"
     * @return step number
     * @throws IllegalArgumentException if the value is not a valid step number
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static StepNumber of(String value) {
        return new StepNumber(value);
    }

    /**
     * Returns the numeric part without a trailing asterisk.
     *
     * @return numeric part
     */
    public BigInteger numericPart() {
        String digits = isStarred() ? value.substring(0, value.length() - 1) : value;
        return new BigInteger(digits);
    }

    /**
     * Returns whether the step number carries a trailing asterisk.
     *
     * @return true for e.g. "6*"
     */
    public boolean isStarred() {
        return value.endsWith(STAR);
    }

    @Override
    public int compareTo(StepNumber other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return value;
    }
}
