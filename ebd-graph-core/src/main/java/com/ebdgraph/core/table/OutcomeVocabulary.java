package com.ebdgraph.core.table;

import java.util.Collection;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * The fixed vocabulary a table is checked against: allowed outcome codes and the shape of end codes.
 *
 * <p>The authoritative values are published by EDI@Energy/BDEW, so both are configurable.
 * {@link #defaults()} covers the yes/no tables of the current publications.
 *
 * @param outcomeCodes allowed outcome codes, e.g. "ja" and "nein"
 * @param endCodePattern pattern every terminal end code must match
 */
public record OutcomeVocabulary(
    Set<String> outcomeCodes,
    Pattern endCodePattern
) {
    public static final String DEFAULT_END_CODE_PATTERN = "[A-Z]\\d+";
    public static final Set<String> DEFAULT_OUTCOME_CODES = Set.of("ja", "nein");

    /**
     * Compact constructor with validation.
     */
    public OutcomeVocabulary {
        Objects.requireNonNull(outcomeCodes, "outcomeCodes must not be null");
        Objects.requireNonNull(endCodePattern, "endCodePattern must not be null");
        if (outcomeCodes.isEmpty()) {
            throw new IllegalArgumentException("outcomeCodes must not be empty");
        }
        outcomeCodes = Set.copyOf(outcomeCodes);
    }

    /**
     * Creates the default vocabulary.
     *
     * @return vocabulary with outcome codes "ja"/"nein" and end codes like "A01"
     */
    public static OutcomeVocabulary defaults() {
        return new OutcomeVocabulary(DEFAULT_OUTCOME_CODES, Pattern.compile(DEFAULT_END_CODE_PATTERN));
    }

    /**
     * Creates a vocabulary from configuration values.
     *
     * @param outcomeCodes allowed outcome codes
     * @param endCodeRegex regular expression for end codes
     * @return vocabulary
     * @throws java.util.regex.PatternSyntaxException if the expression is invalid
     */
    public static OutcomeVocabulary of(Collection<String> outcomeCodes, String endCodeRegex) {
        return new OutcomeVocabulary(Set.copyOf(outcomeCodes), Pattern.compile(endCodeRegex));
    }

    /**
     * Checks an outcome code.
     *
     * @param code outcome code
     * @return true if the code is part of the vocabulary
     */
    public boolean isOutcomeCode(String code) {
        return outcomeCodes.contains(code);
    }

    /**
     * Checks an end code.
     *
     * @param endCode terminal end code
     * @return true if the code matches the end-code pattern
     */
    public boolean isEndCode(String endCode) {
        return endCodePattern.matcher(endCode).matches();
    }
}
