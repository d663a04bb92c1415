package com.ebdgraph.core.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Word wrapping and escaping for diagram labels.
 */
public final class LineBreaks {

    private static final String NEWLINE = "\n";

    private LineBreaks() {
        // Utility class
    }

    /**
     * Inserts line separators so that no line exceeds {@code maxLineLength} characters where a
     * break is possible.
     *
     * <p>A line is broken at the last space before the limit. If the text already contains a line
     * break within one and a half times the limit, that break is used instead: breaks in the
     * source tables are sometimes meaningful ("Cluster: Ablehnung\n...") and sometimes only an
     * artefact of narrow columns, and there is no telling which. Words longer than the limit are
     * split hard.
     *
     * @param text text to wrap
     * @param maxLineLength maximum line length, must be positive
     * @param lineSeparator separator inserted between lines
     * @return wrapped text
     */
    public static String addLineBreaks(String text, int maxLineLength, String lineSeparator) {
        if (maxLineLength <= 0) {
            throw new IllegalArgumentException("maxLineLength must be positive, got " + maxLineLength);
        }
        return String.join(lineSeparator, split(text, maxLineLength));
    }

    private static List<String> split(String text, int maxLength) {
        List<String> parts = new ArrayList<>();
        String remaining = text;

        while (remaining.length() > maxLength) {
            int lineBreak = lastIndexBefore(remaining, NEWLINE, (int) (1.5 * maxLength));
            int whitespace = lastIndexBefore(remaining, " ", maxLength);
            int splitIndex;
            if (lineBreak != -1) {
                splitIndex = lineBreak;
            } else if (whitespace != -1) {
                splitIndex = whitespace;
            } else {
                splitIndex = maxLength;
            }

            String part = remaining.substring(0, splitIndex).stripTrailing();
            if (lineBreak != -1) {
                part = part.replace(NEWLINE, "");
            }
            parts.add(part);
            remaining = remaining.substring(splitIndex).stripLeading();
        }

        if (!remaining.isEmpty()) {
            parts.add(remaining);
        }
        return parts;
    }

    /**
     * Last index of {@code token} lying completely within {@code text[0, end)}, or -1.
     */
    private static int lastIndexBefore(String text, String token, int end) {
        int limit = Math.min(end, text.length()) - token.length();
        if (limit < 0) {
            return -1;
        }
        return text.lastIndexOf(token, limit);
    }

    /**
     * Escapes the characters that have a meaning in HTML-like labels.
     *
     * @param text raw text, may be null
     * @return escaped text, or an empty string for null
     */
    public static String escapeHtml(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }
}
