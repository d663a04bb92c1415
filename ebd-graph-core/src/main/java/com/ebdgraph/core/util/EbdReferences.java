package com.ebdgraph.core.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds and links references to other EBDs ("EBD E_0621") in outcome labels.
 */
public final class EbdReferences {

    /** Matches "EBD E_0621"; group 1 is the referenced EBD code */
    public static final Pattern REFERENCE = Pattern.compile("EBD (E_\\d{4})");

    /** Placeholder of a link template that is replaced by the referenced EBD code */
    public static final String CODE_PLACEHOLDER = "{ebd_code}";

    private EbdReferences() {
        // Utility class
    }

    /**
     * Extracts the referenced EBD codes.
     *
     * @param text label text, may be null
     * @return distinct codes in order of first appearance
     */
    public static List<String> extract(String text) {
        if (text == null) {
            return List.of();
        }
        List<String> codes = new ArrayList<>();
        Matcher matcher = REFERENCE.matcher(text);
        while (matcher.find()) {
            if (!codes.contains(matcher.group(1))) {
                codes.add(matcher.group(1));
            }
        }
        return codes;
    }

    /**
     * Fills a link template with an EBD code.
     *
     * @param template template containing {@value #CODE_PLACEHOLDER}, e.g. {@code ?ebd={ebd_code}}
     * @param ebdCode referenced EBD code
     * @return link target
     */
    public static String link(String template, String ebdCode) {
        Objects.requireNonNull(template, "template must not be null");
        return template.replace(CODE_PLACEHOLDER, ebdCode);
    }
}
