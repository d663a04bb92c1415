package com.ebdgraph.core.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link LineBreaks}.
 */
class LineBreaksTest {

    @Test
    void addLineBreaks_shortText_isUnchanged() {
        assertThat(LineBreaks.addLineBreaks("text shorter than 80 chars", 80, "\n"))
            .isEqualTo("text shorter than 80 chars");
    }

    @Test
    void addLineBreaks_longText_breaksAtLastSpaceBeforeLimit() {
        String text = "Die Köchin der Frau Grubach, seiner Zimmervermieterin, die ihm jeden Tag gegen acht Uhr "
            + "früh das Frühstück brachte, kam diesmal nicht.";

        assertThat(LineBreaks.addLineBreaks(text, 80, "\n")).isEqualTo(
            "Die Köchin der Frau Grubach, seiner Zimmervermieterin, die ihm jeden Tag gegen\n"
                + "acht Uhr früh das Frühstück brachte, kam diesmal nicht.");
    }

    @Test
    void addLineBreaks_existingLineBreakWithinOneAndAHalfLimits_isPreferred() {
        String text = "Der Mann aber ging über die Frage hinweg, als müsse man seine Erscheinung hinnehmen, und "
            + "sagte bloß seinerseits:\n »Sie haben geläutet?« »Anna soll mir das Frühstück bringen«, sagte K. und "
            + "versuchte, zunächst stillschweigend, durch Aufmerksamkeit und Überlegung festzustellen, wer der Mann "
            + "eigentlich war.";

        assertThat(LineBreaks.addLineBreaks(text, 80, "<br/>")).isEqualTo(
            "Der Mann aber ging über die Frage hinweg, als müsse man seine Erscheinung hinnehmen, und sagte bloß "
                + "seinerseits:<br/>»Sie haben geläutet?« »Anna soll mir das Frühstück bringen«, sagte K. und<br/>"
                + "versuchte, zunächst stillschweigend, durch Aufmerksamkeit und Überlegung<br/>"
                + "festzustellen, wer der Mann eigentlich war.");
    }

    @Test
    void addLineBreaks_wordLongerThanLimit_isSplitHard() {
        assertThat(LineBreaks.addLineBreaks("Bilanzkreisverantwortlicher", 10, "|"))
            .isEqualTo("Bilanzkrei|sverantwor|tlicher");
    }

    @Test
    void addLineBreaks_nonPositiveWidth_throwsException() {
        assertThatThrownBy(() -> LineBreaks.addLineBreaks("text", 0, "\n"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void escapeHtml_escapesMarkupCharacters() {
        assertThat(LineBreaks.escapeHtml("a < b & c > d")).isEqualTo("a &lt; b &amp; c &gt; d");
        assertThat(LineBreaks.escapeHtml(null)).isEmpty();
    }
}
