package com.ebdgraph.core.loader;

import com.ebdgraph.core.table.EbdTable;
import com.ebdgraph.core.table.StepNumber;
import com.ebdgraph.core.table.StepResult;
import com.ebdgraph.core.table.TableRow;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link TableLoader}.
 */
class TableLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_json_readsAllResultTypes() throws IOException {
        Path file = tempDir.resolve("E_0003.json");
        Files.writeString(file, """
            {
              "metadata": {"ebdCode": "E_0003", "chapter": "Kapitel 6", "role": "ÜNB"},
              "rows": [
                {"stepNumber": "1", "description": "Fristgerecht?",
                 "outcomes": {
                   "ja":   {"type": "continue", "step": "2"},
                   "nein": {"type": "terminal", "endCode": "A01", "label": "Frist überschritten"}}},
                {"stepNumber": "2", "description": "Absender bekannt?", "note": "siehe Anhang",
                 "outcomes": {
                   "ja":   {"type": "end"},
                   "nein": {"type": "multi", "results": [
                     {"type": "terminal", "endCode": "A02"},
                     {"type": "terminal", "endCode": "A03", "label": "Rückfrage"}]}}}
              ],
              "multiStepInstructions": [
                {"firstStep": "1", "text": "Gilt für alle Schritte"}
              ]
            }
            """);

        EbdTable table = TableLoader.load(file);

        assertThat(table.metadata().ebdCode()).isEqualTo("E_0003");
        assertThat(table.metadata().role()).isEqualTo("ÜNB");
        assertThat(table.rows()).extracting(TableRow::stepNumber)
            .containsExactly(StepNumber.of("1"), StepNumber.of("2"));

        TableRow first = table.rows().get(0);
        assertThat(first.outcomes().keySet()).containsExactly("ja", "nein");
        assertThat(first.outcomes().get("ja")).isEqualTo(new StepResult.ContinueAt(StepNumber.of("2")));
        assertThat(first.outcomes().get("nein")).isEqualTo(new StepResult.Terminal("A01", "Frist überschritten"));

        TableRow second = table.rows().get(1);
        assertThat(second.note()).isEqualTo("siehe Anhang");
        assertThat(second.outcomes().get("ja")).isInstanceOf(StepResult.EndOfProcess.class);
        assertThat(second.outcomes().get("nein")).isInstanceOfSatisfying(StepResult.MultiResult.class,
            multi -> assertThat(multi.results()).hasSize(2));

        assertThat(table.multiStepInstructions()).hasSize(1);
        assertThat(table.multiStepInstructions().get(0).lastStep()).isNull();
    }

    @Test
    void load_yaml_acceptsUnquotedStepNumbers() throws IOException {
        Path file = tempDir.resolve("E_0004.yml");
        Files.writeString(file, """
            metadata:
              ebdCode: E_0004
              role: NB
            rows:
              - stepNumber: 10
                description: Liegt eine Antwort vor?
                outcomes:
                  ja: {type: terminal, endCode: A01}
                  nein: {type: continue, step: 10}
            """);

        EbdTable table = TableLoader.load(file);

        assertThat(table.rows()).hasSize(1);
        assertThat(table.rows().get(0).stepNumber()).isEqualTo(StepNumber.of("10"));
        assertThat(table.rows().get(0).outcomes().get("nein"))
            .isEqualTo(new StepResult.ContinueAt(StepNumber.of("10")));
        assertThat(table.multiStepInstructions()).isEmpty();
    }

    @Test
    void load_unknownExtension_throwsTableLoadException() throws IOException {
        Path file = tempDir.resolve("table.csv");
        Files.writeString(file, "1;a");

        assertThatThrownBy(() -> TableLoader.load(file))
            .isInstanceOf(TableLoadException.class)
            .hasMessageContaining("unsupported file type");
    }

    @Test
    void load_missingFile_throwsTableLoadException() {
        Path file = tempDir.resolve("missing.json");

        assertThatThrownBy(() -> TableLoader.load(file))
            .isInstanceOfSatisfying(TableLoadException.class, e -> assertThat(e.getSource()).isEqualTo(file))
            .hasMessageContaining("file not found");
    }

    @Test
    void load_tableWithoutRows_keepsRemark() throws IOException {
        Path file = tempDir.resolve("E_0590.json");
        Files.writeString(file, """
            {"metadata": {"ebdCode": "E_0590", "remark": "Derzeit ist kein Entscheidungsbaum notwendig."},
             "rows": []}
            """);

        EbdTable table = TableLoader.load(file);

        assertThat(table.isEmpty()).isTrue();
        assertThat(table.metadata().remark()).isEqualTo("Derzeit ist kein Entscheidungsbaum notwendig.");
    }

    @Test
    void load_transitionRowAndTransitionalOutcome_areRead() throws IOException {
        Path file = tempDir.resolve("E_0594.yaml");
        Files.writeString(file, """
            metadata:
              ebdCode: E_0594
            rows:
              - stepNumber: "270"
                description: Ist die Adresse enthalten?
                outcomes:
                  ja: {type: continue, step: "275"}
                  nein: {type: transitional, endCode: A90, label: ohne Adresse, step: "280"}
              - stepNumber: "275"
                description: Vollständige Adressprüfung
                next: "280"
              - stepNumber: "280"
                description: Genau ein Treffer?
                outcomes:
                  ja: {type: end}
                  nein: {type: terminal, endCode: A02}
            """);

        EbdTable table = TableLoader.load(file);

        assertThat(table.rows().get(0).outcomes().get("nein"))
            .isEqualTo(new StepResult.TransitionalOutcome("A90", "ohne Adresse", StepNumber.of("280")));
        TableRow transition = table.rows().get(1);
        assertThat(transition.isTransition()).isTrue();
        assertThat(transition.next()).isEqualTo(StepNumber.of("280"));
        assertThat(transition.outcomes()).isEmpty();
    }

    @Test
    void load_invalidStepNumber_throwsTableLoadException() throws IOException {
        Path file = tempDir.resolve("bad.json");
        Files.writeString(file, """
            {"metadata": {"ebdCode": "E_0006"},
             "rows": [{"stepNumber": "A", "description": "x",
                       "outcomes": {"ja": {"type": "end"}}}]}
            """);

        assertThatThrownBy(() -> TableLoader.load(file))
            .isInstanceOf(TableLoadException.class)
            .hasMessageContaining("Invalid step number");
    }

    @Test
    void load_unknownResultType_throwsTableLoadException() throws IOException {
        Path file = tempDir.resolve("bad-type.json");
        Files.writeString(file, """
            {"metadata": {"ebdCode": "E_0007"},
             "rows": [{"stepNumber": "1", "description": "x",
                       "outcomes": {"ja": {"type": "maybe"}}}]}
            """);

        assertThatThrownBy(() -> TableLoader.load(file)).isInstanceOf(TableLoadException.class);
    }
}
