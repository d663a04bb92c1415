package com.ebdgraph.core.generator.impl;

import com.ebdgraph.core.TestTables;
import com.ebdgraph.core.conversion.TableToGraphConverter;
import com.ebdgraph.core.generator.GeneratedDiagram;
import com.ebdgraph.core.generator.GeneratorConfig;
import com.ebdgraph.core.graph.DecisionNode;
import com.ebdgraph.core.graph.EbdGraph;
import com.ebdgraph.core.graph.EndNode;
import com.ebdgraph.core.graph.GraphEdge;
import com.ebdgraph.core.graph.StartNode;
import com.ebdgraph.core.table.EbdTableMetadata;
import com.ebdgraph.core.table.StepNumber;
import com.ebdgraph.core.validation.MalformedOutcomeSetException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link MermaidGenerator}.
 */
class MermaidGeneratorTest {

    private MermaidGenerator generator;
    private TableToGraphConverter converter;
    private GeneratorConfig config;

    @BeforeEach
    void setUp() {
        generator = new MermaidGenerator();
        converter = new TableToGraphConverter();
        config = GeneratorConfig.defaults();
    }

    @Test
    void getId_returnsCorrectId() {
        assertThat(generator.getId()).isEqualTo("mermaid");
    }

    @Test
    void getFileExtension_returnsMd() {
        assertThat(generator.getFileExtension()).isEqualTo("md");
    }

    @Test
    void generate_withNullConfig_throwsException() {
        EbdGraph graph = converter.convert(TestTables.loopingTable());

        assertThatThrownBy(() -> generator.generate(graph, null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void generate_loopingTable_writesMarkdownWrappedFlowchart() {
        GeneratedDiagram diagram = generator.generate(converter.convert(TestTables.loopingTable()), config);

        assertThat(diagram.fileName()).isEqualTo("E_0001.md");
        assertThat(diagram.content())
            .startsWith("# E_0001_Test\n\n```mermaid\nflowchart TD\n")
            .endsWith("```\n");
    }

    @Test
    void generate_loopingTable_writesNodesAndEdges() {
        String mermaid = generator.generate(converter.convert(TestTables.loopingTable()), config).content();

        assertThat(mermaid)
            .contains("  n_Start([\"E_0001\"])\n")
            .contains("  n_1[\"1: check A\"]\n")
            .contains("  n_2[\"2: check B\"]\n")
            .contains("  n_E0001([\"E0001<br/>no match\"])\n")
            .contains("  n_Start --> n_1\n")
            .contains("  n_1 -->|YES| n_2\n")
            .contains("  n_1 -->|NO| n_E0001\n")
            .contains("  n_2 -->|NO| n_1\n");
    }

    @Test
    void generate_withoutClusters_omitsAnnotations() {
        String mermaid = generator.generate(converter.convert(TestTables.loopingTable()), config).content();

        assertThat(mermaid).doesNotContain("msi").doesNotContain("%%");
    }

    @Test
    void generate_withClusters_writesAnnotationComments() {
        GeneratorConfig clustered = new GeneratorConfig(80, 50, true, null);

        String mermaid = generator.generate(converter.convert(TestTables.sharedOutcomeTable()), clustered).content();

        assertThat(mermaid)
            .contains("  %% msi_10 (steps 10, 20): Alle Prüfungen beziehen sich auf die Nachricht.\n")
            .contains("  %% msi_30 (steps 30, 40): Ab hier Prüfung der Zählpunkte.\n");
    }

    @Test
    void generate_endNodeAndOutcomeWithoutLabel_areRounded() {
        String mermaid = generator.generate(converter.convert(TestTables.sharedOutcomeTable()), config).content();

        assertThat(mermaid)
            .contains("  n_Ende([\"Ende\"])\n")
            .contains("  n_A03([\"A03\"])\n")
            .contains("  n_40 -->|JA| n_Ende\n");
    }

    @Test
    void generate_quotesInLabels_areReplaced() {
        EbdGraph graph = new EbdGraph(EbdTableMetadata.of("E_0400", "NB"),
            List.of(new StartNode(), new DecisionNode(StepNumber.of("1"), "Ist \"Status\" gesetzt?", null, List.of("ja")),
                new EndNode()),
            List.of(GraphEdge.start("1"), GraphEdge.outcome("1", "Ende", "ja")));

        String mermaid = generator.generate(graph, config).content();

        assertThat(mermaid).contains("  n_1[\"1: Ist 'Status' gesetzt?\"]\n");
    }

    @Test
    void generate_sameGraphTwice_isByteIdentical() {
        EbdGraph graph = converter.convert(TestTables.sharedOutcomeTable());

        assertThat(generator.generate(graph, config).content()).isEqualTo(generator.generate(graph, config).content());
    }

    @Test
    void generate_malformedGraph_isRefused() {
        EbdGraph graph = new EbdGraph(EbdTableMetadata.of("E_0401", "NB"),
            List.of(new StartNode(), new DecisionNode(StepNumber.of("1"), "a", null, List.of("ja", "nein")), new EndNode()),
            List.of(GraphEdge.start("1"), GraphEdge.outcome("1", "Ende", "ja")));

        assertThatThrownBy(() -> generator.generate(graph, config)).isInstanceOf(MalformedOutcomeSetException.class);
    }

    @Test
    void generate_transitionTable_writesTransitionsAsPlainArrows() {
        String mermaid = generator.generate(converter.convert(TestTables.transitionTable()), config).content();

        assertThat(mermaid)
            .contains("  n_20[\"20: Vollständige Adressprüfung\"]\n")
            .contains("  n_A90_30([\"A90<br/>Absender nachfragen\"])\n")
            .contains("  n_10 -->|NEIN| n_A90_30\n")
            .contains("  n_A90_30 --> n_30\n")
            .contains("  n_20 --> n_30\n");
    }

    @Test
    void generate_emptyTable_writesSingleRemarkNode() {
        String mermaid = generator.generate(converter.convert(TestTables.emptyTable()), config).content();

        assertThat(mermaid)
            .contains("  n_Empty([\"E_0534<br/>Derzeit ist für diese Entscheidung kein Entscheidungsbaum notwendig.\"])\n")
            .doesNotContain("n_Start")
            .doesNotContain("-->");
    }
}
