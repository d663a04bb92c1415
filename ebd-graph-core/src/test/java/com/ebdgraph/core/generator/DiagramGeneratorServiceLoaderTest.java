package com.ebdgraph.core.generator;

import com.ebdgraph.core.generator.impl.DotGenerator;
import com.ebdgraph.core.generator.impl.MermaidGenerator;
import com.ebdgraph.core.generator.impl.PlantUmlGenerator;
import org.junit.jupiter.api.Test;

import java.util.ServiceLoader;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

import static org.assertj.core.api.Assertions.*;

/**
 * Verifies that all generators are discoverable through {@link ServiceLoader}.
 */
class DiagramGeneratorServiceLoaderTest {

    @Test
    void serviceLoader_findsAllGenerators() {
        ServiceLoader<DiagramGenerator> loader = ServiceLoader.load(DiagramGenerator.class);

        var ids = StreamSupport.stream(loader.spliterator(), false)
            .map(DiagramGenerator::getId)
            .collect(Collectors.toSet());

        assertThat(ids).containsExactlyInAnyOrder("dot", "mermaid", "plantuml");
    }

    @Test
    void all_returnsGeneratorsOrderedById() {
        assertThat(DiagramGenerators.all()).extracting(DiagramGenerator::getId).containsExactly("dot", "mermaid", "plantuml");
    }

    @Test
    void byId_isCaseInsensitive() {
        assertThat(DiagramGenerators.byId("DOT")).get().isInstanceOf(DotGenerator.class);
        assertThat(DiagramGenerators.byId("mermaid")).get().isInstanceOf(MermaidGenerator.class);
        assertThat(DiagramGenerators.byId("PlantUML")).get().isInstanceOf(PlantUmlGenerator.class);
        assertThat(DiagramGenerators.byId("svg")).isEmpty();
    }
}
