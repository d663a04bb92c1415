package com.ebdgraph.core.generator;

import com.ebdgraph.core.graph.EbdGraph;

/**
 * Interface for diagram generators that transform EBD graphs into textual diagram dialects.
 *
 * <p>Each generator targets one dialect (Graphviz DOT, Mermaid, ...). Output must be
 * deterministic: generating the same graph twice yields byte-identical text, so that generated
 * diagrams can be diffed and snapshot-tested.
 *
 * <p>Generators only accept graphs without fatal findings. Implementations call
 * {@link com.ebdgraph.core.validation.GraphValidator#requireRenderable(EbdGraph)} first.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class DotGenerator implements DiagramGenerator {
 *     @Override
 *     public String getId() {
 *         return "dot";
 *     }
 *
 *     @Override
 *     public GeneratedDiagram generate(EbdGraph graph, GeneratorConfig config) {
 *         VALIDATOR.requireRenderable(graph);
 *         String content = ...;
 *         return new GeneratedDiagram(graph.metadata().ebdCode(), content, getFileExtension());
 *     }
 * }
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.ebdgraph.core.generator.DiagramGenerator}
 *
 * @see GeneratorConfig
 * @see GeneratedDiagram
 */
public interface DiagramGenerator {

    /**
     * Returns unique identifier for this generator.
     *
     * <p>Used for selecting the generator on the command line and in configuration. Should be
     * lowercase (e.g., "dot", "mermaid").
     *
     * @return unique generator identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this generator.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns file extension for generated diagrams, without leading dot.
     *
     * @return file extension
     */
    String getFileExtension();

    /**
     * Generates a diagram from the graph.
     *
     * @param graph graph to render; must not have fatal findings
     * @param config configuration settings for generation
     * @return generated diagram content
     * @throws com.ebdgraph.core.validation.GraphValidationException if the graph has fatal findings
     */
    GeneratedDiagram generate(EbdGraph graph, GeneratorConfig config);
}
