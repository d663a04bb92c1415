package com.ebdgraph.core.generator;

import com.ebdgraph.core.util.EbdReferences;

/**
 * Configuration for diagram generation.
 *
 * @param labelWrapWidth wrap width of decision and outcome labels
 * @param annotationWrapWidth wrap width of annotation labels
 * @param annotationClusters whether to group the steps covered by an annotation
 * @param theme styling table
 * @param ebdLinkTemplate link target for references to other EBDs, containing
 *                        {@value EbdReferences#CODE_PLACEHOLDER} (e.g. {@code ?ebd={ebd_code}});
 *                        null renders references as plain text
 */
public record GeneratorConfig(
    int labelWrapWidth,
    int annotationWrapWidth,
    boolean annotationClusters,
    DiagramTheme theme,
    String ebdLinkTemplate
) {
    public static final int DEFAULT_LABEL_WRAP_WIDTH = 80;
    public static final int DEFAULT_ANNOTATION_WRAP_WIDTH = 50;

    /**
     * Compact constructor with validation.
     */
    public GeneratorConfig {
        if (labelWrapWidth <= 0) {
            labelWrapWidth = DEFAULT_LABEL_WRAP_WIDTH;
        }
        if (annotationWrapWidth <= 0) {
            annotationWrapWidth = DEFAULT_ANNOTATION_WRAP_WIDTH;
        }
        if (theme == null) {
            theme = DiagramTheme.defaults();
        }
        if (ebdLinkTemplate != null && ebdLinkTemplate.isBlank()) {
            ebdLinkTemplate = null;
        }
    }

    /**
     * Creates a configuration without EBD links.
     */
    public GeneratorConfig(int labelWrapWidth, int annotationWrapWidth, boolean annotationClusters, DiagramTheme theme) {
        this(labelWrapWidth, annotationWrapWidth, annotationClusters, theme, null);
    }

    /**
     * Creates a default configuration.
     *
     * @return default generator config
     */
    public static GeneratorConfig defaults() {
        return new GeneratorConfig(DEFAULT_LABEL_WRAP_WIDTH, DEFAULT_ANNOTATION_WRAP_WIDTH, false, DiagramTheme.defaults());
    }

    /**
     * Returns a copy of this config linking references to other EBDs.
     *
     * @param template link template, or null for plain references
     * @return new config
     */
    public GeneratorConfig withEbdLinkTemplate(String template) {
        return new GeneratorConfig(labelWrapWidth, annotationWrapWidth, annotationClusters, theme, template);
    }

    /**
     * Returns whether references to other EBDs are rendered as links.
     *
     * @return true if a link template is set
     */
    public boolean linksEbdReferences() {
        return ebdLinkTemplate != null;
    }
}
