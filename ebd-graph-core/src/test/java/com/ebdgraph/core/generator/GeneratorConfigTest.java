package com.ebdgraph.core.generator;

import com.ebdgraph.core.graph.NodeKind;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link GeneratorConfig} and {@link DiagramTheme}.
 */
class GeneratorConfigTest {

    @Test
    void defaults_returnsDocumentedValues() {
        GeneratorConfig config = GeneratorConfig.defaults();

        assertThat(config.labelWrapWidth()).isEqualTo(80);
        assertThat(config.annotationWrapWidth()).isEqualTo(50);
        assertThat(config.annotationClusters()).isFalse();
        assertThat(config.theme()).isEqualTo(DiagramTheme.defaults());
    }

    @Test
    void constructor_nonPositiveWidthsAndNullTheme_fallBackToDefaults() {
        GeneratorConfig config = new GeneratorConfig(0, -5, true, null);

        assertThat(config.labelWrapWidth()).isEqualTo(GeneratorConfig.DEFAULT_LABEL_WRAP_WIDTH);
        assertThat(config.annotationWrapWidth()).isEqualTo(GeneratorConfig.DEFAULT_ANNOTATION_WRAP_WIDTH);
        assertThat(config.annotationClusters()).isTrue();
        assertThat(config.theme()).isNotNull();
    }

    @Test
    void defaults_linkNoEbdReferences() {
        assertThat(GeneratorConfig.defaults().ebdLinkTemplate()).isNull();
        assertThat(GeneratorConfig.defaults().linksEbdReferences()).isFalse();
    }

    @Test
    void withEbdLinkTemplate_keepsOtherSettings() {
        GeneratorConfig config = new GeneratorConfig(60, 40, true, null).withEbdLinkTemplate("?ebd={ebd_code}");

        assertThat(config.ebdLinkTemplate()).isEqualTo("?ebd={ebd_code}");
        assertThat(config.linksEbdReferences()).isTrue();
        assertThat(config.labelWrapWidth()).isEqualTo(60);
        assertThat(config.annotationClusters()).isTrue();
    }

    @Test
    void constructor_blankLinkTemplate_disablesLinks() {
        assertThat(GeneratorConfig.defaults().withEbdLinkTemplate("  ").linksEbdReferences()).isFalse();
    }

    @Test
    void defaultTheme_stylesEveryNodeKind() {
        DiagramTheme theme = DiagramTheme.defaults();

        for (NodeKind kind : NodeKind.values()) {
            assertThat(theme.styleFor(kind)).as(kind.name()).isNotNull();
        }
        assertThat(theme.styleFor(NodeKind.DECISION).fillColor()).isEqualTo("#c2cee9");
        assertThat(theme.styleFor(NodeKind.ANNOTATION).shape()).isEqualTo("note");
        assertThat(theme.styleFor(NodeKind.EMPTY).fillColor()).isEqualTo("#7a8da1");
    }

    @Test
    void theme_missingNodeKind_throwsException() {
        Map<NodeKind, NodeStyle> styles = Map.of(NodeKind.START, new NodeStyle("box", "filled", "#ffffff"));

        assertThatThrownBy(() -> new DiagramTheme(styles, "#000000", "#000000", "#000000", "#000000", "Arial"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("No style for node kind");
    }

    @Test
    void theme_isImmutable() {
        DiagramTheme theme = DiagramTheme.defaults();

        assertThatThrownBy(() -> theme.nodeStyles().put(NodeKind.START, new NodeStyle("box", "filled", "#ffffff")))
            .isInstanceOf(UnsupportedOperationException.class);
    }
}
