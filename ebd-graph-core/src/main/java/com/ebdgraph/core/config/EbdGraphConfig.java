package com.ebdgraph.core.config;

import com.ebdgraph.core.generator.DiagramTheme;
import com.ebdgraph.core.generator.GeneratorConfig;
import com.ebdgraph.core.table.OutcomeVocabulary;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.regex.PatternSyntaxException;

/**
 * Root configuration of the EBD graph tool.
 *
 * <p>Loaded from {@code ebdgraph.yaml}. Missing sections and values fall back to the defaults.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * vocabulary:
 *   outcomeCodes: [ja, nein]
 *   endCodePattern: "[A-Z]\\d+"
 *
 * rendering:
 *   format: dot
 *   labelWrapWidth: 80
 *   annotationWrapWidth: 50
 *   annotationClusters: false
 *   fontName: "Roboto, sans-serif"
 *   ebdLinkTemplate: "?ebd={ebd_code}"
 *
 * output:
 *   directory: "./diagrams"
 * }</pre>
 *
 * @param vocabulary outcome vocabulary settings
 * @param rendering rendering settings
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EbdGraphConfig(
    @JsonProperty("vocabulary") VocabularyConfig vocabulary,
    @JsonProperty("rendering") RenderingConfig rendering,
    @JsonProperty("output") OutputConfig output
) {
    public static final String DEFAULT_FORMAT = "dot";

    private static final Logger log = LoggerFactory.getLogger(EbdGraphConfig.class);

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static EbdGraphConfig defaults() {
        return new EbdGraphConfig(
            new VocabularyConfig(List.copyOf(OutcomeVocabulary.DEFAULT_OUTCOME_CODES), OutcomeVocabulary.DEFAULT_END_CODE_PATTERN),
            new RenderingConfig(DEFAULT_FORMAT, GeneratorConfig.DEFAULT_LABEL_WRAP_WIDTH,
                GeneratorConfig.DEFAULT_ANNOTATION_WRAP_WIDTH, false, null, null),
            new OutputConfig(null)
        );
    }

    /**
     * Builds the outcome vocabulary described by this configuration.
     *
     * <p>An end code pattern that is not a valid regular expression is logged and replaced by the
     * default pattern.
     *
     * @return vocabulary; defaults for unset or invalid values
     */
    public OutcomeVocabulary toVocabulary() {
        if (vocabulary == null) {
            return OutcomeVocabulary.defaults();
        }
        List<String> codes = vocabulary.outcomeCodes() == null || vocabulary.outcomeCodes().isEmpty()
            ? List.copyOf(OutcomeVocabulary.DEFAULT_OUTCOME_CODES)
            : vocabulary.outcomeCodes();
        String pattern = vocabulary.endCodePattern() == null
            ? OutcomeVocabulary.DEFAULT_END_CODE_PATTERN
            : vocabulary.endCodePattern();
        try {
            return OutcomeVocabulary.of(codes, pattern);
        } catch (PatternSyntaxException e) {
            log.warn("Invalid end code pattern '{}': {}. Using default pattern {}",
                pattern, e.getDescription(), OutcomeVocabulary.DEFAULT_END_CODE_PATTERN);
            return OutcomeVocabulary.of(codes, OutcomeVocabulary.DEFAULT_END_CODE_PATTERN);
        }
    }

    /**
     * Builds the generator configuration described by this configuration.
     *
     * @return generator config; defaults for unset values
     */
    public GeneratorConfig toGeneratorConfig() {
        if (rendering == null) {
            return GeneratorConfig.defaults();
        }
        DiagramTheme theme = DiagramTheme.defaults();
        if (rendering.fontName() != null && !rendering.fontName().isBlank()) {
            theme = theme.withFontName(rendering.fontName());
        }
        return new GeneratorConfig(
            rendering.labelWrapWidth() == null ? 0 : rendering.labelWrapWidth(),
            rendering.annotationWrapWidth() == null ? 0 : rendering.annotationWrapWidth(),
            Boolean.TRUE.equals(rendering.annotationClusters()),
            theme,
            rendering.ebdLinkTemplate()
        );
    }

    /**
     * Returns the configured diagram format (generator id).
     *
     * @return format, "dot" when unset
     */
    public String format() {
        return rendering == null || rendering.format() == null ? DEFAULT_FORMAT : rendering.format();
    }

    /**
     * Outcome vocabulary settings.
     *
     * @param outcomeCodes allowed outcome codes
     * @param endCodePattern regular expression end codes must match
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record VocabularyConfig(
        @JsonProperty("outcomeCodes") List<String> outcomeCodes,
        @JsonProperty("endCodePattern") String endCodePattern
    ) {}

    /**
     * Rendering settings.
     *
     * @param format default generator id
     * @param labelWrapWidth wrap width of node labels
     * @param annotationWrapWidth wrap width of annotation labels
     * @param annotationClusters whether to group annotated steps
     * @param fontName font for all labels
     * @param ebdLinkTemplate link target for references to other EBDs, e.g. {@code ?ebd={ebd_code}}
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RenderingConfig(
        @JsonProperty("format") String format,
        @JsonProperty("labelWrapWidth") Integer labelWrapWidth,
        @JsonProperty("annotationWrapWidth") Integer annotationWrapWidth,
        @JsonProperty("annotationClusters") Boolean annotationClusters,
        @JsonProperty("fontName") String fontName,
        @JsonProperty("ebdLinkTemplate") String ebdLinkTemplate
    ) {}

    /**
     * Output settings.
     *
     * @param directory directory diagrams are written to; stdout when unset
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("directory") String directory
    ) {}
}
