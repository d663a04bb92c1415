package com.ebdgraph.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ebdgraph.core.config.ConfigLoader;
import com.ebdgraph.core.config.EbdGraphConfig;
import com.ebdgraph.core.conversion.GraphConversionException;
import com.ebdgraph.core.conversion.TableToGraphConverter;
import com.ebdgraph.core.generator.DiagramGenerator;
import com.ebdgraph.core.generator.DiagramGenerators;
import com.ebdgraph.core.generator.GeneratedDiagram;
import com.ebdgraph.core.generator.GeneratorConfig;
import com.ebdgraph.core.graph.EbdGraph;
import com.ebdgraph.core.loader.TableLoadException;
import com.ebdgraph.core.loader.TableLoader;
import com.ebdgraph.core.table.EbdTable;
import com.ebdgraph.core.table.TableValidator;
import com.ebdgraph.core.validation.Finding;
import com.ebdgraph.core.validation.GraphValidator;
import com.ebdgraph.core.validation.ValidationReport;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Command to convert a decision table and write the diagram.
 *
 * <p>Runs the full pipeline:
 * <ol>
 *   <li>Load the table (JSON or YAML)</li>
 *   <li>Check references and vocabulary</li>
 *   <li>Convert the table into a graph</li>
 *   <li>Validate the graph; findings are printed here once, fatal findings abort</li>
 *   <li>Generate the diagram and write {@code <ebdCode>.<ext>}, or print it</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ebdgraph render E_0003.json -o diagrams
 * ebdgraph render E_0003.yaml -f mermaid
 * ebdgraph render E_0622.json -f plantuml -l "?ebd={ebd_code}"
 * }</pre>
 */
@Command(
    name = "render",
    description = "Convert a decision table and write the diagram",
    mixinStandardHelpOptions = true
)
public class RenderCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RenderCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Table file (.json, .yaml or .yml)")
    private Path tableFile;

    @Option(names = {"-f", "--format"}, description = "Diagram format: dot, mermaid or plantuml (default: from config, else dot)")
    private String format;

    @Option(names = {"-o", "--output"}, description = "Output directory (default: from config, else stdout)")
    private Path outputDir;

    @Option(names = {"-l", "--ebd-link-template"},
        description = "Link target for references to other EBDs, e.g. \"?ebd={ebd_code}\" (default: from config)")
    private String ebdLinkTemplate;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: ebdgraph.yaml)")
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        EbdGraphConfig config = ConfigLoader.load(configPath);
        String effectiveFormat = format != null ? format : config.format();
        Optional<DiagramGenerator> generator = DiagramGenerators.byId(effectiveFormat);
        if (generator.isEmpty()) {
            err.println("✗ Unknown format: " + effectiveFormat + ". Use 'ebdgraph list' to see available formats.");
            return 1;
        }

        try {
            EbdTable table = TableLoader.load(tableFile);
            List<String> problems = TableValidator.validate(table, config.toVocabulary());
            if (!problems.isEmpty()) {
                problems.forEach(problem -> err.println("✗ " + problem));
                return 1;
            }

            EbdGraph graph = new TableToGraphConverter().convert(table);
            ValidationReport report = new ValidationReport(new GraphValidator().validate(graph));
            for (Finding finding : report.findings()) {
                err.println((finding.isFatal() ? "✗ " : "⚠ ") + finding.message());
            }
            if (report.hasFatal()) {
                return 1;
            }

            GeneratorConfig generatorConfig = config.toGeneratorConfig();
            if (ebdLinkTemplate != null) {
                generatorConfig = generatorConfig.withEbdLinkTemplate(ebdLinkTemplate);
            }
            GeneratedDiagram diagram = generator.get().generate(graph, generatorConfig);
            Path targetDir = outputDir != null ? outputDir
                : config.output() != null && config.output().directory() != null ? Paths.get(config.output().directory())
                : null;
            if (targetDir == null) {
                out.print(diagram.content());
                out.flush();
                return 0;
            }

            Files.createDirectories(targetDir);
            Path target = targetDir.resolve(diagram.fileName());
            Files.writeString(target, diagram.content(), StandardCharsets.UTF_8);
            log.info("Wrote {}", target);
            out.println("✓ Rendered " + table.metadata().ebdCode() + " to: " + target);
            return 0;
        } catch (TableLoadException | GraphConversionException e) {
            log.debug("Render failed", e);
            err.println("✗ " + e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("Failed to write diagram", e);
            err.println("✗ Render failed: " + e.getMessage());
            return 1;
        }
    }
}
