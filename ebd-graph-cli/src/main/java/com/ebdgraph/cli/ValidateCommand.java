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
import com.ebdgraph.core.graph.EbdGraph;
import com.ebdgraph.core.loader.TableLoadException;
import com.ebdgraph.core.loader.TableLoader;
import com.ebdgraph.core.table.EbdTable;
import com.ebdgraph.core.table.TableValidator;
import com.ebdgraph.core.validation.Finding;
import com.ebdgraph.core.validation.GraphValidator;
import com.ebdgraph.core.validation.ValidationReport;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to check a decision table without rendering it.
 *
 * <p>Exit codes: 0 valid (warnings allowed), 1 table could not be loaded, 2 table problems or
 * fatal graph findings.
 */
@Command(
    name = "validate",
    description = "Report table problems and graph findings",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    static final int EXIT_INVALID = 2;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Table file (.json, .yaml or .yml)")
    private Path tableFile;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: ebdgraph.yaml)")
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        EbdGraphConfig config = ConfigLoader.load(configPath);

        EbdTable table;
        try {
            table = TableLoader.load(tableFile);
        } catch (TableLoadException e) {
            log.debug("Loading failed", e);
            spec.commandLine().getErr().println("✗ " + e.getMessage());
            return 1;
        }

        List<String> problems = TableValidator.validate(table, config.toVocabulary());
        if (!problems.isEmpty()) {
            problems.forEach(problem -> out.println("✗ " + problem));
            return EXIT_INVALID;
        }

        EbdGraph graph;
        try {
            graph = new TableToGraphConverter().convert(table);
        } catch (GraphConversionException e) {
            out.println("✗ " + e.getMessage());
            return EXIT_INVALID;
        }

        ValidationReport report = new ValidationReport(new GraphValidator().validate(graph));
        for (Finding finding : report.findings()) {
            out.println((finding.isFatal() ? "✗ " : "⚠ ") + finding.kind() + " " + finding.elementId() + ": " + finding.message());
        }
        if (report.hasFatal()) {
            out.println("✗ " + table.metadata().ebdCode() + ": " + report.fatal().size() + " fatal findings");
            return EXIT_INVALID;
        }
        out.println("✓ " + table.metadata().ebdCode() + " is valid (" + graph.nodes().size() + " nodes, "
            + graph.edges().size() + " edges, " + report.warnings().size() + " warnings)");
        return 0;
    }
}
