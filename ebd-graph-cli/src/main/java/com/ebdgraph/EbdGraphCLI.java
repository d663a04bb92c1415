package com.ebdgraph;

import com.ebdgraph.cli.ListCommand;
import com.ebdgraph.cli.RenderCommand;
import com.ebdgraph.cli.ValidateCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point.
 *
 * <p>Turns digitized EBD decision tables into Graphviz DOT or Mermaid diagrams.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code render} - Convert a table and write the diagram</li>
 *   <li>{@code validate} - Report table problems and graph findings</li>
 *   <li>{@code list} - List available diagram generators</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Render E_0003 as DOT into ./diagrams
 * ebdgraph render E_0003.json -o diagrams
 *
 * # Print a Mermaid flowchart
 * ebdgraph render E_0003.yaml -f mermaid
 *
 * # Check a table
 * ebdgraph validate E_0003.json
 * }</pre>
 */
@Command(
    name = "ebdgraph",
    mixinStandardHelpOptions = true,
    version = "EBD Graph 1.0.0-SNAPSHOT",
    description = "Converts EBD decision tables into validated graphs and diagrams",
    subcommands = {
        RenderCommand.class,
        ValidateCommand.class,
        ListCommand.class
    }
)
public class EbdGraphCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(EbdGraphCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("EBD Graph - decision table to diagram converter");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'ebdgraph --help' to see available commands");
        System.out.println("Use 'ebdgraph <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Logging configured (verbose={}, quiet={})", verbose, quiet);
    }

    /**
     * Returns whether verbose mode is enabled.
     *
     * @return true if verbose mode is enabled
     */
    public boolean isVerbose() {
        return verbose;
    }

    /**
     * Returns whether quiet mode is enabled.
     *
     * @return true if quiet mode is enabled
     */
    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line, applying the global logging options before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine newCommandLine() {
        EbdGraphCLI cli = new EbdGraphCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = newCommandLine().execute(args);
        System.exit(exitCode);
    }
}
