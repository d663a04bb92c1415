package com.ebdgraph.cli;

import com.ebdgraph.core.generator.DiagramGenerator;
import com.ebdgraph.core.generator.DiagramGenerators;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to list the available diagram generators.
 *
 * <p>Discovers generators via Java Service Provider Interface (SPI).
 */
@Command(
    name = "list",
    description = "List available diagram generators",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        out.println("Available Generators:");
        out.println();

        List<DiagramGenerator> generators = DiagramGenerators.all();
        for (DiagramGenerator generator : generators) {
            out.printf("  • %s (ID: %s)%n", generator.getDisplayName(), generator.getId());
            out.printf("    File Extension: .%s%n", generator.getFileExtension());
            out.println();
        }

        if (generators.isEmpty()) {
            out.println("  No generators found.");
        }
        out.flush();
        return 0;
    }
}
