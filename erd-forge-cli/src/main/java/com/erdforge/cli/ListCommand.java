package com.erdforge.cli;

import com.erdforge.core.generator.DiagramGenerator;
import com.erdforge.core.renderer.OutputRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.Locale;
import java.util.ServiceLoader;
import java.util.TreeSet;
import java.util.concurrent.Callable;

/**
 * Lists the generators or renderers discovered through {@link ServiceLoader}.
 *
 * <pre>{@code
 * erdforge list generators
 * erdforge list renderers
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available generators or renderers",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Type to list: generators or renderers")
    private String type;

    @Override
    public Integer call() {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "generators", "generator" -> listGenerators();
            case "renderers", "renderer" -> listRenderers();
            default -> {
                log.error("Unknown type: {}. Use: generators or renderers", type);
                spec.commandLine().getErr().println("✗ Unknown type: " + type + ". Use: generators or renderers");
                yield 1;
            }
        };
    }

    private int listGenerators() {
        PrintWriter out = spec.commandLine().getOut();
        out.println("Available Generators:");
        out.println();

        boolean found = false;
        for (DiagramGenerator generator : ServiceLoader.load(DiagramGenerator.class)) {
            found = true;
            out.printf("  • %s (ID: %s)%n", generator.getDisplayName(), generator.getId());
            out.printf("    File Extension: .%s%n", generator.getFileExtension());
            out.printf("    Output Types: %s%n", new TreeSet<>(generator.getSupportedOutputTypes()));
            out.println();
        }

        if (!found) {
            out.println("  No generators found.");
        }
        return 0;
    }

    private int listRenderers() {
        PrintWriter out = spec.commandLine().getOut();
        out.println("Available Renderers:");
        out.println();

        boolean found = false;
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            found = true;
            out.printf("  • %s (%s)%n", renderer.getId(), renderer.getClass().getSimpleName());
        }

        if (!found) {
            out.println("  No renderers found.");
        }
        return 0;
    }
}
