package com.erdforge;

import ch.qos.logback.classic.Level;
import com.erdforge.cli.GenerateCommand;
import com.erdforge.cli.ImportCommand;
import com.erdforge.cli.InitCommand;
import com.erdforge.cli.ListCommand;
import com.erdforge.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParseResult;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;

/**
 * Main CLI entry point for ERD Forge.
 *
 * <p>ERD Forge parses entity-relationship documents written in a small DSL and turns them
 * into canonical DSL, JSON interchange documents for the diagram editor and Mermaid diagrams.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code init} - Write a configuration file and a sample document</li>
 *   <li>{@code validate} - Check a DSL document for syntax errors</li>
 *   <li>{@code generate} - Run generators over a DSL document</li>
 *   <li>{@code import} - Convert editor JSON back to DSL</li>
 *   <li>{@code list} - List available generators or renderers</li>
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
 * erdforge init
 * erdforge validate sample.erd
 * erdforge generate sample.erd -t mermaid -o docs/erd
 * erdforge import diagram.json -o model.erd
 * }</pre>
 */
@Command(
    name = "erdforge",
    mixinStandardHelpOptions = true,
    version = "ERD Forge 1.0.0-SNAPSHOT",
    description = "Entity-relationship diagrams from a text DSL",
    subcommands = {
        InitCommand.class,
        ValidateCommand.class,
        GenerateCommand.class,
        ImportCommand.class,
        ListCommand.class
    }
)
public class ErdForgeCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ErdForgeCLI.class);

    @Spec
    private CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        PrintWriter out = spec.commandLine().getOut();
        out.println("ERD Forge - Entity-relationship diagrams from a text DSL");
        out.println("Version: 1.0.0-SNAPSHOT");
        out.println();
        out.println("Use 'erdforge --help' to see available commands");
        out.println("Use 'erdforge <command> --help' for command-specific help");
        out.flush();
    }

    /**
     * Configures the Logback root level from the global options.
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
        log.debug("Log level set to {}", root.getLevel());
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with logging configured before any sub-command runs.
     *
     * @return command line ready to execute
     */
    public static CommandLine newCommandLine() {
        ErdForgeCLI cli = new ErdForgeCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy((ParseResult parseResult) -> {
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
