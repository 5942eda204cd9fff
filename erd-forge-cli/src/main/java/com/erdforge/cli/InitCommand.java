package com.erdforge.cli;

import com.erdforge.core.config.ConfigLoader;
import com.erdforge.core.util.SampleDocuments;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Writes a starter {@code erdforge.yaml} and {@code sample.erd} into a directory.
 *
 * <pre>{@code
 * erdforge init
 * erdforge init my-model --force
 * }</pre>
 */
@Command(
    name = "init",
    description = "Write a configuration file and a sample DSL document",
    mixinStandardHelpOptions = true
)
public class InitCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(InitCommand.class);

    static final String SAMPLE_FILE_NAME = "sample.erd";

    static final String CONFIG_TEMPLATE = """
        # ERD Forge configuration
        project:
          name: "Entity-Relationship Diagram"

        layout:
          entityRowY: 250
          firstEntityX: 100
          horizontalSpacing: 200
          verticalSpacing: 100
          relationshipOffset: 150
          attributeSpacing: 50

        reverse:
          # Fail instead of filling in missing relationship structure on import
          strict: false

        generators:
          enabled:
            - dsl
            - json
            - mermaid
          settings:
            json:
              indent: true
            mermaid:
              # One of TB, BT, LR, RL
              direction: TB

        output:
          directory: "./docs/erd"
        """;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Target directory (default: current directory)", defaultValue = ".")
    private Path directory;

    @Option(names = {"-f", "--force"}, description = "Overwrite existing files")
    private boolean force;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        Path configFile = directory.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Path sampleFile = directory.resolve(SAMPLE_FILE_NAME);

        if (!force) {
            for (Path existing : List.of(configFile, sampleFile)) {
                if (Files.exists(existing)) {
                    err.println("✗ File already exists: " + existing + " (use --force to overwrite)");
                    return 1;
                }
            }
        }

        try {
            Files.createDirectories(directory);
            Files.writeString(configFile, CONFIG_TEMPLATE, StandardCharsets.UTF_8);
            out.println("✓ Created " + configFile);
            Files.writeString(sampleFile, SampleDocuments.sample(), StandardCharsets.UTF_8);
            out.println("✓ Created " + sampleFile);
            log.info("Initialized ERD Forge project in {}", directory.toAbsolutePath());
            return 0;
        } catch (IOException e) {
            log.error("Init failed", e);
            err.println("✗ Init failed: " + e.getMessage());
            return 1;
        }
    }
}
