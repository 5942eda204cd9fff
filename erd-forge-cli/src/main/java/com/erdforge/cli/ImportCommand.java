package com.erdforge.cli;

import com.erdforge.core.config.ConfigLoader;
import com.erdforge.core.config.ProjectConfig;
import com.erdforge.core.dsl.DslPrinter;
import com.erdforge.core.graph.DiagramGraphReader;
import com.erdforge.core.graph.StructuralDefault;
import com.erdforge.core.graph.StructuralDefaultException;
import com.erdforge.core.json.ErdJson;
import com.erdforge.core.json.ErdJsonException;
import com.erdforge.core.json.ImportedDocument;
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
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Converts a JSON document from the diagram editor back into DSL text.
 *
 * <p>Accepts a complete export, a bare AST or a bare graph. When the diagram has to be read
 * back from a graph, any structural defaults applied are listed; with {@code --strict} (or
 * {@code reverse.strict} in the configuration) they fail the import instead.
 *
 * <pre>{@code
 * erdforge import diagram.json
 * erdforge import diagram.json -o model.erd --strict
 * }</pre>
 */
@Command(
    name = "import",
    description = "Convert editor JSON (export, AST or graph) to DSL",
    mixinStandardHelpOptions = true
)
public class ImportCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ImportCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "JSON file")
    private Path file;

    @Option(names = {"-o", "--output"}, description = "DSL file to write (default: print to stdout)")
    private Path outputFile;

    @Option(names = {"--strict"}, description = "Fail if relationship structure has to be defaulted")
    private boolean strict;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: erdforge.yaml)")
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            ProjectConfig config = ConfigLoader.load(configPath);
            boolean strictRead = strict || config.reverse().strict();

            ErdJson json = new ErdJson(new DiagramGraphReader(strictRead));
            ImportedDocument document = json.importDocument(Files.readString(file, StandardCharsets.UTF_8));
            log.info("Imported {} as {}", file, document.format());

            for (StructuralDefault applied : document.defaults()) {
                err.println("⚠ " + applied.describe());
            }

            String dsl = new DslPrinter().print(document.diagram()) + "\n";
            if (outputFile == null) {
                out.print(dsl);
            } else {
                Path parent = outputFile.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.writeString(outputFile, dsl, StandardCharsets.UTF_8);
                out.printf("✓ Wrote %s (%d entities, %d relationships)%n", outputFile,
                    document.diagram().entities().size(), document.diagram().relationships().size());
            }
            return 0;
        } catch (StructuralDefaultException e) {
            log.error("Strict import of {} failed", file);
            for (StructuralDefault applied : e.getDefaults()) {
                err.println("✗ " + applied.describe());
            }
            return 1;
        } catch (ErdJsonException | IOException e) {
            log.error("Import failed", e);
            err.println("✗ Import failed: " + e.getMessage());
            return 1;
        }
    }
}
