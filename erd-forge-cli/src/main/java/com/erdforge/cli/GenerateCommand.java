package com.erdforge.cli;

import com.erdforge.core.config.ConfigLoader;
import com.erdforge.core.config.ProjectConfig;
import com.erdforge.core.dsl.DslSyntaxException;
import com.erdforge.core.dsl.Parser;
import com.erdforge.core.generator.DiagramGenerator;
import com.erdforge.core.generator.GeneratedDiagram;
import com.erdforge.core.generator.GeneratorConfig;
import com.erdforge.core.generator.OutputType;
import com.erdforge.core.model.ErDiagram;
import com.erdforge.core.renderer.GeneratedFile;
import com.erdforge.core.renderer.GeneratedOutput;
import com.erdforge.core.renderer.OutputRenderer;
import com.erdforge.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * Parses a DSL document and runs generators over it.
 *
 * <p>Generators are selected with {@code -t} (repeatable); without it the generators enabled
 * in the configuration run. Each generator produces one file per supported output type.
 *
 * <pre>{@code
 * erdforge generate model.erd
 * erdforge generate model.erd -t mermaid -t json -o docs/erd
 * erdforge generate model.erd -t dsl --console
 * }</pre>
 */
@Command(
    name = "generate",
    description = "Generate documents from a DSL file",
    mixinStandardHelpOptions = true
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "DSL file")
    private Path file;

    @Option(names = {"-t", "--type"}, description = "Generator id to run (repeatable, default: configured generators)")
    private List<String> generatorIds = new ArrayList<>();

    @Option(names = {"-o", "--output"}, description = "Output directory (overrides config)")
    private Path outputDir;

    @Option(names = {"--console"}, description = "Print documents instead of writing files")
    private boolean console;

    @Option(names = {"--no-color"}, description = "Disable ANSI colours in console output")
    private boolean noColor;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: erdforge.yaml)")
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            ProjectConfig config = ConfigLoader.load(configPath);

            ErDiagram diagram = Parser.parse(Files.readString(file, StandardCharsets.UTF_8));
            out.printf("✓ Parsed %d entities, %d relationships%n",
                diagram.entities().size(), diagram.relationships().size());

            List<DiagramGenerator> generators = selectGenerators(config);
            List<GeneratedDiagram> documents = generate(diagram, generators, config, out);
            out.println("✓ Generated " + documents.size() + " documents");

            GeneratedOutput output = new GeneratedOutput(documents.stream()
                .map(GeneratedFile::of)
                .collect(Collectors.toList()));

            String directory = outputDirectory(config);
            out.flush();
            render(output, directory);
            if (!console) {
                out.println("✓ Rendered output to: " + directory);
            }
            return 0;
        } catch (DslSyntaxException e) {
            log.error("Syntax error in {}: {}", file, e.getMessage());
            err.printf("✗ Syntax error in %s at line %d, column %d: %s%n",
                file, e.getLine(), e.getColumn(), e.getMessage());
            return 1;
        } catch (Exception e) {
            log.error("Generate failed", e);
            err.println("✗ Generate failed: " + e.getMessage());
            return 1;
        }
    }

    private List<DiagramGenerator> selectGenerators(ProjectConfig config) {
        List<DiagramGenerator> available = new ArrayList<>();
        ServiceLoader.load(DiagramGenerator.class).forEach(available::add);
        log.debug("Discovered {} generators", available.size());

        List<String> requested = generatorIds.isEmpty() ? config.generators().enabled() : generatorIds;
        List<DiagramGenerator> selected = new ArrayList<>();
        for (String id : requested) {
            DiagramGenerator generator = available.stream()
                .filter(g -> g.getId().equals(id))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown generator: " + id + ". Available: "
                    + available.stream().map(DiagramGenerator::getId).sorted().collect(Collectors.joining(", "))));
            selected.add(generator);
        }
        return selected;
    }

    private List<GeneratedDiagram> generate(ErDiagram diagram, List<DiagramGenerator> generators,
                                            ProjectConfig config, PrintWriter out) {
        List<GeneratedDiagram> documents = new ArrayList<>();

        for (DiagramGenerator generator : generators) {
            log.info("Running generator: {} ({})", generator.getDisplayName(), generator.getId());
            GeneratorConfig generatorConfig = new GeneratorConfig(config.project().name(), config.layout(),
                config.generators().settingsFor(generator.getId()));
            out.println("  → " + generator.getDisplayName());
            for (OutputType type : new TreeSet<>(generator.getSupportedOutputTypes())) {
                documents.add(generator.generate(diagram, type, generatorConfig));
            }
        }
        return documents;
    }

    private void render(GeneratedOutput output, String directory) {
        String rendererId = console ? "console" : "filesystem";
        OutputRenderer renderer = ServiceLoader.load(OutputRenderer.class).stream()
            .map(ServiceLoader.Provider::get)
            .filter(r -> rendererId.equals(r.getId()))
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("Renderer not found: " + rendererId));

        Map<String, String> settings = noColor ? Map.of("console.colors", "false") : Map.of();
        log.info("Rendering output with: {}", renderer.getId());
        renderer.render(output, new RenderContext(directory, settings));
    }

    private String outputDirectory(ProjectConfig config) {
        Path directory = outputDir != null ? outputDir : Paths.get(config.output().directory());
        return directory.toAbsolutePath().toString();
    }
}
