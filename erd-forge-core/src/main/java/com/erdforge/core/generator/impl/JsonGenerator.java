package com.erdforge.core.generator.impl;

import com.erdforge.core.generator.DiagramGenerator;
import com.erdforge.core.generator.GeneratedDiagram;
import com.erdforge.core.generator.GeneratorConfig;
import com.erdforge.core.generator.OutputType;
import com.erdforge.core.graph.DiagramGraph;
import com.erdforge.core.graph.DiagramGraphBuilder;
import com.erdforge.core.graph.DiagramGraphReader;
import com.erdforge.core.json.ErdJson;
import com.erdforge.core.layout.RowLayoutEngine;
import com.erdforge.core.model.ErDiagram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;

/**
 * Emits the JSON interchange documents read by the diagram editor.
 *
 * <ul>
 *   <li>{@link OutputType#AST_JSON}: the diagram itself</li>
 *   <li>{@link OutputType#GRAPH_JSON}: the expanded graph, laid out with
 *       {@link GeneratorConfig#layout()}</li>
 *   <li>{@link OutputType#EXPORT_JSON}: both, as {@code { "ast": ..., "diagram": ... }}</li>
 * </ul>
 *
 * <p>Output is pretty-printed; the {@code indent: false} setting writes compact JSON.
 */
public class JsonGenerator implements DiagramGenerator {

    private static final Logger log = LoggerFactory.getLogger(JsonGenerator.class);

    private static final String GENERATOR_ID = "json";
    private static final String GENERATOR_DISPLAY_NAME = "JSON Interchange Generator";
    private static final String FILE_EXTENSION = "json";

    /** Setting: pretty-print the output, {@code true} unless set to {@code false} */
    static final String INDENT_SETTING = "indent";

    private final ErdJson indentedJson = new ErdJson(new DiagramGraphReader(), true);
    private final ErdJson compactJson = new ErdJson(new DiagramGraphReader(), false);
    private final DiagramGraphBuilder builder = new DiagramGraphBuilder();

    @Override
    public String getId() {
        return GENERATOR_ID;
    }

    @Override
    public String getDisplayName() {
        return GENERATOR_DISPLAY_NAME;
    }

    @Override
    public String getFileExtension() {
        return FILE_EXTENSION;
    }

    @Override
    public Set<OutputType> getSupportedOutputTypes() {
        return Set.of(OutputType.AST_JSON, OutputType.GRAPH_JSON, OutputType.EXPORT_JSON);
    }

    @Override
    public GeneratedDiagram generate(ErDiagram diagram, OutputType type, GeneratorConfig config) {
        Objects.requireNonNull(diagram, "diagram must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(config, "config must not be null");

        if (!getSupportedOutputTypes().contains(type)) {
            throw new IllegalArgumentException("Unsupported output type: " + type);
        }

        log.debug("Generating JSON document for type: {}", type);

        ErdJson json = indent(config) ? indentedJson : compactJson;
        String content = switch (type) {
            case AST_JSON -> json.writeDiagram(diagram);
            case GRAPH_JSON -> json.writeGraph(positionedGraph(diagram, config));
            case EXPORT_JSON -> json.writeExport(diagram, positionedGraph(diagram, config));
            default -> throw new IllegalArgumentException("Unsupported output type: " + type);
        };

        log.info("Generated JSON document: {}", type.fileStem());
        return new GeneratedDiagram(type.fileStem(), content + "\n", getFileExtension());
    }

    private static boolean indent(GeneratorConfig config) {
        Object indent = config.getSettingOrDefault(INDENT_SETTING, Boolean.TRUE);
        return !"false".equalsIgnoreCase(String.valueOf(indent));
    }

    private DiagramGraph positionedGraph(ErDiagram diagram, GeneratorConfig config) {
        return new RowLayoutEngine(config.layout()).layout(builder.build(diagram));
    }
}
