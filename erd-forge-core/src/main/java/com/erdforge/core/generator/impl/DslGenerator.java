package com.erdforge.core.generator.impl;

import com.erdforge.core.dsl.DslPrinter;
import com.erdforge.core.generator.DiagramGenerator;
import com.erdforge.core.generator.GeneratedDiagram;
import com.erdforge.core.generator.GeneratorConfig;
import com.erdforge.core.generator.OutputType;
import com.erdforge.core.model.ErDiagram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;

/**
 * Emits the canonical DSL text of a diagram.
 *
 * <p>Useful to normalise hand-written documents: comments are dropped, keywords and
 * indentation are made uniform, and defaulted participation is spelled out.
 */
public class DslGenerator implements DiagramGenerator {

    private static final Logger log = LoggerFactory.getLogger(DslGenerator.class);

    private static final String GENERATOR_ID = "dsl";
    private static final String GENERATOR_DISPLAY_NAME = "Canonical DSL Generator";
    private static final String FILE_EXTENSION = "erd";

    private final DslPrinter printer = new DslPrinter();

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
        return Set.of(OutputType.DSL);
    }

    @Override
    public GeneratedDiagram generate(ErDiagram diagram, OutputType type, GeneratorConfig config) {
        Objects.requireNonNull(diagram, "diagram must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(config, "config must not be null");

        if (!getSupportedOutputTypes().contains(type)) {
            throw new IllegalArgumentException("Unsupported output type: " + type);
        }

        String text = printer.print(diagram);
        String content = text.isEmpty() ? "" : text + "\n";
        log.info("Generated DSL document with {} entities and {} relationships",
            diagram.entities().size(), diagram.relationships().size());

        return new GeneratedDiagram(type.fileStem(), content, getFileExtension());
    }
}
