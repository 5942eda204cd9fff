package com.erdforge.core;

import com.erdforge.core.config.ProjectConfig;
import com.erdforge.core.dsl.DslPrinter;
import com.erdforge.core.dsl.Parser;
import com.erdforge.core.graph.DiagramGraph;
import com.erdforge.core.graph.DiagramGraphBuilder;
import com.erdforge.core.graph.DiagramGraphReader;
import com.erdforge.core.graph.ReadResult;
import com.erdforge.core.layout.LayoutEngine;
import com.erdforge.core.layout.LayoutSettings;
import com.erdforge.core.layout.RowLayoutEngine;
import com.erdforge.core.model.ErDiagram;

import java.util.Objects;

/**
 * Entry point wiring the DSL, graph and layout stages together.
 *
 * <p>Forward: {@code text -> parse -> ErDiagram -> toGraph -> layout -> positioned graph}.
 * Backward, after the canvas edits the graph: {@code graph -> toDiagram -> print -> text}.
 *
 * <p>Every stage is stateless, so one pipeline can be shared between threads.
 *
 * <pre>{@code
 * ErdPipeline pipeline = ErdPipeline.from(ConfigLoader.load(Paths.get("erdforge.yaml")));
 * DiagramGraph graph = pipeline.layout(pipeline.toGraph(pipeline.parse(text)));
 * String text = pipeline.toDsl(editedGraph);
 * }</pre>
 */
public class ErdPipeline {

    private final DslPrinter printer;
    private final DiagramGraphBuilder builder;
    private final DiagramGraphReader reader;
    private final LayoutEngine layoutEngine;

    public ErdPipeline() {
        this(new RowLayoutEngine(), new DiagramGraphReader());
    }

    public ErdPipeline(LayoutEngine layoutEngine, DiagramGraphReader reader) {
        this.layoutEngine = Objects.requireNonNull(layoutEngine, "layoutEngine must not be null");
        this.reader = Objects.requireNonNull(reader, "reader must not be null");
        this.printer = new DslPrinter();
        this.builder = new DiagramGraphBuilder();
    }

    /**
     * Creates a pipeline using the layout and reverse settings of a configuration.
     *
     * @param config project configuration
     * @return configured pipeline
     */
    public static ErdPipeline from(ProjectConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        return of(config.layout(), config.reverse().strict());
    }

    public static ErdPipeline of(LayoutSettings settings, boolean strict) {
        return new ErdPipeline(new RowLayoutEngine(settings), new DiagramGraphReader(strict));
    }

    /**
     * Parses DSL text.
     *
     * @param source DSL text
     * @return parsed diagram
     * @throws com.erdforge.core.dsl.DslSyntaxException if the text is invalid
     */
    public ErDiagram parse(String source) {
        return Parser.parse(source);
    }

    public String print(ErDiagram diagram) {
        return printer.print(diagram);
    }

    public DiagramGraph toGraph(ErDiagram diagram) {
        return builder.build(diagram);
    }

    public DiagramGraph layout(DiagramGraph graph) {
        return layoutEngine.layout(graph);
    }

    /**
     * Parses, expands and lays out DSL text in one call.
     *
     * @param source DSL text
     * @return positioned graph
     */
    public DiagramGraph render(String source) {
        return layout(toGraph(parse(source)));
    }

    /**
     * Reads a graph back into a diagram, reporting any structural defaults applied.
     *
     * @param graph edited graph
     * @return diagram and defaults
     * @throws com.erdforge.core.graph.StructuralDefaultException if the reader is strict and a
     *         default was needed
     */
    public ReadResult read(DiagramGraph graph) {
        return reader.read(graph);
    }

    public ErDiagram toDiagram(DiagramGraph graph) {
        return reader.toDiagram(graph);
    }

    /**
     * Prints the DSL text for an edited graph.
     *
     * @param graph edited graph
     * @return canonical DSL text
     */
    public String toDsl(DiagramGraph graph) {
        return print(toDiagram(graph));
    }
}
