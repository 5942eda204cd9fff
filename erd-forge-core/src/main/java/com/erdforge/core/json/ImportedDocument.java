package com.erdforge.core.json;

import com.erdforge.core.graph.DiagramGraph;
import com.erdforge.core.graph.StructuralDefault;
import com.erdforge.core.model.ErDiagram;

import java.util.List;
import java.util.Objects;

/**
 * Result of importing a JSON payload of any supported shape.
 *
 * @param format shape the payload was recognised as
 * @param diagram imported or reconstructed diagram
 * @param graph imported or derived graph
 * @param defaults structural defaults applied when the diagram was read from a graph
 */
public record ImportedDocument(
    Format format,
    ErDiagram diagram,
    DiagramGraph graph,
    List<StructuralDefault> defaults
) {
    public ImportedDocument {
        Objects.requireNonNull(format, "format must not be null");
        Objects.requireNonNull(diagram, "diagram must not be null");
        Objects.requireNonNull(graph, "graph must not be null");
        defaults = defaults == null ? List.of() : List.copyOf(defaults);
    }

    /**
     * Recognised payload shapes.
     */
    public enum Format {
        /** {@code { "ast": ..., "diagram": ... }} */
        EXPORT,
        /** {@code { "entities": [...], "relationships": [...] }} */
        AST,
        /** {@code { "nodes": [...], "edges": [...] }} */
        GRAPH
    }
}
