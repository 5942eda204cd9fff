package com.erdforge.core.json;

import com.erdforge.core.graph.DiagramGraph;
import com.erdforge.core.model.ErDiagram;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Complete export: the diagram together with the graph as currently drawn.
 *
 * @param ast diagram
 * @param diagram positioned graph
 */
public record ExportDocument(
    @JsonProperty("ast") ErDiagram ast,
    @JsonProperty("diagram") DiagramGraph diagram
) {
    public ExportDocument {
        Objects.requireNonNull(ast, "ast must not be null");
        Objects.requireNonNull(diagram, "diagram must not be null");
    }
}
