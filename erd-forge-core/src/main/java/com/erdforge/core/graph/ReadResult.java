package com.erdforge.core.graph;

import com.erdforge.core.model.ErDiagram;

import java.util.List;
import java.util.Objects;

/**
 * Diagram read back from a graph, with the defaults applied along the way.
 *
 * @param diagram reconstructed diagram
 * @param defaults structural defaults applied, in graph order
 */
public record ReadResult(
    ErDiagram diagram,
    List<StructuralDefault> defaults
) {
    public ReadResult {
        Objects.requireNonNull(diagram, "diagram must not be null");
        defaults = defaults == null ? List.of() : List.copyOf(defaults);
    }

    public boolean isClean() {
        return defaults.isEmpty();
    }
}
