package com.erdforge.core.graph;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised by a strict {@link DiagramGraphReader} when a graph can only be read by applying
 * structural defaults.
 */
public class StructuralDefaultException extends RuntimeException {

    private final List<StructuralDefault> defaults;

    public StructuralDefaultException(List<StructuralDefault> defaults) {
        super("Graph is missing relationship structure: " + defaults.stream()
            .map(StructuralDefault::describe)
            .collect(Collectors.joining("; ")));
        this.defaults = List.copyOf(defaults);
    }

    public List<StructuralDefault> getDefaults() {
        return defaults;
    }
}
