package com.erdforge.core.layout;

import com.erdforge.core.graph.DiagramGraph;

/**
 * Computes initial coordinates for a diagram graph.
 *
 * <p>Implementations must be pure functions of the graph's topology: no randomness, and the
 * same graph always yields the same coordinates. The input graph is not modified.
 */
public interface LayoutEngine {

    /**
     * Positions every node of the graph.
     *
     * @param graph graph to position
     * @return a copy of the graph with bounds on every node
     */
    DiagramGraph layout(DiagramGraph graph);
}
