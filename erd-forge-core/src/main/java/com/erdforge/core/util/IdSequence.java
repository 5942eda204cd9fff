package com.erdforge.core.util;

/**
 * Monotonic id generator for graph nodes and edges.
 *
 * <p>Each transform creates its own sequence, so ids restart at 1 for every invocation and
 * the same input always yields the same ids. Not thread-safe; a sequence belongs to one
 * invocation.
 *
 * <pre>{@code
 * IdSequence ids = new IdSequence();
 * ids.nextNodeId(); // "node_1"
 * ids.nextEdgeId(); // "edge_1"
 * ids.nextNodeId(); // "node_2"
 * }</pre>
 */
public final class IdSequence {

    private static final String NODE_PREFIX = "node_";
    private static final String EDGE_PREFIX = "edge_";

    private int nodeCounter;
    private int edgeCounter;

    public String nextNodeId() {
        return NODE_PREFIX + (++nodeCounter);
    }

    public String nextEdgeId() {
        return EDGE_PREFIX + (++edgeCounter);
    }
}
