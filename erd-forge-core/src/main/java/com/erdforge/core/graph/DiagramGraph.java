package com.erdforge.core.graph;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * Node/edge graph handed to the canvas renderer.
 *
 * @param nodes vertices in document order
 * @param edges edges in creation order
 */
public record DiagramGraph(
    @JsonProperty("nodes") List<DiagramNode> nodes,
    @JsonProperty("edges") List<DiagramEdge> edges
) {
    /**
     * Compact constructor with validation.
     */
    public DiagramGraph {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
    }

    public Optional<DiagramNode> node(String id) {
        return nodes.stream().filter(n -> n.id().equals(id)).findFirst();
    }

    public List<DiagramEdge> edgesOf(EdgeKind kind) {
        return edges.stream().filter(e -> e.kind() == kind).toList();
    }

    /**
     * Returns the nodes reached from {@code ownerId} through containment edges, in edge order.
     *
     * @param ownerId owning node id
     * @return direct children of the owner
     */
    public List<DiagramNode> childrenOf(String ownerId) {
        return edges.stream()
            .filter(e -> e.kind() == EdgeKind.CONTAINMENT && e.sourceId().equals(ownerId))
            .map(e -> node(e.targetId()))
            .flatMap(Optional::stream)
            .toList();
    }
}
