package com.erdforge.core.graph;

import com.erdforge.core.model.AttributeKind;
import com.erdforge.core.model.AttributeNode;
import com.erdforge.core.model.EntityKind;
import com.erdforge.core.model.EntityNode;
import com.erdforge.core.model.ErDiagram;
import com.erdforge.core.model.KeyRole;
import com.erdforge.core.model.RelationshipNode;
import com.erdforge.core.model.RelationshipSide;
import com.erdforge.core.util.IdSequence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Expands an {@link ErDiagram} into a {@link DiagramGraph}.
 *
 * <p>Single pass in document order:
 * <ol>
 *   <li>each entity becomes a node, followed by its attributes (depth first), each attribute
 *       linked to its owner by a containment edge</li>
 *   <li>each relationship becomes a node, followed by one relational edge per side and then
 *       its own attributes</li>
 * </ol>
 *
 * <p>The left side is encoded as an edge entity → relationship with source cardinality and
 * participation; the right side as relationship → entity with target cardinality and
 * participation. A side naming an undeclared entity produces no edge.
 *
 * <p>Ids come from a fresh {@link IdSequence} per call, so the builder is stateless and the
 * same diagram always yields the same graph.
 */
public class DiagramGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(DiagramGraphBuilder.class);

    /**
     * Builds the graph for a diagram.
     *
     * @param diagram parsed diagram
     * @return unpositioned graph
     */
    public DiagramGraph build(ErDiagram diagram) {
        Objects.requireNonNull(diagram, "diagram must not be null");

        Expansion expansion = new Expansion(new IdSequence());
        for (EntityNode entity : diagram.entities()) {
            expansion.addEntity(entity);
        }
        for (RelationshipNode relationship : diagram.relationships()) {
            expansion.addRelationship(relationship);
        }

        log.debug("Built diagram graph with {} nodes and {} edges",
            expansion.nodes.size(), expansion.edges.size());
        return new DiagramGraph(expansion.nodes, expansion.edges);
    }

    /**
     * Mutable state of one {@link #build(ErDiagram)} call.
     */
    private static final class Expansion {

        private final IdSequence ids;
        private final List<DiagramNode> nodes = new ArrayList<>();
        private final List<DiagramEdge> edges = new ArrayList<>();
        private final Map<String, String> entityIds = new HashMap<>();

        Expansion(IdSequence ids) {
            this.ids = ids;
        }

        void addEntity(EntityNode entity) {
            String nodeId = ids.nextNodeId();
            entityIds.putIfAbsent(entity.name(), nodeId);

            nodes.add(new DiagramNode(nodeId, NodeType.of(entity.kind()), entity.name(), entity.name(), null,
                false, false, null, null,
                entity.kind() == EntityKind.WEAK ? entity.identifiedBy() : List.of(),
                null, null, null, null));

            for (AttributeNode attribute : entity.attributes()) {
                addAttribute(attribute, nodeId);
            }
        }

        void addRelationship(RelationshipNode relationship) {
            String nodeId = ids.nextNodeId();
            nodes.add(new DiagramNode(nodeId, NodeType.of(relationship.kind()), relationship.verb(),
                relationship.name(), null, false, false, null, null, List.of(), null, null, null, null));

            RelationshipSide left = relationship.left();
            String leftEntityId = entityIds.get(left.entityName());
            if (leftEntityId != null) {
                edges.add(DiagramEdge.fromEntity(ids.nextEdgeId(), leftEntityId, nodeId,
                    left.cardinality(), left.participation()));
            } else {
                log.debug("Relationship '{}' refers to undeclared entity '{}'", relationship.name(), left.entityName());
            }

            RelationshipSide right = relationship.right();
            String rightEntityId = entityIds.get(right.entityName());
            if (rightEntityId != null) {
                edges.add(DiagramEdge.toEntity(ids.nextEdgeId(), nodeId, rightEntityId,
                    right.cardinality(), right.participation()));
            } else {
                log.debug("Relationship '{}' refers to undeclared entity '{}'", relationship.name(), right.entityName());
            }

            for (AttributeNode attribute : relationship.attributes()) {
                addAttribute(attribute, nodeId);
            }
        }

        void addAttribute(AttributeNode attribute, String ownerId) {
            String nodeId = ids.nextNodeId();
            nodes.add(new DiagramNode(nodeId, NodeType.of(attribute.kind()), attribute.name(), null, ownerId,
                attribute.keyRole() == KeyRole.PRIMARY,
                attribute.keyRole() == KeyRole.FOREIGN,
                attribute.foreignKey(),
                attribute.dataType(),
                List.of(), null, null, null, null));
            edges.add(DiagramEdge.containment(ids.nextEdgeId(), ownerId, nodeId));

            if (attribute.kind() == AttributeKind.COMPOSITE) {
                for (AttributeNode sub : attribute.subAttributes()) {
                    addAttribute(sub, nodeId);
                }
            }
        }
    }
}
