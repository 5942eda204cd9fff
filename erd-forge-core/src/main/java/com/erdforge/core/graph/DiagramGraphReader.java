package com.erdforge.core.graph;

import com.erdforge.core.graph.StructuralDefault.Reason;
import com.erdforge.core.graph.StructuralDefault.Side;
import com.erdforge.core.model.AttributeKind;
import com.erdforge.core.model.AttributeNode;
import com.erdforge.core.model.Cardinality;
import com.erdforge.core.model.EntityKind;
import com.erdforge.core.model.EntityNode;
import com.erdforge.core.model.ErDiagram;
import com.erdforge.core.model.KeyRole;
import com.erdforge.core.model.Participation;
import com.erdforge.core.model.RelationshipKind;
import com.erdforge.core.model.RelationshipNode;
import com.erdforge.core.model.RelationshipSide;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Reconstructs an {@link ErDiagram} from a graph that the renderer may have edited.
 *
 * <p>Entities and relationships are recognised by node type, in graph order. Attributes are
 * recovered by following containment edges from their owner, recursively for composites.
 * The two sides of a relationship come from its incident relational edges: an edge ending at
 * the relationship supplies the left side from its source fields, an edge starting at it
 * supplies the right side from its target fields.
 *
 * <p>The reader is lenient: an unconnected side gets an empty entity reference, a missing
 * cardinality becomes {@code 1}, a missing participation {@code partial}, and the last of
 * several edges on one side wins. Every such default is logged and returned in the
 * {@link ReadResult}. A strict reader raises {@link StructuralDefaultException} instead.
 */
public class DiagramGraphReader {

    private static final Logger log = LoggerFactory.getLogger(DiagramGraphReader.class);

    private final boolean strict;

    public DiagramGraphReader() {
        this(false);
    }

    /**
     * Creates a reader.
     *
     * @param strict whether applying a structural default is a failure
     */
    public DiagramGraphReader(boolean strict) {
        this.strict = strict;
    }

    /**
     * Reads a graph back into a diagram.
     *
     * @param graph current graph
     * @return reconstructed diagram and the defaults applied
     * @throws StructuralDefaultException in strict mode, if any default had to be applied
     */
    public ReadResult read(DiagramGraph graph) {
        Objects.requireNonNull(graph, "graph must not be null");

        List<EntityNode> entities = new ArrayList<>();
        List<RelationshipNode> relationships = new ArrayList<>();
        List<StructuralDefault> defaults = new ArrayList<>();

        for (DiagramNode node : graph.nodes()) {
            if (node.type().isEntity()) {
                entities.add(readEntity(node, graph));
            }
        }
        for (DiagramNode node : graph.nodes()) {
            if (node.type().isRelationship()) {
                relationships.add(readRelationship(node, graph, defaults));
            }
        }

        for (StructuralDefault applied : defaults) {
            log.warn("Structural default: {}", applied.describe());
        }
        if (strict && !defaults.isEmpty()) {
            throw new StructuralDefaultException(defaults);
        }

        log.debug("Read {} entities and {} relationships from graph", entities.size(), relationships.size());
        return new ReadResult(new ErDiagram(entities, relationships), defaults);
    }

    /**
     * Reads a graph back into a diagram, discarding the default report.
     *
     * @param graph current graph
     * @return reconstructed diagram
     */
    public ErDiagram toDiagram(DiagramGraph graph) {
        return read(graph).diagram();
    }

    private EntityNode readEntity(DiagramNode node, DiagramGraph graph) {
        EntityKind kind = node.type() == NodeType.WEAK_ENTITY ? EntityKind.WEAK : EntityKind.STRONG;
        List<AttributeNode> attributes = readAttributes(graph, node.id(), new HashSet<>());
        return new EntityNode(node.label(), kind, attributes, node.identifiedBy());
    }

    private RelationshipNode readRelationship(DiagramNode node, DiagramGraph graph,
                                              List<StructuralDefault> defaults) {
        RelationshipKind kind = node.type() == NodeType.IDENTIFYING_RELATIONSHIP
            ? RelationshipKind.IDENTIFYING
            : RelationshipKind.NORMAL;
        String name = node.name() != null ? node.name() : node.label();

        DiagramEdge leftEdge = null;
        DiagramEdge rightEdge = null;
        for (DiagramEdge edge : graph.edgesOf(EdgeKind.RELATIONAL)) {
            if (!edge.touches(node.id()) || graph.node(edge.otherEnd(node.id())).isEmpty()) {
                continue;
            }
            if (!edge.sourceId().equals(node.id())) {
                if (leftEdge != null) {
                    defaults.add(new StructuralDefault(name, Side.LEFT, Reason.DUPLICATE_SIDE, edge.id()));
                }
                leftEdge = edge;
            } else if (!edge.targetId().equals(node.id())) {
                if (rightEdge != null) {
                    defaults.add(new StructuralDefault(name, Side.RIGHT, Reason.DUPLICATE_SIDE, edge.id()));
                }
                rightEdge = edge;
            }
        }

        boolean identifying = kind == RelationshipKind.IDENTIFYING;
        RelationshipSide left = leftEdge == null
            ? unconnected(name, Side.LEFT, defaults)
            : side(name, Side.LEFT, graph.node(leftEdge.sourceId()).orElseThrow(),
                leftEdge.sourceCardinality(), leftEdge.sourceParticipation(), identifying, defaults);
        RelationshipSide right = rightEdge == null
            ? unconnected(name, Side.RIGHT, defaults)
            : side(name, Side.RIGHT, graph.node(rightEdge.targetId()).orElseThrow(),
                rightEdge.targetCardinality(), rightEdge.targetParticipation(), identifying, defaults);

        List<AttributeNode> attributes = readAttributes(graph, node.id(), new HashSet<>());
        return new RelationshipNode(name, kind, left, right, node.label(), attributes);
    }

    private static RelationshipSide unconnected(String relationship, Side side, List<StructuralDefault> defaults) {
        defaults.add(new StructuralDefault(relationship, side, Reason.MISSING_SIDE, ""));
        return RelationshipSide.unconnected();
    }

    private static RelationshipSide side(String relationship, Side side, DiagramNode entity,
                                         Cardinality cardinality, Participation participation,
                                         boolean identifying, List<StructuralDefault> defaults) {
        if (cardinality == null) {
            cardinality = Cardinality.ONE;
            defaults.add(new StructuralDefault(relationship, side, Reason.MISSING_CARDINALITY,
                cardinality.symbol()));
        }
        // Identifying relationships force total participation, so nothing is defaulted there.
        if (participation == null && !identifying) {
            participation = Participation.PARTIAL;
            defaults.add(new StructuralDefault(relationship, side, Reason.MISSING_PARTICIPATION,
                participation.keyword()));
        }
        return new RelationshipSide(entity.label(), cardinality, participation);
    }

    private List<AttributeNode> readAttributes(DiagramGraph graph, String ownerId, Set<String> visited) {
        List<AttributeNode> attributes = new ArrayList<>();
        if (!visited.add(ownerId)) {
            log.debug("Containment cycle through node {}", ownerId);
            return attributes;
        }

        for (DiagramNode child : graph.childrenOf(ownerId)) {
            if (!child.type().isAttribute()) {
                continue;
            }
            AttributeKind kind = attributeKind(child);
            List<AttributeNode> subAttributes = kind == AttributeKind.COMPOSITE
                ? readAttributes(graph, child.id(), visited)
                : List.of();
            attributes.add(new AttributeNode(child.label(), kind, keyRole(child), child.dataType(),
                child.fkTarget(), subAttributes));
        }
        return attributes;
    }

    private static AttributeKind attributeKind(DiagramNode node) {
        return switch (node.type()) {
            case COMPOSITE_ATTRIBUTE -> AttributeKind.COMPOSITE;
            case MULTIVALUED_ATTRIBUTE -> AttributeKind.MULTIVALUED;
            case DERIVED_ATTRIBUTE -> AttributeKind.DERIVED;
            default -> node.dataType() != null ? AttributeKind.TYPED : AttributeKind.SIMPLE;
        };
    }

    private static KeyRole keyRole(DiagramNode node) {
        if (node.primaryKey()) {
            return KeyRole.PRIMARY;
        }
        return node.foreignKey() ? KeyRole.FOREIGN : KeyRole.NONE;
    }
}
