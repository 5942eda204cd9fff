package com.erdforge.core.layout;

import com.erdforge.core.graph.Bounds;
import com.erdforge.core.graph.DiagramEdge;
import com.erdforge.core.graph.DiagramGraph;
import com.erdforge.core.graph.DiagramNode;
import com.erdforge.core.graph.EdgeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Single-row layout used to seed the canvas.
 *
 * <ul>
 *   <li>Entities sit on one horizontal row at a fixed step, in graph order.</li>
 *   <li>Each relationship sits one row below, at the mean x of the entities it is
 *       relationally connected to, or at a fixed default when it has none. Relational edges
 *       to anything other than an entity are ignored.</li>
 *   <li>Attributes form a band above their entity or below their relationship, centred on the
 *       owner's x. Sub-attributes of a composite repeat the centring one band further out.</li>
 * </ul>
 *
 * <p>Nodes that already have a size keep it; others get the configured default size for
 * their type. Attributes whose owner cannot be positioned are parked at a fixed fallback.
 */
public class RowLayoutEngine implements LayoutEngine {

    private static final Logger log = LoggerFactory.getLogger(RowLayoutEngine.class);

    private static final Point UNOWNED_ATTRIBUTE_POSITION = new Point(300, 300);

    private final LayoutSettings settings;

    public RowLayoutEngine() {
        this(LayoutSettings.defaults());
    }

    public RowLayoutEngine(LayoutSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    @Override
    public DiagramGraph layout(DiagramGraph graph) {
        Objects.requireNonNull(graph, "graph must not be null");

        Map<String, DiagramNode> nodesById = new HashMap<>();
        for (DiagramNode node : graph.nodes()) {
            nodesById.putIfAbsent(node.id(), node);
        }
        Map<String, List<String>> attributesByOwner = attributesByOwner(graph, nodesById);

        Map<String, Point> positions = new HashMap<>();
        placeEntities(graph, positions);
        placeRelationships(graph, positions);

        Set<String> placed = new HashSet<>();
        for (DiagramNode node : graph.nodes()) {
            Point owner = positions.get(node.id());
            if (owner == null || node.type().isAttribute()) {
                continue;
            }
            List<String> attributes = attributesByOwner.getOrDefault(node.id(), List.of());
            if (node.type().isEntity()) {
                placeBand(attributes, owner.x(), owner.y() - settings.verticalSpacing(),
                    settings.attributeSpacing(), -1, attributesByOwner, positions, placed);
            } else {
                placeBand(attributes, owner.x(), owner.y() + settings.verticalSpacing(),
                    settings.attributeSpacing(), 1, attributesByOwner, positions, placed);
            }
        }

        List<DiagramNode> positioned = new ArrayList<>(graph.nodes().size());
        for (DiagramNode node : graph.nodes()) {
            Point point = positions.getOrDefault(node.id(), UNOWNED_ATTRIBUTE_POSITION);
            positioned.add(node.withBounds(boundsFor(node, point)));
        }

        log.debug("Laid out {} nodes", positioned.size());
        return new DiagramGraph(positioned, graph.edges());
    }

    private void placeEntities(DiagramGraph graph, Map<String, Point> positions) {
        double x = settings.firstEntityX();
        for (DiagramNode node : graph.nodes()) {
            if (node.type().isEntity()) {
                positions.put(node.id(), new Point(x, settings.entityRowY()));
                x += settings.horizontalSpacing();
            }
        }
    }

    private void placeRelationships(DiagramGraph graph, Map<String, Point> positions) {
        List<DiagramEdge> relational = graph.edgesOf(EdgeKind.RELATIONAL);
        double y = settings.entityRowY() + settings.relationshipOffset();

        for (DiagramNode node : graph.nodes()) {
            if (!node.type().isRelationship()) {
                continue;
            }
            double sum = 0;
            int count = 0;
            for (DiagramEdge edge : relational) {
                if (!edge.touches(node.id())) {
                    continue;
                }
                String otherId = edge.otherEnd(node.id());
                boolean entityEnd = graph.node(otherId).map(other -> other.type().isEntity()).orElse(false);
                Point other = positions.get(otherId);
                if (entityEnd && other != null) {
                    sum += other.x();
                    count++;
                }
            }
            double x = count > 0 ? sum / count : settings.defaultRelationshipX();
            positions.put(node.id(), new Point(x, y));
        }
    }

    /**
     * Places a sibling group centred on {@code centerX}, then recurses into each member's own
     * attributes one band further in {@code direction} (-1 up, +1 down).
     */
    private void placeBand(List<String> attributeIds, double centerX, double bandY, double spacing, int direction,
                           Map<String, List<String>> attributesByOwner, Map<String, Point> positions,
                           Set<String> placed) {
        double startX = centerX - (attributeIds.size() - 1) * spacing / 2;

        for (int i = 0; i < attributeIds.size(); i++) {
            String attributeId = attributeIds.get(i);
            if (!placed.add(attributeId)) {
                continue;
            }
            double x = startX + i * spacing;
            positions.put(attributeId, new Point(x, bandY));

            List<String> nested = attributesByOwner.getOrDefault(attributeId, List.of());
            if (!nested.isEmpty()) {
                placeBand(nested, x, bandY + direction * settings.nestedBandOffset(),
                    settings.nestedAttributeSpacing(), direction, attributesByOwner, positions, placed);
            }
        }
    }

    /**
     * Groups attribute ids by owner following containment edges. An attribute claimed by more
     * than one owner stays with the first.
     */
    private static Map<String, List<String>> attributesByOwner(DiagramGraph graph,
                                                               Map<String, DiagramNode> nodesById) {
        Map<String, List<String>> groups = new LinkedHashMap<>();
        Set<String> owned = new HashSet<>();
        for (DiagramEdge edge : graph.edgesOf(EdgeKind.CONTAINMENT)) {
            DiagramNode target = nodesById.get(edge.targetId());
            if (target == null || !target.type().isAttribute() || !owned.add(target.id())) {
                continue;
            }
            groups.computeIfAbsent(edge.sourceId(), k -> new ArrayList<>()).add(target.id());
        }
        return groups;
    }

    private Bounds boundsFor(DiagramNode node, Point point) {
        if (node.hasSize()) {
            return new Bounds(point.x(), point.y(), node.width(), node.height());
        }
        if (node.type().isEntity()) {
            return new Bounds(point.x(), point.y(), settings.entityWidth(), settings.entityHeight());
        }
        if (node.type().isRelationship()) {
            return new Bounds(point.x(), point.y(), settings.relationshipWidth(), settings.relationshipHeight());
        }
        return new Bounds(point.x(), point.y(), settings.attributeWidth(), settings.attributeHeight());
    }

    private record Point(double x, double y) {
    }
}
