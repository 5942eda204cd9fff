package com.erdforge.core.graph;

import com.erdforge.core.model.Cardinality;
import com.erdforge.core.model.Participation;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Directed edge of a {@link DiagramGraph}.
 *
 * <p>The kind is explicit. Payloads written without a {@code kind} are classified by field
 * presence: an edge carrying any cardinality or participation is relational, every other
 * edge is containment.
 *
 * @param id unique edge id
 * @param sourceId source node id
 * @param targetId target node id
 * @param kind containment or relational
 * @param label optional display label
 * @param sourceCardinality cardinality at the source end, or null
 * @param targetCardinality cardinality at the target end, or null
 * @param sourceParticipation participation at the source end, or null
 * @param targetParticipation participation at the target end, or null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DiagramEdge(
    @JsonProperty("id") String id,
    @JsonProperty("sourceId") String sourceId,
    @JsonProperty("targetId") String targetId,
    @JsonProperty("kind") EdgeKind kind,
    @JsonProperty("label") String label,
    @JsonProperty("sourceCardinality") Cardinality sourceCardinality,
    @JsonProperty("targetCardinality") Cardinality targetCardinality,
    @JsonProperty("sourceParticipation") Participation sourceParticipation,
    @JsonProperty("targetParticipation") Participation targetParticipation
) {
    /**
     * Compact constructor with validation.
     */
    public DiagramEdge {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(sourceId, "sourceId must not be null");
        Objects.requireNonNull(targetId, "targetId must not be null");
        if (kind == null) {
            boolean relational = sourceCardinality != null || targetCardinality != null
                || sourceParticipation != null || targetParticipation != null;
            kind = relational ? EdgeKind.RELATIONAL : EdgeKind.CONTAINMENT;
        }
    }

    public static DiagramEdge containment(String id, String ownerId, String attributeId) {
        return new DiagramEdge(id, ownerId, attributeId, EdgeKind.CONTAINMENT, null, null, null, null, null);
    }

    /**
     * Edge from an entity to a relationship, carrying the entity's side at the source end.
     */
    public static DiagramEdge fromEntity(String id, String entityId, String relationshipId,
                                         Cardinality cardinality, Participation participation) {
        return new DiagramEdge(id, entityId, relationshipId, EdgeKind.RELATIONAL, null,
            cardinality, null, participation, null);
    }

    /**
     * Edge from a relationship to an entity, carrying the entity's side at the target end.
     */
    public static DiagramEdge toEntity(String id, String relationshipId, String entityId,
                                       Cardinality cardinality, Participation participation) {
        return new DiagramEdge(id, relationshipId, entityId, EdgeKind.RELATIONAL, null,
            null, cardinality, null, participation);
    }

    public boolean touches(String nodeId) {
        return sourceId.equals(nodeId) || targetId.equals(nodeId);
    }

    /**
     * Returns the endpoint that is not {@code nodeId}.
     *
     * @param nodeId one endpoint of this edge
     * @return the other endpoint
     */
    public String otherEnd(String nodeId) {
        return sourceId.equals(nodeId) ? targetId : sourceId;
    }
}
