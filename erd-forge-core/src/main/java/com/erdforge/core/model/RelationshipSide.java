package com.erdforge.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One end of a relationship.
 *
 * @param entityName participating entity; empty when the side is not connected
 * @param cardinality one or many
 * @param participation total or partial
 */
public record RelationshipSide(
    @JsonProperty("entityName") String entityName,
    @JsonProperty("cardinality") Cardinality cardinality,
    @JsonProperty("participation") Participation participation
) {
    /**
     * Compact constructor applying the documented defaults.
     */
    public RelationshipSide {
        if (entityName == null) {
            entityName = "";
        }
        if (cardinality == null) {
            cardinality = Cardinality.ONE;
        }
        if (participation == null) {
            participation = Participation.PARTIAL;
        }
    }

    /**
     * Side with no connected entity and default cardinality and participation.
     *
     * @return unconnected side
     */
    public static RelationshipSide unconnected() {
        return new RelationshipSide("", Cardinality.ONE, Participation.PARTIAL);
    }

    public RelationshipSide withParticipation(Participation newParticipation) {
        return new RelationshipSide(entityName, cardinality, newParticipation);
    }
}
