package com.erdforge.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * Abstract syntax tree of an ER document.
 *
 * <p>Produced fresh by every parse and immutable once built. Entities and
 * relationships keep document order.
 *
 * @param entities entity declarations
 * @param relationships relationship declarations
 */
public record ErDiagram(
    @JsonProperty("entities") List<EntityNode> entities,
    @JsonProperty("relationships") List<RelationshipNode> relationships
) {
    /**
     * Compact constructor with validation.
     */
    public ErDiagram {
        entities = entities == null ? List.of() : List.copyOf(entities);
        relationships = relationships == null ? List.of() : List.copyOf(relationships);
    }

    public static ErDiagram empty() {
        return new ErDiagram(List.of(), List.of());
    }

    public Optional<EntityNode> findEntity(String name) {
        return entities.stream().filter(e -> e.name().equals(name)).findFirst();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return entities.isEmpty() && relationships.isEmpty();
    }
}
