package com.erdforge.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Relationship declaration between two entities.
 *
 * <p>Both sides of an identifying relationship always have total participation;
 * the constructor enforces it regardless of the sides passed in.
 *
 * @param name relationship name
 * @param kind normal or identifying
 * @param left left-hand side as written in the DSL
 * @param right right-hand side as written in the DSL
 * @param verb label describing the relationship
 * @param attributes attributes owned by the relationship
 */
public record RelationshipNode(
    @JsonProperty("name") String name,
    @JsonProperty("relationshipType") RelationshipKind kind,
    @JsonProperty("leftSide") RelationshipSide left,
    @JsonProperty("rightSide") RelationshipSide right,
    @JsonProperty("verb") String verb,
    @JsonProperty("attributes") List<AttributeNode> attributes
) {
    /**
     * Compact constructor with validation.
     */
    public RelationshipNode {
        Objects.requireNonNull(name, "name must not be null");
        if (kind == null) {
            kind = RelationshipKind.NORMAL;
        }
        if (left == null) {
            left = RelationshipSide.unconnected();
        }
        if (right == null) {
            right = RelationshipSide.unconnected();
        }
        if (kind == RelationshipKind.IDENTIFYING) {
            left = left.withParticipation(Participation.TOTAL);
            right = right.withParticipation(Participation.TOTAL);
        }
        if (verb == null) {
            verb = name;
        }
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
    }

    public static RelationshipNode normal(String verb, RelationshipSide left, RelationshipSide right,
                                          List<AttributeNode> attributes) {
        return new RelationshipNode(verb, RelationshipKind.NORMAL, left, right, verb, attributes);
    }

    public static RelationshipNode identifying(String verb, RelationshipSide left, RelationshipSide right) {
        return new RelationshipNode(verb, RelationshipKind.IDENTIFYING, left, right, verb, List.of());
    }
}
