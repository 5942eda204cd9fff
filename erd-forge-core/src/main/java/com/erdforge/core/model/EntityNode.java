package com.erdforge.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Entity declaration.
 *
 * <p>Only weak entities carry {@code identifiedBy}; a strong entity always has an
 * empty list. A weak entity declared without an {@code Identified By} clause also
 * has an empty list.
 *
 * @param name unique entity name
 * @param kind strong or weak
 * @param attributes ordered attributes
 * @param identifiedBy foreign keys that jointly identify a weak entity
 */
public record EntityNode(
    @JsonProperty("name") String name,
    @JsonProperty("entityType") EntityKind kind,
    @JsonProperty("attributes") List<AttributeNode> attributes,
    @JsonProperty("identifiedBy") @JsonInclude(JsonInclude.Include.NON_EMPTY) List<ForeignKeyTarget> identifiedBy
) {
    /**
     * Compact constructor with validation.
     */
    public EntityNode {
        Objects.requireNonNull(name, "name must not be null");
        if (kind == null) {
            kind = EntityKind.STRONG;
        }
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
        identifiedBy = kind == EntityKind.WEAK && identifiedBy != null ? List.copyOf(identifiedBy) : List.of();
    }

    public static EntityNode strong(String name, List<AttributeNode> attributes) {
        return new EntityNode(name, EntityKind.STRONG, attributes, List.of());
    }

    public static EntityNode weak(String name, List<AttributeNode> attributes, List<ForeignKeyTarget> identifiedBy) {
        return new EntityNode(name, EntityKind.WEAK, attributes, identifiedBy);
    }
}
