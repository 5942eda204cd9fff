package com.erdforge.core.graph;

import com.erdforge.core.model.AttributeKind;
import com.erdforge.core.model.EntityKind;
import com.erdforge.core.model.RelationshipKind;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Discriminant of a {@link DiagramNode}.
 */
public enum NodeType {
    ENTITY("entity"),
    WEAK_ENTITY("weakEntity"),
    SIMPLE_ATTRIBUTE("simpleAttribute"),
    MULTIVALUED_ATTRIBUTE("multivaluedAttribute"),
    DERIVED_ATTRIBUTE("derivedAttribute"),
    COMPOSITE_ATTRIBUTE("compositeAttribute"),
    RELATIONSHIP("relationship"),
    IDENTIFYING_RELATIONSHIP("identifyingRelationship");

    private final String wireName;

    NodeType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static NodeType fromWireName(String wireName) {
        for (NodeType type : values()) {
            if (type.wireName.equals(wireName)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown node type: " + wireName);
    }

    public boolean isEntity() {
        return this == ENTITY || this == WEAK_ENTITY;
    }

    public boolean isRelationship() {
        return this == RELATIONSHIP || this == IDENTIFYING_RELATIONSHIP;
    }

    public boolean isAttribute() {
        return this == SIMPLE_ATTRIBUTE || this == MULTIVALUED_ATTRIBUTE
            || this == DERIVED_ATTRIBUTE || this == COMPOSITE_ATTRIBUTE;
    }

    public static NodeType of(EntityKind kind) {
        return kind == EntityKind.WEAK ? WEAK_ENTITY : ENTITY;
    }

    public static NodeType of(RelationshipKind kind) {
        return kind == RelationshipKind.IDENTIFYING ? IDENTIFYING_RELATIONSHIP : RELATIONSHIP;
    }

    /**
     * Maps an attribute kind to its node type. Typed attributes are drawn as simple ones;
     * the type name travels in {@link DiagramNode#dataType()}.
     *
     * @param kind attribute kind
     * @return attribute node type
     */
    public static NodeType of(AttributeKind kind) {
        return switch (kind) {
            case COMPOSITE -> COMPOSITE_ATTRIBUTE;
            case MULTIVALUED -> MULTIVALUED_ATTRIBUTE;
            case DERIVED -> DERIVED_ATTRIBUTE;
            case SIMPLE, TYPED -> SIMPLE_ATTRIBUTE;
        };
    }
}
