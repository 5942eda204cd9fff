package com.erdforge.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Attribute of an entity or relationship.
 *
 * <p>Composite attributes own their sub-attributes exclusively. Every other kind
 * carries an empty sub-attribute list.
 *
 * @param name attribute name
 * @param kind semantic kind
 * @param keyRole key role within the owning entity
 * @param dataType explicit scalar type name, or null
 * @param foreignKey referenced attribute for foreign keys, or null
 * @param subAttributes nested attributes of a composite attribute
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AttributeNode(
    @JsonProperty("name") String name,
    @JsonProperty("attributeType") AttributeKind kind,
    @JsonProperty("keyType") KeyRole keyRole,
    @JsonProperty("dataType") String dataType,
    @JsonProperty("fkTarget") ForeignKeyTarget foreignKey,
    @JsonProperty("subAttributes") @JsonInclude(JsonInclude.Include.NON_EMPTY) List<AttributeNode> subAttributes
) {
    /**
     * Compact constructor with validation.
     */
    public AttributeNode {
        Objects.requireNonNull(name, "name must not be null");
        if (kind == null) {
            kind = AttributeKind.SIMPLE;
        }
        if (keyRole == null) {
            keyRole = KeyRole.NONE;
        }
        if (kind == AttributeKind.COMPOSITE && subAttributes != null) {
            subAttributes = List.copyOf(subAttributes);
        } else {
            subAttributes = List.of();
        }
    }

    public static AttributeNode simple(String name) {
        return new AttributeNode(name, AttributeKind.SIMPLE, KeyRole.NONE, null, null, null);
    }

    public static AttributeNode primaryKey(String name) {
        return new AttributeNode(name, AttributeKind.SIMPLE, KeyRole.PRIMARY, null, null, null);
    }

    /**
     * Creates a foreign-key attribute.
     *
     * @param name attribute name
     * @param target referenced attribute, or null when the reference is not spelled out
     * @return foreign-key attribute
     */
    public static AttributeNode foreignKey(String name, ForeignKeyTarget target) {
        return new AttributeNode(name, AttributeKind.SIMPLE, KeyRole.FOREIGN, null, target, null);
    }

    public static AttributeNode composite(String name, List<AttributeNode> subAttributes) {
        return new AttributeNode(name, AttributeKind.COMPOSITE, KeyRole.NONE, null, null, subAttributes);
    }

    public static AttributeNode multivalued(String name) {
        return new AttributeNode(name, AttributeKind.MULTIVALUED, KeyRole.NONE, null, null, null);
    }

    public static AttributeNode derived(String name) {
        return new AttributeNode(name, AttributeKind.DERIVED, KeyRole.NONE, null, null, null);
    }

    public static AttributeNode typed(String name, String dataType) {
        return new AttributeNode(name, AttributeKind.TYPED, KeyRole.NONE, dataType, null, null);
    }

    /**
     * Counts this attribute and all of its nested sub-attributes.
     *
     * @return total number of attribute nodes rooted here
     */
    @JsonIgnore
    public int totalCount() {
        int count = 1;
        for (AttributeNode sub : subAttributes) {
            count += sub.totalCount();
        }
        return count;
    }
}
