package com.erdforge.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Semantic kinds of attributes.
 */
public enum AttributeKind {
    /** Plain single-valued attribute */
    SIMPLE("simple"),

    /** Attribute made of nested sub-attributes */
    COMPOSITE("composite"),

    /** Attribute holding a set of values */
    MULTIVALUED("multivalued"),

    /** Attribute computed from other data */
    DERIVED("derived"),

    /** Simple attribute with an explicit scalar type name */
    TYPED("typed");

    private final String wireName;

    AttributeKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static AttributeKind fromWireName(String wireName) {
        for (AttributeKind kind : values()) {
            if (kind.wireName.equals(wireName)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown attribute type: " + wireName);
    }
}
