package com.erdforge.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of relationships in an ER diagram.
 */
public enum RelationshipKind {
    /** Ordinary association between two entities */
    NORMAL("normal"),

    /** Relationship that supplies part of a weak entity's identity */
    IDENTIFYING("identifying");

    private final String wireName;

    RelationshipKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static RelationshipKind fromWireName(String wireName) {
        for (RelationshipKind kind : values()) {
            if (kind.wireName.equals(wireName)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown relationship type: " + wireName);
    }
}
