package com.erdforge.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of entities in an ER diagram.
 */
public enum EntityKind {
    /** Entity with its own primary key */
    STRONG("strong"),

    /** Entity identified through foreign keys to its owners */
    WEAK("weak");

    private final String wireName;

    EntityKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static EntityKind fromWireName(String wireName) {
        for (EntityKind kind : values()) {
            if (kind.wireName.equals(wireName)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown entity type: " + wireName);
    }
}
