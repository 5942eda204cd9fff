package com.erdforge.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Key role an attribute plays in its entity.
 */
public enum KeyRole {
    /** Part of the primary key, written {@code PK} */
    PRIMARY("pk"),

    /** Reference to another entity's attribute, written {@code FK} */
    FOREIGN("fk"),

    /** No key role */
    NONE("none");

    private final String wireName;

    KeyRole(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static KeyRole fromWireName(String wireName) {
        for (KeyRole role : values()) {
            if (role.wireName.equals(wireName)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown key type: " + wireName);
    }
}
