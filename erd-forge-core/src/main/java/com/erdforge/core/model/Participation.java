package com.erdforge.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Whether every instance of an entity must take part in a relationship.
 */
public enum Participation {
    /** Mandatory participation, drawn as a double line */
    TOTAL("total"),

    /** Optional participation; the default when a side omits it */
    PARTIAL("partial");

    private final String keyword;

    Participation(String keyword) {
        this.keyword = keyword;
    }

    @JsonValue
    public String keyword() {
        return keyword;
    }

    @JsonCreator
    public static Participation fromKeyword(String keyword) {
        for (Participation participation : values()) {
            if (participation.keyword.equals(keyword)) {
                return participation;
            }
        }
        throw new IllegalArgumentException("Unknown participation: " + keyword);
    }
}
