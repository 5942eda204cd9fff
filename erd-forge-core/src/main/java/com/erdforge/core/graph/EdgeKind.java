package com.erdforge.core.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Purpose of a {@link DiagramEdge}.
 */
public enum EdgeKind {
    /** Target is an attribute owned by the source */
    CONTAINMENT("containment"),

    /** Entity participates in a relationship */
    RELATIONAL("relational");

    private final String wireName;

    EdgeKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static EdgeKind fromWireName(String wireName) {
        for (EdgeKind kind : values()) {
            if (kind.wireName.equals(wireName)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown edge kind: " + wireName);
    }
}
