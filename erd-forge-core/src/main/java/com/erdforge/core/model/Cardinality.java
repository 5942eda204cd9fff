package com.erdforge.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Multiplicity of one side of a relationship.
 */
public enum Cardinality {
    /** Exactly one, written {@code 1} */
    ONE("1"),

    /** Many, written {@code M} */
    MANY("M");

    private final String symbol;

    Cardinality(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Returns the DSL and JSON spelling of this cardinality.
     *
     * @return {@code "1"} or {@code "M"}
     */
    @JsonValue
    public String symbol() {
        return symbol;
    }

    /**
     * Resolves a cardinality from its DSL/JSON spelling.
     *
     * @param symbol {@code "1"} or {@code "M"}
     * @return matching cardinality
     * @throws IllegalArgumentException if the symbol is unknown
     */
    @JsonCreator
    public static Cardinality fromSymbol(String symbol) {
        for (Cardinality cardinality : values()) {
            if (cardinality.symbol.equals(symbol)) {
                return cardinality;
            }
        }
        throw new IllegalArgumentException("Unknown cardinality: " + symbol);
    }
}
