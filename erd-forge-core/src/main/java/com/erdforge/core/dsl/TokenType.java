package com.erdforge.core.dsl;

import java.util.Map;

/**
 * Token types produced by the {@link Lexer}.
 */
public enum TokenType {
    IDENTIFIER,
    NUMBER,

    // Keywords
    ENTITY,
    WEAK,
    RELATION,
    IDENTIFYING,
    COMPOSITE,
    MULTIVALUED,
    DERIVED,
    PK,
    FK,
    IDENTIFIED,
    BY,
    TOTAL,
    PARTIAL,
    /** Cardinality {@code M} */
    MANY,
    /** Cardinality {@code 1}; any other digit run is a {@link #NUMBER} */
    ONE,

    // Punctuation
    COLON,
    LPAREN,
    RPAREN,
    COMMA,
    DOT,
    PLUS,
    ARROW,
    /** Em-dash or double hyphen between relationship sides */
    DASH,

    EOF;

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
        Map.entry("Entity", ENTITY),
        Map.entry("Weak", WEAK),
        Map.entry("Relation", RELATION),
        Map.entry("Identifying", IDENTIFYING),
        Map.entry("Composite", COMPOSITE),
        Map.entry("Multivalued", MULTIVALUED),
        Map.entry("Derived", DERIVED),
        Map.entry("PK", PK),
        Map.entry("FK", FK),
        Map.entry("Identified", IDENTIFIED),
        Map.entry("By", BY),
        Map.entry("total", TOTAL),
        Map.entry("partial", PARTIAL),
        Map.entry("M", MANY)
    );

    /**
     * Classifies a word as a keyword or a plain identifier. Keywords are case-sensitive.
     *
     * @param word identifier-shaped word
     * @return keyword type, or {@link #IDENTIFIER}
     */
    public static TokenType ofWord(String word) {
        return KEYWORDS.getOrDefault(word, IDENTIFIER);
    }

    /**
     * Whether this token starts a top-level declaration.
     *
     * @return true for {@code Entity}, {@code Weak}, {@code Relation} and {@code Identifying}
     */
    public boolean startsDeclaration() {
        return this == ENTITY || this == WEAK || this == RELATION || this == IDENTIFYING;
    }
}
