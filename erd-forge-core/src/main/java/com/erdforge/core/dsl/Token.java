package com.erdforge.core.dsl;

import java.util.Objects;

/**
 * Lexical token with its 1-based source position.
 *
 * @param type token type
 * @param text source text of the token
 * @param line line number
 * @param column column of the first character
 */
public record Token(
    TokenType type,
    String text,
    int line,
    int column
) {
    public Token {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(text, "text must not be null");
    }

    /**
     * Describes the token for error messages, e.g. {@code IDENTIFIER 'name'}.
     *
     * @return human-readable description
     */
    public String describe() {
        if (type == TokenType.EOF) {
            return "EOF";
        }
        return type + " '" + text + "'";
    }
}
