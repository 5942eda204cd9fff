package com.erdforge.core.dsl;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Converts ER DSL text into a token stream terminated by {@link TokenType#EOF}.
 *
 * <p>Lexing never fails. Characters that start no token are skipped, and so is a
 * single {@code -} that is not part of {@code ->} or {@code --}. {@code #} starts a
 * comment running to the end of the line. Newlines only advance the line counter.
 *
 * <p>A lexer instance is single-use: create one per input.
 *
 * <pre>{@code
 * List<Token> tokens = new Lexer("Entity Store:\n  store_id PK").tokenize();
 * }</pre>
 */
public class Lexer {

    private static final char EM_DASH = '—';

    private final String input;
    private final List<Token> tokens = new ArrayList<>();
    private int pos;
    private int line = 1;
    private int column = 1;

    public Lexer(String input) {
        this.input = Objects.requireNonNull(input, "input must not be null");
    }

    /**
     * Tokenizes the whole input.
     *
     * @return tokens in source order, ending with an EOF token
     */
    public List<Token> tokenize() {
        while (pos < input.length()) {
            skipBlanksAndComments();
            if (pos >= input.length()) {
                break;
            }

            char c = input.charAt(pos);
            if (c == '\n') {
                pos++;
                line++;
                column = 1;
            } else if (isIdentifierStart(c)) {
                readWord();
            } else if (isDigit(c)) {
                readNumber();
            } else if (c == '-' && peek(1) == '>') {
                emit(TokenType.ARROW, "->", 2);
            } else if (c == '-' && peek(1) == '-') {
                emit(TokenType.DASH, "--", 2);
            } else if (c == EM_DASH) {
                emit(TokenType.DASH, String.valueOf(EM_DASH), 1);
            } else {
                TokenType punctuation = punctuation(c);
                if (punctuation != null) {
                    emit(punctuation, String.valueOf(c), 1);
                } else {
                    advance();
                }
            }
        }

        tokens.add(new Token(TokenType.EOF, "", line, column));
        return List.copyOf(tokens);
    }

    private static TokenType punctuation(char c) {
        return switch (c) {
            case ':' -> TokenType.COLON;
            case '(' -> TokenType.LPAREN;
            case ')' -> TokenType.RPAREN;
            case ',' -> TokenType.COMMA;
            case '.' -> TokenType.DOT;
            case '+' -> TokenType.PLUS;
            default -> null;
        };
    }

    private void skipBlanksAndComments() {
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == ' ' || c == '\t' || c == '\r') {
                advance();
            } else if (c == '#') {
                while (pos < input.length() && input.charAt(pos) != '\n') {
                    advance();
                }
            } else {
                return;
            }
        }
    }

    private void readWord() {
        int startPos = pos;
        int startColumn = column;
        while (pos < input.length() && isIdentifierPart(input.charAt(pos))) {
            advance();
        }
        String word = input.substring(startPos, pos);
        tokens.add(new Token(TokenType.ofWord(word), word, line, startColumn));
    }

    private void readNumber() {
        int startPos = pos;
        int startColumn = column;
        while (pos < input.length() && isDigit(input.charAt(pos))) {
            advance();
        }
        String digits = input.substring(startPos, pos);
        TokenType type = digits.equals("1") ? TokenType.ONE : TokenType.NUMBER;
        tokens.add(new Token(type, digits, line, startColumn));
    }

    private void emit(TokenType type, String text, int length) {
        tokens.add(new Token(type, text, line, column));
        for (int i = 0; i < length; i++) {
            advance();
        }
    }

    private char peek(int offset) {
        int index = pos + offset;
        return index < input.length() ? input.charAt(index) : '\0';
    }

    private void advance() {
        pos++;
        column++;
    }

    private static boolean isIdentifierStart(char c) {
        return c == '_' || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
