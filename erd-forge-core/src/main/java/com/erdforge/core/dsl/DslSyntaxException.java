package com.erdforge.core.dsl;

/**
 * Raised when ER DSL text cannot be parsed.
 *
 * <p>Parsing is all-or-nothing: when this is thrown no diagram is produced.
 */
public class DslSyntaxException extends RuntimeException {

    private final int line;
    private final int column;
    private final String expected;
    private final String actual;

    /**
     * Creates a syntax error at the position of the offending token.
     *
     * @param expected description of what the parser expected
     * @param token token actually found
     */
    public DslSyntaxException(String expected, Token token) {
        super("Expected " + expected + " but got " + token.describe()
            + " at line " + token.line() + ", column " + token.column());
        this.line = token.line();
        this.column = token.column();
        this.expected = expected;
        this.actual = token.describe();
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public String getExpected() {
        return expected;
    }

    public String getActual() {
        return actual;
    }
}
