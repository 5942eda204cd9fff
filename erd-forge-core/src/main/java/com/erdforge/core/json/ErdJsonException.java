package com.erdforge.core.json;

/**
 * Raised when an AST or graph payload cannot be read or written.
 */
public class ErdJsonException extends RuntimeException {

    public ErdJsonException(String message) {
        super(message);
    }

    public ErdJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
