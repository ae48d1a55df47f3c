package com.cmakeparser.json;

/**
 * Exception thrown when converting AST nodes or tokens to or from JSON fails.
 */
public class AstJsonException extends RuntimeException {

    public AstJsonException(String message) {
        super(message);
    }

    public AstJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
