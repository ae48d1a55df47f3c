package com.cmakeparser;

/**
 * Malformed condition: missing operand, unbalanced parentheses or an operator
 * without its argument.
 */
public class ExprException extends CMakeException {

    public ExprException(String message) {
        super(message);
    }

    public ExprException(String message, Token token) {
        super(token.line() > 0
            ? message + " at line " + token.line() + ", column " + token.column()
            : message + " near '" + token.value() + "'");
    }

    public ExprException(String message, Throwable cause) {
        super(message, cause);
    }
}
