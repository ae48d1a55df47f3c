package com.cmakeparser;

/**
 * Malformed variable reference found while substituting variables in an argument.
 */
public class ResolveException extends CMakeException {
    private final int line;
    private final int column;
    private final String remainder;

    public ResolveException(String message, Token token, String remainder) {
        super(message + " at line " + token.line() + ", column " + token.column() + ": '" + remainder + "'");
        this.line = token.line();
        this.column = token.column();
        this.remainder = remainder;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    /**
     * The unterminated part of the argument, starting at the variable reference.
     */
    public String remainder() {
        return remainder;
    }
}
