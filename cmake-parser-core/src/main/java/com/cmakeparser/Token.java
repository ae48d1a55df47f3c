package com.cmakeparser;

/**
 * A lexical unit of a CMake script.
 *
 * <p>{@code value} is the decoded text: quotes and bracket delimiters are stripped,
 * line continuations inside quoted arguments are removed. It is {@code null} only for
 * {@link TokenKind#UNPARSEABLE}. {@code start} and {@code end} form the half-open
 * range of the token in the source; {@code line} and {@code column} are 1-based.
 */
public record Token(
    TokenKind kind,
    String value,
    int start,
    int end,
    int line,
    int column
) {
    public Token(TokenKind kind, String value) {
        this(kind, value, 0, 0, 0, 0);
    }

    /**
     * Returns a token at the same source position carrying a different value.
     * Variable substitution uses this so diagnostics still point at the original text.
     */
    public Token withValue(String newValue) {
        return new Token(kind, newValue, start, end, line, column);
    }

    public Span span() {
        return new Span(start, end);
    }

    public boolean is(TokenKind other) {
        return kind == other;
    }
}
