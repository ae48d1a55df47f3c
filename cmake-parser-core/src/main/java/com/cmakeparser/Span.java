package com.cmakeparser;

/**
 * Half-open character range {@code [start, end)} into the parsed source.
 */
public record Span(int start, int end) {
    public Span {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }

    public String slice(String source) {
        return source.substring(start, Math.min(end, source.length()));
    }
}
