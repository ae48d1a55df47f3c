package com.cmakeparser.ast;

public record Comment(
    int start,
    int end,
    int line,
    int column,
    String comment
) implements Node {
    public Comment(String comment) {
        this(0, 0, 0, 0, comment);
    }

    @Override
    public String type() {
        return "Comment";
    }
}
