package com.cmakeparser.ast;

public record Continue(
    int start,
    int end,
    int line,
    int column
) implements Builtin {
    @Override
    public String type() {
        return "Continue";
    }
}
