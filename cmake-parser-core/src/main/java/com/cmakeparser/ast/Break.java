package com.cmakeparser.ast;

public record Break(
    int start,
    int end,
    int line,
    int column
) implements Builtin {
    @Override
    public String type() {
        return "Break";
    }
}
