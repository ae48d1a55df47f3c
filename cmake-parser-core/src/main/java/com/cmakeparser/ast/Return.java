package com.cmakeparser.ast;

import com.cmakeparser.Token;

import java.util.List;

public record Return(
    int start,
    int end,
    int line,
    int column,
    List<Token> args
) implements Builtin {
    public Return {
        args = List.copyOf(args);
    }

    @Override
    public String type() {
        return "Return";
    }
}
