package com.cmakeparser.ast;

import java.util.List;

public record ForEach(
    int start,
    int end,
    int line,
    int column,
    Expr args,
    List<Node> body
) implements Compound {
    public ForEach {
        body = List.copyOf(body);
    }

    @Override
    public String type() {
        return "ForEach";
    }
}
