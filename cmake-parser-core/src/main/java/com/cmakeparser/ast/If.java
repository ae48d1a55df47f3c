package com.cmakeparser.ast;

import java.util.List;

/**
 * Conditional block. An {@code elseif()} becomes the only element of
 * {@code ifFalse}, as a nested {@code If}.
 */
public record If(
    int start,
    int end,
    int line,
    int column,
    Expr args,
    List<Node> ifTrue,
    List<Node> ifFalse  // Null when there is no else() or elseif()
) implements Builtin {
    public If {
        ifTrue = List.copyOf(ifTrue);
        ifFalse = ifFalse != null ? List.copyOf(ifFalse) : null;
    }

    public boolean hasElse() {
        return ifFalse != null;
    }

    @Override
    public String type() {
        return "If";
    }
}
