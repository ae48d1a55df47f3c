package com.cmakeparser.ast;

import com.cmakeparser.Token;

import java.util.List;

/**
 * Argument tokens kept as written, either because the command has no dedicated
 * argument grammar or because they still hold variable references.
 */
public record UnparsedExpr(List<Token> args) implements Expr {
    public UnparsedExpr {
        args = List.copyOf(args);
    }

    @Override
    public String type() {
        return "UnparsedExpr";
    }
}
