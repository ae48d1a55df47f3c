package com.cmakeparser.ast;

import com.cmakeparser.Token;

import java.util.List;

/**
 * Generic command invocation.
 *
 * <p>Variable expansion can split one token into several arguments or drop it,
 * so {@code args} are tokens, not final argument values.
 */
public record Command(
    int start,
    int end,
    int line,
    int column,
    String identifier,
    List<Token> args
) implements Node {
    public Command {
        args = List.copyOf(args);
    }

    public Command(String identifier, List<Token> args) {
        this(0, 0, 0, 0, identifier, args);
    }

    @Override
    public String type() {
        return "Command";
    }
}
