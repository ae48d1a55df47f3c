package com.cmakeparser.ast;

import com.cmakeparser.Span;

/**
 * Base interface for all CMake AST nodes.
 *
 * <p>{@code start}/{@code end} cover the whole construct including its closing
 * parenthesis or terminator command; {@code line}/{@code column} locate its first token.
 */
public sealed interface Node permits
    Comment,
    Command,
    Builtin {

    String type();
    int start();
    int end();
    int line();
    int column();

    default Span span() {
        return new Span(start(), end());
    }
}
