package com.cmakeparser.ast;

import java.util.List;

/**
 * A {@code keyword(args) ... endkeyword()} construct with a single body.
 */
public sealed interface Compound extends Builtin permits
    Macro,
    Function,
    Block,
    ForEach,
    While {

    Expr args();
    List<Node> body();
}
