package com.cmakeparser.ast;

/**
 * Interpreted argument list of a structured command.
 */
public sealed interface Expr permits UnparsedExpr, CallSignature {
    String type();
}
