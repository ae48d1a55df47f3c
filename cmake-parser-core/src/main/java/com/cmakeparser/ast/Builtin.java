package com.cmakeparser.ast;

/**
 * Nodes for commands whose structure the block parser understands.
 */
public sealed interface Builtin extends Node permits
    Compound,
    If,
    Break,
    Continue,
    Return {
}
