package com.cmakeparser;

public enum TokenKind {
    RAW,
    QUOTED,
    BRACKETED,
    COMMENT,
    LPAREN,
    RPAREN,
    SEMICOLON,
    UNMATCHED_BRACKET,
    UNPARSEABLE
}
