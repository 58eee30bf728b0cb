package com.codevision.playground.compiler.model;

public enum TokenKind {
    KEYWORD,
    IDENTIFIER,
    STRING,
    NUMBER,
    OPERATOR,
    PUNCTUATION,
    /** Recognized by the tokenizer but never emitted. */
    WHITESPACE,
    /** A single character no classifier accepts. */
    ERROR
}
