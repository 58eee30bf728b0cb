package com.codevision.playground.compiler.model;

public enum NodeKind {
    PROGRAM,
    FUNCTION_DECLARATION,
    TYPE,
    IDENTIFIER,
    PARAMETERS,
    PARAMETER,
    FUNCTION_BODY,
    VARIABLE_DECLARATION,
    IF_STATEMENT,
    CONDITION,
    IF_BODY,
    ELSE,
    WHILE_STATEMENT,
    FOR_STATEMENT,
    LOOP_BODY,
    FUNCTION_CALL,
    ARGUMENTS,
    RETURN,
    EXPRESSION,

    // raw token leaves
    KEYWORD,
    STRING,
    NUMBER,
    OPERATOR,
    PUNCTUATION,
    ERROR;

    public static NodeKind forToken(TokenKind kind) {
        return switch (kind) {
            case KEYWORD -> KEYWORD;
            case IDENTIFIER -> IDENTIFIER;
            case STRING -> STRING;
            case NUMBER -> NUMBER;
            case OPERATOR -> OPERATOR;
            case PUNCTUATION -> PUNCTUATION;
            case WHITESPACE, ERROR -> ERROR;
        };
    }

    public boolean isLoop() {
        return this == WHILE_STATEMENT || this == FOR_STATEMENT;
    }

    /** Blocks that open a nested lexical scope inside a function. */
    public boolean opensScope() {
        return this == IF_BODY || this == ELSE || this == LOOP_BODY;
    }
}
