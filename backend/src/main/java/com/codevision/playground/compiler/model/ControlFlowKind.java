package com.codevision.playground.compiler.model;

public enum ControlFlowKind {
    ENTRY,
    EXIT,
    IF,
    CALL,
    RETURN,
    STATEMENT,
    WHILE,
    FOR;

    public boolean isDecision() {
        return this == IF || this == WHILE || this == FOR;
    }
}
