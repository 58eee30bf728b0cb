package com.codevision.playground.compiler.model;

import java.util.List;

public record Scope(
        String name,
        int startLine,
        int endLine,
        List<VariableInfo> variables,
        List<Scope> children) {

    public Scope {
        variables = List.copyOf(variables);
        children = List.copyOf(children);
    }
}
