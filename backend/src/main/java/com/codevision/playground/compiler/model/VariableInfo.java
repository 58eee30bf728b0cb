package com.codevision.playground.compiler.model;

public record VariableInfo(
        String name,
        String declaredType,
        int declarationLine,
        int declarationColumn,
        boolean used) {
}
