package com.codevision.playground.compiler.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Everything one compile produces. {@code syntaxTree}, {@code controlFlow} and {@code complexity}
 * are null when a stage failed or when there is no entry function.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CompilationResult(
        List<Token> tokens,
        SyntaxNode syntaxTree,
        List<Scope> scopes,
        ControlFlowNode controlFlow,
        ComplexityInfo complexity,
        List<Diagnostic> diagnostics) {

    public CompilationResult {
        tokens = List.copyOf(tokens);
        scopes = List.copyOf(scopes);
        diagnostics = List.copyOf(diagnostics);
    }

    public static CompilationResult fatal(String detail) {
        return new CompilationResult(
                List.of(),
                null,
                List.of(),
                null,
                null,
                List.of(Diagnostic.error("Fatal error: " + detail, 1, 1)));
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }
}
