package com.codevision.playground.compiler.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * A finding addressed to the editor. {@code line} and {@code column} are 1-based and use the
 * tokenizer's bookkeeping.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Diagnostic(
        String message,
        int line,
        int column,
        Severity severity,
        String context,
        List<String> suggestions) {

    public Diagnostic {
        suggestions = suggestions == null ? null : List.copyOf(suggestions);
    }

    public static Diagnostic error(String message, int line, int column) {
        return new Diagnostic(message, line, column, Severity.ERROR, null, null);
    }

    public static Diagnostic warning(String message, int line, int column, String context, List<String> suggestions) {
        return new Diagnostic(message, line, column, Severity.WARNING, context, suggestions);
    }

    @JsonIgnore
    public boolean isError() {
        return severity == Severity.ERROR;
    }
}
