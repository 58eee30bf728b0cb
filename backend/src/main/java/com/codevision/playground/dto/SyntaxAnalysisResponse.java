package com.codevision.playground.dto;

import com.codevision.playground.compiler.model.Diagnostic;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Highlighting tokens plus the diagnostics the editor underlines. {@code error} is only set
 * when the source could not be analyzed at all.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SyntaxAnalysisResponse(
        boolean success,
        List<SyntaxToken> tokens,
        List<Diagnostic> diagnostics,
        String error,
        long analysisTimeMs) {

    public static SyntaxAnalysisResponse analyzed(List<SyntaxToken> tokens, List<Diagnostic> diagnostics,
            long analysisTimeMs) {
        return new SyntaxAnalysisResponse(true, tokens, diagnostics, null, analysisTimeMs);
    }

    public static SyntaxAnalysisResponse failed(String error, List<Diagnostic> diagnostics, long analysisTimeMs) {
        return new SyntaxAnalysisResponse(false, List.of(), diagnostics, error, analysisTimeMs);
    }

    public static SyntaxAnalysisResponse rejected(String error) {
        return new SyntaxAnalysisResponse(false, List.of(), List.of(), error, 0);
    }
}
