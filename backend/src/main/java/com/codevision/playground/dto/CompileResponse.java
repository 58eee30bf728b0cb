package com.codevision.playground.dto;

import com.codevision.playground.compiler.model.CompilationResult;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CompileResponse(
        boolean success,
        CompilationResult result,
        String error,
        Long compileTimeMs,
        String resultType
) {

    public static CompileResponse completed(CompilationResult result, long compileTimeMs) {
        if (result.hasErrors()) {
            return new CompileResponse(
                    false,
                    result,
                    null,
                    compileTimeMs,
                    "errors");
        }
        return new CompileResponse(
                true,
                result,
                null,
                compileTimeMs,
                result.diagnostics().isEmpty() ? "success" : "warnings");
    }

    public static CompileResponse fatalError(CompilationResult result, String error, long compileTimeMs) {
        return new CompileResponse(
                false,
                result,
                error,
                compileTimeMs,
                "fatal_error");
    }

    public static CompileResponse internalError(String error) {
        return new CompileResponse(
                false,
                null,
                error,
                null,
                "fatal_error");
    }

    public static CompileResponse validationError(String error) {
        return new CompileResponse(
                false,
                null,
                error,
                null,
                "validation_error");
    }
}
