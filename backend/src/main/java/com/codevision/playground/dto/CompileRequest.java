package com.codevision.playground.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CompileRequest(
    @NotNull(message = "Source code cannot be null")
    @Size(max = 10000, message = "Source code cannot exceed 10,000 characters")
    String sourceCode
) {

    /**
     * Normalizes line endings only. Leading and trailing text is kept so diagnostic positions
     * match what the editor shows.
     */
    public String sanitizedSourceCode() {
        if (sourceCode == null) {
            return "";
        }

        return sourceCode
            .replace("\r\n", "\n")
            .replace("\r", "\n");
    }
}
