package com.codevision.playground.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

@ConfigurationProperties(prefix = "codevision.compiler")
@Validated
public record CodeVisionCompilerProperties(
    @Positive
    @DefaultValue("10000")
    Integer maxSourceCodeLength,

    @PositiveOrZero
    @DefaultValue("0")
    Long compileDelayMs,

    @NotBlank
    @DefaultValue("main")
    String entryFunction
) {

    public static CodeVisionCompilerProperties defaults() {
        return new CodeVisionCompilerProperties(10000, 0L, "main");
    }
}
