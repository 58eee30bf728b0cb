package com.codevision.playground.service;

import com.codevision.playground.compiler.CompilationPipeline;
import com.codevision.playground.compiler.model.CompilationResult;
import com.codevision.playground.config.CodeVisionCompilerProperties;
import com.codevision.playground.dto.CompileResponse;
import com.codevision.playground.exception.CompilationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;

@Service
public class CompilerService {

    private static final Logger logger = LoggerFactory.getLogger(CompilerService.class);

    private final CodeVisionCompilerProperties properties;
    private final CompilationPipeline pipeline;

    public CompilerService(CodeVisionCompilerProperties properties, CompilationPipeline pipeline) {
        this.properties = properties;
        this.pipeline = pipeline;
    }

    @PostConstruct
    public void init() {
        logger.info("CompilerService ready: entry function '{}', max source length {}, compile delay {}ms",
                properties.entryFunction(), properties.maxSourceCodeLength(), properties.compileDelayMs());
    }

    public CompileResponse compile(String sourceCode) {

        if (sourceCode == null) {
            return CompileResponse.validationError("Source code cannot be null");
        }

        if (sourceCode.length() > properties.maxSourceCodeLength()) {
            logger.warn("Rejected source of {} characters (limit {})",
                    sourceCode.length(), properties.maxSourceCodeLength());
            return CompileResponse.validationError(
                "Source code exceeds maximum length of " + properties.maxSourceCodeLength() + " characters"
            );
        }

        long startTime = System.currentTimeMillis();

        awaitCompileDelay();

        try {
            CompilationResult result = pipeline.run(sourceCode);
            long compileTime = System.currentTimeMillis() - startTime;

            logger.info("Compiled {} characters in {}ms: {} tokens, {} scope(s), {} diagnostic(s), control flow {}",
                    sourceCode.length(),
                    compileTime,
                    result.tokens().size(),
                    result.scopes().size(),
                    result.diagnostics().size(),
                    result.controlFlow() != null ? "built" : "skipped");

            return CompileResponse.completed(result, compileTime);

        } catch (CompilationException e) {
            long compileTime = System.currentTimeMillis() - startTime;
            logger.error("Compilation failed in stage '{}': {}", e.getStage(), e.getMessage(), e);

            CompilationResult fatal = CompilationResult.fatal(e.getMessage());
            return CompileResponse.fatalError(fatal, fatal.diagnostics().get(0).message(), compileTime);
        }
    }

    /** Lets the caller show a "compiling" state; the pipeline itself never blocks. */
    private void awaitCompileDelay() {
        long delay = properties.compileDelayMs();
        if (delay <= 0) {
            return;
        }
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            logger.warn("Compile delay interrupted, compiling immediately");
            Thread.currentThread().interrupt();
        }
    }
}
