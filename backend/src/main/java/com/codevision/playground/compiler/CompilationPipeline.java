package com.codevision.playground.compiler;

import com.codevision.playground.compiler.model.CompilationResult;
import com.codevision.playground.compiler.model.ComplexityInfo;
import com.codevision.playground.compiler.model.ControlFlowNode;
import com.codevision.playground.compiler.model.Diagnostic;
import com.codevision.playground.compiler.model.Severity;
import com.codevision.playground.compiler.model.SyntaxNode;
import com.codevision.playground.compiler.model.Token;
import com.codevision.playground.compiler.model.TokenKind;
import com.codevision.playground.config.CodeVisionCompilerProperties;
import com.codevision.playground.exception.CompilationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Runs tokenizer, parser, scope resolver, control-flow builder and complexity estimator in order
 * and gathers their output. A failing stage stops the run; {@link #compile(String)} turns that
 * failure into a single fatal diagnostic.
 */
@Component
public class CompilationPipeline {

    private static final Logger logger = LoggerFactory.getLogger(CompilationPipeline.class);

    private final Tokenizer tokenizer;
    private final ScopeResolver scopeResolver;
    private final ControlFlowBuilder controlFlowBuilder;
    private final ComplexityEstimator complexityEstimator;
    private final CodeVisionCompilerProperties properties;

    public CompilationPipeline(
            Tokenizer tokenizer,
            ScopeResolver scopeResolver,
            ControlFlowBuilder controlFlowBuilder,
            ComplexityEstimator complexityEstimator,
            CodeVisionCompilerProperties properties) {
        this.tokenizer = tokenizer;
        this.scopeResolver = scopeResolver;
        this.controlFlowBuilder = controlFlowBuilder;
        this.complexityEstimator = complexityEstimator;
        this.properties = properties;
    }

    public CompilationResult compile(String source) {
        try {
            return run(source);
        } catch (CompilationException e) {
            logger.error("Compilation failed in stage '{}': {}", e.getStage(), e.getMessage(), e);
            return CompilationResult.fatal(e.getMessage());
        }
    }

    public CompilationResult run(String source) throws CompilationException {
        List<Token> tokens = stage("tokenizer", () -> tokenizer.tokenize(source));
        logger.debug("Tokenizer produced {} tokens", tokens.size());

        SyntaxNode tree = stage("parser", () -> new Parser(tokens).parse());
        logger.debug("Parser found {} function(s)", tree.children().size());

        ScopeResolver.Resolution resolution = stage("scope resolver", () -> scopeResolver.resolve(tree));

        ControlFlowNode controlFlow = stage("control flow builder",
                () -> controlFlowBuilder.build(tree, properties.entryFunction()).orElse(null));

        ComplexityInfo complexity = stage("complexity estimator",
                () -> complexityEstimator.estimate(tree, controlFlow).orElse(null));

        List<Diagnostic> diagnostics = new ArrayList<>(lexicalDiagnostics(tokens));
        diagnostics.addAll(resolution.diagnostics());

        return new CompilationResult(tokens, tree, resolution.scopes(), controlFlow, complexity, diagnostics);
    }

    private static List<Diagnostic> lexicalDiagnostics(List<Token> tokens) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (Token token : tokens) {
            if (token.kind() == TokenKind.ERROR) {
                diagnostics.add(new Diagnostic(
                        "Unexpected character '" + token.text() + "'",
                        token.line(),
                        token.column(),
                        Severity.ERROR,
                        token.text(),
                        List.of("Remove or replace the character")));
            }
        }
        return diagnostics;
    }

    private static <T> T stage(String name, Supplier<T> step) throws CompilationException {
        try {
            return step.get();
        } catch (RuntimeException | StackOverflowError e) {
            String detail = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            throw new CompilationException(name, detail, e);
        }
    }
}
