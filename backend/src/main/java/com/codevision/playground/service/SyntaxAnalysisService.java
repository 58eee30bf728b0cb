package com.codevision.playground.service;

import com.codevision.playground.compiler.CompilationPipeline;
import com.codevision.playground.compiler.model.CompilationResult;
import com.codevision.playground.compiler.model.Diagnostic;
import com.codevision.playground.compiler.model.NodeKind;
import com.codevision.playground.compiler.model.Scope;
import com.codevision.playground.compiler.model.SyntaxNode;
import com.codevision.playground.compiler.model.Token;
import com.codevision.playground.compiler.model.TokenKind;
import com.codevision.playground.compiler.model.VariableInfo;
import com.codevision.playground.dto.SyntaxAnalysisRequest;
import com.codevision.playground.dto.SyntaxAnalysisResponse;
import com.codevision.playground.dto.SyntaxToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Tokens for editor highlighting. Identifiers that name a declared function, parameter or
 * variable are reclassified using the parse tree and the resolved scopes.
 */
@Service
public class SyntaxAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(SyntaxAnalysisService.class);

    private final CompilationPipeline pipeline;

    public SyntaxAnalysisService(CompilationPipeline pipeline) {
        this.pipeline = pipeline;
    }

    public SyntaxAnalysisResponse analyzeSyntax(SyntaxAnalysisRequest request) {
        long startTime = System.currentTimeMillis();

        String sourceCode = sanitizeInput(request.sourceCode());
        CompilationResult result = pipeline.compile(sourceCode);

        if (result.syntaxTree() == null) {
            long analysisTime = System.currentTimeMillis() - startTime;
            String message = result.diagnostics().stream()
                    .findFirst()
                    .map(Diagnostic::message)
                    .orElse("Syntax analysis failed");
            logger.warn("Syntax analysis failed: {}", message);
            return SyntaxAnalysisResponse.failed(message, result.diagnostics(), analysisTime);
        }

        Map<String, String> semanticInfo = new HashMap<>();
        collectSemanticInfo(result.syntaxTree(), result.scopes(), semanticInfo);

        List<SyntaxToken> tokens = new ArrayList<>();
        for (Token token : result.tokens()) {
            String info = token.kind() == TokenKind.IDENTIFIER ? semanticInfo.get(token.text()) : null;
            SyntaxToken syntaxToken = SyntaxToken.of(token, info);
            if (info != null) {
                syntaxToken = new SyntaxToken(
                        syntaxToken.startLine(), syntaxToken.startColumn(),
                        syntaxToken.endLine(), syntaxToken.endColumn(),
                        mapSemanticTypeToTokenType(info), syntaxToken.value(), info);
            }
            tokens.add(syntaxToken);
        }

        long analysisTime = System.currentTimeMillis() - startTime;
        logger.debug("Syntax analysis produced {} tokens ({} semantic entries) in {}ms",
                tokens.size(), semanticInfo.size(), analysisTime);
        return SyntaxAnalysisResponse.analyzed(tokens, result.diagnostics(), analysisTime);
    }

    private void collectSemanticInfo(SyntaxNode program, List<Scope> scopes, Map<String, String> semanticInfo) {
        for (Scope scope : scopes) {
            collectVariables(scope, semanticInfo);
        }

        for (SyntaxNode function : program.children()) {
            function.child(NodeKind.PARAMETERS).ifPresent(parameters -> {
                for (SyntaxNode parameter : parameters.children()) {
                    parameter.childValue(NodeKind.IDENTIFIER)
                            .ifPresent(name -> semanticInfo.put(name, "FUNCTION_PARAMETER"));
                }
            });
        }

        // function names win over variables and parameters of the same name
        for (SyntaxNode function : program.children()) {
            function.childValue(NodeKind.IDENTIFIER)
                    .ifPresent(name -> semanticInfo.put(name, "USER_FUNCTION"));
        }
    }

    private void collectVariables(Scope scope, Map<String, String> semanticInfo) {
        for (VariableInfo variable : scope.variables()) {
            semanticInfo.putIfAbsent(variable.name(), "USER_VARIABLE:" + variable.declaredType());
        }
        for (Scope child : scope.children()) {
            collectVariables(child, semanticInfo);
        }
    }

    private String mapSemanticTypeToTokenType(String semanticType) {
        return switch (semanticType) {
            case "USER_FUNCTION" -> "function.user";
            case "FUNCTION_PARAMETER" -> "variable.parameter";
            default -> semanticType.startsWith("USER_VARIABLE") ? "variable.user" : "identifier";
        };
    }

    private String sanitizeInput(String input) {
        if (input == null)
            return "";

        return input.replace("\r\n", "\n")
                .replace("\r", "\n");
    }
}
