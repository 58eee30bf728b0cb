package com.codevision.playground.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import com.codevision.playground.compiler.CompilationPipeline;
import com.codevision.playground.compiler.ComplexityEstimator;
import com.codevision.playground.compiler.ControlFlowBuilder;
import com.codevision.playground.compiler.ScopeResolver;
import com.codevision.playground.compiler.Tokenizer;
import com.codevision.playground.config.CodeVisionCompilerProperties;
import com.codevision.playground.dto.SyntaxAnalysisRequest;
import com.codevision.playground.dto.SyntaxToken;

class SyntaxAnalysisServiceTest {

    private final SyntaxAnalysisService service = new SyntaxAnalysisService(new CompilationPipeline(
            new Tokenizer(), new ScopeResolver(), new ControlFlowBuilder(), new ComplexityEstimator(),
            CodeVisionCompilerProperties.defaults()));

    private Map<String, SyntaxToken> byValue(String source) {
        var response = service.analyzeSyntax(new SyntaxAnalysisRequest(source));
        assertTrue(response.success());
        return response.tokens().stream()
                .collect(Collectors.toMap(SyntaxToken::value, Function.identity(), (first, second) -> first));
    }

    @Test
    void classifiesDeclaredNames() {
        var tokens = byValue("int add(int a, int b) { int sum = a + b; return sum; }\nint main() { return add(1, 2); }");

        assertEquals("function.user", tokens.get("add").tokenType());
        assertEquals("USER_FUNCTION", tokens.get("add").semanticInfo());
        assertEquals("variable.parameter", tokens.get("a").tokenType());
        assertEquals("variable.user", tokens.get("sum").tokenType());
        assertEquals("USER_VARIABLE:int", tokens.get("sum").semanticInfo());
        assertEquals("KEYWORD", tokens.get("int").tokenType());
        assertNull(tokens.get("int").semanticInfo());
    }

    @Test
    void unknownIdentifiersKeepLexicalType() {
        var tokens = byValue("int main() { foo(bar); }");

        assertEquals("IDENTIFIER", tokens.get("foo").tokenType());
        assertNull(tokens.get("bar").semanticInfo());
    }

    @Test
    void endPositionIsJustPastTheToken() {
        var tokens = byValue("int main() {\n  return 10;\n}");

        var number = tokens.get("10");
        assertEquals(2, number.startLine());
        assertEquals(10, number.startColumn());
        assertEquals(2, number.endLine());
        assertEquals(12, number.endColumn());
    }

    @Test
    void multilineStringEndsOnItsLastLine() {
        var tokens = byValue("\"ab\ncd\"");

        var string = tokens.get("\"ab\ncd\"");
        assertEquals(1, string.startLine());
        assertEquals(1, string.startColumn());
        assertEquals(2, string.endLine());
        assertEquals(4, string.endColumn());
    }

    @Test
    void windowsLineEndingsAreNormalized() {
        var tokens = byValue("int main() {\r\n  return 0;\r\n}");

        assertEquals(2, tokens.get("return").startLine());
        assertEquals(3, tokens.get("}").startLine());
    }

    @Test
    void errorTokensAreStillReported() {
        var response = service.analyzeSyntax(new SyntaxAnalysisRequest("int x = 5 @ 3;"));

        assertTrue(response.success());
        assertFalse(response.tokens().isEmpty());
        assertEquals("ERROR", response.tokens().get(4).tokenType());
        assertEquals(1, response.diagnostics().size());
        assertEquals("Unexpected character '@'", response.diagnostics().get(0).message());
    }
}
