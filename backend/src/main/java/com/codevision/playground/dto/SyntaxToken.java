package com.codevision.playground.dto;

import com.codevision.playground.compiler.model.Token;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Token as the editor highlights it. Lines and columns are 1-based; the end position is the one
 * just past the token's last character.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SyntaxToken(
    int startLine,
    int startColumn,
    int endLine,
    int endColumn,
    String tokenType,
    String value,
    String semanticInfo
) {

    public static SyntaxToken of(Token token, String semanticInfo) {
        int endLine = token.line();
        int endColumn = token.column();
        // string literals may span lines
        for (char c : token.text().toCharArray()) {
            if (c == '\n') {
                endLine++;
                endColumn = 1;
            } else {
                endColumn++;
            }
        }
        return new SyntaxToken(
            token.line(), token.column(),
            endLine, endColumn,
            token.kind().name(), token.text(), semanticInfo);
    }
}
