package com.codevision.playground.compiler.model;

public record Token(
        TokenKind kind,
        String text,
        int line,
        int column) {

    public boolean is(TokenKind kind, String text) {
        return this.kind == kind && this.text.equals(text);
    }

    public boolean isPunctuation(String text) {
        return is(TokenKind.PUNCTUATION, text);
    }

    public boolean isKeyword(String text) {
        return is(TokenKind.KEYWORD, text);
    }
}
