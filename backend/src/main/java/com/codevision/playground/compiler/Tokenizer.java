package com.codevision.playground.compiler;

import com.codevision.playground.compiler.model.Token;
import com.codevision.playground.compiler.model.TokenKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits source text into classified tokens. Every classifier is tried at the current position
 * and the longest match wins; on a tie the classifier listed first wins, which is how keywords
 * beat identifiers. A character nothing accepts becomes a one-character {@link TokenKind#ERROR}
 * token, so the scan always advances.
 */
@Component
public class Tokenizer {

    private static final Logger logger = LoggerFactory.getLogger(Tokenizer.class);

    private record Classifier(TokenKind kind, Pattern pattern) {
    }

    private static final List<Classifier> CLASSIFIERS = List.of(
            new Classifier(TokenKind.KEYWORD,
                    Pattern.compile("\\b(?:int|char|float|double|void|if|else|while|for|return|printf)\\b")),
            new Classifier(TokenKind.IDENTIFIER, Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*")),
            new Classifier(TokenKind.STRING, Pattern.compile("\"[^\"]*\"")),
            new Classifier(TokenKind.NUMBER, Pattern.compile("\\b\\d+(?:\\.\\d+)?(?:e[+-]?\\d+)?\\b")),
            new Classifier(TokenKind.OPERATOR, Pattern.compile("&&|\\|\\||\\+\\+|--|[+\\-*/%=<>!&|^]=?")),
            new Classifier(TokenKind.PUNCTUATION, Pattern.compile("[;,(){}\\[\\].]")),
            new Classifier(TokenKind.WHITESPACE, Pattern.compile("\\s+")));

    public List<Token> tokenize(String source) {
        List<Token> tokens = new ArrayList<>();
        int position = 0;
        int line = 1;
        int column = 1;

        while (position < source.length()) {
            TokenKind matchedKind = null;
            int matchedEnd = position;

            for (Classifier classifier : CLASSIFIERS) {
                // region bounds are opaque and anchoring: the pattern sees the rest of the input as a fresh string
                Matcher matcher = classifier.pattern().matcher(source).region(position, source.length());
                if (matcher.lookingAt() && matcher.end() > matchedEnd) {
                    matchedKind = classifier.kind();
                    matchedEnd = matcher.end();
                }
            }

            if (matchedKind == null) {
                String offending = source.substring(position, position + 1);
                logger.debug("Unrecognized character '{}' at {}:{}", offending, line, column);
                tokens.add(new Token(TokenKind.ERROR, offending, line, column));
                matchedEnd = position + 1;
            } else if (matchedKind != TokenKind.WHITESPACE) {
                tokens.add(new Token(matchedKind, source.substring(position, matchedEnd), line, column));
            }

            for (int i = position; i < matchedEnd; i++) {
                if (source.charAt(i) == '\n') {
                    line++;
                    column = 1;
                } else {
                    column++;
                }
            }
            position = matchedEnd;
        }

        return tokens;
    }
}
