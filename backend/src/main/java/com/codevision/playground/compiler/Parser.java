package com.codevision.playground.compiler;

import com.codevision.playground.compiler.model.NodeKind;
import com.codevision.playground.compiler.model.SyntaxNode;
import com.codevision.playground.compiler.model.Token;
import com.codevision.playground.compiler.model.TokenKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Structural parser for the C-like playground language.
 *
 * <p>The grammar is deliberately partial: at every position the parser tries the statement shapes
 * it knows and otherwise steps over one token. Unrecognized input is left out of the tree rather
 * than reported. Braces are the exception: every opening and closing brace is counted, so a block
 * ends at the brace that balances its opening one.
 *
 * <pre>
 * program     :: function*
 * function    :: TYPE IDENTIFIER "(" parameters ")" block?
 * statement   :: declaration | if | while | for | call | return
 * declaration :: VAR_TYPE IDENTIFIER ( "[" ... "]" )* ( "=" expression )? ";"
 * if          :: "if" "(" tokens ")" block ( "else" ( block | if ) )?
 * call        :: IDENTIFIER "(" ( STRING | NUMBER | IDENTIFIER ) ( "," ... )* ")" ";"
 * return      :: "return" expression? ";"
 * </pre>
 *
 * A parser instance owns its cursor and node arena and is used for one parse only.
 */
public final class Parser {

    private static final Set<String> FUNCTION_TYPES = Set.of("int", "void", "char", "float", "double");
    private static final Set<String> VARIABLE_TYPES = Set.of("int", "char", "float", "double");

    private final List<Token> tokens;
    private final NodeArena arena = new NodeArena();

    private int current = 0;
    private boolean used = false;

    public Parser(List<Token> tokens) {
        this.tokens = List.copyOf(tokens);
    }

    public SyntaxNode parse() {
        if (used) {
            throw new IllegalStateException("Parser instances are single-use");
        }
        used = true;

        int id = arena.allocate();
        List<SyntaxNode> functions = new ArrayList<>();
        while (!isAtEnd()) {
            if (atFunctionDeclaration()) {
                functions.add(functionDeclaration());
            } else {
                advance();
            }
        }
        int endLine = tokens.isEmpty() ? 1 : tokens.get(tokens.size() - 1).line();
        return new SyntaxNode(id, NodeKind.PROGRAM, null, 1, 1, endLine, functions);
    }

    int nodeCount() {
        return arena.size();
    }

    //// declarations ////

    private boolean atFunctionDeclaration() {
        Token type = peek(0);
        return type.kind() == TokenKind.KEYWORD && FUNCTION_TYPES.contains(type.text())
                && check(1, TokenKind.IDENTIFIER)
                && checkPunctuation(2, "(");
    }

    private SyntaxNode functionDeclaration() {
        int id = arena.allocate();
        Token start = peek(0);
        List<SyntaxNode> children = new ArrayList<>();
        children.add(leaf(NodeKind.TYPE, advance()));
        children.add(leaf(NodeKind.IDENTIFIER, advance()));
        children.add(parameters());

        if (checkPunctuation(0, ")")) {
            advance();
        }
        if (checkPunctuation(0, "{")) {
            children.add(block(NodeKind.FUNCTION_BODY));
        }
        return node(id, NodeKind.FUNCTION_DECLARATION, start, children);
    }

    private SyntaxNode parameters() {
        int id = arena.allocate();
        Token open = advance();
        List<SyntaxNode> parameters = new ArrayList<>();

        // a header missing its ")" must not swallow the body
        while (!isAtEnd() && !checkPunctuation(0, ")") && !checkPunctuation(0, "{")) {
            Token token = peek(0);
            if (token.kind() == TokenKind.KEYWORD && FUNCTION_TYPES.contains(token.text())
                    && check(1, TokenKind.IDENTIFIER)) {
                int parameterId = arena.allocate();
                SyntaxNode type = leaf(NodeKind.TYPE, advance());
                SyntaxNode name = leaf(NodeKind.IDENTIFIER, advance());
                parameters.add(node(parameterId, NodeKind.PARAMETER, token, List.of(type, name)));
                if (checkPunctuation(0, ",")) {
                    advance();
                }
            } else {
                advance();
            }
        }
        return node(id, NodeKind.PARAMETERS, open, parameters);
    }

    //// blocks ////

    private SyntaxNode block(NodeKind kind) {
        int id = arena.allocate();
        Token open = advance();
        List<SyntaxNode> statements = new ArrayList<>();
        statementsUntilClosingBrace(statements);
        return node(id, kind, open, statements);
    }

    /**
     * Parses statements after an opening brace has been consumed, up to and including the brace
     * that balances it, or to the end of input.
     */
    private void statementsUntilClosingBrace(List<SyntaxNode> statements) {
        int depth = 1;
        while (!isAtEnd()) {
            Optional<SyntaxNode> statement = statement();
            if (statement.isPresent()) {
                statements.add(statement.get());
                continue;
            }
            Token token = advance();
            if (token.isPunctuation("{")) {
                depth++;
            } else if (token.isPunctuation("}")) {
                depth--;
                if (depth == 0) {
                    return;
                }
            }
        }
    }

    //// statements ////

    private Optional<SyntaxNode> statement() {
        if (atVariableDeclaration()) {
            return Optional.of(variableDeclaration());
        }
        if (checkKeyword(0, "if")) {
            return Optional.of(ifStatement());
        }
        if (checkKeyword(0, "while")) {
            return Optional.of(loop(NodeKind.WHILE_STATEMENT));
        }
        if (checkKeyword(0, "for")) {
            return Optional.of(loop(NodeKind.FOR_STATEMENT));
        }
        if (atFunctionCall()) {
            return Optional.of(functionCall());
        }
        if (checkKeyword(0, "return")) {
            return Optional.of(returnStatement());
        }
        return Optional.empty();
    }

    private boolean atVariableDeclaration() {
        Token type = peek(0);
        return type.kind() == TokenKind.KEYWORD && VARIABLE_TYPES.contains(type.text())
                && check(1, TokenKind.IDENTIFIER)
                && has(2);
    }

    private SyntaxNode variableDeclaration() {
        int id = arena.allocate();
        int typeId = arena.allocate();
        Token typeToken = advance();

        List<SyntaxNode> children = new ArrayList<>();
        SyntaxNode name = leaf(NodeKind.IDENTIFIER, advance());

        // array suffixes are folded into the type text: int[10], char[]
        StringBuilder typeText = new StringBuilder(typeToken.text());
        while (checkPunctuation(0, "[")) {
            Token token;
            do {
                token = advance();
                typeText.append(token.text());
            } while (!token.isPunctuation("]") && !isAtEnd() && !atDeclarationBoundary());
        }
        children.add(new SyntaxNode(typeId, NodeKind.TYPE, typeText.toString(),
                typeToken.line(), typeToken.column(), typeToken.line(), List.of()));
        children.add(name);

        if (check(0, TokenKind.OPERATOR) && peek(0).text().equals("=")) {
            advance();
            children.add(expression());
        }
        if (checkPunctuation(0, ";")) {
            advance();
        }
        return node(id, NodeKind.VARIABLE_DECLARATION, typeToken, children);
    }

    private boolean atDeclarationBoundary() {
        Token token = peek(0);
        return token.isPunctuation(";") || token.isPunctuation("{") || token.isPunctuation("}")
                || token.is(TokenKind.OPERATOR, "=");
    }

    private SyntaxNode ifStatement() {
        int id = arena.allocate();
        Token keyword = advance();
        List<SyntaxNode> children = new ArrayList<>();

        if (checkPunctuation(0, "(")) {
            children.add(condition());
        }
        if (checkPunctuation(0, "{")) {
            children.add(block(NodeKind.IF_BODY));
        }
        if (checkKeyword(0, "else")) {
            children.add(elseClause());
        }
        return node(id, NodeKind.IF_STATEMENT, keyword, children);
    }

    private SyntaxNode elseClause() {
        int id = arena.allocate();
        Token keyword = advance();
        List<SyntaxNode> statements = new ArrayList<>();

        if (checkPunctuation(0, "{")) {
            advance();
            statementsUntilClosingBrace(statements);
        } else if (checkKeyword(0, "if")) {
            statements.add(ifStatement());
        }
        return node(id, NodeKind.ELSE, keyword, statements);
    }

    private SyntaxNode loop(NodeKind kind) {
        int id = arena.allocate();
        Token keyword = advance();
        List<SyntaxNode> children = new ArrayList<>();

        if (checkPunctuation(0, "(")) {
            children.add(condition());
        }
        if (checkPunctuation(0, "{")) {
            children.add(block(NodeKind.LOOP_BODY));
        }
        return node(id, kind, keyword, children);
    }

    /** Raw tokens between balanced parentheses; the outer pair is consumed but not kept. */
    private SyntaxNode condition() {
        int id = arena.allocate();
        Token open = advance();
        List<SyntaxNode> leaves = new ArrayList<>();

        int depth = 1;
        while (!isAtEnd()) {
            Token token = peek(0);
            if (token.isPunctuation("{") || token.isPunctuation("}")) {
                break;
            }
            if (token.isPunctuation("(")) {
                depth++;
            } else if (token.isPunctuation(")")) {
                depth--;
                if (depth == 0) {
                    advance();
                    break;
                }
            }
            leaves.add(rawLeaf(advance()));
        }
        return node(id, NodeKind.CONDITION, open, leaves);
    }

    private boolean atFunctionCall() {
        Token callee = peek(0);
        boolean callable = callee.kind() == TokenKind.IDENTIFIER || callee.is(TokenKind.KEYWORD, "printf");
        return callable && checkPunctuation(1, "(") && has(2);
    }

    private SyntaxNode functionCall() {
        int id = arena.allocate();
        Token callee = peek(0);
        List<SyntaxNode> children = new ArrayList<>();
        children.add(leaf(NodeKind.IDENTIFIER, advance()));

        int argumentsId = arena.allocate();
        Token open = advance();
        List<SyntaxNode> arguments = new ArrayList<>();
        while (!isAtEnd() && !checkPunctuation(0, ")") && !checkPunctuation(0, ";")
                && !checkPunctuation(0, "{") && !checkPunctuation(0, "}")) {
            Token token = peek(0);
            if (token.kind() == TokenKind.STRING || token.kind() == TokenKind.NUMBER
                    || token.kind() == TokenKind.IDENTIFIER) {
                arguments.add(rawLeaf(advance()));
                if (checkPunctuation(0, ",")) {
                    advance();
                }
            } else {
                advance();
            }
        }
        children.add(node(argumentsId, NodeKind.ARGUMENTS, open, arguments));

        if (checkPunctuation(0, ")")) {
            advance();
        }
        if (checkPunctuation(0, ";")) {
            advance();
        }
        return node(id, NodeKind.FUNCTION_CALL, callee, children);
    }

    private SyntaxNode returnStatement() {
        int id = arena.allocate();
        Token keyword = advance();
        List<SyntaxNode> children = new ArrayList<>();

        if (!isAtEnd() && !checkPunctuation(0, ";") && !checkPunctuation(0, "}")) {
            children.add(expression());
        }
        if (checkPunctuation(0, ";")) {
            advance();
        }
        return node(id, NodeKind.RETURN, keyword, children);
    }

    /** Raw tokens up to the next semicolon, closing parenthesis or comma. Braces also end an expression. */
    private SyntaxNode expression() {
        int id = arena.allocate();
        Token start = isAtEnd() ? previous() : peek(0);
        List<SyntaxNode> leaves = new ArrayList<>();

        while (!isAtEnd()) {
            Token token = peek(0);
            if (token.isPunctuation(";") || token.isPunctuation(")") || token.isPunctuation(",")
                    || token.isPunctuation("{") || token.isPunctuation("}")) {
                break;
            }
            leaves.add(rawLeaf(advance()));
        }
        return node(id, NodeKind.EXPRESSION, start, leaves);
    }

    //// node construction ////

    private SyntaxNode leaf(NodeKind kind, Token token) {
        return SyntaxNode.leaf(arena.allocate(), kind, token);
    }

    private SyntaxNode rawLeaf(Token token) {
        return leaf(NodeKind.forToken(token.kind()), token);
    }

    /** Builds an interior node spanning from {@code start} to the last consumed token. */
    private SyntaxNode node(int id, NodeKind kind, Token start, List<SyntaxNode> children) {
        int endLine = Math.max(start.line(), previous().line());
        return new SyntaxNode(id, kind, null, start.line(), start.column(), endLine, children);
    }

    //// cursor ////

    private boolean isAtEnd() {
        return current >= tokens.size();
    }

    private boolean has(int offset) {
        return current + offset < tokens.size();
    }

    /** Token at {@code offset} from the cursor; only called where {@link #has(int)} holds or at offset 0 before the end. */
    private Token peek(int offset) {
        return tokens.get(current + offset);
    }

    private Token previous() {
        return tokens.get(Math.max(0, current - 1));
    }

    private Token advance() {
        return tokens.get(current++);
    }

    private boolean check(int offset, TokenKind kind) {
        return has(offset) && peek(offset).kind() == kind;
    }

    private boolean checkPunctuation(int offset, String text) {
        return has(offset) && peek(offset).isPunctuation(text);
    }

    private boolean checkKeyword(int offset, String text) {
        return has(offset) && peek(offset).isKeyword(text);
    }
}
