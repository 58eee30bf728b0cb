package com.codevision.playground.compiler.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Immutable parse tree node. {@code value} is only set on leaves; {@code line}/{@code column}
 * locate the node's first token and {@code endLine} its last one.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SyntaxNode(
        int id,
        NodeKind kind,
        String value,
        int line,
        int column,
        int endLine,
        List<SyntaxNode> children) {

    public SyntaxNode {
        children = List.copyOf(children);
    }

    public static SyntaxNode leaf(int id, NodeKind kind, Token token) {
        return new SyntaxNode(id, kind, token.text(), token.line(), token.column(), token.line(), List.of());
    }

    public Optional<SyntaxNode> child(NodeKind kind) {
        return children.stream().filter(child -> child.kind == kind).findFirst();
    }

    public Optional<String> childValue(NodeKind kind) {
        return child(kind).map(SyntaxNode::value);
    }

    public boolean anyMatch(Predicate<SyntaxNode> predicate) {
        if (predicate.test(this)) {
            return true;
        }
        return children.stream().anyMatch(child -> child.anyMatch(predicate));
    }

    public int count(Predicate<SyntaxNode> predicate) {
        int count = predicate.test(this) ? 1 : 0;
        for (SyntaxNode child : children) {
            count += child.count(predicate);
        }
        return count;
    }
}
