package com.codevision.playground.compiler;

import com.codevision.playground.compiler.model.ControlFlowKind;
import com.codevision.playground.compiler.model.ControlFlowNode;
import com.codevision.playground.compiler.model.NodeKind;
import com.codevision.playground.compiler.model.SyntaxNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Builds the control-flow graph of one function, from a synthetic ENTRY to a synthetic EXIT.
 *
 * <p>Statements of a block become a chain of nodes. IF nodes own their branches (true branch
 * first, false branch second) and RETURN nodes end a path, so neither gets the next statement
 * appended. WHILE and FOR nodes list the loop body first and the following statement last; back
 * edges are not materialized.
 */
@Component
public class ControlFlowBuilder {

    private static final Logger logger = LoggerFactory.getLogger(ControlFlowBuilder.class);

    public Optional<ControlFlowNode> build(SyntaxNode program, String functionName) {
        Optional<SyntaxNode> function = program.children().stream()
                .filter(node -> node.kind() == NodeKind.FUNCTION_DECLARATION)
                .filter(node -> node.childValue(NodeKind.IDENTIFIER).filter(functionName::equals).isPresent())
                .findFirst();

        if (function.isEmpty()) {
            logger.debug("No '{}' function found, skipping control flow", functionName);
            return Optional.empty();
        }

        ControlFlowNode entry = ControlFlowNode.of("entry", ControlFlowKind.ENTRY);
        function.get().child(NodeKind.FUNCTION_BODY)
                .map(this::sequence)
                .filter(nodes -> !nodes.isEmpty())
                .ifPresent(nodes -> entry.addChild(nodes.get(0)));

        entry.lastReachable().addChild(ControlFlowNode.of("exit", ControlFlowKind.EXIT));
        return Optional.of(entry);
    }

    /** Converts the statements of a block into chained control nodes and returns them in order. */
    private List<ControlFlowNode> sequence(SyntaxNode block) {
        List<ControlFlowNode> nodes = new ArrayList<>();
        for (SyntaxNode statement : block.children()) {
            toControlNode(statement).ifPresent(nodes::add);
        }

        for (int i = 0; i < nodes.size() - 1; i++) {
            ControlFlowKind kind = nodes.get(i).getKind();
            if (kind != ControlFlowKind.IF && kind != ControlFlowKind.RETURN) {
                nodes.get(i).addChild(nodes.get(i + 1));
            }
        }
        return nodes;
    }

    private Optional<ControlFlowNode> toControlNode(SyntaxNode statement) {
        return switch (statement.kind()) {
            case VARIABLE_DECLARATION -> Optional.of(new ControlFlowNode(
                    "decl_" + statement.id(), ControlFlowKind.STATEMENT, null, declarationLabel(statement)));
            case FUNCTION_CALL -> Optional.of(new ControlFlowNode(
                    "call_" + statement.id(), ControlFlowKind.CALL, null,
                    statement.childValue(NodeKind.IDENTIFIER).orElse(null)));
            case RETURN -> Optional.of(new ControlFlowNode(
                    "return_" + statement.id(), ControlFlowKind.RETURN, null, returnLabel(statement)));
            case IF_STATEMENT -> Optional.of(branch(statement));
            case WHILE_STATEMENT -> Optional.of(loop(statement, "while_", ControlFlowKind.WHILE));
            case FOR_STATEMENT -> Optional.of(loop(statement, "for_", ControlFlowKind.FOR));
            default -> Optional.empty();
        };
    }

    private ControlFlowNode branch(SyntaxNode ifStatement) {
        ControlFlowNode node = new ControlFlowNode(
                "if_" + ifStatement.id(), ControlFlowKind.IF, conditionText(ifStatement), null);
        firstOf(ifStatement, NodeKind.IF_BODY).ifPresent(node::addChild);
        firstOf(ifStatement, NodeKind.ELSE).ifPresent(node::addChild);
        return node;
    }

    private ControlFlowNode loop(SyntaxNode loop, String prefix, ControlFlowKind kind) {
        ControlFlowNode node = new ControlFlowNode(prefix + loop.id(), kind, conditionText(loop), null);
        firstOf(loop, NodeKind.LOOP_BODY).ifPresent(node::addChild);
        return node;
    }

    private Optional<ControlFlowNode> firstOf(SyntaxNode statement, NodeKind blockKind) {
        return statement.child(blockKind)
                .map(this::sequence)
                .filter(nodes -> !nodes.isEmpty())
                .map(nodes -> nodes.get(0));
    }

    private static String conditionText(SyntaxNode statement) {
        return statement.child(NodeKind.CONDITION)
                .map(ControlFlowBuilder::joinLeaves)
                .orElse("");
    }

    private static String declarationLabel(SyntaxNode declaration) {
        String label = declaration.childValue(NodeKind.TYPE).orElse("") + " "
                + declaration.childValue(NodeKind.IDENTIFIER).orElse("");
        Optional<SyntaxNode> initializer = declaration.child(NodeKind.EXPRESSION);
        if (initializer.isPresent() && !initializer.get().children().isEmpty()) {
            label += " = " + joinLeaves(initializer.get());
        }
        return label.trim();
    }

    private static String returnLabel(SyntaxNode statement) {
        return statement.child(NodeKind.EXPRESSION)
                .map(expression -> ("return " + joinLeaves(expression)).trim())
                .orElse("return");
    }

    private static String joinLeaves(SyntaxNode node) {
        return node.children().stream()
                .map(SyntaxNode::value)
                .collect(Collectors.joining(" "));
    }
}
