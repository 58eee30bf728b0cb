package com.codevision.playground.compiler;

import com.codevision.playground.compiler.model.Diagnostic;
import com.codevision.playground.compiler.model.NodeKind;
import com.codevision.playground.compiler.model.Scope;
import com.codevision.playground.compiler.model.SyntaxNode;
import com.codevision.playground.compiler.model.VariableInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Builds one scope per function and a child scope per if/else/loop block, records the variables
 * declared directly in each block and reports the ones never referenced.
 *
 * <p>A variable counts as used when an identifier with its name appears inside an expression,
 * condition or argument list while the declaration is visible. Lookup walks from the innermost
 * scope outwards, and a declaration becomes visible after its own initializer.
 */
@Component
public class ScopeResolver {

    private static final Logger logger = LoggerFactory.getLogger(ScopeResolver.class);

    static final List<String> UNUSED_VARIABLE_SUGGESTIONS = List.of(
            "Remove the unused variable declaration",
            "Use the variable in your code");

    public record Resolution(List<Scope> scopes, List<Diagnostic> diagnostics) {
        public Resolution {
            scopes = List.copyOf(scopes);
            diagnostics = List.copyOf(diagnostics);
        }
    }

    public Resolution resolve(SyntaxNode program) {
        List<Frame> functions = new ArrayList<>();

        int index = 0;
        for (SyntaxNode function : program.children()) {
            if (function.kind() == NodeKind.FUNCTION_DECLARATION) {
                String name = function.childValue(NodeKind.IDENTIFIER).orElse("function_" + index);
                Frame frame = new Frame(name, function.line(), function.endLine());

                Deque<Frame> chain = new ArrayDeque<>();
                chain.push(frame);
                function.child(NodeKind.FUNCTION_BODY).ifPresent(body -> walk(body, chain));
                functions.add(frame);
            }
            index++;
        }

        List<Diagnostic> diagnostics = new ArrayList<>();
        List<Scope> scopes = new ArrayList<>();
        for (Frame frame : functions) {
            frame.reportUnused(diagnostics);
            scopes.add(frame.toScope());
        }

        logger.debug("Resolved {} function scope(s), {} unused variable warning(s)", scopes.size(), diagnostics.size());
        return new Resolution(scopes, diagnostics);
    }

    private void walk(SyntaxNode node, Deque<Frame> chain) {
        for (SyntaxNode child : node.children()) {
            switch (child.kind()) {
                case VARIABLE_DECLARATION -> declare(child, chain);
                case EXPRESSION, CONDITION, ARGUMENTS -> markReferences(child, chain);
                default -> {
                    if (child.kind().opensScope()) {
                        Frame nested = new Frame(child.kind().name(), child.line(), child.endLine());
                        chain.peek().children.add(nested);
                        chain.push(nested);
                        walk(child, chain);
                        chain.pop();
                    } else {
                        walk(child, chain);
                    }
                }
            }
        }
    }

    private void declare(SyntaxNode declaration, Deque<Frame> chain) {
        declaration.child(NodeKind.EXPRESSION).ifPresent(initializer -> markReferences(initializer, chain));

        SyntaxNode type = declaration.child(NodeKind.TYPE).orElse(null);
        SyntaxNode name = declaration.child(NodeKind.IDENTIFIER).orElse(null);
        if (type == null || name == null) {
            return;
        }
        chain.peek().variables.add(new Declared(name.value(), type.value(), name.line(), name.column()));
    }

    private void markReferences(SyntaxNode node, Deque<Frame> chain) {
        if (node.kind() == NodeKind.IDENTIFIER && node.value() != null) {
            Declared variable = lookup(node.value(), chain);
            if (variable != null) {
                variable.used = true;
            }
        }
        for (SyntaxNode child : node.children()) {
            markReferences(child, chain);
        }
    }

    private static Declared lookup(String name, Deque<Frame> chain) {
        // the deque iterates from the innermost frame outwards
        for (Frame frame : chain) {
            for (Iterator<Declared> it = frame.variables.descendingIterator(); it.hasNext();) {
                Declared variable = it.next();
                if (variable.name.equals(name)) {
                    return variable;
                }
            }
        }
        return null;
    }

    private static final class Declared {
        private final String name;
        private final String type;
        private final int line;
        private final int column;
        private boolean used;

        Declared(String name, String type, int line, int column) {
            this.name = name;
            this.type = type;
            this.line = line;
            this.column = column;
        }
    }

    private static final class Frame {
        private final String name;
        private final int startLine;
        private final int endLine;
        private final ArrayDeque<Declared> variables = new ArrayDeque<>();
        private final List<Frame> children = new ArrayList<>();

        Frame(String name, int startLine, int endLine) {
            this.name = name;
            this.startLine = startLine;
            this.endLine = endLine;
        }

        void reportUnused(List<Diagnostic> diagnostics) {
            for (Declared variable : variables) {
                if (!variable.used) {
                    diagnostics.add(Diagnostic.warning(
                            "Variable '" + variable.name + "' is declared but never used",
                            variable.line,
                            variable.column,
                            variable.type + " " + variable.name + ";",
                            UNUSED_VARIABLE_SUGGESTIONS));
                }
            }
            children.forEach(child -> child.reportUnused(diagnostics));
        }

        Scope toScope() {
            List<VariableInfo> infos = variables.stream()
                    .map(v -> new VariableInfo(v.name, v.type, v.line, v.column, v.used))
                    .toList();
            List<Scope> nested = children.stream().map(Frame::toScope).toList();
            return new Scope(name, startLine, endLine, infos, nested);
        }
    }
}
