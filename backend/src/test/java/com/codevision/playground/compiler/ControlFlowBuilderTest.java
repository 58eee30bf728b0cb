package com.codevision.playground.compiler;

import static com.codevision.playground.compiler.model.ControlFlowKind.CALL;
import static com.codevision.playground.compiler.model.ControlFlowKind.ENTRY;
import static com.codevision.playground.compiler.model.ControlFlowKind.EXIT;
import static com.codevision.playground.compiler.model.ControlFlowKind.FOR;
import static com.codevision.playground.compiler.model.ControlFlowKind.IF;
import static com.codevision.playground.compiler.model.ControlFlowKind.RETURN;
import static com.codevision.playground.compiler.model.ControlFlowKind.STATEMENT;
import static com.codevision.playground.compiler.model.ControlFlowKind.WHILE;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.codevision.playground.compiler.model.ControlFlowKind;
import com.codevision.playground.compiler.model.ControlFlowNode;

class ControlFlowBuilderTest {

    private final Tokenizer tokenizer = new Tokenizer();
    private final ControlFlowBuilder builder = new ControlFlowBuilder();

    private Optional<ControlFlowNode> build(String source, String function) {
        return builder.build(new Parser(tokenizer.tokenize(source)).parse(), function);
    }

    private ControlFlowNode buildMain(String source) {
        return build(source, "main").orElseThrow();
    }

    /** Kinds along a path without branches; fails if any node has more than one successor. */
    private static List<ControlFlowKind> chain(ControlFlowNode node) {
        var kinds = new ArrayList<ControlFlowKind>();
        while (true) {
            kinds.add(node.getKind());
            assertTrue(node.getChildren().size() <= 1, "unexpected branch at " + node.getId());
            if (node.getChildren().isEmpty()) {
                return kinds;
            }
            node = node.getChildren().get(0);
        }
    }

    @Test
    void declarationThenReturn() {
        var entry = buildMain("int main() { int x = 10; return 0; }");

        assertEquals(List.of(ENTRY, STATEMENT, RETURN, EXIT), chain(entry));
        assertEquals("entry", entry.getId());

        var statement = entry.getChildren().get(0);
        assertEquals("int x = 10", statement.getLabel());
        assertTrue(statement.getId().startsWith("decl_"));
        assertEquals("return 0", statement.getChildren().get(0).getLabel());
        assertEquals("exit", entry.lastReachable().getId());
    }

    @Test
    void noEntryFunctionMeansNoGraph() {
        assertTrue(build("int helper() { return 1; }", "main").isEmpty());
        assertTrue(build("", "main").isEmpty());
    }

    @Test
    void emptyBodyConnectsEntryToExit() {
        assertEquals(List.of(ENTRY, EXIT), chain(buildMain("int main() { }")));
        assertEquals(List.of(ENTRY, EXIT), chain(buildMain("int main();")));
    }

    @Test
    void straightLineCodeIsASingleChain() {
        var entry = buildMain("int main() { int a = 1; foo(a); int b = 2; bar(); x = 3; }");

        assertEquals(List.of(ENTRY, STATEMENT, CALL, STATEMENT, CALL, EXIT), chain(entry));
        assertEquals("foo", entry.getChildren().get(0).getChildren().get(0).getLabel());
    }

    @Test
    void ifOwnsBothBranches() {
        var entry = buildMain("int main() { if (x > 5) { foo(); } else { bar(); } }");

        var branch = entry.getChildren().get(0);
        assertEquals(IF, branch.getKind());
        assertEquals("x > 5", branch.getCondition());
        assertEquals(2, branch.getChildren().size());

        var trueBranch = branch.getChildren().get(0);
        var falseBranch = branch.getChildren().get(1);
        assertEquals("foo", trueBranch.getLabel());
        assertTrue(trueBranch.getChildren().isEmpty());
        assertEquals("bar", falseBranch.getLabel());
        assertEquals(List.of(CALL, EXIT), chain(falseBranch));
    }

    @Test
    void ifAndReturnGetNoSuccessor() {
        var entry = buildMain("int main() { if (a) { foo(); } return 0; bar(); }");

        var branch = entry.getChildren().get(0);
        assertEquals(1, branch.getChildren().size());
        assertEquals(List.of(CALL, EXIT), chain(branch.getChildren().get(0)));
        assertEquals(0, entry.count(RETURN));
    }

    @Test
    void elseIfBecomesIfInFalseBranch() {
        var entry = buildMain("int main() { if (a) { f(); } else if (b) { g(); } }");

        var outer = entry.getChildren().get(0);
        var inner = outer.getChildren().get(1);
        assertEquals(IF, inner.getKind());
        assertEquals("b", inner.getCondition());
        assertEquals(2, entry.count(IF));
    }

    @Test
    void loopListsBodyBeforeSuccessor() {
        var entry = buildMain("int main() { for (i = 0; i < n; i++) { foo(); } return 0; }");

        var loop = entry.getChildren().get(0);
        assertEquals(FOR, loop.getKind());
        assertEquals("i = 0 ; i < n ; i ++", loop.getCondition());
        assertEquals(List.of(CALL, RETURN), loop.getChildren().stream().map(ControlFlowNode::getKind).toList());
        assertEquals(List.of(RETURN, EXIT), chain(loop.getChildren().get(1)));
    }

    @Test
    void whileWithEmptyBody() {
        var entry = buildMain("int main() { while (running) { } done(); }");

        var loop = entry.getChildren().get(0);
        assertEquals(WHILE, loop.getKind());
        assertEquals(List.of(WHILE, CALL, EXIT), chain(loop));
    }

    @Test
    void usesConfiguredEntryFunction() {
        var source = "int main() { return 0; } void run() { go(); }";

        var entry = build(source, "run").orElseThrow();
        assertEquals(List.of(ENTRY, CALL, EXIT), chain(entry));
        assertNull(entry.getCondition());
    }

    @Test
    void idsFollowSyntaxNodeIds() {
        var first = buildMain("int main() { int a = 1; foo(); }");
        var second = buildMain("int main() { int a = 1; foo(); }");

        assertEquals(first.toString(), second.toString());
    }
}
