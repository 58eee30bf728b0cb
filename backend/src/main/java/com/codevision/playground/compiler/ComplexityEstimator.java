package com.codevision.playground.compiler;

import com.codevision.playground.compiler.model.ComplexityClass;
import com.codevision.playground.compiler.model.ComplexityInfo;
import com.codevision.playground.compiler.model.ComplexityInfo.Suggestion;
import com.codevision.playground.compiler.model.ControlFlowKind;
import com.codevision.playground.compiler.model.ControlFlowNode;
import com.codevision.playground.compiler.model.NodeKind;
import com.codevision.playground.compiler.model.SyntaxNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Heuristic time and space estimate. The result is an educational hint drawn from loop nesting,
 * declarations and call sites, not a bound.
 */
@Component
public class ComplexityEstimator {

    private static final Logger logger = LoggerFactory.getLogger(ComplexityEstimator.class);

    static final Suggestion NESTED_LOOPS = new Suggestion(
            "Consider optimizing nested loops",
            "Nested loops lead to O(n²) time complexity. Look for ways to combine or eliminate loops.");

    static final Suggestion UNUSED_VARIABLES = new Suggestion(
            "Remove unused variables",
            "Unused variables consume memory unnecessarily. Consider removing them to optimize space usage.");

    private static final int MANY_VARIABLES = 10;

    public Optional<ComplexityInfo> estimate(SyntaxNode program, ControlFlowNode controlFlow) {
        if (program == null || controlFlow == null) {
            return Optional.empty();
        }

        boolean nestedLoops = hasNestedLoops(program, false);
        int loopCount = program.count(node -> node.kind().isLoop());
        int variableCount = program.count(node -> node.kind() == NodeKind.VARIABLE_DECLARATION);
        int callCount = program.count(node -> node.kind() == NodeKind.FUNCTION_CALL);
        boolean arrays = program.anyMatch(ComplexityEstimator::isArrayDeclaration);
        int decisions = countDecisions(controlFlow);

        ComplexityClass time;
        if (nestedLoops) {
            time = ComplexityClass.QUADRATIC;
        } else if (loopCount > 0) {
            time = ComplexityClass.LINEAR;
        } else {
            time = ComplexityClass.CONSTANT;
        }

        ComplexityClass space;
        if (arrays) {
            space = ComplexityClass.LINEAR;
        } else if (variableCount > MANY_VARIABLES) {
            space = ComplexityClass.LOGARITHMIC;
        } else {
            space = ComplexityClass.CONSTANT;
        }

        List<String> factors = new ArrayList<>();
        if (loopCount > 0) {
            factors.add(loopCount + " loop(s) in the code");
        }
        if (nestedLoops) {
            factors.add("Nested loops detected");
        }
        if (callCount > 0) {
            factors.add("Function calls may contribute to runtime");
        }
        if (decisions > 0) {
            factors.add(decisions + " decision point(s) in the control flow");
        }

        List<String> details = new ArrayList<>();
        details.add(variableCount + " variable(s) declared");
        if (arrays) {
            details.add("Arrays or dynamic data structures detected");
        }

        List<Suggestion> suggestions = new ArrayList<>();
        if (nestedLoops) {
            suggestions.add(NESTED_LOOPS);
        }
        if (hasUnreferencedDeclarations(program)) {
            suggestions.add(UNUSED_VARIABLES);
        }

        logger.debug("Estimated time {} and space {} ({} loop(s), {} declaration(s))",
                time.notation(), space.notation(), loopCount, variableCount);

        return Optional.of(new ComplexityInfo(
                new ComplexityInfo.Time(time, factors),
                new ComplexityInfo.Space(space, details),
                suggestions));
    }

    private static boolean hasNestedLoops(SyntaxNode node, boolean insideLoop) {
        boolean loop = node.kind().isLoop();
        if (insideLoop && loop) {
            return true;
        }
        for (SyntaxNode child : node.children()) {
            if (hasNestedLoops(child, insideLoop || loop)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isArrayDeclaration(SyntaxNode node) {
        if (node.kind() != NodeKind.VARIABLE_DECLARATION) {
            return false;
        }
        String type = node.childValue(NodeKind.TYPE).orElse("");
        return type.contains("[") || type.contains("]");
    }

    private static int countDecisions(ControlFlowNode node) {
        int count = node.getKind().isDecision() ? 1 : 0;
        for (ControlFlowNode child : node.getChildren()) {
            count += countDecisions(child);
        }
        return count;
    }

    /** Name-based check over the whole program; scoping is the resolver's concern. */
    private static boolean hasUnreferencedDeclarations(SyntaxNode program) {
        Set<String> declared = new HashSet<>();
        Set<String> referenced = new HashSet<>();
        collectNames(program, declared, referenced, false);
        return !referenced.containsAll(declared);
    }

    private static void collectNames(SyntaxNode node, Set<String> declared, Set<String> referenced,
            boolean inUseSite) {
        if (node.kind() == NodeKind.VARIABLE_DECLARATION) {
            node.childValue(NodeKind.IDENTIFIER).ifPresent(declared::add);
        }
        if (inUseSite && node.kind() == NodeKind.IDENTIFIER && node.value() != null) {
            referenced.add(node.value());
        }
        boolean useSite = inUseSite || node.kind() == NodeKind.EXPRESSION
                || node.kind() == NodeKind.CONDITION || node.kind() == NodeKind.ARGUMENTS;
        for (SyntaxNode child : node.children()) {
            collectNames(child, declared, referenced, useSite);
        }
    }
}
