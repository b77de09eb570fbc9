package com.vidnyan.pyguard.adapter.out.detector;

import com.vidnyan.pyguard.domain.model.Finding;
import com.vidnyan.pyguard.domain.rule.Rule;
import com.vidnyan.pyguard.domain.rule.RuleCatalog;
import com.vidnyan.pyguard.domain.rule.RuleDescriptor;
import com.vidnyan.pyguard.domain.syntax.Ast;
import com.vidnyan.pyguard.domain.syntax.Node;
import com.vidnyan.pyguard.domain.syntax.NodeKind;
import com.vidnyan.pyguard.domain.traversal.TraversalContext;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.vidnyan.pyguard.domain.model.Category.COMPLEXITY;
import static com.vidnyan.pyguard.domain.model.Severity.LOW;
import static com.vidnyan.pyguard.domain.model.Severity.MEDIUM;

/**
 * Size and shape limits for functions, classes and expressions.
 */
@Component
@Order(3)
public class ComplexityRules implements RuleCatalog {

    static final RuleDescriptor DEEP_NESTING =
            RuleDescriptor.of("C001", "deep-nesting", COMPLEXITY, MEDIUM, "Deeply nested blocks");
    static final RuleDescriptor TOO_MANY_RETURNS =
            RuleDescriptor.of("C002", "too-many-returns", COMPLEXITY, LOW, "Too many return statements");
    static final RuleDescriptor CYCLOMATIC_COMPLEXITY =
            RuleDescriptor.of("C003", "cyclomatic-complexity", COMPLEXITY, MEDIUM, "High cyclomatic complexity");
    static final RuleDescriptor TOO_MANY_PARAMETERS =
            RuleDescriptor.of("C004", "too-many-parameters", COMPLEXITY, MEDIUM, "Too many parameters");
    static final RuleDescriptor ELSE_AFTER_RETURN =
            RuleDescriptor.of("C005", "else-after-return", COMPLEXITY, LOW, "Unnecessary else after return");
    static final RuleDescriptor COMPLEX_BOOLEAN =
            RuleDescriptor.of("C006", "complex-boolean", COMPLEXITY, LOW, "Complex boolean expression");
    static final RuleDescriptor NESTED_COMPREHENSION =
            RuleDescriptor.of("C007", "nested-comprehension", COMPLEXITY, LOW, "Nested comprehension");
    static final RuleDescriptor DEEPLY_NESTED_FUNCTION =
            RuleDescriptor.of("C008", "deeply-nested-function", COMPLEXITY, LOW, "Deeply nested function");
    static final RuleDescriptor NESTED_TERNARY =
            RuleDescriptor.of("C009", "nested-ternary", COMPLEXITY, LOW, "Nested conditional expression");
    static final RuleDescriptor LONG_FUNCTION =
            RuleDescriptor.of("C010", "long-function", COMPLEXITY, MEDIUM, "Long function");

    static final int MAX_NESTING = 4;
    static final int MAX_RETURNS = 6;
    static final int MAX_COMPLEXITY = 10;
    static final int MAX_PARAMETERS = 7;
    static final int MAX_BOOLEAN_OPERANDS = 4;
    static final int MAX_GENERATORS = 2;
    static final int MAX_FUNCTION_NESTING = 3;
    static final int MAX_FUNCTION_LINES = 50;

    private static final String RETURNS = "returns";
    private static final String COMPLEXITY_TALLY = "complexity";

    private static final Set<NodeKind> DEFS = Set.of(NodeKind.FUNCTION_DEF, NodeKind.ASYNC_FUNCTION_DEF);

    private static final Set<NodeKind> BLOCKS = Set.of(
            NodeKind.IF, NodeKind.FOR, NodeKind.ASYNC_FOR, NodeKind.WHILE, NodeKind.WITH, NodeKind.ASYNC_WITH,
            NodeKind.TRY, NodeKind.MATCH);

    private static final Set<NodeKind> DECISIONS = Set.of(
            NodeKind.IF, NodeKind.FOR, NodeKind.ASYNC_FOR, NodeKind.WHILE, NodeKind.EXCEPT_HANDLER,
            NodeKind.IF_EXP, NodeKind.BOOL_OP, NodeKind.COMPREHENSION, NodeKind.MATCH_CASE,
            NodeKind.FUNCTION_DEF, NodeKind.ASYNC_FUNCTION_DEF);

    private static final Set<NodeKind> COMPREHENSIONS = Set.of(
            NodeKind.LIST_COMP, NodeKind.SET_COMP, NodeKind.DICT_COMP, NodeKind.GENERATOR_EXP);

    @Override
    public List<Rule> rules() {
        return List.of(
                Rule.of(DEEP_NESTING, BLOCKS, ComplexityRules::deepNesting),
                Rule.of(TOO_MANY_RETURNS, Set.of(NodeKind.RETURN, NodeKind.FUNCTION_DEF, NodeKind.ASYNC_FUNCTION_DEF),
                        ComplexityRules::countReturn, ComplexityRules::tooManyReturns),
                Rule.of(CYCLOMATIC_COMPLEXITY, DECISIONS,
                        ComplexityRules::countDecision, ComplexityRules::cyclomaticComplexity),
                Rule.of(TOO_MANY_PARAMETERS, DEFS, ComplexityRules::tooManyParameters),
                Rule.of(ELSE_AFTER_RETURN, Set.of(NodeKind.IF), ComplexityRules::elseAfterReturn),
                Rule.of(COMPLEX_BOOLEAN, Set.of(NodeKind.BOOL_OP), ComplexityRules::complexBoolean),
                Rule.of(NESTED_COMPREHENSION, COMPREHENSIONS, ComplexityRules::nestedComprehension),
                Rule.of(DEEPLY_NESTED_FUNCTION, DEFS, ComplexityRules::deeplyNestedFunction),
                Rule.of(NESTED_TERNARY, Set.of(NodeKind.IF_EXP), ComplexityRules::nestedTernary),
                Rule.of(LONG_FUNCTION, DEFS, ComplexityRules::longFunction)
        );
    }

    private static Optional<Finding> deepNesting(Node node, TraversalContext ctx) {
        if (node instanceof Ast.If branch && branch.elif()) {
            return Optional.empty();
        }
        int depth = ctx.controlDepth() + 1;
        if (depth <= MAX_NESTING || !ctx.scope().markOnce("deep-nesting")) {
            return Optional.empty();
        }
        return DEEP_NESTING.report(node, ctx,
                "Blocks nested " + depth + " levels deep (limit " + MAX_NESTING + ")",
                "Return early with guard clauses or extract the inner block into a function");
    }

    // ---------------------------------------------------------------- C002

    private static Optional<Finding> countReturn(Node node, TraversalContext ctx) {
        if (node.kind() == NodeKind.RETURN) {
            ctx.nearestDef().ifPresent(frame -> frame.tally(RETURNS));
        }
        return Optional.empty();
    }

    private static Optional<Finding> tooManyReturns(Node node, TraversalContext ctx) {
        if (!(node instanceof Ast.FunctionDef function)) {
            return Optional.empty();
        }
        int returns = ctx.nearestDef().map(frame -> frame.count(RETURNS)).orElse(0);
        if (returns <= MAX_RETURNS) {
            return Optional.empty();
        }
        return TOO_MANY_RETURNS.report(node, ctx,
                "Function '" + function.name() + "' has " + returns + " return statements (limit " + MAX_RETURNS + ")",
                "Consolidate the exit points, for example with a lookup table or a single result variable");
    }

    // ---------------------------------------------------------------- C003

    /**
     * Adds the decision points a node contributes to the enclosing function:
     * one per branch, loop, handler, case and conditional expression, one per
     * extra boolean operand, and one per comprehension clause and filter.
     */
    private static Optional<Finding> countDecision(Node node, TraversalContext ctx) {
        int points;
        if (node.kind().isFunction()) {
            return Optional.empty();
        } else if (node instanceof Ast.BoolOp bool) {
            points = bool.values().size() - 1;
        } else if (node instanceof Ast.Comprehension generator) {
            points = 1 + generator.ifs().size();
        } else {
            points = 1;
        }
        ctx.nearestDef().ifPresent(frame -> frame.tally(COMPLEXITY_TALLY, points));
        return Optional.empty();
    }

    private static Optional<Finding> cyclomaticComplexity(Node node, TraversalContext ctx) {
        if (!(node instanceof Ast.FunctionDef function)) {
            return Optional.empty();
        }
        int complexity = 1 + ctx.nearestDef().map(frame -> frame.count(COMPLEXITY_TALLY)).orElse(0);
        if (complexity <= MAX_COMPLEXITY) {
            return Optional.empty();
        }
        return CYCLOMATIC_COMPLEXITY.report(node, ctx,
                "Function '" + function.name() + "' has cyclomatic complexity " + complexity
                        + " (limit " + MAX_COMPLEXITY + ")",
                "Split the function into smaller ones or replace branching with polymorphism or lookup tables");
    }

    // ---------------------------------------------------------------- C004

    private static Optional<Finding> tooManyParameters(Node node, TraversalContext ctx) {
        Ast.FunctionDef function = (Ast.FunctionDef) node;
        long count = function.args().all().stream()
                .map(Ast.Arg::name)
                .filter(name -> !name.equals("self") && !name.equals("cls"))
                .count();
        if (count <= MAX_PARAMETERS) {
            return Optional.empty();
        }
        return TOO_MANY_PARAMETERS.report(node, ctx,
                "Function '" + function.name() + "' takes " + count + " parameters (limit " + MAX_PARAMETERS + ")",
                "Group related parameters into a dataclass or split the function");
    }

    private static Optional<Finding> elseAfterReturn(Node node, TraversalContext ctx) {
        Ast.If branch = (Ast.If) node;
        if (branch.elif() || branch.orelse().isEmpty() || branch.body().isEmpty()) {
            return Optional.empty();
        }
        Node last = branch.body().get(branch.body().size() - 1);
        if (!(last instanceof Ast.Return || last instanceof Ast.Raise)) {
            return Optional.empty();
        }
        String jump = last instanceof Ast.Return ? "return" : "raise";
        return ELSE_AFTER_RETURN.report(node, ctx,
                "Unnecessary " + (branch.hasElifBranch() ? "elif" : "else") + " after " + jump,
                "Drop the else and dedent its body; the if branch already leaves the function");
    }

    private static Optional<Finding> complexBoolean(Node node, TraversalContext ctx) {
        if (ctx.parentIs(NodeKind.BOOL_OP)) {
            return Optional.empty();
        }
        int operands = operandCount(node);
        if (operands <= MAX_BOOLEAN_OPERANDS) {
            return Optional.empty();
        }
        return COMPLEX_BOOLEAN.report(node, ctx,
                "Boolean expression combines " + operands + " operands (limit " + MAX_BOOLEAN_OPERANDS + ")",
                "Name the sub-conditions with well-named variables or helper functions");
    }

    private static int operandCount(Node node) {
        if (node instanceof Ast.BoolOp bool) {
            return bool.values().stream().mapToInt(ComplexityRules::operandCount).sum();
        }
        return 1;
    }

    private static Optional<Finding> nestedComprehension(Node node, TraversalContext ctx) {
        int generators = (int) node.children().stream().filter(Ast.Comprehension.class::isInstance).count();
        boolean nested = ctx.comprehensionDepth() > 0;
        if (!nested && generators <= MAX_GENERATORS) {
            return Optional.empty();
        }
        String message = nested
                ? "Comprehension nested inside another comprehension"
                : "Comprehension with " + generators + " for-clauses";
        return NESTED_COMPREHENSION.report(node, ctx, message,
                "Use explicit loops or split the work into named steps");
    }

    private static Optional<Finding> deeplyNestedFunction(Node node, TraversalContext ctx) {
        int enclosing = ctx.defDepth();
        if (enclosing < MAX_FUNCTION_NESTING) {
            return Optional.empty();
        }
        return DEEPLY_NESTED_FUNCTION.report(node, ctx,
                "Function '" + ((Ast.FunctionDef) node).name() + "' is nested " + enclosing + " functions deep",
                "Move the inner function to module level or into a class");
    }

    private static Optional<Finding> nestedTernary(Node node, TraversalContext ctx) {
        if (!ctx.parentIs(NodeKind.IF_EXP)
                || ctx.ancestor(2).map(grand -> grand.kind() == NodeKind.IF_EXP).orElse(false)) {
            return Optional.empty();
        }
        return NESTED_TERNARY.report(node, ctx,
                "Conditional expression nested inside another conditional expression",
                "Use an if/elif statement or a lookup table");
    }

    private static Optional<Finding> longFunction(Node node, TraversalContext ctx) {
        Ast.FunctionDef function = (Ast.FunctionDef) node;
        int lines = function.span().lineCount();
        if (lines <= MAX_FUNCTION_LINES) {
            return Optional.empty();
        }
        return LONG_FUNCTION.report(node, ctx,
                "Function '" + function.name() + "' spans " + lines + " lines (limit " + MAX_FUNCTION_LINES + ")",
                "Extract cohesive steps into helper functions");
    }
}
