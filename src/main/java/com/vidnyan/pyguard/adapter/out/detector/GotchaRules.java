package com.vidnyan.pyguard.adapter.out.detector;

import com.vidnyan.pyguard.domain.model.Finding;
import com.vidnyan.pyguard.domain.rule.Rule;
import com.vidnyan.pyguard.domain.rule.RuleCatalog;
import com.vidnyan.pyguard.domain.rule.RuleDescriptor;
import com.vidnyan.pyguard.domain.syntax.Ast;
import com.vidnyan.pyguard.domain.syntax.Ast.ConstantType;
import com.vidnyan.pyguard.domain.syntax.Node;
import com.vidnyan.pyguard.domain.syntax.NodeKind;
import com.vidnyan.pyguard.domain.traversal.FrameKind;
import com.vidnyan.pyguard.domain.traversal.ScopeFrame;
import com.vidnyan.pyguard.domain.traversal.TraversalContext;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiPredicate;

import static com.vidnyan.pyguard.domain.model.Category.GOTCHA;
import static com.vidnyan.pyguard.domain.model.Severity.HIGH;
import static com.vidnyan.pyguard.domain.model.Severity.LOW;
import static com.vidnyan.pyguard.domain.model.Severity.MEDIUM;

/**
 * Python-specific traps: identity versus equality, closures over loop
 * variables, mutation during iteration and similar surprises.
 */
@Component
@Order(7)
public class GotchaRules implements RuleCatalog {

    static final RuleDescriptor IDENTITY_LITERAL =
            RuleDescriptor.of("G001", "identity-literal", GOTCHA, MEDIUM, "Identity comparison with literal");
    static final RuleDescriptor NONE_EQUALITY =
            RuleDescriptor.of("G002", "none-equality", GOTCHA, MEDIUM, "Equality comparison with None");
    static final RuleDescriptor TYPE_COMPARISON =
            RuleDescriptor.of("G003", "type-comparison", GOTCHA, LOW, "type() compared with ==");
    static final RuleDescriptor MODIFY_WHILE_ITERATING =
            RuleDescriptor.of("G004", "modify-while-iterating", GOTCHA, HIGH, "Collection modified while iterating");
    static final RuleDescriptor SILENT_EXCEPTION =
            RuleDescriptor.of("G005", "silent-exception", GOTCHA, MEDIUM, "Exception silently ignored");
    static final RuleDescriptor BOOL_EQUALITY =
            RuleDescriptor.of("G006", "bool-equality", GOTCHA, LOW, "Equality comparison with True/False");
    static final RuleDescriptor LATE_BINDING_CLOSURE =
            RuleDescriptor.of("G007", "late-binding-closure", GOTCHA, MEDIUM, "Closure captures loop variable");
    static final RuleDescriptor INIT_RETURNS_VALUE =
            RuleDescriptor.of("G008", "init-returns-value", GOTCHA, HIGH, "__init__ returns a value");
    static final RuleDescriptor FSTRING_WITHOUT_PLACEHOLDERS =
            RuleDescriptor.of("G009", "fstring-without-placeholders", GOTCHA, LOW, "f-string without placeholders");
    static final RuleDescriptor SELF_COMPARISON =
            RuleDescriptor.of("G010", "self-comparison", GOTCHA, LOW, "Comparison with itself");

    private static final Set<String> IDENTITY_OPS = Set.of("is", "is not");
    private static final Set<String> EQUALITY_OPS = Set.of("==", "!=");
    private static final Set<String> ORDERING_OPS = Set.of("==", "!=", "<", ">", "<=", ">=", "is", "is not");

    private static final Set<ConstantType> VALUE_LITERALS = Set.of(
            ConstantType.INT, ConstantType.FLOAT, ConstantType.COMPLEX, ConstantType.STRING, ConstantType.BYTES);

    private static final Set<String> MUTATORS = Set.of(
            "append", "extend", "insert", "remove", "pop", "clear", "add", "discard", "update",
            "popitem", "setdefault");

    @Override
    public List<Rule> rules() {
        Set<NodeKind> comparisons = Set.of(NodeKind.COMPARE);
        return List.of(
                Rule.of(IDENTITY_LITERAL, comparisons, GotchaRules::identityLiteral),
                Rule.of(NONE_EQUALITY, comparisons, GotchaRules::noneEquality),
                Rule.of(TYPE_COMPARISON, comparisons, GotchaRules::typeComparison),
                Rule.of(MODIFY_WHILE_ITERATING, Set.of(NodeKind.CALL, NodeKind.DELETE),
                        GotchaRules::modifyWhileIterating),
                Rule.of(SILENT_EXCEPTION, Set.of(NodeKind.EXCEPT_HANDLER), GotchaRules::silentException),
                Rule.of(BOOL_EQUALITY, comparisons, GotchaRules::boolEquality),
                Rule.of(LATE_BINDING_CLOSURE, Set.of(NodeKind.NAME), GotchaRules::lateBindingClosure),
                Rule.of(INIT_RETURNS_VALUE, Set.of(NodeKind.RETURN), GotchaRules::initReturnsValue),
                Rule.of(FSTRING_WITHOUT_PLACEHOLDERS, Set.of(NodeKind.JOINED_STR),
                        GotchaRules::fstringWithoutPlaceholders),
                Rule.of(SELF_COMPARISON, comparisons, GotchaRules::selfComparison)
        );
    }

    // ------------------------------------------------------- comparisons

    private static Optional<Finding> identityLiteral(Node node, TraversalContext ctx) {
        String op = firstPair((Ast.Compare) node, (left, right) -> isValueLiteral(left) || isValueLiteral(right),
                IDENTITY_OPS);
        if (op == null) {
            return Optional.empty();
        }
        return IDENTITY_LITERAL.report(node, ctx,
                "'" + op + "' compares object identity, not value, against a literal",
                "Use " + (op.equals("is") ? "==" : "!=") + " for values; keep 'is' for None, True and False");
    }

    private static Optional<Finding> noneEquality(Node node, TraversalContext ctx) {
        String op = firstPair((Ast.Compare) node,
                (left, right) -> isConstant(left, ConstantType.NONE) || isConstant(right, ConstantType.NONE),
                EQUALITY_OPS);
        if (op == null) {
            return Optional.empty();
        }
        return NONE_EQUALITY.report(node, ctx,
                "Comparison to None with '" + op + "' can be fooled by a custom __eq__",
                "Use '" + (op.equals("==") ? "is None" : "is not None") + "'");
    }

    private static Optional<Finding> typeComparison(Node node, TraversalContext ctx) {
        String op = firstPair((Ast.Compare) node,
                (left, right) -> AstQueries.isCallTo(left, "type") || AstQueries.isCallTo(right, "type"),
                EQUALITY_OPS);
        if (op == null) {
            return Optional.empty();
        }
        return TYPE_COMPARISON.report(node, ctx,
                "type() compared with '" + op + "' ignores subclasses",
                "Use isinstance(obj, T)");
    }

    private static Optional<Finding> boolEquality(Node node, TraversalContext ctx) {
        String op = firstPair((Ast.Compare) node,
                (left, right) -> isBool(left) || isBool(right), EQUALITY_OPS);
        if (op == null) {
            return Optional.empty();
        }
        return BOOL_EQUALITY.report(node, ctx,
                "Comparison to True/False with '" + op + "'",
                "Test the value directly: 'if flag:' or 'if not flag:'");
    }

    private static Optional<Finding> selfComparison(Node node, TraversalContext ctx) {
        String op = firstPair((Ast.Compare) node, GotchaRules::sameReference, ORDERING_OPS);
        if (op == null) {
            return Optional.empty();
        }
        return SELF_COMPARISON.report(node, ctx,
                "Expression compared with itself using '" + op + "'",
                "Compare against the intended value; use math.isnan(x) to test for NaN");
    }

    /**
     * First operator among {@code ops} whose operand pair satisfies {@code test},
     * walking chained comparisons pairwise ({@code a < b < c} is {@code a < b}, {@code b < c}).
     */
    private static String firstPair(Ast.Compare compare, BiPredicate<Node, Node> test, Set<String> ops) {
        Node left = compare.left();
        for (int i = 0; i < compare.ops().size() && i < compare.comparators().size(); i++) {
            Node right = compare.comparators().get(i);
            String op = compare.ops().get(i);
            if (ops.contains(op) && test.test(left, right)) {
                return op;
            }
            left = right;
        }
        return null;
    }

    private static boolean isValueLiteral(Node node) {
        return node instanceof Ast.Constant constant && VALUE_LITERALS.contains(constant.type());
    }

    private static boolean isConstant(Node node, ConstantType type) {
        return AstQueries.isConstant(node, type);
    }

    private static boolean isBool(Node node) {
        return node instanceof Ast.Constant constant && constant.isBool();
    }

    private static boolean sameReference(Node left, Node right) {
        Optional<String> name = AstQueries.dottedName(left);
        return name.isPresent() && name.equals(AstQueries.dottedName(right));
    }

    // ---------------------------------------------------------------- G004

    private static Optional<Finding> modifyWhileIterating(Node node, TraversalContext ctx) {
        String collection = null;
        String action = null;
        if (node instanceof Ast.Call call) {
            String method = AstQueries.methodName(call);
            if (method != null && MUTATORS.contains(method)) {
                collection = AstQueries.receiverName(call);
                action = "." + method + "()";
            }
        } else {
            for (Node target : ((Ast.Delete) node).targets()) {
                if (target instanceof Ast.Subscript subscript && subscript.value() instanceof Ast.Name name) {
                    collection = name.id();
                    action = "del";
                    break;
                }
            }
        }
        if (collection == null) {
            return Optional.empty();
        }
        String modified = collection;
        Optional<ScopeFrame> loop = ctx.loopOver(modified);
        if (loop.isEmpty() || !loop.get().markOnce("mutated:" + modified)) {
            return Optional.empty();
        }
        return MODIFY_WHILE_ITERATING.report(node, ctx,
                "'" + modified + "' is modified with " + action + " while a for loop iterates over it",
                "Iterate over a copy (for x in list(" + modified + "):) or build a new collection");
    }

    private static Optional<Finding> silentException(Node node, TraversalContext ctx) {
        Ast.ExceptHandler handler = (Ast.ExceptHandler) node;
        if (!RuntimeRules.isSilent(handler)) {
            return Optional.empty();
        }
        String caught = handler.type() == null ? "every exception" : AstQueries.describe(handler.type());
        return SILENT_EXCEPTION.report(node, ctx,
                "Handler for " + caught + " silently discards the error",
                "Log the exception, handle it, or let it propagate");
    }

    // ---------------------------------------------------------------- G007

    /**
     * A name read inside a lambda or nested def that is bound by the loop directly
     * enclosing that closure, and not captured through a parameter default.
     */
    private static Optional<Finding> lateBindingClosure(Node node, TraversalContext ctx) {
        String name = ((Ast.Name) node).id();
        Optional<ScopeFrame> closure = ctx.nearestFunction();
        if (closure.isEmpty() || isBindingTarget(node, ctx) || boundInsideClosure(name, ctx)) {
            return Optional.empty();
        }
        Optional<ScopeFrame> loop = ctx.loopAroundClosure();
        if (loop.isEmpty() || !loop.get().binds(name) || !closure.get().markOnce("late-binding:" + name)) {
            return Optional.empty();
        }
        return LATE_BINDING_CLOSURE.report(closure.get().node(), ctx,
                "Closure reads loop variable '" + name + "', which is looked up when it runs, not when it is created",
                "Bind the current value with a default argument (lambda " + name + "=" + name + ": ...)"
                        + " or use functools.partial");
    }

    /**
     * Parameters, and loop, comprehension, with and handler names inside the closure itself.
     */
    private static boolean boundInsideClosure(String name, TraversalContext ctx) {
        List<ScopeFrame> frames = ctx.frames();
        for (int i = frames.size() - 1; i >= 0; i--) {
            ScopeFrame frame = frames.get(i);
            if (frame.binds(name)) {
                return true;
            }
            if (frame.kind() == FrameKind.FUNCTION) {
                return false;
            }
        }
        return false;
    }

    private static boolean isBindingTarget(Node node, TraversalContext ctx) {
        Node parent = ctx.parent().orElse(null);
        if (parent instanceof Ast.Assign assign) {
            return assign.targets().contains(node);
        }
        if (parent instanceof Ast.AugAssign augmented) {
            return augmented.target() == node;
        }
        if (parent instanceof Ast.AnnAssign annotated) {
            return annotated.target() == node;
        }
        if (parent instanceof Ast.For loop) {
            return loop.target() == node;
        }
        if (parent instanceof Ast.Comprehension generator) {
            return generator.target() == node;
        }
        return parent instanceof Ast.NamedExpr named && named.target() == node;
    }

    private static Optional<Finding> initReturnsValue(Node node, TraversalContext ctx) {
        Node value = ((Ast.Return) node).value();
        boolean inInit = ctx.nearestDef()
                .map(frame -> ((Ast.FunctionDef) frame.node()).name().equals("__init__"))
                .orElse(false);
        if (!inInit || value == null || isConstant(value, ConstantType.NONE)) {
            return Optional.empty();
        }
        return INIT_RETURNS_VALUE.report(node, ctx,
                "__init__ returns a value, which raises TypeError at instantiation",
                "Remove the return value; use a classmethod factory to build alternative instances");
    }

    private static Optional<Finding> fstringWithoutPlaceholders(Node node, TraversalContext ctx) {
        if (((Ast.JoinedStr) node).hasPlaceholders() || ctx.parentIs(NodeKind.FORMATTED_VALUE)) {
            return Optional.empty();
        }
        return FSTRING_WITHOUT_PLACEHOLDERS.report(node, ctx,
                "f-string has no replacement fields",
                "Drop the f prefix or add the missing {placeholder}");
    }
}
