package com.vidnyan.pyguard.adapter.out.detector;

import com.vidnyan.pyguard.domain.model.Finding;
import com.vidnyan.pyguard.domain.rule.Rule;
import com.vidnyan.pyguard.domain.rule.RuleCatalog;
import com.vidnyan.pyguard.domain.rule.RuleDescriptor;
import com.vidnyan.pyguard.domain.syntax.Ast;
import com.vidnyan.pyguard.domain.syntax.Node;
import com.vidnyan.pyguard.domain.syntax.NodeKind;
import com.vidnyan.pyguard.domain.traversal.FrameKind;
import com.vidnyan.pyguard.domain.traversal.ScopeFrame;
import com.vidnyan.pyguard.domain.traversal.TraversalContext;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.vidnyan.pyguard.domain.model.Category.RUNTIME;
import static com.vidnyan.pyguard.domain.model.Severity.HIGH;
import static com.vidnyan.pyguard.domain.model.Severity.MEDIUM;

/**
 * Code that misbehaves at run time: shared mutable state, swallowed errors,
 * dynamic evaluation and similar traps.
 */
@Component
@Order(1)
public class RuntimeRules implements RuleCatalog {

    static final RuleDescriptor MUTABLE_DEFAULT =
            RuleDescriptor.of("R001", "mutable-default", RUNTIME, HIGH, "Mutable default argument");
    static final RuleDescriptor DANGEROUS_EVAL =
            RuleDescriptor.of("R002", "dangerous-eval", RUNTIME, HIGH, "eval/exec call");
    static final RuleDescriptor BARE_EXCEPT =
            RuleDescriptor.of("R003", "bare-except", RUNTIME, MEDIUM, "Bare except clause");
    static final RuleDescriptor ASSERT_IN_PRODUCTION =
            RuleDescriptor.of("R004", "assert-in-production", RUNTIME, HIGH, "assert used for validation");
    static final RuleDescriptor GLOBAL_STATEMENT =
            RuleDescriptor.of("R005", "global-statement", RUNTIME, MEDIUM, "global statement");
    static final RuleDescriptor MUTABLE_CLASS_ATTRIBUTE =
            RuleDescriptor.of("R006", "mutable-class-attribute", RUNTIME, MEDIUM, "Mutable class attribute");
    static final RuleDescriptor RETURN_IN_FINALLY =
            RuleDescriptor.of("R007", "return-in-finally", RUNTIME, HIGH, "return inside finally");
    static final RuleDescriptor SHADOWED_BUILTIN =
            RuleDescriptor.of("R008", "shadowed-builtin", RUNTIME, MEDIUM, "Builtin name shadowed");
    static final RuleDescriptor EQ_WITHOUT_HASH =
            RuleDescriptor.of("R009", "eq-without-hash", RUNTIME, MEDIUM, "__eq__ without __hash__");
    static final RuleDescriptor ASYNC_WITHOUT_ERROR_HANDLING =
            RuleDescriptor.of("R010", "async-without-error-handling", RUNTIME, MEDIUM, "Async function without error handling");
    static final RuleDescriptor EXCEPT_WITHOUT_LOGGING =
            RuleDescriptor.of("R011", "except-without-logging", RUNTIME, MEDIUM, "Exception handled without logging");

    static final String CONTAINS_TRY = "contains-try";

    static final Set<String> BUILTINS = Set.of(
            "abs", "all", "any", "bin", "bool", "bytes", "callable", "chr", "compile", "dict", "dir",
            "enumerate", "filter", "float", "format", "frozenset", "hash", "help", "hex", "id", "input",
            "int", "iter", "len", "list", "map", "max", "min", "next", "object", "oct", "open", "ord",
            "pow", "print", "range", "repr", "reversed", "round", "set", "slice", "sorted", "str", "sum",
            "super", "tuple", "type", "vars", "zip");

    private static final Set<NodeKind> SIMPLE_STATEMENTS = Set.of(
            NodeKind.EXPR, NodeKind.ASSIGN, NodeKind.AUG_ASSIGN, NodeKind.ANN_ASSIGN, NodeKind.RETURN);

    private static final Set<NodeKind> FUNCTIONS =
            Set.of(NodeKind.FUNCTION_DEF, NodeKind.ASYNC_FUNCTION_DEF, NodeKind.LAMBDA);

    @Override
    public List<Rule> rules() {
        return List.of(
                Rule.of(MUTABLE_DEFAULT, FUNCTIONS, RuntimeRules::mutableDefault),
                Rule.of(DANGEROUS_EVAL, Set.of(NodeKind.CALL), RuntimeRules::dangerousEval),
                Rule.of(BARE_EXCEPT, Set.of(NodeKind.EXCEPT_HANDLER), RuntimeRules::bareExcept),
                Rule.of(ASSERT_IN_PRODUCTION, Set.of(NodeKind.ASSERT), (node, ctx) -> ASSERT_IN_PRODUCTION.report(
                        node, ctx, "assert statements are stripped when Python runs with -O",
                        "Raise an explicit exception (ValueError, TypeError) for runtime validation")),
                Rule.of(GLOBAL_STATEMENT, Set.of(NodeKind.GLOBAL), RuntimeRules::globalStatement),
                Rule.of(MUTABLE_CLASS_ATTRIBUTE, Set.of(NodeKind.ASSIGN, NodeKind.ANN_ASSIGN),
                        RuntimeRules::mutableClassAttribute),
                Rule.of(RETURN_IN_FINALLY, Set.of(NodeKind.RETURN), RuntimeRules::returnInFinally),
                Rule.of(SHADOWED_BUILTIN, Set.of(NodeKind.ARG, NodeKind.ASSIGN), RuntimeRules::shadowedBuiltin),
                Rule.of(EQ_WITHOUT_HASH, Set.of(NodeKind.CLASS_DEF), RuntimeRules::eqWithoutHash),
                Rule.of(ASYNC_WITHOUT_ERROR_HANDLING, Set.of(NodeKind.ASYNC_FUNCTION_DEF, NodeKind.TRY),
                        RuntimeRules::markTry, RuntimeRules::asyncWithoutErrorHandling),
                Rule.of(EXCEPT_WITHOUT_LOGGING, Set.of(NodeKind.EXCEPT_HANDLER), RuntimeRules::exceptWithoutLogging)
        );
    }

    // ------------------------------------------------------------------ R001

    private static Optional<Finding> mutableDefault(Node node, TraversalContext ctx) {
        Ast.Arguments args;
        String name;
        if (node instanceof Ast.FunctionDef function) {
            args = function.args();
            name = function.name() + "()";
        } else {
            args = ((Ast.Lambda) node).args();
            name = "lambda";
        }
        List<String> offenders = mutableDefaultParameters(args);
        if (offenders.isEmpty()) {
            return Optional.empty();
        }
        return MUTABLE_DEFAULT.report(node, ctx,
                "Mutable default argument '" + String.join("', '", offenders) + "' in " + name
                        + " is shared between calls",
                "Use None as the default and create the object inside the function body");
    }

    static List<String> mutableDefaultParameters(Ast.Arguments args) {
        List<Ast.Arg> positional = new ArrayList<>(args.posonly());
        positional.addAll(args.args());
        List<String> offenders = new ArrayList<>();
        int offset = positional.size() - args.defaults().size();
        for (int i = 0; i < args.defaults().size(); i++) {
            if (AstQueries.isMutableValue(args.defaults().get(i)) && offset + i >= 0) {
                offenders.add(positional.get(offset + i).name());
            }
        }
        for (int i = 0; i < args.kwonly().size() && i < args.kwDefaults().size(); i++) {
            Node value = args.kwDefaults().get(i);
            if (value != null && AstQueries.isMutableValue(value)) {
                offenders.add(args.kwonly().get(i).name());
            }
        }
        return offenders;
    }

    // ------------------------------------------------------------- R002-R008

    private static Optional<Finding> dangerousEval(Node node, TraversalContext ctx) {
        Ast.Call call = (Ast.Call) node;
        if (!(call.func() instanceof Ast.Name name) || !(name.id().equals("eval") || name.id().equals("exec"))) {
            return Optional.empty();
        }
        return DANGEROUS_EVAL.report(node, ctx,
                name.id() + "() executes arbitrary code",
                "Use ast.literal_eval for literals, json for data, or an explicit dispatch table");
    }

    private static Optional<Finding> bareExcept(Node node, TraversalContext ctx) {
        if (((Ast.ExceptHandler) node).type() != null) {
            return Optional.empty();
        }
        return BARE_EXCEPT.report(node, ctx,
                "Bare 'except:' also catches SystemExit and KeyboardInterrupt",
                "Catch a specific exception, or at least 'except Exception:'");
    }

    private static Optional<Finding> globalStatement(Node node, TraversalContext ctx) {
        Ast.Global global = (Ast.Global) node;
        return GLOBAL_STATEMENT.report(node, ctx,
                "global statement rebinds module state: " + String.join(", ", global.names()),
                "Pass values as parameters and return results, or keep state in a class");
    }

    private static Optional<Finding> mutableClassAttribute(Node node, TraversalContext ctx) {
        if (!ctx.isDirectlyIn(FrameKind.CLASS)) {
            return Optional.empty();
        }
        List<Node> targets;
        Node value;
        if (node instanceof Ast.Assign assign) {
            targets = assign.targets();
            value = assign.value();
        } else {
            Ast.AnnAssign annotated = (Ast.AnnAssign) node;
            targets = List.of(annotated.target());
            value = annotated.value();
        }
        if (value == null || !AstQueries.isMutableValue(value)) {
            return Optional.empty();
        }
        for (Node target : targets) {
            if (target instanceof Ast.Name name && !isDunder(name.id())) {
                return MUTABLE_CLASS_ATTRIBUTE.report(node, ctx,
                        "Class attribute '" + name.id() + "' holds a mutable object shared by all instances",
                        "Initialize it in __init__ (self." + name.id() + " = ...) or use dataclasses.field(default_factory=...)");
            }
        }
        return Optional.empty();
    }

    private static Optional<Finding> returnInFinally(Node node, TraversalContext ctx) {
        if (!ctx.isInFinally()) {
            return Optional.empty();
        }
        return RETURN_IN_FINALLY.report(node, ctx,
                "return inside finally silently discards any in-flight exception",
                "Move the return after the try statement");
    }

    private static Optional<Finding> shadowedBuiltin(Node node, TraversalContext ctx) {
        if (node instanceof Ast.Arg arg) {
            if (!BUILTINS.contains(arg.name())) {
                return Optional.empty();
            }
            return SHADOWED_BUILTIN.report(node, ctx,
                    "Parameter '" + arg.name() + "' shadows the builtin " + arg.name() + "()",
                    "Rename it, for example '" + arg.name() + "_' or a more descriptive name");
        }
        for (Node target : ((Ast.Assign) node).targets()) {
            for (String bound : Ast.boundNames(target)) {
                if (BUILTINS.contains(bound)) {
                    return SHADOWED_BUILTIN.report(node, ctx,
                            "Assignment to '" + bound + "' shadows the builtin " + bound + "()",
                            "Pick a different variable name");
                }
            }
        }
        return Optional.empty();
    }

    // ------------------------------------------------------------------ R009

    private static Optional<Finding> eqWithoutHash(Node node, TraversalContext ctx) {
        Ast.ClassDef cls = (Ast.ClassDef) node;
        boolean definesEq = false;
        boolean definesHash = false;
        for (Node statement : cls.body()) {
            if (statement instanceof Ast.FunctionDef method) {
                definesEq |= method.name().equals("__eq__");
                definesHash |= method.name().equals("__hash__");
            } else if (statement instanceof Ast.Assign assign) {
                definesHash |= assign.targets().stream().anyMatch(t -> AstQueries.isNameOf(t, "__hash__"));
            }
        }
        if (!definesEq || definesHash) {
            return Optional.empty();
        }
        return EQ_WITHOUT_HASH.report(node, ctx,
                "Class '" + cls.name() + "' defines __eq__ without __hash__, so instances are unhashable",
                "Define __hash__ consistently with __eq__, or set __hash__ = None explicitly");
    }

    // ------------------------------------------------------------------ R010

    /**
     * Marks every enclosing function: a try nested in an inner def still counts for the outer one.
     */
    static Optional<Finding> markTry(Node node, TraversalContext ctx) {
        if (node.kind() == NodeKind.TRY) {
            for (ScopeFrame frame : ctx.frames()) {
                if (frame.kind() == FrameKind.FUNCTION && frame.node().kind().isFunction()) {
                    frame.mark(CONTAINS_TRY);
                }
            }
        }
        return Optional.empty();
    }

    private static Optional<Finding> asyncWithoutErrorHandling(Node node, TraversalContext ctx) {
        if (node.kind() != NodeKind.ASYNC_FUNCTION_DEF) {
            return Optional.empty();
        }
        Ast.FunctionDef function = (Ast.FunctionDef) node;
        boolean guarded = ctx.nearestDef().map(frame -> frame.isMarked(CONTAINS_TRY)).orElse(false);
        if (guarded) {
            return Optional.empty();
        }
        return ASYNC_WITHOUT_ERROR_HANDLING.report(node, ctx,
                "async function '" + function.name() + "' has no try/except; failures surface only when awaited",
                "Wrap awaited I/O in try/except and log or translate the error");
    }

    // ------------------------------------------------------------------ R011

    private static Optional<Finding> exceptWithoutLogging(Node node, TraversalContext ctx) {
        if (!(node instanceof Ast.ExceptHandler handler)
                || handler.body().stream().anyMatch(RuntimeRules::logsOrRaises)) {
            return Optional.empty();
        }
        return EXCEPT_WITHOUT_LOGGING.report(node, ctx,
                "try-except block handles the error without logging or re-raising it",
                "Log the exception (logger.exception(...)) or re-raise it with context");
    }

    /**
     * A direct handler statement that raises, or a simple statement calling a logging function.
     * Bodies of nested compound statements are not searched.
     */
    private static boolean logsOrRaises(Node statement) {
        if (statement instanceof Ast.Raise) {
            return true;
        }
        return SIMPLE_STATEMENTS.contains(statement.kind()) && containsLoggingCall(statement);
    }

    private static boolean containsLoggingCall(Node node) {
        if (node instanceof Ast.Call call && AstQueries.isLoggingCall(call)) {
            return true;
        }
        for (Node child : node.children()) {
            if (containsLoggingCall(child)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Handler body made only of pass / ... / continue.
     */
    static boolean isSilent(Ast.ExceptHandler handler) {
        return handler.body().stream().allMatch(s -> AstQueries.isNoOp(s) || s instanceof Ast.Continue);
    }

    private static boolean isDunder(String name) {
        return name.length() > 4 && name.startsWith("__") && name.endsWith("__");
    }
}
