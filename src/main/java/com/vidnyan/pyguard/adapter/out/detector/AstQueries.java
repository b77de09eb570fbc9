package com.vidnyan.pyguard.adapter.out.detector;

import com.vidnyan.pyguard.domain.syntax.Ast;
import com.vidnyan.pyguard.domain.syntax.Ast.ConstantType;
import com.vidnyan.pyguard.domain.syntax.Node;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Small structural predicates shared by the rule catalogs.
 * None of them walk more than the node's immediate shape.
 */
final class AstQueries {

    static final Set<String> LOGGING_METHODS = Set.of(
            "debug", "info", "warning", "warn", "error", "exception", "critical", "fatal", "log");

    static final Set<String> LOGGING_FUNCTIONS = Set.of("print", "print_exc", "print_exception", "log");

    private static final Set<String> MUTABLE_FACTORIES = Set.of("list", "dict", "set");

    private AstQueries() {
    }

    /**
     * Dotted name of a call target or attribute chain ({@code os.path.join}),
     * empty when the chain contains anything other than names and attributes.
     */
    static Optional<String> dottedName(Node node) {
        if (node instanceof Ast.Name name) {
            return Optional.of(name.id());
        }
        if (node instanceof Ast.Attribute attribute) {
            return dottedName(attribute.value()).map(prefix -> prefix + "." + attribute.attr());
        }
        return Optional.empty();
    }

    static Optional<String> calleeName(Ast.Call call) {
        return dottedName(call.func());
    }

    static boolean callsAny(Ast.Call call, Set<String> dottedNames) {
        return calleeName(call).map(dottedNames::contains).orElse(false);
    }

    /**
     * Method name when the callee is an attribute ({@code x.execute(...)}), else null.
     */
    static String methodName(Ast.Call call) {
        return call.func() instanceof Ast.Attribute attribute ? attribute.attr() : null;
    }

    /**
     * Name of the receiver object for {@code name.method(...)} calls, else null.
     */
    static String receiverName(Ast.Call call) {
        if (call.func() instanceof Ast.Attribute attribute && attribute.value() instanceof Ast.Name name) {
            return name.id();
        }
        return null;
    }

    static boolean isCallTo(Node node, String functionName) {
        return node instanceof Ast.Call call && call.func() instanceof Ast.Name name && name.id().equals(functionName);
    }

    static Optional<Ast.Keyword> keyword(Ast.Call call, String name) {
        return call.keywords().stream().filter(k -> name.equals(k.arg())).findFirst();
    }

    static Node firstArgument(Ast.Call call) {
        return call.args().isEmpty() ? null : call.args().get(0);
    }

    static boolean isConstant(Node node, ConstantType type) {
        return node instanceof Ast.Constant constant && constant.type() == type;
    }

    static boolean isStringConstant(Node node) {
        return isConstant(node, ConstantType.STRING);
    }

    static boolean isNameOf(Node node, String id) {
        return node instanceof Ast.Name name && name.id().equals(id);
    }

    /**
     * List, dict or set display, any comprehension building one, or a bare
     * {@code list()} / {@code dict()} / {@code set()} call.
     */
    static boolean isMutableValue(Node node) {
        if (node instanceof Ast.ListExpr || node instanceof Ast.DictExpr || node instanceof Ast.SetExpr
                || node instanceof Ast.ListComp || node instanceof Ast.DictComp || node instanceof Ast.SetComp) {
            return true;
        }
        return node instanceof Ast.Call call && call.func() instanceof Ast.Name name
                && MUTABLE_FACTORIES.contains(name.id());
    }

    /**
     * Expression that evidently produces a str: literal, f-string, {@code str(...)},
     * {@code "...".format(...)} / {@code .join(...)}, or concatenation involving one of these.
     */
    static boolean isStringValued(Node node) {
        if (isStringConstant(node) || node instanceof Ast.JoinedStr || isCallTo(node, "str")) {
            return true;
        }
        if (node instanceof Ast.Call call && call.func() instanceof Ast.Attribute attribute
                && isStringConstant(attribute.value())) {
            return true;
        }
        if (node instanceof Ast.BinOp op && (op.op().equals("+") || op.op().equals("%"))) {
            return isStringValued(op.left()) || (op.op().equals("+") && isStringValued(op.right()));
        }
        return false;
    }

    /**
     * String built at run time from other values: f-string with fields,
     * {@code %} with a string template, {@code +} with a string operand that is not
     * made only of literals, or {@code .format(...)}.
     */
    static boolean isDynamicString(Node node) {
        if (node instanceof Ast.JoinedStr joined) {
            return joined.hasPlaceholders();
        }
        if (node instanceof Ast.BinOp op) {
            if (op.op().equals("%")) {
                return isStringValued(op.left());
            }
            if (op.op().equals("+")) {
                if (isLiteralString(op)) {
                    return false;
                }
                return isStringValued(op.left()) || isStringValued(op.right())
                        || isDynamicString(op.left()) || isDynamicString(op.right());
            }
            return false;
        }
        return node instanceof Ast.Call call && call.func() instanceof Ast.Attribute attribute
                && attribute.attr().equals("format") && isStringConstant(attribute.value());
    }

    /**
     * String known at parse time: a literal, a placeholder-free f-string, or a {@code +} of those.
     */
    static boolean isLiteralString(Node node) {
        if (isStringConstant(node)) {
            return true;
        }
        if (node instanceof Ast.JoinedStr joined) {
            return !joined.hasPlaceholders();
        }
        return node instanceof Ast.BinOp op && op.op().equals("+")
                && isLiteralString(op.left()) && isLiteralString(op.right());
    }

    /**
     * Logging-style call: {@code logger.error(...)}, {@code logging.exception(...)},
     * {@code print(...)}, {@code traceback.print_exc()}, {@code warnings.warn(...)}.
     */
    static boolean isLoggingCall(Ast.Call call) {
        if (call.func() instanceof Ast.Name name) {
            return LOGGING_FUNCTIONS.contains(name.id());
        }
        if (call.func() instanceof Ast.Attribute attribute) {
            return LOGGING_METHODS.contains(attribute.attr()) || LOGGING_FUNCTIONS.contains(attribute.attr())
                    || (attribute.attr().equals("write") && dottedName(attribute.value())
                            .map(receiver -> receiver.endsWith("stderr")).orElse(false));
        }
        return false;
    }

    /**
     * Whether the statement list ends by leaving the current block.
     */
    static boolean endsWithJump(List<Node> body) {
        if (body.isEmpty()) {
            return false;
        }
        Node last = body.get(body.size() - 1);
        return last instanceof Ast.Return || last instanceof Ast.Raise
                || last instanceof Ast.Continue || last instanceof Ast.Break;
    }

    /**
     * Statement that does nothing: {@code pass}, {@code ...} or a bare string.
     */
    static boolean isNoOp(Node statement) {
        return statement instanceof Ast.Pass
                || (statement instanceof Ast.Expr expr && expr.value() instanceof Ast.Constant constant
                        && (constant.type() == ConstantType.ELLIPSIS || constant.type() == ConstantType.STRING));
    }

    static String describe(Node node) {
        return dottedName(node).orElse(node.kind().name().toLowerCase(Locale.ROOT).replace('_', ' '));
    }
}
