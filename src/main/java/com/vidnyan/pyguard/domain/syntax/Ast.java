package com.vidnyan.pyguard.domain.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Node variants of the Python syntax tree.
 * Shapes follow the CPython {@code ast} module so detection logic reads the same way.
 * Lists handed to these records are treated as immutable.
 */
public final class Ast {

    private Ast() {
    }

    // ---------------------------------------------------------------- module

    public record Module(Span span, List<Node> body) implements Node {
        @Override public NodeKind kind() { return NodeKind.MODULE; }
        @Override public List<Node> children() { return nodes(body); }
    }

    // ------------------------------------------------------------ statements

    public record FunctionDef(
        Span span,
        String name,
        Arguments args,
        Node returns,
        List<Node> body,
        List<Decorator> decorators,
        boolean async
    ) implements Node {
        @Override public NodeKind kind() { return async ? NodeKind.ASYNC_FUNCTION_DEF : NodeKind.FUNCTION_DEF; }
        @Override public List<Node> children() { return nodes(decorators, args, returns, body); }

        public boolean isDunder() {
            return name.length() > 4 && name.startsWith("__") && name.endsWith("__");
        }
    }

    public record ClassDef(
        Span span,
        String name,
        List<Node> bases,
        List<Keyword> keywords,
        List<Node> body,
        List<Decorator> decorators
    ) implements Node {
        @Override public NodeKind kind() { return NodeKind.CLASS_DEF; }
        @Override public List<Node> children() { return nodes(decorators, bases, keywords, body); }
    }

    public record Decorator(Span span, Node expression) implements Node {
        @Override public NodeKind kind() { return NodeKind.DECORATOR; }
        @Override public List<Node> children() { return nodes(expression); }
    }

    public record Return(Span span, Node value) implements Node {
        @Override public NodeKind kind() { return NodeKind.RETURN; }
        @Override public List<Node> children() { return nodes(value); }
    }

    public record Delete(Span span, List<Node> targets) implements Node {
        @Override public NodeKind kind() { return NodeKind.DELETE; }
        @Override public List<Node> children() { return nodes(targets); }
    }

    public record Assign(Span span, List<Node> targets, Node value) implements Node {
        @Override public NodeKind kind() { return NodeKind.ASSIGN; }
        @Override public List<Node> children() { return nodes(targets, value); }
    }

    public record AugAssign(Span span, Node target, String op, Node value) implements Node {
        @Override public NodeKind kind() { return NodeKind.AUG_ASSIGN; }
        @Override public List<Node> children() { return nodes(target, value); }
    }

    public record AnnAssign(Span span, Node target, Node annotation, Node value) implements Node {
        @Override public NodeKind kind() { return NodeKind.ANN_ASSIGN; }
        @Override public List<Node> children() { return nodes(target, annotation, value); }
    }

    public record For(
        Span span,
        Node target,
        Node iter,
        List<Node> body,
        List<Node> orelse,
        boolean async
    ) implements Node {
        @Override public NodeKind kind() { return async ? NodeKind.ASYNC_FOR : NodeKind.FOR; }
        @Override public List<Node> children() { return nodes(target, iter, body, orelse); }
    }

    public record While(Span span, Node test, List<Node> body, List<Node> orelse) implements Node {
        @Override public NodeKind kind() { return NodeKind.WHILE; }
        @Override public List<Node> children() { return nodes(test, body, orelse); }
    }

    /**
     * {@code if} statement. An {@code elif} clause is a nested {@code If} in {@link #orelse()}
     * with {@link #elif()} set.
     */
    public record If(Span span, Node test, List<Node> body, List<Node> orelse, boolean elif) implements Node {
        @Override public NodeKind kind() { return NodeKind.IF; }
        @Override public List<Node> children() { return nodes(test, body, orelse); }

        public boolean hasElifBranch() {
            return orelse.size() == 1 && orelse.get(0) instanceof If nested && nested.elif();
        }
    }

    public record With(Span span, List<WithItem> items, List<Node> body, boolean async) implements Node {
        @Override public NodeKind kind() { return async ? NodeKind.ASYNC_WITH : NodeKind.WITH; }
        @Override public List<Node> children() { return nodes(items, body); }
    }

    public record WithItem(Span span, Node contextExpr, Node optionalVars) implements Node {
        @Override public NodeKind kind() { return NodeKind.WITH_ITEM; }
        @Override public List<Node> children() { return nodes(contextExpr, optionalVars); }
    }

    public record Match(Span span, Node subject, List<MatchCase> cases) implements Node {
        @Override public NodeKind kind() { return NodeKind.MATCH; }
        @Override public List<Node> children() { return nodes(subject, cases); }
    }

    /**
     * One {@code case} arm. The pattern is kept as an expression tree; {@code capture}
     * holds the name bound by a trailing {@code as NAME}, if any.
     */
    public record MatchCase(Span span, Node pattern, String capture, Node guard, List<Node> body) implements Node {
        @Override public NodeKind kind() { return NodeKind.MATCH_CASE; }
        @Override public List<Node> children() { return nodes(pattern, guard, body); }
    }

    public record Raise(Span span, Node exc, Node cause) implements Node {
        @Override public NodeKind kind() { return NodeKind.RAISE; }
        @Override public List<Node> children() { return nodes(exc, cause); }
    }

    public record Try(
        Span span,
        List<Node> body,
        List<ExceptHandler> handlers,
        List<Node> orelse,
        List<Node> finalbody,
        boolean star
    ) implements Node {
        @Override public NodeKind kind() { return NodeKind.TRY; }
        @Override public List<Node> children() { return nodes(body, handlers, orelse, finalbody); }
    }

    public record ExceptHandler(Span span, Node type, String name, List<Node> body) implements Node {
        @Override public NodeKind kind() { return NodeKind.EXCEPT_HANDLER; }
        @Override public List<Node> children() { return nodes(type, body); }
    }

    public record Assert(Span span, Node test, Node msg) implements Node {
        @Override public NodeKind kind() { return NodeKind.ASSERT; }
        @Override public List<Node> children() { return nodes(test, msg); }
    }

    public record Import(Span span, List<Alias> names) implements Node {
        @Override public NodeKind kind() { return NodeKind.IMPORT; }
        @Override public List<Node> children() { return nodes(names); }
    }

    /**
     * {@code from module import names}. {@code module} is empty for {@code from . import x};
     * {@code level} counts the leading dots.
     */
    public record ImportFrom(Span span, String module, List<Alias> names, int level) implements Node {
        @Override public NodeKind kind() { return NodeKind.IMPORT_FROM; }
        @Override public List<Node> children() { return nodes(names); }

        public boolean isWildcard() {
            return names.size() == 1 && "*".equals(names.get(0).name());
        }
    }

    public record Alias(Span span, String name, String asName) implements Node {
        @Override public NodeKind kind() { return NodeKind.ALIAS; }
        @Override public List<Node> children() { return List.of(); }

        public String boundName() {
            if (asName != null) {
                return asName;
            }
            int dot = name.indexOf('.');
            return dot < 0 ? name : name.substring(0, dot);
        }
    }

    public record Global(Span span, List<String> names) implements Node {
        @Override public NodeKind kind() { return NodeKind.GLOBAL; }
        @Override public List<Node> children() { return List.of(); }
    }

    public record Nonlocal(Span span, List<String> names) implements Node {
        @Override public NodeKind kind() { return NodeKind.NONLOCAL; }
        @Override public List<Node> children() { return List.of(); }
    }

    /** Expression statement. */
    public record Expr(Span span, Node value) implements Node {
        @Override public NodeKind kind() { return NodeKind.EXPR; }
        @Override public List<Node> children() { return nodes(value); }
    }

    public record Pass(Span span) implements Node {
        @Override public NodeKind kind() { return NodeKind.PASS; }
        @Override public List<Node> children() { return List.of(); }
    }

    public record Break(Span span) implements Node {
        @Override public NodeKind kind() { return NodeKind.BREAK; }
        @Override public List<Node> children() { return List.of(); }
    }

    public record Continue(Span span) implements Node {
        @Override public NodeKind kind() { return NodeKind.CONTINUE; }
        @Override public List<Node> children() { return List.of(); }
    }

    // ----------------------------------------------------------- expressions

    /** {@code and} / {@code or} over two or more operands. */
    public record BoolOp(Span span, String op, List<Node> values) implements Node {
        @Override public NodeKind kind() { return NodeKind.BOOL_OP; }
        @Override public List<Node> children() { return nodes(values); }
    }

    public record NamedExpr(Span span, Node target, Node value) implements Node {
        @Override public NodeKind kind() { return NodeKind.NAMED_EXPR; }
        @Override public List<Node> children() { return nodes(target, value); }
    }

    public record BinOp(Span span, Node left, String op, Node right) implements Node {
        @Override public NodeKind kind() { return NodeKind.BIN_OP; }
        @Override public List<Node> children() { return nodes(left, right); }
    }

    public record UnaryOp(Span span, String op, Node operand) implements Node {
        @Override public NodeKind kind() { return NodeKind.UNARY_OP; }
        @Override public List<Node> children() { return nodes(operand); }
    }

    public record Lambda(Span span, Arguments args, Node body) implements Node {
        @Override public NodeKind kind() { return NodeKind.LAMBDA; }
        @Override public List<Node> children() { return nodes(args, body); }
    }

    public record IfExp(Span span, Node test, Node body, Node orelse) implements Node {
        @Override public NodeKind kind() { return NodeKind.IF_EXP; }
        @Override public List<Node> children() { return nodes(body, test, orelse); }
    }

    /** Dict display. A {@code null} key marks a {@code **mapping} unpacking entry. */
    public record DictExpr(Span span, List<Node> keys, List<Node> values) implements Node {
        @Override public NodeKind kind() { return NodeKind.DICT; }

        @Override
        public List<Node> children() {
            List<Node> out = new ArrayList<>();
            for (int i = 0; i < values.size(); i++) {
                if (keys.get(i) != null) {
                    out.add(keys.get(i));
                }
                out.add(values.get(i));
            }
            return Collections.unmodifiableList(out);
        }
    }

    public record SetExpr(Span span, List<Node> elts) implements Node {
        @Override public NodeKind kind() { return NodeKind.SET; }
        @Override public List<Node> children() { return nodes(elts); }
    }

    public record ListExpr(Span span, List<Node> elts) implements Node {
        @Override public NodeKind kind() { return NodeKind.LIST; }
        @Override public List<Node> children() { return nodes(elts); }
    }

    public record TupleExpr(Span span, List<Node> elts) implements Node {
        @Override public NodeKind kind() { return NodeKind.TUPLE; }
        @Override public List<Node> children() { return nodes(elts); }
    }

    public record ListComp(Span span, Node elt, List<Comprehension> generators) implements Node {
        @Override public NodeKind kind() { return NodeKind.LIST_COMP; }
        @Override public List<Node> children() { return nodes(generators, elt); }
    }

    public record SetComp(Span span, Node elt, List<Comprehension> generators) implements Node {
        @Override public NodeKind kind() { return NodeKind.SET_COMP; }
        @Override public List<Node> children() { return nodes(generators, elt); }
    }

    public record GeneratorExp(Span span, Node elt, List<Comprehension> generators) implements Node {
        @Override public NodeKind kind() { return NodeKind.GENERATOR_EXP; }
        @Override public List<Node> children() { return nodes(generators, elt); }
    }

    public record DictComp(Span span, Node key, Node value, List<Comprehension> generators) implements Node {
        @Override public NodeKind kind() { return NodeKind.DICT_COMP; }
        @Override public List<Node> children() { return nodes(generators, key, value); }
    }

    /** One {@code for target in iter if ...} clause of a comprehension. */
    public record Comprehension(Span span, Node target, Node iter, List<Node> ifs, boolean async) implements Node {
        @Override public NodeKind kind() { return NodeKind.COMPREHENSION; }
        @Override public List<Node> children() { return nodes(iter, target, ifs); }
    }

    public record Await(Span span, Node value) implements Node {
        @Override public NodeKind kind() { return NodeKind.AWAIT; }
        @Override public List<Node> children() { return nodes(value); }
    }

    public record Yield(Span span, Node value) implements Node {
        @Override public NodeKind kind() { return NodeKind.YIELD; }
        @Override public List<Node> children() { return nodes(value); }
    }

    public record YieldFrom(Span span, Node value) implements Node {
        @Override public NodeKind kind() { return NodeKind.YIELD_FROM; }
        @Override public List<Node> children() { return nodes(value); }
    }

    /**
     * Comparison chain {@code left op1 c1 op2 c2 ...}. Operators are source spellings,
     * {@code "not in"} and {@code "is not"} included.
     */
    public record Compare(Span span, Node left, List<String> ops, List<Node> comparators) implements Node {
        @Override public NodeKind kind() { return NodeKind.COMPARE; }
        @Override public List<Node> children() { return nodes(left, comparators); }
    }

    public record Call(Span span, Node func, List<Node> args, List<Keyword> keywords) implements Node {
        @Override public NodeKind kind() { return NodeKind.CALL; }
        @Override public List<Node> children() { return nodes(func, args, keywords); }
    }

    /** Keyword argument; {@code arg} is {@code null} for {@code **kwargs} unpacking. */
    public record Keyword(Span span, String arg, Node value) implements Node {
        @Override public NodeKind kind() { return NodeKind.KEYWORD; }
        @Override public List<Node> children() { return nodes(value); }
    }

    /** f-string: literal {@link Constant} parts interleaved with {@link FormattedValue}s. */
    public record JoinedStr(Span span, List<Node> values) implements Node {
        @Override public NodeKind kind() { return NodeKind.JOINED_STR; }
        @Override public List<Node> children() { return nodes(values); }

        public boolean hasPlaceholders() {
            return values.stream().anyMatch(FormattedValue.class::isInstance);
        }
    }

    public record FormattedValue(Span span, Node value, char conversion, Node formatSpec) implements Node {
        @Override public NodeKind kind() { return NodeKind.FORMATTED_VALUE; }
        @Override public List<Node> children() { return nodes(value, formatSpec); }
    }

    public enum ConstantType {
        STRING, BYTES, INT, FLOAT, COMPLEX, TRUE, FALSE, NONE, ELLIPSIS
    }

    /**
     * Literal value. {@code value} holds the string body without quotes and prefix,
     * or the source spelling for numbers and keywords.
     */
    public record Constant(Span span, ConstantType type, String value) implements Node {
        @Override public NodeKind kind() { return NodeKind.CONSTANT; }
        @Override public List<Node> children() { return List.of(); }

        public boolean isNone() {
            return type == ConstantType.NONE;
        }

        public boolean isBool() {
            return type == ConstantType.TRUE || type == ConstantType.FALSE;
        }

        public boolean isString() {
            return type == ConstantType.STRING;
        }

        public boolean isNumber() {
            return type == ConstantType.INT || type == ConstantType.FLOAT || type == ConstantType.COMPLEX;
        }
    }

    public record Attribute(Span span, Node value, String attr) implements Node {
        @Override public NodeKind kind() { return NodeKind.ATTRIBUTE; }
        @Override public List<Node> children() { return nodes(value); }
    }

    public record Subscript(Span span, Node value, Node slice) implements Node {
        @Override public NodeKind kind() { return NodeKind.SUBSCRIPT; }
        @Override public List<Node> children() { return nodes(value, slice); }
    }

    public record Starred(Span span, Node value) implements Node {
        @Override public NodeKind kind() { return NodeKind.STARRED; }
        @Override public List<Node> children() { return nodes(value); }
    }

    public record Name(Span span, String id) implements Node {
        @Override public NodeKind kind() { return NodeKind.NAME; }
        @Override public List<Node> children() { return List.of(); }
    }

    public record Slice(Span span, Node lower, Node upper, Node step) implements Node {
        @Override public NodeKind kind() { return NodeKind.SLICE; }
        @Override public List<Node> children() { return nodes(lower, upper, step); }
    }

    // ------------------------------------------------------------ signatures

    /**
     * Parameter list. {@code defaults} align with the tail of {@code posonly + args};
     * {@code kwDefaults} align one-to-one with {@code kwonly} and may hold {@code null}.
     */
    public record Arguments(
        Span span,
        List<Arg> posonly,
        List<Arg> args,
        Arg vararg,
        List<Arg> kwonly,
        List<Node> kwDefaults,
        Arg kwarg,
        List<Node> defaults
    ) implements Node {
        @Override public NodeKind kind() { return NodeKind.ARGUMENTS; }
        @Override public List<Node> children() { return nodes(posonly, args, vararg, kwonly, kwarg, defaults, kwDefaults); }

        public static Arguments empty(Span span) {
            return new Arguments(span, List.of(), List.of(), null, List.of(), List.of(), null, List.of());
        }

        /**
         * Every declared parameter in declaration order.
         */
        public List<Arg> all() {
            List<Arg> out = new ArrayList<>(posonly);
            out.addAll(args);
            if (vararg != null) {
                out.add(vararg);
            }
            out.addAll(kwonly);
            if (kwarg != null) {
                out.add(kwarg);
            }
            return out;
        }

        /**
         * Every default value expression, positional first.
         */
        public List<Node> allDefaults() {
            List<Node> out = new ArrayList<>(defaults);
            for (Node node : kwDefaults) {
                if (node != null) {
                    out.add(node);
                }
            }
            return out;
        }

        public boolean declares(String name) {
            return all().stream().anyMatch(arg -> arg.name().equals(name));
        }
    }

    public record Arg(Span span, String name, Node annotation) implements Node {
        @Override public NodeKind kind() { return NodeKind.ARG; }
        @Override public List<Node> children() { return nodes(annotation); }
    }

    // --------------------------------------------------------------- helpers

    /**
     * Names bound by an assignment target: plain names, unpacked through tuples,
     * lists and starred elements. Attribute and subscript targets bind nothing.
     */
    public static Set<String> boundNames(Node target) {
        Set<String> out = new LinkedHashSet<>();
        collectBound(target, out);
        return out;
    }

    private static void collectBound(Node target, Set<String> out) {
        if (target instanceof Name name) {
            out.add(name.id());
        } else if (target instanceof Starred starred) {
            collectBound(starred.value(), out);
        } else if (target instanceof TupleExpr tuple) {
            tuple.elts().forEach(elt -> collectBound(elt, out));
        } else if (target instanceof ListExpr list) {
            list.elts().forEach(elt -> collectBound(elt, out));
        }
    }

    static List<Node> nodes(Object... parts) {
        List<Node> out = new ArrayList<>();
        for (Object part : parts) {
            if (part instanceof Node node) {
                out.add(node);
            } else if (part instanceof List<?> list) {
                for (Object item : list) {
                    if (item instanceof Node node) {
                        out.add(node);
                    }
                }
            }
        }
        return Collections.unmodifiableList(out);
    }
}
