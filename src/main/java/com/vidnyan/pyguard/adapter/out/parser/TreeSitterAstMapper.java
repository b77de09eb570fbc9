package com.vidnyan.pyguard.adapter.out.parser;

import com.vidnyan.pyguard.domain.syntax.Ast;
import com.vidnyan.pyguard.domain.syntax.Ast.ConstantType;
import com.vidnyan.pyguard.domain.syntax.Node;
import com.vidnyan.pyguard.domain.syntax.Span;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Maps an error-free tree-sitter-python tree onto {@link Ast} records.
 * Node types and field names are those of the tree-sitter-python grammar.
 * Constructs with no {@link Ast} counterpart (Python 2 statements) raise
 * {@link PythonSyntaxException}.
 */
class TreeSitterAstMapper {

    private static final Set<String> EXTRAS = Set.of("comment", "line_continuation");

    private static final Set<String> COMPARISON_OPERATORS = Set.of(
            "<", "<=", "==", "!=", ">=", ">", "<>", "in", "not in", "is", "is not");

    private final SourceBytes source;

    TreeSitterAstMapper(SourceBytes source) {
        this.source = source;
    }

    Ast.Module module(TSNode root) {
        List<Node> body = statements(root);
        Span span = body.isEmpty()
                ? Span.of(1, 0, 1, 0)
                : Span.between(body.get(0).span(), body.get(body.size() - 1).span());
        return new Ast.Module(span, body);
    }

    // ============================================================ statements

    private List<Node> statements(TSNode container) {
        List<Node> out = new ArrayList<>();
        for (TSNode child : named(container)) {
            out.add(statement(child));
        }
        return List.copyOf(out);
    }

    private Node statement(TSNode node) {
        Span span = span(node);
        switch (node.getType()) {
            case "expression_statement":
                return expressionStatement(node);
            case "pass_statement":
                return new Ast.Pass(span);
            case "break_statement":
                return new Ast.Break(span);
            case "continue_statement":
                return new Ast.Continue(span);
            case "return_statement": {
                List<TSNode> parts = named(node);
                return new Ast.Return(span, parts.isEmpty() ? null : expr(parts.get(0)));
            }
            case "delete_statement":
                return new Ast.Delete(span, elements(named(node).get(0)));
            case "raise_statement":
                return raiseStatement(node);
            case "global_statement":
                return new Ast.Global(span, identifiers(node));
            case "nonlocal_statement":
                return new Ast.Nonlocal(span, identifiers(node));
            case "assert_statement": {
                List<TSNode> parts = named(node);
                return new Ast.Assert(span, expr(parts.get(0)), parts.size() > 1 ? expr(parts.get(1)) : null);
            }
            case "import_statement":
                return new Ast.Import(span, aliases(named(node), null));
            case "import_from_statement":
                return importFrom(node);
            case "future_import_statement":
                return new Ast.ImportFrom(span, "__future__", aliases(named(node), null), 0);
            case "type_alias_statement":
                return typeAlias(node);
            case "function_definition":
                return functionDef(node, List.of());
            case "class_definition":
                return classDef(node, List.of());
            case "decorated_definition":
                return decorated(node);
            case "if_statement":
                return ifStatement(node);
            case "for_statement": {
                List<Node> body = body(node, "body");
                List<Node> orelse = elseBody(node);
                return new Ast.For(compound(node, body, orelse), expr(field(node, "left")),
                        expr(field(node, "right")), body, orelse, hasToken(node, "async"));
            }
            case "while_statement": {
                List<Node> body = body(node, "body");
                List<Node> orelse = elseBody(node);
                return new Ast.While(compound(node, body, orelse), expr(field(node, "condition")), body, orelse);
            }
            case "try_statement":
                return tryStatement(node);
            case "with_statement":
                return withStatement(node);
            case "match_statement":
                return matchStatement(node);
            default:
                throw error(node, "unsupported statement '" + node.getType() + "'");
        }
    }

    private Node expressionStatement(TSNode node) {
        Span span = span(node);
        List<TSNode> parts = named(node);
        if (parts.size() > 1) {
            return new Ast.Expr(span, new Ast.TupleExpr(span, exprs(parts)));
        }
        TSNode only = parts.get(0);
        switch (only.getType()) {
            case "assignment":
                return assignment(only, span);
            case "augmented_assignment":
                return new Ast.AugAssign(span, expr(field(only, "left")),
                        text(field(only, "operator")), expr(field(only, "right")));
            default:
                return new Ast.Expr(span, expr(only));
        }
    }

    /**
     * {@code a = b = value} arrives as nested assignments; it is flattened into one
     * {@link Ast.Assign} with every target.
     */
    private Node assignment(TSNode node, Span span) {
        TSNode annotation = field(node, "type");
        TSNode right = field(node, "right");
        if (annotation != null) {
            return new Ast.AnnAssign(span, expr(field(node, "left")), expr(annotation),
                    right == null ? null : expr(right));
        }
        List<Node> targets = new ArrayList<>();
        targets.add(expr(field(node, "left")));
        while (right != null && "assignment".equals(right.getType()) && field(right, "type") == null) {
            targets.add(expr(field(right, "left")));
            right = field(right, "right");
        }
        if (right == null) {
            throw error(node, "assignment without a value");
        }
        return new Ast.Assign(span, List.copyOf(targets), expr(right));
    }

    private Node raiseStatement(TSNode node) {
        TSNode cause = field(node, "cause");
        Node exc = null;
        for (TSNode part : named(node)) {
            if (cause == null || part.getStartByte() != cause.getStartByte()) {
                exc = expr(part);
                break;
            }
        }
        return new Ast.Raise(span(node), exc, cause == null ? null : expr(cause));
    }

    private Node importFrom(TSNode node) {
        TSNode moduleNode = field(node, "module_name");
        String module = "";
        int level = 0;
        if (moduleNode != null && "relative_import".equals(moduleNode.getType())) {
            for (TSNode part : named(moduleNode)) {
                if ("import_prefix".equals(part.getType())) {
                    level = text(part).replaceAll("[^.]", "").length();
                } else {
                    module = dotted(part);
                }
            }
        } else if (moduleNode != null) {
            module = dotted(moduleNode);
        }
        return new Ast.ImportFrom(span(node), module, aliases(named(node), moduleNode), level);
    }

    private List<Ast.Alias> aliases(List<TSNode> parts, TSNode skip) {
        List<Ast.Alias> out = new ArrayList<>();
        for (TSNode part : parts) {
            if (skip != null && part.getStartByte() == skip.getStartByte()) {
                continue;
            }
            switch (part.getType()) {
                case "aliased_import":
                    out.add(new Ast.Alias(span(part), dotted(field(part, "name")), text(field(part, "alias"))));
                    break;
                case "wildcard_import":
                    out.add(new Ast.Alias(span(part), "*", null));
                    break;
                default:
                    out.add(new Ast.Alias(span(part), dotted(part), null));
                    break;
            }
        }
        return List.copyOf(out);
    }

    /** {@code type Alias[T] = ...} is kept as a plain assignment to {@code Alias}. */
    private Node typeAlias(TSNode node) {
        List<TSNode> parts = named(node);
        TSNode left = field(node, "left");
        TSNode right = field(node, "right");
        left = unwrapType(left != null ? left : parts.get(parts.size() - 2));
        right = right != null ? right : parts.get(parts.size() - 1);
        if ("generic_type".equals(left.getType())) {
            left = named(left).get(0);
        }
        Node target = new Ast.Name(span(left), text(left));
        return new Ast.Assign(span(node), List.of(target), expr(right));
    }

    private Node functionDef(TSNode node, List<Ast.Decorator> decorators) {
        TSNode parameters = field(node, "parameters");
        TSNode returns = field(node, "return_type");
        List<Node> body = body(node, "body");
        return new Ast.FunctionDef(compound(node, body), text(field(node, "name")),
                parameters == null ? Ast.Arguments.empty(span(node)) : parameters(parameters),
                returns == null ? null : expr(returns),
                body, decorators, hasToken(node, "async"));
    }

    private Node classDef(TSNode node, List<Ast.Decorator> decorators) {
        List<Node> bases = new ArrayList<>();
        List<Ast.Keyword> keywords = new ArrayList<>();
        TSNode superclasses = field(node, "superclasses");
        if (superclasses != null) {
            arguments(superclasses, bases, keywords);
        }
        List<Node> body = body(node, "body");
        return new Ast.ClassDef(compound(node, body), text(field(node, "name")), List.copyOf(bases),
                List.copyOf(keywords), body, decorators);
    }

    private Node decorated(TSNode node) {
        List<Ast.Decorator> decorators = new ArrayList<>();
        for (TSNode part : named(node)) {
            if ("decorator".equals(part.getType())) {
                decorators.add(new Ast.Decorator(span(part), expr(named(part).get(0))));
            }
        }
        TSNode definition = field(node, "definition");
        if (definition == null) {
            throw error(node, "decorator without a definition");
        }
        return "class_definition".equals(definition.getType())
                ? classDef(definition, List.copyOf(decorators))
                : functionDef(definition, List.copyOf(decorators));
    }

    private Node ifStatement(TSNode node) {
        List<TSNode> alternatives = new ArrayList<>();
        for (TSNode part : named(node)) {
            if ("elif_clause".equals(part.getType()) || "else_clause".equals(part.getType())) {
                alternatives.add(part);
            }
        }
        List<Node> body = body(node, "consequence");
        List<Node> orelse = elseChain(alternatives, 0);
        return new Ast.If(compound(node, body, orelse), expr(field(node, "condition")), body, orelse, false);
    }

    /** Each {@code elif} becomes an {@link Ast.If} nested in the previous branch's orelse. */
    private List<Node> elseChain(List<TSNode> alternatives, int from) {
        if (from >= alternatives.size()) {
            return List.of();
        }
        TSNode clause = alternatives.get(from);
        if ("else_clause".equals(clause.getType())) {
            return body(clause, "body");
        }
        List<Node> body = body(clause, "consequence");
        List<Node> orelse = elseChain(alternatives, from + 1);
        return List.of(new Ast.If(compound(clause, body, orelse), expr(field(clause, "condition")), body, orelse, true));
    }

    private Node tryStatement(TSNode node) {
        List<Ast.ExceptHandler> handlers = new ArrayList<>();
        List<Node> orelse = List.of();
        List<Node> finalbody = List.of();
        boolean star = false;
        for (TSNode part : named(node)) {
            switch (part.getType()) {
                case "except_group_clause":
                    star = true;
                    handlers.add(exceptHandler(part));
                    break;
                case "except_clause":
                    handlers.add(exceptHandler(part));
                    break;
                case "else_clause":
                    orelse = body(part, "body");
                    break;
                case "finally_clause":
                    finalbody = body(part, "body");
                    break;
                default:
                    break;
            }
        }
        List<Node> body = body(node, "body");
        return new Ast.Try(compound(node, body, handlers, orelse, finalbody), body, List.copyOf(handlers),
                orelse, finalbody, star);
    }

    private Ast.ExceptHandler exceptHandler(TSNode clause) {
        List<TSNode> parts = new ArrayList<>();
        for (TSNode part : named(clause)) {
            if (!"block".equals(part.getType())) {
                parts.add(part);
            }
        }
        Node type = null;
        String name = null;
        if (!parts.isEmpty()) {
            TSNode head = parts.get(0);
            if ("as_pattern".equals(head.getType())) {
                type = expr(named(head).get(0));
                name = aliasName(head);
            } else {
                type = expr(head);
                name = parts.size() > 1 ? text(parts.get(1)) : null;
            }
        }
        List<Node> body = body(clause, "body");
        return new Ast.ExceptHandler(compound(clause, body), type, name, body);
    }

    private Node withStatement(TSNode node) {
        List<Ast.WithItem> items = new ArrayList<>();
        for (TSNode part : named(node)) {
            if ("with_clause".equals(part.getType())) {
                for (TSNode item : named(part)) {
                    if ("with_item".equals(item.getType())) {
                        items.add(withItem(item));
                    }
                }
            }
        }
        List<Node> body = body(node, "body");
        return new Ast.With(compound(node, body), List.copyOf(items), body, hasToken(node, "async"));
    }

    private Ast.WithItem withItem(TSNode item) {
        TSNode value = field(item, "value");
        if (value == null) {
            value = named(item).get(0);
        }
        if ("as_pattern".equals(value.getType())) {
            TSNode target = aliasTarget(value);
            return new Ast.WithItem(span(item), expr(named(value).get(0)), target == null ? null : expr(target));
        }
        return new Ast.WithItem(span(item), expr(value), null);
    }

    // ================================================================= match

    private Node matchStatement(TSNode node) {
        List<Node> subjects = new ArrayList<>();
        List<Ast.MatchCase> cases = new ArrayList<>();
        for (TSNode part : named(node)) {
            if ("block".equals(part.getType())) {
                for (TSNode clause : named(part)) {
                    if ("case_clause".equals(clause.getType())) {
                        cases.add(matchCase(clause));
                    }
                }
            } else {
                subjects.add(expr(part));
            }
        }
        Node subject = subjects.size() == 1 ? subjects.get(0) : new Ast.TupleExpr(span(node), List.copyOf(subjects));
        return new Ast.Match(compound(node, cases), subject, List.copyOf(cases));
    }

    private Ast.MatchCase matchCase(TSNode clause) {
        List<TSNode> patterns = new ArrayList<>();
        for (TSNode part : named(clause)) {
            if ("case_pattern".equals(part.getType())) {
                patterns.add(part);
            }
        }
        String capture = null;
        Node pattern;
        if (patterns.size() == 1) {
            TSNode only = patterns.get(0);
            List<TSNode> inner = named(only);
            if (!inner.isEmpty() && "as_pattern".equals(inner.get(0).getType())) {
                capture = aliasName(inner.get(0));
            }
            pattern = pattern(only);
        } else {
            List<Node> elts = new ArrayList<>();
            patterns.forEach(p -> elts.add(pattern(p)));
            pattern = new Ast.TupleExpr(span(clause), List.copyOf(elts));
        }
        TSNode guard = field(clause, "guard");
        Node guardExpr = guard == null ? null : expr(named(guard).get(0));
        List<Node> body = body(clause, "consequence");
        return new Ast.MatchCase(compound(clause, body), pattern, capture, guardExpr, body);
    }

    /**
     * Patterns are kept as expression trees: class patterns become calls,
     * sequence patterns lists or tuples, mapping patterns dicts.
     */
    private Node pattern(TSNode node) {
        Span span = span(node);
        switch (node.getType()) {
            case "case_pattern":
            case "as_pattern": {
                List<TSNode> inner = named(node);
                return inner.isEmpty() ? new Ast.Name(span, text(node)) : pattern(inner.get(0));
            }
            case "dotted_name":
                return dottedExpr(node);
            case "class_pattern": {
                List<Node> args = new ArrayList<>();
                List<Ast.Keyword> keywords = new ArrayList<>();
                Node func = null;
                for (TSNode part : named(node)) {
                    if (func == null) {
                        func = pattern(part);
                    } else if ("case_pattern".equals(part.getType()) && !named(part).isEmpty()
                            && "keyword_pattern".equals(named(part).get(0).getType())) {
                        keywords.add(keywordPattern(named(part).get(0)));
                    } else if ("keyword_pattern".equals(part.getType())) {
                        keywords.add(keywordPattern(part));
                    } else {
                        args.add(pattern(part));
                    }
                }
                return new Ast.Call(span, func, List.copyOf(args), List.copyOf(keywords));
            }
            case "list_pattern":
                return new Ast.ListExpr(span, patterns(node));
            case "tuple_pattern":
                return new Ast.TupleExpr(span, patterns(node));
            case "dict_pattern": {
                List<Node> keys = new ArrayList<>();
                List<Node> values = new ArrayList<>();
                List<TSNode> parts = named(node);
                for (int i = 0; i < parts.size(); i++) {
                    TSNode part = parts.get(i);
                    if ("splat_pattern".equals(part.getType())) {
                        keys.add(null);
                        values.add(pattern(part));
                    } else if (i + 1 < parts.size()) {
                        keys.add(pattern(part));
                        values.add(pattern(parts.get(++i)));
                    }
                }
                return new Ast.DictExpr(span, Collections.unmodifiableList(keys), List.copyOf(values));
            }
            case "splat_pattern": {
                List<TSNode> inner = named(node);
                return new Ast.Starred(span, inner.isEmpty() ? new Ast.Name(span, "_") : pattern(inner.get(0)));
            }
            case "union_pattern": {
                List<Node> alternatives = patterns(node);
                Node result = alternatives.get(0);
                for (int i = 1; i < alternatives.size(); i++) {
                    result = new Ast.BinOp(span, result, "|", alternatives.get(i));
                }
                return result;
            }
            case "complex_pattern":
                return new Ast.Constant(span, ConstantType.COMPLEX, text(node));
            case "identifier":
            case "string":
            case "concatenated_string":
            case "integer":
            case "float":
            case "true":
            case "false":
            case "none":
                return expr(node);
            default:
                return new Ast.Name(span, text(node));
        }
    }

    private List<Node> patterns(TSNode node) {
        List<Node> out = new ArrayList<>();
        named(node).forEach(part -> out.add(pattern(part)));
        return List.copyOf(out);
    }

    private Ast.Keyword keywordPattern(TSNode node) {
        List<TSNode> parts = named(node);
        return new Ast.Keyword(span(node), text(parts.get(0)), pattern(parts.get(parts.size() - 1)));
    }

    // =========================================================== expressions

    private List<Node> exprs(List<TSNode> nodes) {
        List<Node> out = new ArrayList<>();
        nodes.forEach(node -> out.add(expr(node)));
        return List.copyOf(out);
    }

    private Node expr(TSNode node) {
        Span span = span(node);
        switch (node.getType()) {
            case "identifier":
            case "keyword_identifier":
                return new Ast.Name(span, text(node));
            case "integer":
            case "float":
                return new Ast.Constant(span, numberType(text(node)), text(node));
            case "true":
                return new Ast.Constant(span, ConstantType.TRUE, "True");
            case "false":
                return new Ast.Constant(span, ConstantType.FALSE, "False");
            case "none":
                return new Ast.Constant(span, ConstantType.NONE, "None");
            case "ellipsis":
                return new Ast.Constant(span, ConstantType.ELLIPSIS, "...");
            case "string":
                return strings(List.of(node), span);
            case "concatenated_string":
                return strings(named(node), span);
            case "parenthesized_expression":
            case "parenthesized_list_splat":
            case "type":
            case "constrained_type":
                return expr(named(node).get(0));
            case "attribute":
                return new Ast.Attribute(span, expr(field(node, "object")), text(field(node, "attribute")));
            case "subscript":
                return subscript(node);
            case "slice":
                return slice(node);
            case "call":
                return call(node);
            case "list_splat":
            case "list_splat_pattern":
            case "splat_type":
                return new Ast.Starred(span, expr(named(node).get(0)));
            case "binary_operator":
                return new Ast.BinOp(span, expr(field(node, "left")), text(field(node, "operator")),
                        expr(field(node, "right")));
            case "unary_operator":
                return new Ast.UnaryOp(span, text(field(node, "operator")), expr(field(node, "argument")));
            case "not_operator":
                return new Ast.UnaryOp(span, "not", expr(field(node, "argument")));
            case "boolean_operator": {
                String op = text(field(node, "operator"));
                List<Node> values = new ArrayList<>();
                flattenBoolean(node, op, values);
                return new Ast.BoolOp(span, op, List.copyOf(values));
            }
            case "comparison_operator":
                return comparison(node);
            case "conditional_expression": {
                List<TSNode> parts = named(node);
                return new Ast.IfExp(span, expr(parts.get(1)), expr(parts.get(0)), expr(parts.get(2)));
            }
            case "named_expression":
                return new Ast.NamedExpr(span, expr(field(node, "name")), expr(field(node, "value")));
            case "lambda":
            case "lambda_within_for_in_clause": {
                TSNode parameters = field(node, "parameters");
                return new Ast.Lambda(span, parameters == null ? Ast.Arguments.empty(span) : parameters(parameters),
                        expr(field(node, "body")));
            }
            case "await":
                return new Ast.Await(span, expr(named(node).get(0)));
            case "yield": {
                List<TSNode> parts = named(node);
                Node value = parts.isEmpty() ? null : expr(parts.get(0));
                return hasToken(node, "from") ? new Ast.YieldFrom(span, value) : new Ast.Yield(span, value);
            }
            case "list":
            case "list_pattern":
                return new Ast.ListExpr(span, exprs(named(node)));
            case "tuple":
            case "tuple_pattern":
            case "expression_list":
            case "pattern_list":
                return new Ast.TupleExpr(span, exprs(named(node)));
            case "set":
                return new Ast.SetExpr(span, exprs(named(node)));
            case "dictionary":
                return dictionary(node);
            case "list_comprehension":
                return new Ast.ListComp(span, expr(field(node, "body")), comprehensions(node));
            case "set_comprehension":
                return new Ast.SetComp(span, expr(field(node, "body")), comprehensions(node));
            case "generator_expression":
                return new Ast.GeneratorExp(span, expr(field(node, "body")), comprehensions(node));
            case "dictionary_comprehension": {
                TSNode pair = field(node, "body");
                return new Ast.DictComp(span, expr(field(pair, "key")), expr(field(pair, "value")),
                        comprehensions(node));
            }
            case "as_pattern":
                return expr(named(node).get(0));
            case "generic_type": {
                List<TSNode> parts = named(node);
                return new Ast.Subscript(span, expr(parts.get(0)), typeParameter(parts.get(parts.size() - 1)));
            }
            case "union_type": {
                List<TSNode> parts = named(node);
                return new Ast.BinOp(span, expr(parts.get(0)), "|", expr(parts.get(parts.size() - 1)));
            }
            case "member_type": {
                List<TSNode> parts = named(node);
                return new Ast.Attribute(span, expr(parts.get(0)), text(parts.get(parts.size() - 1)));
            }
            default:
                throw error(node, "unsupported expression '" + node.getType() + "'");
        }
    }

    private Node typeParameter(TSNode node) {
        List<Node> parts = exprs(named(node));
        return parts.size() == 1 ? parts.get(0) : new Ast.TupleExpr(span(node), parts);
    }

    private void flattenBoolean(TSNode node, String op, List<Node> out) {
        if ("boolean_operator".equals(node.getType()) && op.equals(text(field(node, "operator")))) {
            flattenBoolean(field(node, "left"), op, out);
            flattenBoolean(field(node, "right"), op, out);
        } else {
            out.add(expr(node));
        }
    }

    /** Operators are anonymous children; "not in" and "is not" may arrive as one node or as two tokens. */
    private Node comparison(TSNode node) {
        List<Node> operands = new ArrayList<>();
        List<String> ops = new ArrayList<>();
        for (int i = 0; i < node.getChildCount(); i++) {
            TSNode child = node.getChild(i);
            String type = child.getType();
            String following = i + 1 < node.getChildCount() ? node.getChild(i + 1).getType() : "";
            if (("is".equals(type) && "not".equals(following)) || ("not".equals(type) && "in".equals(following))) {
                ops.add(type + " " + following);
                i++;
            } else if (COMPARISON_OPERATORS.contains(type)) {
                ops.add(type);
            } else if (!EXTRAS.contains(type)) {
                operands.add(expr(child));
            }
        }
        return new Ast.Compare(span(node), operands.get(0), List.copyOf(ops),
                List.copyOf(operands.subList(1, operands.size())));
    }

    private Node subscript(TSNode node) {
        List<TSNode> parts = named(node);
        Node value = expr(parts.get(0));
        List<Node> slices = exprs(parts.subList(1, parts.size()));
        Node slice = slices.size() == 1
                ? slices.get(0)
                : new Ast.TupleExpr(Span.between(slices.get(0).span(), slices.get(slices.size() - 1).span()), slices);
        return new Ast.Subscript(span(node), value, slice);
    }

    /** {@code lower:upper:step}; each colon moves to the next part. */
    private Node slice(TSNode node) {
        Node[] parts = new Node[3];
        int section = 0;
        for (int i = 0; i < node.getChildCount(); i++) {
            TSNode child = node.getChild(i);
            String type = child.getType();
            if (":".equals(type)) {
                section++;
            } else if (!EXTRAS.contains(type) && section < 3) {
                parts[section] = expr(child);
            }
        }
        return new Ast.Slice(span(node), parts[0], parts[1], parts[2]);
    }

    private Node call(TSNode node) {
        Node func = expr(field(node, "function"));
        TSNode arguments = field(node, "arguments");
        List<Node> args = new ArrayList<>();
        List<Ast.Keyword> keywords = new ArrayList<>();
        if (arguments != null && "generator_expression".equals(arguments.getType())) {
            args.add(expr(arguments));
        } else if (arguments != null) {
            arguments(arguments, args, keywords);
        }
        return new Ast.Call(span(node), func, List.copyOf(args), List.copyOf(keywords));
    }

    private void arguments(TSNode argumentList, List<Node> args, List<Ast.Keyword> keywords) {
        for (TSNode part : named(argumentList)) {
            switch (part.getType()) {
                case "keyword_argument":
                    keywords.add(new Ast.Keyword(span(part), text(field(part, "name")), expr(field(part, "value"))));
                    break;
                case "dictionary_splat":
                    keywords.add(new Ast.Keyword(span(part), null, expr(named(part).get(0))));
                    break;
                default:
                    args.add(expr(part));
                    break;
            }
        }
    }

    private Node dictionary(TSNode node) {
        List<Node> keys = new ArrayList<>();
        List<Node> values = new ArrayList<>();
        for (TSNode part : named(node)) {
            if ("pair".equals(part.getType())) {
                keys.add(expr(field(part, "key")));
                values.add(expr(field(part, "value")));
            } else if ("dictionary_splat".equals(part.getType())) {
                keys.add(null);
                values.add(expr(named(part).get(0)));
            }
        }
        return new Ast.DictExpr(span(node), Collections.unmodifiableList(keys), List.copyOf(values));
    }

    /** {@code if} clauses attach to the {@code for} clause before them. */
    private List<Ast.Comprehension> comprehensions(TSNode node) {
        List<Ast.Comprehension> out = new ArrayList<>();
        TSNode clause = null;
        TSNode lastPart = null;
        List<Node> ifs = new ArrayList<>();
        for (TSNode part : named(node)) {
            if ("for_in_clause".equals(part.getType())) {
                if (clause != null) {
                    out.add(comprehension(clause, lastPart, ifs));
                }
                clause = part;
                lastPart = part;
                ifs = new ArrayList<>();
            } else if ("if_clause".equals(part.getType()) && clause != null) {
                ifs.add(expr(named(part).get(0)));
                lastPart = part;
            }
        }
        if (clause != null) {
            out.add(comprehension(clause, lastPart, ifs));
        }
        return List.copyOf(out);
    }

    private Ast.Comprehension comprehension(TSNode clause, TSNode lastPart, List<Node> ifs) {
        return new Ast.Comprehension(Span.between(span(clause), span(lastPart)), expr(field(clause, "left")),
                expr(field(clause, "right")), List.copyOf(ifs), hasToken(clause, "async"));
    }

    // =============================================================== strings

    /**
     * Adjacent literals are joined. Without an f-string part the result is a single
     * {@link Ast.Constant} holding the undecoded body; otherwise a {@link Ast.JoinedStr}.
     */
    private Node strings(List<TSNode> pieces, Span span) {
        List<Node> parts = new ArrayList<>();
        StringBuilder plain = new StringBuilder();
        boolean formatted = false;
        boolean bytes = false;
        for (TSNode piece : pieces) {
            String prefix = prefix(piece);
            bytes |= prefix.contains("b");
            if (prefix.contains("f")) {
                formatted = true;
                parts.addAll(fStringParts(piece));
            } else {
                String body = body(piece);
                plain.append(body);
                parts.add(new Ast.Constant(span(piece), ConstantType.STRING, body));
            }
        }
        if (!formatted) {
            return new Ast.Constant(span, bytes ? ConstantType.BYTES : ConstantType.STRING, plain.toString());
        }
        return new Ast.JoinedStr(span, mergeConstants(parts));
    }

    private String prefix(TSNode string) {
        String start = text(string.getChild(0));
        int quote = 0;
        while (quote < start.length() && start.charAt(quote) != '"' && start.charAt(quote) != '\'') {
            quote++;
        }
        return start.substring(0, quote).toLowerCase(Locale.ROOT);
    }

    private String body(TSNode string) {
        return source.text(bodyStart(string), bodyEnd(string));
    }

    private static int bodyStart(TSNode string) {
        return string.getChild(0).getEndByte();
    }

    private static int bodyEnd(TSNode string) {
        return string.getChild(string.getChildCount() - 1).getStartByte();
    }

    private List<Node> fStringParts(TSNode string) {
        return interpolated(string, bodyStart(string), bodyEnd(string), span(string));
    }

    /**
     * Literal text between replacement fields, and the fields themselves, for the byte
     * range {@code [from, to)} of an f-string or format spec.
     */
    private List<Node> interpolated(TSNode owner, int from, int to, Span span) {
        List<Node> parts = new ArrayList<>();
        int cursor = from;
        for (TSNode child : named(owner)) {
            String type = child.getType();
            if (!"interpolation".equals(type) && !"format_expression".equals(type)) {
                continue;
            }
            addText(parts, cursor, child.getStartByte(), span);
            parts.add(formattedValue(child));
            cursor = child.getEndByte();
        }
        addText(parts, cursor, to, span);
        return parts;
    }

    private void addText(List<Node> parts, int from, int to, Span span) {
        String text = source.text(from, to).replace("{{", "{").replace("}}", "}");
        if (!text.isEmpty()) {
            parts.add(new Ast.Constant(span, ConstantType.STRING, text));
        }
    }

    private Node formattedValue(TSNode field) {
        TSNode expression = field(field, "expression");
        char conversion = '\0';
        Node formatSpec = null;
        for (TSNode part : named(field)) {
            switch (part.getType()) {
                case "type_conversion": {
                    String spelled = text(part);
                    conversion = spelled.charAt(spelled.length() - 1);
                    break;
                }
                case "format_specifier": {
                    int from = part.getStartByte();
                    if (part.getChildCount() > 0 && ":".equals(part.getChild(0).getType())) {
                        from = part.getChild(0).getEndByte();
                    }
                    formatSpec = new Ast.JoinedStr(span(part),
                            mergeConstants(interpolated(part, from, part.getEndByte(), span(part))));
                    break;
                }
                default:
                    if (expression == null) {
                        expression = part;
                    }
                    break;
            }
        }
        if (expression == null) {
            throw error(field, "f-string: empty expression not allowed");
        }
        return new Ast.FormattedValue(span(field), expr(expression), conversion, formatSpec);
    }

    private static List<Node> mergeConstants(List<Node> parts) {
        List<Node> merged = new ArrayList<>();
        for (Node part : parts) {
            int lastIndex = merged.size() - 1;
            if (part instanceof Ast.Constant constant && lastIndex >= 0
                    && merged.get(lastIndex) instanceof Ast.Constant previous) {
                merged.set(lastIndex, new Ast.Constant(Span.between(previous.span(), constant.span()),
                        ConstantType.STRING, previous.value() + constant.value()));
            } else if (!(part instanceof Ast.Constant constant && constant.value().isEmpty())) {
                merged.add(part);
            }
        }
        return List.copyOf(merged);
    }

    private static ConstantType numberType(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.endsWith("j")) {
            return ConstantType.COMPLEX;
        }
        if (lower.startsWith("0x") || lower.startsWith("0o") || lower.startsWith("0b")) {
            return ConstantType.INT;
        }
        if (lower.contains(".") || lower.contains("e")) {
            return ConstantType.FLOAT;
        }
        return ConstantType.INT;
    }

    // ============================================================ signatures

    /**
     * Parameters in declaration order. A bare {@code *} or {@code *args} switches to
     * keyword-only; a {@code /} moves everything seen so far to positional-only.
     */
    private Ast.Arguments parameters(TSNode node) {
        List<Ast.Arg> posonly = new ArrayList<>();
        List<Ast.Arg> args = new ArrayList<>();
        List<Ast.Arg> kwonly = new ArrayList<>();
        List<Node> defaults = new ArrayList<>();
        List<Node> kwDefaults = new ArrayList<>();
        Ast.Arg vararg = null;
        Ast.Arg kwarg = null;
        boolean keywordOnly = false;

        for (TSNode part : named(node)) {
            Ast.Arg arg = null;
            Node defaultValue = null;
            switch (part.getType()) {
                case "identifier":
                    arg = new Ast.Arg(span(part), text(part), null);
                    break;
                case "default_parameter":
                    arg = new Ast.Arg(span(part), text(field(part, "name")), null);
                    defaultValue = expr(field(part, "value"));
                    break;
                case "typed_default_parameter":
                    arg = new Ast.Arg(span(part), text(field(part, "name")), expr(field(part, "type")));
                    defaultValue = expr(field(part, "value"));
                    break;
                case "typed_parameter": {
                    TSNode inner = named(part).get(0);
                    Ast.Arg typed = new Ast.Arg(span(part), splatName(inner), expr(field(part, "type")));
                    if ("list_splat_pattern".equals(inner.getType())) {
                        vararg = typed;
                        keywordOnly = true;
                    } else if ("dictionary_splat_pattern".equals(inner.getType())) {
                        kwarg = typed;
                    } else {
                        arg = typed;
                    }
                    break;
                }
                case "list_splat_pattern":
                    vararg = new Ast.Arg(span(part), splatName(part), null);
                    keywordOnly = true;
                    break;
                case "dictionary_splat_pattern":
                    kwarg = new Ast.Arg(span(part), splatName(part), null);
                    break;
                case "keyword_separator":
                    keywordOnly = true;
                    break;
                case "positional_separator":
                    posonly.addAll(args);
                    args.clear();
                    break;
                default:
                    throw error(part, "unsupported parameter '" + part.getType() + "'");
            }
            if (arg == null) {
                continue;
            }
            if (keywordOnly) {
                kwonly.add(arg);
                kwDefaults.add(defaultValue);
            } else {
                args.add(arg);
                if (defaultValue != null) {
                    defaults.add(defaultValue);
                }
            }
        }
        return new Ast.Arguments(span(node), List.copyOf(posonly), List.copyOf(args), vararg, List.copyOf(kwonly),
                Collections.unmodifiableList(kwDefaults), kwarg, List.copyOf(defaults));
    }

    private String splatName(TSNode node) {
        List<TSNode> inner = named(node);
        return inner.isEmpty() ? text(node) : text(inner.get(0));
    }

    // =============================================================== helpers

    /**
     * Span from the start of a compound statement to the end of its last nested statement.
     * Tree-sitter's own range can run on over trailing comments and blank lines.
     */
    @SafeVarargs
    private Span compound(TSNode node, List<? extends Node>... tails) {
        Span start = span(node);
        for (int i = tails.length - 1; i >= 0; i--) {
            if (!tails[i].isEmpty()) {
                return Span.between(start, tails[i].get(tails[i].size() - 1).span());
            }
        }
        return start;
    }

    private List<Node> body(TSNode node, String fieldName) {
        TSNode block = field(node, fieldName);
        if (block == null) {
            for (TSNode part : named(node)) {
                if ("block".equals(part.getType())) {
                    block = part;
                    break;
                }
            }
        }
        return block == null ? List.of() : statements(block);
    }

    private List<Node> elseBody(TSNode node) {
        TSNode clause = field(node, "alternative");
        return clause == null ? List.of() : body(clause, "body");
    }

    private List<Node> elements(TSNode node) {
        String type = node.getType();
        if ("expression_list".equals(type) || "pattern_list".equals(type)) {
            return exprs(named(node));
        }
        return List.of(expr(node));
    }

    private List<String> identifiers(TSNode node) {
        List<String> out = new ArrayList<>();
        named(node).forEach(part -> out.add(text(part)));
        return List.copyOf(out);
    }

    private String aliasName(TSNode asPattern) {
        TSNode target = aliasTarget(asPattern);
        return target == null ? null : text(target);
    }

    /** Target of {@code expr as target}, unwrapped from its as_pattern_target node. */
    private TSNode aliasTarget(TSNode asPattern) {
        TSNode alias = field(asPattern, "alias");
        if (alias == null) {
            List<TSNode> parts = named(asPattern);
            alias = parts.size() > 1 ? parts.get(parts.size() - 1) : null;
        }
        if (alias != null && "as_pattern_target".equals(alias.getType()) && !named(alias).isEmpty()) {
            return named(alias).get(0);
        }
        return alias;
    }

    private TSNode unwrapType(TSNode node) {
        return "type".equals(node.getType()) && !named(node).isEmpty() ? named(node).get(0) : node;
    }

    private String dotted(TSNode node) {
        return text(node).replaceAll("\\s+", "");
    }

    private Node dottedExpr(TSNode node) {
        List<TSNode> parts = named(node);
        Node result = new Ast.Name(span(parts.get(0)), text(parts.get(0)));
        for (int i = 1; i < parts.size(); i++) {
            result = new Ast.Attribute(Span.between(result.span(), span(parts.get(i))), result, text(parts.get(i)));
        }
        return result;
    }

    private static boolean hasToken(TSNode node, String type) {
        for (int i = 0; i < node.getChildCount(); i++) {
            if (type.equals(node.getChild(i).getType())) {
                return true;
            }
        }
        return false;
    }

    private static List<TSNode> named(TSNode node) {
        List<TSNode> out = new ArrayList<>();
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            TSNode child = node.getNamedChild(i);
            if (!EXTRAS.contains(child.getType())) {
                out.add(child);
            }
        }
        return out;
    }

    private static TSNode field(TSNode node, String name) {
        TSNode child = node.getChildByFieldName(name);
        return child == null || child.isNull() ? null : child;
    }

    private String text(TSNode node) {
        return source.text(node);
    }

    private Span span(TSNode node) {
        return source.span(node);
    }

    private PythonSyntaxException error(TSNode node, String message) {
        Span at = span(node);
        return new PythonSyntaxException(message, at.line(), at.column());
    }
}
