package com.vidnyan.pyguard.adapter.out.detector;

import com.vidnyan.pyguard.domain.model.Finding;
import com.vidnyan.pyguard.domain.rule.Rule;
import com.vidnyan.pyguard.domain.rule.RuleCatalog;
import com.vidnyan.pyguard.domain.rule.RuleDescriptor;
import com.vidnyan.pyguard.domain.syntax.Ast;
import com.vidnyan.pyguard.domain.syntax.Node;
import com.vidnyan.pyguard.domain.syntax.NodeKind;
import com.vidnyan.pyguard.domain.traversal.FrameKind;
import com.vidnyan.pyguard.domain.traversal.TraversalContext;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.vidnyan.pyguard.domain.model.Category.PERFORMANCE;
import static com.vidnyan.pyguard.domain.model.Severity.LOW;
import static com.vidnyan.pyguard.domain.model.Severity.MEDIUM;

/**
 * Work repeated inside loops, and iteration idioms that do more than needed.
 */
@Component
@Order(2)
public class PerformanceRules implements RuleCatalog {

    static final RuleDescriptor STRING_CONCAT_IN_LOOP =
            RuleDescriptor.of("P001", "string-concat-in-loop", PERFORMANCE, MEDIUM, "String concatenation in loop");
    static final RuleDescriptor RANGE_LEN_ITERATION =
            RuleDescriptor.of("P002", "range-len-iteration", PERFORMANCE, LOW, "range(len(...)) iteration");
    static final RuleDescriptor DICT_KEYS_ITERATION =
            RuleDescriptor.of("P003", "dict-keys-iteration", PERFORMANCE, LOW, "Iterating over dict.keys()");
    static final RuleDescriptor LITERAL_MEMBERSHIP_IN_LOOP =
            RuleDescriptor.of("P004", "literal-membership-in-loop", PERFORMANCE, LOW, "List membership test in loop");
    static final RuleDescriptor REGEX_COMPILE_IN_LOOP =
            RuleDescriptor.of("P005", "regex-compile-in-loop", PERFORMANCE, LOW, "Regex built inside loop");

    private static final String STRING_NAME = "str-name:";

    private static final Set<String> REGEX_FUNCTIONS = Set.of(
            "re.compile", "re.match", "re.search", "re.fullmatch", "re.findall", "re.finditer", "re.sub",
            "re.subn", "re.split");

    private static final Set<NodeKind> ITERATIONS = Set.of(NodeKind.FOR, NodeKind.COMPREHENSION);

    @Override
    public List<Rule> rules() {
        return List.of(
                Rule.of(STRING_CONCAT_IN_LOOP, Set.of(NodeKind.ASSIGN, NodeKind.ANN_ASSIGN, NodeKind.AUG_ASSIGN),
                        PerformanceRules::stringConcatInLoop),
                Rule.of(RANGE_LEN_ITERATION, ITERATIONS, PerformanceRules::rangeLen),
                Rule.of(DICT_KEYS_ITERATION, ITERATIONS, PerformanceRules::dictKeys),
                Rule.of(LITERAL_MEMBERSHIP_IN_LOOP, Set.of(NodeKind.COMPARE), PerformanceRules::literalMembership),
                Rule.of(REGEX_COMPILE_IN_LOOP, Set.of(NodeKind.CALL), PerformanceRules::regexInLoop)
        );
    }

    /**
     * Names assigned a string value are remembered on the enclosing scope; a later
     * {@code +=} on such a name, or with a string operand, inside a loop is reported
     * once per loop and name.
     */
    private static Optional<Finding> stringConcatInLoop(Node node, TraversalContext ctx) {
        if (node instanceof Ast.Assign assign) {
            if (AstQueries.isStringValued(assign.value())) {
                assign.targets().stream()
                        .filter(Ast.Name.class::isInstance)
                        .forEach(target -> ctx.scope().mark(STRING_NAME + ((Ast.Name) target).id()));
            }
            return Optional.empty();
        }
        if (node instanceof Ast.AnnAssign annotated) {
            if (annotated.target() instanceof Ast.Name name && annotated.value() != null
                    && AstQueries.isStringValued(annotated.value())) {
                ctx.scope().mark(STRING_NAME + name.id());
            }
            return Optional.empty();
        }

        Ast.AugAssign aug = (Ast.AugAssign) node;
        if (!aug.op().equals("+=") || !(aug.target() instanceof Ast.Name target)) {
            return Optional.empty();
        }
        boolean stringy = AstQueries.isStringValued(aug.value()) || ctx.scope().isMarked(STRING_NAME + target.id());
        boolean firstInLoop = ctx.nearest(FrameKind.LOOP)
                .map(loop -> loop.markOnce("concat:" + target.id()))
                .orElse(false);
        if (!stringy || !firstInLoop) {
            return Optional.empty();
        }
        return STRING_CONCAT_IN_LOOP.report(node, ctx,
                "String '" + target.id() + "' is built with += inside a loop (quadratic copying)",
                "Collect the parts in a list and call ''.join(parts) after the loop");
    }

    private static Optional<Finding> rangeLen(Node node, TraversalContext ctx) {
        Node iter = iterable(node);
        if (!(iter instanceof Ast.Call call) || !AstQueries.isCallTo(call, "range") || call.args().size() != 1
                || !AstQueries.isCallTo(call.args().get(0), "len")) {
            return Optional.empty();
        }
        return RANGE_LEN_ITERATION.report(node, ctx,
                "Iterating with range(len(...)) to index a sequence",
                "Iterate directly, or use enumerate() when the index is needed");
    }

    private static Optional<Finding> dictKeys(Node node, TraversalContext ctx) {
        Node iter = iterable(node);
        if (!(iter instanceof Ast.Call call) || !"keys".equals(AstQueries.methodName(call))
                || !call.args().isEmpty() || !call.keywords().isEmpty()) {
            return Optional.empty();
        }
        return DICT_KEYS_ITERATION.report(node, ctx,
                "Iterating over .keys() builds a view that plain iteration does not need",
                "Iterate over the dict itself: 'for key in mapping:'");
    }

    private static Optional<Finding> literalMembership(Node node, TraversalContext ctx) {
        if (!ctx.isRepeated()) {
            return Optional.empty();
        }
        Ast.Compare compare = (Ast.Compare) node;
        for (int i = 0; i < compare.ops().size(); i++) {
            String op = compare.ops().get(i);
            if ((op.equals("in") || op.equals("not in")) && compare.comparators().get(i) instanceof Ast.ListExpr list
                    && list.elts().size() > 1) {
                return LITERAL_MEMBERSHIP_IN_LOOP.report(node, ctx,
                        "Membership test against a list literal inside a loop is a linear scan each time",
                        "Use a set literal, or hoist a frozenset constant out of the loop");
            }
        }
        return Optional.empty();
    }

    private static Optional<Finding> regexInLoop(Node node, TraversalContext ctx) {
        Ast.Call call = (Ast.Call) node;
        if (!ctx.isRepeated() || !AstQueries.callsAny(call, REGEX_FUNCTIONS)
                || !AstQueries.isStringConstant(AstQueries.firstArgument(call))) {
            return Optional.empty();
        }
        return REGEX_COMPILE_IN_LOOP.report(node, ctx,
                AstQueries.calleeName(call).orElse("re") + "() with a constant pattern inside a loop",
                "Compile the pattern once with re.compile() outside the loop and reuse it");
    }

    private static Node iterable(Node node) {
        if (node instanceof Ast.For loop) {
            return loop.iter();
        }
        return ((Ast.Comprehension) node).iter();
    }
}
