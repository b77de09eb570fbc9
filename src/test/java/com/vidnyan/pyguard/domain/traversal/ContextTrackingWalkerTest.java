package com.vidnyan.pyguard.domain.traversal;

import com.vidnyan.pyguard.adapter.out.parser.TreeSitterPythonParser;
import com.vidnyan.pyguard.domain.model.Category;
import com.vidnyan.pyguard.domain.model.Finding;
import com.vidnyan.pyguard.domain.model.Severity;
import com.vidnyan.pyguard.domain.rule.Rule;
import com.vidnyan.pyguard.domain.rule.RuleDescriptor;
import com.vidnyan.pyguard.domain.rule.RuleRegistry;
import com.vidnyan.pyguard.domain.syntax.Ast;
import com.vidnyan.pyguard.domain.syntax.NodeKind;
import com.vidnyan.pyguard.domain.syntax.SyntaxTree;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ContextTrackingWalkerTest {

    private static RuleDescriptor check(String code) {
        return RuleDescriptor.of(code, "check-" + code.toLowerCase(), Category.RUNTIME, Severity.LOW, "Check " + code);
    }

    private static ScanResult scan(String source, Rule... rules) {
        Ast.Module module = TreeSitterPythonParser.parseModule(source);
        ContextTrackingWalker walker = new ContextTrackingWalker(new RuleRegistry(List.of(rules)));
        return walker.scan(new SyntaxTree(module, source.lines().toList().size()), source.lines().toList());
    }

    private static List<String> messages(ScanResult result) {
        return result.findings().stream().map(Finding::message).toList();
    }

    @Test
    void scan_ShouldVisitEveryNodeOnce() {
        ScanResult result = scan("x = 1\n");

        // module, assign, name, constant
        assertEquals(4, result.nodesVisited());
        assertTrue(result.findings().isEmpty());
    }

    @Test
    void guardAndHandlerFrames_ShouldResetInsideNestedFunctions() {
        RuleDescriptor d = check("X001");
        Rule rule = Rule.of(d, Set.of(NodeKind.PASS), (node, ctx) -> d.report(node, ctx,
                "guarded=" + ctx.isGuarded() + " handler=" + ctx.isInHandler(), null));

        ScanResult result = scan("""
                try:
                    pass
                    def inner():
                        pass
                except ValueError:
                    pass
                """, rule);

        assertEquals(List.of(
                "guarded=true handler=false",
                "guarded=false handler=false",
                "guarded=false handler=true"), messages(result));
    }

    @Test
    void controlDepth_ShouldCountEnclosingBlocksAndFindIteratedLoop() {
        RuleDescriptor d = check("X002");
        Rule rule = Rule.of(d, Set.of(NodeKind.PASS), (node, ctx) -> d.report(node, ctx,
                ctx.controlDepth() + " " + ctx.loopOver("items").isPresent() + " " + ctx.isInLoop(), null));

        ScanResult result = scan("""
                for item in items:
                    if item:
                        while True:
                            pass
                """, rule);

        assertEquals(List.of("3 true true"), messages(result));
        assertEquals(4, result.findings().get(0).line());
        assertEquals("pass", result.findings().get(0).snippet());
    }

    @Test
    void elifChain_ShouldNotDeepenNesting() {
        RuleDescriptor d = check("X003");
        Rule rule = Rule.of(d, Set.of(NodeKind.PASS), (node, ctx) -> d.report(node, ctx,
                String.valueOf(ctx.controlDepth()), null));

        ScanResult result = scan("""
                if a:
                    pass
                elif b:
                    pass
                else:
                    pass
                """, rule);

        assertEquals(List.of("1", "1", "1"), messages(result));
    }

    @Test
    void parameterDefaults_ShouldBeWalkedOutsideTheFunction() {
        RuleDescriptor d = check("X004");
        Rule rule = Rule.of(d, Set.of(NodeKind.NAME), (node, ctx) -> d.report(node, ctx,
                ((Ast.Name) node).id() + " " + ctx.isInFunction(), null));

        ScanResult result = scan("""
                def f(a=fallback):
                    return a
                """, rule);

        assertEquals(List.of("fallback false", "a true"), messages(result));
    }

    @Test
    void comprehension_ShouldBindItsTargets() {
        RuleDescriptor d = check("X005");
        Rule rule = Rule.of(d, Set.of(NodeKind.NAME), (node, ctx) -> "a".equals(((Ast.Name) node).id())
                ? d.report(node, ctx, ctx.current().kind() + " " + ctx.current().binds("a")
                        + " " + ctx.comprehensionDepth(), null)
                : Optional.empty());

        ScanResult result = scan("r = [a for a in items if a]\n", rule);

        assertEquals(3, result.findings().size());
        assertTrue(messages(result).stream().allMatch("COMPREHENSION true 1"::equals));
    }

    @Test
    void exitCheck_ShouldSeeTalliesOfTheFrameItOpened() {
        RuleDescriptor d = check("X006");
        Rule rule = Rule.of(d, Set.of(NodeKind.FUNCTION_DEF, NodeKind.NAME),
                (node, ctx) -> {
                    if (node.kind() == NodeKind.NAME) {
                        ctx.nearestDef().ifPresent(frame -> frame.tally("names"));
                    }
                    return Optional.empty();
                },
                (node, ctx) -> node.kind() == NodeKind.FUNCTION_DEF
                        ? d.report(node, ctx, "names=" + ctx.nearestDef().orElseThrow().count("names"), null)
                        : Optional.empty());

        ScanResult result = scan("""
                def outer():
                    a
                    def inner():
                        b
                        c
                    d
                """, rule);

        assertEquals(List.of("names=2", "names=2"), messages(result));
        assertEquals(3, result.findings().get(0).line());
        assertEquals(1, result.findings().get(1).line());
    }

    @Test
    void failingRule_ShouldBeRecordedAsFaultWithoutStoppingOthers() {
        RuleDescriptor broken = check("X007");
        RuleDescriptor healthy = check("X008");
        Rule failing = Rule.of(broken, Set.of(NodeKind.NAME), (node, ctx) -> {
            throw new IllegalStateException("boom");
        });
        Rule working = Rule.of(healthy, Set.of(NodeKind.NAME), (node, ctx) -> healthy.report(node, ctx, "ok", null));

        ScanResult result = scan("x = y\n", failing, working);

        assertTrue(result.hasFaults());
        assertEquals(2, result.faults().size());
        assertEquals("check-x007", result.faults().get(0).ruleId());
        assertEquals("boom", result.faults().get(0).message());
        assertEquals(2, result.findings().size());
    }

    @Test
    void closure_ShouldSeeTheLoopAroundIt() {
        RuleDescriptor d = check("X009");
        Rule rule = Rule.of(d, Set.of(NodeKind.RETURN), (node, ctx) -> d.report(node, ctx,
                ctx.loopAroundClosure().map(frame -> frame.binds("i")).orElse(false) + " " + ctx.isInLoop(), null));

        ScanResult result = scan("""
                for i in range(3):
                    def show():
                        return i
                """, rule);

        assertEquals(List.of("true false"), messages(result));
    }
}
