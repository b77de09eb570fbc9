package com.vidnyan.pyguard.domain.traversal;

import com.vidnyan.pyguard.domain.model.Finding;
import com.vidnyan.pyguard.domain.rule.Rule;
import com.vidnyan.pyguard.domain.rule.RuleRegistry;
import com.vidnyan.pyguard.domain.syntax.Ast;
import com.vidnyan.pyguard.domain.syntax.Node;
import com.vidnyan.pyguard.domain.syntax.SyntaxTree;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Single pre-order walk over a syntax tree.
 * <p>
 * For each node: enter-phase rules run, the node's frames are pushed as its
 * regions are walked, exit-phase rules run, then the frames are popped.
 * Rules are looked up in the registry's dispatch table, so every node is
 * visited exactly once regardless of how many rules are registered.
 * A rule that throws is recorded as a fault and the walk continues.
 */
@Slf4j
@RequiredArgsConstructor
public class ContextTrackingWalker {

    private final RuleRegistry registry;

    public ScanResult scan(SyntaxTree tree, List<String> lines) {
        Scan scan = new Scan(new TraversalContext(lines));
        scan.visit(tree.module());
        if (!scan.faults.isEmpty()) {
            log.warn("{} rule fault(s) during scan; affected findings were dropped", scan.faults.size());
        }
        return new ScanResult(List.copyOf(scan.findings), List.copyOf(scan.faults), scan.visited);
    }

    private enum Phase {
        ENTER,
        EXIT
    }

    /**
     * Per-invocation walk state.
     */
    private final class Scan {

        private final TraversalContext context;
        private final List<Finding> findings = new ArrayList<>();
        private final List<RuleFault> faults = new ArrayList<>();
        private int visited;

        Scan(TraversalContext context) {
            this.context = context;
        }

        void visit(Node node) {
            visited++;
            dispatch(node, Phase.ENTER);
            int depth = context.frames().size();
            context.descend(node);
            walkRegions(node);
            context.ascend();
            dispatch(node, Phase.EXIT);
            while (context.frames().size() > depth) {
                context.pop();
            }
        }

        /**
         * Walks the node's children. Frames spanning the whole node (module, function,
         * class, handler, comprehension) stay pushed so exit checks can read them;
         * frames covering one region only are popped right after that region.
         */
        private void walkRegions(Node node) {
            if (node instanceof Ast.Module module) {
                context.push(FrameKind.MODULE, module);
                walk(module.body());
            } else if (node instanceof Ast.FunctionDef function) {
                walk(function.decorators());
                visit(function.args());
                visitOptional(function.returns());
                context.push(FrameKind.FUNCTION, function, parameterNames(function.args()), null);
                walk(function.body());
            } else if (node instanceof Ast.Lambda lambda) {
                visit(lambda.args());
                context.push(FrameKind.FUNCTION, lambda, parameterNames(lambda.args()), null);
                visit(lambda.body());
            } else if (node instanceof Ast.ClassDef cls) {
                walk(cls.decorators());
                walk(cls.bases());
                walk(cls.keywords());
                context.push(FrameKind.CLASS, cls);
                walk(cls.body());
            } else if (node instanceof Ast.For loop) {
                visit(loop.target());
                visit(loop.iter());
                String iterated = loop.iter() instanceof Ast.Name name ? name.id() : null;
                region(FrameKind.LOOP, loop, Ast.boundNames(loop.target()), iterated, loop.body());
                walk(loop.orelse());
            } else if (node instanceof Ast.While loop) {
                visit(loop.test());
                region(FrameKind.LOOP, loop, Set.of(), null, loop.body());
                walk(loop.orelse());
            } else if (node instanceof Ast.If branch) {
                visit(branch.test());
                region(FrameKind.BRANCH, branch, Set.of(), null, branch.body());
                if (branch.hasElifBranch()) {
                    walk(branch.orelse());
                } else if (!branch.orelse().isEmpty()) {
                    region(FrameKind.BRANCH, branch, Set.of(), null, branch.orelse());
                }
            } else if (node instanceof Ast.With with) {
                walk(with.items());
                Set<String> bound = with.items().stream()
                        .filter(item -> item.optionalVars() != null)
                        .flatMap(item -> Ast.boundNames(item.optionalVars()).stream())
                        .collect(Collectors.toSet());
                region(FrameKind.BRANCH, with, bound, null, with.body());
            } else if (node instanceof Ast.MatchCase arm) {
                visit(arm.pattern());
                visitOptional(arm.guard());
                region(FrameKind.BRANCH, arm, Set.of(), null, arm.body());
            } else if (node instanceof Ast.Try attempt) {
                region(FrameKind.GUARDED, attempt, Set.of(), null, attempt.body());
                walk(attempt.handlers());
                walk(attempt.orelse());
                if (!attempt.finalbody().isEmpty()) {
                    region(FrameKind.FINALLY, attempt, Set.of(), null, attempt.finalbody());
                }
            } else if (node instanceof Ast.ExceptHandler handler) {
                visitOptional(handler.type());
                context.push(FrameKind.HANDLER, handler,
                        handler.name() != null ? Set.of(handler.name()) : Set.of(), null);
                walk(handler.body());
            } else if (node.kind().isComprehension()) {
                context.push(FrameKind.COMPREHENSION, node, comprehensionTargets(node), null);
                walk(node.children());
            } else {
                walk(node.children());
            }
        }

        private void region(FrameKind kind, Node owner, Set<String> bound, String iterated, List<? extends Node> body) {
            context.push(kind, owner, bound, iterated);
            walk(body);
            context.pop();
        }

        private void walk(List<? extends Node> nodes) {
            for (Node child : nodes) {
                visit(child);
            }
        }

        private void visitOptional(Node node) {
            if (node != null) {
                visit(node);
            }
        }

        private void dispatch(Node node, Phase phase) {
            for (Rule rule : registry.rulesFor(node.kind())) {
                try {
                    Optional<Finding> finding = phase == Phase.ENTER
                            ? rule.enter(node, context)
                            : rule.exit(node, context);
                    finding.ifPresent(findings::add);
                } catch (RuntimeException e) {
                    log.warn("Rule {} failed on {} at line {}: {}", rule.id(), node.kind(), node.line(), e.toString());
                    faults.add(new RuleFault(rule.id(), node.kind().name(), node.line(), String.valueOf(e.getMessage())));
                }
            }
        }
    }

    private static Set<String> parameterNames(Ast.Arguments args) {
        return args.all().stream().map(Ast.Arg::name).collect(Collectors.toSet());
    }

    private static Set<String> comprehensionTargets(Node comprehension) {
        return comprehension.children().stream()
                .filter(Ast.Comprehension.class::isInstance)
                .map(Ast.Comprehension.class::cast)
                .flatMap(generator -> Ast.boundNames(generator.target()).stream())
                .collect(Collectors.toSet());
    }
}
