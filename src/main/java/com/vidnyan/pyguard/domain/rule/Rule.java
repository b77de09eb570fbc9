package com.vidnyan.pyguard.domain.rule;

import com.vidnyan.pyguard.domain.model.Finding;
import com.vidnyan.pyguard.domain.syntax.Node;
import com.vidnyan.pyguard.domain.syntax.NodeKind;
import com.vidnyan.pyguard.domain.traversal.TraversalContext;

import java.util.Optional;
import java.util.Set;

/**
 * A named, severity-tagged predicate over a node and its traversal context.
 * Rules hold no state between calls; per-scan bookkeeping lives in the context frames.
 */
public interface Rule {

    RuleDescriptor descriptor();

    /**
     * Node kinds this rule is dispatched on.
     */
    Set<NodeKind> interests();

    /**
     * Called before the node's children are walked.
     */
    default Optional<Finding> enter(Node node, TraversalContext context) {
        return Optional.empty();
    }

    /**
     * Called after the node's children, while frames opened for the node are still active.
     */
    default Optional<Finding> exit(Node node, TraversalContext context) {
        return Optional.empty();
    }

    default String id() {
        return descriptor().id();
    }

    static Rule of(RuleDescriptor descriptor, Set<NodeKind> interests, Check enter) {
        return of(descriptor, interests, enter, Check.NONE);
    }

    static Rule of(RuleDescriptor descriptor, Set<NodeKind> interests, Check enter, Check exit) {
        return new Rule() {
            @Override
            public RuleDescriptor descriptor() {
                return descriptor;
            }

            @Override
            public Set<NodeKind> interests() {
                return interests;
            }

            @Override
            public Optional<Finding> enter(Node node, TraversalContext context) {
                return enter.check(node, context);
            }

            @Override
            public Optional<Finding> exit(Node node, TraversalContext context) {
                return exit.check(node, context);
            }

            @Override
            public String toString() {
                return descriptor.code() + ":" + descriptor.id();
            }
        };
    }

    /**
     * One phase of a rule.
     */
    @FunctionalInterface
    interface Check {

        Check NONE = (node, context) -> Optional.empty();

        Optional<Finding> check(Node node, TraversalContext context);
    }
}
