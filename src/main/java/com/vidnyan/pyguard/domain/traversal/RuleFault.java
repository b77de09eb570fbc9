package com.vidnyan.pyguard.domain.traversal;

/**
 * A rule check that threw; the rule's finding for that node is dropped.
 */
public record RuleFault(
    String ruleId,
    String nodeKind,
    int line,
    String message
) {
}
