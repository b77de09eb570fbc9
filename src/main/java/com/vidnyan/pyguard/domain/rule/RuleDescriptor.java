package com.vidnyan.pyguard.domain.rule;

import com.vidnyan.pyguard.domain.model.Category;
import com.vidnyan.pyguard.domain.model.Finding;
import com.vidnyan.pyguard.domain.model.Severity;
import com.vidnyan.pyguard.domain.syntax.Node;
import com.vidnyan.pyguard.domain.traversal.TraversalContext;

import java.util.Optional;

/**
 * Identity and classification of a rule.
 *
 * @param id       kebab-case slug, unique across the catalogue
 * @param code     short code such as {@code R001}, unique across the catalogue
 * @param title    one-line human name
 */
public record RuleDescriptor(
    String id,
    String code,
    Category category,
    Severity severity,
    String title
) {

    public static RuleDescriptor of(String code, String id, Category category, Severity severity, String title) {
        return new RuleDescriptor(id, code, category, severity, title);
    }

    /**
     * Builds a finding located at {@code node}, with the source line attached as snippet.
     */
    public Finding finding(Node node, TraversalContext context, String message, String suggestion) {
        return new Finding(id, code, category, severity, node.line(), node.column(),
                message, suggestion, context.sourceLine(node.line()));
    }

    public Optional<Finding> report(Node node, TraversalContext context, String message, String suggestion) {
        return Optional.of(finding(node, context, message, suggestion));
    }
}
