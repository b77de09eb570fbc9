package com.vidnyan.pyguard.domain.model;

import java.util.Comparator;

/**
 * One concrete occurrence of a rule matching at a source location.
 * Immutable value object.
 */
public record Finding(
    String ruleId,
    String code,
    Category category,
    Severity severity,
    int line,
    int column,
    String message,
    String suggestion,
    String snippet
) {

    /**
     * Report order: severity (CRITICAL first), then line, column and rule id.
     */
    public static final Comparator<Finding> REPORT_ORDER = Comparator
            .comparing(Finding::severity)
            .thenComparingInt(Finding::line)
            .thenComparingInt(Finding::column)
            .thenComparing(Finding::ruleId);

    public boolean hasSnippet() {
        return snippet != null && !snippet.isBlank();
    }
}
