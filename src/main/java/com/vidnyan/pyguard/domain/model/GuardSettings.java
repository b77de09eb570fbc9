package com.vidnyan.pyguard.domain.model;

import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable engine configuration, resolved once per invocation and passed by parameter.
 */
public record GuardSettings(
    boolean enabled,
    Set<Severity> enabledSeverities,
    Set<String> disabledRules,
    boolean blockOnCritical,
    int maxIssues,
    int maxLines,
    Set<String> allowedExtensions,
    Path projectRoot
) {

    public static final int DEFAULT_MAX_ISSUES = 10;
    public static final int DEFAULT_MAX_LINES = 10_000;
    public static final Set<String> PYTHON_EXTENSIONS = Set.of(".py", ".pyi");

    public GuardSettings {
        enabledSeverities = enabledSeverities.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(enabledSeverities));
        disabledRules = disabledRules.stream()
                .map(rule -> rule.trim().toLowerCase(Locale.ROOT))
                .filter(rule -> !rule.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
        allowedExtensions = Set.copyOf(allowedExtensions);
        projectRoot = projectRoot.toAbsolutePath().normalize();
    }

    public static GuardSettings defaults(Path projectRoot) {
        return new GuardSettings(true, EnumSet.allOf(Severity.class), Set.of(), true,
                DEFAULT_MAX_ISSUES, DEFAULT_MAX_LINES, PYTHON_EXTENSIONS, projectRoot);
    }

    /**
     * A rule is disabled when either its slug id or its code is listed (case-insensitive).
     */
    public boolean isRuleDisabled(String ruleId, String code) {
        return disabledRules.contains(ruleId.toLowerCase(Locale.ROOT))
                || disabledRules.contains(code.toLowerCase(Locale.ROOT));
    }

    public boolean isSeverityEnabled(Severity severity) {
        return enabledSeverities.contains(severity);
    }

    public GuardSettings withDisabledRules(Set<String> rules) {
        return new GuardSettings(enabled, enabledSeverities, rules, blockOnCritical, maxIssues, maxLines,
                allowedExtensions, projectRoot);
    }

    public GuardSettings withEnabledSeverities(Set<Severity> severities) {
        return new GuardSettings(enabled, severities, disabledRules, blockOnCritical, maxIssues, maxLines,
                allowedExtensions, projectRoot);
    }

    public GuardSettings withBlockOnCritical(boolean block) {
        return new GuardSettings(enabled, enabledSeverities, disabledRules, block, maxIssues, maxLines,
                allowedExtensions, projectRoot);
    }

    public GuardSettings withMaxLines(int lines) {
        return new GuardSettings(enabled, enabledSeverities, disabledRules, blockOnCritical, maxIssues, lines,
                allowedExtensions, projectRoot);
    }

    public GuardSettings withMaxIssues(int issues) {
        return new GuardSettings(enabled, enabledSeverities, disabledRules, blockOnCritical, issues, maxLines,
                allowedExtensions, projectRoot);
    }

    public GuardSettings withEnabled(boolean on) {
        return new GuardSettings(on, enabledSeverities, disabledRules, blockOnCritical, maxIssues, maxLines,
                allowedExtensions, projectRoot);
    }
}
