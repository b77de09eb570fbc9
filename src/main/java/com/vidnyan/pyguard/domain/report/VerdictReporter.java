package com.vidnyan.pyguard.domain.report;

import com.vidnyan.pyguard.domain.model.Finding;
import com.vidnyan.pyguard.domain.model.Severity;
import com.vidnyan.pyguard.domain.policy.AggregatedFindings;
import com.vidnyan.pyguard.domain.policy.Verdict;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders a verdict as text for the hook caller.
 * The issue cap limits how many findings are printed; counts always cover all of them.
 */
public class VerdictReporter {

    private static final String INDENT = "  ";

    public Report render(Verdict verdict, String fileName, int maxIssues) {
        return switch (verdict.decision()) {
            case SILENT -> Report.silent();
            case WARN -> new Report(verdict.decision(), warning(verdict.findings(), fileName, maxIssues));
            case BLOCK -> new Report(verdict.decision(), blockReason(verdict.findings(), fileName, maxIssues));
        };
    }

    private String warning(AggregatedFindings findings, String fileName, int maxIssues) {
        StringBuilder out = new StringBuilder();
        out.append("⚠️ Python antipatterns in ").append(fileName).append(": ")
                .append(summary(findings)).append('\n');

        int budget = cap(maxIssues, findings.total());
        int shown = 0;
        for (Severity severity : Severity.values()) {
            List<Finding> group = findings.bySeverity(severity);
            if (group.isEmpty() || shown >= budget) {
                continue;
            }
            out.append('\n').append(severity).append(" (").append(group.size()).append(")\n");
            for (Finding finding : group) {
                if (shown >= budget) {
                    break;
                }
                appendFinding(out, finding);
                shown++;
            }
        }
        appendRemainder(out, findings.total() - shown);
        return out.toString().stripTrailing();
    }

    private String blockReason(AggregatedFindings findings, String fileName, int maxIssues) {
        List<Finding> critical = findings.bySeverity(Severity.CRITICAL);
        StringBuilder out = new StringBuilder();
        out.append("🚫 Blocked: ").append(critical.size())
                .append(critical.size() == 1 ? " critical issue" : " critical issues")
                .append(" in ").append(fileName).append('\n');

        int budget = cap(maxIssues, critical.size());
        for (Finding finding : critical.subList(0, budget)) {
            appendFinding(out, finding);
        }
        appendRemainder(out, critical.size() - budget);
        out.append("\nFix the critical issue(s) above before continuing.");
        return out.toString();
    }

    private static void appendFinding(StringBuilder out, Finding finding) {
        out.append(INDENT).append(format(finding)).append('\n');
        if (finding.suggestion() != null && !finding.suggestion().isBlank()) {
            out.append(INDENT).append(INDENT).append("Fix: ").append(finding.suggestion()).append('\n');
        }
        if (finding.hasSnippet()) {
            out.append(INDENT).append(INDENT).append("> ").append(finding.snippet()).append('\n');
        }
    }

    private static void appendRemainder(StringBuilder out, int remaining) {
        if (remaining > 0) {
            out.append('\n').append("... and ").append(remaining).append(" more\n");
        }
    }

    /**
     * {@code [R001:HIGH] mutable-default (line 3): message}
     */
    static String format(Finding finding) {
        return "[" + finding.code() + ":" + finding.severity() + "] " + finding.ruleId()
                + " (line " + finding.line() + "): " + finding.message();
    }

    static String summary(AggregatedFindings findings) {
        List<String> parts = new ArrayList<>();
        for (Severity severity : Severity.values()) {
            int count = findings.count(severity);
            if (count > 0) {
                parts.add(count + " " + severity);
            }
        }
        String noun = findings.total() == 1 ? " issue found" : " issues found";
        return findings.total() + noun + " (" + parts.stream().collect(Collectors.joining(", ")) + ")";
    }

    private static int cap(int maxIssues, int total) {
        return maxIssues <= 0 ? total : Math.min(maxIssues, total);
    }
}
