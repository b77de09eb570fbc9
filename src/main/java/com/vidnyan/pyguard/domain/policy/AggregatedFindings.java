package com.vidnyan.pyguard.domain.policy;

import com.vidnyan.pyguard.domain.model.Finding;
import com.vidnyan.pyguard.domain.model.Severity;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Filtered, ordered findings with per-severity counts.
 */
public record AggregatedFindings(
    List<Finding> findings,
    Map<Severity, Integer> counts
) {

    public static AggregatedFindings empty() {
        return of(List.of());
    }

    public static AggregatedFindings of(List<Finding> ordered) {
        Map<Severity, Integer> counts = new EnumMap<>(Severity.class);
        for (Finding finding : ordered) {
            counts.merge(finding.severity(), 1, Integer::sum);
        }
        return new AggregatedFindings(List.copyOf(ordered), Collections.unmodifiableMap(counts));
    }

    public int count(Severity severity) {
        return counts.getOrDefault(severity, 0);
    }

    public int total() {
        return findings.size();
    }

    public boolean isEmpty() {
        return findings.isEmpty();
    }

    public List<Finding> bySeverity(Severity severity) {
        return findings.stream().filter(f -> f.severity() == severity).toList();
    }
}
