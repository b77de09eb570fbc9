package com.vidnyan.pyguard.domain.policy;

import com.vidnyan.pyguard.domain.model.Category;
import com.vidnyan.pyguard.domain.model.Finding;
import com.vidnyan.pyguard.domain.model.GuardSettings;
import com.vidnyan.pyguard.domain.model.Severity;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FindingAggregatorTest {

    private final FindingAggregator aggregator = new FindingAggregator();
    private final GuardSettings defaults = GuardSettings.defaults(Path.of("."));

    static Finding finding(String code, String id, Severity severity, int line) {
        return new Finding(id, code, Category.GOTCHA, severity, line, 0, "message " + code, null, null);
    }

    @Test
    void aggregate_ShouldOrderBySeverityThenLine() {
        List<Finding> raw = List.of(
                finding("G009", "fstring-without-placeholders", Severity.LOW, 1),
                finding("S002", "command-injection", Severity.CRITICAL, 9),
                finding("R001", "mutable-default", Severity.HIGH, 5),
                finding("R003", "bare-except", Severity.MEDIUM, 2),
                finding("S001", "injection-heuristic", Severity.CRITICAL, 3));

        AggregatedFindings result = aggregator.aggregate(raw, defaults);

        assertEquals(List.of("S001", "S002", "R001", "R003", "G009"),
                result.findings().stream().map(Finding::code).toList());
        assertEquals(2, result.count(Severity.CRITICAL));
        assertEquals(1, result.count(Severity.LOW));
        assertEquals(5, result.total());
    }

    @Test
    void aggregate_ShouldDropDisabledRulesByIdOrCode() {
        List<Finding> raw = List.of(
                finding("R001", "mutable-default", Severity.HIGH, 1),
                finding("R003", "bare-except", Severity.MEDIUM, 2),
                finding("G009", "fstring-without-placeholders", Severity.LOW, 3));

        AggregatedFindings result = aggregator.aggregate(raw,
                defaults.withDisabledRules(Set.of("r001", " Bare-Except ")));

        assertEquals(List.of("G009"), result.findings().stream().map(Finding::code).toList());
    }

    @Test
    void aggregate_ShouldKeepOnlyEnabledSeverities() {
        List<Finding> raw = List.of(
                finding("S002", "command-injection", Severity.CRITICAL, 1),
                finding("R003", "bare-except", Severity.MEDIUM, 2),
                finding("G009", "fstring-without-placeholders", Severity.LOW, 3));

        AggregatedFindings result = aggregator.aggregate(raw,
                defaults.withEnabledSeverities(EnumSet.of(Severity.CRITICAL, Severity.MEDIUM)));

        assertEquals(2, result.total());
        assertEquals(0, result.count(Severity.LOW));
    }

    @Test
    void aggregate_NoEnabledSeverities_ShouldBeEmpty() {
        AggregatedFindings result = aggregator.aggregate(
                List.of(finding("R001", "mutable-default", Severity.HIGH, 1)),
                defaults.withEnabledSeverities(Set.of()));

        assertTrue(result.isEmpty());
    }
}
