package com.vidnyan.pyguard.domain.policy;

import com.vidnyan.pyguard.domain.model.Finding;
import com.vidnyan.pyguard.domain.model.GuardSettings;

import java.util.List;

/**
 * Applies the configured filters and the report order.
 */
public class FindingAggregator {

    public AggregatedFindings aggregate(List<Finding> raw, GuardSettings settings) {
        List<Finding> kept = raw.stream()
                .filter(f -> !settings.isRuleDisabled(f.ruleId(), f.code()))
                .filter(f -> settings.isSeverityEnabled(f.severity()))
                .sorted(Finding.REPORT_ORDER)
                .toList();
        return AggregatedFindings.of(kept);
    }
}
