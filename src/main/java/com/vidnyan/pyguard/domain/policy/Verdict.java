package com.vidnyan.pyguard.domain.policy;

/**
 * Policy decision together with the findings it was made on.
 */
public record Verdict(
    Decision decision,
    AggregatedFindings findings
) {

    public static Verdict silent() {
        return new Verdict(Decision.SILENT, AggregatedFindings.empty());
    }

    public boolean isSilent() {
        return decision == Decision.SILENT;
    }
}
