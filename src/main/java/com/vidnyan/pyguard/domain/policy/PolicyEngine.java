package com.vidnyan.pyguard.domain.policy;

import com.vidnyan.pyguard.domain.model.GuardSettings;
import com.vidnyan.pyguard.domain.model.Severity;

/**
 * Silent when nothing survived filtering, Block on any CRITICAL finding when
 * block-on-critical is set, Warn otherwise. The max-issues cap plays no part here.
 */
public class PolicyEngine {

    public Verdict decide(AggregatedFindings findings, GuardSettings settings) {
        if (findings.isEmpty()) {
            return new Verdict(Decision.SILENT, findings);
        }
        if (settings.blockOnCritical() && findings.count(Severity.CRITICAL) > 0) {
            return new Verdict(Decision.BLOCK, findings);
        }
        return new Verdict(Decision.WARN, findings);
    }
}
