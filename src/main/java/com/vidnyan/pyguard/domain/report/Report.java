package com.vidnyan.pyguard.domain.report;

import com.vidnyan.pyguard.domain.policy.Decision;

/**
 * Rendered outcome: feedback text for WARN, the block reason for BLOCK, empty for SILENT.
 */
public record Report(
    Decision decision,
    String text
) {

    public static Report silent() {
        return new Report(Decision.SILENT, "");
    }

    public boolean isBlocking() {
        return decision == Decision.BLOCK;
    }
}
