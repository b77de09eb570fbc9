package com.vidnyan.pyguard.application.port.in;

import com.vidnyan.pyguard.domain.model.GuardSettings;
import com.vidnyan.pyguard.domain.model.StageOutcome;
import com.vidnyan.pyguard.domain.policy.Decision;
import com.vidnyan.pyguard.domain.policy.Verdict;
import com.vidnyan.pyguard.domain.report.Report;

/**
 * Primary use case: analyze one Python file and decide Silent, Warn or Block.
 * Never throws; internal failures resolve to a Silent result.
 */
public interface AnalyzeSourceUseCase {

    AnalysisResult analyze(AnalysisRequest request);

    /**
     * @param filePath path as given by the caller, absolute or relative to the project root
     */
    record AnalysisRequest(
        String filePath,
        GuardSettings settings
    ) {}

    /**
     * Outcome of one analysis. {@code status} tells whether the pipeline ran to the end;
     * anything other than OK always comes with a Silent verdict.
     */
    record AnalysisResult(
        StageOutcome.Status status,
        String reason,
        Verdict verdict,
        Report report,
        AnalysisStats stats
    ) {

        public static AnalysisResult silent(StageOutcome.Status status, String reason) {
            return new AnalysisResult(status, reason, Verdict.silent(), Report.silent(), AnalysisStats.none());
        }

        public Decision decision() {
            return verdict.decision();
        }
    }

    record AnalysisStats(
        int linesAnalyzed,
        int nodesVisited,
        int rawFindings,
        int ruleFaults,
        long durationMs
    ) {
        public static AnalysisStats none() {
            return new AnalysisStats(0, 0, 0, 0, 0);
        }
    }
}
