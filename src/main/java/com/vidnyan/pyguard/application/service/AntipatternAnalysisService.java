package com.vidnyan.pyguard.application.service;

import com.vidnyan.pyguard.application.port.in.AnalyzeSourceUseCase;
import com.vidnyan.pyguard.application.port.out.SourceLoader;
import com.vidnyan.pyguard.application.port.out.SyntaxTreeBuilder;
import com.vidnyan.pyguard.domain.model.GuardSettings;
import com.vidnyan.pyguard.domain.model.SourceFile;
import com.vidnyan.pyguard.domain.model.StageOutcome;
import com.vidnyan.pyguard.domain.policy.AggregatedFindings;
import com.vidnyan.pyguard.domain.policy.FindingAggregator;
import com.vidnyan.pyguard.domain.policy.PolicyEngine;
import com.vidnyan.pyguard.domain.policy.Verdict;
import com.vidnyan.pyguard.domain.report.Report;
import com.vidnyan.pyguard.domain.report.VerdictReporter;
import com.vidnyan.pyguard.domain.syntax.SyntaxTree;
import com.vidnyan.pyguard.domain.traversal.ContextTrackingWalker;
import com.vidnyan.pyguard.domain.traversal.ScanResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;

/**
 * Drives one analysis: load, parse, scan, aggregate, decide, render.
 * Each stage yields a {@link StageOutcome}; any SKIPPED or ERROR outcome ends
 * the run with a Silent result.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AntipatternAnalysisService implements AnalyzeSourceUseCase {

    private final SourceLoader sourceLoader;
    private final SyntaxTreeBuilder syntaxTreeBuilder;
    private final ContextTrackingWalker walker;
    private final FindingAggregator aggregator;
    private final PolicyEngine policyEngine;
    private final VerdictReporter reporter;

    @Override
    public AnalysisResult analyze(AnalysisRequest request) {
        GuardSettings settings = request.settings();
        if (!settings.enabled()) {
            log.debug("Analysis disabled by configuration");
            return AnalysisResult.silent(StageOutcome.Status.SKIPPED, "disabled");
        }

        Instant startTime = Instant.now();
        StageOutcome<AnalysisResult> outcome;
        try {
            outcome = sourceLoader.load(request.filePath(), settings)
                    .then(source -> syntaxTreeBuilder.build(source)
                            .then(tree -> scan(source, tree))
                            .map(scan -> conclude(source, scan, settings, startTime)));
        } catch (RuntimeException e) {
            outcome = StageOutcome.error("unexpected failure", e);
        }

        switch (outcome.status()) {
            case OK:
                AnalysisResult result = outcome.value();
                log.info("Analyzed {}: {} ({} findings, {}ms)", request.filePath(), result.decision(),
                        result.verdict().findings().total(), result.stats().durationMs());
                return result;
            case SKIPPED:
                log.info("Skipped {}: {}", request.filePath(), outcome.reason());
                return AnalysisResult.silent(StageOutcome.Status.SKIPPED, outcome.reason());
            default:
                log.error("Analysis of {} failed: {}", request.filePath(), outcome.reason(), outcome.cause());
                return AnalysisResult.silent(StageOutcome.Status.ERROR, outcome.reason());
        }
    }

    private StageOutcome<ScanResult> scan(SourceFile source, SyntaxTree tree) {
        try {
            return StageOutcome.ok(walker.scan(tree, source.lines()));
        } catch (RuntimeException | StackOverflowError e) {
            return StageOutcome.error("traversal failed", e);
        }
    }

    private AnalysisResult conclude(SourceFile source, ScanResult scan, GuardSettings settings, Instant startTime) {
        AggregatedFindings findings = aggregator.aggregate(scan.findings(), settings);
        Verdict verdict = policyEngine.decide(findings, settings);
        Report report = reporter.render(verdict, source.fileName(), settings.maxIssues());

        long duration = Duration.between(startTime, Instant.now()).toMillis();
        AnalysisStats stats = new AnalysisStats(source.lineCount(), scan.nodesVisited(),
                scan.findings().size(), scan.faults().size(), duration);
        return new AnalysisResult(StageOutcome.Status.OK, null, verdict, report, stats);
    }
}
