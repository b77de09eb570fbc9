package com.vidnyan.pyguard.application.service;

import com.vidnyan.pyguard.adapter.out.detector.ComplexityRules;
import com.vidnyan.pyguard.adapter.out.detector.GotchaRules;
import com.vidnyan.pyguard.adapter.out.detector.OrganizationRules;
import com.vidnyan.pyguard.adapter.out.detector.PerformanceRules;
import com.vidnyan.pyguard.adapter.out.detector.ResourceRules;
import com.vidnyan.pyguard.adapter.out.detector.RuntimeRules;
import com.vidnyan.pyguard.adapter.out.detector.SecurityRules;
import com.vidnyan.pyguard.adapter.out.parser.PythonTreeBuilder;
import com.vidnyan.pyguard.adapter.out.source.FileSystemSourceLoader;
import com.vidnyan.pyguard.application.port.in.AnalyzeSourceUseCase.AnalysisRequest;
import com.vidnyan.pyguard.application.port.in.AnalyzeSourceUseCase.AnalysisResult;
import com.vidnyan.pyguard.domain.model.Category;
import com.vidnyan.pyguard.domain.model.Finding;
import com.vidnyan.pyguard.domain.model.GuardSettings;
import com.vidnyan.pyguard.domain.model.Severity;
import com.vidnyan.pyguard.domain.model.StageOutcome;
import com.vidnyan.pyguard.domain.policy.Decision;
import com.vidnyan.pyguard.domain.policy.FindingAggregator;
import com.vidnyan.pyguard.domain.policy.PolicyEngine;
import com.vidnyan.pyguard.domain.report.VerdictReporter;
import com.vidnyan.pyguard.domain.rule.RuleRegistry;
import com.vidnyan.pyguard.domain.traversal.ContextTrackingWalker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AntipatternAnalysisServiceTest {

    @TempDir
    Path projectRoot;

    private AntipatternAnalysisService service;
    private GuardSettings settings;

    @BeforeEach
    void setUp() {
        RuleRegistry registry = RuleRegistry.fromCatalogs(List.of(
                new RuntimeRules(), new PerformanceRules(), new ComplexityRules(), new SecurityRules(),
                new OrganizationRules(), new ResourceRules(), new GotchaRules()));
        service = new AntipatternAnalysisService(new FileSystemSourceLoader(), new PythonTreeBuilder(),
                new ContextTrackingWalker(registry), new FindingAggregator(), new PolicyEngine(),
                new VerdictReporter());
        settings = GuardSettings.defaults(projectRoot);
    }

    private AnalysisResult analyze(String fileName, String source, GuardSettings config) throws IOException {
        Path file = Files.writeString(projectRoot.resolve(fileName), source);
        return service.analyze(new AnalysisRequest(file.toString(), config));
    }

    private AnalysisResult analyze(String source) throws IOException {
        return analyze("module.py", source, settings);
    }

    private static List<Finding> findings(AnalysisResult result) {
        return result.verdict().findings().findings();
    }

    @Test
    void analyze_MutableDefault_ShouldWarn() throws IOException {
        AnalysisResult result = analyze("def f(x=[]): x.append(1); return x\n");

        assertEquals(StageOutcome.Status.OK, result.status());
        assertEquals(Decision.WARN, result.decision());
        assertEquals(1, findings(result).size());
        Finding finding = findings(result).get(0);
        assertEquals("mutable-default", finding.ruleId());
        assertEquals(Severity.HIGH, finding.severity());
        assertTrue(result.report().text().contains("module.py"));
    }

    @Test
    void analyze_QueryFromFString_ShouldBlock() throws IOException {
        AnalysisResult result = analyze("cursor.execute(f\"SELECT * FROM t WHERE id={user_id}\")\n");

        assertEquals(Decision.BLOCK, result.decision());
        assertEquals(1, findings(result).size());
        assertEquals("injection-heuristic", findings(result).get(0).ruleId());
        assertEquals(Severity.CRITICAL, findings(result).get(0).severity());
        assertTrue(result.report().isBlocking());
    }

    @Test
    void analyze_HandlerThatLogs_ShouldNotReportMissingLogging() throws IOException {
        AnalysisResult result = analyze("""
                import logging

                logger = logging.getLogger(__name__)


                def load():
                    try:
                        run()
                    except ValueError as e:
                        logger.error("load failed: %s", e)
                """);

        assertTrue(findings(result).stream().noneMatch(f -> f.code().equals("R011")));
    }

    @Test
    void analyze_AsyncWithoutTry_ShouldWarnOnce() throws IOException {
        AnalysisResult result = analyze("""
                async def fetch(client, url):
                    return await client.get(url)
                """);

        assertEquals(Decision.WARN, result.decision());
        assertEquals(1, findings(result).size());
        assertEquals("async-without-error-handling", findings(result).get(0).ruleId());
        assertEquals(Category.RUNTIME, findings(result).get(0).category());
    }

    @Test
    void analyze_SameInputTwice_ShouldProduceIdenticalFindings() throws IOException {
        String source = """
                import os
                import os

                def handler(items=[], password="hunter22"):
                    for item in items:
                        if item == None:
                            items.remove(item)
                    return os.system("ls " + items[0])
                """;

        AnalysisResult first = analyze(source);
        AnalysisResult second = analyze(source);

        assertFalse(findings(first).isEmpty());
        assertEquals(findings(first), findings(second));
        assertEquals(first.report(), second.report());
    }

    @Test
    void analyze_FileOverLineCeiling_ShouldBeSilent() throws IOException {
        AnalysisResult result = analyze("big.py", "def f(x=[]):\n    return x\n", settings.withMaxLines(1));

        assertEquals(StageOutcome.Status.SKIPPED, result.status());
        assertEquals(Decision.SILENT, result.decision());
        assertEquals("", result.report().text());
    }

    @Test
    void analyze_DisabledRule_ShouldBeFilteredOut() throws IOException {
        AnalysisResult result = analyze("defaults.py", "def f(x=[]):\n    return x\n",
                settings.withDisabledRules(Set.of("R001")));

        assertEquals(StageOutcome.Status.OK, result.status());
        assertEquals(Decision.SILENT, result.decision());
        assertEquals(1, result.stats().rawFindings());
    }

    @Test
    void analyze_DisabledEngine_ShouldNotReadTheFile() {
        AnalysisResult result = service.analyze(new AnalysisRequest(
                projectRoot.resolve("missing.py").toString(), settings.withEnabled(false)));

        assertEquals(StageOutcome.Status.SKIPPED, result.status());
        assertEquals("disabled", result.reason());
    }

    @Test
    void analyze_EmptyFile_ShouldBeSilent() throws IOException {
        AnalysisResult result = analyze("");

        assertEquals(StageOutcome.Status.OK, result.status());
        assertEquals(Decision.SILENT, result.decision());
    }

    @Test
    void analyze_SyntaxError_ShouldBeSilent() throws IOException {
        AnalysisResult result = analyze("def f(x=[]:\n    return x\n");

        assertEquals(StageOutcome.Status.SKIPPED, result.status());
        assertEquals(Decision.SILENT, result.decision());
        assertTrue(result.reason().startsWith("syntax error"));
    }

    @Test
    void analyze_CriticalWithBlockingOff_ShouldWarn() throws IOException {
        AnalysisResult result = analyze("run.py", "import subprocess\nsubprocess.run(cmd, shell=True)\n",
                settings.withBlockOnCritical(false));

        assertEquals(Decision.WARN, result.decision());
        assertTrue(result.report().text().contains("S002"));
    }

    @Test
    void analyze_Stats_ShouldDescribeTheRun() throws IOException {
        AnalysisResult result = analyze("x = 1\ny = 2\n");

        assertEquals(2, result.stats().linesAnalyzed());
        assertTrue(result.stats().nodesVisited() > 0);
        assertEquals(0, result.stats().ruleFaults());
    }
}
