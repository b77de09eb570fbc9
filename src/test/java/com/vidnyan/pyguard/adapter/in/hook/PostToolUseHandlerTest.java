package com.vidnyan.pyguard.adapter.in.hook;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vidnyan.pyguard.adapter.out.detector.GotchaRules;
import com.vidnyan.pyguard.adapter.out.detector.RuntimeRules;
import com.vidnyan.pyguard.adapter.out.detector.SecurityRules;
import com.vidnyan.pyguard.adapter.out.parser.PythonTreeBuilder;
import com.vidnyan.pyguard.adapter.out.source.FileSystemSourceLoader;
import com.vidnyan.pyguard.application.port.in.AnalyzeSourceUseCase;
import com.vidnyan.pyguard.application.service.AntipatternAnalysisService;
import com.vidnyan.pyguard.config.GuardProperties;
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
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PostToolUseHandlerTest {

    @TempDir
    Path projectRoot;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<AnalyzeSourceUseCase.AnalysisRequest> requests = new ArrayList<>();
    private PostToolUseHandler handler;

    @BeforeEach
    void setUp() {
        RuleRegistry registry = RuleRegistry.fromCatalogs(List.of(
                new RuntimeRules(), new SecurityRules(), new GotchaRules()));
        AntipatternAnalysisService service = new AntipatternAnalysisService(new FileSystemSourceLoader(),
                new PythonTreeBuilder(), new ContextTrackingWalker(registry), new FindingAggregator(),
                new PolicyEngine(), new VerdictReporter());
        AnalyzeSourceUseCase recording = request -> {
            requests.add(request);
            return service.analyze(request);
        };
        handler = new PostToolUseHandler(objectMapper, recording, new GuardProperties());
    }

    private String event(String toolName, String filePath) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("session_id", "abc");
        root.put("hook_event_name", "PostToolUse");
        root.put("tool_name", toolName);
        root.put("cwd", projectRoot.toString());
        root.putObject("tool_input").put("file_path", filePath).put("content", "ignored");
        root.putObject("tool_response").put("success", true).put("extra", 1);
        root.put("unknown_field", "tolerated");
        return root.toString();
    }

    private JsonNode respond(String payload) throws IOException {
        return objectMapper.readTree(handler.render(handler.handle(payload)));
    }

    private Path write(String name, String content) throws IOException {
        return Files.writeString(projectRoot.resolve(name), content);
    }

    @Test
    void handle_CleanFile_ShouldAnswerSilently() throws IOException {
        Path file = write("clean.py", "def add(a, b):\n    return a + b\n");

        JsonNode response = respond(event("Write", file.toString()));

        assertFalse(response.has("decision"));
        assertEquals("PostToolUse", response.path("hookSpecificOutput").path("hookEventName").asText());
        assertFalse(response.path("hookSpecificOutput").has("additionalContext"));
        assertTrue(response.path("suppressOutput").asBoolean());
        assertEquals(1, requests.size());
    }

    @Test
    void handle_NonCriticalFindings_ShouldAddContextWithoutBlocking() throws IOException {
        Path file = write("defaults.py", "def f(x=[]):\n    return x\n");

        JsonNode response = respond(event("Edit", file.toString()));

        assertFalse(response.has("decision"));
        String context = response.path("hookSpecificOutput").path("additionalContext").asText();
        assertTrue(context.contains("defaults.py"));
        assertTrue(context.contains("R001:HIGH"));
    }

    @Test
    void handle_CriticalFinding_ShouldBlockWithReason() throws IOException {
        Path file = write("shell.py", "import subprocess\nsubprocess.call(cmd, shell=True)\n");

        JsonNode response = respond(event("MultiEdit", file.toString()));

        assertEquals("block", response.path("decision").asText());
        assertTrue(response.path("reason").asText().contains("S002"));
    }

    @Test
    void handle_RelativePath_ShouldResolveAgainstCwd() throws IOException {
        write("rel.py", "def f(x={}):\n    return x\n");

        JsonNode response = respond(event("Write", "rel.py"));

        assertTrue(response.path("hookSpecificOutput").has("additionalContext"));
        assertEquals(projectRoot.toAbsolutePath().normalize(), requests.get(0).settings().projectRoot());
    }

    @Test
    void handle_OtherTools_ShouldNotAnalyze() throws IOException {
        Path file = write("defaults.py", "def f(x=[]):\n    return x\n");

        JsonNode response = respond(event("Read", file.toString()));

        assertFalse(response.has("decision"));
        assertTrue(requests.isEmpty());
    }

    @Test
    void handle_FailedTool_ShouldNotAnalyze() throws IOException {
        Path file = write("defaults.py", "def f(x=[]):\n    return x\n");
        ObjectNode payload = (ObjectNode) objectMapper.readTree(event("Write", file.toString()));
        payload.putObject("tool_response").put("success", false);

        handler.handle(payload.toString());

        assertTrue(requests.isEmpty());
    }

    @Test
    void handle_PathOnlyInToolResponse_ShouldStillAnalyze() throws IOException {
        Path file = write("defaults.py", "def f(x=[]):\n    return x\n");
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("tool_name", "Write");
        payload.put("cwd", projectRoot.toString());
        payload.putObject("tool_response").put("filePath", file.toString());

        HookResponse response = handler.handle(payload.toString());

        assertNotNull(response.hookSpecificOutput().additionalContext());
    }

    @Test
    void handle_MalformedOrEmptyPayload_ShouldAnswerSilently() {
        assertEquals(HookResponse.silent(), handler.handle("{not json"));
        assertEquals(HookResponse.silent(), handler.handle(""));
        assertEquals(HookResponse.silent(), handler.handle("null"));
        assertEquals(HookResponse.silent(), handler.handle("{\"tool_name\":\"Write\"}"));
        assertTrue(requests.isEmpty());
    }

    @Test
    void render_Silent_ShouldMatchPrerenderedForm() {
        assertEquals(HookResponse.SILENT_JSON, handler.render(HookResponse.silent()));
    }
}
