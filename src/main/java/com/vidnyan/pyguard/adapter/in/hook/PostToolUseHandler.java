package com.vidnyan.pyguard.adapter.in.hook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.pyguard.application.port.in.AnalyzeSourceUseCase;
import com.vidnyan.pyguard.application.port.in.AnalyzeSourceUseCase.AnalysisRequest;
import com.vidnyan.pyguard.application.port.in.AnalyzeSourceUseCase.AnalysisResult;
import com.vidnyan.pyguard.config.GuardProperties;
import com.vidnyan.pyguard.domain.model.GuardSettings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Set;

/**
 * Turns one post-tool-use event into a hook decision.
 * Anything that is not a successful file edit, or cannot be read, is answered with Silent.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PostToolUseHandler {

    static final Set<String> ANALYZED_TOOLS = Set.of("Write", "Edit", "MultiEdit");

    private final ObjectMapper objectMapper;
    private final AnalyzeSourceUseCase analyzeSourceUseCase;
    private final GuardProperties guardProperties;

    public HookResponse handle(String payload) {
        if (payload == null || payload.isBlank()) {
            log.debug("Empty hook payload");
            return HookResponse.silent();
        }
        HookInput input;
        try {
            input = objectMapper.readValue(payload, HookInput.class);
        } catch (JsonProcessingException e) {
            log.warn("Malformed hook payload: {}", e.getOriginalMessage());
            return HookResponse.silent();
        }
        if (input == null) {
            return HookResponse.silent();
        }
        return handle(input);
    }

    public HookResponse handle(HookInput input) {
        if (input.toolName == null || !ANALYZED_TOOLS.contains(input.toolName)) {
            log.debug("Ignoring tool {}", input.toolName);
            return HookResponse.silent();
        }
        if (input.toolFailed()) {
            log.debug("Tool {} reported failure, nothing to analyze", input.toolName);
            return HookResponse.silent();
        }
        String filePath = input.editedFilePath();
        if (filePath == null) {
            log.debug("No file path in {} event", input.toolName);
            return HookResponse.silent();
        }

        GuardSettings settings = guardProperties.toSettings(workingDirectory(input));
        AnalysisResult result = analyzeSourceUseCase.analyze(new AnalysisRequest(filePath, settings));
        return HookResponse.from(result.report());
    }

    /**
     * Serializes a response to a single JSON line.
     */
    public String render(HookResponse response) {
        try {
            return objectMapper.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize hook response", e);
            return HookResponse.SILENT_JSON;
        }
    }

    private static Path workingDirectory(HookInput input) {
        if (input.cwd != null && !input.cwd.isBlank()) {
            return Path.of(input.cwd);
        }
        return Path.of("").toAbsolutePath();
    }
}
