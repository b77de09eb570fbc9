package com.vidnyan.pyguard.adapter.in.hook;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.vidnyan.pyguard.domain.report.Report;

/**
 * Decision written to stdout. Silent and Warn never block; Block carries
 * {@code "decision": "block"} with the reason shown to the agent.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"decision", "reason", "hookSpecificOutput", "suppressOutput"})
public record HookResponse(
    String decision,
    String reason,
    HookSpecificOutput hookSpecificOutput,
    boolean suppressOutput
) {

    public static final String EVENT_NAME = "PostToolUse";

    /**
     * Silent response, pre-rendered for paths where serialization itself is unavailable.
     */
    public static final String SILENT_JSON =
            "{\"hookSpecificOutput\":{\"hookEventName\":\"PostToolUse\"},\"suppressOutput\":true}";

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"hookEventName", "additionalContext"})
    public record HookSpecificOutput(String hookEventName, String additionalContext) {}

    public static HookResponse silent() {
        return new HookResponse(null, null, new HookSpecificOutput(EVENT_NAME, null), true);
    }

    public static HookResponse warn(String context) {
        return new HookResponse(null, null, new HookSpecificOutput(EVENT_NAME, context), true);
    }

    public static HookResponse block(String reason) {
        return new HookResponse("block", reason, new HookSpecificOutput(EVENT_NAME, null), true);
    }

    public static HookResponse from(Report report) {
        return switch (report.decision()) {
            case SILENT -> silent();
            case WARN -> report.text().isEmpty() ? silent() : warn(report.text());
            case BLOCK -> block(report.text());
        };
    }
}
