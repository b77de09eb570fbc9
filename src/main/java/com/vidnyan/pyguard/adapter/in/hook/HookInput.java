package com.vidnyan.pyguard.adapter.in.hook;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Post-tool-use event as delivered on stdin. Unknown fields are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class HookInput {

    @JsonProperty("session_id")
    public String sessionId;

    @JsonProperty("transcript_path")
    public String transcriptPath;

    public String cwd;

    @JsonProperty("hook_event_name")
    public String hookEventName;

    @JsonProperty("tool_name")
    public String toolName;

    @JsonProperty("tool_input")
    public ToolInput toolInput;

    @JsonProperty("tool_response")
    public ToolResponse toolResponse;

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ToolInput {

        @JsonProperty("file_path")
        public String filePath;

        public String content;
    }

    /**
     * Tool result. {@code success} is absent for tools that do not report it.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ToolResponse {

        public Boolean success;

        public String filePath;
    }

    /**
     * Edited file path: the tool input's {@code file_path}, else the response's {@code filePath}.
     */
    public String editedFilePath() {
        if (toolInput != null && toolInput.filePath != null && !toolInput.filePath.isBlank()) {
            return toolInput.filePath;
        }
        if (toolResponse != null && toolResponse.filePath != null && !toolResponse.filePath.isBlank()) {
            return toolResponse.filePath;
        }
        return null;
    }

    public boolean toolFailed() {
        return toolResponse != null && Boolean.FALSE.equals(toolResponse.success);
    }
}
