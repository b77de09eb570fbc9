package com.vidnyan.pyguard.domain.model;

import java.nio.file.Path;
import java.util.List;

/**
 * A loaded Python source file. Read-only.
 */
public record SourceFile(
    Path path,
    String content,
    int lineCount
) {

    public String fileName() {
        Path name = path.getFileName();
        return name != null ? name.toString() : path.toString();
    }

    /**
     * Physical lines, used to attach snippets to findings.
     */
    public List<String> lines() {
        return content.lines().toList();
    }

    /**
     * Number of physical lines, counting a trailing fragment without newline.
     */
    public static int countLines(String content) {
        if (content.isEmpty()) {
            return 0;
        }
        int lines = 0;
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (c == '\n' || (c == '\r' && (i + 1 >= content.length() || content.charAt(i + 1) != '\n'))) {
                lines++;
            }
        }
        char last = content.charAt(content.length() - 1);
        return last == '\n' || last == '\r' ? lines : lines + 1;
    }
}
