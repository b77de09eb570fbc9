package com.vidnyan.pyguard.adapter.out.source;

import com.vidnyan.pyguard.application.port.out.SourceLoader;
import com.vidnyan.pyguard.domain.model.GuardSettings;
import com.vidnyan.pyguard.domain.model.SourceFile;
import com.vidnyan.pyguard.domain.model.StageOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Reads the file under analysis from disk, inside the project root only.
 */
@Slf4j
@Component
public class FileSystemSourceLoader implements SourceLoader {

    static final long MAX_FILE_BYTES = 2L * 1024 * 1024;

    @Override
    public StageOutcome<SourceFile> load(String filePath, GuardSettings settings) {
        if (filePath == null || filePath.isBlank()) {
            return StageOutcome.skipped("no file path");
        }
        if (!hasAllowedExtension(filePath, settings)) {
            return StageOutcome.skipped("not a Python file");
        }

        Path root = settings.projectRoot();
        Path candidate;
        try {
            Path given = Path.of(filePath);
            candidate = given.isAbsolute() ? given : root.resolve(given);
        } catch (InvalidPathException e) {
            return StageOutcome.skipped("invalid path: " + e.getReason());
        }

        if (!Files.isRegularFile(candidate)) {
            return StageOutcome.skipped("file not found");
        }

        Path resolved;
        Path resolvedRoot;
        try {
            resolved = candidate.toRealPath();
            resolvedRoot = Files.exists(root) ? root.toRealPath() : root;
        } catch (IOException e) {
            return StageOutcome.skipped("cannot resolve path: " + e.getMessage());
        }
        if (!resolved.startsWith(resolvedRoot)) {
            log.warn("Refusing to read {} outside project root {}", resolved, resolvedRoot);
            return StageOutcome.skipped("outside project root");
        }

        try {
            long size = Files.size(resolved);
            if (size > MAX_FILE_BYTES) {
                return StageOutcome.skipped("file too large (" + size + " bytes)");
            }
            String content = decode(Files.readAllBytes(resolved));
            int lines = SourceFile.countLines(content);
            if (lines > settings.maxLines()) {
                return StageOutcome.skipped("too many lines (" + lines + " > " + settings.maxLines() + ")");
            }
            return StageOutcome.ok(new SourceFile(resolved, content, lines));
        } catch (CharacterCodingException e) {
            return StageOutcome.skipped("not valid UTF-8");
        } catch (IOException e) {
            return StageOutcome.skipped("unreadable: " + e.getMessage());
        }
    }

    private static boolean hasAllowedExtension(String filePath, GuardSettings settings) {
        return settings.allowedExtensions().stream().anyMatch(filePath::endsWith);
    }

    private static String decode(byte[] bytes) throws CharacterCodingException {
        String text = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
        return text.startsWith("\uFEFF") ? text.substring(1) : text;
    }
}
