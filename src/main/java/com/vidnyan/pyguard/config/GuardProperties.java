package com.vidnyan.pyguard.config;

import com.vidnyan.pyguard.domain.model.GuardSettings;
import com.vidnyan.pyguard.domain.model.Severity;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Externalized engine settings, bound from {@code pyguard.*}.
 * {@code application.properties} maps the hook's environment variables onto these keys.
 */
@Slf4j
@Data
@ConfigurationProperties(prefix = "pyguard")
public class GuardProperties {

    private boolean enabled = true;

    /**
     * Severities to report, for example {@code CRITICAL,HIGH}.
     */
    private List<String> levels = new ArrayList<>(List.of("CRITICAL", "HIGH", "MEDIUM", "LOW"));

    private boolean blockOnCritical = true;

    /**
     * Rule ids or codes to skip, for example {@code R001,string-concat-in-loop}.
     */
    private List<String> disabled = new ArrayList<>();

    private int maxIssues = GuardSettings.DEFAULT_MAX_ISSUES;

    private int maxLines = GuardSettings.DEFAULT_MAX_LINES;

    /**
     * Root every analyzed path must stay inside. Blank means the hook's working directory.
     */
    private String projectDir;

    /**
     * Resolves the immutable settings for one invocation.
     *
     * @param fallbackRoot root used when no project directory is configured
     */
    public GuardSettings toSettings(Path fallbackRoot) {
        Set<Severity> severities = EnumSet.noneOf(Severity.class);
        for (String level : levels) {
            if (level == null || level.isBlank()) {
                continue;
            }
            Optional<Severity> severity = Severity.parse(level);
            if (severity.isPresent()) {
                severities.add(severity.get());
            } else {
                log.warn("Ignoring unknown severity level '{}'", level.trim());
            }
        }
        Path root = projectDir == null || projectDir.isBlank() ? fallbackRoot : Path.of(projectDir.trim());
        return new GuardSettings(enabled, severities, new LinkedHashSet<>(disabled), blockOnCritical,
                maxIssues, maxLines, GuardSettings.PYTHON_EXTENSIONS, root);
    }
}
