package com.vidnyan.pyguard.config;

import com.vidnyan.pyguard.domain.model.GuardSettings;
import com.vidnyan.pyguard.domain.model.Severity;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class GuardPropertiesTest {

    private final Path cwd = Path.of("/work/project");

    @Test
    void toSettings_Defaults_ShouldMatchHookDefaults() {
        GuardSettings settings = new GuardProperties().toSettings(cwd);

        assertTrue(settings.enabled());
        assertEquals(EnumSet.allOf(Severity.class), settings.enabledSeverities());
        assertTrue(settings.blockOnCritical());
        assertEquals(10, settings.maxIssues());
        assertEquals(10_000, settings.maxLines());
        assertEquals(Set.of(".py", ".pyi"), settings.allowedExtensions());
        assertEquals(cwd.toAbsolutePath().normalize(), settings.projectRoot());
    }

    @Test
    void toSettings_ShouldParseLevelsAndSkipUnknownOnes() {
        GuardProperties properties = new GuardProperties();
        properties.setLevels(List.of("critical", " High ", "SEVERE", ""));

        GuardSettings settings = properties.toSettings(cwd);

        assertEquals(Set.of(Severity.CRITICAL, Severity.HIGH), settings.enabledSeverities());
    }

    @Test
    void toSettings_ShouldNormalizeDisabledRules() {
        GuardProperties properties = new GuardProperties();
        properties.setDisabled(List.of("R001", " String-Concat-In-Loop ", " "));

        GuardSettings settings = properties.toSettings(cwd);

        assertEquals(Set.of("r001", "string-concat-in-loop"), settings.disabledRules());
        assertTrue(settings.isRuleDisabled("mutable-default", "R001"));
        assertTrue(settings.isRuleDisabled("string-concat-in-loop", "P001"));
        assertFalse(settings.isRuleDisabled("bare-except", "R003"));
    }

    @Test
    void toSettings_ProjectDir_ShouldOverrideWorkingDirectory() {
        GuardProperties properties = new GuardProperties();
        properties.setProjectDir("/srv/repo");

        assertEquals(Path.of("/srv/repo"), properties.toSettings(cwd).projectRoot());

        properties.setProjectDir("  ");
        assertEquals(cwd, properties.toSettings(cwd).projectRoot());
    }
}
