package com.vidnyan.pyguard.domain.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Ordinal finding severity, most severe first.
 */
public enum Severity {
    CRITICAL,   // blocks when block-on-critical is set
    HIGH,
    MEDIUM,
    LOW;

    /**
     * Case-insensitive lookup; blank or unknown names yield empty.
     */
    public static Optional<Severity> parse(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
